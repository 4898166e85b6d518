/*
 * Copyright 2019-2020 The OpenZipkin Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package io.tailsampling.score_sampling;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scores a trace as {@code intercept + sum(weight * feature)}. Features without a weight don't
 * contribute, and weights without a matching feature multiply zero.
 */
public final class LinearModel {
  final double intercept;
  final Map<String, Double> weights;

  public LinearModel(double intercept, Map<String, Double> weights) {
    if (weights == null) throw new NullPointerException("weights == null");
    this.intercept = intercept;
    this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
  }

  public double intercept() {
    return intercept;
  }

  public Map<String, Double> weights() {
    return weights;
  }

  public double score(Map<String, Double> features) {
    double score = intercept;
    for (Map.Entry<String, Double> weight : weights.entrySet()) {
      Double feature = features.get(weight.getKey());
      score += weight.getValue() * (feature != null ? feature : 0.0);
    }
    return score;
  }

  /** Returns false when the score is NaN or infinite, and so can't be compared to a threshold. */
  public static boolean isValid(double score) {
    return !Double.isNaN(score) && !Double.isInfinite(score);
  }

  @Override public String toString() {
    return "LinearModel(intercept=" + intercept + ", weights=" + weights + ")";
  }
}
