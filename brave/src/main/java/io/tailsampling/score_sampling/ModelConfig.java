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

import brave.internal.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration of a {@link PolicyType#MODEL model policy}.
 *
 * <p><pre>{@code
 * model = ModelConfig.create()
 *   .threshold(2.0)
 *   .weight("duration_ms", 0.01)
 *   .weight("has_error", 2.0);
 * }</pre>
 */
// naming convention is like MutableSpan. Unlike a builder, this allows readback.
public final class ModelConfig {
  public static final String LINEAR = "linear";

  public static ModelConfig create() {
    return new ModelConfig();
  }

  String type = "";
  double threshold, intercept;
  final Map<String, Double> weights = new LinkedHashMap<>();
  @Nullable AdaptiveConfig adaptive;

  /** Empty means {@link #LINEAR}, currently the only model type. */
  public String type() {
    return type;
  }

  public ModelConfig type(String type) {
    if (type == null) throw new NullPointerException("type == null");
    this.type = type;
    return this;
  }

  public double threshold() {
    return threshold;
  }

  public ModelConfig threshold(double threshold) {
    this.threshold = threshold;
    return this;
  }

  public double intercept() {
    return intercept;
  }

  public ModelConfig intercept(double intercept) {
    this.intercept = intercept;
    return this;
  }

  /** Weights keyed by {@link ModelFeatures#SUPPORTED feature name}. */
  public Map<String, Double> weights() {
    return Collections.unmodifiableMap(weights);
  }

  public ModelConfig weight(String feature, double weight) {
    if (feature == null) throw new NullPointerException("feature == null");
    weights.put(feature, weight);
    return this;
  }

  public ModelConfig weights(Map<String, Double> weights) {
    if (weights == null) throw new NullPointerException("weights == null");
    this.weights.clear();
    for (Map.Entry<String, Double> entry : weights.entrySet()) {
      weight(entry.getKey(), entry.getValue());
    }
    return this;
  }

  @Nullable public AdaptiveConfig adaptive() {
    return adaptive;
  }

  public ModelConfig adaptive(@Nullable AdaptiveConfig adaptive) {
    this.adaptive = adaptive;
    return this;
  }

  boolean isAdaptive() {
    return adaptive != null && adaptive.enabled;
  }

  @Override public String toString() {
    return "ModelConfig(type=" + type + ", threshold=" + threshold + ", intercept=" + intercept
      + ", weights=" + weights + ", adaptive=" + adaptive + ")";
  }
}
