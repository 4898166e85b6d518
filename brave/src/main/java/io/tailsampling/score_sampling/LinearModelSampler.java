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

import brave.handler.MutableSpan;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Samples a trace when its {@link LinearModel model score} is at or above a fixed threshold.
 *
 * <p>A score that is NaN or infinite is never sampled. This happens when a weight or intercept is
 * itself not finite, and is logged at debug level instead of failing the pipeline.
 */
public final class LinearModelSampler implements PolicyEvaluator {
  static final Logger LOG = LoggerFactory.getLogger(LinearModelSampler.class);

  final LinearModel model;
  final double threshold;

  public LinearModelSampler(LinearModel model, double threshold) {
    if (model == null) throw new NullPointerException("model == null");
    this.model = model;
    this.threshold = threshold;
  }

  public double threshold() {
    return threshold;
  }

  @Override public Decision evaluate(String traceId, TraceData trace) {
    List<MutableSpan> spans = trace.spans(); // releases the trace lock before scoring
    Map<String, Double> features = ModelFeatures.extract(spans, trace);
    double score = model.score(features);

    if (!LinearModel.isValid(score)) {
      LOG.debug("model score invalid; not sampling traceId={} score={}", traceId, score);
      return Decision.NOT_SAMPLED;
    }
    return score >= threshold ? Decision.SAMPLED : Decision.NOT_SAMPLED;
  }

  @Override public String toString() {
    return "LinearModelSampler(threshold=" + threshold + ", model=" + model + ")";
  }
}
