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

import java.time.Duration;

/**
 * Builds the {@link PolicyEvaluator} for a model policy. Without an enabled {@link
 * ModelConfig#adaptive() adaptive} section, the result is a fixed-threshold {@link
 * LinearModelSampler}; otherwise an {@link AdaptiveLinearModelSampler}.
 *
 * <p>Configuration is expected to have been {@link TailSamplingConfig#validate() validated}.
 */
public final class ModelSamplers {
  static final Duration DEFAULT_WINDOW_DURATION = Duration.ofSeconds(30);
  static final Duration DEFAULT_RECOMPUTE_INTERVAL = Duration.ofSeconds(5);
  static final int DEFAULT_MAX_SAMPLES = 2048;

  public static PolicyEvaluator create(PolicyConfig policy) {
    if (policy == null) throw new NullPointerException("policy == null");
    if (policy.type != PolicyType.MODEL) {
      throw new IllegalArgumentException(policy.name + " is not a model policy");
    }
    if (policy.model == null) {
      throw new IllegalArgumentException(policy.name + ": model config is required");
    }
    return create(policy.model);
  }

  public static PolicyEvaluator create(ModelConfig config) {
    if (config == null) throw new NullPointerException("config == null");
    LinearModel model = new LinearModel(config.intercept, config.weights);
    if (!config.isAdaptive()) return new LinearModelSampler(model, config.threshold);

    AdaptiveConfig adaptive = config.adaptive;
    return AdaptiveLinearModelSampler.newBuilder()
      .model(model)
      .fallbackThreshold(config.threshold)
      .windowDuration(orDefault(adaptive.windowDuration, DEFAULT_WINDOW_DURATION))
      .recomputeInterval(orDefault(adaptive.recomputeInterval, DEFAULT_RECOMPUTE_INTERVAL))
      .maxSamples(adaptive.maxSamples > 0 ? adaptive.maxSamples : DEFAULT_MAX_SAMPLES)
      .targetTracesPerSec(adaptive.targetTracesPerSec)
      .keepRatio(adaptive.keepRatio)
      .minKeepRatio(adaptive.minKeepRatio)
      .maxKeepRatio(adaptive.maxKeepRatio)
      .alwaysKeepErrors(adaptive.alwaysKeepErrors)
      .slaDurationMs(adaptive.slaDurationMs)
      .violationRateThreshold(adaptive.violationRateThreshold)
      .incidentKeepRatio(adaptive.incidentKeepRatio)
      .build();
  }

  static Duration orDefault(Duration duration, Duration defaultValue) {
    return duration.isZero() ? defaultValue : duration;
  }

  ModelSamplers() {
  }
}
