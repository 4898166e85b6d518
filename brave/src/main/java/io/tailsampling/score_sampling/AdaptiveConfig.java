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
 * Settings of an {@link AdaptiveLinearModelSampler}, nested under {@link ModelConfig#adaptive()}.
 * Unset durations and sample counts take the defaults of {@link ModelSamplers}.
 */
public final class AdaptiveConfig {
  public static AdaptiveConfig create() {
    return new AdaptiveConfig();
  }

  boolean enabled;
  Duration windowDuration = Duration.ZERO, recomputeInterval = Duration.ZERO;
  int maxSamples;
  double targetTracesPerSec, keepRatio, minKeepRatio, maxKeepRatio;
  boolean alwaysKeepErrors;
  double slaDurationMs, violationRateThreshold, incidentKeepRatio;

  public boolean enabled() {
    return enabled;
  }

  public AdaptiveConfig enabled(boolean enabled) {
    this.enabled = enabled;
    return this;
  }

  public Duration windowDuration() {
    return windowDuration;
  }

  public AdaptiveConfig windowDuration(Duration windowDuration) {
    if (windowDuration == null) throw new NullPointerException("windowDuration == null");
    this.windowDuration = windowDuration;
    return this;
  }

  public Duration recomputeInterval() {
    return recomputeInterval;
  }

  public AdaptiveConfig recomputeInterval(Duration recomputeInterval) {
    if (recomputeInterval == null) throw new NullPointerException("recomputeInterval == null");
    this.recomputeInterval = recomputeInterval;
    return this;
  }

  public int maxSamples() {
    return maxSamples;
  }

  public AdaptiveConfig maxSamples(int maxSamples) {
    this.maxSamples = maxSamples;
    return this;
  }

  public double targetTracesPerSec() {
    return targetTracesPerSec;
  }

  public AdaptiveConfig targetTracesPerSec(double targetTracesPerSec) {
    this.targetTracesPerSec = targetTracesPerSec;
    return this;
  }

  public double keepRatio() {
    return keepRatio;
  }

  public AdaptiveConfig keepRatio(double keepRatio) {
    this.keepRatio = keepRatio;
    return this;
  }

  public double minKeepRatio() {
    return minKeepRatio;
  }

  public AdaptiveConfig minKeepRatio(double minKeepRatio) {
    this.minKeepRatio = minKeepRatio;
    return this;
  }

  public double maxKeepRatio() {
    return maxKeepRatio;
  }

  public AdaptiveConfig maxKeepRatio(double maxKeepRatio) {
    this.maxKeepRatio = maxKeepRatio;
    return this;
  }

  public boolean alwaysKeepErrors() {
    return alwaysKeepErrors;
  }

  public AdaptiveConfig alwaysKeepErrors(boolean alwaysKeepErrors) {
    this.alwaysKeepErrors = alwaysKeepErrors;
    return this;
  }

  public double slaDurationMs() {
    return slaDurationMs;
  }

  public AdaptiveConfig slaDurationMs(double slaDurationMs) {
    this.slaDurationMs = slaDurationMs;
    return this;
  }

  public double violationRateThreshold() {
    return violationRateThreshold;
  }

  public AdaptiveConfig violationRateThreshold(double violationRateThreshold) {
    this.violationRateThreshold = violationRateThreshold;
    return this;
  }

  public double incidentKeepRatio() {
    return incidentKeepRatio;
  }

  public AdaptiveConfig incidentKeepRatio(double incidentKeepRatio) {
    this.incidentKeepRatio = incidentKeepRatio;
    return this;
  }

  @Override public String toString() {
    return "AdaptiveConfig(enabled=" + enabled
      + ", windowDuration=" + windowDuration
      + ", recomputeInterval=" + recomputeInterval
      + ", maxSamples=" + maxSamples
      + ", targetTracesPerSec=" + targetTracesPerSec
      + ", keepRatio=" + keepRatio
      + ", minKeepRatio=" + minKeepRatio
      + ", maxKeepRatio=" + maxKeepRatio
      + ", alwaysKeepErrors=" + alwaysKeepErrors
      + ", slaDurationMs=" + slaDurationMs
      + ", violationRateThreshold=" + violationRateThreshold
      + ", incidentKeepRatio=" + incidentKeepRatio
      + ")";
  }
}
