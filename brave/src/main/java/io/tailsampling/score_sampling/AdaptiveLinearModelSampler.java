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

import brave.Clock;
import brave.handler.MutableSpan;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link LinearModelSampler} whose threshold follows traffic. Recent scores are kept in a ring of
 * {@link Builder#maxSamples(int) max samples}, and the threshold is periodically recomputed as the
 * score quantile that retains the desired fraction of traces.
 *
 * <p>The fraction kept is derived either from a trace budget ({@link
 * Builder#targetTracesPerSec(double)} divided by the observed incoming rate) or a fixed {@link
 * Builder#keepRatio(double)}. When neither is set, everything is kept.
 *
 * <p><h3>Incidents</h3>
 * A trace is a violation when it has an error, or lasts at least {@link
 * Builder#slaDurationMs(double)}. When the share of violations in the current window reaches {@link
 * Builder#violationRateThreshold(double)}, the keep ratio is raised to {@link
 * Builder#incidentKeepRatio(double)}, so degraded periods are recorded in more detail.
 *
 * <p>This is best-effort: ties and drift in the score distribution mean the exact keep rate is not
 * guaranteed.
 *
 * <p>Each instance owns its state for its whole lifetime. Statistics reset only when the window
 * rotates, and the score ring is never reset.
 */
public final class AdaptiveLinearModelSampler implements PolicyEvaluator {
  static final Logger LOG = LoggerFactory.getLogger(AdaptiveLinearModelSampler.class);
  static final long MIN_ELAPSED_MICROS = 1000L;

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    LinearModel model;
    double fallbackThreshold;
    Duration windowDuration = Duration.ZERO, recomputeInterval = Duration.ZERO;
    int maxSamples;
    double targetTracesPerSec, keepRatio, minKeepRatio, maxKeepRatio;
    boolean alwaysKeepErrors;
    double slaDurationMs, violationRateThreshold, incidentKeepRatio;
    Clock clock = () -> TimeUnit.MILLISECONDS.toMicros(System.currentTimeMillis());

    /** Required: scores each trace. */
    public Builder model(LinearModel model) {
      if (model == null) throw new NullPointerException("model == null");
      this.model = model;
      return this;
    }

    /**
     * Threshold in effect until the first recompute, and whenever no scores have been recorded.
     */
    public Builder fallbackThreshold(double fallbackThreshold) {
      this.fallbackThreshold = fallbackThreshold;
      return this;
    }

    /** Span of the window used to estimate the incoming rate. Zero never rotates the window. */
    public Builder windowDuration(Duration windowDuration) {
      if (windowDuration == null) throw new NullPointerException("windowDuration == null");
      this.windowDuration = windowDuration;
      return this;
    }

    /** Minimum time between threshold recomputes. Zero recomputes on every trace. */
    public Builder recomputeInterval(Duration recomputeInterval) {
      if (recomputeInterval == null) throw new NullPointerException("recomputeInterval == null");
      this.recomputeInterval = recomputeInterval;
      return this;
    }

    /** Count of recent scores the threshold quantile is computed over. */
    public Builder maxSamples(int maxSamples) {
      this.maxSamples = maxSamples;
      return this;
    }

    /** Traces per second to retain. Takes precedence over {@link #keepRatio(double)}. */
    public Builder targetTracesPerSec(double targetTracesPerSec) {
      this.targetTracesPerSec = targetTracesPerSec;
      return this;
    }

    /** Fraction of traces to retain when there's no {@link #targetTracesPerSec(double)}. */
    public Builder keepRatio(double keepRatio) {
      this.keepRatio = keepRatio;
      return this;
    }

    /** Lower bound of the effective keep ratio. Zero means unbounded. */
    public Builder minKeepRatio(double minKeepRatio) {
      this.minKeepRatio = minKeepRatio;
      return this;
    }

    /** Upper bound of the effective keep ratio. Zero means 1.0. */
    public Builder maxKeepRatio(double maxKeepRatio) {
      this.maxKeepRatio = maxKeepRatio;
      return this;
    }

    /** When true, traces with errors are sampled regardless of their score. */
    public Builder alwaysKeepErrors(boolean alwaysKeepErrors) {
      this.alwaysKeepErrors = alwaysKeepErrors;
      return this;
    }

    /** Traces lasting at least this long count as violations. Zero disables the SLA check. */
    public Builder slaDurationMs(double slaDurationMs) {
      this.slaDurationMs = slaDurationMs;
      return this;
    }

    /**
     * Share of violating traces in the window that declares an incident. Zero or less declares an
     * incident on any violation.
     */
    public Builder violationRateThreshold(double violationRateThreshold) {
      this.violationRateThreshold = violationRateThreshold;
      return this;
    }

    /** Keep ratio to use during an incident, if higher than usual. Zero disables the boost. */
    public Builder incidentKeepRatio(double incidentKeepRatio) {
      this.incidentKeepRatio = incidentKeepRatio;
      return this;
    }

    /** Optional: time source in epoch microseconds. Defaults to the system clock. */
    public Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    public AdaptiveLinearModelSampler build() {
      if (model == null) throw new NullPointerException("model == null");
      return new AdaptiveLinearModelSampler(this);
    }

    Builder() {
    }
  }

  final LinearModel model;
  final double fallbackThreshold;
  final long windowDurationMicros, recomputeIntervalMicros;
  final double targetTracesPerSec, keepRatio, minKeepRatio, maxKeepRatio;
  final boolean alwaysKeepErrors;
  final double slaDurationMs, violationRateThreshold, incidentKeepRatio;
  final Clock clock;

  // guarded by lock
  final Object lock = new Object();
  final RecentScores scores;
  boolean windowStarted, recomputed, firstRecomputeLogged;
  long windowStart, lastRecompute;
  long windowTraceCount, windowViolationCount;
  double currentThreshold, currentKeepRatio = 1.0;

  AdaptiveLinearModelSampler(Builder builder) {
    model = builder.model;
    fallbackThreshold = builder.fallbackThreshold;
    windowDurationMicros = TimeUnit.NANOSECONDS.toMicros(builder.windowDuration.toNanos());
    recomputeIntervalMicros = TimeUnit.NANOSECONDS.toMicros(builder.recomputeInterval.toNanos());
    targetTracesPerSec = builder.targetTracesPerSec;
    keepRatio = builder.keepRatio;
    minKeepRatio = builder.minKeepRatio;
    maxKeepRatio = builder.maxKeepRatio == 0 ? 1.0 : builder.maxKeepRatio;
    alwaysKeepErrors = builder.alwaysKeepErrors;
    slaDurationMs = builder.slaDurationMs;
    violationRateThreshold = builder.violationRateThreshold;
    incidentKeepRatio = builder.incidentKeepRatio;
    clock = builder.clock;
    scores = new RecentScores(builder.maxSamples);
    currentThreshold = fallbackThreshold;

    LOG.info("adaptive model sampler initialized: fallback_threshold={} window_duration={} "
        + "recompute_interval={} max_samples={} target_traces_per_sec={} keep_ratio={} "
        + "min_keep_ratio={} max_keep_ratio={} always_keep_errors={}",
      fallbackThreshold, builder.windowDuration, builder.recomputeInterval, builder.maxSamples,
      targetTracesPerSec, keepRatio, minKeepRatio, maxKeepRatio, alwaysKeepErrors);
  }

  @Override public Decision evaluate(String traceId, TraceData trace) {
    List<MutableSpan> spans = trace.spans(); // releases the trace lock before taking ours
    Map<String, Double> features = ModelFeatures.extract(spans, trace);
    double score = model.score(features);

    if (!LinearModel.isValid(score)) {
      LOG.debug("model score invalid; not sampling traceId={} score={}", traceId, score);
      return Decision.NOT_SAMPLED;
    }

    boolean hasError = features.get(ModelFeatures.HAS_ERROR) >= 1;
    double durationMs = features.get(ModelFeatures.DURATION_MS);
    long now = clock.currentTimeMicroseconds();

    double threshold;
    synchronized (lock) {
      // The arriving trace counts toward the window it rotates into.
      if (!windowStarted) {
        windowStart = now;
        windowStarted = true;
      } else if (windowDurationMicros > 0 && now - windowStart >= windowDurationMicros) {
        windowStart = now;
        windowTraceCount = 0;
        windowViolationCount = 0;
      }

      windowTraceCount++;
      if (hasError || (slaDurationMs > 0 && durationMs >= slaDurationMs)) {
        windowViolationCount++;
      }
      scores.add(score);

      if (!recomputed || now - lastRecompute >= recomputeIntervalMicros) {
        recompute(now);
      }
      threshold = currentThreshold;
    }

    if (alwaysKeepErrors && hasError) return Decision.SAMPLED;
    return score >= threshold ? Decision.SAMPLED : Decision.NOT_SAMPLED;
  }

  /** Called under the lock. */
  void recompute(long now) {
    long elapsedMicros = Math.max(now - windowStart, MIN_ELAPSED_MICROS);
    double incomingRate = windowTraceCount / (elapsedMicros / 1_000_000.0);
    double baseKeepRatio = targetKeepRatio(incomingRate);

    double keepRatio = baseKeepRatio;
    boolean incidentBoosted = false;
    if (incidentKeepRatio > 0 && isIncident() && incidentKeepRatio > keepRatio) {
      keepRatio = incidentKeepRatio;
      incidentBoosted = true;
    }

    keepRatio = clamp01(keepRatio);
    if (minKeepRatio > 0) keepRatio = Math.max(keepRatio, minKeepRatio);
    if (maxKeepRatio > 0) keepRatio = Math.min(keepRatio, maxKeepRatio);

    double threshold = fallbackThreshold;
    if (keepRatio >= 1) {
      threshold = Double.NEGATIVE_INFINITY;
    } else if (keepRatio <= 0) {
      threshold = Double.POSITIVE_INFINITY;
    } else if (scores.size() > 0) {
      threshold = scores.quantile(1.0 - keepRatio);
    }

    currentThreshold = threshold;
    currentKeepRatio = keepRatio;
    lastRecompute = now;
    recomputed = true;

    if (!firstRecomputeLogged) {
      firstRecomputeLogged = true;
      LOG.info("adaptive model sampler first recompute: incoming_rate={} window_trace_count={} "
          + "window_violation_count={} base_keep_ratio={} keep_ratio={} incident_boosted={} "
          + "threshold={} scores_len={} window_elapsed_us={}",
        incomingRate, windowTraceCount, windowViolationCount, baseKeepRatio, keepRatio,
        incidentBoosted, threshold, scores.size(), elapsedMicros);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("adaptive model sampler recompute: incoming_rate={} window_trace_count={} "
          + "window_violation_count={} base_keep_ratio={} keep_ratio={} incident_boosted={} "
          + "threshold={} scores_len={} window_elapsed_us={}",
        incomingRate, windowTraceCount, windowViolationCount, baseKeepRatio, keepRatio,
        incidentBoosted, threshold, scores.size(), elapsedMicros);
    }
  }

  double targetKeepRatio(double incomingRate) {
    if (targetTracesPerSec > 0) {
      if (incomingRate <= 0) return 1.0;
      return targetTracesPerSec / incomingRate;
    }
    if (keepRatio > 0) return keepRatio;
    return 1.0; // no target: keep everything
  }

  boolean isIncident() {
    if (violationRateThreshold <= 0) return windowViolationCount > 0;
    double violationRate =
      windowTraceCount > 0 ? (double) windowViolationCount / windowTraceCount : 0.0;
    return violationRate >= violationRateThreshold;
  }

  static double clamp01(double value) {
    if (value < 0) return 0;
    if (value > 1) return 1;
    return value;
  }

  /** The threshold applied to the last evaluated trace. */
  public double currentThreshold() {
    synchronized (lock) {
      return currentThreshold;
    }
  }

  /** The keep ratio as of the last recompute. Starts at 1.0. */
  public double currentKeepRatio() {
    synchronized (lock) {
      return currentKeepRatio;
    }
  }

  /** Traces counted in the current rate window. */
  public long windowTraceCount() {
    synchronized (lock) {
      return windowTraceCount;
    }
  }

  @Override public String toString() {
    return "AdaptiveLinearModelSampler(model=" + model + ")";
  }
}
