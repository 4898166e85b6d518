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
import brave.Tracing;
import brave.TracingCustomizer;
import brave.handler.MutableSpan;
import brave.handler.SpanHandler;
import brave.propagation.TraceContext;
import brave.sampler.Sampler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds finished spans until their local trace completes, then forwards them to the {@link
 * Builder#spanHandler(SpanHandler) delegate} only if the {@link Builder#evaluator(PolicyEvaluator)
 * evaluator} samples them.
 *
 * <p>Spans are grouped by trace ID and {@linkplain TraceContext#localRootId() local root}, so a
 * server span joined to an upstream trace is handled like a root span. The local trace is decided
 * when its local root finishes, or when the {@linkplain Builder#decisionWait(Duration) decision
 * wait} elapses first. Spans that finish after the decision follow it for as long as the
 * decision is remembered, which is also the decision wait.
 *
 * <p>Because the decision is made after the fact, all spans must be recorded: {@link
 * #customize(Tracing.Builder)} forces {@link Sampler#ALWAYS_SAMPLE} in addition to adding this
 * handler.
 *
 * <p><pre>{@code
 * TailSamplingSpanHandler tailSampling = TailSamplingSpanHandler.newBuilder()
 *   .evaluator(ModelSamplers.create(config.policy("slow-or-broken")))
 *   .spanHandler(zipkinSpanHandler)
 *   .build();
 *
 * Tracing.Builder builder = Tracing.newBuilder().localServiceName("api");
 * tailSampling.customize(builder);
 * }</pre>
 */
public final class TailSamplingSpanHandler extends SpanHandler implements TracingCustomizer {
  static final Logger LOG = LoggerFactory.getLogger(TailSamplingSpanHandler.class);
  static final long MAX_SWEEP_INTERVAL_MICROS = TimeUnit.SECONDS.toMicros(1);

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    PolicyEvaluator evaluator;
    SpanHandler spanHandler;
    Duration decisionWait = Duration.ofSeconds(30);
    Clock clock = () -> TimeUnit.MILLISECONDS.toMicros(System.currentTimeMillis());

    /** Required: decides if a completed trace is forwarded. */
    public Builder evaluator(PolicyEvaluator evaluator) {
      if (evaluator == null) throw new NullPointerException("evaluator == null");
      this.evaluator = evaluator;
      return this;
    }

    /** Required: receives every span of sampled traces. */
    public Builder spanHandler(SpanHandler spanHandler) {
      if (spanHandler == null) throw new NullPointerException("spanHandler == null");
      this.spanHandler = spanHandler;
      return this;
    }

    /**
     * How long a local trace may wait for its local root before it is decided with the spans
     * received so far. Decisions are remembered for the same duration. Defaults to 30 seconds.
     */
    public Builder decisionWait(Duration decisionWait) {
      if (decisionWait == null) throw new NullPointerException("decisionWait == null");
      if (decisionWait.isNegative() || decisionWait.isZero()) {
        throw new IllegalArgumentException("decisionWait must be positive");
      }
      this.decisionWait = decisionWait;
      return this;
    }

    /** Source of epoch microseconds used to expire waiting traces and remembered decisions. */
    public Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    public TailSamplingSpanHandler build() {
      if (evaluator == null) throw new NullPointerException("evaluator == null");
      if (spanHandler == null) throw new NullPointerException("spanHandler == null");
      return new TailSamplingSpanHandler(this);
    }

    Builder() {
    }
  }

  static final class PendingTrace {
    final long createdMicros;
    final TraceData data = new TraceData();
    final List<TraceContext> contexts = new ArrayList<>();
    final List<MutableSpan> spans = new ArrayList<>();
    final List<Cause> causes = new ArrayList<>();
    boolean decided;

    PendingTrace(long createdMicros) {
      this.createdMicros = createdMicros;
    }

    /** Returns false if the trace was already decided. */
    synchronized boolean add(TraceContext context, MutableSpan span, Cause cause) {
      if (decided) return false;
      contexts.add(context);
      spans.add(span);
      causes.add(cause);
      data.addSpan(span);
      return true;
    }

    void forwardTo(SpanHandler spanHandler) {
      for (int i = 0; i < spans.size(); i++) {
        spanHandler.end(contexts.get(i), spans.get(i), causes.get(i));
      }
    }
  }

  static final class DecidedTrace {
    final Decision decision;
    final long decidedMicros;

    DecidedTrace(Decision decision, long decidedMicros) {
      this.decision = decision;
      this.decidedMicros = decidedMicros;
    }
  }

  final PolicyEvaluator evaluator;
  final SpanHandler spanHandler;
  final Clock clock;
  final long decisionWaitMicros, sweepIntervalMicros;
  final ConcurrentMap<String, PendingTrace> pendingTraces = new ConcurrentHashMap<>();
  final ConcurrentMap<String, DecidedTrace> decidedTraces = new ConcurrentHashMap<>();
  volatile long lastSweepMicros;

  TailSamplingSpanHandler(Builder builder) {
    this.evaluator = builder.evaluator;
    this.spanHandler = builder.spanHandler;
    this.clock = builder.clock;
    long decisionWaitMicros = TimeUnit.NANOSECONDS.toMicros(builder.decisionWait.toNanos());
    this.decisionWaitMicros = Math.max(1L, decisionWaitMicros);
    this.sweepIntervalMicros = Math.min(decisionWaitMicros, MAX_SWEEP_INTERVAL_MICROS);
    this.lastSweepMicros = clock.currentTimeMicroseconds();
  }

  @Override public void customize(Tracing.Builder builder) {
    builder.sampler(Sampler.ALWAYS_SAMPLE).addSpanHandler(this);
  }

  @Override public boolean end(TraceContext context, MutableSpan span, Cause cause) {
    if (cause == Cause.ABANDONED) return true;

    long now = clock.currentTimeMicroseconds();
    String key = context.traceIdString() + "/" + context.localRootIdString();
    while (true) {
      DecidedTrace decided = decidedTraces.get(key);
      if (decided != null) { // arrived after its local root
        if (decided.decision == Decision.SAMPLED) spanHandler.end(context, span, cause);
        break;
      }

      PendingTrace pending = pendingTraces.get(key);
      if (pending == null) {
        PendingTrace created = new PendingTrace(now);
        pending = pendingTraces.putIfAbsent(key, created);
        if (pending == null) pending = created;
      }
      if (pending.add(context, span, cause)) {
        if (context.isLocalRoot()) decide(key, pending, now);
        break;
      }
      // decided concurrently: the decision is now recorded, so look it up again
    }

    if (now - lastSweepMicros >= sweepIntervalMicros) expire(now);
    return false; // only sampled traces reach the delegate
  }

  /**
   * Decides local traces that waited longer than the decision wait and forgets decisions older
   * than it. This runs periodically as spans finish.
   */
  public void expire() {
    expire(clock.currentTimeMicroseconds());
  }

  void expire(long now) {
    lastSweepMicros = now;
    for (Map.Entry<String, PendingTrace> entry : pendingTraces.entrySet()) {
      PendingTrace pending = entry.getValue();
      if (now - pending.createdMicros < decisionWaitMicros) continue;
      LOG.debug("key={} decision wait elapsed before its local root finished", entry.getKey());
      decide(entry.getKey(), pending, now);
    }
    for (Iterator<DecidedTrace> i = decidedTraces.values().iterator(); i.hasNext(); ) {
      if (now - i.next().decidedMicros >= decisionWaitMicros) i.remove();
    }
  }

  void decide(String key, PendingTrace pending, long now) {
    Decision decision;
    synchronized (pending) {
      if (pending.decided) return;
      String traceId = key.substring(0, key.indexOf('/'));
      decision = evaluator.evaluate(traceId, pending.data);
      decidedTraces.put(key, new DecidedTrace(decision, now));
      pending.decided = true;
      pendingTraces.remove(key, pending);
    }
    LOG.debug("key={} spans={} decision={}", key, pending.data.spanCount(), decision);
    // no span can be added once decided
    if (decision == Decision.SAMPLED) pending.forwardTo(spanHandler);
  }

  /** Count of local traces waiting for their local root span to finish. */
  public int pendingTraceCount() {
    return pendingTraces.size();
  }

  /** Count of decisions remembered for spans that finish after their local root. */
  public int decidedTraceCount() {
    return decidedTraces.size();
  }

  @Override public String toString() {
    return "TailSamplingSpanHandler(evaluator=" + evaluator + ", spanHandler=" + spanHandler + ")";
  }
}
