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
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Spans received so far for one trace ID, plus a span count maintained as spans are added.
 *
 * <p>Writers and readers share the lock of this object only to append or copy the span list.
 * {@link PolicyEvaluator evaluators} take a {@link #spans() snapshot} and release the lock before
 * scoring, so this lock is never held alongside an evaluator's own lock.
 */
public final class TraceData {
  final List<MutableSpan> receivedSpans = new ArrayList<>();
  final AtomicLong spanCount = new AtomicLong();

  public TraceData addSpan(MutableSpan span) {
    if (span == null) throw new NullPointerException("span == null");
    synchronized (this) {
      receivedSpans.add(span);
    }
    spanCount.incrementAndGet();
    return this;
  }

  public TraceData addSpans(Collection<MutableSpan> spans) {
    if (spans == null) throw new NullPointerException("spans == null");
    for (MutableSpan span : spans) {
      if (span == null) throw new NullPointerException("spans contains null");
    }
    synchronized (this) {
      receivedSpans.addAll(spans);
    }
    spanCount.addAndGet(spans.size());
    return this;
  }

  /** Returns a copy of the spans received so far. */
  public List<MutableSpan> spans() {
    synchronized (this) {
      return new ArrayList<>(receivedSpans);
    }
  }

  /** Number of spans added, read without walking them. */
  public long spanCount() {
    return spanCount.get();
  }

  @Override public String toString() {
    return "TraceData(spanCount=" + spanCount.get() + ")";
  }
}
