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

/** Builds finished spans with timestamps in epoch microseconds. */
final class TestSpans {
  static final long T0 = 1_600_000_000_000_000L;

  static MutableSpan span(long startMicros, long durationMillis) {
    MutableSpan span = new MutableSpan();
    span.traceId("463ac35c9f6413ad");
    span.id("a2fb4a1d1a96d312");
    span.startTimestamp(startMicros);
    span.finishTimestamp(startMicros + durationMillis * 1000L);
    return span;
  }

  static MutableSpan errorSpan(long startMicros, long durationMillis) {
    MutableSpan span = span(startMicros, durationMillis);
    span.error(new IllegalStateException("boom"));
    return span;
  }

  static MutableSpan httpSpan(long startMicros, long durationMillis, int statusCode) {
    MutableSpan span = span(startMicros, durationMillis);
    span.tag("http.status_code", String.valueOf(statusCode));
    return span;
  }

  static TraceData trace(MutableSpan... spans) {
    TraceData result = new TraceData();
    for (MutableSpan span : spans) result.addSpan(span);
    return result;
  }

  /** One successful span lasting the given milliseconds. */
  static TraceData traceLasting(long durationMillis) {
    return trace(httpSpan(T0, durationMillis, 200));
  }

  TestSpans() {
  }
}
