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
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import org.junit.Test;

import static io.tailsampling.score_sampling.ModelFeatures.DURATION_MS;
import static io.tailsampling.score_sampling.ModelFeatures.HAS_ERROR;
import static io.tailsampling.score_sampling.ModelFeatures.SPAN_COUNT;
import static io.tailsampling.score_sampling.TestSpans.T0;
import static io.tailsampling.score_sampling.TestSpans.errorSpan;
import static io.tailsampling.score_sampling.TestSpans.httpSpan;
import static io.tailsampling.score_sampling.TestSpans.span;
import static io.tailsampling.score_sampling.TestSpans.trace;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

public class ModelFeaturesTest {
  @Test public void defaultsWhenEmpty() {
    Map<String, Double> features = ModelFeatures.extract(Collections.emptyList(), null);

    assertThat(features).containsOnly(
      entry(DURATION_MS, 0.0),
      entry(SPAN_COUNT, 0.0),
      entry(HAS_ERROR, 0.0)
    );
  }

  /** The extent of the trace is used, not a sum of per-span durations */
  @Test public void durationMs_earliestStartToLatestFinish() {
    TraceData trace = trace(
      span(T0, 100),
      span(T0 + 200_000L, 300) // finishes at T0 + 500ms
    );

    assertThat(ModelFeatures.extract(trace.spans(), trace))
      .containsEntry(DURATION_MS, 500.0);
  }

  @Test public void durationMs_childInsideParent() {
    TraceData trace = trace(
      span(T0, 250),
      span(T0 + 10_000L, 20)
    );

    assertThat(ModelFeatures.extract(trace.spans(), trace))
      .containsEntry(DURATION_MS, 250.0);
  }

  @Test public void durationMs_fractionalMillis() {
    MutableSpan span = new MutableSpan();
    span.startTimestamp(T0);
    span.finishTimestamp(T0 + 1500L);

    assertThat(ModelFeatures.extract(Collections.singletonList(span), null))
      .containsEntry(DURATION_MS, 1.5);
  }

  @Test public void durationMs_ignoresSpansWithoutBothTimestamps() {
    MutableSpan noFinish = new MutableSpan();
    noFinish.startTimestamp(T0 - 5_000_000L);
    MutableSpan noStart = new MutableSpan();
    noStart.finishTimestamp(T0 + 5_000_000L);

    assertThat(ModelFeatures.extract(Arrays.asList(noFinish, span(T0, 40), noStart), null))
      .containsEntry(DURATION_MS, 40.0);
  }

  @Test public void durationMs_zeroWhenNoSpanHasTimestamps() {
    assertThat(ModelFeatures.extract(Collections.singletonList(new MutableSpan()), null))
      .containsEntry(DURATION_MS, 0.0);
  }

  @Test public void spanCount_readsMaintainedCount() {
    TraceData trace = trace(span(T0, 1), span(T0, 1), span(T0, 1));

    // the count is read from trace data, not the passed spans
    assertThat(ModelFeatures.extract(Collections.<MutableSpan>emptyList(), trace))
      .containsEntry(SPAN_COUNT, 3.0);
  }

  @Test public void hasError_errorStatus() {
    TraceData trace = trace(span(T0, 10), errorSpan(T0, 5));

    assertThat(ModelFeatures.extract(trace.spans(), trace))
      .containsEntry(HAS_ERROR, 1.0);
  }

  @Test public void hasError_errorTag() {
    MutableSpan span = span(T0, 10);
    span.tag("error", "timeout");

    assertThat(ModelFeatures.extract(Collections.singletonList(span), null))
      .containsEntry(HAS_ERROR, 1.0);
  }

  @Test public void hasError_httpServerErrorEvenWhenStatusOk() {
    assertThat(ModelFeatures.extract(Collections.singletonList(httpSpan(T0, 10, 503)), null))
      .containsEntry(HAS_ERROR, 1.0);
  }

  @Test public void hasError_httpClientErrorIsNotAnError() {
    assertThat(ModelFeatures.extract(Collections.singletonList(httpSpan(T0, 10, 404)), null))
      .containsEntry(HAS_ERROR, 0.0);
  }

  @Test public void hasError_ignoresNonIntegerStatusCode() {
    MutableSpan span = span(T0, 10);
    span.tag("http.status_code", "5xx");

    assertThat(ModelFeatures.extract(Collections.singletonList(span), null))
      .containsEntry(HAS_ERROR, 0.0);
  }

  @Test public void parseStatusCode() {
    assertThat(ModelFeatures.parseStatusCode("500")).isEqualTo(500);
    assertThat(ModelFeatures.parseStatusCode(" 502 ")).isEqualTo(502);
    assertThat(ModelFeatures.parseStatusCode("")).isEqualTo(-1);
    assertThat(ModelFeatures.parseStatusCode("500.0")).isEqualTo(-1);
  }
}
