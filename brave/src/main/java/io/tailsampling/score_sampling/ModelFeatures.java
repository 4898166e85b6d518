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
import brave.http.HttpTags;
import brave.internal.Nullable;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the spans of a trace into the features a {@link LinearModel} is weighted against.
 *
 * <p>Supported feature names:
 * <ul>
 *   <li>{@value #DURATION_MS}: milliseconds between the earliest span start and the latest span
 *   finish. This is the extent of the trace, not a sum of span durations.</li>
 *   <li>{@value #SPAN_COUNT}: the count maintained by {@link TraceData#spanCount()}</li>
 *   <li>{@value #HAS_ERROR}: 1 if any span has an error status or an {@code http.status_code} of
 *   500 or above, otherwise 0</li>
 * </ul>
 */
public final class ModelFeatures {
  public static final String DURATION_MS = "duration_ms";
  public static final String SPAN_COUNT = "span_count";
  public static final String HAS_ERROR = "has_error";

  /** Feature names a model can be weighted against. */
  public static final Set<String> SUPPORTED = Collections.unmodifiableSet(
    new LinkedHashSet<>(Arrays.asList(DURATION_MS, SPAN_COUNT, HAS_ERROR)));

  static final String ERROR_TAG = "error";
  static final String HTTP_STATUS_CODE_TAG = HttpTags.STATUS_CODE.key();

  /**
   * Returns every {@link #SUPPORTED supported feature}, each defaulting to zero.
   *
   * @param spans a snapshot of {@link TraceData#spans()}
   * @param trace source of the span count, or null when unknown
   */
  public static Map<String, Double> extract(List<MutableSpan> spans, @Nullable TraceData trace) {
    Map<String, Double> features = new LinkedHashMap<>();
    features.put(DURATION_MS, 0.0);
    features.put(SPAN_COUNT, 0.0);
    features.put(HAS_ERROR, 0.0);

    if (trace != null) features.put(SPAN_COUNT, (double) trace.spanCount());

    long earliest = 0L, latest = 0L;
    boolean hasTime = false, hasError = false;
    for (MutableSpan span : spans) {
      long start = span.startTimestamp(), finish = span.finishTimestamp();
      if (start != 0L && finish != 0L) {
        if (!hasTime) {
          earliest = start;
          latest = finish;
          hasTime = true;
        } else {
          if (start < earliest) earliest = start;
          if (finish > latest) latest = finish;
        }
      }

      if (!hasError) hasError = isError(span);
    }

    // brave timestamps are epoch microseconds
    if (hasTime && latest > earliest) features.put(DURATION_MS, (latest - earliest) / 1000.0);
    if (hasError) features.put(HAS_ERROR, 1.0);
    return features;
  }

  static boolean isError(MutableSpan span) {
    if (span.error() != null || span.tag(ERROR_TAG) != null) return true;
    String statusCode = span.tag(HTTP_STATUS_CODE_TAG);
    return statusCode != null && parseStatusCode(statusCode) >= 500;
  }

  /** Returns the integer value of the tag, or -1 when it is not an integer. */
  static int parseStatusCode(String statusCode) {
    try {
      return Integer.parseInt(statusCode.trim());
    } catch (NumberFormatException e) {
      return -1; // not an integer attribute
    }
  }

  ModelFeatures() {
  }
}
