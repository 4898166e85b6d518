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

/**
 * Decides if a completed trace is retained. This is invoked once per trace, after its spans were
 * buffered into {@link TraceData}.
 *
 * <p>Implementations must be safe to call from multiple threads at the same time, against
 * different traces. The same instance lives as long as the pipeline it was configured into.
 *
 * <p>Here's an example that keeps any trace with more than 100 spans:
 * <pre>{@code
 * PolicyEvaluator bigTraces = (traceId, trace) ->
 *   trace.spanCount() > 100 ? Decision.SAMPLED : Decision.NOT_SAMPLED;
 * }</pre>
 */
public interface PolicyEvaluator {
  /**
   * @param traceId lower-hex trace ID of the trace being decided
   * @param trace the spans received for that trace
   * @return {@link Decision#SAMPLED} to retain the trace
   */
  Decision evaluate(String traceId, TraceData trace);
}
