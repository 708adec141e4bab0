/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package com.gatekit.core.tracing;

import java.util.Map;
import java.util.function.Supplier;

import com.gatekit.core.GatekitException;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * ChainTracer wraps Gatekit operations in OpenTelemetry spans. Spans go to
 * whatever SDK the application registers with {@link GlobalOpenTelemetry};
 * without one they are no-ops.
 */
public final class ChainTracer {

  private static final String INSTRUMENTATION_NAME = "gatekit-java";

  /** Name of the span recorded around each chain build. */
  public static final String CHAIN_BUILD_SPAN = "gatekit.chain.build";

  private ChainTracer() {
    // Utility class
  }

  /**
   * Runs a function within a new span.
   *
   * @param spanName
   *            the span name
   * @param attributes
   *            string attributes to set on the span
   * @param fn
   *            the function to execute
   * @param <T>
   *            the result type
   * @return the function result
   * @throws GatekitException
   *             if the function throws one
   */
  public static <T> T runInSpan(String spanName, Map<String, String> attributes, Supplier<T> fn)
      throws GatekitException {
    Tracer tracer = GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME);
    Span span = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL).startSpan();
    attributes.forEach((key, value) -> span.setAttribute(key, value));

    try (Scope scope = span.makeCurrent()) {
      T result = fn.get();
      span.setAttribute("gatekit:state", "success");
      span.setStatus(StatusCode.OK);
      return result;
    } catch (RuntimeException e) {
      span.setAttribute("gatekit:state", "error");
      span.setStatus(StatusCode.ERROR, e.getMessage());
      span.recordException(e);
      throw e;
    } finally {
      span.end();
    }
  }
}
