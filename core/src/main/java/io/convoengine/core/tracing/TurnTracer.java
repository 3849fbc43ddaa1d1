/*
 * Copyright 2025 The ConvoEngine Authors
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

package io.convoengine.core.tracing;

import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.convoengine.core.ConvoException;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * TurnTracer wraps conversation turns in OpenTelemetry spans. It uses the
 * global OpenTelemetry instance, so spans are no-ops unless the host
 * application installs an SDK.
 */
public final class TurnTracer {

  private static final Logger logger = LoggerFactory.getLogger(TurnTracer.class);
  private static final String INSTRUMENTATION_NAME = "convoengine-java";

  public static final String ATTR_CONVERSATION_ID = "convo:conversationId";
  public static final String ATTR_SESSION_ID = "convo:sessionId";
  public static final String ATTR_QUEUED = "convo:queued";

  private final Tracer tracer;

  /**
   * Creates a tracer backed by the global OpenTelemetry instance.
   */
  public TurnTracer() {
    this(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME));
  }

  /**
   * Creates a tracer backed by the given OpenTelemetry tracer.
   *
   * @param tracer
   *            the OpenTelemetry tracer
   */
  public TurnTracer(Tracer tracer) {
    this.tracer = tracer;
  }

  /**
   * Runs a function within a new span.
   *
   * @param spanName
   *            the span name
   * @param attributes
   *            span attributes; String, Long, Boolean and Double values are
   *            recorded, anything else is recorded via toString
   * @param fn
   *            the function to run
   * @param <T>
   *            the result type
   * @return the function result
   * @throws ConvoException
   *             if the function fails; ConvoExceptions are rethrown as-is
   */
  public <T> T inSpan(String spanName, Map<String, Object> attributes, Callable<T> fn) throws ConvoException {
    Span span = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL).startSpan();
    if (attributes != null) {
      for (Map.Entry<String, Object> entry : attributes.entrySet()) {
        setAttribute(span, entry.getKey(), entry.getValue());
      }
    }

    try (Scope scope = span.makeCurrent()) {
      T result = fn.call();
      span.setStatus(StatusCode.OK);
      return result;
    } catch (ConvoException e) {
      recordFailure(span, e);
      throw e;
    } catch (Exception e) {
      recordFailure(span, e);
      throw new ConvoException("Error in span " + spanName + ": " + e.getMessage(), e);
    } finally {
      span.end();
    }
  }

  private static void recordFailure(Span span, Exception e) {
    span.setStatus(StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    span.recordException(e);
    logger.debug("Span failed: {}", e.getMessage());
  }

  private static void setAttribute(Span span, String key, Object value) {
    if (value == null) {
      return;
    }
    if (value instanceof String) {
      span.setAttribute(key, (String) value);
    } else if (value instanceof Long) {
      span.setAttribute(key, (Long) value);
    } else if (value instanceof Integer) {
      span.setAttribute(key, ((Integer) value).longValue());
    } else if (value instanceof Double) {
      span.setAttribute(key, (Double) value);
    } else if (value instanceof Boolean) {
      span.setAttribute(key, (Boolean) value);
    } else {
      span.setAttribute(key, value.toString());
    }
  }
}
