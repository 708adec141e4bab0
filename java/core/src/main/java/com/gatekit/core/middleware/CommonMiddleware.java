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

package com.gatekit.core.middleware;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gatekit.core.Request;
import com.gatekit.core.Response;

/**
 * CommonMiddleware provides factory methods for creating commonly-used
 * middleware units. Built-in units use the names and priorities of the bundled
 * default configuration.
 */
public final class CommonMiddleware {

  private static final Logger logger = LoggerFactory.getLogger(CommonMiddleware.class);

  /** Context attribute holding the request ID assigned by {@link #requestId()}. */
  public static final String REQUEST_ID_ATTRIBUTE = "gatekit.requestId";

  /** Header carrying the request ID. */
  public static final String REQUEST_ID_HEADER = "X-Request-ID";

  private CommonMiddleware() {
    // Utility class
  }

  /**
   * Creates a unit from a handler function.
   *
   * @param name
   *            the unit name
   * @param priority
   *            the unit priority
   * @param handler
   *            the processing function
   * @return a middleware unit
   */
  public static Middleware named(String name, int priority, MiddlewareHandler handler) {
    return new NamedMiddleware(name, priority, handler);
  }

  /**
   * Creates a unit with the default priority from a handler function.
   *
   * @param name
   *            the unit name
   * @param handler
   *            the processing function
   * @return a middleware unit
   */
  public static Middleware named(String name, MiddlewareHandler handler) {
    return new NamedMiddleware(name, Middleware.DEFAULT_PRIORITY, handler);
  }

  /**
   * Creates a unit that passes every request through unchanged.
   *
   * @param name
   *            the unit name
   * @param priority
   *            the unit priority
   * @return a middleware unit
   */
  public static Middleware passThrough(String name, int priority) {
    return new NamedMiddleware(name, priority, (request, context, next) -> next.apply(request, context));
  }

  /**
   * Creates the {@code recovery} unit, which turns exceptions thrown further
   * down the chain into a JSON 500 response.
   *
   * @return a recovery unit
   */
  public static Middleware recovery() {
    return named("recovery", 10, (request, context, next) -> {
      try {
        return next.apply(request, context);
      } catch (RuntimeException e) {
        logger.error("Recovered from error while handling {} [{}]", request, context.getRequestId(), e);
        return Response.json(500, Map.of("error", "Internal Server Error", "request_id", context.getRequestId()))
            .setError(e);
      }
    });
  }

  /**
   * Creates the {@code request-id} unit. It reuses the request's
   * {@code X-Request-ID} header when present, otherwise the context's ID, and
   * echoes the ID on the response.
   *
   * @return a request ID unit
   */
  public static Middleware requestId() {
    return named("request-id", 30, (request, context, next) -> {
      String header = request.getHeader(REQUEST_ID_HEADER);
      String id = header != null && !header.isEmpty() ? header : context.getRequestId();
      context.setAttribute(REQUEST_ID_ATTRIBUTE, id);
      Response response = next.apply(request, context);
      if (response != null && response.getHeader(REQUEST_ID_HEADER) == null) {
        response.setHeader(REQUEST_ID_HEADER, id);
      }
      return response;
    });
  }

  /**
   * Creates the {@code logging} unit, which logs each request with its status
   * and duration.
   *
   * @return a logging unit
   */
  public static Middleware logging() {
    return logging(logger);
  }

  /**
   * Creates the {@code logging} unit with a custom logger.
   *
   * @param customLogger
   *            the logger to use
   * @return a logging unit
   */
  public static Middleware logging(Logger customLogger) {
    return named("logging", 90, (request, context, next) -> {
      Instant start = Instant.now();
      try {
        Response response = next.apply(request, context);
        Duration duration = Duration.between(start, Instant.now());
        customLogger.info("{} -> {} ({}ms)", request, response != null ? response.getStatusCode() : "no response",
            duration.toMillis());
        return response;
      } catch (RuntimeException e) {
        Duration duration = Duration.between(start, Instant.now());
        customLogger.error("{} failed ({}ms): {}", request, duration.toMillis(), e.getMessage(), e);
        throw e;
      }
    });
  }

  /**
   * Creates a timing unit that measures the time spent in the rest of the
   * chain.
   *
   * @param name
   *            the unit name
   * @param callback
   *            callback to receive the duration
   * @return a timing unit
   */
  public static Middleware timing(String name, Consumer<Duration> callback) {
    return named(name, (request, context, next) -> {
      Instant start = Instant.now();
      try {
        return next.apply(request, context);
      } finally {
        callback.accept(Duration.between(start, Instant.now()));
      }
    });
  }

  private static final class NamedMiddleware implements Middleware {
    private final String name;
    private final int priority;
    private final MiddlewareHandler handler;

    NamedMiddleware(String name, int priority, MiddlewareHandler handler) {
      this.name = Objects.requireNonNull(name, "name");
      this.priority = priority;
      this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public int getPriority() {
      return priority;
    }

    @Override
    public Response handle(Request request, ChainContext context, MiddlewareNext next) {
      return handler.handle(request, context, next);
    }

    @Override
    public String toString() {
      return name + "(" + priority + ")";
    }
  }
}
