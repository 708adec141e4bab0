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

package com.gatekit.core;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Request is a transport-agnostic view of an inbound HTTP request. Instances
 * are immutable; middleware that wants to hand a modified request downstream
 * derives one with {@link #toBuilder()}.
 *
 * <p>
 * Header names are case-insensitive and stored lower-cased.
 */
public final class Request {

  private final String method;
  private final String path;
  private final Map<String, List<String>> query;
  private final Map<String, List<String>> headers;
  private final Map<String, String> cookies;
  private final byte[] body;
  private final String remoteAddr;
  private final Instant timestamp;

  private Request(Builder builder) {
    this.method = builder.method;
    this.path = builder.path;
    this.query = Collections.unmodifiableMap(copyOf(builder.query));
    this.headers = Collections.unmodifiableMap(copyOf(builder.headers));
    this.cookies = Collections.unmodifiableMap(new LinkedHashMap<>(builder.cookies));
    this.body = builder.body;
    this.remoteAddr = builder.remoteAddr;
    this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a GET request for the given path.
   *
   * @param path
   *            the request path
   * @return a new request
   */
  public static Request get(String path) {
    return builder().method("GET").path(path).build();
  }

  /**
   * Returns a builder pre-populated with this request's values.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    Builder builder = new Builder().method(method).path(path).body(body).remoteAddr(remoteAddr).timestamp(timestamp);
    query.forEach((name, values) -> values.forEach(value -> builder.queryParam(name, value)));
    headers.forEach((name, values) -> values.forEach(value -> builder.header(name, value)));
    cookies.forEach(builder::cookie);
    return builder;
  }

  public String getMethod() {
    return method;
  }

  public String getPath() {
    return path;
  }

  public Map<String, List<String>> getQuery() {
    return query;
  }

  /**
   * Returns the first value of a query parameter.
   *
   * @param name
   *            the parameter name
   * @return the value, or null if absent
   */
  public String getQueryParam(String name) {
    List<String> values = query.get(name);
    return values == null || values.isEmpty() ? null : values.get(0);
  }

  public Map<String, List<String>> getHeaders() {
    return headers;
  }

  /**
   * Returns the first value of a header.
   *
   * @param name
   *            the header name, matched case-insensitively
   * @return the value, or null if absent
   */
  public String getHeader(String name) {
    List<String> values = headers.get(name.toLowerCase(Locale.ROOT));
    return values == null || values.isEmpty() ? null : values.get(0);
  }

  public Map<String, String> getCookies() {
    return cookies;
  }

  public String getCookie(String name) {
    return cookies.get(name);
  }

  /**
   * Returns the raw request body.
   *
   * @return the body bytes, never null
   */
  public byte[] getBody() {
    return body != null ? body.clone() : new byte[0];
  }

  /**
   * Returns the request body decoded as UTF-8.
   *
   * @return the body text, empty if there is no body
   */
  public String getBodyAsString() {
    return body != null ? new String(body, StandardCharsets.UTF_8) : "";
  }

  public String getContentType() {
    return getHeader("Content-Type");
  }

  public String getRemoteAddr() {
    return remoteAddr;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  @Override
  public String toString() {
    return method + " " + path;
  }

  private static Map<String, List<String>> copyOf(Map<String, List<String>> source) {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    source.forEach((name, values) -> copy.put(name, List.copyOf(values)));
    return copy;
  }

  /**
   * Builder for Request.
   */
  public static class Builder {
    private String method = "GET";
    private String path = "/";
    private final Map<String, List<String>> query = new LinkedHashMap<>();
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final Map<String, String> cookies = new LinkedHashMap<>();
    private byte[] body;
    private String remoteAddr;
    private Instant timestamp;

    public Builder method(String method) {
      this.method = method;
      return this;
    }

    public Builder path(String path) {
      this.path = path;
      return this;
    }

    public Builder queryParam(String name, String value) {
      query.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
      return this;
    }

    public Builder header(String name, String value) {
      headers.computeIfAbsent(name.toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(value);
      return this;
    }

    public Builder cookie(String name, String value) {
      cookies.put(name, value);
      return this;
    }

    public Builder body(byte[] body) {
      this.body = body != null ? body.clone() : null;
      return this;
    }

    public Builder body(String body) {
      this.body = body != null ? body.getBytes(StandardCharsets.UTF_8) : null;
      return this;
    }

    public Builder remoteAddr(String remoteAddr) {
      this.remoteAddr = remoteAddr;
      return this;
    }

    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Request build() {
      if (path == null || path.isEmpty()) {
        throw new IllegalStateException("path is required");
      }
      return new Request(this);
    }
  }
}
