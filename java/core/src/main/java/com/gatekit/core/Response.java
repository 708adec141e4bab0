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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Response is a transport-agnostic HTTP response. Unlike {@link Request} it is
 * mutable so that middleware can decorate the response produced further down
 * the chain; setters return {@code this} for fluent use.
 */
public class Response {

  private int statusCode;
  private final Map<String, List<String>> headers = new LinkedHashMap<>();
  private final List<String> cookies = new ArrayList<>();
  private byte[] body = new byte[0];
  private Throwable error;

  /**
   * Creates a new response with the given status code.
   *
   * @param statusCode
   *            the HTTP status code
   */
  public Response(int statusCode) {
    this.statusCode = statusCode;
  }

  /**
   * Creates an empty response with the given status code.
   *
   * @param statusCode
   *            the HTTP status code
   * @return a new response
   */
  public static Response of(int statusCode) {
    return new Response(statusCode);
  }

  /**
   * Creates a plain text response.
   *
   * @param statusCode
   *            the HTTP status code
   * @param text
   *            the body text
   * @return a new response
   */
  public static Response text(int statusCode, String text) {
    return new Response(statusCode).setContentType("text/plain; charset=utf-8").setBody(text);
  }

  /**
   * Creates a JSON response by serializing the given value.
   *
   * @param statusCode
   *            the HTTP status code
   * @param value
   *            the value to serialize
   * @return a new response
   */
  public static Response json(int statusCode, Object value) {
    return new Response(statusCode).setContentType("application/json").setBody(JsonUtils.toJson(value));
  }

  /**
   * Creates an error response that records the failure.
   *
   * @param statusCode
   *            the HTTP status code
   * @param error
   *            the error
   * @return a new response
   */
  public static Response error(int statusCode, Throwable error) {
    return new Response(statusCode).setError(error);
  }

  public int getStatusCode() {
    return statusCode;
  }

  public Response setStatusCode(int statusCode) {
    this.statusCode = statusCode;
    return this;
  }

  public Map<String, List<String>> getHeaders() {
    return Collections.unmodifiableMap(headers);
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

  /**
   * Sets a header, replacing any existing values.
   *
   * @param name
   *            the header name
   * @param value
   *            the header value
   * @return this response
   */
  public Response setHeader(String name, String value) {
    List<String> values = new ArrayList<>();
    values.add(value);
    headers.put(name.toLowerCase(Locale.ROOT), values);
    return this;
  }

  /**
   * Adds a header value without overwriting existing values.
   *
   * @param name
   *            the header name
   * @param value
   *            the header value
   * @return this response
   */
  public Response addHeader(String name, String value) {
    headers.computeIfAbsent(name.toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(value);
    return this;
  }

  public String getContentType() {
    return getHeader("Content-Type");
  }

  public Response setContentType(String contentType) {
    return setHeader("Content-Type", contentType);
  }

  /**
   * Returns the cookies to set, each in {@code Set-Cookie} header form.
   *
   * @return the cookies
   */
  public List<String> getCookies() {
    return Collections.unmodifiableList(cookies);
  }

  /**
   * Adds a cookie in {@code Set-Cookie} header form, for example
   * {@code "session=abc; Path=/; HttpOnly"}.
   *
   * @param setCookie
   *            the cookie definition
   * @return this response
   */
  public Response addCookie(String setCookie) {
    cookies.add(setCookie);
    return this;
  }

  public byte[] getBody() {
    return body.clone();
  }

  public String getBodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  public Response setBody(byte[] body) {
    this.body = body != null ? body.clone() : new byte[0];
    return this;
  }

  public Response setBody(String body) {
    this.body = body != null ? body.getBytes(StandardCharsets.UTF_8) : new byte[0];
    return this;
  }

  public Throwable getError() {
    return error;
  }

  public Response setError(Throwable error) {
    this.error = error;
    return this;
  }

  public boolean isError() {
    return error != null || statusCode >= 400;
  }

  public boolean isRedirect() {
    return statusCode >= 300 && statusCode < 400;
  }

  @Override
  public String toString() {
    return "Response{status=" + statusCode + ", bytes=" + body.length + "}";
  }
}
