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

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ChainContext carries request-scoped state through a chain. The chain passes
 * it unchanged to every unit; units use the attribute map to share values such
 * as an authenticated principal or a session.
 *
 * <p>
 * Cancellation is cooperative. The chain never checks {@link #isCancelled()};
 * units that honor cancellation do so themselves.
 */
public class ChainContext {

  private final String requestId;
  private final ChainType chainType;
  private final Instant startTime;
  private final Map<String, Object> attributes = new ConcurrentHashMap<>();
  private volatile boolean cancelled;

  /**
   * Creates a new ChainContext.
   *
   * @param requestId
   *            the request ID, generated when null
   * @param chainType
   *            the chain type selected for the request, may be null
   */
  public ChainContext(String requestId, ChainType chainType) {
    this.requestId = requestId != null ? requestId : UUID.randomUUID().toString();
    this.chainType = chainType;
    this.startTime = Instant.now();
  }

  /**
   * Creates a new ChainContext with a generated request ID.
   *
   * @param chainType
   *            the chain type selected for the request
   */
  public ChainContext(ChainType chainType) {
    this(null, chainType);
  }

  /**
   * Creates a new ChainContext with a generated request ID and no chain type.
   */
  public ChainContext() {
    this(null, null);
  }

  public String getRequestId() {
    return requestId;
  }

  /**
   * Returns the chain type the request was routed to.
   *
   * @return the chain type, or null when the chain was not selected by type
   */
  public ChainType getChainType() {
    return chainType;
  }

  public Instant getStartTime() {
    return startTime;
  }

  /**
   * Returns an attribute value.
   *
   * @param key
   *            the attribute key
   * @param type
   *            the expected value type
   * @param <T>
   *            the value type
   * @return the value, or empty if absent or of another type
   */
  public <T> Optional<T> getAttribute(String key, Class<T> type) {
    Object value = attributes.get(key);
    return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
  }

  /**
   * Sets an attribute. A null value removes the attribute.
   *
   * @param key
   *            the attribute key
   * @param value
   *            the value
   * @return this context
   */
  public ChainContext setAttribute(String key, Object value) {
    if (value == null) {
      attributes.remove(key);
    } else {
      attributes.put(key, value);
    }
    return this;
  }

  public Map<String, Object> getAttributes() {
    return Collections.unmodifiableMap(attributes);
  }

  /**
   * Marks the request as cancelled.
   */
  public void cancel() {
    this.cancelled = true;
  }

  public boolean isCancelled() {
    return cancelled;
  }
}
