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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * MiddlewareCategory is a coarse classification of a unit's purpose. Each
 * {@link ChainType} admits a fixed set of categories.
 */
public enum MiddlewareCategory {
  /**
   * Infrastructure units such as recovery, CORS, request IDs and timeouts.
   */
  BASIC("basic"),

  /**
   * Units enforcing security policy: headers, CSRF, rate limits, input
   * validation.
   */
  SECURITY("security"),

  /**
   * Session, authentication and authorization units.
   */
  AUTH("auth"),

  /**
   * Request logging units.
   */
  LOGGING("logging"),

  /**
   * Application-specific units. No chain type admits this category by default.
   */
  CUSTOM("custom");

  private final String value;

  MiddlewareCategory(String value) {
    this.value = value;
  }

  /**
   * Returns the string value of the category.
   *
   * @return the category string value
   */
  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Creates a MiddlewareCategory from a string value.
   *
   * @param value
   *            the string value
   * @return the corresponding MiddlewareCategory
   * @throws IllegalArgumentException
   *             if the value doesn't match any MiddlewareCategory
   */
  @JsonCreator
  public static MiddlewareCategory fromValue(String value) {
    for (MiddlewareCategory category : values()) {
      if (category.value.equalsIgnoreCase(value)) {
        return category;
      }
    }
    throw new IllegalArgumentException("Unknown middleware category: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
