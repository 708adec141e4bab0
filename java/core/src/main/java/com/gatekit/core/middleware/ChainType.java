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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * ChainType is a closed category of request traffic. The type decides which
 * middleware categories are eligible for a chain; configuration then narrows
 * the eligible units further.
 */
public enum ChainType {
  DEFAULT("default", "Default middleware chain for most requests",
      MiddlewareCategory.BASIC, MiddlewareCategory.SECURITY, MiddlewareCategory.LOGGING),

  API("api", "Middleware chain for API requests with authentication and logging",
      MiddlewareCategory.BASIC, MiddlewareCategory.SECURITY, MiddlewareCategory.AUTH, MiddlewareCategory.LOGGING),

  WEB("web", "Middleware chain for web page requests with session management",
      MiddlewareCategory.BASIC, MiddlewareCategory.SECURITY, MiddlewareCategory.AUTH, MiddlewareCategory.LOGGING),

  AUTH("auth", "Middleware chain for authentication endpoints",
      MiddlewareCategory.BASIC, MiddlewareCategory.SECURITY, MiddlewareCategory.AUTH),

  ADMIN("admin", "Middleware chain for admin-only endpoints with enhanced security",
      MiddlewareCategory.BASIC, MiddlewareCategory.SECURITY, MiddlewareCategory.AUTH, MiddlewareCategory.LOGGING),

  PUBLIC("public", "Middleware chain for public endpoints with basic security",
      MiddlewareCategory.BASIC, MiddlewareCategory.SECURITY),

  STATIC("static", "Middleware chain for static asset requests with caching",
      MiddlewareCategory.BASIC);

  private final String value;
  private final String description;
  private final List<MiddlewareCategory> categories;

  ChainType(String value, String description, MiddlewareCategory... categories) {
    this.value = value;
    this.description = description;
    this.categories = List.of(categories);
  }

  /**
   * Returns the string value of the chain type, used in configuration and cache
   * keys.
   *
   * @return the chain type string value
   */
  @JsonValue
  public String getValue() {
    return value;
  }

  public String getDescription() {
    return description;
  }

  /**
   * Returns the middleware categories eligible for this chain type, in the order
   * they are collected.
   *
   * @return the categories
   */
  public List<MiddlewareCategory> getCategories() {
    return categories;
  }

  /**
   * Creates a ChainType from a string value.
   *
   * @param value
   *            the string value
   * @return the corresponding ChainType
   * @throws IllegalArgumentException
   *             if the value doesn't match any ChainType
   */
  @JsonCreator
  public static ChainType fromValue(String value) {
    for (ChainType type : values()) {
      if (type.value.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown chain type: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
