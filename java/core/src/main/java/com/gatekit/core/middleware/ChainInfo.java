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
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ChainInfo is a read-only descriptor of a chain type: its eligible
 * categories, the units it currently resolves to, and its configuration. It is
 * intended for introspection and tooling, not execution.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ChainInfo {

  @JsonProperty("type")
  private final ChainType type;

  @JsonProperty("name")
  private final String name;

  @JsonProperty("description")
  private final String description;

  @JsonProperty("categories")
  private final List<MiddlewareCategory> categories;

  @JsonProperty("middleware")
  private final List<String> middleware;

  @JsonProperty("enabled")
  private final boolean enabled;

  @JsonProperty("path_patterns")
  private final List<String> pathPatterns;

  @JsonProperty("custom_config")
  private final Map<String, Object> customConfig;

  /**
   * Creates a new ChainInfo.
   *
   * @param type
   *            the chain type
   * @param name
   *            the display name
   * @param description
   *            a human-readable description
   * @param categories
   *            the eligible categories
   * @param middleware
   *            the resolved unit names in execution order
   * @param enabled
   *            whether the chain is enabled
   * @param pathPatterns
   *            the configured path patterns
   * @param customConfig
   *            the configured custom settings
   */
  public ChainInfo(ChainType type, String name, String description, List<MiddlewareCategory> categories,
      List<String> middleware, boolean enabled, List<String> pathPatterns, Map<String, Object> customConfig) {
    this.type = type;
    this.name = name;
    this.description = description;
    this.categories = List.copyOf(categories);
    this.middleware = List.copyOf(middleware);
    this.enabled = enabled;
    this.pathPatterns = List.copyOf(pathPatterns);
    this.customConfig = customConfig;
  }

  public ChainType getType() {
    return type;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public List<MiddlewareCategory> getCategories() {
    return categories;
  }

  public List<String> getMiddleware() {
    return middleware;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public List<String> getPathPatterns() {
    return pathPatterns;
  }

  public Map<String, Object> getCustomConfig() {
    return customConfig;
  }
}
