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
package com.gatekit.core.config;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Binding for a middleware configuration document. See
 * {@link JsonMiddlewareConfigLoader} for the format.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
class MiddlewareDocument {

  @JsonProperty("disabled")
  private List<String> disabled;

  @JsonProperty("middleware")
  private Map<String, UnitEntry> middleware;

  @JsonProperty("chains")
  private Map<String, ChainEntry> chains;

  public List<String> getDisabled() {
    return disabled != null ? disabled : List.of();
  }

  public Map<String, UnitEntry> getMiddleware() {
    return middleware != null ? middleware : Map.of();
  }

  public Map<String, ChainEntry> getChains() {
    return chains != null ? chains : Map.of();
  }

  /**
   * One entry of the {@code middleware} object.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  static class UnitEntry {

    @JsonProperty("category")
    private String category;

    @JsonProperty("priority")
    private Integer priority;

    @JsonProperty("dependencies")
    private List<String> dependencies;

    @JsonProperty("conflicts")
    private List<String> conflicts;

    @JsonProperty("paths")
    private List<String> paths;

    @JsonProperty("exclude_paths")
    private List<String> excludePaths;

    // Null when absent so the loader can default it to paths.
    @JsonProperty("include_paths")
    private List<String> includePaths;

    @JsonProperty("enabled")
    private Boolean enabled;

    @JsonProperty("settings")
    private Map<String, Object> settings;

    public String getCategory() {
      return category;
    }

    public Integer getPriority() {
      return priority;
    }

    public List<String> getDependencies() {
      return orEmpty(dependencies);
    }

    public List<String> getConflicts() {
      return orEmpty(conflicts);
    }

    public List<String> getPaths() {
      return orEmpty(paths);
    }

    public List<String> getExcludePaths() {
      return orEmpty(excludePaths);
    }

    public List<String> getIncludePaths() {
      return includePaths;
    }

    public boolean isEnabled() {
      return enabled == null || enabled;
    }

    public Map<String, Object> getSettings() {
      return settings;
    }
  }

  /**
   * One entry of the {@code chains} object.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  static class ChainEntry {

    @JsonProperty("enabled")
    private Boolean enabled;

    @JsonProperty("middleware")
    private List<String> middleware;

    @JsonProperty("paths")
    private List<String> paths;

    @JsonProperty("custom")
    private Map<String, Object> custom;

    public boolean isEnabled() {
      return enabled == null || enabled;
    }

    public List<String> getMiddleware() {
      return orEmpty(middleware);
    }

    public List<String> getPaths() {
      return orEmpty(paths);
    }

    public Map<String, Object> getCustom() {
      return custom;
    }
  }

  private static List<String> orEmpty(List<String> values) {
    return values != null ? values : List.of();
  }
}
