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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.gatekit.core.middleware.MiddlewareCategory;

/**
 * MiddlewareSettings holds the configuration declared for a single middleware
 * unit: its category, priority override, relationships to other units, and
 * path rules.
 *
 * <p>
 * Path rules are applied when a chain is specialized for a request path:
 * <ul>
 * <li>{@code paths}: the unit is added to chains for matching paths</li>
 * <li>{@code excludePaths}: the unit is removed for matching paths</li>
 * <li>{@code includePaths}: when non-empty, the unit is kept only for matching
 * paths</li>
 * </ul>
 */
public final class MiddlewareSettings {

  private static final MiddlewareSettings EMPTY = builder().build();

  private final MiddlewareCategory category;
  private final Integer priority;
  private final List<String> dependencies;
  private final List<String> conflicts;
  private final List<String> paths;
  private final List<String> excludePaths;
  private final List<String> includePaths;
  private final Map<String, Object> custom;

  private MiddlewareSettings(Builder builder) {
    this.category = builder.category;
    this.priority = builder.priority;
    this.dependencies = List.copyOf(builder.dependencies);
    this.conflicts = List.copyOf(builder.conflicts);
    this.paths = List.copyOf(builder.paths);
    this.excludePaths = List.copyOf(builder.excludePaths);
    this.includePaths = List.copyOf(builder.includePaths);
    this.custom = Collections.unmodifiableMap(new LinkedHashMap<>(builder.custom));
  }

  /**
   * Returns settings with no category, no priority and no rules.
   *
   * @return the empty settings
   */
  public static MiddlewareSettings empty() {
    return EMPTY;
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
   * Returns a builder pre-populated with these settings.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    return new Builder().category(category).priority(priority).dependencies(dependencies).conflicts(conflicts)
        .paths(paths).excludePaths(excludePaths).includePaths(includePaths).custom(custom);
  }

  /**
   * Returns the configured category.
   *
   * @return the category, or null when none is configured
   */
  public MiddlewareCategory getCategory() {
    return category;
  }

  /**
   * Returns the configured priority.
   *
   * @return the priority, or null when the unit's own priority applies
   */
  public Integer getPriority() {
    return priority;
  }

  public List<String> getDependencies() {
    return dependencies;
  }

  public List<String> getConflicts() {
    return conflicts;
  }

  public List<String> getPaths() {
    return paths;
  }

  public List<String> getExcludePaths() {
    return excludePaths;
  }

  public List<String> getIncludePaths() {
    return includePaths;
  }

  public Map<String, Object> getCustom() {
    return custom;
  }

  @Override
  public String toString() {
    return "MiddlewareSettings{category=" + category + ", priority=" + priority + ", dependencies=" + dependencies
        + ", conflicts=" + conflicts + ", paths=" + paths + ", excludePaths=" + excludePaths + ", includePaths="
        + includePaths + "}";
  }

  /**
   * Builder for MiddlewareSettings.
   */
  public static class Builder {
    private MiddlewareCategory category;
    private Integer priority;
    private final List<String> dependencies = new ArrayList<>();
    private final List<String> conflicts = new ArrayList<>();
    private final List<String> paths = new ArrayList<>();
    private final List<String> excludePaths = new ArrayList<>();
    private final List<String> includePaths = new ArrayList<>();
    private final Map<String, Object> custom = new LinkedHashMap<>();

    public Builder category(MiddlewareCategory category) {
      this.category = category;
      return this;
    }

    public Builder priority(Integer priority) {
      this.priority = priority;
      return this;
    }

    public Builder dependencies(Collection<String> dependencies) {
      this.dependencies.addAll(dependencies);
      return this;
    }

    public Builder dependsOn(String... dependencies) {
      Collections.addAll(this.dependencies, dependencies);
      return this;
    }

    public Builder conflicts(Collection<String> conflicts) {
      this.conflicts.addAll(conflicts);
      return this;
    }

    public Builder conflictsWith(String... conflicts) {
      Collections.addAll(this.conflicts, conflicts);
      return this;
    }

    public Builder paths(Collection<String> paths) {
      this.paths.addAll(paths);
      return this;
    }

    public Builder paths(String... paths) {
      Collections.addAll(this.paths, paths);
      return this;
    }

    public Builder excludePaths(Collection<String> excludePaths) {
      this.excludePaths.addAll(excludePaths);
      return this;
    }

    public Builder excludePaths(String... excludePaths) {
      Collections.addAll(this.excludePaths, excludePaths);
      return this;
    }

    public Builder includePaths(Collection<String> includePaths) {
      this.includePaths.addAll(includePaths);
      return this;
    }

    public Builder includePaths(String... includePaths) {
      Collections.addAll(this.includePaths, includePaths);
      return this;
    }

    public Builder custom(Map<String, Object> custom) {
      this.custom.putAll(custom);
      return this;
    }

    public Builder custom(String key, Object value) {
      this.custom.put(key, value);
      return this;
    }

    public MiddlewareSettings build() {
      return new MiddlewareSettings(this);
    }
  }
}
