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

/**
 * ChainConfig is the configuration of one chain type: whether it is enabled,
 * an optional allow-list of unit names, the path patterns it serves, and
 * free-form custom settings.
 *
 * <p>
 * An empty allow-list admits every unit of the chain type's categories.
 */
public final class ChainConfig {

  private static final ChainConfig DEFAULTS = builder().build();

  private final boolean enabled;
  private final List<String> middlewareNames;
  private final List<String> paths;
  private final Map<String, Object> customConfig;

  private ChainConfig(Builder builder) {
    this.enabled = builder.enabled;
    this.middlewareNames = List.copyOf(builder.middlewareNames);
    this.paths = List.copyOf(builder.paths);
    this.customConfig = Collections.unmodifiableMap(new LinkedHashMap<>(builder.customConfig));
  }

  /**
   * Returns an enabled configuration with no allow-list.
   *
   * @return the default chain configuration
   */
  public static ChainConfig defaults() {
    return DEFAULTS;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Returns the allow-list of unit names.
   *
   * @return the names, empty when every eligible unit is admitted
   */
  public List<String> getMiddlewareNames() {
    return middlewareNames;
  }

  public List<String> getPaths() {
    return paths;
  }

  public Map<String, Object> getCustomConfig() {
    return customConfig;
  }

  @Override
  public String toString() {
    return "ChainConfig{enabled=" + enabled + ", middleware=" + middlewareNames + ", paths=" + paths + "}";
  }

  /**
   * Builder for ChainConfig.
   */
  public static class Builder {
    private boolean enabled = true;
    private final List<String> middlewareNames = new ArrayList<>();
    private final List<String> paths = new ArrayList<>();
    private final Map<String, Object> customConfig = new LinkedHashMap<>();

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder middlewareNames(Collection<String> names) {
      this.middlewareNames.addAll(names);
      return this;
    }

    public Builder middleware(String... names) {
      Collections.addAll(this.middlewareNames, names);
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

    public Builder customConfig(Map<String, Object> customConfig) {
      this.customConfig.putAll(customConfig);
      return this;
    }

    public Builder custom(String key, Object value) {
      this.customConfig.put(key, value);
      return this;
    }

    public ChainConfig build() {
      return new ChainConfig(this);
    }
  }
}
