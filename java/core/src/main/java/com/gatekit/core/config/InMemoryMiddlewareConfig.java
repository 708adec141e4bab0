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

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import com.gatekit.core.middleware.ChainType;

/**
 * InMemoryMiddlewareConfig is a mutable, thread-safe configuration provider.
 *
 * <p>
 * Units without settings are enabled and uncategorized. Chain types without a
 * configuration are enabled with no allow-list. Changes are visible to the
 * next chain build; chains already cached by an orchestrator keep their units
 * until its cache is cleared.
 */
public class InMemoryMiddlewareConfig implements MiddlewareConfig {

  private final Map<String, MiddlewareSettings> settings = new ConcurrentHashMap<>();
  private final Set<String> disabled = ConcurrentHashMap.newKeySet();
  private final Map<ChainType, ChainConfig> chains = new ConcurrentHashMap<>();

  /**
   * Creates a new, empty InMemoryMiddlewareConfig.
   */
  public InMemoryMiddlewareConfig() {
  }

  @Override
  public boolean isMiddlewareEnabled(String name) {
    return !disabled.contains(name);
  }

  @Override
  public MiddlewareSettings getMiddlewareSettings(String name) {
    return settings.getOrDefault(name, MiddlewareSettings.empty());
  }

  @Override
  public ChainConfig getChainConfig(ChainType chainType) {
    return chains.getOrDefault(chainType, ChainConfig.defaults());
  }

  /**
   * Sets the settings for a unit, replacing any previous settings.
   *
   * @param name
   *            the unit name
   * @param middlewareSettings
   *            the settings
   * @return this config
   */
  public InMemoryMiddlewareConfig setMiddlewareSettings(String name, MiddlewareSettings middlewareSettings) {
    settings.put(name, middlewareSettings);
    return this;
  }

  /**
   * Sets the configuration for a chain type.
   *
   * @param chainType
   *            the chain type
   * @param chainConfig
   *            the configuration
   * @return this config
   */
  public InMemoryMiddlewareConfig setChainConfig(ChainType chainType, ChainConfig chainConfig) {
    chains.put(chainType, chainConfig);
    return this;
  }

  /**
   * Disables a unit.
   *
   * @param name
   *            the unit name
   * @return this config
   */
  public InMemoryMiddlewareConfig disable(String name) {
    disabled.add(name);
    return this;
  }

  /**
   * Re-enables a disabled unit.
   *
   * @param name
   *            the unit name
   * @return this config
   */
  public InMemoryMiddlewareConfig enable(String name) {
    disabled.remove(name);
    return this;
  }

  /**
   * Returns the names of units that have settings, sorted.
   *
   * @return the configured unit names
   */
  public Set<String> getConfiguredMiddleware() {
    return new TreeSet<>(settings.keySet());
  }

  /**
   * Returns the names of disabled units, sorted.
   *
   * @return the disabled unit names
   */
  public Set<String> getDisabledMiddleware() {
    return new TreeSet<>(disabled);
  }

  /**
   * Removes all settings, chain configurations and disabled entries.
   */
  public void clear() {
    settings.clear();
    disabled.clear();
    chains.clear();
  }
}
