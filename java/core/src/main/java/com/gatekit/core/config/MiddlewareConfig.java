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

import com.gatekit.core.middleware.ChainType;

/**
 * MiddlewareConfig is the configuration provider consulted by the registry and
 * the orchestrator. Implementations must be safe for concurrent reads and
 * should answer without blocking.
 */
public interface MiddlewareConfig {

  /**
   * Returns whether a unit is enabled.
   *
   * @param name
   *            the unit name
   * @return true if the unit may take part in chains
   */
  boolean isMiddlewareEnabled(String name);

  /**
   * Returns the settings declared for a unit.
   *
   * @param name
   *            the unit name
   * @return the settings, {@link MiddlewareSettings#empty()} when none are
   *         declared
   */
  MiddlewareSettings getMiddlewareSettings(String name);

  /**
   * Returns the configuration of a chain type.
   *
   * @param chainType
   *            the chain type
   * @return the chain configuration, {@link ChainConfig#defaults()} when none is
   *         declared
   */
  ChainConfig getChainConfig(ChainType chainType);
}
