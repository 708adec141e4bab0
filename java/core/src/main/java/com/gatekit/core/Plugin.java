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

import java.util.List;

import com.gatekit.core.middleware.ChainOrchestrator;
import com.gatekit.core.middleware.Middleware;

/**
 * Plugin is the interface implemented by types that extend Gatekit, either by
 * contributing middleware units or by binding built chains to a transport.
 *
 * <p>
 * Plugins are initialized by the Gatekit builder. Middleware they return is
 * registered before the configuration is validated, so a plugin's units take
 * part in dependency checks like any other unit.
 */
public interface Plugin {

  /**
   * Returns the unique identifier for the plugin.
   *
   * @return the plugin name
   */
  String getName();

  /**
   * Initializes the plugin. This method is called once during Gatekit
   * initialization.
   *
   * @return middleware units provided by this plugin
   */
  List<Middleware> init();

  /**
   * Initializes the plugin with access to the orchestrator. Override this
   * method instead of {@link #init()} when the plugin needs to build or look up
   * chains, as transport adapters do.
   *
   * @param orchestrator
   *            the chain orchestrator
   * @return middleware units provided by this plugin
   */
  default List<Middleware> init(ChainOrchestrator orchestrator) {
    return init();
  }
}
