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

/**
 * ServerPlugin is a {@link Plugin} that binds the orchestrator's chains to a
 * network transport. It receives the orchestrator through
 * {@link Plugin#init(com.gatekit.core.middleware.ChainOrchestrator)} and must
 * not accept traffic before that call.
 *
 * <p>
 * The facade never starts servers itself; the application calls
 * {@link #start()} or {@link #startAsync()} once the facade is built, and the
 * facade's {@code stop()} shuts every running server down.
 */
public interface ServerPlugin extends Plugin {

  /**
   * Starts accepting requests and blocks the calling thread until the server
   * stops.
   *
   * @throws Exception
   *             if the server cannot be started or if interrupted while waiting
   */
  void start() throws Exception;

  /**
   * Starts the HTTP server and returns once it accepts connections.
   *
   * @throws Exception
   *             if the server cannot be started
   */
  void startAsync() throws Exception;

  /**
   * Stops the HTTP server.
   *
   * @throws Exception
   *             if the server cannot be stopped
   */
  void stop() throws Exception;

  /**
   * Returns the bound port while running, otherwise the configured one.
   *
   * @return the port
   */
  int getPort();

  /**
   * Returns true if the server is currently running.
   *
   * @return true if running, false otherwise
   */
  boolean isRunning();
}
