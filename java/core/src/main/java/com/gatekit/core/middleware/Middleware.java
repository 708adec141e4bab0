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

/**
 * Middleware is a named, prioritized request-processing unit. Units are
 * registered once in a {@link MiddlewareRegistry} and shared by reference
 * between every chain that includes them, so implementations must be immutable
 * and safe for concurrent use.
 *
 * <p>
 * Lower priorities execute earlier. A priority configured for the unit takes
 * precedence over {@link #getPriority()}.
 *
 * @see CommonMiddleware#named(String, int, MiddlewareHandler)
 */
public interface Middleware extends MiddlewareHandler {

  /** Priority used when neither the unit nor its configuration declares one. */
  int DEFAULT_PRIORITY = 50;

  /**
   * Returns the unit name.
   *
   * @return the name
   */
  String getName();

  /**
   * Returns the unit's own priority.
   *
   * @return the priority, {@link #DEFAULT_PRIORITY} unless overridden
   */
  default int getPriority() {
    return DEFAULT_PRIORITY;
  }
}
