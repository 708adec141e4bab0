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

import java.util.Map;

/**
 * Thrown when two middleware units declared as conflicting are present in the
 * same validated scope.
 */
public class ConflictingMiddlewareException extends GatekitException {

  /** Error code carried by this exception. */
  public static final String CODE = "CONFLICTING_MIDDLEWARE";

  private final String middleware;
  private final String conflict;

  /**
   * Creates a new ConflictingMiddlewareException.
   *
   * @param middleware
   *            the unit declaring the conflict
   * @param conflict
   *            the conflicting unit that is present
   */
  public ConflictingMiddlewareException(String middleware, String conflict) {
    super("Middleware " + middleware + " conflicts with " + conflict, null, CODE,
        Map.of("middleware", middleware, "conflict", conflict));
    this.middleware = middleware;
    this.conflict = conflict;
  }

  public String getMiddleware() {
    return middleware;
  }

  public String getConflict() {
    return conflict;
  }
}
