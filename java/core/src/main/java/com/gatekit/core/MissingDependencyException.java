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
 * Thrown when a middleware unit declares a dependency that is absent from the
 * validated scope: the whole registry, or the units of a single chain.
 */
public class MissingDependencyException extends GatekitException {

  /** Error code carried by this exception. */
  public static final String CODE = "MISSING_DEPENDENCY";

  private final String middleware;
  private final String dependency;

  /**
   * Creates a new MissingDependencyException.
   *
   * @param middleware
   *            the unit declaring the dependency
   * @param dependency
   *            the missing unit
   */
  public MissingDependencyException(String middleware, String dependency) {
    super("Middleware " + middleware + " depends on " + dependency + ", which is not present", null, CODE,
        Map.of("middleware", middleware, "dependency", dependency));
    this.middleware = middleware;
    this.dependency = dependency;
  }

  /**
   * Returns the name of the unit that declared the dependency.
   *
   * @return the unit name
   */
  public String getMiddleware() {
    return middleware;
  }

  /**
   * Returns the name of the missing dependency.
   *
   * @return the dependency name
   */
  public String getDependency() {
    return dependency;
  }
}
