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
 * Thrown when a middleware unit is registered under a name that is already
 * taken.
 */
public class AlreadyRegisteredException extends GatekitException {

  /** Error code carried by this exception. */
  public static final String CODE = "ALREADY_REGISTERED";

  private final String name;

  /**
   * Creates a new AlreadyRegisteredException.
   *
   * @param name
   *            the duplicate unit name
   */
  public AlreadyRegisteredException(String name) {
    super("Middleware already registered: " + name, null, CODE, Map.of("name", name));
    this.name = name;
  }

  public String getName() {
    return name;
  }
}
