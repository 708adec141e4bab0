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

import java.util.List;
import java.util.Optional;

import com.gatekit.core.AlreadyRegisteredException;
import com.gatekit.core.ConflictingMiddlewareException;
import com.gatekit.core.MissingDependencyException;

/**
 * MiddlewareRegistry is the catalog of registered middleware units and their
 * metadata.
 */
public interface MiddlewareRegistry {

  /**
   * Registers a unit. A unit the configuration reports as disabled is accepted
   * without being catalogued.
   *
   * @param name
   *            the unit name, which must equal {@code unit.getName()}
   * @param unit
   *            the unit
   * @throws AlreadyRegisteredException
   *             if a unit with this name is already registered
   * @throws IllegalArgumentException
   *             if the name does not match the unit
   */
  void register(String name, Middleware unit);

  /**
   * Registers a unit under its own name.
   *
   * @param unit
   *            the unit
   * @throws AlreadyRegisteredException
   *             if a unit with this name is already registered
   */
  default void register(Middleware unit) {
    register(unit.getName(), unit);
  }

  /**
   * Looks up a unit by name.
   *
   * @param name
   *            the unit name
   * @return the unit, or empty if not registered
   */
  Optional<Middleware> get(String name);

  /**
   * Looks up the metadata derived for a unit.
   *
   * @param name
   *            the unit name
   * @return the metadata, or empty if not registered
   */
  Optional<MiddlewareMetadata> getMetadata(String name);

  /**
   * Returns the names of all registered units, sorted.
   *
   * @return the names
   */
  List<String> list();

  /**
   * Removes a unit and its metadata.
   *
   * @param name
   *            the unit name
   * @return true if the unit was registered
   */
  boolean remove(String name);

  /**
   * Removes all units.
   */
  void clear();

  /**
   * Returns the number of registered units.
   *
   * @return the count
   */
  int count();

  /**
   * Returns the units of a category that are currently enabled, ordered by
   * effective priority with ties in registration order.
   *
   * @param category
   *            the category
   * @return the ordered units
   */
  List<Middleware> getOrdered(MiddlewareCategory category);

  /**
   * Checks every registered unit's declared dependencies and conflicts against
   * the whole registry.
   *
   * @throws MissingDependencyException
   *             if a declared dependency is not registered
   * @throws ConflictingMiddlewareException
   *             if a declared conflict is registered
   */
  void validateDependencies();
}
