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

import com.gatekit.core.GatekitException;
import com.gatekit.core.Request;
import com.gatekit.core.Response;

/**
 * Chain is an ordered, executable sequence of middleware units.
 *
 * <p>
 * Chains built by a {@link ChainOrchestrator} are sorted by priority. The
 * mutation methods on this interface never re-sort: {@code add} and
 * {@code insert} place units exactly where the caller asks.
 */
public interface Chain {

  /**
   * Runs the chain. When the last unit calls its continuation the result is
   * null.
   *
   * @param request
   *            the request
   * @param context
   *            the chain context
   * @return the response produced by the units, or null
   * @throws GatekitException
   *             if a unit fails or calls its continuation twice
   */
  Response process(Request request, ChainContext context) throws GatekitException;

  /**
   * Runs the chain, invoking {@code terminal} when the last unit calls its
   * continuation.
   *
   * @param request
   *            the request
   * @param context
   *            the chain context
   * @param terminal
   *            the handler invoked after all units
   * @return the response
   * @throws GatekitException
   *             if a unit or the terminal handler fails
   */
  Response process(Request request, ChainContext context, MiddlewareNext terminal) throws GatekitException;

  /**
   * Appends units to the end of the chain.
   *
   * @param units
   *            the units to append
   * @return this chain
   */
  Chain add(Middleware... units);

  /**
   * Inserts units at a position. Position 0 is the front; a negative or
   * out-of-range position appends.
   *
   * @param position
   *            the insert position
   * @param units
   *            the units to insert
   * @return this chain
   */
  Chain insert(int position, Middleware... units);

  /**
   * Removes the first unit with the given name.
   *
   * @param name
   *            the unit name
   * @return true if a unit was removed
   */
  boolean remove(String name);

  /**
   * Returns the first unit with the given name.
   *
   * @param name
   *            the unit name
   * @return the unit, or empty if not present
   */
  Optional<Middleware> get(String name);

  /**
   * Returns the units in execution order.
   *
   * @return an immutable snapshot of the units
   */
  List<Middleware> list();

  /**
   * Returns the unit names in execution order.
   *
   * @return the names
   */
  List<String> names();

  /**
   * Removes all units.
   *
   * @return this chain
   */
  Chain clear();

  /**
   * Returns the number of units.
   *
   * @return the length
   */
  int length();

  /**
   * Creates an independent chain with the same units. The units themselves are
   * shared, not copied.
   *
   * @return the copy
   */
  Chain copy();
}
