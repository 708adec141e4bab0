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

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.gatekit.core.ChainAlreadyExistsException;
import com.gatekit.core.ChainValidationException;
import com.gatekit.core.ConflictingMiddlewareException;
import com.gatekit.core.MissingDependencyException;

/**
 * ChainOrchestrator turns a {@link ChainType}, optionally narrowed by a request
 * path, into a validated, priority-ordered {@link Chain}.
 *
 * <p>
 * Builds either return a complete chain or throw; no partially built chain is
 * ever returned or cached.
 */
public interface ChainOrchestrator {

  /**
   * Builds the chain for a chain type.
   *
   * @param chainType
   *            the chain type
   * @return a new chain
   * @throws ChainValidationException
   *             if the resolved units fail dependency or conflict validation
   */
  Chain createChain(ChainType chainType);

  /**
   * Alias of {@link #createChain(ChainType)}.
   *
   * @param chainType
   *            the chain type
   * @return a new chain
   * @throws ChainValidationException
   *             if the resolved units fail validation
   */
  default Chain buildChain(ChainType chainType) {
    return createChain(chainType);
  }

  /**
   * Builds the chain for a chain type and specializes it for a request path:
   * units whose {@code paths} match are added, then units whose
   * {@code excludePaths} match, or whose non-empty {@code includePaths} do not
   * match, are removed. The resulting set is validated again.
   *
   * @param chainType
   *            the chain type
   * @param path
   *            the request path
   * @return a new chain
   * @throws ChainValidationException
   *             if the base chain or the path-specialized chain fails
   *             validation
   */
  Chain buildChainForPath(ChainType chainType, String path);

  /**
   * Returns the cached chain for a chain type and path, building and caching it
   * on first use. The returned chain is shared between callers and is
   * read-only: its mutation methods throw
   * {@link UnsupportedOperationException}. Use {@link Chain#copy()} for a
   * private, mutable chain.
   *
   * @param chainType
   *            the chain type
   * @param path
   *            the request path
   * @return the cached chain
   * @throws ChainValidationException
   *             if the chain cannot be built; nothing is cached in that case
   */
  Chain getChainForPath(ChainType chainType, String path);

  /**
   * Looks up a named chain.
   *
   * @param name
   *            the chain name
   * @return the chain, or empty if none is registered under the name
   */
  Optional<Chain> getChain(String name);

  /**
   * Registers a pre-built chain under a name.
   *
   * @param name
   *            the chain name
   * @param chain
   *            the chain
   * @throws ChainAlreadyExistsException
   *             if the name is taken
   */
  void registerChain(String name, Chain chain);

  /**
   * Returns the names of registered chains, sorted.
   *
   * @return the names
   */
  List<String> listChains();

  /**
   * Removes a named chain.
   *
   * @param name
   *            the chain name
   * @return true if the chain was registered
   */
  boolean removeChain(String name);

  /**
   * Empties the path cache. Named chains and the registry are untouched.
   */
  void clearCache();

  /**
   * Checks the registry's dependency graph and builds every chain type once.
   * Intended to run at startup.
   *
   * @throws MissingDependencyException
   *             if a registered unit depends on an unregistered one
   * @throws ConflictingMiddlewareException
   *             if conflicting units are both registered
   * @throws ChainValidationException
   *             if a chain type cannot be built
   */
  void validateConfiguration();

  /**
   * Describes a chain type.
   *
   * @param chainType
   *            the chain type
   * @return the descriptor
   */
  ChainInfo getChainInfo(ChainType chainType);

  /**
   * Returns the last build duration per chain type value.
   *
   * @return a snapshot of build durations
   */
  Map<String, Duration> getChainPerformance();

  /**
   * Returns cache and build statistics.
   *
   * @return a snapshot of the statistics
   */
  ChainCacheStats getCacheStats();
}
