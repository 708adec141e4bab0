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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gatekit.core.ChainAlreadyExistsException;
import com.gatekit.core.ChainValidationException;
import com.gatekit.core.ConflictingMiddlewareException;
import com.gatekit.core.MissingDependencyException;
import com.gatekit.core.config.ChainConfig;
import com.gatekit.core.config.MiddlewareConfig;
import com.gatekit.core.config.MiddlewareSettings;
import com.gatekit.core.tracing.ChainTracer;

/**
 * DefaultChainOrchestrator is the default implementation of the
 * ChainOrchestrator interface.
 *
 * <p>
 * The path cache, the named chains and the build times each have their own
 * lock, independent of the registry's. No operation holds two of them at once.
 */
public class DefaultChainOrchestrator implements ChainOrchestrator {

  private static final Logger logger = LoggerFactory.getLogger(DefaultChainOrchestrator.class);

  private final MiddlewareRegistry registry;
  private final MiddlewareConfig config;

  private final ReentrantReadWriteLock cacheLock = new ReentrantReadWriteLock();
  private final Map<String, Chain> pathCache = new HashMap<>();

  private final ReentrantReadWriteLock chainsLock = new ReentrantReadWriteLock();
  private final Map<String, Chain> namedChains = new HashMap<>();

  private final ReentrantReadWriteLock buildLock = new ReentrantReadWriteLock();
  private final Map<String, Duration> buildTimes = new HashMap<>();

  /**
   * Creates a new orchestrator.
   *
   * @param registry
   *            the unit registry
   * @param config
   *            the configuration provider
   */
  public DefaultChainOrchestrator(MiddlewareRegistry registry, MiddlewareConfig config) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.config = Objects.requireNonNull(config, "config");
  }

  @Override
  public Chain createChain(ChainType chainType) {
    Objects.requireNonNull(chainType, "chainType");
    long start = System.nanoTime();
    try {
      return ChainTracer.runInSpan(ChainTracer.CHAIN_BUILD_SPAN, Map.of("gatekit:chainType", chainType.getValue()),
          () -> assemble(chainType));
    } finally {
      recordBuildTime(chainType, Duration.ofNanos(System.nanoTime() - start));
    }
  }

  private Chain assemble(ChainType chainType) {
    List<Entry> entries = filterByConfig(chainType, collect(chainType));
    validate(chainType, entries);

    Chain chain = new MiddlewareChain(units(entries));
    logger.debug("Built {} chain: {}", chainType, chain.names());
    return chain;
  }

  private static void validate(ChainType chainType, List<Entry> entries) {
    List<MiddlewareMetadata> scope = new ArrayList<>(entries.size());
    Set<String> names = new HashSet<>();
    for (Entry entry : entries) {
      scope.add(entry.metadata);
      names.add(entry.metadata.getName());
    }
    try {
      DependencyValidator.validate(scope, names);
    } catch (MissingDependencyException | ConflictingMiddlewareException e) {
      throw new ChainValidationException(chainType, e);
    }
  }

  /**
   * Collects the enabled units of every category eligible for the chain type,
   * in a single priority order across categories.
   */
  private List<Entry> collect(ChainType chainType) {
    List<Entry> entries = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (MiddlewareCategory category : chainType.getCategories()) {
      for (Middleware unit : registry.getOrdered(category)) {
        if (seen.add(unit.getName())) {
          resolve(unit).ifPresent(entries::add);
        }
      }
    }
    entries.sort((a, b) -> MiddlewareMetadata.EXECUTION_ORDER.compare(a.metadata, b.metadata));
    return entries;
  }

  private List<Entry> filterByConfig(ChainType chainType, List<Entry> entries) {
    ChainConfig chainConfig = config.getChainConfig(chainType);
    if (!chainConfig.isEnabled()) {
      logger.debug("{} chain is disabled", chainType);
      return new ArrayList<>();
    }
    Set<String> allowed = new HashSet<>(chainConfig.getMiddlewareNames());
    List<Entry> filtered = new ArrayList<>(entries.size());
    for (Entry entry : entries) {
      String name = entry.metadata.getName();
      if (!config.isMiddlewareEnabled(name)) {
        continue;
      }
      if (!allowed.isEmpty() && !allowed.contains(name)) {
        continue;
      }
      filtered.add(entry);
    }
    return filtered;
  }

  @Override
  public Chain buildChainForPath(ChainType chainType, String path) {
    Objects.requireNonNull(path, "path");
    Chain base = createChain(chainType);

    List<Entry> entries = new ArrayList<>();
    Set<String> present = new LinkedHashSet<>();
    for (Middleware unit : base.list()) {
      resolve(unit).ifPresent(entry -> {
        entries.add(entry);
        present.add(unit.getName());
      });
    }

    boolean added = false;
    for (String name : registry.list()) {
      if (present.contains(name) || !config.isMiddlewareEnabled(name)) {
        continue;
      }
      List<String> paths = config.getMiddlewareSettings(name).getPaths();
      if (!paths.isEmpty() && PathMatcher.matchesAny(paths, path)) {
        Optional<Middleware> unit = registry.get(name);
        Optional<Entry> entry = unit.flatMap(this::resolve);
        if (entry.isPresent()) {
          entries.add(entry.get());
          present.add(name);
          added = true;
          logger.debug("Added {} to {} chain for path {}", name, chainType, path);
        }
      }
    }
    if (added) {
      entries.sort((a, b) -> MiddlewareMetadata.EXECUTION_ORDER.compare(a.metadata, b.metadata));
    }

    entries.removeIf(entry -> {
      MiddlewareSettings settings = config.getMiddlewareSettings(entry.metadata.getName());
      if (PathMatcher.matchesAny(settings.getExcludePaths(), path)) {
        return true;
      }
      return !settings.getIncludePaths().isEmpty() && !PathMatcher.matchesAny(settings.getIncludePaths(), path);
    });

    // Path additions and exclusions can break dependencies the base chain satisfied.
    validate(chainType, entries);
    return new MiddlewareChain(units(entries));
  }

  @Override
  public Chain getChainForPath(ChainType chainType, String path) {
    String key = "path:" + chainType.getValue() + ":" + path;

    cacheLock.readLock().lock();
    try {
      Chain cached = pathCache.get(key);
      if (cached != null) {
        return cached;
      }
    } finally {
      cacheLock.readLock().unlock();
    }

    Chain built = new UnmodifiableChain(buildChainForPath(chainType, path));

    Chain stored;
    cacheLock.writeLock().lock();
    try {
      Chain existing = pathCache.putIfAbsent(key, built);
      stored = existing != null ? existing : built;
    } finally {
      cacheLock.writeLock().unlock();
    }
    logger.debug("Cached chain {} with {} middleware", key, stored.length());
    return stored;
  }

  @Override
  public Optional<Chain> getChain(String name) {
    chainsLock.readLock().lock();
    try {
      return Optional.ofNullable(namedChains.get(name));
    } finally {
      chainsLock.readLock().unlock();
    }
  }

  @Override
  public void registerChain(String name, Chain chain) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(chain, "chain");
    chainsLock.writeLock().lock();
    try {
      if (namedChains.containsKey(name)) {
        throw new ChainAlreadyExistsException(name);
      }
      namedChains.put(name, chain);
    } finally {
      chainsLock.writeLock().unlock();
    }
    logger.debug("Registered chain: {}", name);
  }

  @Override
  public List<String> listChains() {
    chainsLock.readLock().lock();
    try {
      return new ArrayList<>(new TreeSet<>(namedChains.keySet()));
    } finally {
      chainsLock.readLock().unlock();
    }
  }

  @Override
  public boolean removeChain(String name) {
    chainsLock.writeLock().lock();
    try {
      return namedChains.remove(name) != null;
    } finally {
      chainsLock.writeLock().unlock();
    }
  }

  @Override
  public void clearCache() {
    int cleared;
    cacheLock.writeLock().lock();
    try {
      cleared = pathCache.size();
      pathCache.clear();
    } finally {
      cacheLock.writeLock().unlock();
    }
    logger.info("Cleared chain cache ({} entries)", cleared);
  }

  @Override
  public void validateConfiguration() {
    registry.validateDependencies();
    for (ChainType chainType : ChainType.values()) {
      createChain(chainType);
    }
    logger.info("Middleware configuration is valid: {} middleware, {} chain types", registry.count(),
        ChainType.values().length);
  }

  @Override
  public ChainInfo getChainInfo(ChainType chainType) {
    ChainConfig chainConfig = config.getChainConfig(chainType);
    List<String> names = new ArrayList<>();
    for (Entry entry : filterByConfig(chainType, collect(chainType))) {
      names.add(entry.metadata.getName());
    }
    return new ChainInfo(chainType, chainType.getValue(), chainType.getDescription(), chainType.getCategories(),
        names, chainConfig.isEnabled(), chainConfig.getPaths(), chainConfig.getCustomConfig());
  }

  @Override
  public Map<String, Duration> getChainPerformance() {
    buildLock.readLock().lock();
    try {
      return new TreeMap<>(buildTimes);
    } finally {
      buildLock.readLock().unlock();
    }
  }

  @Override
  public ChainCacheStats getCacheStats() {
    int cacheSize;
    cacheLock.readLock().lock();
    try {
      cacheSize = pathCache.size();
    } finally {
      cacheLock.readLock().unlock();
    }
    Map<String, Duration> performance = getChainPerformance();
    int chains;
    chainsLock.readLock().lock();
    try {
      chains = namedChains.size();
    } finally {
      chainsLock.readLock().unlock();
    }
    return new ChainCacheStats(cacheSize, performance, chains);
  }

  public MiddlewareRegistry getRegistry() {
    return registry;
  }

  public MiddlewareConfig getConfig() {
    return config;
  }

  private void recordBuildTime(ChainType chainType, Duration duration) {
    buildLock.writeLock().lock();
    try {
      buildTimes.put(chainType.getValue(), duration);
    } finally {
      buildLock.writeLock().unlock();
    }
  }

  private Optional<Entry> resolve(Middleware unit) {
    return registry.getMetadata(unit.getName()).map(metadata -> new Entry(unit, metadata));
  }

  private static List<Middleware> units(List<Entry> entries) {
    List<Middleware> units = new ArrayList<>(entries.size());
    for (Entry entry : entries) {
      units.add(entry.unit);
    }
    return units;
  }

  /** A unit paired with its registry metadata. */
  private static final class Entry {
    private final Middleware unit;
    private final MiddlewareMetadata metadata;

    Entry(Middleware unit, MiddlewareMetadata metadata) {
      this.unit = unit;
      this.metadata = metadata;
    }
  }
}
