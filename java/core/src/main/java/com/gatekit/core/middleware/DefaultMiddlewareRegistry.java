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

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gatekit.core.AlreadyRegisteredException;
import com.gatekit.core.config.MiddlewareConfig;
import com.gatekit.core.config.MiddlewareSettings;

/**
 * DefaultMiddlewareRegistry is the default implementation of the
 * MiddlewareRegistry interface. All state is guarded by a single read-write
 * lock; the configuration provider is never called while the lock is held.
 */
public class DefaultMiddlewareRegistry implements MiddlewareRegistry {

  private static final Logger logger = LoggerFactory.getLogger(DefaultMiddlewareRegistry.class);

  private final MiddlewareConfig config;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Middleware> units = new LinkedHashMap<>();
  private final Map<String, MiddlewareMetadata> metadata = new HashMap<>();
  private final Map<MiddlewareCategory, List<String>> categories = new EnumMap<>(MiddlewareCategory.class);
  private long nextSequence;

  /**
   * Creates a new registry backed by the given configuration provider.
   *
   * @param config
   *            the configuration provider
   */
  public DefaultMiddlewareRegistry(MiddlewareConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  @Override
  public void register(String name, Middleware unit) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(unit, "unit");
    if (!name.equals(unit.getName())) {
      throw new IllegalArgumentException(
          "Registration name " + name + " does not match middleware name " + unit.getName());
    }
    if (contains(name)) {
      throw new AlreadyRegisteredException(name);
    }
    if (!config.isMiddlewareEnabled(name)) {
      logger.info("Middleware {} is disabled, skipping registration", name);
      return;
    }

    MiddlewareSettings settings = config.getMiddlewareSettings(name);
    MiddlewareCategory category = settings.getCategory();
    if (category == null) {
      logger.warn("Middleware {} has no configured category, defaulting to {}", name, MiddlewareCategory.BASIC);
      category = MiddlewareCategory.BASIC;
    }
    int priority = settings.getPriority() != null ? settings.getPriority() : unit.getPriority();

    lock.writeLock().lock();
    try {
      if (units.containsKey(name)) {
        throw new AlreadyRegisteredException(name);
      }
      MiddlewareMetadata meta = new MiddlewareMetadata(name, category, priority, settings.getDependencies(),
          settings.getConflicts(), nextSequence++);
      units.put(name, unit);
      metadata.put(name, meta);
      categories.computeIfAbsent(category, c -> new ArrayList<>()).add(name);
    } finally {
      lock.writeLock().unlock();
    }
    logger.debug("Registered middleware: {} (category={}, priority={})", name, category, priority);
  }

  private boolean contains(String name) {
    lock.readLock().lock();
    try {
      return units.containsKey(name);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Optional<Middleware> get(String name) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(units.get(name));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Optional<MiddlewareMetadata> getMetadata(String name) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(metadata.get(name));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<String> list() {
    lock.readLock().lock();
    try {
      return new ArrayList<>(new TreeSet<>(units.keySet()));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public boolean remove(String name) {
    lock.writeLock().lock();
    try {
      if (units.remove(name) == null) {
        return false;
      }
      MiddlewareMetadata meta = metadata.remove(name);
      if (meta != null) {
        List<String> names = categories.get(meta.getCategory());
        if (names != null) {
          names.remove(name);
        }
      }
    } finally {
      lock.writeLock().unlock();
    }
    logger.debug("Removed middleware: {}", name);
    return true;
  }

  @Override
  public void clear() {
    lock.writeLock().lock();
    try {
      units.clear();
      metadata.clear();
      categories.clear();
    } finally {
      lock.writeLock().unlock();
    }
    logger.debug("Cleared middleware registry");
  }

  @Override
  public int count() {
    lock.readLock().lock();
    try {
      return units.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<Middleware> getOrdered(MiddlewareCategory category) {
    List<MiddlewareMetadata> candidates = new ArrayList<>();
    Map<String, Middleware> byName = new HashMap<>();
    lock.readLock().lock();
    try {
      for (String name : categories.getOrDefault(category, List.of())) {
        candidates.add(metadata.get(name));
        byName.put(name, units.get(name));
      }
    } finally {
      lock.readLock().unlock();
    }

    candidates.removeIf(meta -> !config.isMiddlewareEnabled(meta.getName()));
    candidates.sort(MiddlewareMetadata.EXECUTION_ORDER);

    List<Middleware> ordered = new ArrayList<>(candidates.size());
    for (MiddlewareMetadata meta : candidates) {
      ordered.add(byName.get(meta.getName()));
    }
    return ordered;
  }

  @Override
  public void validateDependencies() {
    List<MiddlewareMetadata> snapshot = new ArrayList<>();
    Set<String> names;
    lock.readLock().lock();
    try {
      for (String name : units.keySet()) {
        snapshot.add(metadata.get(name));
      }
      names = Set.copyOf(units.keySet());
    } finally {
      lock.readLock().unlock();
    }
    DependencyValidator.validate(snapshot, names);
    logger.debug("Validated dependencies of {} middleware", snapshot.size());
  }
}
