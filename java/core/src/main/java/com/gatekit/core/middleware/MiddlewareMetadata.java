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

import java.util.Comparator;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * MiddlewareMetadata is derived once per registration from the configuration
 * provider and kept by the registry until the unit is removed.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class MiddlewareMetadata {

  /** Orders by effective priority, then by registration sequence. */
  public static final Comparator<MiddlewareMetadata> EXECUTION_ORDER = Comparator
      .comparingInt(MiddlewareMetadata::getPriority).thenComparingLong(MiddlewareMetadata::getSequence);

  @JsonProperty("name")
  private final String name;

  @JsonProperty("category")
  private final MiddlewareCategory category;

  @JsonProperty("priority")
  private final int priority;

  @JsonProperty("dependencies")
  private final List<String> dependencies;

  @JsonProperty("conflicts")
  private final List<String> conflicts;

  @JsonIgnore
  private final long sequence;

  /**
   * Creates new metadata.
   *
   * @param name
   *            the unit name
   * @param category
   *            the resolved category
   * @param priority
   *            the effective priority
   * @param dependencies
   *            names of units that must be present alongside this one
   * @param conflicts
   *            names of units that must not be present alongside this one
   * @param sequence
   *            the registration sequence number, used to break priority ties
   */
  public MiddlewareMetadata(String name, MiddlewareCategory category, int priority, List<String> dependencies,
      List<String> conflicts, long sequence) {
    this.name = name;
    this.category = category;
    this.priority = priority;
    this.dependencies = List.copyOf(dependencies);
    this.conflicts = List.copyOf(conflicts);
    this.sequence = sequence;
  }

  public String getName() {
    return name;
  }

  public MiddlewareCategory getCategory() {
    return category;
  }

  /**
   * Returns the effective priority: the configured priority when one is
   * declared, otherwise the unit's own.
   *
   * @return the priority
   */
  public int getPriority() {
    return priority;
  }

  public List<String> getDependencies() {
    return dependencies;
  }

  public List<String> getConflicts() {
    return conflicts;
  }

  /**
   * Returns the registration sequence number. Units registered earlier have
   * smaller numbers.
   *
   * @return the sequence number
   */
  public long getSequence() {
    return sequence;
  }

  @Override
  public String toString() {
    return "MiddlewareMetadata{name=" + name + ", category=" + category + ", priority=" + priority + "}";
  }
}
