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

import java.util.Collection;
import java.util.Set;

import com.gatekit.core.ConflictingMiddlewareException;
import com.gatekit.core.MissingDependencyException;

/**
 * Checks declared dependencies and conflicts within a scope of unit names.
 * Dependencies are checked for every unit before any conflict.
 */
final class DependencyValidator {

  private DependencyValidator() {
  }

  static void validate(Collection<MiddlewareMetadata> units, Set<String> scope) {
    for (MiddlewareMetadata unit : units) {
      for (String dependency : unit.getDependencies()) {
        if (!scope.contains(dependency)) {
          throw new MissingDependencyException(unit.getName(), dependency);
        }
      }
    }
    for (MiddlewareMetadata unit : units) {
      for (String conflict : unit.getConflicts()) {
        if (scope.contains(conflict)) {
          throw new ConflictingMiddlewareException(unit.getName(), conflict);
        }
      }
    }
  }
}
