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

/**
 * ChainTypeResolver maps a request path to the {@link ChainType} that serves
 * it. Rules are checked in order and the first match wins:
 *
 * <ol>
 * <li>{@code /api} to {@link ChainType#API}</li>
 * <li>{@code /dashboard}, {@code /forms} to {@link ChainType#WEB}</li>
 * <li>{@code /login}, {@code /signup}, {@code /logout},
 * {@code /forgot-password}, {@code /reset-password} (exact) to
 * {@link ChainType#AUTH}</li>
 * <li>{@code /admin} to {@link ChainType#ADMIN}</li>
 * <li>{@code /public} to {@link ChainType#PUBLIC}</li>
 * <li>{@code /static}, {@code /assets} to {@link ChainType#STATIC}</li>
 * </ol>
 *
 * Anything else resolves to {@link ChainType#DEFAULT}. Prefix rules match the
 * prefix itself or any path below it, so {@code /apis} is not an API path.
 */
public final class ChainTypeResolver {

  private static final List<String> API_PREFIXES = List.of("/api");
  private static final List<String> WEB_PREFIXES = List.of("/dashboard", "/forms");
  private static final List<String> AUTH_PATHS = List.of("/login", "/signup", "/logout", "/forgot-password",
      "/reset-password");
  private static final List<String> ADMIN_PREFIXES = List.of("/admin");
  private static final List<String> PUBLIC_PREFIXES = List.of("/public");
  private static final List<String> STATIC_PREFIXES = List.of("/static", "/assets");

  private ChainTypeResolver() {
    // Utility class
  }

  /**
   * Resolves the chain type for a path.
   *
   * @param path
   *            the request path
   * @return the chain type, never null
   */
  public static ChainType resolve(String path) {
    if (path == null || path.isEmpty()) {
      return ChainType.DEFAULT;
    }
    if (underAny(path, API_PREFIXES)) {
      return ChainType.API;
    }
    if (underAny(path, WEB_PREFIXES)) {
      return ChainType.WEB;
    }
    if (AUTH_PATHS.contains(path)) {
      return ChainType.AUTH;
    }
    if (underAny(path, ADMIN_PREFIXES)) {
      return ChainType.ADMIN;
    }
    if (underAny(path, PUBLIC_PREFIXES)) {
      return ChainType.PUBLIC;
    }
    if (underAny(path, STATIC_PREFIXES)) {
      return ChainType.STATIC;
    }
    return ChainType.DEFAULT;
  }

  private static boolean underAny(String path, List<String> prefixes) {
    for (String prefix : prefixes) {
      if (path.equals(prefix) || path.startsWith(prefix + "/")) {
        return true;
      }
    }
    return false;
  }
}
