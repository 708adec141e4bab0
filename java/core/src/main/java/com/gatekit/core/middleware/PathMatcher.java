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
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * PathMatcher matches request paths against the patterns used in middleware
 * and chain configuration. Strategies are tried in a fixed order and the first
 * that matches wins:
 *
 * <ol>
 * <li>{@link Strategy#EXACT}: the pattern equals the path.</li>
 * <li>{@link Strategy#PREFIX}: a pattern ending in {@code /*} matches any path
 * starting with the part before it, so {@code /api/*} matches {@code /api} and
 * {@code /api/v1/users}.</li>
 * <li>{@link Strategy#GLOB}: {@code *} matches any sequence of characters,
 * including {@code /}. The whole path must match.</li>
 * <li>{@link Strategy#PATTERN}: shell-style segment pattern. {@code *} and
 * {@code ?} do not cross {@code /}; {@code [...]} is a character class, negated
 * by a leading {@code ^} or {@code !}. Malformed patterns never match.</li>
 * </ol>
 */
public final class PathMatcher {

  /**
   * The strategy that produced a match.
   */
  public enum Strategy {
    EXACT, PREFIX, GLOB, PATTERN
  }

  private static final Map<String, Pattern> GLOBS = new ConcurrentHashMap<>();

  private PathMatcher() {
    // Utility class
  }

  /**
   * Returns true if the path matches the pattern.
   *
   * @param pattern
   *            the pattern
   * @param path
   *            the request path
   * @return true on match
   */
  public static boolean matches(String pattern, String path) {
    return match(pattern, path).isPresent();
  }

  /**
   * Returns true if the path matches any of the patterns.
   *
   * @param patterns
   *            the patterns
   * @param path
   *            the request path
   * @return true if at least one pattern matches
   */
  public static boolean matchesAny(Collection<String> patterns, String path) {
    for (String pattern : patterns) {
      if (matches(pattern, path)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Matches the path against the pattern and reports which strategy matched.
   *
   * @param pattern
   *            the pattern
   * @param path
   *            the request path
   * @return the matching strategy, or empty if none matched
   */
  public static Optional<Strategy> match(String pattern, String path) {
    if (pattern == null || path == null) {
      return Optional.empty();
    }
    if (pattern.equals(path)) {
      return Optional.of(Strategy.EXACT);
    }
    if (pattern.endsWith("/*") && path.startsWith(pattern.substring(0, pattern.length() - 2))) {
      return Optional.of(Strategy.PREFIX);
    }
    if (pattern.indexOf('*') >= 0 && glob(pattern).matcher(path).matches()) {
      return Optional.of(Strategy.GLOB);
    }
    if (isWellFormed(pattern) && matchSegments(pattern, 0, path, 0)) {
      return Optional.of(Strategy.PATTERN);
    }
    return Optional.empty();
  }

  private static Pattern glob(String pattern) {
    return GLOBS.computeIfAbsent(pattern, p -> {
      StringBuilder regex = new StringBuilder("^");
      int start = 0;
      int star;
      while ((star = p.indexOf('*', start)) >= 0) {
        if (star > start) {
          regex.append(Pattern.quote(p.substring(start, star)));
        }
        regex.append(".*");
        start = star + 1;
      }
      if (start < p.length()) {
        regex.append(Pattern.quote(p.substring(start)));
      }
      return Pattern.compile(regex.append('$').toString());
    });
  }

  private static boolean isWellFormed(String pattern) {
    boolean[] ignored = new boolean[1];
    int i = 0;
    while (i < pattern.length()) {
      char c = pattern.charAt(i);
      if (c == '\\') {
        if (i + 1 >= pattern.length()) {
          return false;
        }
        i += 2;
      } else if (c == '[') {
        i = scanClass(pattern, i, '\0', ignored);
        if (i < 0) {
          return false;
        }
      } else {
        i++;
      }
    }
    return true;
  }

  private static boolean matchSegments(String p, int pi, String s, int si) {
    while (pi < p.length()) {
      char c = p.charAt(pi);
      if (c == '*') {
        while (pi < p.length() && p.charAt(pi) == '*') {
          pi++;
        }
        for (int k = si;; k++) {
          if (matchSegments(p, pi, s, k)) {
            return true;
          }
          if (k >= s.length() || s.charAt(k) == '/') {
            return false;
          }
        }
      }
      if (si >= s.length()) {
        return false;
      }
      char ch = s.charAt(si);
      if (c == '?') {
        if (ch == '/') {
          return false;
        }
        pi++;
      } else if (c == '[') {
        boolean[] matched = new boolean[1];
        pi = scanClass(p, pi, ch, matched);
        if (!matched[0]) {
          return false;
        }
      } else {
        if (c == '\\') {
          pi++;
          c = p.charAt(pi);
        }
        if (c != ch) {
          return false;
        }
        pi++;
      }
      si++;
    }
    return si == s.length();
  }

  /**
   * Scans the character class starting at {@code start}, recording in
   * {@code result[0]} whether {@code ch} is in the class.
   *
   * @return the index after the closing bracket, or -1 if the class is malformed
   */
  private static int scanClass(String p, int start, char ch, boolean[] result) {
    int i = start + 1;
    boolean negated = false;
    if (i < p.length() && (p.charAt(i) == '^' || p.charAt(i) == '!')) {
      negated = true;
      i++;
    }
    boolean matched = false;
    int ranges = 0;
    while (true) {
      if (i >= p.length()) {
        return -1;
      }
      char c = p.charAt(i);
      if (c == ']' && ranges > 0) {
        i++;
        break;
      }
      if (c == '-' || c == ']') {
        return -1;
      }
      if (c == '\\') {
        if (++i >= p.length()) {
          return -1;
        }
        c = p.charAt(i);
      }
      char lo = c;
      char hi = c;
      i++;
      if (i < p.length() && p.charAt(i) == '-') {
        if (++i >= p.length()) {
          return -1;
        }
        hi = p.charAt(i);
        if (hi == '\\') {
          if (++i >= p.length()) {
            return -1;
          }
          hi = p.charAt(i);
        } else if (hi == '-' || hi == ']') {
          return -1;
        }
        i++;
      }
      if (lo <= ch && ch <= hi) {
        matched = true;
      }
      ranges++;
    }
    result[0] = matched != negated;
    return i;
  }
}
