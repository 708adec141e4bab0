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
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ChainCacheStats is a snapshot of an orchestrator's cache and build
 * statistics.
 */
public final class ChainCacheStats {

  @JsonProperty("cache_size")
  private final int cacheSize;

  @JsonProperty("build_times")
  private final Map<String, Duration> buildTimes;

  @JsonProperty("registered_chains_count")
  private final int registeredChains;

  /**
   * Creates a new ChainCacheStats.
   *
   * @param cacheSize
   *            the number of cached path chains
   * @param buildTimes
   *            the last build duration per chain type value
   * @param registeredChains
   *            the number of named chains
   */
  public ChainCacheStats(int cacheSize, Map<String, Duration> buildTimes, int registeredChains) {
    this.cacheSize = cacheSize;
    this.buildTimes = Map.copyOf(buildTimes);
    this.registeredChains = registeredChains;
  }

  public int getCacheSize() {
    return cacheSize;
  }

  public Map<String, Duration> getBuildTimes() {
    return buildTimes;
  }

  public int getRegisteredChains() {
    return registeredChains;
  }

  @Override
  public String toString() {
    return "ChainCacheStats{cacheSize=" + cacheSize + ", buildTimes=" + buildTimes + ", registeredChains="
        + registeredChains + "}";
  }
}
