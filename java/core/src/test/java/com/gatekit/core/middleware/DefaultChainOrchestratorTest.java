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

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.gatekit.core.ChainAlreadyExistsException;
import com.gatekit.core.ChainValidationException;
import com.gatekit.core.ConflictingMiddlewareException;
import com.gatekit.core.JsonUtils;
import com.gatekit.core.MissingDependencyException;
import com.gatekit.core.config.ChainConfig;
import com.gatekit.core.config.InMemoryMiddlewareConfig;
import com.gatekit.core.config.JsonMiddlewareConfigLoader;
import com.gatekit.core.config.MiddlewareSettings;

/**
 * Unit tests for DefaultChainOrchestrator.
 */
class DefaultChainOrchestratorTest {

  private InMemoryMiddlewareConfig config;
  private DefaultMiddlewareRegistry registry;
  private DefaultChainOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    config = new InMemoryMiddlewareConfig();
    registry = new DefaultMiddlewareRegistry(config);
    orchestrator = new DefaultChainOrchestrator(registry, config);
  }

  private void register(String name, int priority) {
    registry.register(CommonMiddleware.passThrough(name, priority));
  }

  private void register(String name, int priority, MiddlewareSettings settings) {
    config.setMiddlewareSettings(name, settings);
    registry.register(CommonMiddleware.passThrough(name, priority));
  }

  private static MiddlewareSettings category(MiddlewareCategory category) {
    return MiddlewareSettings.builder().category(category).build();
  }

  @Test
  void testScenarioAApiChainOrdersByPriority() {
    register("cors", 10);
    register("auth", 20, category(MiddlewareCategory.AUTH));
    register("logging", 30);

    Chain chain = orchestrator.createChain(ChainType.API);

    assertEquals(3, chain.length());
    assertEquals(List.of("cors", "auth", "logging"), chain.names());
  }

  @Test
  void testScenarioBDisabledUnitIsDropped() {
    register("cors", 10);
    register("auth", 20, category(MiddlewareCategory.AUTH));
    register("logging", 30);

    config.disable("auth");
    Chain chain = orchestrator.createChain(ChainType.API);

    assertEquals(2, chain.length());
    assertEquals(List.of("cors", "logging"), chain.names());
  }

  @Test
  void testScenarioCMissingDependencyFailsValidation() {
    register("session", 100, MiddlewareSettings.builder().category(MiddlewareCategory.AUTH).dependsOn("auth").build());

    MissingDependencyException e = assertThrows(MissingDependencyException.class,
        () -> orchestrator.validateConfiguration());
    assertEquals("session", e.getMiddleware());
    assertEquals("auth", e.getDependency());
    assertTrue(e.getMessage().contains("session"));
    assertTrue(e.getMessage().contains("auth"));
  }

  @Test
  void testScenarioDPathRules() {
    register("cors", 10);
    register("auth", 20, MiddlewareSettings.builder().category(MiddlewareCategory.AUTH).paths("/*")
        .excludePaths("/public/*").build());
    register("admin", 30,
        MiddlewareSettings.builder().category(MiddlewareCategory.SECURITY).includePaths("/admin/*").build());

    Chain publicChain = orchestrator.buildChainForPath(ChainType.DEFAULT, "/public/info");
    assertFalse(publicChain.get("auth").isPresent());
    assertFalse(publicChain.get("admin").isPresent());

    Chain adminChain = orchestrator.buildChainForPath(ChainType.DEFAULT, "/admin/users");
    assertEquals(List.of("cors", "auth", "admin"), adminChain.names());
  }

  @Test
  void testOrderingIsGlobalAcrossCategories() {
    register("cors", 20);
    register("session", 10, category(MiddlewareCategory.AUTH));
    register("logging", 5, category(MiddlewareCategory.LOGGING));
    register("csrf", 15, category(MiddlewareCategory.SECURITY));

    assertEquals(List.of("logging", "session", "csrf", "cors"), orchestrator.createChain(ChainType.API).names());
  }

  @Test
  void testPriorityTiesKeepRegistrationOrderAcrossCategories() {
    register("first", 50, category(MiddlewareCategory.AUTH));
    register("second", 50);
    register("third", 50, category(MiddlewareCategory.SECURITY));

    assertEquals(List.of("first", "second", "third"), orchestrator.createChain(ChainType.API).names());
  }

  @Test
  void testCategoryFiltering() {
    register("recovery", 10);
    register("csrf", 60, category(MiddlewareCategory.SECURITY));
    register("session", 100, category(MiddlewareCategory.AUTH));
    register("custom", 1, category(MiddlewareCategory.CUSTOM));

    assertEquals(List.of("recovery"), orchestrator.createChain(ChainType.STATIC).names());
    assertEquals(List.of("recovery", "csrf"), orchestrator.createChain(ChainType.PUBLIC).names());
    assertEquals(List.of("recovery", "csrf", "session"), orchestrator.createChain(ChainType.AUTH).names());
  }

  @Test
  void testBuildIsDeterministic() {
    register("cors", 20);
    register("recovery", 10);
    register("session", 100, category(MiddlewareCategory.AUTH));

    Chain first = orchestrator.buildChainForPath(ChainType.WEB, "/dashboard");
    Chain second = orchestrator.buildChainForPath(ChainType.WEB, "/dashboard");

    assertNotSame(first, second);
    assertEquals(first.names(), second.names());
    assertEquals(orchestrator.createChain(ChainType.WEB).names(), orchestrator.buildChain(ChainType.WEB).names());
  }

  @Test
  void testGetChainForPathCachesByKey() {
    register("cors", 20);

    Chain first = orchestrator.getChainForPath(ChainType.API, "/api/users");
    assertEquals(1, orchestrator.getCacheStats().getCacheSize());

    Chain second = orchestrator.getChainForPath(ChainType.API, "/api/users");
    assertSame(first, second);
    assertEquals(1, orchestrator.getCacheStats().getCacheSize());

    orchestrator.getChainForPath(ChainType.API, "/api/orders");
    assertEquals(2, orchestrator.getCacheStats().getCacheSize());

    orchestrator.getChainForPath(ChainType.DEFAULT, "/api/users");
    assertEquals(3, orchestrator.getCacheStats().getCacheSize());
  }

  @Test
  void testClearCacheForcesRebuild() {
    register("cors", 20);
    orchestrator.registerChain("custom", MiddlewareChain.of(CommonMiddleware.passThrough("x", 1)));
    Chain first = orchestrator.getChainForPath(ChainType.API, "/api");

    orchestrator.clearCache();

    assertEquals(0, orchestrator.getCacheStats().getCacheSize());
    assertNotSame(first, orchestrator.getChainForPath(ChainType.API, "/api"));
    assertTrue(orchestrator.getChain("custom").isPresent());
    assertEquals(1, registry.count());
  }

  @Test
  void testConcurrentColdLookupsConverge() throws Exception {
    register("cors", 20);
    register("recovery", 10);
    int threads = 8;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<Chain>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(executor.submit(() -> {
          start.await();
          return orchestrator.getChainForPath(ChainType.DEFAULT, "/home");
        }));
      }
      start.countDown();
      Chain expected = futures.get(0).get(10, TimeUnit.SECONDS);
      for (Future<Chain> future : futures) {
        assertSame(expected, future.get(10, TimeUnit.SECONDS));
      }
      assertSame(expected, orchestrator.getChainForPath(ChainType.DEFAULT, "/home"));
      assertEquals(1, orchestrator.getCacheStats().getCacheSize());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void testAllowListOmittingDependencyFails() {
    register("a", 10);
    register("b", 20, MiddlewareSettings.builder().dependsOn("a").build());
    config.setChainConfig(ChainType.API, ChainConfig.builder().middleware("b").build());

    ChainValidationException e = assertThrows(ChainValidationException.class,
        () -> orchestrator.createChain(ChainType.API));

    assertEquals(ChainType.API, e.getChainType());
    assertEquals(ChainValidationException.CODE, e.getErrorCode());
    MissingDependencyException cause = assertInstanceOf(MissingDependencyException.class, e.getCause());
    assertEquals("b", cause.getMiddleware());
    assertEquals("a", cause.getDependency());
  }

  @Test
  void testConflictingUnitsInOneChainFail() {
    register("c", 10, MiddlewareSettings.builder().conflictsWith("d").build());
    register("d", 20);

    ChainValidationException e = assertThrows(ChainValidationException.class,
        () -> orchestrator.createChain(ChainType.DEFAULT));

    assertEquals(ChainType.DEFAULT, e.getChainType());
    assertInstanceOf(ConflictingMiddlewareException.class, e.getCause());
  }

  @Test
  void testAllowListCanResolveConflict() {
    register("c", 10, MiddlewareSettings.builder().conflictsWith("d").build());
    register("d", 20);
    config.setChainConfig(ChainType.DEFAULT, ChainConfig.builder().middleware("c").build());

    assertEquals(List.of("c"), orchestrator.createChain(ChainType.DEFAULT).names());
  }

  @Test
  void testFailedBuildIsNotCached() {
    register("a", 10);
    register("b", 20, MiddlewareSettings.builder().dependsOn("a").build());
    config.setChainConfig(ChainType.API, ChainConfig.builder().middleware("b").build());

    assertThrows(ChainValidationException.class, () -> orchestrator.getChainForPath(ChainType.API, "/api/x"));
    assertEquals(0, orchestrator.getCacheStats().getCacheSize());

    config.setChainConfig(ChainType.API, ChainConfig.builder().middleware("a", "b").build());

    assertEquals(List.of("a", "b"), orchestrator.getChainForPath(ChainType.API, "/api/x").names());
    assertEquals(1, orchestrator.getCacheStats().getCacheSize());
  }

  @Test
  void testDisabledChainIsEmpty() {
    register("recovery", 10);
    config.setChainConfig(ChainType.STATIC, ChainConfig.builder().enabled(false).build());

    assertEquals(0, orchestrator.createChain(ChainType.STATIC).length());
    assertEquals(1, orchestrator.createChain(ChainType.DEFAULT).length());
  }

  @Test
  void testDisabledUnitIsAbsentFromEveryChain() {
    config.disable("csrf");
    register("csrf", 60, category(MiddlewareCategory.SECURITY));
    register("cors", 20);

    for (ChainType chainType : ChainType.values()) {
      assertFalse(orchestrator.createChain(chainType).get("csrf").isPresent(), chainType.getValue());
    }
  }

  @Test
  void testPathAddsMatchingUnitInPriorityOrder() {
    register("recovery", 10);
    register("timeout", 40);
    register("rate-limit", 30, MiddlewareSettings.builder().category(MiddlewareCategory.SECURITY).paths("/api/*")
        .build());

    assertEquals(List.of("recovery", "rate-limit", "timeout"),
        orchestrator.buildChainForPath(ChainType.STATIC, "/api/users").names());
    assertEquals(List.of("recovery", "timeout"),
        orchestrator.buildChainForPath(ChainType.STATIC, "/static/app.js").names());
  }

  @Test
  void testExclusionRunsAfterAddition() {
    register("recovery", 10);
    register("csrf", 60, MiddlewareSettings.builder().category(MiddlewareCategory.CUSTOM).paths("/api/*")
        .excludePaths("/api/public/*").build());

    assertTrue(orchestrator.buildChainForPath(ChainType.DEFAULT, "/api/forms").get("csrf").isPresent());
    assertFalse(orchestrator.buildChainForPath(ChainType.DEFAULT, "/api/public/info").get("csrf").isPresent());
  }

  @Test
  void testPathAddedUnitWithMissingDependencyFails() {
    register("recovery", 10);
    register("session", 100, category(MiddlewareCategory.AUTH));
    register("csrf", 60, MiddlewareSettings.builder().category(MiddlewareCategory.CUSTOM).dependsOn("session")
        .paths("/api/*").build());

    ChainValidationException e = assertThrows(ChainValidationException.class,
        () -> orchestrator.buildChainForPath(ChainType.STATIC, "/api/x"));
    assertEquals(ChainType.STATIC, e.getChainType());
    MissingDependencyException cause = assertInstanceOf(MissingDependencyException.class, e.getCause());
    assertEquals("csrf", cause.getMiddleware());
    assertEquals("session", cause.getDependency());

    assertThrows(ChainValidationException.class, () -> orchestrator.getChainForPath(ChainType.STATIC, "/api/x"));
    assertEquals(0, orchestrator.getCacheStats().getCacheSize());
    assertEquals(List.of("recovery"), orchestrator.getChainForPath(ChainType.STATIC, "/static/app.js").names());
  }

  @Test
  void testExcludingDependencyFailsPathChain() {
    register("session", 100, MiddlewareSettings.builder().category(MiddlewareCategory.AUTH)
        .excludePaths("/api/public/*").build());
    register("auth", 110, MiddlewareSettings.builder().category(MiddlewareCategory.AUTH).dependsOn("session")
        .build());

    assertEquals(List.of("session", "auth"), orchestrator.buildChainForPath(ChainType.AUTH, "/api/users").names());
    ChainValidationException e = assertThrows(ChainValidationException.class,
        () -> orchestrator.buildChainForPath(ChainType.AUTH, "/api/public/info"));
    assertInstanceOf(MissingDependencyException.class, e.getCause());
  }

  @Test
  void testPathAddedConflictFails() {
    register("recovery", 10);
    register("no-csrf", 50);
    register("csrf", 60, MiddlewareSettings.builder().category(MiddlewareCategory.CUSTOM).conflictsWith("no-csrf")
        .paths("/forms/*").build());

    ChainValidationException e = assertThrows(ChainValidationException.class,
        () -> orchestrator.buildChainForPath(ChainType.DEFAULT, "/forms/signup"));
    assertInstanceOf(ConflictingMiddlewareException.class, e.getCause());
    assertEquals(List.of("recovery", "no-csrf"), orchestrator.buildChainForPath(ChainType.DEFAULT, "/home").names());
  }

  @Test
  void testCachedChainIsReadOnly() {
    register("recovery", 10);
    register("cors", 20);

    Chain cached = orchestrator.getChainForPath(ChainType.DEFAULT, "/home");

    assertThrows(UnsupportedOperationException.class, () -> cached.add(CommonMiddleware.passThrough("evil", 1)));
    assertThrows(UnsupportedOperationException.class,
        () -> cached.insert(0, CommonMiddleware.passThrough("evil", 1)));
    assertThrows(UnsupportedOperationException.class, () -> cached.remove("cors"));
    assertThrows(UnsupportedOperationException.class, cached::clear);
    assertThrows(UnsupportedOperationException.class, () -> cached.names().add("evil"));

    Chain again = orchestrator.getChainForPath(ChainType.DEFAULT, "/home");
    assertSame(cached, again);
    assertEquals(orchestrator.buildChainForPath(ChainType.DEFAULT, "/home").names(), again.names());

    Chain copy = cached.copy();
    copy.add(CommonMiddleware.passThrough("audit", 90));
    assertEquals(List.of("recovery", "cors", "audit"), copy.names());
    assertEquals(List.of("recovery", "cors"), cached.names());
  }

  @Test
  void testNonMatchingExclusionIsNoOp() {
    register("recovery", 10);
    register("cors", 20, MiddlewareSettings.builder().excludePaths("/nowhere/*").build());

    int before = orchestrator.buildChainForPath(ChainType.DEFAULT, "/home").length();
    int after = orchestrator.buildChainForPath(ChainType.DEFAULT, "/home").length();

    assertEquals(2, before);
    assertEquals(before, after);
  }

  @Test
  void testDefaultConfigurationValidates() {
    InMemoryMiddlewareConfig defaults = JsonMiddlewareConfigLoader.defaults();
    DefaultMiddlewareRegistry defaultRegistry = new DefaultMiddlewareRegistry(defaults);
    for (String name : List.of("recovery", "cors", "request-id", "timeout", "security-headers", "csrf", "rate-limit",
        "input-validation", "logging", "session", "authentication", "authorization")) {
      defaultRegistry.register(CommonMiddleware.passThrough(name, Middleware.DEFAULT_PRIORITY));
    }
    DefaultChainOrchestrator defaultOrchestrator = new DefaultChainOrchestrator(defaultRegistry, defaults);

    assertDoesNotThrow(defaultOrchestrator::validateConfiguration);
    assertEquals(List.of("security-headers", "csrf", "rate-limit", "session", "authentication", "authorization"),
        defaultOrchestrator.createChain(ChainType.API).names());
    assertEquals(List.of("security-headers", "csrf", "rate-limit", "session", "authentication", "authorization"),
        defaultOrchestrator.getChainForPath(ChainType.API, "/api/v1").names());
    ChainValidationException e = assertThrows(ChainValidationException.class,
        () -> defaultOrchestrator.getChainForPath(ChainType.DEFAULT, "/api/v1"));
    MissingDependencyException cause = assertInstanceOf(MissingDependencyException.class, e.getCause());
    assertEquals("csrf", cause.getMiddleware());
    assertEquals("session", cause.getDependency());
    assertEquals(List.of("recovery", "cors", "request-id", "timeout"),
        defaultOrchestrator.getChainForPath(ChainType.DEFAULT, "/health").names());
  }

  @Test
  void testGetChainInfo() {
    register("cors", 20);
    register("session", 100, category(MiddlewareCategory.AUTH));
    register("recovery", 10);
    config.setChainConfig(ChainType.API, ChainConfig.builder().middleware("session", "cors").paths("/api/*")
        .custom("timeout", 60).build());

    ChainInfo info = orchestrator.getChainInfo(ChainType.API);

    assertEquals(ChainType.API, info.getType());
    assertEquals("api", info.getName());
    assertEquals(ChainType.API.getDescription(), info.getDescription());
    assertEquals(ChainType.API.getCategories(), info.getCategories());
    assertEquals(List.of("cors", "session"), info.getMiddleware());
    assertTrue(info.isEnabled());
    assertEquals(List.of("/api/*"), info.getPathPatterns());
    assertEquals(60, info.getCustomConfig().get("timeout"));
  }

  @Test
  void testBuildTimesRecordedOnSuccessAndFailure() {
    register("c", 10, MiddlewareSettings.builder().conflictsWith("d").build());
    register("d", 20);
    config.setChainConfig(ChainType.API, ChainConfig.builder().middleware("c").build());

    orchestrator.createChain(ChainType.API);
    assertThrows(ChainValidationException.class, () -> orchestrator.createChain(ChainType.DEFAULT));

    Map<String, Duration> performance = orchestrator.getChainPerformance();
    assertTrue(performance.containsKey("api"));
    assertTrue(performance.containsKey("default"));
    assertFalse(performance.containsKey("web"));
  }

  @Test
  void testNamedChains() {
    Chain admin = MiddlewareChain.of(CommonMiddleware.passThrough("audit", 10));
    orchestrator.registerChain("zeta", new MiddlewareChain());
    orchestrator.registerChain("admin", admin);

    assertSame(admin, orchestrator.getChain("admin").orElseThrow());
    assertEquals(List.of("admin", "zeta"), orchestrator.listChains());
    ChainAlreadyExistsException e = assertThrows(ChainAlreadyExistsException.class,
        () -> orchestrator.registerChain("admin", new MiddlewareChain()));
    assertEquals(ChainAlreadyExistsException.CODE, e.getErrorCode());

    assertTrue(orchestrator.removeChain("admin"));
    assertFalse(orchestrator.removeChain("admin"));
    assertFalse(orchestrator.getChain("admin").isPresent());
    assertEquals(1, orchestrator.getCacheStats().getRegisteredChains());
  }

  @Test
  void testCacheStatsSerialization() {
    register("cors", 20);
    orchestrator.getChainForPath(ChainType.API, "/api");
    orchestrator.registerChain("named", new MiddlewareChain());

    String json = JsonUtils.toJson(orchestrator.getCacheStats());

    assertTrue(json.contains("\"cache_size\":1"));
    assertTrue(json.contains("\"registered_chains_count\":1"));
    assertTrue(json.contains("\"build_times\":{\"api\":"));
  }
}
