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
import static org.mockito.Mockito.*;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.gatekit.core.AlreadyRegisteredException;
import com.gatekit.core.ConflictingMiddlewareException;
import com.gatekit.core.MissingDependencyException;
import com.gatekit.core.Request;
import com.gatekit.core.Response;
import com.gatekit.core.config.InMemoryMiddlewareConfig;
import com.gatekit.core.config.MiddlewareConfig;
import com.gatekit.core.config.MiddlewareSettings;

/**
 * Unit tests for DefaultMiddlewareRegistry.
 */
@ExtendWith(MockitoExtension.class)
class DefaultMiddlewareRegistryTest {

  private InMemoryMiddlewareConfig config;
  private DefaultMiddlewareRegistry registry;

  @Mock
  private MiddlewareConfig mockConfig;

  @BeforeEach
  void setUp() {
    config = new InMemoryMiddlewareConfig();
    registry = new DefaultMiddlewareRegistry(config);
  }

  private void category(String name, MiddlewareCategory category) {
    config.setMiddlewareSettings(name, MiddlewareSettings.builder().category(category).build());
  }

  @Test
  void testRegisterAndGet() {
    Middleware cors = CommonMiddleware.passThrough("cors", 20);

    registry.register("cors", cors);

    assertSame(cors, registry.get("cors").orElseThrow());
    assertEquals(1, registry.count());
    assertFalse(registry.get("missing").isPresent());
  }

  @Test
  void testRegisterDuplicateThrows() {
    registry.register(CommonMiddleware.passThrough("cors", 20));

    AlreadyRegisteredException e = assertThrows(AlreadyRegisteredException.class,
        () -> registry.register(CommonMiddleware.passThrough("cors", 30)));
    assertEquals("cors", e.getName());
    assertEquals(AlreadyRegisteredException.CODE, e.getErrorCode());
  }

  @Test
  void testRegisterNameMustMatchUnit() {
    assertThrows(IllegalArgumentException.class,
        () -> registry.register("other", CommonMiddleware.passThrough("cors", 20)));
  }

  @Test
  void testListIsSorted() {
    registry.register(CommonMiddleware.passThrough("session", 100));
    registry.register(CommonMiddleware.passThrough("cors", 20));
    registry.register(CommonMiddleware.passThrough("logging", 90));

    assertEquals(List.of("cors", "logging", "session"), registry.list());
  }

  @Test
  void testDisabledRegistrationIsAcceptedButNotCatalogued() {
    config.disable("csrf");

    assertDoesNotThrow(() -> registry.register(CommonMiddleware.passThrough("csrf", 60)));

    assertEquals(0, registry.count());
    assertFalse(registry.get("csrf").isPresent());
    for (MiddlewareCategory category : MiddlewareCategory.values()) {
      assertTrue(registry.getOrdered(category).isEmpty());
    }
  }

  @Test
  void testUncategorizedDefaultsToBasic() {
    registry.register(CommonMiddleware.passThrough("cors", 20));

    MiddlewareMetadata metadata = registry.getMetadata("cors").orElseThrow();
    assertEquals(MiddlewareCategory.BASIC, metadata.getCategory());
    assertEquals(1, registry.getOrdered(MiddlewareCategory.BASIC).size());
  }

  @Test
  void testConfiguredPriorityOverridesUnitPriority() {
    config.setMiddlewareSettings("cors", MiddlewareSettings.builder().priority(5).build());
    registry.register(CommonMiddleware.passThrough("cors", 20));
    registry.register(CommonMiddleware.passThrough("recovery", 10));

    assertEquals(5, registry.getMetadata("cors").orElseThrow().getPriority());
    assertEquals(List.of("cors", "recovery"), names(registry.getOrdered(MiddlewareCategory.BASIC)));
  }

  @Test
  void testUnitWithoutPriorityUsesDefault() {
    registry.register(new Middleware() {
      @Override
      public String getName() {
        return "plain";
      }

      @Override
      public Response handle(Request request, ChainContext context, MiddlewareNext next) {
        return next.apply(request, context);
      }
    });

    assertEquals(Middleware.DEFAULT_PRIORITY, registry.getMetadata("plain").orElseThrow().getPriority());
  }

  @Test
  void testGetOrderedSortsByPriorityThenRegistrationOrder() {
    registry.register(CommonMiddleware.passThrough("timeout", 40));
    registry.register(CommonMiddleware.passThrough("b-tie", 30));
    registry.register(CommonMiddleware.passThrough("recovery", 10));
    registry.register(CommonMiddleware.passThrough("a-tie", 30));

    assertEquals(List.of("recovery", "b-tie", "a-tie", "timeout"),
        names(registry.getOrdered(MiddlewareCategory.BASIC)));
  }

  @Test
  void testGetOrderedFiltersByCategory() {
    category("session", MiddlewareCategory.AUTH);
    category("logging", MiddlewareCategory.LOGGING);
    registry.register(CommonMiddleware.passThrough("cors", 20));
    registry.register(CommonMiddleware.passThrough("session", 100));
    registry.register(CommonMiddleware.passThrough("logging", 90));

    assertEquals(List.of("session"), names(registry.getOrdered(MiddlewareCategory.AUTH)));
    assertEquals(List.of("logging"), names(registry.getOrdered(MiddlewareCategory.LOGGING)));
    assertTrue(registry.getOrdered(MiddlewareCategory.CUSTOM).isEmpty());
  }

  @Test
  void testGetOrderedReflectsRuntimeDisable() {
    registry.register(CommonMiddleware.passThrough("cors", 20));
    registry.register(CommonMiddleware.passThrough("recovery", 10));

    config.disable("cors");
    assertEquals(List.of("recovery"), names(registry.getOrdered(MiddlewareCategory.BASIC)));

    config.enable("cors");
    assertEquals(List.of("recovery", "cors"), names(registry.getOrdered(MiddlewareCategory.BASIC)));
  }

  @Test
  void testRemovePurgesIndexes() {
    category("session", MiddlewareCategory.AUTH);
    registry.register(CommonMiddleware.passThrough("session", 100));

    assertTrue(registry.remove("session"));
    assertFalse(registry.remove("session"));

    assertFalse(registry.get("session").isPresent());
    assertFalse(registry.getMetadata("session").isPresent());
    assertTrue(registry.getOrdered(MiddlewareCategory.AUTH).isEmpty());

    registry.register(CommonMiddleware.passThrough("session", 100));
    assertEquals(1, registry.count());
  }

  @Test
  void testClear() {
    registry.register(CommonMiddleware.passThrough("cors", 20));
    registry.register(CommonMiddleware.passThrough("recovery", 10));

    registry.clear();

    assertEquals(0, registry.count());
    assertTrue(registry.list().isEmpty());
    assertTrue(registry.getOrdered(MiddlewareCategory.BASIC).isEmpty());
  }

  @Test
  void testValidateDependenciesMissing() {
    config.setMiddlewareSettings("authorization",
        MiddlewareSettings.builder().category(MiddlewareCategory.AUTH).dependsOn("authentication").build());
    registry.register(CommonMiddleware.passThrough("authorization", 120));

    MissingDependencyException e = assertThrows(MissingDependencyException.class,
        () -> registry.validateDependencies());
    assertEquals("authorization", e.getMiddleware());
    assertEquals("authentication", e.getDependency());

    registry.register(CommonMiddleware.passThrough("authentication", 110));
    assertDoesNotThrow(() -> registry.validateDependencies());
  }

  @Test
  void testValidateDependenciesConflict() {
    config.setMiddlewareSettings("csrf", MiddlewareSettings.builder().conflictsWith("no-csrf").build());
    registry.register(CommonMiddleware.passThrough("csrf", 60));
    assertDoesNotThrow(() -> registry.validateDependencies());

    registry.register(CommonMiddleware.passThrough("no-csrf", 60));

    ConflictingMiddlewareException e = assertThrows(ConflictingMiddlewareException.class,
        () -> registry.validateDependencies());
    assertEquals("csrf", e.getMiddleware());
    assertEquals("no-csrf", e.getConflict());
  }

  @Test
  void testValidateDependenciesChecksDependenciesBeforeConflicts() {
    config.setMiddlewareSettings("a", MiddlewareSettings.builder().conflictsWith("b").build());
    config.setMiddlewareSettings("b", MiddlewareSettings.builder().dependsOn("missing").build());
    registry.register(CommonMiddleware.passThrough("a", 10));
    registry.register(CommonMiddleware.passThrough("b", 20));

    assertThrows(MissingDependencyException.class, () -> registry.validateDependencies());
  }

  @Test
  void testRegistrationConsultsProvider() {
    when(mockConfig.isMiddlewareEnabled("session")).thenReturn(true);
    when(mockConfig.getMiddlewareSettings("session"))
        .thenReturn(MiddlewareSettings.builder().category(MiddlewareCategory.AUTH).priority(100).build());
    DefaultMiddlewareRegistry mocked = new DefaultMiddlewareRegistry(mockConfig);

    mocked.register(CommonMiddleware.passThrough("session", 1));

    MiddlewareMetadata metadata = mocked.getMetadata("session").orElseThrow();
    assertEquals(MiddlewareCategory.AUTH, metadata.getCategory());
    assertEquals(100, metadata.getPriority());
    verify(mockConfig).getMiddlewareSettings("session");
  }

  private static List<String> names(List<Middleware> units) {
    return units.stream().map(Middleware::getName).collect(Collectors.toList());
  }
}
