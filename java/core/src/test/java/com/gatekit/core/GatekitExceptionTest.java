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
package com.gatekit.core;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.gatekit.core.middleware.ChainType;

/**
 * Unit tests for GatekitException and its subclasses.
 */
class GatekitExceptionTest {

  @Test
  void testConstructorWithMessageOnly() {
    GatekitException exception = new GatekitException("boom");

    assertEquals("boom", exception.getMessage());
    assertNull(exception.getCause());
    assertNull(exception.getErrorCode());
    assertNull(exception.getDetails());
  }

  @Test
  void testBuilder() {
    RuntimeException cause = new RuntimeException("root");

    GatekitException exception = GatekitException.builder().message("bad config").cause(cause)
        .errorCode(GatekitException.INVALID_CONFIG).details(Map.of("field", "priority")).build();

    assertEquals("bad config", exception.getMessage());
    assertSame(cause, exception.getCause());
    assertEquals(GatekitException.INVALID_CONFIG, exception.getErrorCode());
    assertEquals(Map.of("field", "priority"), exception.getDetails());
  }

  @Test
  void testBuilderRequiresMessage() {
    assertThrows(IllegalStateException.class, () -> GatekitException.builder().build());
  }

  @Test
  void testAlreadyRegistered() {
    AlreadyRegisteredException exception = new AlreadyRegisteredException("cors");

    assertEquals("cors", exception.getName());
    assertEquals(AlreadyRegisteredException.CODE, exception.getErrorCode());
    assertTrue(exception.getMessage().contains("cors"));
  }

  @Test
  void testMissingDependencyMessage() {
    MissingDependencyException exception = new MissingDependencyException("csrf", "session");

    assertEquals("csrf", exception.getMiddleware());
    assertEquals("session", exception.getDependency());
    assertEquals("Middleware csrf depends on session, which is not present", exception.getMessage());
    assertEquals(MissingDependencyException.CODE, exception.getErrorCode());
  }

  @Test
  void testConflictingMiddleware() {
    ConflictingMiddlewareException exception = new ConflictingMiddlewareException("csrf", "no-csrf");

    assertEquals(ConflictingMiddlewareException.CODE, exception.getErrorCode());
    assertTrue(exception.getMessage().contains("csrf"));
    assertTrue(exception.getMessage().contains("no-csrf"));
  }

  @Test
  void testChainValidationWrapsCause() {
    MissingDependencyException cause = new MissingDependencyException("csrf", "session");

    ChainValidationException exception = new ChainValidationException(ChainType.API, cause);

    assertEquals(ChainType.API, exception.getChainType());
    assertSame(cause, exception.getCause());
    assertEquals(ChainValidationException.CODE, exception.getErrorCode());
  }

  @Test
  void testChainAlreadyExists() {
    ChainAlreadyExistsException exception = new ChainAlreadyExistsException("checkout");

    assertEquals(ChainAlreadyExistsException.CODE, exception.getErrorCode());
    assertTrue(exception.getMessage().contains("checkout"));
  }
}
