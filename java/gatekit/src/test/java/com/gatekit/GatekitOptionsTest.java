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
package com.gatekit;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for GatekitOptions.
 */
class GatekitOptionsTest {

  @Test
  void testDefaults() {
    GatekitOptions options = GatekitOptions.builder().build();

    assertTrue(options.isValidateOnStartup());
    assertTrue(options.isUseDefaultConfig());
    assertNotNull(options.getEnvironment());
  }

  @Test
  void testBuilder() {
    GatekitOptions options = GatekitOptions.builder().validateOnStartup(false).useDefaultConfig(false)
        .configPath("/etc/gatekit/middleware.json").environment("prod").build();

    assertFalse(options.isValidateOnStartup());
    assertFalse(options.isUseDefaultConfig());
    assertEquals("/etc/gatekit/middleware.json", options.getConfigPath());
    assertEquals("prod", options.getEnvironment());
    assertFalse(options.isDevelopment());
  }

  @Test
  void testDevelopment() {
    assertTrue(GatekitOptions.builder().environment("dev").build().isDevelopment());
  }
}
