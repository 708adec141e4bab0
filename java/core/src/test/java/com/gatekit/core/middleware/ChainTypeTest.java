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

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/**
 * Tests for ChainType and MiddlewareCategory.
 */
class ChainTypeTest {

  @ParameterizedTest
  @EnumSource(ChainType.class)
  void testEveryChainTypeAdmitsBasic(ChainType chainType) {
    assertTrue(chainType.getCategories().contains(MiddlewareCategory.BASIC));
    assertFalse(chainType.getCategories().contains(MiddlewareCategory.CUSTOM));
    assertNotNull(chainType.getDescription());
  }

  @ParameterizedTest
  @EnumSource(ChainType.class)
  void testFromValueRoundTrip(ChainType chainType) {
    assertEquals(chainType, ChainType.fromValue(chainType.getValue()));
    assertEquals(chainType.getValue(), chainType.toString());
  }

  @Test
  void testCategoryTable() {
    assertEquals(List.of(MiddlewareCategory.BASIC, MiddlewareCategory.SECURITY, MiddlewareCategory.LOGGING),
        ChainType.DEFAULT.getCategories());
    assertEquals(List.of(MiddlewareCategory.BASIC, MiddlewareCategory.SECURITY, MiddlewareCategory.AUTH,
        MiddlewareCategory.LOGGING), ChainType.API.getCategories());
    assertEquals(List.of(MiddlewareCategory.BASIC, MiddlewareCategory.SECURITY, MiddlewareCategory.AUTH),
        ChainType.AUTH.getCategories());
    assertEquals(List.of(MiddlewareCategory.BASIC, MiddlewareCategory.SECURITY), ChainType.PUBLIC.getCategories());
    assertEquals(List.of(MiddlewareCategory.BASIC), ChainType.STATIC.getCategories());
  }

  @Test
  void testFromValueUnknown() {
    assertThrows(IllegalArgumentException.class, () -> ChainType.fromValue("internal"));
    assertThrows(IllegalArgumentException.class, () -> MiddlewareCategory.fromValue("metrics"));
  }

  @Test
  void testCategoryFromValueIgnoresCase() {
    assertEquals(MiddlewareCategory.SECURITY, MiddlewareCategory.fromValue("Security"));
    assertEquals("auth", MiddlewareCategory.AUTH.toString());
  }
}
