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

import java.util.Map;

import com.gatekit.core.middleware.ChainType;

/**
 * Thrown when a chain cannot be built because its resolved units fail
 * dependency or conflict validation. The cause is a
 * {@link MissingDependencyException} or a
 * {@link ConflictingMiddlewareException}.
 */
public class ChainValidationException extends GatekitException {

  /** Error code carried by this exception. */
  public static final String CODE = "CHAIN_VALIDATION_FAILED";

  private final ChainType chainType;

  /**
   * Creates a new ChainValidationException.
   *
   * @param chainType
   *            the chain type that failed to build
   * @param cause
   *            the validation failure
   */
  public ChainValidationException(ChainType chainType, GatekitException cause) {
    super("Validation failed for " + chainType + " chain: " + cause.getMessage(), cause, CODE,
        Map.of("chainType", chainType.getValue()));
    this.chainType = chainType;
  }

  public ChainType getChainType() {
    return chainType;
  }
}
