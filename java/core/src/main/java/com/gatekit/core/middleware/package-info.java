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

/**
 * Middleware orchestration for Gatekit.
 *
 * <p>
 * This package assembles request-processing chains out of independently
 * registered middleware units:
 * <ul>
 * <li>{@link com.gatekit.core.middleware.MiddlewareRegistry} catalogs units and
 * their metadata</li>
 * <li>{@link com.gatekit.core.middleware.ChainOrchestrator} builds, validates,
 * specializes and caches chains per chain type and path</li>
 * <li>{@link com.gatekit.core.middleware.Chain} runs units in order</li>
 * </ul>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * InMemoryMiddlewareConfig config = JsonMiddlewareConfigLoader.defaults();
 * MiddlewareRegistry registry = new DefaultMiddlewareRegistry(config);
 * registry.register(CommonMiddleware.recovery());
 * registry.register(CommonMiddleware.requestId());
 *
 * ChainOrchestrator orchestrator = new DefaultChainOrchestrator(registry, config);
 * orchestrator.validateConfiguration();
 *
 * Chain chain = orchestrator.getChainForPath(ChainType.DEFAULT, "/");
 * Response response = chain.process(request, new ChainContext(ChainType.DEFAULT),
 * 		(req, ctx) -> Response.text(200, "hello"));
 * }
 * </pre>
 *
 * @see com.gatekit.core.middleware.Middleware
 * @see com.gatekit.core.middleware.MiddlewareChain
 * @see com.gatekit.core.middleware.CommonMiddleware
 */
package com.gatekit.core.middleware;
