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

import com.gatekit.core.GatekitException;
import com.gatekit.core.Request;
import com.gatekit.core.Response;

/**
 * MiddlewareNext represents the rest of the chain. Middleware calls it to pass
 * control to the next unit, or to the terminal handler when no units remain.
 * The same shape is used for terminal handlers.
 */
@FunctionalInterface
public interface MiddlewareNext {

  /**
   * Calls the next unit in the chain or the terminal handler.
   *
   * @param request
   *            the request (may be replaced by the middleware)
   * @param context
   *            the chain context
   * @return the response
   * @throws GatekitException
   *             if processing fails
   */
  Response apply(Request request, ChainContext context) throws GatekitException;
}
