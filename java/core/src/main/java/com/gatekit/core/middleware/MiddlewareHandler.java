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
 * MiddlewareHandler is the processing function of a middleware unit. It
 * receives the request, the chain context, and a "next" function that invokes
 * the rest of the chain.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * MiddlewareHandler poweredBy = (request, context, next) -> {
 * 	Response response = next.apply(request, context);
 * 	if (response != null) {
 * 		response.setHeader("X-Powered-By", "gatekit");
 * 	}
 * 	return response;
 * };
 * }
 * </pre>
 */
@FunctionalInterface
public interface MiddlewareHandler {

  /**
   * Processes the request. Returning without calling {@code next} short-circuits
   * the chain.
   *
   * @param request
   *            the request
   * @param context
   *            the chain context
   * @param next
   *            the continuation, callable at most once
   * @return the response, or null if no unit produced one
   * @throws GatekitException
   *             if processing fails
   */
  Response handle(Request request, ChainContext context, MiddlewareNext next) throws GatekitException;
}
