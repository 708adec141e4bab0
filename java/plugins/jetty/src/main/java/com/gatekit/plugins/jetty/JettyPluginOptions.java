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
package com.gatekit.plugins.jetty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.gatekit.core.Response;
import com.gatekit.core.middleware.MiddlewareNext;

/**
 * Options for configuring the Jetty plugin.
 */
public class JettyPluginOptions {

  private final int port;
  private final String host;
  private final String healthPath;
  private final Map<String, MiddlewareNext> routes;
  private final MiddlewareNext fallback;
  private final boolean cacheChains;

  private JettyPluginOptions(Builder builder) {
    this.port = builder.port;
    this.host = builder.host;
    this.healthPath = builder.healthPath;
    this.routes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.routes));
    this.fallback = builder.fallback;
    this.cacheChains = builder.cacheChains;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Gets the HTTP port. Port 0 binds an ephemeral port.
   *
   * @return the port
   */
  public int getPort() {
    return port;
  }

  /**
   * Gets the host to bind to.
   *
   * @return the host
   */
  public String getHost() {
    return host;
  }

  /**
   * Gets the path of the health endpoint, which bypasses every chain.
   *
   * @return the health path
   */
  public String getHealthPath() {
    return healthPath;
  }

  /**
   * Gets the terminal handlers keyed by exact request path.
   *
   * @return the routes
   */
  public Map<String, MiddlewareNext> getRoutes() {
    return routes;
  }

  /**
   * Gets the terminal handler for paths without a route.
   *
   * @return the fallback handler
   */
  public MiddlewareNext getFallback() {
    return fallback;
  }

  /**
   * Whether chains are looked up through the orchestrator's path cache. The
   * cache holds one entry per distinct request path and is only bounded by
   * {@code clearCache()}; servers exposed to arbitrary paths can turn it off
   * and build a chain per request instead.
   *
   * @return true if path chains are cached
   */
  public boolean isCacheChains() {
    return cacheChains;
  }

  /**
   * Builder for JettyPluginOptions.
   */
  public static class Builder {
    private int port = 8080;
    private String host = "0.0.0.0";
    private String healthPath = "/health";
    private final Map<String, MiddlewareNext> routes = new LinkedHashMap<>();
    private MiddlewareNext fallback = (request, context) -> Response.json(404, Map.of("error", "Not Found"));
    private boolean cacheChains = true;

    public Builder port(int port) {
      this.port = port;
      return this;
    }

    public Builder host(String host) {
      this.host = host;
      return this;
    }

    public Builder healthPath(String healthPath) {
      this.healthPath = healthPath;
      return this;
    }

    /**
     * Adds a terminal handler for an exact request path.
     *
     * @param path
     *            the request path
     * @param handler
     *            the handler run after the chain
     * @return this builder
     */
    public Builder route(String path, MiddlewareNext handler) {
      this.routes.put(path, handler);
      return this;
    }

    public Builder fallback(MiddlewareNext fallback) {
      this.fallback = fallback;
      return this;
    }

    public Builder cacheChains(boolean cacheChains) {
      this.cacheChains = cacheChains;
      return this;
    }

    public JettyPluginOptions build() {
      return new JettyPluginOptions(this);
    }
  }
}
