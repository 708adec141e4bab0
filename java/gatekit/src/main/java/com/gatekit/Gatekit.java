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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gatekit.core.GatekitException;
import com.gatekit.core.Plugin;
import com.gatekit.core.Request;
import com.gatekit.core.Response;
import com.gatekit.core.ServerPlugin;
import com.gatekit.core.config.InMemoryMiddlewareConfig;
import com.gatekit.core.config.JsonMiddlewareConfigLoader;
import com.gatekit.core.config.MiddlewareConfig;
import com.gatekit.core.middleware.Chain;
import com.gatekit.core.middleware.ChainContext;
import com.gatekit.core.middleware.ChainOrchestrator;
import com.gatekit.core.middleware.ChainType;
import com.gatekit.core.middleware.ChainTypeResolver;
import com.gatekit.core.middleware.DefaultChainOrchestrator;
import com.gatekit.core.middleware.DefaultMiddlewareRegistry;
import com.gatekit.core.middleware.Middleware;
import com.gatekit.core.middleware.MiddlewareNext;
import com.gatekit.core.middleware.MiddlewareRegistry;

/**
 * Gatekit is the main entry point. It wires a {@link MiddlewareConfig}, a
 * {@link MiddlewareRegistry} and a {@link ChainOrchestrator} together,
 * registers the application's units and the units contributed by plugins, and
 * validates the dependency graph before any request is served.
 *
 * <p>
 * Example usage:
 *
 * <pre>{@code
 * Gatekit gatekit = Gatekit.builder()
 *     .use(CommonMiddleware.recovery())
 *     .use(CommonMiddleware.requestId())
 *     .plugin(new JettyPlugin(JettyPluginOptions.builder().port(8080).build()))
 *     .build();
 *
 * Response response = gatekit.process(request, (req, ctx) -> Response.text(200, "hello"));
 * }</pre>
 */
public class Gatekit {

  private static final Logger logger = LoggerFactory.getLogger(Gatekit.class);

  private final GatekitOptions options;
  private final MiddlewareConfig config;
  private final MiddlewareRegistry registry;
  private final ChainOrchestrator orchestrator;
  private final List<Plugin> plugins;

  /**
   * Creates a new Gatekit instance with default options.
   */
  public Gatekit() {
    this(GatekitOptions.builder().build());
  }

  /**
   * Creates a new Gatekit instance with the given options. The configuration is
   * resolved from the options.
   *
   * @param options
   *            the Gatekit options
   */
  public Gatekit(GatekitOptions options) {
    this(options, resolveConfig(options));
  }

  /**
   * Creates a new Gatekit instance with the given options and configuration.
   *
   * @param options
   *            the Gatekit options
   * @param config
   *            the middleware configuration
   */
  public Gatekit(GatekitOptions options, MiddlewareConfig config) {
    this.options = options;
    this.config = config;
    this.registry = new DefaultMiddlewareRegistry(config);
    this.orchestrator = new DefaultChainOrchestrator(registry, config);
    this.plugins = new ArrayList<>();
  }

  /**
   * Creates a new Gatekit builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a Gatekit instance with the given plugins.
   *
   * @param plugins
   *            the plugins to use
   * @return a configured Gatekit instance
   */
  public static Gatekit create(Plugin... plugins) {
    Builder builder = builder();
    for (Plugin plugin : plugins) {
      builder.plugin(plugin);
    }
    return builder.build();
  }

  private static MiddlewareConfig resolveConfig(GatekitOptions options) {
    if (options.getConfigPath() != null && !options.getConfigPath().isEmpty()) {
      return JsonMiddlewareConfigLoader.fromFile(Path.of(options.getConfigPath()));
    }
    if (options.isUseDefaultConfig()) {
      return JsonMiddlewareConfigLoader.defaults();
    }
    return new InMemoryMiddlewareConfig();
  }

  /**
   * Initializes plugins and validates the configuration. Units returned by
   * plugins are registered first so that they take part in validation.
   *
   * @throws GatekitException
   *             if a plugin fails to initialize or validation fails
   */
  public void init() {
    for (Plugin plugin : plugins) {
      try {
        List<Middleware> units = plugin.init(orchestrator);
        for (Middleware unit : units) {
          registry.register(unit);
        }
        logger.info("Initialized plugin: {}", plugin.getName());
      } catch (RuntimeException e) {
        logger.error("Failed to initialize plugin: {}", plugin.getName(), e);
        throw new GatekitException("Failed to initialize plugin: " + plugin.getName(), e);
      }
    }

    if (options.isValidateOnStartup()) {
      orchestrator.validateConfiguration();
      logger.info("Middleware configuration validated ({} units registered, environment {})", registry.count(),
          options.getEnvironment());
    }
  }

  /**
   * Registers a unit under its own name. Cached chains are dropped so that the
   * unit is picked up by the next lookup.
   *
   * @param unit
   *            the unit
   * @return this instance
   */
  public Gatekit use(Middleware unit) {
    return use(unit.getName(), unit);
  }

  /**
   * Registers a unit under the given name, which must equal the unit's name.
   *
   * @param name
   *            the registration name
   * @param unit
   *            the unit
   * @return this instance
   */
  public Gatekit use(String name, Middleware unit) {
    registry.register(name, unit);
    orchestrator.clearCache();
    return this;
  }

  /**
   * Returns the chain for a request path. The chain type is derived from the
   * path and the chain comes from the orchestrator's cache.
   *
   * @param path
   *            the request path
   * @return the chain
   */
  public Chain chainFor(String path) {
    return orchestrator.getChainForPath(ChainTypeResolver.resolve(path), path);
  }

  /**
   * Processes a request through the chain for its path with a fresh context.
   *
   * @param request
   *            the request
   * @param terminal
   *            the handler run after the last unit
   * @return the response
   */
  public Response process(Request request, MiddlewareNext terminal) {
    ChainType chainType = ChainTypeResolver.resolve(request.getPath());
    Chain chain = orchestrator.getChainForPath(chainType, request.getPath());
    return chain.process(request, new ChainContext(chainType), terminal);
  }

  /**
   * Processes a request through the chain for its path.
   *
   * @param request
   *            the request
   * @param context
   *            the chain context
   * @param terminal
   *            the handler run after the last unit
   * @return the response
   */
  public Response process(Request request, ChainContext context, MiddlewareNext terminal) {
    return chainFor(request.getPath()).process(request, context, terminal);
  }

  public MiddlewareRegistry getRegistry() {
    return registry;
  }

  public ChainOrchestrator getOrchestrator() {
    return orchestrator;
  }

  public MiddlewareConfig getConfig() {
    return config;
  }

  public GatekitOptions getOptions() {
    return options;
  }

  public List<Plugin> getPlugins() {
    return Collections.unmodifiableList(plugins);
  }

  /**
   * Stops every running server plugin.
   */
  public void stop() {
    for (Plugin plugin : plugins) {
      if (plugin instanceof ServerPlugin) {
        ServerPlugin server = (ServerPlugin) plugin;
        if (!server.isRunning()) {
          continue;
        }
        try {
          server.stop();
        } catch (Exception e) {
          logger.warn("Error stopping server plugin: {}", plugin.getName(), e);
        }
      }
    }
  }

  /**
   * Builder for Gatekit.
   */
  public static class Builder {
    private final List<Plugin> plugins = new ArrayList<>();
    private final Map<String, Middleware> units = new LinkedHashMap<>();
    private GatekitOptions options = GatekitOptions.builder().build();
    private MiddlewareConfig config;

    /**
     * Sets the Gatekit options.
     *
     * @param options
     *            the options
     * @return this builder
     */
    public Builder options(GatekitOptions options) {
      this.options = options;
      return this;
    }

    /**
     * Sets the middleware configuration, overriding the one the options would
     * select.
     *
     * @param config
     *            the configuration
     * @return this builder
     */
    public Builder config(MiddlewareConfig config) {
      this.config = config;
      return this;
    }

    public Builder use(Middleware unit) {
      return use(unit.getName(), unit);
    }

    public Builder use(String name, Middleware unit) {
      this.units.put(name, unit);
      return this;
    }

    /**
     * Adds a plugin.
     *
     * @param plugin
     *            the plugin to add
     * @return this builder
     */
    public Builder plugin(Plugin plugin) {
      this.plugins.add(plugin);
      return this;
    }

    /**
     * Disables startup validation.
     *
     * @return this builder
     */
    public Builder skipValidation() {
      this.options = GatekitOptions.builder().validateOnStartup(false)
          .useDefaultConfig(options.isUseDefaultConfig()).configPath(options.getConfigPath())
          .environment(options.getEnvironment()).build();
      return this;
    }

    /**
     * Builds and initializes the Gatekit instance.
     *
     * @return the configured Gatekit instance
     * @throws GatekitException
     *             if registration, plugin initialization or validation fails
     */
    public Gatekit build() {
      Gatekit gatekit = config != null ? new Gatekit(options, config) : new Gatekit(options);
      for (Map.Entry<String, Middleware> entry : units.entrySet()) {
        gatekit.registry.register(entry.getKey(), entry.getValue());
      }
      gatekit.plugins.addAll(plugins);
      gatekit.init();
      return gatekit;
    }
  }
}
