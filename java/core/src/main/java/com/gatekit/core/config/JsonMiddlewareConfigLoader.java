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

package com.gatekit.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.gatekit.core.GatekitException;
import com.gatekit.core.JsonUtils;
import com.gatekit.core.middleware.ChainType;
import com.gatekit.core.middleware.MiddlewareCategory;

/**
 * JsonMiddlewareConfigLoader reads middleware and chain configuration from JSON
 * documents into an {@link InMemoryMiddlewareConfig}.
 *
 * <p>
 * The document has three optional top-level keys:
 *
 * <pre>{@code
 * {
 *   "disabled": ["no-csrf"],
 *   "middleware": {
 *     "csrf": {
 *       "category": "security",
 *       "priority": 60,
 *       "dependencies": ["session"],
 *       "conflicts": ["no-csrf"],
 *       "paths": ["/api/*"],
 *       "exclude_paths": ["/api/public/*"],
 *       "include_paths": ["/api/*"],
 *       "enabled": true,
 *       "settings": {"token_header": "X-CSRF-Token"}
 *     }
 *   },
 *   "chains": {
 *     "api": {"enabled": true, "middleware": ["session", "csrf"], "paths": ["/api/*"], "custom": {"timeout": 60}}
 *   }
 * }
 * }</pre>
 *
 * <p>
 * A unit that declares {@code paths} without {@code include_paths} is limited
 * to those paths. Unknown categories and chain types fail the load.
 */
public final class JsonMiddlewareConfigLoader {

  private static final Logger logger = LoggerFactory.getLogger(JsonMiddlewareConfigLoader.class);

  /** Classpath location of the bundled default configuration. */
  public static final String DEFAULTS_RESOURCE = "gatekit/middleware-defaults.json";

  private JsonMiddlewareConfigLoader() {
    // Utility class
  }

  /**
   * Loads the bundled default configuration.
   *
   * @return the configuration
   * @throws GatekitException
   *             if the resource is missing or invalid
   */
  public static InMemoryMiddlewareConfig defaults() throws GatekitException {
    return fromResource(DEFAULTS_RESOURCE);
  }

  /**
   * Loads configuration from a classpath resource.
   *
   * @param resource
   *            the resource name
   * @return the configuration
   * @throws GatekitException
   *             if the resource is missing or invalid
   */
  public static InMemoryMiddlewareConfig fromResource(String resource) throws GatekitException {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = JsonMiddlewareConfigLoader.class.getClassLoader();
    }
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        throw invalid("Middleware configuration resource not found: " + resource, null);
      }
      InMemoryMiddlewareConfig config = fromStream(in);
      logger.info("Loaded middleware configuration from classpath:{}", resource);
      return config;
    } catch (IOException e) {
      throw invalid("Failed to read middleware configuration resource " + resource, e);
    }
  }

  /**
   * Loads configuration from a file.
   *
   * @param file
   *            the file path
   * @return the configuration
   * @throws GatekitException
   *             if the file cannot be read or is invalid
   */
  public static InMemoryMiddlewareConfig fromFile(Path file) throws GatekitException {
    try (InputStream in = Files.newInputStream(file)) {
      InMemoryMiddlewareConfig config = fromStream(in);
      logger.info("Loaded middleware configuration from {}", file);
      return config;
    } catch (IOException e) {
      throw invalid("Failed to read middleware configuration file " + file, e);
    }
  }

  /**
   * Loads configuration from a stream. The stream is not closed.
   *
   * @param in
   *            the input stream
   * @return the configuration
   * @throws GatekitException
   *             if the document is invalid
   */
  public static InMemoryMiddlewareConfig fromStream(InputStream in) throws GatekitException {
    JsonNode root;
    try {
      root = JsonUtils.parseJson(in);
    } catch (GatekitException e) {
      throw invalid("Invalid middleware configuration: " + e.getMessage(), e);
    }
    return parse(root);
  }

  /**
   * Loads configuration from a JSON string.
   *
   * @param json
   *            the JSON document
   * @return the configuration
   * @throws GatekitException
   *             if the document is invalid
   */
  public static InMemoryMiddlewareConfig fromString(String json) throws GatekitException {
    JsonNode root;
    try {
      root = JsonUtils.parseJson(json);
    } catch (GatekitException e) {
      throw invalid("Invalid middleware configuration: " + e.getMessage(), e);
    }
    return parse(root);
  }

  private static InMemoryMiddlewareConfig parse(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw invalid("Middleware configuration must be a JSON object", null);
    }
    MiddlewareDocument document;
    try {
      document = JsonUtils.fromJsonNode(root, MiddlewareDocument.class);
    } catch (GatekitException e) {
      throw invalid("Invalid middleware configuration: " + e.getMessage(), e);
    }

    InMemoryMiddlewareConfig config = new InMemoryMiddlewareConfig();

    for (String name : strings(document.getDisabled(), "disabled")) {
      config.disable(name);
    }

    for (Map.Entry<String, MiddlewareDocument.UnitEntry> entry : document.getMiddleware().entrySet()) {
      parseMiddleware(config, entry.getKey(), entry.getValue());
    }

    for (Map.Entry<String, MiddlewareDocument.ChainEntry> entry : document.getChains().entrySet()) {
      ChainType chainType;
      try {
        chainType = ChainType.fromValue(entry.getKey());
      } catch (IllegalArgumentException e) {
        throw invalid(e.getMessage(), e);
      }
      config.setChainConfig(chainType, parseChain(entry.getKey(), entry.getValue()));
    }

    logger.debug("Parsed middleware configuration: {} units configured, {} disabled",
        config.getConfiguredMiddleware().size(), config.getDisabledMiddleware().size());
    return config;
  }

  private static void parseMiddleware(InMemoryMiddlewareConfig config, String name,
      MiddlewareDocument.UnitEntry entry) {
    String where = "middleware." + name;
    if (entry == null) {
      throw invalid("Configuration for middleware " + name + " must be an object", null);
    }
    MiddlewareSettings.Builder builder = MiddlewareSettings.builder();

    if (entry.getCategory() != null) {
      try {
        builder.category(MiddlewareCategory.fromValue(entry.getCategory()));
      } catch (IllegalArgumentException e) {
        throw invalid(e.getMessage() + " (" + where + ")", e);
      }
    }
    if (entry.getPriority() != null) {
      builder.priority(entry.getPriority());
    }

    List<String> paths = strings(entry.getPaths(), where + ".paths");
    builder.dependencies(strings(entry.getDependencies(), where + ".dependencies"))
        .conflicts(strings(entry.getConflicts(), where + ".conflicts")).paths(paths)
        .excludePaths(strings(entry.getExcludePaths(), where + ".exclude_paths"));
    if (entry.getIncludePaths() != null) {
      builder.includePaths(strings(entry.getIncludePaths(), where + ".include_paths"));
    } else {
      builder.includePaths(paths);
    }
    if (entry.getSettings() != null) {
      builder.custom(entry.getSettings());
    }

    config.setMiddlewareSettings(name, builder.build());

    if (!entry.isEnabled()) {
      config.disable(name);
    }
  }

  private static ChainConfig parseChain(String name, MiddlewareDocument.ChainEntry entry) {
    String where = "chains." + name;
    if (entry == null) {
      throw invalid("Configuration for chain " + name + " must be an object", null);
    }
    ChainConfig.Builder builder = ChainConfig.builder().enabled(entry.isEnabled())
        .middlewareNames(strings(entry.getMiddleware(), where + ".middleware"))
        .paths(strings(entry.getPaths(), where + ".paths"));
    if (entry.getCustom() != null) {
      builder.customConfig(entry.getCustom());
    }
    return builder.build();
  }

  private static List<String> strings(List<String> values, String where) {
    for (String value : values) {
      if (value == null) {
        throw invalid(where + " must not contain null", null);
      }
    }
    return values;
  }

  private static GatekitException invalid(String message, Throwable cause) {
    return GatekitException.builder().message(message).cause(cause).errorCode(GatekitException.INVALID_CONFIG)
        .build();
  }
}
