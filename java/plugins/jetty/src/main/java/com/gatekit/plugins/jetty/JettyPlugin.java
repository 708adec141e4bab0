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

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.jetty.http.HttpCookie;
import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.Callback;
import org.eclipse.jetty.util.Fields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gatekit.core.GatekitException;
import com.gatekit.core.JsonUtils;
import com.gatekit.core.ServerPlugin;
import com.gatekit.core.middleware.Chain;
import com.gatekit.core.middleware.ChainContext;
import com.gatekit.core.middleware.ChainOrchestrator;
import com.gatekit.core.middleware.ChainType;
import com.gatekit.core.middleware.ChainTypeResolver;
import com.gatekit.core.middleware.Middleware;
import com.gatekit.core.middleware.MiddlewareNext;

/**
 * JettyPlugin serves HTTP requests through Gatekit chains.
 *
 * <p>
 * Every request except the health endpoint is converted to a Gatekit
 * {@link com.gatekit.core.Request}, routed to the chain for its path and run
 * with the route registered for the path as terminal handler. The resulting
 * Gatekit response is written back to Jetty.
 *
 * <p>
 * Example usage:
 *
 * <pre>{@code
 * JettyPlugin jetty = new JettyPlugin(JettyPluginOptions.builder().port(8080)
 *     .route("/api/users", (request, context) -> Response.json(200, users)).build());
 *
 * Gatekit gatekit = Gatekit.builder().use(CommonMiddleware.recovery()).plugin(jetty).build();
 *
 * // Start and block
 * jetty.start();
 * }</pre>
 */
public class JettyPlugin implements ServerPlugin {

  private static final Logger logger = LoggerFactory.getLogger(JettyPlugin.class);

  private final JettyPluginOptions options;
  private Server server;
  private ServerConnector connector;
  private ChainOrchestrator orchestrator;

  /**
   * Creates a JettyPlugin with default options.
   */
  public JettyPlugin() {
    this(JettyPluginOptions.builder().build());
  }

  /**
   * Creates a JettyPlugin with the specified options.
   *
   * @param options
   *            the plugin options
   */
  public JettyPlugin(JettyPluginOptions options) {
    this.options = options;
  }

  /**
   * Creates a JettyPlugin with the specified port.
   *
   * @param port
   *            the HTTP port
   * @return a new JettyPlugin
   */
  public static JettyPlugin create(int port) {
    return new JettyPlugin(JettyPluginOptions.builder().port(port).build());
  }

  @Override
  public String getName() {
    return "jetty";
  }

  @Override
  public List<Middleware> init() {
    // Jetty plugin doesn't provide middleware itself
    return Collections.emptyList();
  }

  @Override
  public List<Middleware> init(ChainOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
    return Collections.emptyList();
  }

  /**
   * Starts the Jetty server and blocks until it is stopped.
   *
   * @throws Exception
   *             if the server cannot be started or if interrupted while waiting
   */
  @Override
  public void start() throws Exception {
    startAsync();
    server.join();
  }

  /**
   * Starts the Jetty server without blocking.
   *
   * @throws Exception
   *             if the server cannot be started
   */
  @Override
  public synchronized void startAsync() throws Exception {
    if (server != null) {
      return;
    }

    if (orchestrator == null) {
      throw new GatekitException(
          "Orchestrator not set. Make sure JettyPlugin is added to Gatekit before calling start().");
    }

    Server newServer = new Server();

    ServerConnector newConnector = new ServerConnector(newServer);
    newConnector.setPort(options.getPort());
    newConnector.setHost(options.getHost());
    newServer.addConnector(newConnector);

    newServer.setHandler(new GatekitHandler());
    newServer.start();

    server = newServer;
    connector = newConnector;
    logger.info("Jetty server started on {}:{}", options.getHost(), connector.getLocalPort());
  }

  /**
   * Stops the Jetty server.
   *
   * @throws Exception
   *             if the server cannot be stopped
   */
  @Override
  public synchronized void stop() throws Exception {
    if (server != null) {
      server.stop();
      server = null;
      connector = null;
      logger.info("Jetty server stopped");
    }
  }

  /**
   * Returns the port the server is listening on.
   *
   * @return the bound port while running, otherwise the configured port
   */
  @Override
  public synchronized int getPort() {
    return connector != null ? connector.getLocalPort() : options.getPort();
  }

  /**
   * Returns true if the server is currently running.
   *
   * @return true if the server is running, false otherwise
   */
  @Override
  public synchronized boolean isRunning() {
    return server != null && server.isRunning();
  }

  static com.gatekit.core.Request toGatekitRequest(Request request, byte[] body) {
    com.gatekit.core.Request.Builder builder = com.gatekit.core.Request.builder().method(request.getMethod())
        .path(request.getHttpURI().getPath()).remoteAddr(Request.getRemoteAddr(request)).body(body);
    for (HttpField field : request.getHeaders()) {
      builder.header(field.getName(), field.getValue());
    }
    Fields query = Request.extractQueryParameters(request);
    for (Fields.Field field : query) {
      for (String value : field.getValues()) {
        builder.queryParam(field.getName(), value);
      }
    }
    for (HttpCookie cookie : Request.getCookies(request)) {
      builder.cookie(cookie.getName(), cookie.getValue());
    }
    return builder.build();
  }

  private static void write(com.gatekit.core.Response result, Response response, Callback callback) {
    response.setStatus(result.getStatusCode());
    for (Map.Entry<String, List<String>> header : result.getHeaders().entrySet()) {
      for (String value : header.getValue()) {
        response.getHeaders().add(header.getKey(), value);
      }
    }
    for (String cookie : result.getCookies()) {
      response.getHeaders().add("Set-Cookie", cookie);
    }
    response.write(true, ByteBuffer.wrap(result.getBody()), callback);
  }

  private static void writeJson(int status, Object value, Response response, Callback callback) {
    response.setStatus(status);
    response.getHeaders().put("Content-Type", "application/json");
    response.write(true, ByteBuffer.wrap(JsonUtils.toJson(value).getBytes(StandardCharsets.UTF_8)), callback);
  }

  /**
   * Handler routing every request through its Gatekit chain.
   */
  private class GatekitHandler extends Handler.Abstract {
    @Override
    public boolean handle(Request request, Response response, Callback callback) throws Exception {
      String path = request.getHttpURI().getPath();
      if (path == null || path.isEmpty()) {
        path = "/";
      }

      if (path.equals(options.getHealthPath())) {
        writeJson(200, Map.of("status", "ok"), response, callback);
        return true;
      }

      try {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (InputStream in = Request.asInputStream(request)) {
          in.transferTo(baos);
        }

        ChainType chainType = ChainTypeResolver.resolve(path);
        Chain chain = options.isCacheChains() ? orchestrator.getChainForPath(chainType, path)
            : orchestrator.buildChainForPath(chainType, path);
        MiddlewareNext terminal = options.getRoutes().getOrDefault(path, options.getFallback());

        com.gatekit.core.Response result = chain.process(toGatekitRequest(request, baos.toByteArray()),
            new ChainContext(chainType), terminal);
        if (result == null) {
          logger.debug("No response produced for {} {}", request.getMethod(), path);
          result = com.gatekit.core.Response.of(204);
        }
        write(result, response, callback);
        return true;
      } catch (Exception e) {
        logger.error("Error handling request {} {}", request.getMethod(), path, e);

        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", e.getMessage() != null ? e.getMessage() : "Internal Server Error");
        if (e instanceof GatekitException && ((GatekitException) e).getErrorCode() != null) {
          error.put("code", ((GatekitException) e).getErrorCode());
        }
        writeJson(500, error, response, callback);
        return true;
      }
    }
  }
}
