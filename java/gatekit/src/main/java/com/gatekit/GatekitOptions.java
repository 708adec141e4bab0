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

/**
 * GatekitOptions contains startup options for Gatekit.
 */
public class GatekitOptions {

  /** Environment variable naming a JSON middleware configuration file. */
  public static final String CONFIG_PATH_ENV = "GATEKIT_MIDDLEWARE_CONFIG";

  /** Environment variable naming the deployment environment. */
  public static final String ENV_ENV = "GATEKIT_ENV";

  private final boolean validateOnStartup;
  private final boolean useDefaultConfig;
  private final String configPath;
  private final String environment;

  private GatekitOptions(Builder builder) {
    this.validateOnStartup = builder.validateOnStartup;
    this.useDefaultConfig = builder.useDefaultConfig;
    this.configPath = builder.configPath;
    this.environment = builder.environment;
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
   * Returns whether the dependency graph is validated when Gatekit starts. A
   * failed validation aborts startup.
   *
   * @return true if validation runs at startup
   */
  public boolean isValidateOnStartup() {
    return validateOnStartup;
  }

  /**
   * Returns whether the bundled default configuration is loaded when no
   * configuration path is set.
   *
   * @return true if the bundled defaults are used
   */
  public boolean isUseDefaultConfig() {
    return useDefaultConfig;
  }

  /**
   * Returns the path of a JSON middleware configuration file.
   *
   * @return the path, or null when none is set
   */
  public String getConfigPath() {
    return configPath;
  }

  public String getEnvironment() {
    return environment;
  }

  /**
   * Returns true when running in the development environment.
   *
   * @return true for the {@code dev} environment
   */
  public boolean isDevelopment() {
    return "dev".equals(environment);
  }

  /**
   * Builder for GatekitOptions.
   */
  public static class Builder {
    private boolean validateOnStartup = true;
    private boolean useDefaultConfig = true;
    private String configPath = System.getenv(CONFIG_PATH_ENV);
    private String environment = environmentFromEnv();

    private static String environmentFromEnv() {
      String env = System.getenv(ENV_ENV);
      return env != null && !env.isEmpty() ? env : "dev";
    }

    public Builder validateOnStartup(boolean validateOnStartup) {
      this.validateOnStartup = validateOnStartup;
      return this;
    }

    public Builder useDefaultConfig(boolean useDefaultConfig) {
      this.useDefaultConfig = useDefaultConfig;
      return this;
    }

    public Builder configPath(String configPath) {
      this.configPath = configPath;
      return this;
    }

    public Builder environment(String environment) {
      this.environment = environment;
      return this;
    }

    public GatekitOptions build() {
      return new GatekitOptions(this);
    }
  }
}
