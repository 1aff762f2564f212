// Copyright 2023 Google LLC
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.examples.meshdestination.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

/**
 * Reads destination server configuration from the environment and the classpath.
 *
 * <p>For simplified unit testing of the server, create a subclass and override methods.
 */
public class ServerConfig {

  private static final Logger LOG = LoggerFactory.getLogger(ServerConfig.class);

  /**
   * Default destination API port. Override with the <code>PORT</code> environment variable.
   */
  private static final int DEFAULT_SERVING_PORT = 8086;

  /**
   * Default health checking port. Override with the <code>HEALTH_PORT</code> environment variable.
   */
  private static final int DEFAULT_HEALTH_PORT = 9996;

  /** The file that contains the destination service settings. */
  private static final String DESTINATION_CONFIG_FILE = "config/destination.yaml";

  /** Returns the port number that the server should listen on for destination requests. */
  public int servingPort() {
    return portFromEnv("PORT", DEFAULT_SERVING_PORT);
  }

  /** Returns the port number that the server should listen on for health requests. */
  public int healthPort() {
    return portFromEnv("HEALTH_PORT", DEFAULT_HEALTH_PORT);
  }

  /** Reads the destination service settings from a file on the classpath. */
  @SuppressWarnings("unchecked")
  @NotNull
  public DestinationConfig destinationConfig() {
    String configFile = destinationConfigFile();
    try (InputStream in = getClassLoader().getResourceAsStream(configFile)) {
      if (in == null) {
        throw new ConfigException("Could not find " + configFile + " on the classpath");
      }
      Object loaded = new Load(LoadSettings.builder().build()).loadFromInputStream(in);
      var config =
          new DestinationConfig(loaded == null ? Map.of() : (Map<String, Object>) loaded);
      LOG.info("Destination config: {}", config);
      return config;
    } catch (IOException e) {
      throw new ConfigException("Could not read " + configFile, e);
    } catch (ClassCastException | IllegalArgumentException e) {
      throw new ConfigException("Invalid configuration in " + configFile, e);
    }
  }

  @NotNull
  String destinationConfigFile() {
    return DESTINATION_CONFIG_FILE;
  }

  /** Returns the value of an environment variable, or null if it is not set. */
  String getenv(@NotNull String name) {
    return System.getenv(name);
  }

  private int portFromEnv(@NotNull String name, int defaultPort) {
    String portEnv = getenv(name);
    if (portEnv != null && !portEnv.isBlank()) {
      try {
        return Integer.parseInt(portEnv);
      } catch (NumberFormatException e) {
        throw new ConfigException(
            "Invalid value of " + name + " environment variable: " + portEnv, e);
      }
    }
    return defaultPort;
  }

  @NotNull
  ClassLoader getClassLoader() {
    try {
      var contextClassLoader = Thread.currentThread().getContextClassLoader();
      if (contextClassLoader != null) {
        return contextClassLoader;
      }
    } catch (Exception e) {
      LOG.warn("Could not get current thread context class loader.", e);
    }
    try {
      var classLoader = this.getClass().getClassLoader();
      if (classLoader != null) {
        return classLoader;
      }
    } catch (Exception e) {
      LOG.warn("Could not get class loader of {} class.", this.getClass().getName(), e);
    }
    var systemClassLoader = ClassLoader.getSystemClassLoader();
    if (systemClassLoader == null) {
      throw new ConfigException("Could not find class loader to load application configuration.");
    }
    return systemClassLoader;
  }
}
