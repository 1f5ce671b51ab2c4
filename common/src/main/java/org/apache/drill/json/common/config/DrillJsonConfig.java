/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.drill.json.common.config;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Configuration of the JSON functions. Values come from, in increasing
 * order of precedence:
 * <ol>
 * <li>The defaults file, {@value #DEFAULTS_FILE_NAME}, at the root of
 * the class path.</li>
 * <li>An optional site file, {@value #OVERRIDE_FILE_NAME}.</li>
 * <li>System properties, such as
 * {@code -Ddrill.exec.functions.json.path_cache.size=64}.</li>
 * </ol>
 * Tests may layer explicit values on top with {@link #withValues(Map)}.
 */
public class DrillJsonConfig {
  private static final Logger logger = LoggerFactory.getLogger(DrillJsonConfig.class);

  public static final String DEFAULTS_FILE_NAME = "drill-json-module.conf";
  public static final String OVERRIDE_FILE_NAME = "drill-json-override.conf";

  public static final String JSON_FUNCTIONS_PARENT = "drill.exec.functions.json";
  public static final String PATH_CACHE_SIZE = append(JSON_FUNCTIONS_PARENT, "path_cache.size");
  public static final String EXTRACT_BACKEND = append(JSON_FUNCTIONS_PARENT, "extract.backend");
  public static final String MAX_NESTING_DEPTH = append(JSON_FUNCTIONS_PARENT, "parser.max_nesting_depth");

  private final Config config;

  private DrillJsonConfig(Config config) {
    this.config = config;
  }

  public static String append(String parent, String key) {
    return parent + "." + key;
  }

  /**
   * Loads the configuration from the class path and system properties.
   *
   * @return the resolved configuration
   * @throws ConfigException if the defaults file is missing or a value
   * is malformed
   */
  public static DrillJsonConfig create() {
    Config defaults = ConfigFactory.parseResources(DEFAULTS_FILE_NAME);
    if (defaults.isEmpty()) {
      throw new ConfigException.Missing(DEFAULTS_FILE_NAME);
    }
    Config config = ConfigFactory.parseProperties(System.getProperties())
        .withFallback(ConfigFactory.parseResources(OVERRIDE_FILE_NAME))
        .withFallback(defaults)
        .resolve();
    DrillJsonConfig result = new DrillJsonConfig(config);
    logger.debug("Loaded JSON function config: cache size = {}, extract backend = {}",
        result.pathCacheSize(), result.extractBackend());
    return result;
  }

  /**
   * Returns a copy of this configuration with the given values taking
   * precedence.
   */
  public DrillJsonConfig withValues(Map<String, ?> values) {
    return new DrillJsonConfig(
        ConfigFactory.parseMap(values).withFallback(config).resolve());
  }

  public int pathCacheSize() {
    int size = config.getInt(PATH_CACHE_SIZE);
    if (size < 0) {
      throw new ConfigException.BadValue(PATH_CACHE_SIZE, "must be zero or positive");
    }
    return size;
  }

  public String extractBackend() {
    return config.getString(EXTRACT_BACKEND);
  }

  public int maxNestingDepth() {
    int depth = config.getInt(MAX_NESTING_DEPTH);
    if (depth <= 0) {
      throw new ConfigException.BadValue(MAX_NESTING_DEPTH, "must be positive");
    }
    return depth;
  }

  public Config getConfig() { return config; }
}
