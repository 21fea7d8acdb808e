/*
 * Copyright (C) 2025 Isima, Inc.
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
 */
package io.isima.syntax.common;

import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Properties-backed configuration value provider shared by the syntax components. */
public class SyntaxConfigBase {
  private static final Logger logger = LoggerFactory.getLogger(SyntaxConfigBase.class);

  private static SyntaxConfigBase instance;

  private Properties properties = System.getProperties();

  /**
   * SyntaxConfigBase is instantiated as a singleton.
   *
   * @return The instance.
   */
  public static synchronized SyntaxConfigBase getInstance() {
    if (instance == null) {
      instance = new SyntaxConfigBase();
    }
    return instance;
  }

  /**
   * Replaces the property source. System properties are used until this method is called.
   *
   * @param properties The new property source; null restores the system properties.
   */
  public static void setProperties(Properties properties) {
    getInstance().properties = properties != null ? properties : System.getProperties();
    logger.debug("Configuration properties replaced");
  }

  /**
   * Generic method to get property as string.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as a string.
   */
  public String getString(String key, String defaultValue) {
    String value = properties.getProperty(key);
    return value != null ? value.trim() : defaultValue;
  }

  /**
   * Generic method to get property as boolean.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as a boolean.
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
