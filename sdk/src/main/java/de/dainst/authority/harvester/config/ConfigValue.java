/*
 * Copyright © 2017 Google Inc.
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
package de.dainst.authority.harvester.config;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Strings;
import de.dainst.authority.harvester.InvalidConfigurationException;
import de.dainst.authority.harvester.config.Configuration.Parser;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle to one configuration value, created through the {@link Configuration} factory methods.
 *
 * <p>{@link #get} may only be called once {@link Configuration#initConfig} has run.
 */
public class ConfigValue<T> {
  private final String configKey;
  private final T defaultValue;
  private final Parser<T> parser;
  private final AtomicBoolean initialized = new AtomicBoolean();
  private T configuredValue;

  private ConfigValue(Builder<T> builder) {
    configKey = builder.configKey;
    defaultValue = builder.defaultValue;
    parser = builder.parser;
  }

  /**
   * Returns the configured value, or the default when the key is absent.
   *
   * @throws IllegalStateException if the configuration is not initialized
   */
  public T get() {
    checkState(initialized.get(), "Config Key %s not initialized", configKey);
    return configuredValue;
  }

  public T getDefault() {
    return defaultValue;
  }

  public boolean isInitialized() {
    return initialized.get();
  }

  synchronized void initialize(String value) {
    if (initialized.get()) {
      return;
    }
    if (Strings.isNullOrEmpty(value)) {
      if (defaultValue == null) {
        throw new InvalidConfigurationException(
            String.format("Required Config Key %s not initialized", configKey));
      }
      configuredValue = defaultValue;
      return;
    }
    try {
      configuredValue = parser.parse(value);
    } catch (InvalidConfigurationException | IllegalArgumentException e) {
      throw new InvalidConfigurationException(
          String.format("Failed to parse configured value [%s] for ConfigKey [%s]",
              value, configKey),
          e);
    }
  }

  String getConfigKey() {
    return configKey;
  }

  synchronized void freeze() {
    initialized.set(true);
  }

  synchronized void reset() {
    configuredValue = null;
    initialized.set(false);
  }

  static final class Builder<T> {
    private String configKey;
    private T defaultValue;
    private Parser<T> parser;

    Builder<T> setConfigKey(String configKey) {
      this.configKey = configKey;
      return this;
    }

    Builder<T> setDefaultValue(T defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    Builder<T> setParser(Parser<T> parser) {
      this.parser = parser;
      return this;
    }

    ConfigValue<T> build() {
      checkArgument(!Strings.isNullOrEmpty(configKey), "configKey can not be empty or null");
      checkNotNull(parser, "parser can not be null.");
      return new ConfigValue<T>(this);
    }
  }
}
