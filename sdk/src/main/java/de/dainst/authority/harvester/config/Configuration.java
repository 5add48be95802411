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

import com.google.common.base.Ascii;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import de.dainst.authority.harvester.InvalidConfigurationException;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.rules.TestRule;
import org.junit.runner.Description;
import org.junit.runners.model.Statement;

/**
 * Static registry of harvester configuration values.
 *
 * <p>Components declare the values they need through the factory methods below, typically from a
 * {@code fromConfiguration()} method. Values declared before {@link #initConfig} runs are held
 * and initialized together once the configuration is loaded; values declared later are
 * initialized immediately. Raw values are trimmed before parsing.
 *
 * <pre>{@code
 * ConfigValue<Integer> batchSize = Configuration.getInteger("gazetteer.batchSize", 250);
 * ConfigValue<LocalDate> startDate =
 *     Configuration.getValue("harvest.startDate", null, Configuration.LOCAL_DATE_PARSER);
 * }</pre>
 *
 * <p>Tests reset the registry with {@link ResetConfigRule} and load properties with {@link
 * SetupConfigRule}.
 */
public class Configuration {
  private static final Logger logger = Logger.getLogger(Configuration.class.getName());
  private static final String HARVESTER_CONFIG_FILE = "harvester-config.properties";
  private static final String ARGS_KEY = "-D";
  private static final String ARGS_CONFIGFILE = "config";
  @SuppressWarnings("rawtypes")
  private static final List<ConfigValue> configurations = new ArrayList<>();
  private static final AtomicBoolean initialized = new AtomicBoolean();
  private static Properties loadedConfig;

  private Configuration() {
    throw new AssertionError();
  }

  /**
   * Loads the configuration from command line arguments.
   *
   * <p>Arguments of the form {@code -Dkey=value} become properties. {@code -Dconfig=path} names
   * the properties file to read, {@value #HARVESTER_CONFIG_FILE} by default; a missing file is
   * not an error. Command line values override file values.
   *
   * @param args command line arguments
   * @throws IOException if the properties file exists but can not be read
   */
  public static void initConfig(String[] args) throws IOException {
    checkNotNull(args, "arguments can not be null");
    Properties commandLine = parseArgs(args);
    File configFile = new File(commandLine.getProperty(ARGS_CONFIGFILE, HARVESTER_CONFIG_FILE));
    Properties merged = new Properties();
    if (configFile.exists()) {
      logger.log(Level.CONFIG, "Loading configuration from {0}", configFile.getAbsolutePath());
      try (FileInputStream in = new FileInputStream(configFile)) {
        merged.load(in);
      }
    }
    merged.putAll(commandLine);
    for (String key : merged.stringPropertyNames()) {
      merged.setProperty(key, merged.getProperty(key).trim());
    }
    initConfig(merged);
  }

  /**
   * Loads the configuration from {@code config} and initializes every declared value.
   *
   * <p>Loading the same properties twice is a no-op; loading different properties once the
   * configuration is initialized fails.
   *
   * @param config properties to load
   * @throws InvalidConfigurationException if a declared value can not be parsed or a required
   *     value is missing
   */
  @SuppressWarnings("rawtypes")
  public static synchronized void initConfig(Properties config) {
    checkNotNull(config, "config can not be null");
    if (initialized.get()) {
      Map<String, String> loaded = flatten(loadedConfig);
      Map<String, String> requested = flatten(config);
      if (loaded.equals(requested)) {
        logger.log(Level.CONFIG, "Configuration already loaded with the same values.");
        return;
      }
      logger.log(Level.CONFIG, "Conflicting properties: {0}",
          Sets.symmetricDifference(loaded.entrySet(), requested.entrySet()));
      checkState(false, "Attempt to reload config with different properties.");
    }
    loadedConfig = config;
    synchronized (configurations) {
      try {
        for (ConfigValue value : configurations) {
          initializeConfigValue(value);
        }
        initialized.set(true);
      } finally {
        if (initialized.get()) {
          configurations.forEach(ConfigValue::freeze);
        } else {
          configurations.forEach(ConfigValue::reset);
          loadedConfig = null;
        }
      }
    }
  }

  private static Map<String, String> flatten(Properties p) {
    return p.stringPropertyNames()
        .stream()
        .collect(ImmutableMap.toImmutableMap(name -> name, p::getProperty));
  }

  /** Returns a copy of the loaded properties. */
  public static Properties getConfig() {
    checkState(initialized.get(), "configuration not initialized yet");
    Properties copy = new Properties();
    copy.putAll(loadedConfig);
    return copy;
  }

  /** Returns whether {@link #initConfig} completed successfully. */
  public static boolean isInitialized() {
    return initialized.get();
  }

  /** Converts a raw configuration string into a typed value. */
  public interface Parser<T> {
    /**
     * @throws InvalidConfigurationException if {@code value} is not acceptable
     */
    T parse(String value) throws InvalidConfigurationException;
  }

  /** Accepts {@code true} or {@code false}, ignoring case. */
  public static final Parser<Boolean> BOOLEAN_PARSER =
      value -> {
        checkArgument(!Strings.isNullOrEmpty(value), "value to parse can not be null or empty.");
        if ("true".equalsIgnoreCase(value)) {
          return true;
        }
        if ("false".equalsIgnoreCase(value)) {
          return false;
        }
        throw new InvalidConfigurationException(
            String.format("Invalid value [%s] for boolean property", value));
      };

  public static final Parser<Integer> INTEGER_PARSER =
      value -> {
        checkArgument(!Strings.isNullOrEmpty(value), "value to parse can not be null or empty.");
        try {
          return Integer.parseInt(value);
        } catch (NumberFormatException e) {
          throw new InvalidConfigurationException(e);
        }
      };

  public static final Parser<String> STRING_PARSER =
      value -> {
        checkNotNull(value, "value to parse can not be null.");
        return value;
      };

  /** Accepts ISO-8601 calendar dates such as {@code 2020-03-01}. */
  public static final Parser<LocalDate> LOCAL_DATE_PARSER =
      value -> {
        checkArgument(!Strings.isNullOrEmpty(value), "value to parse can not be null or empty.");
        try {
          return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
          throw new InvalidConfigurationException(
              String.format("Not a valid date [%s], expected pattern YYYY-MM-DD", value), e);
        }
      };

  /**
   * Returns a parser matching enum constant names case-insensitively.
   *
   * @param type enum class to parse into
   */
  public static <E extends Enum<E>> Parser<E> enumParser(Class<E> type) {
    checkNotNull(type);
    return value -> {
      checkArgument(!Strings.isNullOrEmpty(value), "value to parse can not be null or empty.");
      for (E constant : type.getEnumConstants()) {
        if (Ascii.equalsIgnoreCase(constant.name(), value)) {
          return constant;
        }
      }
      throw new InvalidConfigurationException(
          String.format("Invalid value [%s] for %s", value, type.getSimpleName()));
    };
  }

  private static class ListParser<T> implements Parser<List<T>> {
    private final Parser<T> elementParser;
    private final String delimiter;

    ListParser(Parser<T> elementParser, String delimiter) {
      this.elementParser = elementParser;
      this.delimiter = delimiter;
    }

    @Override
    public List<T> parse(String value) {
      checkNotNull(value);
      ImmutableList.Builder<T> parsed = ImmutableList.builder();
      Splitter.on(delimiter)
          .trimResults()
          .omitEmptyStrings()
          .split(value)
          .forEach(v -> parsed.add(elementParser.parse(v)));
      return parsed.build();
    }
  }

  public static ConfigValue<Boolean> getBoolean(String configKey, Boolean defaultValue) {
    return getValue(configKey, defaultValue, BOOLEAN_PARSER);
  }

  public static ConfigValue<String> getString(String configKey, String defaultValue) {
    return getValue(configKey, defaultValue, STRING_PARSER);
  }

  public static ConfigValue<Integer> getInteger(String configKey, Integer defaultValue) {
    return getValue(configKey, defaultValue, INTEGER_PARSER);
  }

  /**
   * Declares a comma separated list value.
   *
   * @param configKey configuration key
   * @param defaultValues value used when the key is absent, {@code null} for a required key
   * @param parser parser applied to each element
   */
  public static <T> ConfigValue<List<T>> getMultiValue(
      String configKey, List<T> defaultValues, Parser<T> parser) {
    return getValue(configKey, defaultValues, new ListParser<T>(parser, ","));
  }

  /**
   * Declares a value of any type.
   *
   * @param configKey configuration key
   * @param defaultValue value used when the key is absent, {@code null} for a required key
   * @param parser converts the raw string
   */
  public static <T> ConfigValue<T> getValue(String configKey, T defaultValue, Parser<T> parser) {
    ConfigValue<T> toReturn =
        new ConfigValue.Builder<T>()
            .setConfigKey(configKey)
            .setDefaultValue(defaultValue)
            .setParser(parser)
            .build();
    initializeOrRegister(toReturn);
    return toReturn;
  }

  /**
   * Declares an optional value; an absent key yields {@link Optional#empty()}.
   *
   * @param configKey configuration key
   * @param parser converts the raw string
   */
  public static <T> ConfigValue<Optional<T>> getOptional(String configKey, Parser<T> parser) {
    checkNotNull(parser);
    return getValue(configKey, Optional.empty(), value -> Optional.of(parser.parse(value)));
  }

  @SuppressWarnings("rawtypes")
  private static void initializeOrRegister(ConfigValue value) {
    if (initialized.get()) {
      initializeConfigValue(value);
    } else {
      synchronized (configurations) {
        configurations.add(value);
      }
    }
  }

  @SuppressWarnings("rawtypes")
  private static void initializeConfigValue(ConfigValue value) {
    checkState(loadedConfig != null, "loadedConfig not initialized yet");
    String configured =
        Optional.ofNullable(loadedConfig.getProperty(value.getConfigKey()))
            .map(String::trim)
            .orElse(null);
    value.initialize(configured);
    value.freeze();
  }

  /**
   * Throws {@link InvalidConfigurationException} with a formatted message unless {@code
   * condition} holds.
   */
  public static void checkConfiguration(
      boolean condition, String errorFormat, Object... errorArgs) {
    if (!condition) {
      throw new InvalidConfigurationException(String.format(errorFormat, errorArgs));
    }
  }

  private static Properties parseArgs(String[] args) {
    Properties props = new Properties();
    for (String arg : args) {
      if (!arg.startsWith(ARGS_KEY)) {
        logger.log(Level.WARNING, "Ignoring argument {0}", arg);
        continue;
      }
      String[] parts = arg.substring(ARGS_KEY.length()).split("=", 2);
      if (parts.length == 2) {
        props.setProperty(parts[0].trim(), parts[1].trim());
      }
    }
    return props;
  }

  private static synchronized void resetConfiguration() {
    synchronized (configurations) {
      configurations.clear();
    }
    initialized.set(false);
    loadedConfig = null;
  }

  /** {@link TestRule} that clears the static configuration before each test. */
  public static class ResetConfigRule implements TestRule {
    @Override
    public Statement apply(Statement base, Description description) {
      resetConfiguration();
      return base;
    }
  }

  /**
   * {@link TestRule} that lets a test load configuration properties.
   *
   * <pre>
   * {@code @Rule public ResetConfigRule resetConfig = new ResetConfigRule(); }
   * {@code @Rule public SetupConfigRule setupConfig = SetupConfigRule.uninitialized(); }
   * </pre>
   */
  public static class SetupConfigRule implements TestRule {
    private SetupConfigRule() {}

    @Override
    public Statement apply(Statement base, Description description) {
      return base;
    }

    public static SetupConfigRule uninitialized() {
      return new SetupConfigRule();
    }

    /** Loads {@code properties}, which must only hold string keys and values. */
    public void initConfig(Properties properties) {
      Set<String> names = properties.stringPropertyNames();
      if (properties.size() != names.size()) {
        throw new IllegalArgumentException("Non-string properties found in config: "
            + Sets.difference(properties.keySet(), names));
      }
      Configuration.initConfig(properties);
    }
  }
}
