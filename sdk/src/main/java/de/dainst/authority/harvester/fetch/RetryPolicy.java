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
package de.dainst.authority.harvester.fetch;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.api.client.util.BackOff;
import com.google.api.client.util.ExponentialBackOff;
import de.dainst.authority.harvester.config.Configuration;
import de.dainst.authority.harvester.fetch.FetchException.ErrorType;
import java.time.Duration;
import java.util.Optional;

/**
 * Retry budget, back-off and timeout escalation applied by {@link RetryingFetcher}.
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li>{@value #CONFIG_MAXIMUM_RETRIES} - retries after the first attempt, default {@value
 *       #DEFAULT_MAXIMUM_RETRIES}
 *   <li>{@value #CONFIG_INITIAL_TIMEOUT} - timeout of the first attempt in seconds, default
 *       {@value #DEFAULT_INITIAL_TIMEOUT_SECONDS}
 *   <li>{@value #CONFIG_TIMEOUT_INCREMENT} - added to the timeout after each timed out attempt,
 *       default {@value #DEFAULT_TIMEOUT_INCREMENT_SECONDS}
 *   <li>{@value #CONFIG_MAXIMUM_TIMEOUT} - timeout cap, default {@value
 *       #DEFAULT_MAXIMUM_TIMEOUT_SECONDS}
 * </ul>
 */
public class RetryPolicy {

  public static final String CONFIG_MAXIMUM_RETRIES = "fetch.maxRetryLimit";
  public static final String CONFIG_INITIAL_TIMEOUT = "fetch.initialTimeoutSeconds";
  public static final String CONFIG_TIMEOUT_INCREMENT = "fetch.timeoutIncrementSeconds";
  public static final String CONFIG_MAXIMUM_TIMEOUT = "fetch.maxTimeoutSeconds";

  public static final int DEFAULT_MAXIMUM_RETRIES = 5;
  public static final int DEFAULT_INITIAL_TIMEOUT_SECONDS = 60;
  public static final int DEFAULT_TIMEOUT_INCREMENT_SECONDS = 60;
  public static final int DEFAULT_MAXIMUM_TIMEOUT_SECONDS = 300;

  private final int maxRetries;
  private final BackOffFactory backOffFactory;
  private final Duration initialTimeout;
  private final Duration timeoutIncrement;
  private final Duration maxTimeout;

  private RetryPolicy(Builder builder) {
    this.maxRetries = builder.maxRetries;
    this.backOffFactory = builder.backOffFactory;
    this.initialTimeout = builder.initialTimeout;
    this.timeoutIncrement = builder.timeoutIncrement;
    this.maxTimeout = builder.maxTimeout;
  }

  /** Creates a retry policy from the {@code fetch.*} configuration keys. */
  public static RetryPolicy fromConfiguration() {
    checkState(Configuration.isInitialized(), "config not initialized");
    return new Builder()
        .setMaxRetryLimit(
            Configuration.getInteger(CONFIG_MAXIMUM_RETRIES, DEFAULT_MAXIMUM_RETRIES).get())
        .setInitialTimeout(Duration.ofSeconds(
            Configuration.getInteger(CONFIG_INITIAL_TIMEOUT, DEFAULT_INITIAL_TIMEOUT_SECONDS)
                .get()))
        .setTimeoutIncrement(Duration.ofSeconds(
            Configuration.getInteger(CONFIG_TIMEOUT_INCREMENT, DEFAULT_TIMEOUT_INCREMENT_SECONDS)
                .get()))
        .setMaxTimeout(Duration.ofSeconds(
            Configuration.getInteger(CONFIG_MAXIMUM_TIMEOUT, DEFAULT_MAXIMUM_TIMEOUT_SECONDS)
                .get()))
        .build();
  }

  /** Creates the {@link BackOff} used between attempts of one fetch. */
  public interface BackOffFactory {
    BackOff createBackOffInstance();
  }

  /** Exponential back-off starting at one second and doubling on every retry. */
  public static class DefaultBackOffFactoryImpl implements BackOffFactory {
    public static final int INITIAL_DELAY_SECONDS = 1;
    public static final double MULTIPLIER = 2;

    @Override
    public BackOff createBackOffInstance() {
      return new ExponentialBackOff.Builder()
          .setInitialIntervalMillis(INITIAL_DELAY_SECONDS * 1000)
          .setMultiplier(MULTIPLIER)
          .build();
    }
  }

  /** Builder for {@link RetryPolicy}. */
  public static final class Builder {
    private BackOffFactory backOffFactory = new DefaultBackOffFactoryImpl();
    private int maxRetries = DEFAULT_MAXIMUM_RETRIES;
    private Duration initialTimeout = Duration.ofSeconds(DEFAULT_INITIAL_TIMEOUT_SECONDS);
    private Duration timeoutIncrement = Duration.ofSeconds(DEFAULT_TIMEOUT_INCREMENT_SECONDS);
    private Duration maxTimeout = Duration.ofSeconds(DEFAULT_MAXIMUM_TIMEOUT_SECONDS);

    public Builder setMaxRetryLimit(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder setBackOffFactory(BackOffFactory factory) {
      this.backOffFactory = factory;
      return this;
    }

    public Builder setInitialTimeout(Duration initialTimeout) {
      this.initialTimeout = initialTimeout;
      return this;
    }

    public Builder setTimeoutIncrement(Duration timeoutIncrement) {
      this.timeoutIncrement = timeoutIncrement;
      return this;
    }

    public Builder setMaxTimeout(Duration maxTimeout) {
      this.maxTimeout = maxTimeout;
      return this;
    }

    public RetryPolicy build() {
      checkArgument(maxRetries >= 0, "retry limit can not be negative");
      checkNotNull(backOffFactory, "back-off factory can not be null");
      checkArgument(!initialTimeout.isNegative() && !initialTimeout.isZero(),
          "initial timeout must be positive");
      checkArgument(!timeoutIncrement.isNegative(), "timeout increment can not be negative");
      checkArgument(maxTimeout.compareTo(initialTimeout) >= 0,
          "maximum timeout must not be below the initial timeout");
      return new RetryPolicy(this);
    }
  }

  /** Number of retries allowed after the first attempt. */
  public int getMaxRetryLimit() {
    return maxRetries;
  }

  public BackOffFactory getBackOffFactory() {
    return backOffFactory;
  }

  public Duration getInitialTimeout() {
    return initialTimeout;
  }

  /**
   * Returns the timeout for the attempt following a timed out attempt, or empty once the
   * escalated timeout would exceed the cap.
   */
  public Optional<Duration> nextTimeout(Duration current) {
    Duration next = current.plus(timeoutIncrement);
    return next.compareTo(maxTimeout) > 0 ? Optional.empty() : Optional.of(next);
  }

  /** Whether a failure of kind {@code type} may be retried. */
  public boolean isRetryable(ErrorType type) {
    switch (type) {
      case SERVER_ERROR:
      case CONNECTION_ERROR:
      case TIMEOUT:
        return true;
      case CLIENT_ERROR:
      case MALFORMED_PAYLOAD:
        return false;
      default:
        throw new AssertionError("Unknown error type " + type);
    }
  }
}
