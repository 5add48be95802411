/*
 * Copyright © 2024 Deutsches Archäologisches Institut
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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import de.dainst.authority.harvester.InvalidConfigurationException;
import de.dainst.authority.harvester.config.Configuration.ResetConfigRule;
import de.dainst.authority.harvester.config.Configuration.SetupConfigRule;
import de.dainst.authority.harvester.fetch.FetchException.ErrorType;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

/** Tests for {@link RetryPolicy}. */
public class RetryPolicyTest {
  @Rule public ExpectedException thrown = ExpectedException.none();
  @Rule public ResetConfigRule resetConfig = new ResetConfigRule();
  @Rule public SetupConfigRule setupConfig = SetupConfigRule.uninitialized();

  @Test
  public void fromConfiguration_defaults() {
    setupConfig.initConfig(new Properties());
    RetryPolicy policy = RetryPolicy.fromConfiguration();
    assertEquals(5, policy.getMaxRetryLimit());
    assertEquals(Duration.ofSeconds(60), policy.getInitialTimeout());
    assertEquals(Optional.of(Duration.ofSeconds(120)), policy.nextTimeout(Duration.ofSeconds(60)));
  }

  @Test
  public void fromConfiguration_customValues() {
    Properties config = new Properties();
    config.setProperty(RetryPolicy.CONFIG_MAXIMUM_RETRIES, "2");
    config.setProperty(RetryPolicy.CONFIG_INITIAL_TIMEOUT, "10");
    config.setProperty(RetryPolicy.CONFIG_TIMEOUT_INCREMENT, "5");
    config.setProperty(RetryPolicy.CONFIG_MAXIMUM_TIMEOUT, "20");
    setupConfig.initConfig(config);
    RetryPolicy policy = RetryPolicy.fromConfiguration();
    assertEquals(2, policy.getMaxRetryLimit());
    assertEquals(Duration.ofSeconds(10), policy.getInitialTimeout());
    assertEquals(Optional.of(Duration.ofSeconds(20)), policy.nextTimeout(Duration.ofSeconds(15)));
    assertEquals(Optional.empty(), policy.nextTimeout(Duration.ofSeconds(20)));
  }

  @Test
  public void fromConfiguration_invalidNumber_throws() {
    Properties config = new Properties();
    config.setProperty(RetryPolicy.CONFIG_MAXIMUM_RETRIES, "many");
    setupConfig.initConfig(config);
    thrown.expect(InvalidConfigurationException.class);
    RetryPolicy.fromConfiguration();
  }

  @Test
  public void fromConfiguration_uninitialized_throws() {
    thrown.expect(IllegalStateException.class);
    RetryPolicy.fromConfiguration();
  }

  @Test
  public void build_maxTimeoutBelowInitial_throws() {
    thrown.expect(IllegalArgumentException.class);
    new RetryPolicy.Builder()
        .setInitialTimeout(Duration.ofSeconds(30))
        .setMaxTimeout(Duration.ofSeconds(10))
        .build();
  }

  @Test
  public void build_negativeRetries_throws() {
    thrown.expect(IllegalArgumentException.class);
    new RetryPolicy.Builder().setMaxRetryLimit(-1).build();
  }

  @Test
  public void nextTimeout_escalatesUpToCap() {
    RetryPolicy policy = new RetryPolicy.Builder().build();
    Duration timeout = policy.getInitialTimeout();
    int escalations = 0;
    for (Optional<Duration> next = policy.nextTimeout(timeout);
        next.isPresent();
        next = policy.nextTimeout(timeout)) {
      timeout = next.get();
      escalations++;
    }
    assertEquals(Duration.ofSeconds(300), timeout);
    assertEquals(4, escalations);
  }

  @Test
  public void isRetryable() {
    RetryPolicy policy = new RetryPolicy.Builder().build();
    assertTrue(policy.isRetryable(ErrorType.SERVER_ERROR));
    assertTrue(policy.isRetryable(ErrorType.CONNECTION_ERROR));
    assertTrue(policy.isRetryable(ErrorType.TIMEOUT));
    assertFalse(policy.isRetryable(ErrorType.CLIENT_ERROR));
    assertFalse(policy.isRetryable(ErrorType.MALFORMED_PAYLOAD));
  }

  @Test
  public void isRetryable_decidesEveryErrorType() {
    RetryPolicy policy = new RetryPolicy.Builder().build();
    int retryable = 0;
    for (ErrorType type : ErrorType.values()) {
      if (policy.isRetryable(type)) {
        retryable++;
      }
    }
    assertEquals(3, retryable);
  }
}
