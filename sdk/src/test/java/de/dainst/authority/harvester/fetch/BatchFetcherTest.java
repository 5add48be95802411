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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.api.client.http.GenericUrl;
import com.google.api.client.util.BackOff;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import de.dainst.authority.harvester.config.Configuration.ResetConfigRule;
import de.dainst.authority.harvester.config.Configuration.SetupConfigRule;
import de.dainst.authority.harvester.fetch.FetchException.ErrorType;
import java.util.List;
import java.util.Properties;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

/** Tests for {@link BatchFetcher}. */
public class BatchFetcherTest {
  @Rule public ExpectedException thrown = ExpectedException.none();
  @Rule public ResetConfigRule resetConfig = new ResetConfigRule();
  @Rule public SetupConfigRule setupConfig = SetupConfigRule.uninitialized();

  private final TestingHttpTransport transport = new TestingHttpTransport();
  private final RetryingFetcher<String> fetcher =
      new RetryingFetcher<>(
          transport,
          (content, charset, url) -> new String(content, UTF_8),
          new RetryPolicy.Builder()
              .setMaxRetryLimit(1)
              .setBackOffFactory(() -> BackOff.ZERO_BACKOFF)
              .build());

  private static List<GenericUrl> urls(String... urls) {
    ImmutableList.Builder<GenericUrl> result = ImmutableList.builder();
    for (String url : urls) {
      result.add(new GenericUrl(url));
    }
    return result.build();
  }

  @Test
  public void fetchAll_keepsInputOrderAndIsolatesFailures() {
    transport.ok("http://example.org/a", "A");
    transport.reply("http://example.org/b", 404, "missing");
    transport.ok("http://example.org/c", "C");
    try (BatchFetcher<String> batch = BatchFetcher.create(fetcher, 3, "test")) {
      List<FetchResult<String>> results =
          batch.fetchAll(urls("http://example.org/a", "http://example.org/b",
              "http://example.org/c"));
      assertEquals(3, results.size());
      assertEquals("A", results.get(0).getPayload().get());
      assertFalse(results.get(1).isSuccess());
      assertEquals(ErrorType.CLIENT_ERROR, results.get(1).getFailure().get().getErrorType());
      assertEquals("http://example.org/b", results.get(1).getUrl().build());
      assertEquals("C", results.get(2).getPayload().get());
    }
  }

  @Test
  public void fetchSuccessful_dropsFailures() {
    transport.ok("http://example.org/a", "A");
    transport.reply("http://example.org/b", 500, "boom");
    transport.ok("http://example.org/c", "C");
    BatchFetcher<String> batch =
        new BatchFetcher<>(fetcher, MoreExecutors.newDirectExecutorService());
    assertEquals(ImmutableList.of("A", "C"),
        batch.fetchSuccessful(urls("http://example.org/a", "http://example.org/b",
            "http://example.org/c")));
    // one retry for the server error
    assertThat(transport.getRequestCount("http://example.org/b"), is(2));
  }

  @Test
  public void fetchAll_emptyInput() {
    BatchFetcher<String> batch =
        new BatchFetcher<>(fetcher, MoreExecutors.newDirectExecutorService());
    assertTrue(batch.fetchAll(ImmutableList.of()).isEmpty());
  }

  @Test
  public void fromConfiguration_invalidCeiling_throws() {
    Properties config = new Properties();
    config.setProperty(BatchFetcher.CONFIG_MAX_CONCURRENT_REQUESTS, "0");
    setupConfig.initConfig(config);
    thrown.expect(de.dainst.authority.harvester.InvalidConfigurationException.class);
    BatchFetcher.fromConfiguration(fetcher, "test");
  }

  @Test
  public void fromConfiguration_default() {
    setupConfig.initConfig(new Properties());
    transport.ok("http://example.org/a", "A");
    try (BatchFetcher<String> batch = BatchFetcher.fromConfiguration(fetcher, "test")) {
      assertEquals(ImmutableList.of("A"), batch.fetchSuccessful(urls("http://example.org/a")));
      assertEquals(fetcher, batch.getFetcher());
    }
  }
}
