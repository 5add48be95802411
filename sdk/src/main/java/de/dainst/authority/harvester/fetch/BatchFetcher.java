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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.api.client.http.GenericUrl;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.dainst.authority.harvester.config.Configuration;
import de.dainst.authority.harvester.fetch.FetchException.ErrorType;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fetches a list of URLs concurrently through a fixed-size worker pool.
 *
 * <p>Every URL is handed to the {@link RetryingFetcher} on its own worker. A failed request never
 * affects its siblings: the failure is logged and reported in its {@link FetchResult}. Results
 * are returned in input order once every request of the call has completed.
 *
 * <p>Optional configuration:
 *
 * <ul>
 *   <li>{@value #CONFIG_MAX_CONCURRENT_REQUESTS} - worker pool size, default {@value
 *       #DEFAULT_MAX_CONCURRENT_REQUESTS}
 * </ul>
 */
public class BatchFetcher<T> implements Closeable {
  private static final Logger logger = Logger.getLogger(BatchFetcher.class.getName());

  public static final String CONFIG_MAX_CONCURRENT_REQUESTS = "fetch.maxConcurrentRequests";
  public static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 10;
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

  private final RetryingFetcher<T> fetcher;
  private final ListeningExecutorService executor;

  @VisibleForTesting
  BatchFetcher(RetryingFetcher<T> fetcher, ListeningExecutorService executor) {
    this.fetcher = checkNotNull(fetcher, "fetcher can not be null");
    this.executor = checkNotNull(executor, "executor can not be null");
  }

  /**
   * Creates a batch fetcher with its own pool of {@code maxConcurrentRequests} threads.
   *
   * @param name prefix of the worker thread names
   */
  public static <T> BatchFetcher<T> create(
      RetryingFetcher<T> fetcher, int maxConcurrentRequests, String name) {
    checkArgument(maxConcurrentRequests > 0, "concurrency ceiling must be positive");
    ListeningExecutorService executor =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(
                maxConcurrentRequests,
                new ThreadFactoryBuilder().setNameFormat(name + "-fetch-%d").setDaemon(true)
                    .build()));
    return new BatchFetcher<>(fetcher, executor);
  }

  /** Creates a batch fetcher sized by {@value #CONFIG_MAX_CONCURRENT_REQUESTS}. */
  public static <T> BatchFetcher<T> fromConfiguration(RetryingFetcher<T> fetcher, String name) {
    checkState(Configuration.isInitialized(), "config not initialized");
    int ceiling =
        Configuration.getInteger(CONFIG_MAX_CONCURRENT_REQUESTS, DEFAULT_MAX_CONCURRENT_REQUESTS)
            .get();
    Configuration.checkConfiguration(
        ceiling > 0, "%s must be positive: %d", CONFIG_MAX_CONCURRENT_REQUESTS, ceiling);
    return create(fetcher, ceiling, name);
  }

  /** Returns the single-request fetcher used by the workers. */
  public RetryingFetcher<T> getFetcher() {
    return fetcher;
  }

  /**
   * Fetches all {@code urls}, blocking until each request succeeded or failed.
   *
   * @return one result per input URL, in input order
   */
  public List<FetchResult<T>> fetchAll(List<GenericUrl> urls) {
    checkNotNull(urls, "urls can not be null");
    List<ListenableFuture<T>> futures = new ArrayList<>(urls.size());
    for (GenericUrl url : urls) {
      futures.add(executor.submit(() -> fetcher.fetch(url)));
    }
    ImmutableList.Builder<FetchResult<T>> results = ImmutableList.builder();
    int failed = 0;
    for (int i = 0; i < urls.size(); i++) {
      FetchResult<T> result = await(urls.get(i), futures.get(i));
      if (!result.isSuccess()) {
        failed++;
        logger.log(Level.WARNING, "Dropping {0}: {1}",
            new Object[] {result.getUrl(), result.getFailure().get()});
      }
      results.add(result);
    }
    logger.log(Level.FINE, "Fetched {0} of {1} resources",
        new Object[] {urls.size() - failed, urls.size()});
    return results.build();
  }

  /** Convenience variant of {@link #fetchAll} returning only the decoded payloads, in order. */
  public List<T> fetchSuccessful(List<GenericUrl> urls) {
    ImmutableList.Builder<T> payloads = ImmutableList.builder();
    for (FetchResult<T> result : fetchAll(urls)) {
      result.getPayload().ifPresent(payloads::add);
    }
    return payloads.build();
  }

  private static <T> FetchResult<T> await(GenericUrl url, ListenableFuture<T> future) {
    try {
      return FetchResult.success(url, future.get());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return FetchResult.failure(url, unexpectedFailure(url, e));
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof FetchException) {
        return FetchResult.failure(url, (FetchException) cause);
      }
      return FetchResult.failure(url, unexpectedFailure(url, cause));
    }
  }

  private static FetchException unexpectedFailure(GenericUrl url, Throwable cause) {
    return new FetchException.Builder(ErrorType.CONNECTION_ERROR)
        .setUrl(url.build())
        .setErrorMessage("Request did not complete: " + cause)
        .setCause(cause)
        .build();
  }

  @Override
  public void close() {
    MoreExecutors.shutdownAndAwaitTermination(executor, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
  }
}
