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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpResponse;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.util.BackOff;
import com.google.api.client.util.BackOffUtils;
import com.google.api.client.util.Sleeper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.ByteStreams;
import de.dainst.authority.harvester.fetch.FetchException.ErrorType;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Issues a single GET request and decodes the response, retrying transient failures.
 *
 * <p>Attempts run one after another on the calling thread. Server errors, connection failures
 * and timeouts are retried until the {@link RetryPolicy} budget is spent; every timed out
 * attempt raises the timeout of the next one until the policy's cap is reached. Client errors
 * and undecodable payloads fail at once. Instances are safe for use by concurrent callers.
 */
public class RetryingFetcher<T> {
  private static final Logger logger = Logger.getLogger(RetryingFetcher.class.getName());

  private final HttpRequestFactory requestFactory;
  private final PayloadParser<T> parser;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;

  public RetryingFetcher(HttpTransport transport, PayloadParser<T> parser, RetryPolicy policy) {
    this(transport, parser, policy, Sleeper.DEFAULT);
  }

  @VisibleForTesting
  RetryingFetcher(
      HttpTransport transport, PayloadParser<T> parser, RetryPolicy policy, Sleeper sleeper) {
    this.requestFactory =
        checkNotNull(transport, "transport can not be null").createRequestFactory();
    this.parser = checkNotNull(parser, "parser can not be null");
    this.retryPolicy = checkNotNull(policy, "retry policy can not be null");
    this.sleeper = checkNotNull(sleeper, "sleeper can not be null");
  }

  /**
   * Fetches and decodes {@code url}.
   *
   * @throws FetchException the last failure once no further attempt is allowed
   */
  public T fetch(GenericUrl url) throws FetchException {
    checkNotNull(url, "url can not be null");
    BackOff backOff = retryPolicy.getBackOffFactory().createBackOffInstance();
    Duration timeout = retryPolicy.getInitialTimeout();
    int retries = 0;
    while (true) {
      try {
        return attempt(url, timeout);
      } catch (FetchException e) {
        if (!retryPolicy.isRetryable(e.getErrorType())) {
          logger.log(Level.WARNING, "Request to {0} failed and is not retryable: {1}",
              new Object[] {url, e});
          throw e;
        }
        if (retries >= retryPolicy.getMaxRetryLimit()) {
          logger.log(Level.WARNING, "Request to {0} failed after {1} attempts: {2}",
              new Object[] {url, retries + 1, e});
          throw e;
        }
        if (e.getErrorType() == ErrorType.TIMEOUT) {
          Optional<Duration> next = retryPolicy.nextTimeout(timeout);
          if (!next.isPresent()) {
            logger.log(Level.WARNING, "Request to {0} timed out at the maximum timeout of {1}s",
                new Object[] {url, timeout.getSeconds()});
            throw e;
          }
          timeout = next.get();
        }
        retries++;
        logger.log(Level.INFO, "Retrying request to {0} ({1} of {2}) after {3}",
            new Object[] {url, retries, retryPolicy.getMaxRetryLimit(), e.getErrorType()});
        waitBeforeRetry(backOff, e);
      }
    }
  }

  private void waitBeforeRetry(BackOff backOff, FetchException lastFailure)
      throws FetchException {
    try {
      if (!BackOffUtils.next(sleeper, backOff)) {
        logger.log(Level.WARNING, "Back-off exhausted for {0}", lastFailure.getUrl());
        throw lastFailure;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      lastFailure.addSuppressed(e);
      throw lastFailure;
    } catch (FetchException e) {
      throw e;
    } catch (IOException e) {
      lastFailure.addSuppressed(e);
      throw lastFailure;
    }
  }

  private T attempt(GenericUrl url, Duration timeout) throws FetchException {
    String location = url.build();
    int timeoutMillis = (int) timeout.toMillis();
    HttpResponse response;
    try {
      HttpRequest request = requestFactory.buildGetRequest(url);
      request.setConnectTimeout(timeoutMillis);
      request.setReadTimeout(timeoutMillis);
      request.setNumberOfRetries(0);
      request.setThrowExceptionOnExecuteError(false);
      logger.log(Level.FINE, "GET {0}", location);
      response = request.execute();
    } catch (IOException e) {
      throw transportFailure(location, e);
    }
    try {
      int status = response.getStatusCode();
      if (status >= 500) {
        throw new FetchException.Builder(ErrorType.SERVER_ERROR)
            .setUrl(location)
            .setStatusCode(status)
            .setErrorMessage(response.getStatusMessage())
            .build();
      }
      if (!response.isSuccessStatusCode()) {
        throw new FetchException.Builder(ErrorType.CLIENT_ERROR)
            .setUrl(location)
            .setStatusCode(status)
            .setErrorMessage(response.getStatusMessage())
            .build();
      }
      byte[] content;
      try (InputStream in = response.getContent()) {
        content = in == null ? new byte[0] : ByteStreams.toByteArray(in);
      } catch (IOException e) {
        throw transportFailure(location, e);
      }
      try {
        return parser.parse(content, response.getContentCharset(), location);
      } catch (IOException | IllegalArgumentException e) {
        throw new FetchException.Builder(ErrorType.MALFORMED_PAYLOAD)
            .setUrl(location)
            .setStatusCode(status)
            .setErrorMessage("Unable to decode response: " + e.getMessage())
            .setCause(e)
            .build();
      }
    } finally {
      disconnect(response);
    }
  }

  private static FetchException transportFailure(String location, IOException cause) {
    ErrorType type =
        cause instanceof SocketTimeoutException ? ErrorType.TIMEOUT : ErrorType.CONNECTION_ERROR;
    return new FetchException.Builder(type)
        .setUrl(location)
        .setErrorMessage(cause.getMessage())
        .setCause(cause)
        .build();
  }

  private static void disconnect(HttpResponse response) {
    try {
      response.disconnect();
    } catch (IOException e) {
      logger.log(Level.FINE, "Error closing response", e);
    }
  }
}
