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

import java.io.IOException;
import java.util.Optional;

/** Failure to retrieve or decode a single upstream resource. */
public class FetchException extends IOException {

  /** Closed set of failure kinds; {@link RetryPolicy#isRetryable} decides on each of them. */
  public enum ErrorType {
    /** HTTP 5xx response. */
    SERVER_ERROR,
    /** Connection refused, reset or otherwise broken before a response was read. */
    CONNECTION_ERROR,
    /** Connect or read timeout. */
    TIMEOUT,
    /** HTTP 4xx or another non-success status. */
    CLIENT_ERROR,
    /** Response body could not be decoded. */
    MALFORMED_PAYLOAD
  }

  private final ErrorType errorType;
  private final String url;
  private final Optional<Integer> statusCode;

  private FetchException(Builder builder) {
    super(builder.message, builder.cause);
    this.errorType = builder.errorType;
    this.url = builder.url;
    this.statusCode = builder.statusCode;
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  /** Requested URL. */
  public String getUrl() {
    return url;
  }

  /** HTTP status of the failed response, if one was received. */
  public Optional<Integer> getStatusCode() {
    return statusCode;
  }

  @Override
  public String toString() {
    return "FetchException[type=" + errorType
        + ", url=" + url
        + statusCode.map(s -> ", status=" + s).orElse("")
        + ", message=" + getMessage()
        + (getCause() != null ? ", cause=" + getCause() : "")
        + "]";
  }

  /** Builder for {@link FetchException}. */
  public static class Builder {
    private final ErrorType errorType;
    private String url;
    private String message;
    private Throwable cause;
    private Optional<Integer> statusCode = Optional.empty();

    public Builder(ErrorType errorType) {
      this.errorType = checkNotNull(errorType);
    }

    public Builder setUrl(String url) {
      this.url = url;
      return this;
    }

    public Builder setErrorMessage(String message) {
      this.message = message;
      return this;
    }

    public Builder setCause(Throwable cause) {
      this.cause = cause;
      return this;
    }

    public Builder setStatusCode(int statusCode) {
      this.statusCode = Optional.of(statusCode);
      return this;
    }

    public FetchException build() {
      return new FetchException(this);
    }
  }
}
