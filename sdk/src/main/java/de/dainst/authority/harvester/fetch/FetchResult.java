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
import java.util.Optional;

/** Outcome of one request issued by {@link BatchFetcher}: a payload or a failure. */
public final class FetchResult<T> {
  private final GenericUrl url;
  private final Optional<T> payload;
  private final Optional<FetchException> failure;

  private FetchResult(GenericUrl url, Optional<T> payload, Optional<FetchException> failure) {
    this.url = checkNotNull(url);
    this.payload = payload;
    this.failure = failure;
  }

  public static <T> FetchResult<T> success(GenericUrl url, T payload) {
    return new FetchResult<>(url, Optional.of(payload), Optional.empty());
  }

  public static <T> FetchResult<T> failure(GenericUrl url, FetchException failure) {
    return new FetchResult<>(url, Optional.empty(), Optional.of(failure));
  }

  public GenericUrl getUrl() {
    return url;
  }

  public boolean isSuccess() {
    return payload.isPresent();
  }

  public Optional<T> getPayload() {
    return payload;
  }

  public Optional<FetchException> getFailure() {
    return failure;
  }

  @Override
  public String toString() {
    return "FetchResult[" + url + ", " + (isSuccess() ? "ok" : failure.get().getErrorType()) + "]";
  }
}
