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

import java.io.IOException;
import java.nio.charset.Charset;

/**
 * Decodes a response body fetched by {@link RetryingFetcher}.
 *
 * <p>Any {@link IOException} thrown here is reported as {@link
 * FetchException.ErrorType#MALFORMED_PAYLOAD} and is never retried.
 */
public interface PayloadParser<T> {

  /**
   * @param content complete response body
   * @param charset charset announced by the response, or the transport default
   * @param url requested URL, for error messages
   */
  T parse(byte[] content, Charset charset, String url) throws IOException;
}
