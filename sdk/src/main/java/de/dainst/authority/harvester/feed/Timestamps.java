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
package de.dainst.authority.harvester.feed;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Parses the ISO-8601 timestamp variants found in upstream payloads into UTC instants. */
public final class Timestamps {
  private static final Logger logger = Logger.getLogger(Timestamps.class.getName());

  private static final ImmutableList<Function<String, Instant>> FORMATS =
      ImmutableList.of(
          text -> OffsetDateTime.parse(text).toInstant(),
          text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
          text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());

  private Timestamps() {}

  /**
   * Parses a timestamp with offset, a local date-time or a plain date. Values without an offset
   * are read as UTC; a plain date denotes its first instant.
   *
   * @return the instant, or empty for blank or unparseable input
   */
  public static Optional<Instant> parse(String value) {
    if (Strings.isNullOrEmpty(value) || value.trim().isEmpty()) {
      return Optional.empty();
    }
    String text = value.trim();
    DateTimeParseException lastFailure = null;
    for (Function<String, Instant> format : FORMATS) {
      try {
        return Optional.of(format.apply(text));
      } catch (DateTimeParseException e) {
        lastFailure = e;
      }
    }
    logger.log(Level.FINE, "Ignoring unparseable timestamp " + text, lastFailure);
    return Optional.empty();
  }
}
