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

import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Lower bound on the change timestamp of harvested items.
 *
 * <p>An item passes when its modification timestamp, or its creation timestamp if it was never
 * modified, is not earlier than the bound. Items without any timestamp only pass an unbounded
 * filter. All comparisons use UTC instants.
 */
public final class SinceFilter {
  private static final SinceFilter UNBOUNDED = new SinceFilter(Optional.empty());

  private final Optional<Instant> since;

  private SinceFilter(Optional<Instant> since) {
    this.since = since;
  }

  /** Filter that accepts everything. */
  public static SinceFilter unbounded() {
    return UNBOUNDED;
  }

  public static SinceFilter of(Instant since) {
    return new SinceFilter(Optional.of(checkNotNull(since)));
  }

  /** Filter starting at midnight UTC of {@code date}. */
  public static SinceFilter startOf(LocalDate date) {
    return of(date.atStartOfDay(ZoneOffset.UTC).toInstant());
  }

  public static SinceFilter of(Optional<LocalDate> date) {
    return date.map(SinceFilter::startOf).orElse(UNBOUNDED);
  }

  public Optional<Instant> getSince() {
    return since;
  }

  public boolean isBounded() {
    return since.isPresent();
  }

  /** Accepts {@code timestamp} if it is at or after the bound. */
  public boolean accepts(Optional<Instant> timestamp) {
    if (!since.isPresent()) {
      return true;
    }
    return timestamp.isPresent() && !timestamp.get().isBefore(since.get());
  }

  /** Accepts an item by its modification timestamp, falling back to its creation timestamp. */
  public boolean accepts(Optional<Instant> modified, Optional<Instant> created) {
    return accepts(modified.isPresent() ? modified : created);
  }

  @Override
  public String toString() {
    return since.map(s -> "since " + s).orElse("unbounded");
  }
}
