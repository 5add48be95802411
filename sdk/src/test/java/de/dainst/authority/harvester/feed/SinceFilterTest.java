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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import org.junit.Test;

/** Tests for {@link SinceFilter}. */
public class SinceFilterTest {
  private static final Instant SINCE = Instant.parse("2024-03-01T00:00:00Z");

  @Test
  public void accepts_lowerBoundIsInclusive() {
    SinceFilter filter = SinceFilter.of(SINCE);
    assertTrue(filter.accepts(Optional.of(SINCE)));
    assertFalse(filter.accepts(Optional.of(SINCE.minusSeconds(1))));
    assertTrue(filter.accepts(Optional.of(SINCE.plusSeconds(1))));
  }

  @Test
  public void accepts_missingTimestampOnlyWhenUnbounded() {
    assertFalse(SinceFilter.of(SINCE).accepts(Optional.empty()));
    assertTrue(SinceFilter.unbounded().accepts(Optional.empty()));
  }

  @Test
  public void accepts_fallsBackToCreation() {
    SinceFilter filter = SinceFilter.of(SINCE);
    assertTrue(filter.accepts(Optional.empty(), Optional.of(SINCE)));
    assertFalse(filter.accepts(Optional.empty(), Optional.of(SINCE.minusSeconds(1))));
    // modification wins over creation
    assertFalse(filter.accepts(Optional.of(SINCE.minusSeconds(1)), Optional.of(SINCE)));
  }

  @Test
  public void startOf_isMidnightUtc() {
    SinceFilter filter = SinceFilter.startOf(LocalDate.of(2024, 3, 1));
    assertEquals(Optional.of(SINCE), filter.getSince());
    assertTrue(filter.isBounded());
  }

  @Test
  public void ofEmptyDate_isUnbounded() {
    assertFalse(SinceFilter.of(Optional.<LocalDate>empty()).isBounded());
  }

  @Test
  public void accepts_comparesInstantsAcrossOffsets() {
    SinceFilter filter = SinceFilter.of(SINCE);
    // 2024-02-29T23:30:00-01:00 is 00:30 UTC on the first of March
    assertTrue(filter.accepts(Timestamps.parse("2024-02-29T23:30:00-01:00")));
    assertFalse(filter.accepts(Timestamps.parse("2024-03-01T00:30:00+01:00")));
  }
}
