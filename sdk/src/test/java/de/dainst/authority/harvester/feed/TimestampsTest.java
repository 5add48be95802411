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

import java.time.Instant;
import java.util.Optional;
import org.junit.Test;

/** Tests for {@link Timestamps}. */
public class TimestampsTest {

  @Test
  public void parse_offsetDateTime() {
    assertEquals(Optional.of(Instant.parse("2024-01-31T16:00:00Z")),
        Timestamps.parse("2024-01-31T12:00:00-04:00"));
  }

  @Test
  public void parse_utcDesignator() {
    assertEquals(Optional.of(Instant.parse("2024-01-31T12:00:00Z")),
        Timestamps.parse("2024-01-31T12:00:00Z"));
  }

  @Test
  public void parse_localDateTimeIsUtc() {
    assertEquals(Optional.of(Instant.parse("2024-01-31T12:00:00.5Z")),
        Timestamps.parse(" 2024-01-31T12:00:00.5 "));
  }

  @Test
  public void parse_dateIsStartOfDay() {
    assertEquals(Optional.of(Instant.parse("2024-01-31T00:00:00Z")),
        Timestamps.parse("2024-01-31"));
  }

  @Test
  public void parse_invalid() {
    assertEquals(Optional.empty(), Timestamps.parse("yesterday"));
    assertEquals(Optional.empty(), Timestamps.parse("   "));
    assertEquals(Optional.empty(), Timestamps.parse(null));
  }
}
