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
package de.dainst.authority.harvester.checkpoint;

import static com.google.common.base.Preconditions.checkNotNull;

import de.dainst.authority.harvester.InvalidConfigurationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/** The date of the last completed harvest, stored as one ISO-8601 line. */
public class FeedCheckpoint {
  private static final Logger logger = Logger.getLogger(FeedCheckpoint.class.getName());

  public static final String CHECKPOINT_NAME = "last_run_date.log";

  private final CheckpointHandler handler;

  public FeedCheckpoint(CheckpointHandler handler) {
    this.handler = checkNotNull(handler, "checkpoint handler can not be null");
  }

  /**
   * @return the stored date, or empty if no harvest completed yet
   * @throws IOException if the checkpoint can not be read
   * @throws InvalidConfigurationException if the checkpoint does not hold a date
   */
  public Optional<LocalDate> read() throws IOException {
    byte[] payload = handler.readCheckpoint(CHECKPOINT_NAME);
    if (payload == null) {
      return Optional.empty();
    }
    String text = new String(payload, StandardCharsets.UTF_8).trim();
    if (text.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalDate.parse(text.split("\\R", 2)[0].trim()));
    } catch (DateTimeParseException e) {
      throw new InvalidConfigurationException(
          "Checkpoint " + CHECKPOINT_NAME + " does not hold an ISO date: " + text, e);
    }
  }

  public void write(LocalDate date) throws IOException {
    checkNotNull(date);
    handler.saveCheckpoint(CHECKPOINT_NAME, date.toString().getBytes(StandardCharsets.UTF_8));
    logger.log(Level.INFO, "Saved harvest checkpoint {0}", date);
  }
}
