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
package de.dainst.authority.harvester;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import de.dainst.authority.harvester.HarvestOptions.WindowMode;
import de.dainst.authority.harvester.checkpoint.FeedCheckpoint;
import de.dainst.authority.harvester.checkpoint.InMemoryCheckpointHandler;
import de.dainst.authority.harvester.config.Configuration.ResetConfigRule;
import de.dainst.authority.harvester.config.Configuration.SetupConfigRule;
import de.dainst.authority.harvester.record.MarcOutputFormat;
import java.io.IOException;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.Optional;
import java.util.Properties;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

/** Tests for {@link HarvestOptions}. */
public class HarvestOptionsTest {
  private static final LocalDate TODAY = LocalDate.of(2024, 3, 5);

  @Rule public ExpectedException thrown = ExpectedException.none();
  @Rule public ResetConfigRule resetConfig = new ResetConfigRule();
  @Rule public SetupConfigRule setupConfig = SetupConfigRule.uninitialized();

  private final InMemoryCheckpointHandler checkpointHandler = new InMemoryCheckpointHandler();
  private final FeedCheckpoint checkpoint = new FeedCheckpoint(checkpointHandler);

  private HarvestOptions options(String... keyValues) {
    Properties config = new Properties();
    for (int i = 0; i < keyValues.length; i += 2) {
      config.setProperty(keyValues[i], keyValues[i + 1]);
    }
    setupConfig.initConfig(config);
    return HarvestOptions.fromConfiguration(TODAY);
  }

  @Test
  public void defaults() throws IOException {
    HarvestOptions options = options(HarvestOptions.FULL, "true");
    assertEquals(MarcOutputFormat.MARC, options.getFormat());
    assertEquals(Paths.get("output", "2024-03-05"), options.getOutputDirectory());
    assertEquals(WindowMode.FULL, options.getWindowMode());
    assertTrue(options.isSelected("gazetteer"));
    assertTrue(options.isSelected("loc"));
    assertEquals(Optional.empty(), options.resolveSinceDate(TODAY, checkpoint));
  }

  @Test
  public void formatAndSources() {
    HarvestOptions options =
        options(
            HarvestOptions.FULL, "true",
            HarvestOptions.FORMAT, "MarcXml",
            HarvestOptions.SOURCES, "gazetteer, thesauri",
            HarvestOptions.OUTPUT_DIRECTORY, "/tmp/harvest");
    assertEquals(MarcOutputFormat.MARCXML, options.getFormat());
    assertEquals(Paths.get("/tmp/harvest"), options.getOutputDirectory());
    assertTrue(options.isSelected("thesauri"));
    assertFalse(options.isSelected("loc"));
  }

  @Test
  public void unknownFormat_throwsException() {
    thrown.expect(InvalidConfigurationException.class);
    options(HarvestOptions.FULL, "true", HarvestOptions.FORMAT, "json");
  }

  @Test
  public void startDate() throws IOException {
    HarvestOptions options = options(HarvestOptions.START_DATE, "2024-01-15");
    assertEquals(WindowMode.START_DATE, options.getWindowMode());
    assertEquals(Optional.of(LocalDate.of(2024, 1, 15)),
        options.resolveSinceDate(TODAY, checkpoint));
  }

  @Test
  public void dayOffset() throws IOException {
    HarvestOptions options = options(HarvestOptions.DAY_OFFSET, "7");
    assertEquals(Optional.of(LocalDate.of(2024, 2, 27)),
        options.resolveSinceDate(TODAY, checkpoint));
  }

  @Test
  public void dayOffset_notPositive_throwsException() {
    thrown.expect(InvalidConfigurationException.class);
    thrown.expectMessage(HarvestOptions.DAY_OFFSET);
    options(HarvestOptions.DAY_OFFSET, "0");
  }

  @Test
  public void continue_fromCheckpoint() throws IOException {
    checkpoint.write(LocalDate.of(2024, 3, 1));
    HarvestOptions options = options(HarvestOptions.CONTINUE, "true");
    assertEquals(WindowMode.CONTINUE, options.getWindowMode());
    assertEquals(Optional.of(LocalDate.of(2024, 3, 1)),
        options.resolveSinceDate(TODAY, checkpoint));
  }

  @Test
  public void continue_withoutCheckpoint_throwsException() throws IOException {
    HarvestOptions options = options(HarvestOptions.CONTINUE, "true");
    thrown.expect(StartupException.class);
    thrown.expectMessage(FeedCheckpoint.CHECKPOINT_NAME);
    options.resolveSinceDate(TODAY, checkpoint);
  }

  @Test
  public void noWindow_throwsException() {
    thrown.expect(InvalidConfigurationException.class);
    options(HarvestOptions.FORMAT, "marc");
  }

  @Test
  public void twoWindows_throwsException() {
    thrown.expect(InvalidConfigurationException.class);
    options(HarvestOptions.FULL, "true", HarvestOptions.DAY_OFFSET, "3");
  }

  @Test
  public void falseFlagsDoNotSelectAWindow() {
    HarvestOptions options =
        options(HarvestOptions.FULL, "false", HarvestOptions.CONTINUE, "false",
            HarvestOptions.START_DATE, "2024-01-01");
    assertEquals(WindowMode.START_DATE, options.getWindowMode());
  }
}
