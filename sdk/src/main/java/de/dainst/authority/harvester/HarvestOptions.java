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

import static com.google.common.base.Preconditions.checkState;
import static de.dainst.authority.harvester.config.Configuration.checkConfiguration;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import de.dainst.authority.harvester.checkpoint.FeedCheckpoint;
import de.dainst.authority.harvester.config.Configuration;
import de.dainst.authority.harvester.record.MarcOutputFormat;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Run options of the harvester application.
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li>{@value #FORMAT} - {@code marc} (default) or {@code marcxml}
 *   <li>{@value #SOURCES} - {@code all} (default) or a comma separated list of source names
 *   <li>{@value #OUTPUT_DIRECTORY} - target directory, default {@code ./output/<today>}
 *   <li>exactly one of {@value #CONTINUE} ({@code true} resumes from the checkpoint), {@value
 *       #START_DATE} (ISO date), {@value #DAY_OFFSET} (positive number of days before today) or
 *       {@value #FULL} ({@code true} harvests without date limit)
 * </ul>
 */
public final class HarvestOptions {
  public static final String FORMAT = "harvest.format";
  public static final String SOURCES = "harvest.sources";
  public static final String OUTPUT_DIRECTORY = "harvest.outputDirectory";
  public static final String CONTINUE = "harvest.continue";
  public static final String START_DATE = "harvest.startDate";
  public static final String DAY_OFFSET = "harvest.dayOffset";
  public static final String FULL = "harvest.full";

  public static final String ALL_SOURCES = "all";

  /** How the lower bound of the harvest window is chosen. */
  public enum WindowMode {
    CONTINUE,
    START_DATE,
    DAY_OFFSET,
    FULL
  }

  private final MarcOutputFormat format;
  private final ImmutableSet<String> sources;
  private final Path outputDirectory;
  private final WindowMode windowMode;
  private final Optional<LocalDate> startDate;
  private final int dayOffset;

  private HarvestOptions(
      MarcOutputFormat format,
      ImmutableSet<String> sources,
      Path outputDirectory,
      WindowMode windowMode,
      Optional<LocalDate> startDate,
      int dayOffset) {
    this.format = format;
    this.sources = sources;
    this.outputDirectory = outputDirectory;
    this.windowMode = windowMode;
    this.startDate = startDate;
    this.dayOffset = dayOffset;
  }

  /**
   * Reads the run options.
   *
   * @param today the day the run starts
   * @throws InvalidConfigurationException if the window selection is missing or ambiguous
   */
  public static HarvestOptions fromConfiguration(LocalDate today) {
    checkState(Configuration.isInitialized(), "config not initialized");
    MarcOutputFormat format =
        Configuration.getValue(
                FORMAT, MarcOutputFormat.MARC, Configuration.enumParser(MarcOutputFormat.class))
            .get();
    List<String> sources =
        Configuration.getMultiValue(
                SOURCES, ImmutableList.of(ALL_SOURCES), Configuration.STRING_PARSER)
            .get();
    checkConfiguration(!sources.isEmpty(), "%s can not be empty", SOURCES);
    String outputDirectory =
        Configuration.getString(OUTPUT_DIRECTORY, Paths.get("output", today.toString()).toString())
            .get();

    boolean resume = Configuration.getBoolean(CONTINUE, false).get();
    Optional<LocalDate> startDate =
        Configuration.getOptional(START_DATE, Configuration.LOCAL_DATE_PARSER).get();
    Optional<Integer> dayOffset =
        Configuration.getOptional(DAY_OFFSET, Configuration.INTEGER_PARSER).get();
    boolean full = Configuration.getBoolean(FULL, false).get();

    int selected = (resume ? 1 : 0) + (startDate.isPresent() ? 1 : 0)
        + (dayOffset.isPresent() ? 1 : 0) + (full ? 1 : 0);
    checkConfiguration(selected == 1,
        "Exactly one of %s, %s, %s or %s must be set", CONTINUE, START_DATE, DAY_OFFSET, FULL);
    WindowMode mode;
    if (resume) {
      mode = WindowMode.CONTINUE;
    } else if (startDate.isPresent()) {
      mode = WindowMode.START_DATE;
    } else if (dayOffset.isPresent()) {
      checkConfiguration(dayOffset.get() > 0,
          "%s must be a positive number of days: %d", DAY_OFFSET, dayOffset.get());
      mode = WindowMode.DAY_OFFSET;
    } else {
      mode = WindowMode.FULL;
    }
    return new HarvestOptions(format, ImmutableSet.copyOf(sources), Paths.get(outputDirectory),
        mode, startDate, dayOffset.orElse(0));
  }

  public MarcOutputFormat getFormat() {
    return format;
  }

  public Path getOutputDirectory() {
    return outputDirectory;
  }

  public WindowMode getWindowMode() {
    return windowMode;
  }

  /** Whether the harvester named {@code name} takes part in this run. */
  public boolean isSelected(String name) {
    return sources.contains(ALL_SOURCES) || sources.contains(name);
  }

  public ImmutableSet<String> getSources() {
    return sources;
  }

  /**
   * Determines the first day of the harvest window.
   *
   * @param today the day the run starts
   * @param checkpoint checkpoint consulted in {@link WindowMode#CONTINUE} mode
   * @return the first day, or empty for a full harvest
   * @throws IOException if the checkpoint can not be read
   * @throws StartupException if resuming without a stored checkpoint
   */
  public Optional<LocalDate> resolveSinceDate(LocalDate today, FeedCheckpoint checkpoint)
      throws IOException {
    switch (windowMode) {
      case CONTINUE:
        Optional<LocalDate> lastRun = checkpoint.read();
        if (!lastRun.isPresent()) {
          throw new StartupException(
              "No checkpoint " + FeedCheckpoint.CHECKPOINT_NAME + " found to continue from");
        }
        return lastRun;
      case START_DATE:
        return startDate;
      case DAY_OFFSET:
        return Optional.of(today.minusDays(dayOffset));
      case FULL:
        return Optional.empty();
      default:
        throw new AssertionError("Unknown window mode " + windowMode);
    }
  }
}
