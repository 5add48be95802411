/*
 * Copyright © 2017 Google Inc.
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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import de.dainst.authority.harvester.checkpoint.CheckpointHandler;
import de.dainst.authority.harvester.checkpoint.FeedCheckpoint;
import de.dainst.authority.harvester.checkpoint.LocalFileCheckpointHandler;
import de.dainst.authority.harvester.config.Configuration;
import de.dainst.authority.harvester.record.MarcFileSink;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of a harvest run.
 *
 * <p>Loads the configuration, determines the harvest window, runs the selected harvesters one
 * after another and finally stores today's date as checkpoint. A failing harvester is logged
 * and does not stop the remaining ones, but it keeps the checkpoint from being advanced.
 *
 * <pre>{@code
 * public static void main(String[] args) {
 *   Application application = new Application.Builder(args)
 *       .addHarvester(new GazetteerHarvester())
 *       .build();
 *   System.exit(application.run() ? 0 : 1);
 * }
 * }</pre>
 *
 * @see HarvestOptions for the run options
 */
public class Application {
  private static final Logger logger = Logger.getLogger(Application.class.getName());

  private final String[] args;
  private final ImmutableList<Harvester> harvesters;
  private final Clock clock;
  private final HttpTransport transport;
  private final Optional<CheckpointHandler> checkpointHandler;

  private Application(Builder builder) {
    this.args = builder.args;
    this.harvesters = builder.harvesters.build();
    this.clock = builder.clock;
    this.transport = builder.transport;
    this.checkpointHandler = builder.checkpointHandler;
  }

  /**
   * Runs all selected harvesters.
   *
   * @return {@code true} if every selected harvester completed
   * @throws StartupException if the configuration is invalid or the output directory is unusable
   */
  public boolean run() {
    initConfig();
    LocalDate today = LocalDate.now(clock);
    HarvestOptions options = HarvestOptions.fromConfiguration(today);
    checkSources(options);
    FeedCheckpoint checkpoint =
        new FeedCheckpoint(
            checkpointHandler.orElseGet(LocalFileCheckpointHandler::fromConfiguration));

    Optional<LocalDate> since;
    try {
      since = options.resolveSinceDate(today, checkpoint);
    } catch (IOException e) {
      throw new StartupException("Unable to read harvest checkpoint", e);
    }
    logger.log(Level.INFO, "Harvesting {0} into {1} as {2}",
        new Object[] {
          since.map(d -> "all changes since " + d).orElse("everything"),
          options.getOutputDirectory(),
          options.getFormat()
        });
    Path outputDirectory = prepareOutputDirectory(options.getOutputDirectory());

    boolean success = true;
    try (MarcFileSink sink = new MarcFileSink(outputDirectory, options.getFormat())) {
      HarvestContext context =
          new HarvestContext.Builder()
              .setSinceDate(since)
              .setToday(today)
              .setTransport(transport)
              .setSink(sink)
              .build();
      for (Harvester harvester : harvesters) {
        if (options.isSelected(harvester.getName())) {
          success &= runHarvester(harvester, context);
        }
      }
    } catch (IOException e) {
      logger.log(Level.SEVERE, "Unable to finish output files", e);
      success = false;
    }

    if (!success) {
      logger.log(Level.WARNING, "Harvest incomplete, checkpoint not updated.");
      return false;
    }
    try {
      checkpoint.write(today);
    } catch (IOException e) {
      logger.log(Level.SEVERE, "Unable to save harvest checkpoint", e);
      return false;
    }
    return true;
  }

  private boolean runHarvester(Harvester harvester, HarvestContext context) {
    try {
      harvester.init(context);
      harvester.harvest();
      return true;
    } catch (StartupException e) {
      throw e;
    } catch (HarvestException e) {
      logger.log(Level.SEVERE, "Harvester " + harvester.getName() + " failed", e);
      return false;
    } catch (Exception e) {
      logger.log(Level.SEVERE, "Harvester " + harvester.getName() + " failed to start", e);
      return false;
    } finally {
      harvester.destroy();
    }
  }

  private void initConfig() {
    if (Configuration.isInitialized()) {
      return;
    }
    try {
      Configuration.initConfig(args);
    } catch (IOException e) {
      throw new StartupException("Failed to load configuration", e);
    }
  }

  private void checkSources(HarvestOptions options) {
    Set<String> known = new HashSet<>();
    known.add(HarvestOptions.ALL_SOURCES);
    for (Harvester harvester : harvesters) {
      known.add(harvester.getName());
    }
    for (String source : options.getSources()) {
      Configuration.checkConfiguration(known.contains(source),
          "Unknown source [%s] in %s, expected one of %s", source, HarvestOptions.SOURCES, known);
    }
  }

  @VisibleForTesting
  static Path prepareOutputDirectory(Path directory) {
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new StartupException("Unable to create output directory " + directory, e);
    }
    if (!Files.isDirectory(directory) || !Files.isWritable(directory)) {
      throw new StartupException("Output directory " + directory + " is not writable");
    }
    return directory;
  }

  /** Builder for {@link Application}. */
  public static class Builder {
    private final String[] args;
    private final ImmutableList.Builder<Harvester> harvesters = ImmutableList.builder();
    private Clock clock = Clock.systemDefaultZone();
    private HttpTransport transport;
    private Optional<CheckpointHandler> checkpointHandler = Optional.empty();

    /** @param args command line arguments in {@code -Dkey=value} form */
    public Builder(String[] args) {
      this.args = checkNotNull(args, "args can not be null");
    }

    /** Adds a harvester; harvesters run in the order they were added. */
    public Builder addHarvester(Harvester harvester) {
      harvesters.add(checkNotNull(harvester));
      return this;
    }

    public Builder setClock(Clock clock) {
      this.clock = checkNotNull(clock);
      return this;
    }

    public Builder setTransport(HttpTransport transport) {
      this.transport = checkNotNull(transport);
      return this;
    }

    /** Replaces the checkpoint store configured by {@code harvest.checkpointDirectory}. */
    public Builder setCheckpointHandler(CheckpointHandler checkpointHandler) {
      this.checkpointHandler = Optional.of(checkpointHandler);
      return this;
    }

    public Application build() {
      if (transport == null) {
        transport = new NetHttpTransport();
      }
      Application application = new Application(this);
      checkArgument(!application.harvesters.isEmpty(), "no harvesters added");
      return application;
    }
  }
}
