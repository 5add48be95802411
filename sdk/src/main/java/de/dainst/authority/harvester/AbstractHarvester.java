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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import de.dainst.authority.harvester.resolve.ItemReference;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.marc4j.marc.Record;

/**
 * Base class running the batch pipeline of a harvester.
 *
 * <p>The change feed is consumed one page at a time. Each page is reduced to references whose
 * identifier was not harvested earlier in the run and is then handed to {@link #processBatch},
 * which fetches, resolves, assembles and writes it before the next page is requested. A feed
 * page that can not be read, or an output that can not be written, fails the run.
 */
public abstract class AbstractHarvester implements Harvester {
  private static final Logger logger = Logger.getLogger(AbstractHarvester.class.getName());

  private final String name;
  private final Set<String> harvestedIds = new HashSet<>();
  private volatile HarvestState state = HarvestState.START;
  private HarvestContext context;

  protected AbstractHarvester(String name) {
    checkArgument(!Strings.isNullOrEmpty(name), "harvester name can not be empty");
    this.name = name;
  }

  @Override
  public String getName() {
    return name;
  }

  public HarvestState getState() {
    return state;
  }

  protected HarvestContext getContext() {
    checkState(context != null, "harvester %s not initialized", name);
    return context;
  }

  @Override
  public final void init(HarvestContext context) throws Exception {
    this.context = checkNotNull(context, "context can not be null");
    harvestedIds.clear();
    state = HarvestState.START;
    startUp(context);
    for (String output : getOutputNames()) {
      context.getSink().open(output);
    }
  }

  @Override
  public final HarvestSummary harvest() throws HarvestException {
    HarvestContext context = getContext();
    logger.log(Level.INFO, "Begin {0} harvest, {1}.",
        new Object[] {name, context.getSinceFilter()});
    int batches = 0;
    int references = 0;
    int duplicates = 0;
    int records = 0;
    transition(HarvestState.READING_FEED);
    try {
      for (List<ItemReference> page : openFeed(context)) {
        batches++;
        references += page.size();
        List<ItemReference> batch = newReferences(page);
        duplicates += page.size() - batch.size();
        logger.log(Level.INFO, "Processing {0} batch #{1} ({2} items)",
            new Object[] {name, batches, batch.size()});
        if (!batch.isEmpty()) {
          records += processBatch(batch);
        }
        transition(HarvestState.READING_FEED);
      }
    } catch (UncheckedIOException e) {
      transition(HarvestState.FAILED);
      throw new HarvestException("Unable to read " + name + " change feed", e.getCause());
    } catch (IOException e) {
      transition(HarvestState.FAILED);
      throw new HarvestException(name + " harvest failed", e);
    }
    transition(HarvestState.DONE);
    HarvestSummary summary = new HarvestSummary(name, batches, references, duplicates, records);
    logger.log(Level.INFO, "End {0} harvest: {1}", new Object[] {name, summary});
    return summary;
  }

  private List<ItemReference> newReferences(List<ItemReference> page) {
    ImmutableList.Builder<ItemReference> fresh = ImmutableList.builder();
    for (ItemReference reference : page) {
      if (harvestedIds.add(reference.getId())) {
        fresh.add(reference);
      } else {
        logger.log(Level.FINE, "Skipping duplicate reference {0}", reference.getId());
      }
    }
    return fresh.build();
  }

  protected void transition(HarvestState next) {
    logger.log(Level.FINEST, "{0}: {1} -> {2}", new Object[] {name, state, next});
    state = next;
  }

  /** Appends {@code record} to the output {@code outputName}. */
  protected void write(String outputName, Record record) throws IOException {
    getContext().getSink().write(outputName, record);
  }

  @Override
  public void destroy() {}

  /**
   * Creates fetchers and reads source configuration.
   *
   * @throws Exception if the harvester can not be prepared
   */
  protected abstract void startUp(HarvestContext context) throws Exception;

  /** Names of the outputs this harvester writes to; each is opened on init. */
  protected abstract List<String> getOutputNames();

  /**
   * Opens the change feed of this run. Iterating the feed may throw {@link UncheckedIOException}
   * when a page can not be read.
   *
   * @throws IOException if the feed can not be opened
   */
  protected abstract Iterable<List<ItemReference>> openFeed(HarvestContext context)
      throws IOException;

  /**
   * Turns one batch of new references into written records.
   *
   * @return number of records written
   * @throws IOException if records can not be written
   */
  protected abstract int processBatch(List<ItemReference> batch) throws IOException;
}
