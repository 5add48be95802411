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
package de.dainst.authority.harvester.sources.loc;

import com.google.api.client.http.GenericUrl;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import de.dainst.authority.harvester.AbstractHarvester;
import de.dainst.authority.harvester.HarvestContext;
import de.dainst.authority.harvester.HarvestState;
import de.dainst.authority.harvester.config.Configuration;
import de.dainst.authority.harvester.fetch.BatchFetcher;
import de.dainst.authority.harvester.fetch.RetryPolicy;
import de.dainst.authority.harvester.fetch.RetryingFetcher;
import de.dainst.authority.harvester.resolve.ItemReference;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.marc4j.marc.Record;

/**
 * Harvests the name and subject authority change feeds of id.loc.gov.
 *
 * <p>The records are published as MARCXML and written unchanged, one output per heading tag (see
 * {@link LocHeading}). Records with none of the known heading tags are skipped.
 *
 * <p>Configuration:
 *
 * <ul>
 *   <li>{@code loc.feeds} - comma separated feed URLs, page numbers are appended
 *   <li>{@code loc.batchSize} - records fetched per batch, default 300
 * </ul>
 */
public class LocHarvester extends AbstractHarvester {
  private static final Logger logger = Logger.getLogger(LocHarvester.class.getName());

  public static final String NAME = "loc";

  public static final String CONFIG_FEEDS = "loc.feeds";
  public static final String CONFIG_BATCH_SIZE = "loc.batchSize";

  public static final List<String> DEFAULT_FEEDS =
      ImmutableList.of(
          "http://id.loc.gov/authorities/names/feed/",
          "http://id.loc.gov/authorities/subjects/feed/");
  public static final int DEFAULT_BATCH_SIZE = 300;

  private List<String> feeds;
  private int batchSize;
  private RetryingFetcher<List<AtomEntry>> feedFetcher;
  private BatchFetcher<Record> recordFetcher;
  private final Map<LocHeading, Integer> routed = new EnumMap<>(LocHeading.class);

  public LocHarvester() {
    super(NAME);
  }

  @Override
  protected void startUp(HarvestContext context) {
    feeds =
        Configuration.getMultiValue(CONFIG_FEEDS, DEFAULT_FEEDS, Configuration.STRING_PARSER)
            .get();
    Configuration.checkConfiguration(!feeds.isEmpty(), "%s can not be empty", CONFIG_FEEDS);
    batchSize = Configuration.getInteger(CONFIG_BATCH_SIZE, DEFAULT_BATCH_SIZE).get();
    Configuration.checkConfiguration(
        batchSize > 0, "%s must be positive: %s", CONFIG_BATCH_SIZE, batchSize);
    logger.log(Level.CONFIG, "LoC feeds {0}, batch size {1}", new Object[] {feeds, batchSize});

    RetryPolicy policy = RetryPolicy.fromConfiguration();
    feedFetcher = new RetryingFetcher<>(context.getTransport(), new AtomFeedParser(), policy);
    recordFetcher =
        BatchFetcher.fromConfiguration(
            new RetryingFetcher<>(context.getTransport(), new MarcXmlRecordParser(), policy),
            NAME);
    routed.clear();
  }

  @Override
  protected List<String> getOutputNames() {
    List<String> outputs = new ArrayList<>();
    for (LocHeading heading : LocHeading.values()) {
      outputs.add(heading.getOutputName());
    }
    return outputs;
  }

  @Override
  protected Iterable<List<ItemReference>> openFeed(HarvestContext context) {
    List<Iterable<ItemReference>> entries = new ArrayList<>();
    for (String feed : feeds) {
      logger.log(Level.INFO, "Reading feed {0}", feed);
      entries.add(new AtomChangeFeed(feedFetcher, feed, context.getSinceFilter()).entries());
    }
    return Iterables.partition(Iterables.concat(entries), batchSize);
  }

  @Override
  protected int processBatch(List<ItemReference> batch) throws IOException {
    transition(HarvestState.FETCHING_BATCH);
    List<GenericUrl> urls = new ArrayList<>(batch.size());
    for (ItemReference reference : batch) {
      urls.add(reference.getUrl());
    }
    List<Record> records = recordFetcher.fetchSuccessful(urls);

    transition(HarvestState.WRITING);
    int written = 0;
    for (Record record : records) {
      Optional<LocHeading> heading = LocHeading.of(record);
      if (!heading.isPresent()) {
        logger.log(Level.FINE, "No known heading in record {0}", record.getControlNumber());
        continue;
      }
      write(heading.get().getOutputName(), record);
      routed.merge(heading.get(), 1, Integer::sum);
      written++;
    }
    logger.log(Level.FINE, "Records per heading so far: {0}", routed);
    return written;
  }

  @Override
  public void destroy() {
    if (recordFetcher != null) {
      recordFetcher.close();
      recordFetcher = null;
    }
  }
}
