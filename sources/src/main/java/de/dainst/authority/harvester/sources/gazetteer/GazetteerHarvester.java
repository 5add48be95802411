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
package de.dainst.authority.harvester.sources.gazetteer;

import de.dainst.authority.harvester.HarvestContext;
import de.dainst.authority.harvester.HierarchicalHarvester;
import de.dainst.authority.harvester.config.Configuration;
import de.dainst.authority.harvester.fetch.PayloadParser;
import de.dainst.authority.harvester.fetch.RetryPolicy;
import de.dainst.authority.harvester.fetch.RetryingFetcher;
import de.dainst.authority.harvester.record.HeadingType;
import de.dainst.authority.harvester.record.SourceProfile;
import de.dainst.authority.harvester.resolve.ItemLocator;
import de.dainst.authority.harvester.resolve.ItemReference;
import de.dainst.authority.harvester.resolve.ResolvedItem;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Harvests places of the iDAI.gazetteer into {@code gazetteer_authority}.
 *
 * <p>Changed places are listed by {@code search.json}, either offset paginated or through a
 * scroll cursor, and resolved from their detail documents. The full {@code ancestors} list of a
 * place is prefetched with its batch, so the part-of chain is normally served from the cache.
 *
 * <p>Configuration:
 *
 * <ul>
 *   <li>{@code gazetteer.baseUrl} - service root, default {@value #DEFAULT_BASE_URL}
 *   <li>{@code gazetteer.batchSize} - places per search page, default 250
 *   <li>{@code gazetteer.feedMode} - {@code offset} or {@code scroll}, default {@code offset}
 * </ul>
 */
public class GazetteerHarvester extends HierarchicalHarvester {
  private static final Logger logger = Logger.getLogger(GazetteerHarvester.class.getName());

  public static final String NAME = "gazetteer";
  public static final String OUTPUT_NAME = "gazetteer_authority";

  public static final String CONFIG_BASE_URL = "gazetteer.baseUrl";
  public static final String CONFIG_BATCH_SIZE = "gazetteer.batchSize";
  public static final String CONFIG_FEED_MODE = "gazetteer.feedMode";

  public static final String DEFAULT_BASE_URL = "https://gazetteer.dainst.org";
  public static final int DEFAULT_BATCH_SIZE = 250;

  static final SourceProfile PROFILE =
      new SourceProfile.Builder("iDAI.gazetteer")
          .setHeadingType(HeadingType.GEOGRAPHIC)
          .setIdentifierIndicators(' ', '7')
          .setBroaderQualifier("part of")
          .setBroaderNoteFormat("ancestor of order %d")
          .build();

  /** How the change list is paged. */
  public enum FeedMode {
    OFFSET,
    SCROLL
  }

  private PlaceLocator locator;
  private PlaceDocumentParser parser;
  private RetryingFetcher<PlaceSearchResult> searchFetcher;
  private int batchSize;
  private FeedMode feedMode;

  public GazetteerHarvester() {
    super(NAME);
  }

  @Override
  protected void configure(HarvestContext context) {
    String baseUrl = Configuration.getString(CONFIG_BASE_URL, DEFAULT_BASE_URL).get();
    batchSize = Configuration.getInteger(CONFIG_BATCH_SIZE, DEFAULT_BATCH_SIZE).get();
    Configuration.checkConfiguration(
        batchSize > 0, "%s must be positive: %s", CONFIG_BATCH_SIZE, batchSize);
    feedMode =
        Configuration.getValue(
                CONFIG_FEED_MODE, FeedMode.OFFSET, Configuration.enumParser(FeedMode.class))
            .get();
    logger.log(Level.CONFIG, "Gazetteer {0}, {1} paging, batch size {2}",
        new Object[] {baseUrl, feedMode, batchSize});
    locator = new PlaceLocator(baseUrl);
    parser = new PlaceDocumentParser(locator);
    searchFetcher =
        new RetryingFetcher<>(
            context.getTransport(),
            PlaceSearchFeed.RESULT_PARSER,
            RetryPolicy.fromConfiguration());
  }

  @Override
  protected Iterable<List<ItemReference>> openFeed(HarvestContext context) {
    String query = PlaceSearchFeed.changedBetween(context.getSinceDate(), context.getToday());
    logger.log(Level.INFO, "Listing gazetteer places matching {0}", query);
    switch (feedMode) {
      case SCROLL:
        return new PlaceScrollFeed(searchFetcher, locator, query, batchSize);
      case OFFSET:
      default:
        return new PlaceOffsetFeed(searchFetcher, locator, query, batchSize);
    }
  }

  @Override
  protected PayloadParser<ResolvedItem> getPayloadParser() {
    return parser;
  }

  @Override
  protected ItemLocator getItemLocator() {
    return locator;
  }

  @Override
  protected SourceProfile getSourceProfile() {
    return PROFILE;
  }

  @Override
  protected String getOutputName() {
    return OUTPUT_NAME;
  }
}
