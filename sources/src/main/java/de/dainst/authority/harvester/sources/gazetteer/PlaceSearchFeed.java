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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.api.client.http.GenericUrl;
import com.google.common.collect.ImmutableList;
import de.dainst.authority.harvester.feed.ChangeFeed;
import de.dainst.authority.harvester.fetch.FetchException;
import de.dainst.authority.harvester.fetch.PayloadParser;
import de.dainst.authority.harvester.fetch.RetryingFetcher;
import de.dainst.authority.harvester.resolve.ItemReference;
import de.dainst.authority.harvester.sources.gazetteer.PlaceSearchResult.PlaceHit;
import java.io.ByteArrayInputStream;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Shared query construction and hit mapping for the gazetteer search feeds. */
abstract class PlaceSearchFeed<Q> extends ChangeFeed<ItemReference, Q> {
  private static final Logger logger = Logger.getLogger(PlaceSearchFeed.class.getName());

  static final String MATCH_ALL = "*";

  static final PayloadParser<PlaceSearchResult> RESULT_PARSER =
      (content, charset, url) ->
          PlaceDocumentParser.JSON_FACTORY.fromInputStream(
              new ByteArrayInputStream(content),
              charset == null ? UTF_8 : charset,
              PlaceSearchResult.class);

  private final RetryingFetcher<PlaceSearchResult> fetcher;
  private final PlaceLocator locator;
  private final String query;
  private final int limit;

  PlaceSearchFeed(
      Optional<Q> startToken,
      RetryingFetcher<PlaceSearchResult> fetcher,
      PlaceLocator locator,
      String query,
      int limit) {
    super(startToken);
    this.fetcher = fetcher;
    this.locator = locator;
    this.query = query;
    this.limit = limit;
  }

  /** Query selecting places changed between {@code since} and {@code today}, both inclusive. */
  static String changedBetween(Optional<LocalDate> since, LocalDate today) {
    return since.map(start -> "lastChangeDate:[" + start + " TO " + today + "]").orElse(MATCH_ALL);
  }

  int getLimit() {
    return limit;
  }

  GenericUrl newSearchUrl() {
    GenericUrl url = locator.searchUrl();
    url.set("q", query);
    url.set("limit", limit);
    return url;
  }

  PlaceSearchResult search(GenericUrl url) throws FetchException {
    PlaceSearchResult result = fetcher.fetch(url);
    logger.log(Level.FINE, "Search {0} returned {1} of {2} places",
        new Object[] {url, result.getResult().size(), result.getTotal().orElse(null)});
    return result;
  }

  List<ItemReference> toReferences(List<PlaceHit> hits) {
    ImmutableList.Builder<ItemReference> references = ImmutableList.builder();
    for (PlaceHit hit : hits) {
      Optional<ItemReference> reference = locator.locate(hit);
      if (reference.isPresent()) {
        references.add(reference.get());
      } else {
        logger.log(Level.WARNING, "Skipping search hit without place id: {0}", hit);
      }
    }
    return references.build();
  }
}
