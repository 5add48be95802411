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
import de.dainst.authority.harvester.feed.ChangeFeed;
import de.dainst.authority.harvester.feed.SinceFilter;
import de.dainst.authority.harvester.fetch.RetryingFetcher;
import de.dainst.authority.harvester.resolve.ItemReference;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Page indexed Atom feed, requested as {@code {feedUrl}1}, {@code {feedUrl}2} and so on.
 *
 * <p>The feed lists the newest changes first. Reading stops at an empty page or at the first
 * page without any entry inside the harvest window.
 */
class AtomChangeFeed extends ChangeFeed<ItemReference, Integer> {
  private static final Logger logger = Logger.getLogger(AtomChangeFeed.class.getName());

  static final int FIRST_PAGE = 1;

  private final RetryingFetcher<List<AtomEntry>> fetcher;
  private final String feedUrl;
  private final SinceFilter sinceFilter;

  AtomChangeFeed(
      RetryingFetcher<List<AtomEntry>> fetcher, String feedUrl, SinceFilter sinceFilter) {
    super(Optional.of(FIRST_PAGE));
    this.fetcher = fetcher;
    this.feedUrl = feedUrl;
    this.sinceFilter = sinceFilter;
  }

  @Override
  protected Page<ItemReference, Integer> getPage(Optional<Integer> token) throws IOException {
    int index = token.orElse(FIRST_PAGE);
    GenericUrl url = new GenericUrl(feedUrl + index);
    List<AtomEntry> entries = fetcher.fetch(url);
    ImmutableList.Builder<ItemReference> references = ImmutableList.builder();
    int accepted = 0;
    for (AtomEntry entry : entries) {
      if (sinceFilter.accepts(entry.getUpdated())) {
        references.add(new ItemReference(entry.getMarcXmlLink(),
            new GenericUrl(entry.getMarcXmlLink())));
        accepted++;
      }
    }
    logger.log(Level.FINE, "Feed page {0}: {1} of {2} entries inside the window",
        new Object[] {url, accepted, entries.size()});
    if (accepted == 0) {
      return Page.last(ImmutableList.of());
    }
    return Page.withNext(references.build(), index + 1);
  }
}
