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

import static de.dainst.authority.harvester.sources.FixtureTransport.fixture;
import static org.junit.Assert.assertEquals;

import com.google.api.client.util.BackOff;
import com.google.common.collect.ImmutableList;
import de.dainst.authority.harvester.feed.SinceFilter;
import de.dainst.authority.harvester.fetch.RetryPolicy;
import de.dainst.authority.harvester.fetch.RetryingFetcher;
import de.dainst.authority.harvester.resolve.ItemReference;
import de.dainst.authority.harvester.sources.FixtureTransport;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

/** Tests for {@link AtomChangeFeed}. */
public class AtomChangeFeedTest {
  private static final String FEED = "http://loc.test/authorities/names/feed/";
  private static final String PAGE_PATH = "/authorities/names/feed/";

  @Rule public ExpectedException thrown = ExpectedException.none();

  private final FixtureTransport transport = new FixtureTransport();
  private final RetryingFetcher<List<AtomEntry>> fetcher =
      new RetryingFetcher<>(
          transport,
          new AtomFeedParser(),
          new RetryPolicy.Builder()
              .setMaxRetryLimit(0)
              .setBackOffFactory(() -> BackOff.ZERO_BACKOFF)
              .build());

  private void servePages() throws IOException {
    transport
        .xml(PAGE_PATH + "1", fixture("loc/names_feed_1.xml"))
        .xml(PAGE_PATH + "2", fixture("loc/names_feed_2.xml"))
        .xml(PAGE_PATH + "3", fixture("loc/names_feed_3.xml"))
        .xml(PAGE_PATH + "4", fixture("loc/empty_feed.xml"));
  }

  private static List<String> ids(Iterable<ItemReference> references) {
    List<String> ids = new ArrayList<>();
    for (ItemReference reference : references) {
      ids.add(reference.getId());
    }
    return ids;
  }

  @Test
  public void entries_stopAtFirstPageOutsideWindow() throws IOException {
    servePages();

    List<String> ids =
        ids(new AtomChangeFeed(fetcher, FEED, SinceFilter.startOf(LocalDate.of(2024, 3, 1)))
            .entries());

    assertEquals(
        ImmutableList.of(
            "http://loc.test/authorities/names/n79021457.marcxml.xml",
            "http://loc.test/authorities/names/n80012345.marcxml.xml",
            "http://loc.test/authorities/names/n50000001.marcxml.xml"),
        ids);
    assertEquals(1, transport.getRequestCount(PAGE_PATH + "3"));
    assertEquals(0, transport.getRequestCount(PAGE_PATH + "4"));
  }

  @Test
  public void entries_unbounded_readsUntilEmptyPage() throws IOException {
    servePages();

    List<String> ids = ids(new AtomChangeFeed(fetcher, FEED, SinceFilter.unbounded()).entries());

    assertEquals(5, ids.size());
    assertEquals(1, transport.getRequestCount(PAGE_PATH + "4"));
  }

  @Test
  public void entries_referenceUrlIsMarcXmlLink() throws IOException {
    servePages();
    ItemReference first =
        new AtomChangeFeed(fetcher, FEED, SinceFilter.unbounded()).entries().iterator().next();
    assertEquals(first.getId(), first.getUrl().build());
  }

  @Test
  public void entries_unreadablePage_throwsException() throws IOException {
    transport.xml(PAGE_PATH + "1", fixture("loc/names_feed_1.xml"));
    transport.status(PAGE_PATH + "2", 503);
    thrown.expect(UncheckedIOException.class);
    ids(new AtomChangeFeed(fetcher, FEED, SinceFilter.unbounded()).entries());
  }
}
