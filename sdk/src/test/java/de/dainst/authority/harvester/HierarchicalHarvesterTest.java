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

import static de.dainst.authority.harvester.resolve.ItemFixtures.deniedItem;
import static de.dainst.authority.harvester.resolve.ItemFixtures.item;
import static de.dainst.authority.harvester.resolve.ItemFixtures.ref;
import static de.dainst.authority.harvester.resolve.ItemFixtures.url;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import de.dainst.authority.harvester.config.Configuration.ResetConfigRule;
import de.dainst.authority.harvester.config.Configuration.SetupConfigRule;
import de.dainst.authority.harvester.fetch.BatchFetcher;
import de.dainst.authority.harvester.fetch.PayloadParser;
import de.dainst.authority.harvester.fetch.RetryPolicy;
import de.dainst.authority.harvester.fetch.TestingHttpTransport;
import de.dainst.authority.harvester.record.SourceProfile;
import de.dainst.authority.harvester.resolve.ItemFixtures;
import de.dainst.authority.harvester.resolve.ItemLocator;
import de.dainst.authority.harvester.resolve.ItemReference;
import de.dainst.authority.harvester.resolve.ResolvedItem;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Properties;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.marc4j.marc.DataField;
import org.marc4j.marc.Record;

/** Tests for {@link HierarchicalHarvester} and the batch pipeline of {@link AbstractHarvester}. */
public class HierarchicalHarvesterTest {
  private static final String OUTPUT = "test_authority";

  @Rule public ExpectedException thrown = ExpectedException.none();
  @Rule public ResetConfigRule resetConfig = new ResetConfigRule();
  @Rule public SetupConfigRule setupConfig = SetupConfigRule.uninitialized();

  private final TestingHttpTransport transport = new TestingHttpTransport();
  private final CollectingRecordSink sink = new CollectingRecordSink();
  private TestHarvester harvester;

  @Before
  public void setUp() {
    Properties config = new Properties();
    config.setProperty(RetryPolicy.CONFIG_MAXIMUM_RETRIES, "0");
    config.setProperty(BatchFetcher.CONFIG_MAX_CONCURRENT_REQUESTS, "2");
    setupConfig.initConfig(config);
  }

  @After
  public void tearDown() {
    if (harvester != null) {
      harvester.destroy();
    }
  }

  private HarvestSummary harvest(Iterable<List<ItemReference>> pages) throws Exception {
    harvester = new TestHarvester(pages);
    harvester.init(
        new HarvestContext.Builder()
            .setToday(LocalDate.of(2024, 3, 5))
            .setTransport(transport)
            .setSink(sink)
            .build());
    return harvester.harvest();
  }

  private Record recordOf(String id) {
    for (Record record : sink.getRecords(OUTPUT)) {
      if (record.getControlNumber().equals("test." + id)) {
        return record;
      }
    }
    throw new AssertionError("no record for " + id);
  }

  @Test
  public void harvest_childReferencesParent() throws Exception {
    transport.ok(url("P1"), item("P1", "Italia", null));
    transport.ok(url("P2"), item("P2", "Latium", "P1"));

    HarvestSummary summary = harvest(ImmutableList.of(ImmutableList.of(ref("P2"), ref("P1"))));

    assertEquals(2, summary.getRecords());
    assertEquals(2, sink.getRecords(OUTPUT).size());
    assertNull(recordOf("P1").getVariableField("550"));
    DataField broader = (DataField) recordOf("P2").getVariableField("550");
    assertEquals("Italia", broader.getSubfield('a').getData());
    assertEquals("test.P1", broader.getSubfield('0').getData());
    assertEquals("broader of order 1", broader.getSubfield('i').getData());
    assertEquals(1, transport.getRequestCount(url("P1")));
    assertEquals(HarvestState.DONE, harvester.getState());
  }

  @Test
  public void harvest_accessDeniedParent_noBroaderReference() throws Exception {
    transport.ok(url("P2"), item("P2", "Latium", "P1"));
    transport.ok(url("P1"), deniedItem("P1", null));

    harvest(ImmutableList.of(ImmutableList.of(ref("P2"))));

    assertEquals(1, sink.getRecords(OUTPUT).size());
    assertNull(recordOf("P2").getVariableField("550"));
  }

  @Test
  public void harvest_prefetchedAncestorIsNotWritten() throws Exception {
    transport.ok(url("P3"), item("P3", "Ostia", "P2"));
    transport.ok(url("P2"), item("P2", "Latium", "P1"));
    transport.ok(url("P1"), item("P1", "Italia", null));

    HarvestSummary summary = harvest(ImmutableList.of(ImmutableList.of(ref("P3"))));

    assertEquals(1, summary.getRecords());
    assertEquals(2, recordOf("P3").getVariableFields("550").size());
  }

  @Test
  public void harvest_duplicatesAcrossPagesAreSkipped() throws Exception {
    transport.ok(url("P1"), item("P1", "Italia", null));
    transport.ok(url("P2"), item("P2", "Latium", "P1"));

    HarvestSummary summary =
        harvest(ImmutableList.of(
            ImmutableList.of(ref("P1")),
            ImmutableList.of(ref("P1"), ref("P2")),
            ImmutableList.of(ref("P2"))));

    assertEquals(3, summary.getBatches());
    assertEquals(4, summary.getReferences());
    assertEquals(2, summary.getDuplicates());
    assertEquals(2, summary.getRecords());
    assertEquals(2, sink.getRecords(OUTPUT).size());
  }

  @Test
  public void harvest_unavailableItemIsSkipped() throws Exception {
    transport.ok(url("P1"), item("P1", "Italia", null));
    transport.reply(url("P9"), 404, "not found");

    HarvestSummary summary = harvest(ImmutableList.of(ImmutableList.of(ref("P1"), ref("P9"))));

    assertEquals(1, summary.getRecords());
    assertNotNull(recordOf("P1"));
  }

  @Test
  public void harvest_itemWithoutLabelIsDropped() throws Exception {
    transport.ok(url("P1"), item("P1", null, null));

    HarvestSummary summary = harvest(ImmutableList.of(ImmutableList.of(ref("P1"))));

    assertEquals(0, summary.getRecords());
    assertTrue(sink.getRecords(OUTPUT).isEmpty());
  }

  @Test
  public void init_opensOutputWithoutRecords() throws Exception {
    HarvestSummary summary = harvest(ImmutableList.of());
    assertThat(sink.getOpened(), hasItem(OUTPUT));
    assertEquals(0, summary.getBatches());
  }

  @Test
  public void harvest_unreadableFeed_fails() throws Exception {
    transport.ok(url("P1"), item("P1", "Italia", null));
    Iterable<List<ItemReference>> failing =
        () -> {
          throw new UncheckedIOException(new IOException("feed page unavailable"));
        };
    List<List<ItemReference>> first = ImmutableList.of(ImmutableList.of(ref("P1")));
    Iterable<List<ItemReference>> broken = Iterables.concat(first, failing);
    try {
      harvest(broken);
      fail("expected HarvestException");
    } catch (HarvestException e) {
      assertThat(e.getCause(), instanceOf(IOException.class));
    }
    assertEquals(HarvestState.FAILED, harvester.getState());
    assertEquals(1, sink.getRecords(OUTPUT).size());
  }

  @Test
  public void harvest_beforeInit_throwsException() throws Exception {
    harvester = new TestHarvester(ImmutableList.of());
    thrown.expect(IllegalStateException.class);
    harvester.harvest();
  }

  private static class TestHarvester extends HierarchicalHarvester {
    private static final SourceProfile PROFILE =
        new SourceProfile.Builder("test.").setLinkReferences(true).build();

    private final Iterable<List<ItemReference>> pages;

    TestHarvester(Iterable<List<ItemReference>> pages) {
      super("test");
      this.pages = pages;
    }

    @Override
    protected PayloadParser<ResolvedItem> getPayloadParser() {
      return ItemFixtures.PARSER;
    }

    @Override
    protected ItemLocator getItemLocator() {
      return ItemFixtures.LOCATOR;
    }

    @Override
    protected SourceProfile getSourceProfile() {
      return PROFILE;
    }

    @Override
    protected String getOutputName() {
      return OUTPUT;
    }

    @Override
    protected Iterable<List<ItemReference>> openFeed(HarvestContext context) {
      return pages;
    }
  }
}
