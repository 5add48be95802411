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
import static org.junit.Assert.assertTrue;

import de.dainst.authority.harvester.HarvestContext;
import de.dainst.authority.harvester.HarvestSummary;
import de.dainst.authority.harvester.config.Configuration.ResetConfigRule;
import de.dainst.authority.harvester.config.Configuration.SetupConfigRule;
import de.dainst.authority.harvester.fetch.RetryPolicy;
import de.dainst.authority.harvester.sources.FixtureTransport;
import de.dainst.authority.harvester.sources.RecordingSink;
import java.io.IOException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.Properties;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.marc4j.marc.DataField;
import org.marc4j.marc.Record;

/** Tests for {@link LocHarvester}. */
public class LocHarvesterTest {
  private static final String NAMES = "/authorities/names/";
  private static final String SUBJECTS = "/authorities/subjects/";

  @Rule public ResetConfigRule resetConfig = new ResetConfigRule();
  @Rule public SetupConfigRule setupConfig = SetupConfigRule.uninitialized();

  private final FixtureTransport transport = new FixtureTransport();
  private final RecordingSink sink = new RecordingSink();
  private final LocHarvester harvester = new LocHarvester();

  @Before
  public void setUp() throws IOException {
    transport
        .xml(NAMES + "feed/1", fixture("loc/names_feed_1.xml"))
        .xml(NAMES + "feed/2", fixture("loc/names_feed_2.xml"))
        .xml(NAMES + "feed/3", fixture("loc/names_feed_3.xml"))
        .xml(SUBJECTS + "feed/1", fixture("loc/subjects_feed_1.xml"))
        .xml(SUBJECTS + "feed/2", fixture("loc/empty_feed.xml"))
        .xml(NAMES + "n79021457.marcxml.xml", fixture("loc/n79021457.marcxml.xml"))
        .xml(NAMES + "n80012345.marcxml.xml", fixture("loc/n80012345.marcxml.xml"))
        .xml(SUBJECTS + "sh85004812.marcxml.xml", fixture("loc/sh85004812.marcxml.xml"))
        .xml(SUBJECTS + "sh99999999.marcxml.xml", fixture("loc/sh99999999.marcxml.xml"));
    Properties config = new Properties();
    config.setProperty(RetryPolicy.CONFIG_MAXIMUM_RETRIES, "0");
    config.setProperty(LocHarvester.CONFIG_FEEDS,
        "http://loc.test/authorities/names/feed/, http://loc.test/authorities/subjects/feed/");
    config.setProperty(LocHarvester.CONFIG_BATCH_SIZE, "2");
    setupConfig.initConfig(config);
  }

  @After
  public void tearDown() {
    harvester.destroy();
  }

  private HarvestSummary harvest() throws Exception {
    harvester.init(
        new HarvestContext.Builder()
            .setSinceDate(Optional.of(LocalDate.of(2024, 3, 1)))
            .setToday(LocalDate.of(2024, 3, 5))
            .setTransport(transport)
            .setSink(sink)
            .build());
    return harvester.harvest();
  }

  @Test
  public void init_opensOneOutputPerHeading() throws Exception {
    harvest();
    assertEquals(LocHeading.values().length, sink.getOpened().size());
    assertTrue(sink.getOpened().contains("loc_meeting_names"));
    assertTrue(sink.getRecords("loc_meeting_names").isEmpty());
  }

  @Test
  public void harvest_routesRecordsByHeading() throws Exception {
    transport.xml(NAMES + "n50000001.marcxml.xml", fixture("loc/n50000001.marcxml.xml"));

    HarvestSummary summary = harvest();

    assertEquals(5, summary.getReferences());
    assertEquals(3, summary.getBatches());
    assertEquals(4, summary.getRecords());
    assertEquals(1, sink.getRecords("loc_personal_names").size());
    assertEquals(2, sink.getRecords("loc_corporate_names").size());
    assertEquals(1, sink.getRecords("loc_topical_terms").size());
    assertEquals(0, transport.getRequestCount(NAMES + "feed/4"));
  }

  @Test
  public void harvest_recordsAreWrittenUnchanged() throws Exception {
    harvest();
    Record amphorae = sink.getRecords("loc_topical_terms").get(0);
    DataField broader = (DataField) amphorae.getVariableField("550");
    assertEquals("g", broader.getSubfield('w').getData());
    assertEquals("Vases", broader.getSubfield('a').getData());
  }

  @Test
  public void harvest_unavailableRecordIsSkipped() throws Exception {
    HarvestSummary summary = harvest();

    assertEquals(3, summary.getRecords());
    assertEquals(1, sink.getRecords("loc_corporate_names").size());
    assertEquals(1, transport.getRequestCount(NAMES + "n50000001.marcxml.xml"));
  }
}
