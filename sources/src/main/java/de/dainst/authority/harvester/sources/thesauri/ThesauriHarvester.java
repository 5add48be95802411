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
package de.dainst.authority.harvester.sources.thesauri;

import com.google.common.collect.ImmutableList;
import de.dainst.authority.harvester.HarvestContext;
import de.dainst.authority.harvester.HierarchicalHarvester;
import de.dainst.authority.harvester.config.Configuration;
import de.dainst.authority.harvester.fetch.PayloadParser;
import de.dainst.authority.harvester.record.HeadingType;
import de.dainst.authority.harvester.record.SourceProfile;
import de.dainst.authority.harvester.resolve.ItemLocator;
import de.dainst.authority.harvester.resolve.ItemReference;
import de.dainst.authority.harvester.resolve.ResolvedItem;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Harvests the SKOS concepts of the iDAI.thesauri into {@code thesauri_authority}.
 *
 * <p>The concept tree is walked from the configured root concepts. Headings use the German
 * preferred label unless {@code thesauri.preferredLanguage} names another language; the broader
 * concepts are linked by URI and local control number.
 */
public class ThesauriHarvester extends HierarchicalHarvester {
  private static final Logger logger = Logger.getLogger(ThesauriHarvester.class.getName());

  public static final String NAME = "thesauri";
  public static final String OUTPUT_NAME = "thesauri_authority";

  public static final String CONFIG_BASE_URL = "thesauri.baseUrl";
  public static final String CONFIG_ROOT_CONCEPTS = "thesauri.rootConcepts";
  public static final String CONFIG_PREFERRED_LANGUAGE = "thesauri.preferredLanguage";
  public static final String CONFIG_BATCH_SIZE = "thesauri.batchSize";

  public static final String DEFAULT_BASE_URL = "http://thesauri.dainst.org/";
  public static final String DEFAULT_ROOT_CONCEPT_ID = "_fe65f286";
  public static final String DEFAULT_PREFERRED_LANGUAGE = "de";
  public static final int DEFAULT_BATCH_SIZE = 100;

  private final ConceptLocator locator = new ConceptLocator();
  private final ConceptParser parser = new ConceptParser();
  private List<String> rootConcepts;
  private int batchSize;
  private SourceProfile profile;

  public ThesauriHarvester() {
    super(NAME);
  }

  @Override
  protected void configure(HarvestContext context) {
    String baseUrl = Configuration.getString(CONFIG_BASE_URL, DEFAULT_BASE_URL).get();
    String defaultRoot =
        (baseUrl.endsWith("/") ? baseUrl : baseUrl + "/") + DEFAULT_ROOT_CONCEPT_ID;
    rootConcepts =
        Configuration.getMultiValue(
                CONFIG_ROOT_CONCEPTS, ImmutableList.of(defaultRoot), Configuration.STRING_PARSER)
            .get();
    Configuration.checkConfiguration(
        !rootConcepts.isEmpty(), "%s can not be empty", CONFIG_ROOT_CONCEPTS);
    batchSize = Configuration.getInteger(CONFIG_BATCH_SIZE, DEFAULT_BATCH_SIZE).get();
    Configuration.checkConfiguration(
        batchSize > 0, "%s must be positive: %s", CONFIG_BATCH_SIZE, batchSize);
    String language =
        Configuration.getString(CONFIG_PREFERRED_LANGUAGE, DEFAULT_PREFERRED_LANGUAGE).get();
    logger.log(Level.CONFIG, "Thesauri roots {0}, heading language {1}, batch size {2}",
        new Object[] {rootConcepts, language, batchSize});
    profile =
        new SourceProfile.Builder("iDAI.thesauri")
            .setCatalogingAgency("Deutsches Archäologisches Institut")
            .setHeadingType(HeadingType.TOPICAL)
            .setPreferredLanguage(language)
            .setIdentifierIndicators('7', ' ')
            .setAnnotateVariants(true)
            .setLinkReferences(true)
            .setBroaderNoteFormat("broader concept of order %d")
            .build();
  }

  @Override
  protected Iterable<List<ItemReference>> openFeed(HarvestContext context) {
    logger.log(Level.INFO, "Walking concept tree from {0}", rootConcepts);
    return new ConceptTreeFeed(
        getItemResolver(), locator, rootConcepts, context.getSinceFilter(), batchSize);
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
    return profile;
  }

  @Override
  protected String getOutputName() {
    return OUTPUT_NAME;
  }
}
