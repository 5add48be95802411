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
package de.dainst.authority.harvester.record;

import static com.google.common.base.Preconditions.checkNotNull;

import de.dainst.authority.harvester.record.AuthorityRecord.BroaderReference;
import de.dainst.authority.harvester.record.AuthorityRecord.VariantHeading;
import de.dainst.authority.harvester.resolve.AncestorChain;
import de.dainst.authority.harvester.resolve.Label;
import de.dainst.authority.harvester.resolve.ResolvedItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds an {@link AuthorityRecord} from a resolved item and its ancestor chain.
 *
 * <p>The established heading is the preferred label in the profile's preferred language, or the
 * first preferred label if there is none in that language. The remaining preferred labels and
 * all alternative labels become variant headings. Items without any preferred label produce no
 * record.
 */
public class RecordAssembler {
  private static final Logger logger = Logger.getLogger(RecordAssembler.class.getName());

  static final String PREFERRED_LABEL_NOTE = "pref label";
  static final String ALTERNATIVE_LABEL_NOTE = "alt label";

  private final SourceProfile profile;

  public RecordAssembler(SourceProfile profile) {
    this.profile = checkNotNull(profile, "profile can not be null");
  }

  public SourceProfile getProfile() {
    return profile;
  }

  /**
   * @return the record, or empty if {@code item} has no preferred label
   */
  public Optional<AuthorityRecord> assemble(ResolvedItem item, AncestorChain chain) {
    checkNotNull(item);
    checkNotNull(chain);
    Optional<Label> heading = selectHeading(item);
    if (!heading.isPresent()) {
      logger.log(Level.WARNING, "No preferred label for {0}, dropping record", item.getId());
      return Optional.empty();
    }

    List<VariantHeading> variants = new ArrayList<>();
    for (Label label : item.getPreferredLabels()) {
      if (!label.equals(heading.get())) {
        variants.add(new VariantHeading(label, note(PREFERRED_LABEL_NOTE)));
      }
    }
    for (Label label : item.getAlternativeLabels()) {
      variants.add(new VariantHeading(label, note(ALTERNATIVE_LABEL_NOTE)));
    }

    List<BroaderReference> broader = new ArrayList<>();
    for (AncestorChain.Entry entry : chain.getEntries()) {
      ResolvedItem ancestor = entry.getItem();
      selectHeading(ancestor).ifPresent(label ->
          broader.add(new BroaderReference(
              label, entry.getOrder(), ancestor.getId(), ancestor.getLocalId())));
    }

    return Optional.of(new AuthorityRecord(
        profile, item.getId(), item.getLocalId(), heading.get(), variants, broader,
        item.getDefinitions()));
  }

  private Optional<Label> selectHeading(ResolvedItem item) {
    List<Label> labels = item.getPreferredLabels();
    if (labels.isEmpty()) {
      return Optional.empty();
    }
    if (profile.getPreferredLanguage().isPresent()) {
      String language = profile.getPreferredLanguage().get();
      for (Label label : labels) {
        if (label.hasLanguage(language)) {
          return Optional.of(label);
        }
      }
      logger.log(Level.WARNING, "No {0} preferred label for {1}, using {2}",
          new Object[] {language, item.getId(), labels.get(0)});
    }
    return Optional.of(labels.get(0));
  }

  private Optional<String> note(String note) {
    return profile.isAnnotateVariants() ? Optional.of(note) : Optional.empty();
  }
}
