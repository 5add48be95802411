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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import com.google.common.collect.ImmutableList;
import de.dainst.authority.harvester.record.AuthorityRecord.BroaderReference;
import de.dainst.authority.harvester.record.AuthorityRecord.VariantHeading;
import de.dainst.authority.harvester.resolve.AncestorChain;
import de.dainst.authority.harvester.resolve.Label;
import de.dainst.authority.harvester.resolve.ResolvedItem;
import java.util.List;
import java.util.Optional;
import org.junit.Test;

/** Tests for {@link RecordAssembler}. */
public class RecordAssemblerTest {
  private static final SourceProfile ANNOTATED =
      new SourceProfile.Builder("iDAI.thesauri")
          .setPreferredLanguage("de")
          .setAnnotateVariants(true)
          .setLinkReferences(true)
          .build();
  private static final SourceProfile PLAIN =
      new SourceProfile.Builder("iDAI.gazetteer").setHeadingType(HeadingType.GEOGRAPHIC).build();

  private static ResolvedItem.Builder concept(String id) {
    return new ResolvedItem.Builder("http://thesauri.example.org/" + id).setLocalId(id);
  }

  @Test
  public void assemble_noPreferredLabel_noRecord() {
    ResolvedItem item = concept("_1").addAlternativeLabel(Label.of("Vase")).build();
    assertEquals(Optional.empty(),
        new RecordAssembler(ANNOTATED).assemble(item, AncestorChain.empty()));
  }

  @Test
  public void assemble_headingInPreferredLanguage() {
    ResolvedItem item =
        concept("_1")
            .addPreferredLabel(Label.of("vase", "en"))
            .addPreferredLabel(Label.of("Vase", "de"))
            .addAlternativeLabel(Label.of("Gefäß", "de"))
            .build();
    AuthorityRecord record =
        new RecordAssembler(ANNOTATED).assemble(item, AncestorChain.empty()).get();
    assertEquals(Label.of("Vase", "de"), record.getPreferredHeading());
    List<VariantHeading> variants = record.getVariantHeadings();
    assertEquals(2, variants.size());
    assertEquals(Label.of("vase", "en"), variants.get(0).getLabel());
    assertEquals(Optional.of(RecordAssembler.PREFERRED_LABEL_NOTE), variants.get(0).getNote());
    assertEquals(Label.of("Gefäß", "de"), variants.get(1).getLabel());
    assertEquals(Optional.of(RecordAssembler.ALTERNATIVE_LABEL_NOTE), variants.get(1).getNote());
    assertEquals("iDAI.thesauri_1", record.getControlNumber());
  }

  @Test
  public void assemble_noLabelInPreferredLanguage_fallsBackToFirst() {
    ResolvedItem item =
        concept("_1")
            .addPreferredLabel(Label.of("vase", "en"))
            .addPreferredLabel(Label.of("vaso", "it"))
            .build();
    AuthorityRecord record =
        new RecordAssembler(ANNOTATED).assemble(item, AncestorChain.empty()).get();
    assertEquals(Label.of("vase", "en"), record.getPreferredHeading());
    assertEquals(1, record.getVariantHeadings().size());
  }

  @Test
  public void assemble_variantsWithoutNotes() {
    ResolvedItem item =
        new ResolvedItem.Builder("https://gazetteer.example.org/place/2")
            .setLocalId("2")
            .addPreferredLabel(Label.of("Roma", "ita"))
            .addAlternativeLabel(Label.of("Rom", "deu"))
            .build();
    AuthorityRecord record = new RecordAssembler(PLAIN).assemble(item, AncestorChain.empty()).get();
    assertFalse(record.getVariantHeadings().get(0).getNote().isPresent());
  }

  @Test
  public void assemble_oneBroaderReferencePerChainEntry() {
    ResolvedItem parent =
        concept("_2").addPreferredLabel(Label.of("Keramik", "de")).build();
    ResolvedItem grandParent =
        concept("_3").addPreferredLabel(Label.of("Objekte", "de")).build();
    ResolvedItem item =
        concept("_1").addPreferredLabel(Label.of("Vase", "de")).setParentId(parent.getId())
            .build();
    AncestorChain chain =
        AncestorChain.of(new AncestorChain.Entry(parent, 1),
            new AncestorChain.Entry(grandParent, 2));

    AuthorityRecord record = new RecordAssembler(ANNOTATED).assemble(item, chain).get();
    List<BroaderReference> broader = record.getBroaderReferences();
    assertEquals(2, broader.size());
    assertEquals(Label.of("Keramik", "de"), broader.get(0).getLabel());
    assertEquals(1, broader.get(0).getOrder());
    assertEquals("_2", broader.get(0).getTargetLocalId());
    assertEquals(Label.of("Objekte", "de"), broader.get(1).getLabel());
    assertEquals(2, broader.get(1).getOrder());
    assertEquals(grandParent.getId(), broader.get(1).getTargetId());
  }

  @Test
  public void assemble_keepsDefinitions() {
    ResolvedItem item =
        concept("_1")
            .addPreferredLabel(Label.of("Vase", "de"))
            .addDefinition(Label.of("Ein Gefäß", "de"))
            .build();
    AuthorityRecord record =
        new RecordAssembler(ANNOTATED).assemble(item, AncestorChain.empty()).get();
    assertEquals(ImmutableList.of(Label.of("Ein Gefäß", "de")), record.getDefinitions());
  }
}
