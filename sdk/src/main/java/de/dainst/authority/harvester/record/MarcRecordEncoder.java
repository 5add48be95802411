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

import com.google.common.annotations.VisibleForTesting;
import de.dainst.authority.harvester.record.AuthorityRecord.BroaderReference;
import de.dainst.authority.harvester.record.AuthorityRecord.VariantHeading;
import de.dainst.authority.harvester.resolve.Label;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import org.marc4j.marc.DataField;
import org.marc4j.marc.MarcFactory;
import org.marc4j.marc.Record;

/** Maps an {@link AuthorityRecord} onto a MARC21 authority record. */
public class MarcRecordEncoder {

  /** Leader of a new authority record with UCS/Unicode character coding. */
  static final String LEADER = "00000nz  a2200000n  4500";

  /** Positions 06 to 39 of field 008; positions 00 to 05 hold the date entered on file. */
  static final String FIXED_LENGTH_DATA = "||||zzz||||d          || bn|      ";

  private static final DateTimeFormatter DATE_ENTERED = DateTimeFormatter.ofPattern("yyMMdd");

  private final MarcFactory factory;
  private final Clock clock;

  public MarcRecordEncoder() {
    this(MarcFactory.newInstance(), Clock.systemDefaultZone());
  }

  @VisibleForTesting
  MarcRecordEncoder(MarcFactory factory, Clock clock) {
    this.factory = checkNotNull(factory);
    this.clock = checkNotNull(clock);
  }

  public Record encode(AuthorityRecord authority) {
    SourceProfile profile = authority.getProfile();
    HeadingType headingType = profile.getHeadingType();
    Record record = factory.newRecord(LEADER);
    record.addVariableField(factory.newControlField("001", authority.getControlNumber()));
    record.addVariableField(factory.newControlField("003", profile.getOrganizationCode()));
    record.addVariableField(factory.newControlField(
        "008", LocalDate.now(clock).format(DATE_ENTERED) + FIXED_LENGTH_DATA));

    DataField identifier = factory.newDataField(
        "024", profile.getIdentifierIndicator1(), profile.getIdentifierIndicator2());
    addSubfield(identifier, 'a', authority.getLocalId());
    addSubfield(identifier, '2', profile.getSourceCode());
    if (profile.isLinkReferences()) {
      addSubfield(identifier, '9', authority.getControlNumber());
    }
    record.addVariableField(identifier);

    DataField source = factory.newDataField("040", ' ', ' ');
    addSubfield(source, 'a', profile.getCatalogingAgency());
    record.addVariableField(source);

    record.addVariableField(heading(headingType.headingTag(), authority.getPreferredHeading()));

    for (VariantHeading variant : authority.getVariantHeadings()) {
      DataField field = heading(headingType.variantTag(), variant.getLabel());
      variant.getNote().ifPresent(note -> addSubfield(field, 'i', note));
      record.addVariableField(field);
    }

    for (BroaderReference broader : authority.getBroaderReferences()) {
      DataField field = heading(headingType.broaderTag(), broader.getLabel());
      if (profile.isLinkReferences()) {
        addSubfield(field, '0', profile.controlNumber(broader.getTargetLocalId()));
        addSubfield(field, '1', broader.getTargetId());
      }
      profile.getBroaderQualifier().ifPresent(qualifier -> addSubfield(field, 'x', qualifier));
      addSubfield(field, 'i', profile.broaderNote(broader.getOrder()));
      record.addVariableField(field);
    }

    for (Label definition : authority.getDefinitions()) {
      DataField field = factory.newDataField("677", ' ', ' ');
      addSubfield(field, 'a', definition.getText());
      definition.getLanguage().ifPresent(language -> addSubfield(field, 'l', language));
      addSubfield(field, 'v', profile.getSourceCode());
      record.addVariableField(field);
    }
    return record;
  }

  private DataField heading(String tag, Label label) {
    DataField field = factory.newDataField(tag, ' ', ' ');
    addSubfield(field, 'a', label.getText());
    label.getLanguage().ifPresent(language -> addSubfield(field, 'l', language));
    return field;
  }

  private void addSubfield(DataField field, char code, String data) {
    field.addSubfield(factory.newSubfield(code, data));
  }
}
