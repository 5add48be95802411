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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import java.util.Optional;

/**
 * Constants and mapping choices of one upstream source.
 *
 * <p>Built once per harvester and shared by its {@link RecordAssembler} and {@link
 * MarcRecordEncoder}.
 */
public final class SourceProfile {
  private final String sourceCode;
  private final String catalogingAgency;
  private final String organizationCode;
  private final HeadingType headingType;
  private final Optional<String> preferredLanguage;
  private final char identifierIndicator1;
  private final char identifierIndicator2;
  private final boolean annotateVariants;
  private final boolean linkReferences;
  private final Optional<String> broaderQualifier;
  private final String broaderNoteFormat;

  private SourceProfile(Builder builder) {
    this.sourceCode = builder.sourceCode;
    this.catalogingAgency = builder.catalogingAgency;
    this.organizationCode = builder.organizationCode;
    this.headingType = builder.headingType;
    this.preferredLanguage = builder.preferredLanguage;
    this.identifierIndicator1 = builder.identifierIndicator1;
    this.identifierIndicator2 = builder.identifierIndicator2;
    this.annotateVariants = builder.annotateVariants;
    this.linkReferences = builder.linkReferences;
    this.broaderQualifier = builder.broaderQualifier;
    this.broaderNoteFormat = builder.broaderNoteFormat;
  }

  /** Source code used in 024 $2 and as control number prefix, e.g. {@code iDAI.gazetteer}. */
  public String getSourceCode() {
    return sourceCode;
  }

  /** Original cataloging agency written to 040 $a. */
  public String getCatalogingAgency() {
    return catalogingAgency;
  }

  /** MARC organization code written to 003. */
  public String getOrganizationCode() {
    return organizationCode;
  }

  public HeadingType getHeadingType() {
    return headingType;
  }

  /** Language whose preferred label becomes the established heading. */
  public Optional<String> getPreferredLanguage() {
    return preferredLanguage;
  }

  public char getIdentifierIndicator1() {
    return identifierIndicator1;
  }

  public char getIdentifierIndicator2() {
    return identifierIndicator2;
  }

  /** Whether see-from tracings say if they come from a preferred or an alternative label. */
  public boolean isAnnotateVariants() {
    return annotateVariants;
  }

  /** Whether identifiers are also written as linking subfields ($9 in 024, $0 and $1 in 5XX). */
  public boolean isLinkReferences() {
    return linkReferences;
  }

  /** Optional relationship qualifier for 5XX $x, e.g. {@code part of}. */
  public Optional<String> getBroaderQualifier() {
    return broaderQualifier;
  }

  /** Format of the 5XX $i note; receives the order as its only argument. */
  public String broaderNote(int order) {
    return String.format(broaderNoteFormat, order);
  }

  /** Control number written to 001. */
  public String controlNumber(String localId) {
    return sourceCode + localId;
  }

  /** Builder for {@link SourceProfile}. */
  public static final class Builder {
    private final String sourceCode;
    private String catalogingAgency;
    private String organizationCode = "DE-2553";
    private HeadingType headingType = HeadingType.TOPICAL;
    private Optional<String> preferredLanguage = Optional.empty();
    private char identifierIndicator1 = '7';
    private char identifierIndicator2 = ' ';
    private boolean annotateVariants;
    private boolean linkReferences;
    private Optional<String> broaderQualifier = Optional.empty();
    private String broaderNoteFormat = "broader of order %d";

    public Builder(String sourceCode) {
      checkArgument(!Strings.isNullOrEmpty(sourceCode), "source code can not be empty");
      this.sourceCode = sourceCode;
      this.catalogingAgency = sourceCode;
    }

    public Builder setCatalogingAgency(String catalogingAgency) {
      this.catalogingAgency = checkNotNull(catalogingAgency);
      return this;
    }

    public Builder setOrganizationCode(String organizationCode) {
      this.organizationCode = checkNotNull(organizationCode);
      return this;
    }

    public Builder setHeadingType(HeadingType headingType) {
      this.headingType = checkNotNull(headingType);
      return this;
    }

    public Builder setPreferredLanguage(String preferredLanguage) {
      this.preferredLanguage = Optional.ofNullable(Strings.emptyToNull(preferredLanguage));
      return this;
    }

    public Builder setIdentifierIndicators(char first, char second) {
      this.identifierIndicator1 = first;
      this.identifierIndicator2 = second;
      return this;
    }

    public Builder setAnnotateVariants(boolean annotateVariants) {
      this.annotateVariants = annotateVariants;
      return this;
    }

    public Builder setLinkReferences(boolean linkReferences) {
      this.linkReferences = linkReferences;
      return this;
    }

    public Builder setBroaderQualifier(String broaderQualifier) {
      this.broaderQualifier = Optional.ofNullable(Strings.emptyToNull(broaderQualifier));
      return this;
    }

    public Builder setBroaderNoteFormat(String broaderNoteFormat) {
      checkArgument(broaderNoteFormat.contains("%d"), "note format must contain %d");
      this.broaderNoteFormat = broaderNoteFormat;
      return this;
    }

    public SourceProfile build() {
      return new SourceProfile(this);
    }
  }
}
