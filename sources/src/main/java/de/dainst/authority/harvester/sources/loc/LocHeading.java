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

import java.util.Optional;
import org.marc4j.marc.Record;

/** Output of a LoC authority record, chosen by the tag of its heading field. */
enum LocHeading {
  PERSONAL_NAME("100", "loc_personal_names"),
  CORPORATE_NAME("110", "loc_corporate_names"),
  MEETING_NAME("111", "loc_meeting_names"),
  UNIFORM_TITLE("130", "loc_uniform_titles"),
  TOPICAL_TERM("150", "loc_topical_terms"),
  GEOGRAPHIC_NAME("151", "loc_geographic_names"),
  GENRE_FORM_TERM("155", "loc_genre_form_terms");

  private final String tag;
  private final String outputName;

  LocHeading(String tag, String outputName) {
    this.tag = tag;
    this.outputName = outputName;
  }

  String getTag() {
    return tag;
  }

  String getOutputName() {
    return outputName;
  }

  /** First heading, in declaration order, whose tag occurs in {@code record}. */
  static Optional<LocHeading> of(Record record) {
    for (LocHeading heading : values()) {
      if (record.getVariableField(heading.tag) != null) {
        return Optional.of(heading);
      }
    }
    return Optional.empty();
  }
}
