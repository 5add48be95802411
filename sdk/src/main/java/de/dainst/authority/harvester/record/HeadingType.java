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

/** Kind of heading an authority record establishes; selects the X50 or X51 tag family. */
public enum HeadingType {
  TOPICAL("50"),
  GEOGRAPHIC("51");

  private final String tagSuffix;

  HeadingType(String tagSuffix) {
    this.tagSuffix = tagSuffix;
  }

  /** Tag of the established heading, 150 or 151. */
  public String headingTag() {
    return "1" + tagSuffix;
  }

  /** Tag of see-from tracings, 450 or 451. */
  public String variantTag() {
    return "4" + tagSuffix;
  }

  /** Tag of see-also-from tracings to broader headings, 550 or 551. */
  public String broaderTag() {
    return "5" + tagSuffix;
  }
}
