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

import com.google.common.base.MoreObjects;
import java.time.Instant;
import java.util.Optional;

/** One entry of an Atom change feed: the MARCXML link and the time of the change. */
final class AtomEntry {
  private final String marcXmlLink;
  private final Optional<Instant> updated;

  AtomEntry(String marcXmlLink, Optional<Instant> updated) {
    this.marcXmlLink = marcXmlLink;
    this.updated = updated;
  }

  String getMarcXmlLink() {
    return marcXmlLink;
  }

  Optional<Instant> getUpdated() {
    return updated;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("link", marcXmlLink)
        .add("updated", updated.orElse(null))
        .toString();
  }
}
