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

import com.google.common.base.MoreObjects;

/** Counters of a completed harvester run. */
public final class HarvestSummary {
  private final String harvester;
  private final int batches;
  private final int references;
  private final int duplicates;
  private final int records;

  HarvestSummary(String harvester, int batches, int references, int duplicates, int records) {
    this.harvester = harvester;
    this.batches = batches;
    this.references = references;
    this.duplicates = duplicates;
    this.records = records;
  }

  public String getHarvester() {
    return harvester;
  }

  /** Feed pages processed. */
  public int getBatches() {
    return batches;
  }

  /** Item references read from the feed, duplicates included. */
  public int getReferences() {
    return references;
  }

  /** References skipped because their identifier was already harvested in this run. */
  public int getDuplicates() {
    return duplicates;
  }

  /** Records written. */
  public int getRecords() {
    return records;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("harvester", harvester)
        .add("batches", batches)
        .add("references", references)
        .add("duplicates", duplicates)
        .add("records", records)
        .toString();
  }
}
