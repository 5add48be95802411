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
package de.dainst.authority.harvester.resolve;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolved items of one harvester run, keyed by identifier.
 *
 * <p>Entries are never replaced or evicted. Not thread-safe: the harvester thread merges fetch
 * results after each concurrent round.
 */
public final class ItemCache {
  private final Map<String, ResolvedItem> items = new HashMap<>();

  public Optional<ResolvedItem> get(String id) {
    return Optional.ofNullable(items.get(id));
  }

  public boolean contains(String id) {
    return items.containsKey(id);
  }

  /**
   * Stores {@code item} under {@code id} unless that identifier is already cached.
   *
   * @return whether the item was stored
   */
  public boolean putIfAbsent(String id, ResolvedItem item) {
    checkNotNull(id);
    checkNotNull(item);
    return items.putIfAbsent(id, item) == null;
  }

  public int size() {
    return items.size();
  }
}
