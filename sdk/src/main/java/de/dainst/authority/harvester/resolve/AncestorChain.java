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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Ancestors of an item ordered from the immediate parent upwards.
 *
 * <p>Orders start at 1 and increase by one per entry. No identifier occurs twice.
 */
public final class AncestorChain {
  private static final AncestorChain EMPTY = new AncestorChain(ImmutableList.of(), false);

  private final ImmutableList<Entry> entries;
  private final boolean cyclic;

  AncestorChain(List<Entry> entries, boolean cyclic) {
    this.entries = ImmutableList.copyOf(entries);
    this.cyclic = cyclic;
  }

  public static AncestorChain empty() {
    return EMPTY;
  }

  @VisibleForTesting
  public static AncestorChain of(Entry... entries) {
    return new AncestorChain(ImmutableList.copyOf(entries), false);
  }

  public ImmutableList<Entry> getEntries() {
    return entries;
  }

  /** Whether the walk stopped because an identifier repeated. */
  public boolean isCyclic() {
    return cyclic;
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  @Override
  public String toString() {
    return "AncestorChain" + entries + (cyclic ? " (cyclic)" : "");
  }

  /** One ancestor and its 1-based distance from the item. */
  public static final class Entry {
    private final ResolvedItem item;
    private final int order;

    public Entry(ResolvedItem item, int order) {
      checkArgument(order > 0, "order must be positive");
      this.item = checkNotNull(item);
      this.order = order;
    }

    public ResolvedItem getItem() {
      return item;
    }

    public int getOrder() {
      return order;
    }

    @Override
    public String toString() {
      return order + ":" + item.getId();
    }
  }
}
