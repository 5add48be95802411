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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Walks the parent pointers of an item and collects its {@link AncestorChain}.
 *
 * <p>The walk ends when a node has no parent, when an ancestor is access-denied (that ancestor
 * is not part of the chain), when an ancestor can not be fetched, or when an identifier comes
 * up a second time. An ancestor without a preferred label is stepped over: it gets no entry and
 * does not advance the order, so orders always count emitted entries.
 */
public class AncestorResolver {
  private static final Logger logger = Logger.getLogger(AncestorResolver.class.getName());

  private final CachingItemResolver itemResolver;

  public AncestorResolver(CachingItemResolver itemResolver) {
    this.itemResolver = checkNotNull(itemResolver, "item resolver can not be null");
  }

  public AncestorChain resolve(ResolvedItem item) {
    checkNotNull(item);
    Set<String> visited = new HashSet<>();
    visited.add(item.getId());
    List<AncestorChain.Entry> entries = new ArrayList<>();
    Optional<String> next = item.getParentId();
    while (next.isPresent()) {
      String ancestorId = next.get();
      if (!visited.add(ancestorId)) {
        logger.log(Level.SEVERE, "Cyclic ancestry for {0}: {1} was already visited",
            new Object[] {item.getId(), ancestorId});
        return new AncestorChain(entries, true);
      }
      Optional<ResolvedItem> resolved = itemResolver.resolve(ancestorId);
      if (!resolved.isPresent()) {
        logger.log(Level.WARNING, "Ancestor {0} of {1} is unavailable, truncating chain",
            new Object[] {ancestorId, item.getId()});
        break;
      }
      ResolvedItem ancestor = resolved.get();
      if (ancestor.isAccessDenied()) {
        logger.log(Level.FINE, "Ancestor {0} of {1} is access-denied",
            new Object[] {ancestorId, item.getId()});
        break;
      }
      if (ancestor.getPreferredLabels().isEmpty()) {
        logger.log(Level.WARNING, "No preferred label for ancestor {0}, skipping it",
            ancestorId);
      } else {
        entries.add(new AncestorChain.Entry(ancestor, entries.size() + 1));
      }
      next = ancestor.getParentId();
    }
    return new AncestorChain(entries, false);
  }
}
