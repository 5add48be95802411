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
package de.dainst.authority.harvester.sources.thesauri;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import de.dainst.authority.harvester.feed.ChangeFeed;
import de.dainst.authority.harvester.feed.SinceFilter;
import de.dainst.authority.harvester.resolve.CachingItemResolver;
import de.dainst.authority.harvester.resolve.ItemLocator;
import de.dainst.authority.harvester.resolve.ItemReference;
import de.dainst.authority.harvester.resolve.ResolvedItem;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Walks a concept tree breadth first from its root concepts.
 *
 * <p>Every wave of up to {@code batchSize} pending concepts is resolved through the shared
 * resolver, so the concepts of a page are already cached when the page is processed. Top
 * concepts are traversed but never listed; other concepts are listed when they changed inside
 * the harvest window. Each concept is visited once per iteration.
 */
class ConceptTreeFeed extends ChangeFeed<ItemReference, Integer> {
  private static final Logger logger = Logger.getLogger(ConceptTreeFeed.class.getName());

  private final CachingItemResolver resolver;
  private final ItemLocator locator;
  private final List<String> roots;
  private final SinceFilter sinceFilter;
  private final int batchSize;

  private final Queue<String> pending = new ArrayDeque<>();
  private final Set<String> visited = new HashSet<>();

  ConceptTreeFeed(
      CachingItemResolver resolver,
      ItemLocator locator,
      List<String> roots,
      SinceFilter sinceFilter,
      int batchSize) {
    super(Optional.empty());
    checkArgument(batchSize > 0, "batch size must be positive");
    this.resolver = checkNotNull(resolver);
    this.locator = checkNotNull(locator);
    this.roots = ImmutableList.copyOf(roots);
    this.sinceFilter = checkNotNull(sinceFilter);
    this.batchSize = batchSize;
  }

  @Override
  protected Page<ItemReference, Integer> getPage(Optional<Integer> token) throws IOException {
    if (!token.isPresent()) {
      pending.clear();
      visited.clear();
      enqueue(roots);
    }
    int wave = token.orElse(0) + 1;
    List<ItemReference> references = new ArrayList<>(batchSize);
    while (!pending.isEmpty() && references.size() < batchSize) {
      String id = pending.poll();
      Optional<ItemReference> reference = locator.locate(id);
      if (reference.isPresent()) {
        references.add(reference.get());
      } else if (roots.contains(id)) {
        throw new IOException("Root concept " + id + " has no resolvable description URL");
      } else {
        logger.log(Level.WARNING, "Skipping concept with unresolvable id {0}", id);
      }
    }

    List<ResolvedItem> concepts = resolver.resolveAll(references);
    checkRootsResolved(references);
    ImmutableList.Builder<ItemReference> changed = ImmutableList.builder();
    for (ResolvedItem concept : concepts) {
      enqueue(concept.getNarrowerIds());
      if (concept.isTopConcept()) {
        logger.log(Level.INFO, "Skipping root concept {0}", concept.getId());
      } else if (sinceFilter.accepts(concept.getModified(), concept.getCreated())) {
        locator.locate(concept.getId()).ifPresent(changed::add);
      } else {
        logger.log(Level.FINE, "No changes to {0} inside the window", concept.getId());
      }
    }
    logger.log(Level.FINE, "Concept wave {0}: {1} pending, {2} visited",
        new Object[] {wave, pending.size(), visited.size()});
    return pending.isEmpty() ? Page.last(changed.build()) : Page.withNext(changed.build(), wave);
  }

  /** Unavailable root concepts fail the feed; other concepts are skipped. */
  private void checkRootsResolved(List<ItemReference> references) throws IOException {
    for (ItemReference reference : references) {
      if (roots.contains(reference.getId()) && !resolver.getCache().contains(reference.getId())) {
        throw new IOException("Root concept " + reference.getId() + " could not be fetched");
      }
    }
  }

  private void enqueue(List<String> ids) {
    for (String id : ids) {
      if (visited.add(id)) {
        pending.add(id);
      }
    }
  }
}
