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

import com.google.api.client.http.GenericUrl;
import com.google.common.collect.ImmutableList;
import de.dainst.authority.harvester.fetch.BatchFetcher;
import de.dainst.authority.harvester.fetch.FetchException;
import de.dainst.authority.harvester.fetch.FetchResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves item references to {@link ResolvedItem}s through an {@link ItemCache}.
 *
 * <p>Uncached references of a batch are fetched concurrently and merged into the cache once the
 * whole round has completed. When prefetching is enabled a second round fetches the parents and
 * announced ancestors of the batch that are still missing, so that ancestor resolution mostly
 * hits the cache.
 */
public class CachingItemResolver {
  private static final Logger logger = Logger.getLogger(CachingItemResolver.class.getName());

  private final BatchFetcher<ResolvedItem> batchFetcher;
  private final ItemCache cache;
  private final ItemLocator locator;
  private final boolean prefetchAncestors;

  public CachingItemResolver(
      BatchFetcher<ResolvedItem> batchFetcher,
      ItemCache cache,
      ItemLocator locator,
      boolean prefetchAncestors) {
    this.batchFetcher = checkNotNull(batchFetcher, "batch fetcher can not be null");
    this.cache = checkNotNull(cache, "cache can not be null");
    this.locator = checkNotNull(locator, "locator can not be null");
    this.prefetchAncestors = prefetchAncestors;
  }

  public ItemCache getCache() {
    return cache;
  }

  /**
   * Resolves a batch of references.
   *
   * @return the resolved items in reference order; references that could not be fetched are
   *     left out
   */
  public List<ResolvedItem> resolveAll(List<ItemReference> references) {
    Map<String, ItemReference> missing = new LinkedHashMap<>();
    for (ItemReference reference : references) {
      if (!cache.contains(reference.getId())) {
        missing.putIfAbsent(reference.getId(), reference);
      }
    }
    fetchIntoCache(ImmutableList.copyOf(missing.values()));
    if (prefetchAncestors) {
      prefetchAncestorsOf(references);
    }
    ImmutableList.Builder<ResolvedItem> resolved = ImmutableList.builder();
    for (ItemReference reference : references) {
      cache.get(reference.getId()).ifPresent(resolved::add);
    }
    return resolved.build();
  }

  /**
   * Resolves a single identifier, fetching it if it is not cached yet.
   *
   * @return the item, or empty if it can not be located or fetched
   */
  public Optional<ResolvedItem> resolve(String id) {
    Optional<ResolvedItem> cached = cache.get(id);
    if (cached.isPresent()) {
      return cached;
    }
    Optional<ItemReference> reference = locator.locate(id);
    if (!reference.isPresent()) {
      logger.log(Level.WARNING, "Unable to locate item {0}", id);
      return Optional.empty();
    }
    logger.log(Level.FINE, "Cache miss for {0}, fetching {1}",
        new Object[] {id, reference.get().getUrl()});
    try {
      ResolvedItem item = batchFetcher.getFetcher().fetch(reference.get().getUrl());
      merge(id, item);
      return cache.get(id);
    } catch (FetchException e) {
      logger.log(Level.WARNING, "Unable to fetch item " + id, e);
      return Optional.empty();
    }
  }

  private void prefetchAncestorsOf(List<ItemReference> references) {
    Set<String> wanted = new LinkedHashSet<>();
    for (ItemReference reference : references) {
      cache.get(reference.getId()).ifPresent(item -> {
        item.getParentId().ifPresent(wanted::add);
        wanted.addAll(item.getAncestorIds());
      });
    }
    List<ItemReference> toFetch = new ArrayList<>();
    for (String id : wanted) {
      if (cache.contains(id)) {
        continue;
      }
      Optional<ItemReference> located = locator.locate(id);
      if (located.isPresent()) {
        toFetch.add(located.get());
      } else {
        logger.log(Level.WARNING, "Unable to locate ancestor {0}", id);
      }
    }
    if (!toFetch.isEmpty()) {
      logger.log(Level.FINE, "Prefetching {0} ancestors", toFetch.size());
      fetchIntoCache(toFetch);
    }
  }

  private void fetchIntoCache(List<ItemReference> references) {
    if (references.isEmpty()) {
      return;
    }
    List<GenericUrl> urls = new ArrayList<>(references.size());
    for (ItemReference reference : references) {
      urls.add(reference.getUrl());
    }
    List<FetchResult<ResolvedItem>> results = batchFetcher.fetchAll(urls);
    for (int i = 0; i < results.size(); i++) {
      String id = references.get(i).getId();
      results.get(i).getPayload().ifPresent(item -> merge(id, item));
    }
  }

  private void merge(String requestedId, ResolvedItem item) {
    cache.putIfAbsent(requestedId, item);
    if (!requestedId.equals(item.getId())) {
      cache.putIfAbsent(item.getId(), item);
    }
  }
}
