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
package de.dainst.authority.harvester.sources.gazetteer;

import com.google.api.client.http.GenericUrl;
import de.dainst.authority.harvester.fetch.RetryingFetcher;
import de.dainst.authority.harvester.resolve.ItemReference;
import java.io.IOException;
import java.util.Optional;

/**
 * Scroll cursor search. The first request opens the cursor with {@code scroll=true}, later
 * requests pass the returned {@code scrollId}; an empty result list ends the feed.
 */
class PlaceScrollFeed extends PlaceSearchFeed<String> {

  PlaceScrollFeed(
      RetryingFetcher<PlaceSearchResult> fetcher, PlaceLocator locator, String query, int limit) {
    super(Optional.empty(), fetcher, locator, query, limit);
  }

  @Override
  protected Page<ItemReference, String> getPage(Optional<String> scrollId) throws IOException {
    GenericUrl url = newSearchUrl();
    if (scrollId.isPresent()) {
      url.set("scrollId", scrollId.get());
    } else {
      url.set("scroll", true);
    }
    PlaceSearchResult result = search(url);
    if (result.getResult().isEmpty()) {
      return Page.last(toReferences(result.getResult()));
    }
    Optional<String> next = result.getScrollId();
    if (!next.isPresent()) {
      return Page.last(toReferences(result.getResult()));
    }
    return Page.withNext(toReferences(result.getResult()), next.get());
  }
}
