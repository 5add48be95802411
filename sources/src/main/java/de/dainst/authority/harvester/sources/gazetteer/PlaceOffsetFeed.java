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
import java.util.List;
import java.util.Optional;

/**
 * Offset paginated search. Stops at a short page or once {@code total} places were listed.
 */
class PlaceOffsetFeed extends PlaceSearchFeed<Integer> {

  PlaceOffsetFeed(
      RetryingFetcher<PlaceSearchResult> fetcher, PlaceLocator locator, String query, int limit) {
    super(Optional.of(0), fetcher, locator, query, limit);
  }

  @Override
  protected Page<ItemReference, Integer> getPage(Optional<Integer> token) throws IOException {
    int offset = token.orElse(0);
    GenericUrl url = newSearchUrl();
    url.set("offset", offset);
    PlaceSearchResult result = search(url);
    int listed = result.getResult().size();
    List<ItemReference> references = toReferences(result.getResult());
    int next = offset + listed;
    boolean exhausted =
        listed < getLimit() || result.getTotal().map(total -> next >= total).orElse(false);
    return exhausted ? Page.last(references) : Page.withNext(references, next);
  }
}
