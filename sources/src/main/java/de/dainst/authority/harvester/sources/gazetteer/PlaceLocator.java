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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.api.client.http.GenericUrl;
import de.dainst.authority.harvester.resolve.ItemLocator;
import de.dainst.authority.harvester.resolve.ItemReference;
import de.dainst.authority.harvester.sources.gazetteer.PlaceSearchResult.PlaceHit;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Maps place URIs such as {@code https://gazetteer.dainst.org/place/2042600} to detail URLs. */
class PlaceLocator implements ItemLocator {
  private static final Pattern PLACE_URI = Pattern.compile(".*/place/(\\d+)$");

  private final String baseUrl;

  PlaceLocator(String baseUrl) {
    this.baseUrl = trimTrailingSlash(checkNotNull(baseUrl));
  }

  /** Numeric gazetteer id at the end of a place URI. */
  static Optional<String> gazIdOf(String placeUri) {
    Matcher matcher = PLACE_URI.matcher(placeUri);
    return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
  }

  @Override
  public Optional<ItemReference> locate(String id) {
    return gazIdOf(id).map(gazId -> new ItemReference(id, documentUrl(gazId)));
  }

  /** Reference for a search hit, preferring its {@code @id} over the bare {@code gazId}. */
  Optional<ItemReference> locate(PlaceHit hit) {
    Optional<String> gazId =
        hit.getGazId().isPresent() ? hit.getGazId() : hit.getId().flatMap(PlaceLocator::gazIdOf);
    return gazId.map(
        value -> new ItemReference(hit.getId().orElse(placeUri(value)), documentUrl(value)));
  }

  GenericUrl documentUrl(String gazId) {
    return new GenericUrl(baseUrl + "/doc/" + gazId + ".json");
  }

  String placeUri(String gazId) {
    return baseUrl + "/place/" + gazId;
  }

  GenericUrl searchUrl() {
    return new GenericUrl(baseUrl + "/search.json");
  }

  static String trimTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
