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

import com.google.api.client.json.GenericJson;
import com.google.api.client.util.Key;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

/**
 * One page of a gazetteer {@code search.json} response.
 *
 * <pre>
 *   {"total": 1234,
 *    "scrollId": "c2Nhbj...",
 *    "result": [
 *      {"@id": "https://gazetteer.dainst.org/place/2042600", "gazId": "2042600"}
 *    ]}
 * </pre>
 */
public class PlaceSearchResult extends GenericJson {
  @Key
  public Long total;

  @Key
  public String scrollId;

  @Key
  public List<PlaceHit> result;

  public Optional<Long> getTotal() {
    return Optional.ofNullable(total);
  }

  public Optional<String> getScrollId() {
    return Optional.ofNullable(scrollId).filter(id -> !id.isEmpty());
  }

  public List<PlaceHit> getResult() {
    if (result == null) {
      return ImmutableList.of();
    }
    return ImmutableList.copyOf(result);
  }

  /** Reference to one place in a search result. */
  public static class PlaceHit extends GenericJson {
    @Key("@id")
    public String id;

    // Numeric or textual depending on the index version.
    @Key
    public Object gazId;

    public Optional<String> getId() {
      return Optional.ofNullable(id).filter(value -> !value.isEmpty());
    }

    public Optional<String> getGazId() {
      return gazId == null ? Optional.empty() : Optional.of(gazId.toString());
    }
  }
}
