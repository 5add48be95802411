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
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Detail document of one place, as served by {@code /doc/{gazId}.json}. */
public class PlaceDocument extends GenericJson {
  /** Geometry members; large and never mapped to authority data. */
  static final Set<String> GEOMETRY_KEYS = ImmutableSet.of("prefLocation", "locations");

  @Key("@id")
  public String id;

  @Key
  public Object gazId;

  @Key
  public PlaceName prefName;

  @Key
  public List<PlaceName> names;

  @Key
  public String parent;

  @Key
  public List<String> ancestors;

  @Key
  public Boolean accessDenied;

  public Optional<String> getId() {
    return Optional.ofNullable(id).filter(value -> !value.isEmpty());
  }

  public Optional<String> getGazId() {
    return gazId == null ? Optional.empty() : Optional.of(gazId.toString());
  }

  public Optional<PlaceName> getPrefName() {
    return Optional.ofNullable(prefName);
  }

  public List<PlaceName> getNames() {
    if (names == null) {
      return ImmutableList.of();
    }
    return ImmutableList.copyOf(names);
  }

  public Optional<String> getParent() {
    return Optional.ofNullable(parent).filter(value -> !value.isEmpty());
  }

  public List<String> getAncestors() {
    if (ancestors == null) {
      return ImmutableList.of();
    }
    return ImmutableList.copyOf(ancestors);
  }

  public boolean isAccessDenied() {
    return Boolean.TRUE.equals(accessDenied);
  }

  /** Drops the geometry members kept as unknown keys by the JSON parser. */
  PlaceDocument sanitize() {
    getUnknownKeys().keySet().removeAll(GEOMETRY_KEYS);
    return this;
  }

  /** A place name with its ISO 639 language code. */
  public static class PlaceName extends GenericJson {
    @Key
    public String title;

    @Key
    public String language;

    public String getTitle() {
      return title == null ? "" : title;
    }

    public String getLanguage() {
      return language == null ? "" : language;
    }
  }
}
