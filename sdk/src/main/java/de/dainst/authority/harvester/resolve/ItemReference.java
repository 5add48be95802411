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

import com.google.api.client.http.GenericUrl;
import com.google.common.base.Objects;
import com.google.common.base.Strings;

/** Identifier of a harvestable item together with the URL of its detail document. */
public final class ItemReference {
  private final String id;
  private final GenericUrl url;

  public ItemReference(String id, GenericUrl url) {
    checkArgument(!Strings.isNullOrEmpty(id), "item id can not be null or empty");
    this.id = id;
    this.url = checkNotNull(url, "detail url can not be null");
  }

  public String getId() {
    return id;
  }

  public GenericUrl getUrl() {
    return url;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ItemReference)) {
      return false;
    }
    ItemReference other = (ItemReference) o;
    return id.equals(other.id) && url.build().equals(other.url.build());
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id, url.build());
  }

  @Override
  public String toString() {
    return id + " <" + url.build() + ">";
  }
}
