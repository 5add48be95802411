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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.api.client.http.GenericUrl;
import de.dainst.authority.harvester.resolve.ItemLocator;
import de.dainst.authority.harvester.resolve.ItemReference;
import java.util.Optional;

/** Concept URIs resolve to their RDF/XML description at {@code {uri}.rdf}. */
class ConceptLocator implements ItemLocator {
  static final String RDF_SUFFIX = ".rdf";

  @Override
  public Optional<ItemReference> locate(String id) {
    checkNotNull(id);
    if (!id.startsWith("http://") && !id.startsWith("https://")) {
      return Optional.empty();
    }
    return Optional.of(new ItemReference(id, new GenericUrl(id + RDF_SUFFIX)));
  }

  /** Concept URI of a description URL. */
  static String conceptUri(String url) {
    return url.endsWith(RDF_SUFFIX) ? url.substring(0, url.length() - RDF_SUFFIX.length()) : url;
  }

  /** Last path segment of a concept URI, e.g. {@code _fe65f286}. */
  static String localId(String uri) {
    int slash = uri.lastIndexOf('/');
    return slash < 0 ? uri : uri.substring(slash + 1);
  }
}
