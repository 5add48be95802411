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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.common.base.Strings;
import de.dainst.authority.harvester.fetch.PayloadParser;
import de.dainst.authority.harvester.resolve.Label;
import de.dainst.authority.harvester.resolve.ResolvedItem;
import de.dainst.authority.harvester.sources.gazetteer.PlaceDocument.PlaceName;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decodes a place document into a {@link ResolvedItem}.
 *
 * <p>{@code prefName} becomes the preferred label, every entry of {@code names} an alternative
 * label. {@code parent} and {@code ancestors} are kept as pointers for the ancestor walk.
 */
class PlaceDocumentParser implements PayloadParser<ResolvedItem> {
  private static final Logger logger = Logger.getLogger(PlaceDocumentParser.class.getName());
  static final JsonFactory JSON_FACTORY = JacksonFactory.getDefaultInstance();

  private final PlaceLocator locator;

  PlaceDocumentParser(PlaceLocator locator) {
    this.locator = locator;
  }

  @Override
  public ResolvedItem parse(byte[] content, Charset charset, String url) throws IOException {
    PlaceDocument document =
        JSON_FACTORY
            .fromInputStream(
                new ByteArrayInputStream(content),
                charset == null ? UTF_8 : charset,
                PlaceDocument.class)
            .sanitize();
    Optional<String> gazId =
        document.getGazId().isPresent()
            ? document.getGazId()
            : document.getId().flatMap(PlaceLocator::gazIdOf);
    if (!gazId.isPresent()) {
      throw new IOException("Place document " + url + " carries neither @id nor gazId");
    }
    String id = document.getId().orElse(locator.placeUri(gazId.get()));

    ResolvedItem.Builder item =
        new ResolvedItem.Builder(id)
            .setLocalId(gazId.get())
            .setAccessDenied(document.isAccessDenied());
    document.getPrefName().flatMap(PlaceDocumentParser::toLabel).ifPresent(
        item::addPreferredLabel);
    for (PlaceName name : document.getNames()) {
      toLabel(name).ifPresent(item::addAlternativeLabel);
    }
    document.getParent().ifPresent(item::setParentId);
    for (String ancestor : document.getAncestors()) {
      if (!Strings.isNullOrEmpty(ancestor)) {
        item.addAncestorId(ancestor);
      }
    }
    ResolvedItem resolved = item.build();
    logger.log(Level.FINEST, "Parsed place {0}", resolved);
    return resolved;
  }

  private static Optional<Label> toLabel(PlaceName name) {
    if (name.getTitle().trim().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(Label.of(name.getTitle(), name.getLanguage()));
  }
}
