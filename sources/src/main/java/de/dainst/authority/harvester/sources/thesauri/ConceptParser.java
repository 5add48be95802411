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

import de.dainst.authority.harvester.feed.Timestamps;
import de.dainst.authority.harvester.fetch.PayloadParser;
import de.dainst.authority.harvester.resolve.Label;
import de.dainst.authority.harvester.resolve.ResolvedItem;
import de.dainst.authority.harvester.sources.XmlDocuments;
import java.io.IOException;
import java.nio.charset.Charset;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Decodes the RDF/XML description of a SKOS concept.
 *
 * <p>Only the {@code rdf:Description} about the requested concept is read. The first {@code
 * skos:broader} is the parent, {@code skos:narrower} references feed the tree walk and any {@code
 * skos:topConceptOf} marks the concept as a top concept. Change times come from the {@code
 * dct:modified} and {@code dct:created} values of the concept's change notes; the latest of each
 * is kept.
 */
class ConceptParser implements PayloadParser<ResolvedItem> {
  static final String SKOS_NS = "http://www.w3.org/2004/02/skos/core#";
  static final String DCT_NS = "http://purl.org/dc/terms/";

  @Override
  public ResolvedItem parse(byte[] content, Charset charset, String url) throws IOException {
    Document document = XmlDocuments.parse(content);
    String uri = ConceptLocator.conceptUri(url);
    Element description = findDescription(document.getDocumentElement(), uri, url);

    ResolvedItem.Builder item =
        new ResolvedItem.Builder(uri).setLocalId(ConceptLocator.localId(uri));
    readLabels(description, "prefLabel", item::addPreferredLabel);
    readLabels(description, "altLabel", item::addAlternativeLabel);
    readLabels(description, "definition", item::addDefinition);
    for (Element broader : XmlDocuments.children(description, SKOS_NS, "broader")) {
      String resource = XmlDocuments.rdfResource(broader);
      if (!resource.isEmpty()) {
        item.setParentId(resource);
        break;
      }
    }
    for (Element narrower : XmlDocuments.children(description, SKOS_NS, "narrower")) {
      String resource = XmlDocuments.rdfResource(narrower);
      if (!resource.isEmpty()) {
        item.addNarrowerId(resource);
      }
    }
    item.setTopConcept(!XmlDocuments.children(description, SKOS_NS, "topConceptOf").isEmpty());
    item.setModified(latestChange(description, "modified"));
    item.setCreated(latestChange(description, "created"));
    return item.build();
  }

  private static Element findDescription(Element rdf, String uri, String url) throws IOException {
    for (Element description : XmlDocuments.children(rdf, XmlDocuments.RDF_NS, "Description")) {
      if (uri.equals(XmlDocuments.rdfAbout(description))) {
        return description;
      }
    }
    throw new IOException("No description of " + uri + " in " + url);
  }

  private static void readLabels(Element description, String property, Consumer<Label> sink) {
    for (Element element : XmlDocuments.children(description, SKOS_NS, property)) {
      String text = XmlDocuments.text(element);
      if (!text.isEmpty()) {
        sink.accept(Label.of(text, XmlDocuments.language(element)));
      }
    }
  }

  private static Optional<Instant> latestChange(Element description, String property) {
    Optional<Instant> latest = Optional.empty();
    for (Element note : XmlDocuments.children(description, SKOS_NS, "changeNote")) {
      for (Element change : XmlDocuments.children(note, XmlDocuments.RDF_NS, "Description")) {
        latest = later(latest, XmlDocuments.children(change, DCT_NS, property));
      }
    }
    return latest;
  }

  private static Optional<Instant> later(Optional<Instant> current, List<Element> values) {
    Optional<Instant> latest = current;
    for (Element value : values) {
      Optional<Instant> parsed = Timestamps.parse(XmlDocuments.text(value));
      if (parsed.isPresent() && (!latest.isPresent() || parsed.get().isAfter(latest.get()))) {
        latest = parsed;
      }
    }
    return latest;
  }
}
