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
package de.dainst.authority.harvester.sources.loc;

import com.google.common.collect.ImmutableList;
import de.dainst.authority.harvester.feed.Timestamps;
import de.dainst.authority.harvester.fetch.PayloadParser;
import de.dainst.authority.harvester.sources.XmlDocuments;
import java.io.IOException;
import java.nio.charset.Charset;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Reads the entries of one Atom feed page. Entries without an {@code alternate} link of type
 * {@code application/marc+xml} are dropped.
 */
class AtomFeedParser implements PayloadParser<List<AtomEntry>> {
  private static final Logger logger = Logger.getLogger(AtomFeedParser.class.getName());

  static final String ATOM_NS = "http://www.w3.org/2005/Atom";
  static final String MARC_XML_TYPE = "application/marc+xml";

  @Override
  public List<AtomEntry> parse(byte[] content, Charset charset, String url) throws IOException {
    Document document = XmlDocuments.parse(content);
    Element feed = document.getDocumentElement();
    if (!ATOM_NS.equals(feed.getNamespaceURI()) || !"feed".equals(feed.getLocalName())) {
      throw new IOException(url + " is not an Atom feed: " + feed.getNodeName());
    }
    ImmutableList.Builder<AtomEntry> entries = ImmutableList.builder();
    for (Element entry : XmlDocuments.children(feed, ATOM_NS, "entry")) {
      Optional<String> link = marcXmlLink(entry);
      if (!link.isPresent()) {
        logger.log(Level.FINE, "Feed entry without MARCXML link in {0}", url);
        continue;
      }
      entries.add(new AtomEntry(link.get(), updated(entry)));
    }
    return entries.build();
  }

  private static Optional<String> marcXmlLink(Element entry) {
    for (Element link : XmlDocuments.children(entry, ATOM_NS, "link")) {
      String href = link.getAttribute("href").trim();
      if ("alternate".equals(link.getAttribute("rel"))
          && MARC_XML_TYPE.equals(link.getAttribute("type"))
          && !href.isEmpty()) {
        return Optional.of(href);
      }
    }
    return Optional.empty();
  }

  private static Optional<Instant> updated(Element entry) {
    List<Element> updated = XmlDocuments.children(entry, ATOM_NS, "updated");
    return updated.isEmpty()
        ? Optional.empty()
        : Timestamps.parse(XmlDocuments.text(updated.get(0)));
  }
}
