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
package de.dainst.authority.harvester.sources;

import com.google.common.collect.ImmutableList;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

/** Namespace-aware DOM parsing and navigation for Atom and RDF/XML payloads. */
public final class XmlDocuments {
  public static final String RDF_NS = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";

  private XmlDocuments() {}

  /**
   * Parses {@code content} with external entities and DTDs disabled.
   *
   * @throws IOException if the content is not well-formed XML
   */
  public static Document parse(byte[] content) throws IOException {
    DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    factory.setExpandEntityReferences(false);
    try {
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      DocumentBuilder builder = factory.newDocumentBuilder();
      return builder.parse(new ByteArrayInputStream(content));
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser not available", e);
    } catch (SAXException e) {
      throw new IOException("Invalid XML: " + e.getMessage(), e);
    }
  }

  /** Element children of {@code parent} with the given namespace and local name. */
  public static List<Element> children(Node parent, String namespace, String localName) {
    ImmutableList.Builder<Element> children = ImmutableList.builder();
    for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
      if (child.getNodeType() == Node.ELEMENT_NODE
          && namespace.equals(child.getNamespaceURI())
          && localName.equals(child.getLocalName())) {
        children.add((Element) child);
      }
    }
    return children.build();
  }

  /** Trimmed text content of {@code element}. */
  public static String text(Element element) {
    String text = element.getTextContent();
    return text == null ? "" : text.trim();
  }

  /** Value of {@code rdf:resource}, or empty string. */
  public static String rdfResource(Element element) {
    return element.getAttributeNS(RDF_NS, "resource").trim();
  }

  /** Value of {@code rdf:about}, or empty string. */
  public static String rdfAbout(Element element) {
    return element.getAttributeNS(RDF_NS, "about").trim();
  }

  /** Value of {@code xml:lang}, or empty string. */
  public static String language(Element element) {
    return element.getAttributeNS(XMLConstants.XML_NS_URI, "lang").trim();
  }
}
