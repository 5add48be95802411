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
package de.dainst.authority.harvester.record;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import javax.xml.XMLConstants;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.TransformerConfigurationException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.sax.SAXResult;
import javax.xml.transform.sax.SAXTransformerFactory;
import javax.xml.transform.sax.TransformerHandler;
import javax.xml.transform.stream.StreamResult;
import org.marc4j.MarcStreamWriter;
import org.marc4j.MarcWriter;
import org.marc4j.MarcXmlWriter;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.AttributesImpl;
import org.xml.sax.helpers.XMLFilterImpl;

/** Output encodings; each opens a marc4j {@link MarcWriter} over a file stream. */
public enum MarcOutputFormat {
  /** ISO 2709 records written back to back. */
  MARC(".mrc") {
    @Override
    public MarcWriter newWriter(OutputStream out) {
      return new MarcStreamWriter(out, StandardCharsets.UTF_8.name());
    }
  },
  /** Records in a single MARC21 slim {@code collection} element. */
  MARCXML(".marcxml") {
    @Override
    public MarcWriter newWriter(OutputStream out) throws IOException {
      try {
        SAXTransformerFactory factory = (SAXTransformerFactory) TransformerFactory.newInstance();
        TransformerHandler serializer = factory.newTransformerHandler();
        serializer.getTransformer().setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        serializer.getTransformer().setOutputProperty(OutputKeys.INDENT, "yes");
        serializer.setResult(new StreamResult(out));
        SchemaLocationFilter filter = new SchemaLocationFilter();
        filter.setContentHandler(serializer);
        return new MarcXmlWriter(new SAXResult(filter));
      } catch (TransformerConfigurationException e) {
        throw new IOException("Unable to create MARCXML serializer", e);
      }
    }
  };

  static final String MARCXML_NAMESPACE = "http://www.loc.gov/MARC21/slim";
  static final String MARCXML_SCHEMA_LOCATION =
      MARCXML_NAMESPACE + " http://www.loc.gov/standards/marcxml/schema/MARC21slim.xsd";

  private final String fileSuffix;

  MarcOutputFormat(String fileSuffix) {
    this.fileSuffix = fileSuffix;
  }

  public String getFileSuffix() {
    return fileSuffix;
  }

  /** Returns {@code baseName} with this format's suffix. */
  public String fileName(String baseName) {
    return baseName + fileSuffix;
  }

  /**
   * Opens a writer on {@code out}. Closing the writer finishes the document but does not
   * necessarily close {@code out}.
   */
  public abstract MarcWriter newWriter(OutputStream out) throws IOException;

  /** Declares the MARC21 slim schema location on the {@code collection} element. */
  private static class SchemaLocationFilter extends XMLFilterImpl {
    private static final String XSI_PREFIX = "xsi";
    private boolean rootSeen;

    @Override
    public void startElement(String uri, String localName, String qName, Attributes atts)
        throws SAXException {
      if (rootSeen) {
        super.startElement(uri, localName, qName, atts);
        return;
      }
      rootSeen = true;
      AttributesImpl withSchema = new AttributesImpl(atts);
      withSchema.addAttribute(
          XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI,
          "schemaLocation",
          XSI_PREFIX + ":schemaLocation",
          "CDATA",
          MARCXML_SCHEMA_LOCATION);
      super.startPrefixMapping(XSI_PREFIX, XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI);
      super.startElement(uri, localName, qName, withSchema);
    }
  }
}
