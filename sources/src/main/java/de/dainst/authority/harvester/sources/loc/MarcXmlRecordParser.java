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

import de.dainst.authority.harvester.fetch.PayloadParser;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import org.marc4j.MarcException;
import org.marc4j.MarcReader;
import org.marc4j.MarcXmlReader;
import org.marc4j.marc.Record;

/** Reads the first record of a MARCXML document. */
class MarcXmlRecordParser implements PayloadParser<Record> {

  @Override
  public Record parse(byte[] content, Charset charset, String url) throws IOException {
    MarcReader reader = new MarcXmlReader(new ByteArrayInputStream(content));
    try {
      if (!reader.hasNext()) {
        throw new IOException("No MARCXML record in " + url);
      }
      return reader.next();
    } catch (MarcException e) {
      throw new IOException("Invalid MARCXML in " + url, e);
    }
  }
}
