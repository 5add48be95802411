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

import java.io.Closeable;
import java.io.IOException;
import org.marc4j.marc.Record;

/** Destination of encoded records, organized in named outputs. */
public interface RecordSink extends Closeable {

  /**
   * Makes sure the output {@code name} exists even if no record is ever written to it.
   *
   * @throws IOException if the output can not be created
   */
  void open(String name) throws IOException;

  /**
   * Appends {@code record} to the output {@code name}, opening it if needed.
   *
   * @throws IOException if the record can not be written
   */
  void write(String name, Record record) throws IOException;
}
