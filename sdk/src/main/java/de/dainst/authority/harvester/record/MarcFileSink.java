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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.marc4j.MarcException;
import org.marc4j.MarcWriter;
import org.marc4j.marc.Record;

/**
 * Writes each named output to {@code <directory>/<name><suffix>} in one {@link MarcOutputFormat}.
 *
 * <p>Files are truncated when first opened during the lifetime of the sink.
 */
public class MarcFileSink implements RecordSink {
  private static final Logger logger = Logger.getLogger(MarcFileSink.class.getName());

  private final Path directory;
  private final MarcOutputFormat format;
  private final Map<String, Output> outputs = new LinkedHashMap<>();
  private boolean closed;

  public MarcFileSink(Path directory, MarcOutputFormat format) {
    this.directory = checkNotNull(directory, "directory can not be null");
    this.format = checkNotNull(format, "format can not be null");
  }

  public MarcOutputFormat getFormat() {
    return format;
  }

  /** Returns the file that backs output {@code name}. */
  public Path pathOf(String name) {
    return directory.resolve(format.fileName(name));
  }

  @Override
  public synchronized void open(String name) throws IOException {
    output(name);
  }

  @Override
  public synchronized void write(String name, Record record) throws IOException {
    checkNotNull(record);
    Output output = output(name);
    try {
      output.writer.write(record);
    } catch (MarcException e) {
      throw new IOException("Unable to write record to " + pathOf(name), e);
    }
    output.count++;
  }

  private Output output(String name) throws IOException {
    checkState(!closed, "sink is closed");
    Output output = outputs.get(name);
    if (output == null) {
      Path path = pathOf(name);
      logger.log(Level.INFO, "Opening output file {0}", path);
      OutputStream stream = new BufferedOutputStream(Files.newOutputStream(path));
      try {
        output = new Output(stream, format.newWriter(stream));
      } catch (IOException | RuntimeException e) {
        stream.close();
        throw e;
      }
      outputs.put(name, output);
    }
    return output;
  }

  @Override
  public synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    IOException failure = null;
    for (Map.Entry<String, Output> entry : outputs.entrySet()) {
      Output output = entry.getValue();
      try {
        output.writer.close();
      } catch (MarcException e) {
        failure = failure == null ? new IOException("Unable to finish " + entry.getKey(), e)
            : failure;
      }
      try {
        output.stream.close();
      } catch (IOException e) {
        failure = failure == null ? e : failure;
      }
      logger.log(Level.INFO, "Wrote {0} records to {1}",
          new Object[] {output.count, pathOf(entry.getKey())});
    }
    if (failure != null) {
      throw failure;
    }
  }

  private static class Output {
    private final OutputStream stream;
    private final MarcWriter writer;
    private int count;

    Output(OutputStream stream, MarcWriter writer) {
      this.stream = stream;
      this.writer = writer;
    }
  }
}
