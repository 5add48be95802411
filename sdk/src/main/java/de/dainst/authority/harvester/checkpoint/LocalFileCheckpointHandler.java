/*
 * Copyright © 2017 Google Inc.
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
package de.dainst.authority.harvester.checkpoint;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.ByteStreams;
import de.dainst.authority.harvester.config.Configuration;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Stores checkpoints as files in a local directory.
 *
 * <p>Optional configuration:
 *
 * <ul>
 *   <li>{@value #CHECKPOINT_DIRECTORY} - directory holding the checkpoint files, default is the
 *       working directory
 * </ul>
 */
public class LocalFileCheckpointHandler implements CheckpointHandler {

  public static final String CHECKPOINT_DIRECTORY = "harvest.checkpointDirectory";
  @VisibleForTesting static final String DEFAULT_CHECKPOINT_DIRECTORY = ".";

  private final Path basePath;
  private final FileHelper fileHelper;

  @VisibleForTesting
  LocalFileCheckpointHandler(String directory, FileHelper fileHelper) {
    String checkpointDir = checkNotNull(directory, "checkpoint directory can not be null").trim();
    this.basePath = Paths.get(checkpointDir);
    this.fileHelper = checkNotNull(fileHelper);
  }

  public static LocalFileCheckpointHandler fromConfiguration() {
    checkState(Configuration.isInitialized(), "Configuration object not initialized");
    return new LocalFileCheckpointHandler(
        Configuration.getString(CHECKPOINT_DIRECTORY, DEFAULT_CHECKPOINT_DIRECTORY).get(),
        new FileHelper());
  }

  @VisibleForTesting
  Path getCheckpointFilePath(String checkpointName) {
    checkState(!isNullOrEmpty(checkpointName), "checkpoint name can't be null or empty");
    return basePath.resolve(checkpointName);
  }

  @Override
  public byte[] readCheckpoint(String checkpointName) throws IOException {
    File checkpointFile = fileHelper.getFile(getCheckpointFilePath(checkpointName));
    if (!checkpointFile.exists()) {
      return null;
    }
    checkArgument(checkpointFile.isFile(), "checkpoint file is not pointing to file");
    return fileHelper.readFile(checkpointFile);
  }

  @Override
  public void saveCheckpoint(String checkpointName, byte[] checkpoint) throws IOException {
    File checkpointFile = fileHelper.getFile(getCheckpointFilePath(checkpointName));
    boolean exists = checkpointFile.exists();
    checkArgument(!exists || checkpointFile.isFile(), "checkpoint file is not pointing to file");
    if (checkpoint == null) {
      if (exists) {
        fileHelper.delete(checkpointFile);
      }
      return;
    }
    fileHelper.writeFile(checkpointFile, checkpoint);
  }

  /** File operations, replaceable in tests. */
  static class FileHelper {

    File getFile(Path filePath) {
      return filePath.toFile();
    }

    byte[] readFile(File file) throws IOException {
      try (FileInputStream inputStream = new FileInputStream(file)) {
        return ByteStreams.toByteArray(inputStream);
      }
    }

    void writeFile(File file, byte[] content) throws IOException {
      File parent = file.getAbsoluteFile().getParentFile();
      if (parent != null) {
        Files.createDirectories(parent.toPath());
      }
      try (FileOutputStream outputStream = new FileOutputStream(file, false)) {
        outputStream.write(content);
        outputStream.flush();
      }
    }

    void delete(File file) throws IOException {
      Files.deleteIfExists(file.toPath());
    }
  }
}
