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

import java.io.IOException;

/** Reads and writes named checkpoint blobs. */
public interface CheckpointHandler {

  /**
   * @return the saved checkpoint, or {@code null} if none exists
   * @throws IOException if the checkpoint exists but can not be read
   */
  byte[] readCheckpoint(String checkpointName) throws IOException;

  /**
   * Replaces the checkpoint; a {@code null} value removes it.
   *
   * @throws IOException if the checkpoint can not be written
   */
  void saveCheckpoint(String checkpointName, byte[] checkpoint) throws IOException;
}
