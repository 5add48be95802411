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
package de.dainst.authority.harvester;

/**
 * One upstream source: reads its change feed and writes authority records for changed items.
 *
 * <p>The {@link Application} calls {@link #init}, {@link #harvest} and {@link #destroy} once per
 * run, on a single thread.
 */
public interface Harvester {

  /** Source key used to select this harvester, e.g. {@code gazetteer}. */
  String getName();

  /**
   * Prepares a run.
   *
   * <p>Throw {@link StartupException} for configuration problems.
   *
   * @param context run parameters and shared resources
   * @throws Exception if the harvester can not be prepared
   */
  void init(HarvestContext context) throws Exception;

  /**
   * Harvests all changes within the context's window.
   *
   * @return counters of the run
   * @throws HarvestException if the change feed can not be read or records can not be written
   */
  HarvestSummary harvest() throws HarvestException;

  /** Releases worker threads and other resources. */
  void destroy();
}
