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

/** Fatal failure of a single harvester run. Other harvesters of the same run are unaffected. */
public class HarvestException extends Exception {

  public HarvestException(String message, Throwable cause) {
    super(message, cause);
  }
}
