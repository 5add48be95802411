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

import de.dainst.authority.harvester.Application;
import de.dainst.authority.harvester.StartupException;
import de.dainst.authority.harvester.sources.gazetteer.GazetteerHarvester;
import de.dainst.authority.harvester.sources.loc.LocHarvester;
import de.dainst.authority.harvester.sources.thesauri.ThesauriHarvester;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point harvesting the iDAI.gazetteer, id.loc.gov and the iDAI.thesauri.
 *
 * <p>A sample configuration file can be found at
 * {src/main/resources/de/dainst/authority/harvester/sources/harvester-config.properties.sample}
 *
 * <p>{@code mvn package} builds a self-contained jar with all dependencies. Command to run a
 * harvest of the last seven days:
 *
 * <pre>
 *    java
 *    -jar authority-harvester-sources-{version}.jar
 *    -Dconfig={your config.properties file}
 *    -Dharvest.dayOffset=7
 *  </pre>
 *
 * If the configuration file is not specified, harvester-config.properties is read from the
 * working directory when present. The process exits with status 1 if the run could not start
 * or any harvester failed.
 */
public class HarvesterMain {
  private static final Logger logger = Logger.getLogger(HarvesterMain.class.getName());

  public static void main(String[] args) {
    Application application =
        new Application.Builder(args)
            .addHarvester(new GazetteerHarvester())
            .addHarvester(new LocHarvester())
            .addHarvester(new ThesauriHarvester())
            .build();
    boolean success;
    try {
      success = application.run();
    } catch (StartupException e) {
      logger.log(Level.SEVERE, "Harvest could not start", e);
      success = false;
    }
    System.exit(success ? 0 : 1);
  }
}
