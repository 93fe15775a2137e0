/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.lgc.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;
import org.apache.commons.lang3.StringUtils;

import exm.lgc.common.exceptions.LGCRuntimeError;
import exm.lgc.common.util.Pair;

public class Logging {
  private static final String LGC_LOGGER_NAME = "exm.lgc";

  private static final String LOG_PATTERN = "%-5p %c{1} %x - %m%n";

  /**
   * Messages already emitted.
   */
  private static final Set<Pair<Level, String>> emitted =
          new HashSet<Pair<Level, String>>();

  public static Logger getLGCLogger() {
    return Logger.getLogger(LGC_LOGGER_NAME);
  }

  /**
   * Configure the core's logger.
   * @param logfile file to log to.  If empty or null, only warnings and
   *                errors go to the console
   * @param trace if true, log at TRACE level instead of DEBUG
   * @return the configured logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger lgcLogger = getLGCLogger();
    lgcLogger.removeAllAppenders();
    lgcLogger.setAdditivity(false);
    Layout layout = new PatternLayout(LOG_PATTERN);

    if (StringUtils.isBlank(logfile)) {
      ConsoleAppender console = new ConsoleAppender(layout,
                                    ConsoleAppender.SYSTEM_ERR);
      lgcLogger.addAppender(console);
      lgcLogger.setLevel(Level.WARN);
      return lgcLogger;
    }

    try {
      FileAppender appender = new FileAppender(layout, logfile, false);
      lgcLogger.addAppender(appender);
    } catch (IOException e) {
      throw new LGCRuntimeError("Could not open log file " + logfile +
                                ": " + e.getMessage());
    }
    lgcLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return lgcLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg) {
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getLGCLogger().warn(msg);
    } else {
      Logging.getLGCLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
