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
package exm.dirc.common;

import java.io.IOException;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.dirc.common.exceptions.DIRCRuntimeError;
import exm.dirc.common.exceptions.InvalidOptionException;
import exm.dirc.common.util.Pair;

public class Logging {
  private static final String DIRC_LOGGER_NAME = "exm.dirc";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted.
   */
  private static final Set<Pair<Level, String>> emitted =
      Collections.synchronizedSet(new HashSet<Pair<Level, String>>());

  public static Logger getDircLogger() {
    return Logger.getLogger(DIRC_LOGGER_NAME);
  }

  /**
   * Configure the dirc logger.  With no log file, only warnings go to
   * the console.
   * @param logfile file name, or empty/null for console only
   * @param trace if true log at TRACE level, else DEBUG
   * @return the configured logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger dircLogger = getDircLogger();
    Layout layout = new PatternLayout(LOG_PATTERN);
    dircLogger.removeAllAppenders();
    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(layout, logfile, false);
        dircLogger.addAppender(appender);
      } catch (IOException e) {
        throw new DIRCRuntimeError("Could not open log file " + logfile
                                   + ": " + e.getMessage());
      }
      dircLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      dircLogger.addAppender(new ConsoleAppender(layout,
                                        ConsoleAppender.SYSTEM_ERR));
      dircLogger.setLevel(Level.WARN);
    }
    dircLogger.setAdditivity(false);
    return dircLogger;
  }

  /**
   * Configure the dirc logger from {@link Settings#LOG_FILE} and
   * {@link Settings#LOG_TRACE}.
   * @throws InvalidOptionException if the trace setting is not a boolean
   */
  public static Logger setupLoggingFromSettings()
                                  throws InvalidOptionException {
    return setupLogging(Settings.get(Settings.LOG_FILE),
                        Settings.getBoolean(Settings.LOG_TRACE));
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getDircLogger().warn(msg);
    } else {
      Logging.getDircLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
