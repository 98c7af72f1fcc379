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
package exm.tinyc.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.tinyc.common.exceptions.InvalidOptionException;
import exm.tinyc.common.util.Pair;

public class Logging
{
  private static final String TINYC_LOGGER_NAME = "exm.tinyc";

  private static final String LOG_PATTERN = "%-5p %m%n";

  /**
   * Messages already emitted.
   */
  static final Set<Pair<Level, String>> emitted =
       new HashSet<Pair<Level, String>>();

  public static Logger getTinyLogger()
  {
    return Logger.getLogger(TINYC_LOGGER_NAME);
  }

  /**
   * Configure the compiler logger.  With no log file, only warnings
   * and errors go to the console.
   * @param logfile file name, or empty/null for console only
   * @param trace enable TRACE level in the log file
   * @return the configured logger
   * @throws InvalidOptionException if log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws InvalidOptionException
  {
    Logger logger = getTinyLogger();
    logger.removeAllAppenders();
    logger.setAdditivity(false);
    Layout layout = new PatternLayout(LOG_PATTERN);
    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(layout, logfile, false);
        logger.addAppender(appender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file " +
                                         logfile + ": " + e.getMessage());
      }
      logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      ConsoleAppender appender = new ConsoleAppender(layout,
                                            ConsoleAppender.SYSTEM_ERR);
      logger.addAppender(appender);
      logger.setLevel(Level.WARN);
    }
    return logger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    synchronized (emitted) {
      return emitted.add(Pair.create(level, msg));
    }
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getTinyLogger().warn(msg);
    else
      getTinyLogger().debug("Duplicate Warning: " + msg);
  }
}
