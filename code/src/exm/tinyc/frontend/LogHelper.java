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

package exm.tinyc.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.tinyc.common.Logging;

/**
 * Logging with source positions and indentation by nesting depth
 */
public class LogHelper {
  private static final Logger logger = Logging.getTinyLogger();

  public static void info(FilePosition pos, String msg) {
    log(0, Level.INFO, location(pos), msg);
  }

  public static void debug(FilePosition pos, String msg) {
    log(0, Level.DEBUG, location(pos), msg);
  }

  /**
     TRACE-level with indentation for nice output
   */
  public static void trace(int indent, FilePosition pos, String msg) {
    log(indent, Level.TRACE, location(pos), msg);
  }

  public static void warn(FilePosition pos, String msg) {
    log(0, Level.WARN, location(pos), msg);
  }

  /**
   * Warn, unless the identical warning was already emitted
   */
  public static void uniqueWarn(FilePosition pos, String msg) {
    Logging.uniqueWarn(location(pos) + msg);
  }

  public static void log(int indent, Level level, String location,
                         String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    StringBuilder sb = new StringBuilder(256);
    sb.append(location);
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }

  private static String location(FilePosition pos) {
    return pos == null ? "" : pos.toString() + ": ";
  }

  public static boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }
}
