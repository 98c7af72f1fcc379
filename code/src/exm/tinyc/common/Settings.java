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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.tinyc.common.exceptions.InvalidOptionException;

/**
 * General compiler settings.  Defaults are overridden by Java system
 * properties of the same name when {@link #initTinyProperties()} runs.
 * */
public class Settings
{
  public static final String LOG_FILE = "tinyc.log.file";
  public static final String LOG_TRACE = "tinyc.log.trace";

  /** Emit ;; comments into generated code */
  public static final String CODEGEN_COMMENTS = "tinyc.codegen.comments";

  /** Global variable whose value the entry function returns */
  public static final String ABI_RESULT_VAR = "tinyc.abi.result-var";
  /** Module name used for the host read/write imports */
  public static final String ABI_IMPORT_MODULE = "tinyc.abi.import-module";

  public static final String MEMORY_PAGES = "tinyc.memory.pages";
  /** Initial value of the shadow stack pointer; stack grows down */
  public static final String MEMORY_STACK_TOP = "tinyc.memory.stack-top";

  public static final String INPUT_FILENAME = "tinyc.input_filename";
  public static final String OUTPUT_FILENAME = "tinyc.output_filename";

  private static final int WASM_PAGE_SIZE = 65536;

  private static final Properties defaults;
  private static final Properties properties;

  static {
    defaults = new Properties();
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(CODEGEN_COMMENTS, "true");
    defaults.setProperty(ABI_RESULT_VAR, "X");
    defaults.setProperty(ABI_IMPORT_MODULE, "");
    defaults.setProperty(MEMORY_PAGES, "8");
    defaults.setProperty(MEMORY_STACK_TOP, "65536");
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(OUTPUT_FILENAME, "");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initTinyProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Restore all settings to built-in defaults
   */
  public static void reset() {
    properties.clear();
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(CODEGEN_COMMENTS);

    String resultVar = get(ABI_RESULT_VAR);
    if (resultVar == null || !resultVar.matches("[A-Za-z][A-Za-z0-9]*")) {
      throw new InvalidOptionException("Invalid name for " + ABI_RESULT_VAR +
                                       ": \"" + resultVar + "\"");
    }

    long pages = getLong(MEMORY_PAGES);
    if (pages < 1) {
      throw new InvalidOptionException(MEMORY_PAGES +
                                       " must be positive: " + pages);
    }
    long stackTop = getLong(MEMORY_STACK_TOP);
    if (stackTop <= 0 || stackTop % 8 != 0 ||
        stackTop > pages * WASM_PAGE_SIZE) {
      throw new InvalidOptionException(MEMORY_STACK_TOP + " must be a " +
          "positive multiple of 8 within memory of " + pages +
          " page(s): " + stackTop);
    }
  }

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String value = get(key);
    if (value == null) {
      throw new InvalidOptionException("Unknown setting " + key);
    }
    if (value.equalsIgnoreCase("true")) {
      return true;
    } else if (value.equalsIgnoreCase("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for " + key +
                                       ": " + value);
    }
  }

  public static long getLong(String key) throws InvalidOptionException {
    String value = get(key);
    if (value == null) {
      throw new InvalidOptionException("Unknown setting " + key);
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      throw new InvalidOptionException("Invalid integer value for " + key +
                                       ": " + value);
    }
  }

  public static int getInt(String key) throws InvalidOptionException {
    long value = getLong(key);
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw new InvalidOptionException("Value for " + key +
                                       " out of range: " + value);
    }
    return (int) value;
  }
}
