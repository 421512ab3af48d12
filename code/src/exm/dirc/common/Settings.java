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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.dirc.common.exceptions.DIRCRuntimeError;
import exm.dirc.common.exceptions.InvalidOptionException;

/**
 * General settings for the IR core.  Defaults can be overridden by
 * Java system properties with the same key.
 * */
public class Settings
{
  public static final String SIMPLIFY_MAX_PASSES = "dirc.simplify.max-passes";
  public static final String SIMPLIFY_LOG_CHANGES = "dirc.simplify.log-changes";
  public static final String SIMPLIFY_ARITH_AFTER =
                                "dirc.simplify.arith-after-simplify";
  public static final String SIGNATURE_PROMOTE = "dirc.signature.promote";

  public static final String LOG_FILE = "dirc.log.file";
  public static final String LOG_TRACE = "dirc.log.trace";

  private static final Properties properties;
  static {
    Properties defaults = new Properties();
    defaults.setProperty(SIMPLIFY_MAX_PASSES, "1000");
    defaults.setProperty(SIMPLIFY_LOG_CHANGES, "false");
    defaults.setProperty(SIMPLIFY_ARITH_AFTER, "false");
    defaults.setProperty(SIGNATURE_PROMOTE, "true");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System, then configure logging from the
     log settings
   */
  public static void initDircProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
    Logging.setupLoggingFromSettings();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Restore the default value for a key
   */
  public static void reset(String key) {
    properties.remove(key);
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
  public static void validateProperties() throws InvalidOptionException {
    getBoolean(SIMPLIFY_LOG_CHANGES);
    getBoolean(SIMPLIFY_ARITH_AFTER);
    getBoolean(SIGNATURE_PROMOTE);
    getBoolean(LOG_TRACE);

    long maxPasses = getLong(SIMPLIFY_MAX_PASSES);
    if (maxPasses < 1) {
      throw new InvalidOptionException(SIMPLIFY_MAX_PASSES +
              " must be at least 1, but was " + maxPasses);
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }

  public static boolean getBooleanUnchecked(String key) {
    try {
      return getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new DIRCRuntimeError(e.getMessage());
    }
  }

  public static int getIntUnchecked(String key) {
    try {
      return getInt(key);
    } catch (InvalidOptionException e) {
      throw new DIRCRuntimeError(e.getMessage());
    }
  }
}
