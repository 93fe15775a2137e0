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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.lgc.common.exceptions.InvalidOptionException;

/**
 * Settings for the optimization core.
 *
 * Defaults are set here and can be overridden by Java system properties
 * with the same keys, e.g. -Dlgc.opt.hoist=false
 */
public class Settings
{
  public static final String COMPILER_DEBUG = "lgc.compiler-debug";
  public static final String LOG_FILE = "lgc.log.file";
  public static final String LOG_TRACE = "lgc.log.trace";

  // Worker threads for analyzing independent call graph SCCs
  public static final String ANALYSIS_THREADS = "lgc.analysis.threads";

  // Cap on rounds within one SCC of the effect fixed point
  public static final String EFFECTS_MAX_ITERATIONS =
                                          "lgc.effects.max-iterations";
  // Number of growth observations at a loop header before widening
  public static final String RANGE_WIDENING_DELAY = "lgc.range.widening-delay";
  // Cap on loop header iterations in range analysis
  public static final String RANGE_MAX_ITERATIONS = "lgc.range.max-iterations";
  // Smallest valid collection index in the source language
  public static final String LANG_MIN_INDEX = "lgc.lang.min-index";

  public static final String OPT_CONSTANT_FOLD = "lgc.opt.constant-fold";
  // Steps the constant folder may take on one function before giving up
  public static final String OPT_FOLD_STEP_BUDGET = "lgc.opt.fold-step-budget";
  public static final String OPT_HOIST = "lgc.opt.hoist";
  public static final String OPT_DEAD_STORE_ELIM = "lgc.opt.dead-store-elim";
  public static final String OPT_UNSWITCH = "lgc.opt.unswitch";
  // Max size of unswitched loops, as a multiple of the original loop size
  public static final String OPT_UNSWITCH_EXPANSION = "lgc.opt.unswitch-expansion";
  // Don't unswitch loops with more AST nodes than this
  public static final String OPT_UNSWITCH_MAX_NODES = "lgc.opt.unswitch-max-nodes";
  public static final String OPT_PEEL = "lgc.opt.peel";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(COMPILER_DEBUG, "false");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(ANALYSIS_THREADS, "1");
    defaults.setProperty(EFFECTS_MAX_ITERATIONS, "100");
    defaults.setProperty(RANGE_WIDENING_DELAY, "2");
    defaults.setProperty(RANGE_MAX_ITERATIONS, "64");
    defaults.setProperty(LANG_MIN_INDEX, "1");
    defaults.setProperty(OPT_CONSTANT_FOLD, "true");
    defaults.setProperty(OPT_FOLD_STEP_BUDGET, "100000");
    defaults.setProperty(OPT_HOIST, "true");
    defaults.setProperty(OPT_DEAD_STORE_ELIM, "true");
    defaults.setProperty(OPT_UNSWITCH, "true");
    defaults.setProperty(OPT_UNSWITCH_EXPANSION, "4");
    defaults.setProperty(OPT_UNSWITCH_MAX_NODES, "256");
    defaults.setProperty(OPT_PEEL, "true");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initLGCProperties() throws InvalidOptionException {
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
   * Drop an override so that the default applies again
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
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(COMPILER_DEBUG);
    getBoolean(LOG_TRACE);
    getBoolean(OPT_CONSTANT_FOLD);
    getBoolean(OPT_HOIST);
    getBoolean(OPT_DEAD_STORE_ELIM);
    getBoolean(OPT_UNSWITCH);
    getBoolean(OPT_PEEL);
    getLong(OPT_FOLD_STEP_BUDGET);
    getLong(LANG_MIN_INDEX);

    checkPositive(ANALYSIS_THREADS);
    checkPositive(EFFECTS_MAX_ITERATIONS);
    checkPositive(RANGE_WIDENING_DELAY);
    checkPositive(RANGE_MAX_ITERATIONS);
    checkPositive(OPT_UNSWITCH_EXPANSION);
    checkPositive(OPT_UNSWITCH_MAX_NODES);
  }

  private static void checkPositive(String key) throws InvalidOptionException {
    if (getLong(key) < 1) {
      throw new InvalidOptionException("Expected property " + key +
              " to be at least 1 but was " + get(key));
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
}
