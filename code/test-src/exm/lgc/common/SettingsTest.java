package exm.lgc.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.lgc.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void resetSettings() {
    Settings.reset(Settings.RANGE_WIDENING_DELAY);
    Settings.reset(Settings.OPT_HOIST);
    Settings.reset(Settings.ANALYSIS_THREADS);
    System.clearProperty(Settings.ANALYSIS_THREADS);
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertEquals(2, Settings.getInt(Settings.RANGE_WIDENING_DELAY));
    assertEquals(1L, Settings.getLong(Settings.LANG_MIN_INDEX));
    assertTrue(Settings.getBoolean(Settings.OPT_HOIST));
    assertFalse(Settings.getBoolean(Settings.COMPILER_DEBUG));
    assertTrue(Settings.getKeys().contains(Settings.OPT_PEEL));
  }

  @Test
  public void testOverrideAndReset() throws InvalidOptionException {
    Settings.set(Settings.OPT_HOIST, "false");
    assertFalse(Settings.getBoolean(Settings.OPT_HOIST));
    Settings.reset(Settings.OPT_HOIST);
    assertTrue(Settings.getBoolean(Settings.OPT_HOIST));
  }

  @Test
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.OPT_HOIST, "maybe");
    exception.expect(InvalidOptionException.class);
    Settings.getBoolean(Settings.OPT_HOIST);
  }

  @Test
  public void testBadInteger() throws InvalidOptionException {
    Settings.set(Settings.RANGE_WIDENING_DELAY, "two");
    exception.expect(InvalidOptionException.class);
    Settings.getInt(Settings.RANGE_WIDENING_DELAY);
  }

  @Test
  public void testSystemPropertyValidated() throws InvalidOptionException {
    System.setProperty(Settings.ANALYSIS_THREADS, "0");
    exception.expect(InvalidOptionException.class);
    Settings.initLGCProperties();
  }

  @Test
  public void testSystemPropertyApplied() throws InvalidOptionException {
    System.setProperty(Settings.ANALYSIS_THREADS, "3");
    Settings.initLGCProperties();
    assertEquals(3, Settings.getInt(Settings.ANALYSIS_THREADS));
  }
}
