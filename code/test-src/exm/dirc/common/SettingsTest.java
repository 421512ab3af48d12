package exm.dirc.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Test;

import exm.dirc.common.exceptions.DIRCRuntimeError;
import exm.dirc.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @After
  public void resetAll() {
    for (String key: Settings.getKeys()) {
      Settings.reset(key);
    }
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertEquals(1000, Settings.getInt(Settings.SIMPLIFY_MAX_PASSES));
    assertTrue(Settings.getBoolean(Settings.SIGNATURE_PROMOTE));
    assertFalse(Settings.getBoolean(Settings.SIMPLIFY_ARITH_AFTER));
    assertEquals("", Settings.get(Settings.LOG_FILE));
    Settings.validateProperties();
  }

  @Test
  public void testSetAndReset() {
    Settings.set(Settings.SIMPLIFY_MAX_PASSES, " 7 ");
    assertEquals(7, Settings.getIntUnchecked(Settings.SIMPLIFY_MAX_PASSES));
    Settings.set(Settings.SIGNATURE_PROMOTE, "FALSE");
    assertFalse(Settings.getBooleanUnchecked(Settings.SIGNATURE_PROMOTE));
    Settings.reset(Settings.SIMPLIFY_MAX_PASSES);
    assertEquals(1000, Settings.getIntUnchecked(Settings.SIMPLIFY_MAX_PASSES));
  }

  @Test
  public void testKeysSorted() {
    assertTrue(Settings.getKeys().contains(Settings.LOG_TRACE));
    assertEquals(Settings.LOG_FILE, Settings.getKeys().get(0));
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.LOG_TRACE, "yes");
    Settings.getBoolean(Settings.LOG_TRACE);
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadInt() throws InvalidOptionException {
    Settings.set(Settings.SIMPLIFY_MAX_PASSES, "lots");
    Settings.getInt(Settings.SIMPLIFY_MAX_PASSES);
  }

  @Test(expected=InvalidOptionException.class)
  public void testPassesMustBePositive() throws InvalidOptionException {
    Settings.set(Settings.SIMPLIFY_MAX_PASSES, "0");
    Settings.validateProperties();
  }

  @Test(expected=DIRCRuntimeError.class)
  public void testUncheckedWraps() {
    Settings.set(Settings.SIGNATURE_PROMOTE, "maybe");
    Settings.getBooleanUnchecked(Settings.SIGNATURE_PROMOTE);
  }

  @Test
  public void testSystemPropertiesOverride() throws InvalidOptionException {
    System.setProperty(Settings.SIMPLIFY_LOG_CHANGES, "true");
    try {
      Settings.initDircProperties();
      assertTrue(Settings.getBoolean(Settings.SIMPLIFY_LOG_CHANGES));
    } finally {
      System.clearProperty(Settings.SIMPLIFY_LOG_CHANGES);
    }
  }
}
