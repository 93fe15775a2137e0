package exm.lgc.common;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Test;

public class LoggingTest {

  private static Logger logger;

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("LoggingTest.lgc.log", true);
  }

  @Test
  public void testSetup() {
    assertTrue(logger.isTraceEnabled());
    assertFalse("Doesn't log through the root logger",
                logger.getAdditivity());
  }

  @Test
  public void testUniqueWarn() {
    String msg = "LoggingTest: only reported once";
    Logging.uniqueWarn(msg);
    assertFalse(Logging.addEmitted(Level.WARN, msg));
    Logging.uniqueWarn(msg);
    assertTrue("Other levels are tracked separately",
               Logging.addEmitted(Level.ERROR, msg));
  }
}
