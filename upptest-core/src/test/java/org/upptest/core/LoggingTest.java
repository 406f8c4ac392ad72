package org.upptest.core;

import org.junit.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class LoggingTest {

  @Test
  public void parsesKnownLevels() {
    assertEquals(Level.FINE, Logging.parseLevel("FINE"));
    assertEquals(Level.WARNING, Logging.parseLevel("WARNING"));
  }

  @Test
  public void levelNamesAreCaseInsensitive() {
    assertEquals(Level.CONFIG, Logging.parseLevel("config"));
    assertEquals(Level.FINE, Logging.parseLevel(" Fine "));
  }

  @Test
  public void unknownLevelFallsBackToInfo() {
    assertEquals(Level.INFO, Logging.parseLevel("chatty"));
  }

  @Test
  public void packageLoggersLiveUnderProjectLogger() {
    assertEquals(
      "org.upptest.core",
      Logging.getPackageLogger(TestRunner.class).getName()
    );
  }

  @Test
  public void formatsRecordOnOneLine() {
    final LogRecord record = new LogRecord(Level.WARNING, "Test {0} failed to tear down");
    record.setLoggerName("org.upptest.core");
    record.setParameters(new Object[] { "db-insert" });

    assertEquals(
      "upptest WARNING org.upptest.core: Test db-insert failed to tear down" + System.lineSeparator(),
      new Logging.LineFormatter().format(record)
    );
  }

  @Test
  public void appendsStackTraceOfThrown() {
    final LogRecord record = new LogRecord(Level.FINE, "Unhandled exception");
    record.setLoggerName("org.upptest.core");
    record.setThrown(new IllegalStateException("closed"));

    final String text = new Logging.LineFormatter().format(record);
    assertTrue(text.startsWith("upptest FINE org.upptest.core: Unhandled exception"));
    assertTrue(text.contains("java.lang.IllegalStateException: closed"));
  }

}
