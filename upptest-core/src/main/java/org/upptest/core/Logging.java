package org.upptest.core;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Configures the {@code org.upptest} logger. Log records go to the standard
 * error stream, one line per record, so that they never interleave with
 * test reports printed to the standard output. The level is taken from
 * the {@code org.upptest.logging} system property (case-insensitive,
 * {@code INFO} by default).
 */
public final class Logging {
  private static final String ROOT_LOGGER_NAME = "org.upptest";

  private static final String LEVEL_PROPERTY = "org.upptest.logging";

  // Keep a strong reference to the (configured) logger.
  private static final Logger rootLogger = createRootLogger();

  private static Logger createRootLogger() {
    // ConsoleHandler writes to System.err.
    final Handler handler = new ConsoleHandler();
    handler.setFormatter(new LineFormatter());
    handler.setLevel(Level.ALL);

    final Logger result = Logger.getLogger(ROOT_LOGGER_NAME);
    result.addHandler(handler);
    result.setUseParentHandlers(false);
    result.setLevel(getLogLevel());
    return result;
  }

  private Logging() {}

  public static Logger getLogger(String name) {
    return Logger.getLogger(name);
  }

  public static Logger getPackageLogger(Class<?> klass) {
    return Logger.getLogger(klass.getPackage().getName());
  }

  static Level getLogLevel() {
    return parseLevel(System.getProperty(LEVEL_PROPERTY, "INFO"));
  }

  static Level parseLevel(String level) {
    try {
      return Level.parse(level.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return Level.INFO;
    }
  }

  /**
   * Formats a record as {@code upptest LEVEL logger: message}, followed by
   * the stack trace of the attached exception, if any.
   */
  static final class LineFormatter extends Formatter {
    @Override
    public String format(final LogRecord record) {
      final StringWriter result = new StringWriter();
      final PrintWriter writer = new PrintWriter(result);
      writer.printf(
        "upptest %s %s: %s%n",
        record.getLevel().getName(), record.getLoggerName(), formatMessage(record)
      );

      if (record.getThrown() != null) {
        record.getThrown().printStackTrace(writer);
      }

      writer.flush();
      return result.toString();
    }
  }
}
