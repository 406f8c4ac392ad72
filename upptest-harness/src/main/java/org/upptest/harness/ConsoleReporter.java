package org.upptest.harness;

import org.upptest.Status;
import org.upptest.TestResult;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints one line per executed test and a summary line at the end of the
 * run. In quiet mode, passing tests are not printed. The summary line is
 * taken from a {@link ResultSummary}, which must be registered with the
 * same dispatcher before the reporter.
 */
public final class ConsoleReporter implements Plugin.TestResultListener,
  Plugin.AfterRunListener {

  private final PrintStream out;

  private final boolean quiet;

  private final ResultSummary summary;

  public ConsoleReporter(
    final PrintStream out, final boolean quiet, final ResultSummary summary
  ) {
    this.out = Objects.requireNonNull(out);
    this.quiet = quiet;
    this.summary = Objects.requireNonNull(summary);
  }

  @Override
  public void onTestResult(final TestResult result) {
    if (quiet && result.isPassed()) {
      return;
    }

    out.println(formatResult(result));
    if (result.isFailed()) {
      out.println("  " + formatFailure(result));
    }
  }

  @Override
  public void afterRun(final Status aggregate) {
    out.println(summary.summaryLine());
    out.flush();
  }

  static String formatResult(final TestResult result) {
    return String.format(
      "[%s] %s (%d ms)", result.status(), result.testName(), result.durationMillis()
    );
  }

  static String formatFailure(final TestResult result) {
    if (result.errFile().isEmpty()) {
      return result.errMessage();
    }

    return result.errFile() + ":" + result.errLine() + ": " + result.errMessage();
  }

}
