package org.upptest.core;

import org.upptest.AssertionFailure;
import org.upptest.Status;
import org.upptest.TestCase;
import org.upptest.TestResult;

import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Test execution driver. Captures the sequence of actions performed during
 * the execution of a single test (set up, body, tear down), measures the
 * duration of the sequence and turns its outcome into a {@link TestResult}.
 * <p>
 * No failure of the test escapes the driver. Assertion failures and other
 * exceptions, including {@link StackOverflowError} from a runaway test,
 * are recorded in the result. Only {@link OutOfMemoryError} and
 * {@link InternalError} propagate, because the virtual machine cannot be
 * trusted to run further tests after either of them.
 */
public final class ExecutionDriver {
  private static final Logger logger = Logging.getPackageLogger(ExecutionDriver.class);

  private ExecutionDriver() {}

  /**
   * Executes a test and records the outcome in the given result.
   *
   * @param test The test to execute.
   * @param result A result which has not been completed yet.
   * @return The final status of the test.
   * @throws IllegalStateException if the result has already been completed,
   *   in which case the test is not executed at all.
   */
  public static Status execute(final TestCase test, final TestResult result) {
    if (result.status().isTerminal()) {
      throw new IllegalStateException(
        "result of test " + result.testName() + " already completed: " + result.status()
      );
    }

    final String testName = result.testName();
    logger.fine(() -> "Starting test " + testName);

    final long startNanos = System.nanoTime();

    Throwable failure = null;
    Throwable tearDownFailure;

    try {
      failure = invoke(test::setUp);
      if (failure == null) {
        failure = invoke(test::run);
      }

    } finally {
      // Complement the setUp() invocation, whatever happened.
      tearDownFailure = invoke(test::tearDown);
    }

    final long durationNanos = System.nanoTime() - startNanos;

    if (failure == null) {
      failure = tearDownFailure;
    } else if (tearDownFailure != null) {
      // The first failure is the one reported.
      logger.log(Level.WARNING, String.format(
        "Test %s failed to tear down after an earlier failure", testName
      ), tearDownFailure);
    }

    result.duration(TimeUnit.NANOSECONDS.toMillis(durationNanos));
    record(failure, result);

    logger.fine(() -> String.format(
      "Finished test %s: %s (%d ms)", testName, result.status(), result.durationMillis()
    ));

    return result.status();
  }


  /**
   * Records the outcome of a test in the result. A {@code null} failure
   * means that the test passed.
   */
  static void record(final Throwable failure, final TestResult result) {
    if (failure == null) {
      result.pass();

    } else if (failure instanceof AssertionFailure) {
      final AssertionFailure af = (AssertionFailure) failure;
      result.fail(af.getMessage(), af.fileName(), af.lineNumber());

    } else {
      logger.log(Level.FINE, "Unhandled exception in test " + result.testName(), failure);
      result.exception(failure);
    }
  }


  /**
   * Invokes a test step and returns the failure it produced, or
   * {@code null} if the step completed normally.
   */
  private static Throwable invoke(final Step step) {
    try {
      step.invoke();
      return null;

    } catch (OutOfMemoryError | InternalError e) {
      throw e;

    } catch (Throwable t) {
      return t;
    }
  }

  /**
   * Determines whether an error leaves the virtual machine in a state in
   * which no further test should run.
   */
  static boolean isFatal(final Throwable error) {
    return error instanceof OutOfMemoryError || error instanceof InternalError;
  }


  @FunctionalInterface
  private interface Step {
    void invoke() throws Exception;
  }

}
