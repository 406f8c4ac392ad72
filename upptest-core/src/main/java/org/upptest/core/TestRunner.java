package org.upptest.core;

import org.upptest.ResultObserver;
import org.upptest.Status;
import org.upptest.TestCase;
import org.upptest.TestInfo;
import org.upptest.TestResult;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Runs tests described by {@link TestInfo} instances. Tests are executed
 * strictly one at a time, in iteration order, on the calling thread. Each
 * execution gets a fresh {@link TestCase} and a fresh {@link TestResult},
 * which is passed to the observer as soon as the test finishes.
 * <p>
 * Individual test failures never cause the runner to throw. The aggregate
 * status returned by the collection-based methods is {@link Status#PASS}
 * if all executed tests passed (or if no test was executed), and
 * {@link Status#FAIL} otherwise.
 */
public final class TestRunner {
  private static final Logger logger = Logging.getPackageLogger(TestRunner.class);

  private TestRunner() {}

  /**
   * Creates and executes a single test.
   *
   * @param info The test to run.
   * @param result A fresh result, which is attached to the test and completed.
   * @return The status of the test.
   */
  public static Status run(final TestInfo info, final TestResult result) {
    result.attach(info);

    final TestCase test;
    try {
      test = info.newTestCase();

    } catch (Throwable t) {
      if (ExecutionDriver.isFatal(t)) {
        throw t;
      }

      // A test that cannot be created is a failed test.
      ExecutionDriver.record(t, result);
      return result.status();
    }

    return ExecutionDriver.execute(test, result);
  }

  /**
   * Runs the tests accepted by the filter.
   *
   * @param tests The tests to consider.
   * @param filter Selects the tests to run; rejected tests are skipped
   *   without producing a result.
   * @param observer Receives the result of each executed test.
   * @return The aggregate status of the executed tests.
   */
  public static Status run(
    final Iterator<TestInfo> tests,
    final Predicate<? super TestInfo> filter,
    final ResultObserver observer
  ) {
    Objects.requireNonNull(filter);
    Objects.requireNonNull(observer);

    int executedCount = 0;
    int passedCount = 0;

    while (tests.hasNext()) {
      final TestInfo info = tests.next();
      if (!filter.test(info)) {
        continue;
      }

      final TestResult result = new TestResult();
      if (run(info, result) == Status.PASS) {
        passedCount++;
      }

      executedCount++;
      observer.onResult(result);
    }

    final int executed = executedCount;
    final int passed = passedCount;
    logger.fine(() -> String.format("Executed %d test(s), %d passed", executed, passed));

    return (passedCount == executedCount) ? Status.PASS : Status.FAIL;
  }

  public static Status run(final Iterator<TestInfo> tests, final ResultObserver observer) {
    return run(tests, info -> true, observer);
  }

  public static Status run(
    final Iterable<TestInfo> tests,
    final Predicate<? super TestInfo> filter,
    final ResultObserver observer
  ) {
    return run(tests.iterator(), filter, observer);
  }

  public static Status run(final Iterable<TestInfo> tests, final ResultObserver observer) {
    return run(tests.iterator(), observer);
  }

  /** Runs all tests in the process-wide registry. */
  public static Status runRegistered(final ResultObserver observer) {
    return run(TestRegistry.get().tests(), observer);
  }

  /** Runs the tests in the process-wide registry accepted by the filter. */
  public static Status runRegistered(
    final Predicate<? super TestInfo> filter, final ResultObserver observer
  ) {
    return run(TestRegistry.get().tests(), filter, observer);
  }

}
