package org.upptest;

import java.util.Objects;
import java.util.Optional;

/**
 * Mutable record of a single test execution. A fresh instance is created
 * by the runner for each execution, completed exactly once by the
 * execution path, and then handed to a {@link ResultObserver}.
 * <p>
 * A failed result always carries a non-empty error message. The error
 * file and line are only known for assertion failures; they are empty
 * and zero for passed tests and for unhandled exceptions.
 */
public final class TestResult {

  static final String UNHANDLED_EXCEPTION = "unhandled exception";

  private TestInfo info;

  private Status status = Status.NOT_RUN;

  private long durationMillis;

  private String errMessage = "";

  private String errFile = "";

  private int errLine;

  //

  /** Associates this result with the descriptor of the executed test. */
  public void attach(final TestInfo info) {
    this.info = Objects.requireNonNull(info);
  }

  /** Marks the test as passed. */
  public void pass() {
    requireNotRun();
    status = Status.PASS;
  }

  /**
   * Marks the test as failed with the given message and location.
   *
   * @throws IllegalArgumentException if the message is empty.
   * @throws IllegalStateException if the result has already been completed.
   */
  public void fail(final String message, final String fileName, final int lineNumber) {
    if (message == null || message.isEmpty()) {
      throw new IllegalArgumentException("failure message must not be empty");
    }

    requireNotRun();
    status = Status.FAIL;
    errMessage = message;
    errFile = Objects.requireNonNull(fileName);
    errLine = lineNumber;
  }

  /**
   * Marks the test as failed because of an error other than an assertion
   * failure. The message includes the error's own message, if it has one.
   * The location is left unknown.
   */
  public void exception(final Throwable error) {
    fail(unhandledMessage(error), "", 0);
  }

  static String unhandledMessage(final Throwable error) {
    final String description = error.getMessage();
    if (description == null || description.isEmpty()) {
      return UNHANDLED_EXCEPTION;
    } else {
      return UNHANDLED_EXCEPTION + ": " + description;
    }
  }

  public void duration(final long millis) {
    if (millis < 0) {
      throw new IllegalArgumentException("negative duration: " + millis);
    }

    durationMillis = millis;
  }

  private void requireNotRun() {
    if (status.isTerminal()) {
      throw new IllegalStateException("result already completed: " + status);
    }
  }

  //

  /** The executed test, empty until the result is attached to one. */
  public Optional<TestInfo> info() { return Optional.ofNullable(info); }

  public Status status() { return status; }

  public boolean isPassed() { return status == Status.PASS; }

  public boolean isFailed() { return status == Status.FAIL; }

  public long durationMillis() { return durationMillis; }

  public String errMessage() { return errMessage; }

  public String errFile() { return errFile; }

  public int errLine() { return errLine; }

  /** The test name, or an empty string if no test is attached. */
  public String testName() {
    return (info != null) ? info.name() : "";
  }


  @Override
  public String toString() {
    final StringBuilder result = new StringBuilder()
      .append(testName()).append(": ").append(status)
      .append(" (").append(durationMillis).append(" ms)");

    if (status == Status.FAIL) {
      result.append(" - ");
      if (!errFile.isEmpty()) {
        result.append(errFile).append(':').append(errLine).append(": ");
      }

      result.append(errMessage);
    }

    return result.toString();
  }

}
