package org.upptest;

import java.util.Objects;

/**
 * Signals that a condition checked by the assertion engine did not hold.
 * Carries a human-readable message and the location of the failed check.
 * The exception is caught by the test execution driver and turned into a
 * failed {@link TestResult}; it never propagates past a single test.
 */
public final class AssertionFailure extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /** Message used when the failure was raised without one. */
  static final String DEFAULT_MESSAGE = "assertion failed";

  private final SourceLocation location;

  public AssertionFailure(final String message, final SourceLocation location) {
    super((message == null || message.isEmpty()) ? DEFAULT_MESSAGE : message);
    this.location = Objects.requireNonNull(location);
  }

  public AssertionFailure(final String message, final String fileName, final int lineNumber) {
    this(message, new SourceLocation(fileName, lineNumber));
  }

  public SourceLocation location() { return location; }

  public String fileName() { return location.fileName(); }

  public int lineNumber() { return location.lineNumber(); }

}
