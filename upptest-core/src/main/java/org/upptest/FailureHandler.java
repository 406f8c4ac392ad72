package org.upptest;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Strategy invoked by {@link Assertions} when a check fails. The default
 * strategy raises an {@link AssertionFailure}, which aborts the test body.
 * Embedders may install a different strategy, e.g., one that only logs the
 * failure and lets the caller continue.
 */
@FunctionalInterface
public interface FailureHandler {

  /**
   * Handles a failed check.
   *
   * @param message Description of the failure.
   * @param location Location of the failed check.
   */
  void handle(String message, SourceLocation location);

  //

  /** Raises an {@link AssertionFailure}. Never returns normally. */
  FailureHandler THROWING = (message, location) -> {
    throw new AssertionFailure(message, location);
  };

  /**
   * Creates a handler which reports failures to the given logger at the
   * {@code WARNING} level and returns normally.
   */
  static FailureHandler logging(final Logger logger) {
    Objects.requireNonNull(logger);
    return (message, location) -> logger.warning(
      () -> String.format("%s: %s", location, message)
    );
  }

}
