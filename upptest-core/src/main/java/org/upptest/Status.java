package org.upptest;

/**
 * Outcome of a test execution. A result starts as {@link #NOT_RUN} and
 * moves to exactly one of the terminal values when the test finishes.
 */
public enum Status {
  NOT_RUN, PASS, FAIL;

  public boolean isTerminal() {
    return this != NOT_RUN;
  }
}
