package org.upptest;

/**
 * Receives the result of each executed test. Called synchronously, exactly
 * once per executed test, in execution order, with a completed result.
 */
@FunctionalInterface
public interface ResultObserver {

  void onResult(TestResult result);

  /** An observer that ignores all results. */
  static ResultObserver ignoring() {
    return result -> { };
  }

}
