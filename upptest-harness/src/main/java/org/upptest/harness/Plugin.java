package org.upptest.harness;

import org.upptest.Status;
import org.upptest.TestResult;

/**
 * Marker interface for harness plugins. A plugin receives run events by
 * implementing one or more of the nested listener interfaces.
 */
public interface Plugin {

  interface BeforeRunListener extends Plugin {
    /**
     * Called before the first selected test runs, after the selection
     * has been made.
     *
     * @param selectedCount Number of tests that will be executed.
     */
    void beforeRun(int selectedCount);
  }

  interface TestResultListener extends Plugin {
    /**
     * Called after each executed test, before the next one starts.
     *
     * @param result The completed result of the test.
     */
    void onTestResult(TestResult result);
  }

  interface AfterRunListener extends Plugin {
    /**
     * Called after the last selected test finished.
     *
     * @param aggregate {@link Status#PASS} if all executed tests passed,
     *   {@link Status#FAIL} otherwise.
     */
    void afterRun(Status aggregate);
  }

}
