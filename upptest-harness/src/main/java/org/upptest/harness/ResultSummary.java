package org.upptest.harness;

import org.upptest.Status;
import org.upptest.TestResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counts executed, passed and failed tests and keeps the failed results.
 */
public final class ResultSummary implements Plugin.BeforeRunListener,
  Plugin.TestResultListener, Plugin.AfterRunListener {

  private final List<TestResult> failures = new ArrayList<>();

  private int selectedCount;
  private int executedCount;
  private int passedCount;
  private Status aggregate = Status.NOT_RUN;

  @Override
  public void beforeRun(final int selectedCount) {
    this.selectedCount = selectedCount;
  }

  @Override
  public void onTestResult(final TestResult result) {
    executedCount++;
    if (result.isPassed()) {
      passedCount++;
    } else {
      failures.add(result);
    }
  }

  @Override
  public void afterRun(final Status aggregate) {
    this.aggregate = aggregate;
  }

  public int selectedCount() { return selectedCount; }

  public int executedCount() { return executedCount; }

  public int passedCount() { return passedCount; }

  public int failedCount() { return failures.size(); }

  /** Failed results, in execution order. */
  public List<TestResult> failures() {
    return Collections.unmodifiableList(failures);
  }

  /** {@link Status#NOT_RUN} until the run has finished. */
  public Status aggregate() { return aggregate; }

  /** Formats the counts as {@code N tests, P passed, F failed}. */
  public String summaryLine() {
    return String.format(
      "%d tests, %d passed, %d failed", executedCount, passedCount, failedCount()
    );
  }

}
