package org.upptest.harness;

import org.junit.Test;
import org.upptest.Status;
import org.upptest.TestResult;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

public class ResultSummaryTest {

  private static TestResult passed() {
    final TestResult result = new TestResult();
    result.pass();
    return result;
  }

  private static TestResult failed(String message) {
    final TestResult result = new TestResult();
    result.fail(message, "", 0);
    return result;
  }

  @Test
  public void countsResultsAndKeepsFailures() {
    final ResultSummary summary = new ResultSummary();
    final TestResult failure = failed("Expected [null]");

    summary.beforeRun(3);
    summary.onTestResult(passed());
    summary.onTestResult(failure);
    summary.onTestResult(passed());
    summary.afterRun(Status.FAIL);

    assertEquals(3, summary.selectedCount());
    assertEquals(3, summary.executedCount());
    assertEquals(2, summary.passedCount());
    assertEquals(1, summary.failedCount());
    assertSame(failure, summary.failures().get(0));
    assertEquals(Status.FAIL, summary.aggregate());
    assertEquals("3 tests, 2 passed, 1 failed", summary.summaryLine());
  }

  @Test
  public void aggregateIsNotRunBeforeRunEnds() {
    final ResultSummary summary = new ResultSummary();
    summary.onTestResult(passed());

    assertEquals(Status.NOT_RUN, summary.aggregate());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void failuresAreReadOnly() {
    new ResultSummary().failures().add(new TestResult());
  }

}
