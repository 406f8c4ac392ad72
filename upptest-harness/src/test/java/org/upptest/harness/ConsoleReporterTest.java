package org.upptest.harness;

import org.junit.Test;
import org.upptest.SourceLocation;
import org.upptest.Status;
import org.upptest.TestInfo;
import org.upptest.TestResult;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertEquals;

public class ConsoleReporterTest {

  private static TestResult result(String name) {
    final TestResult result = new TestResult();
    result.attach(new TestInfo(() -> () -> { }, name, "", SourceLocation.unknown()));
    result.duration(7);
    return result;
  }

  @Test
  public void formatsPassingResult() {
    final TestResult result = result("adds-numbers");
    result.pass();

    assertEquals("[PASS] adds-numbers (7 ms)", ConsoleReporter.formatResult(result));
  }

  @Test
  public void formatsFailureWithLocation() {
    final TestResult result = result("parses");
    result.fail("Expected [1] saw [2]", "ParserTest.java", 31);

    assertEquals("[FAIL] parses (7 ms)", ConsoleReporter.formatResult(result));
    assertEquals(
      "ParserTest.java:31: Expected [1] saw [2]", ConsoleReporter.formatFailure(result)
    );
  }

  @Test
  public void formatsFailureWithoutLocation() {
    final TestResult result = result("opens");
    result.exception(new IllegalStateException("closed"));

    assertEquals("unhandled exception: closed", ConsoleReporter.formatFailure(result));
  }

  @Test
  public void printsResultsAndSummary() {
    final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    final ResultSummary summary = new ResultSummary();
    final EventDispatcher dispatcher = new EventDispatcher.Builder()
      .withPlugin(summary)
      .withPlugin(new ConsoleReporter(
        new PrintStream(buffer, true, StandardCharsets.UTF_8), false, summary
      ))
      .build();

    final TestResult passed = result("a");
    passed.pass();
    final TestResult failed = result("b");
    failed.fail("Expected [true] saw [false]", "B.java", 4);

    dispatcher.notifyBeforeRun(2);
    dispatcher.notifyOnTestResult(passed);
    dispatcher.notifyOnTestResult(failed);
    dispatcher.notifyAfterRun(Status.FAIL);

    final String nl = System.lineSeparator();
    assertEquals(
      "[PASS] a (7 ms)" + nl
        + "[FAIL] b (7 ms)" + nl
        + "  B.java:4: Expected [true] saw [false]" + nl
        + "2 tests, 1 passed, 1 failed" + nl,
      buffer.toString(StandardCharsets.UTF_8)
    );
  }

}
