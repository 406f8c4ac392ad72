package org.upptest;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestResultTest {

  @Test
  public void startsNotRunWithEmptyErrorFields() {
    final TestResult result = new TestResult();

    assertEquals(Status.NOT_RUN, result.status());
    assertFalse(result.info().isPresent());
    assertEquals("", result.errMessage());
    assertEquals("", result.errFile());
    assertEquals(0, result.errLine());
  }

  @Test
  public void failRecordsMessageAndLocation() {
    final TestResult result = new TestResult();
    result.fail("Expected [1] saw [2]", "Foo.java", 12);

    assertTrue(result.isFailed());
    assertEquals("Expected [1] saw [2]", result.errMessage());
    assertEquals("Foo.java", result.errFile());
    assertEquals(12, result.errLine());
  }

  @Test
  public void exceptionMessageIncludesDescription() {
    final TestResult result = new TestResult();
    result.exception(new IllegalStateException("socket closed"));

    assertEquals(Status.FAIL, result.status());
    assertEquals("unhandled exception: socket closed", result.errMessage());
    assertEquals("", result.errFile());
    assertEquals(0, result.errLine());
  }

  @Test
  public void exceptionWithoutDescriptionHasNoColon() {
    final TestResult result = new TestResult();
    result.exception(new NullPointerException());
    assertEquals("unhandled exception", result.errMessage());

    final TestResult empty = new TestResult();
    empty.exception(new RuntimeException(""));
    assertEquals("unhandled exception", empty.errMessage());
  }

  @Test(expected = IllegalStateException.class)
  public void completesOnlyOnce() {
    final TestResult result = new TestResult();
    result.pass();
    result.fail("late", "", 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsEmptyFailureMessage() {
    new TestResult().fail("", "Foo.java", 1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsNegativeDuration() {
    new TestResult().duration(-1);
  }

  @Test
  public void describesFailureInText() {
    final TestResult result = new TestResult();
    result.attach(new TestInfo(() -> () -> { }, "t", "c", SourceLocation.unknown()));
    result.duration(3);
    result.fail("Expected [null]", "Foo.java", 7);

    assertEquals("t: FAIL (3 ms) - Foo.java:7: Expected [null]", result.toString());
  }

}
