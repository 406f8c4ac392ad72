package org.upptest;

/**
 * Static shortcuts to the assertion engine. A failing check raises an
 * {@link AssertionFailure} carrying the message and the location of the
 * calling code, e.g.,
 *
 * <pre>{@code
 *   Assert.eq(42, answer);         // Expected [42] saw [41]
 *   Assert.isNotNull(connection);  // Expected not [null]
 * }</pre>
 *
 * Use an {@link Assertions} instance with a custom {@link FailureHandler}
 * to handle failures differently.
 */
public final class Assert {

  private static final Assertions engine = Assertions.throwing();

  private Assert() {}

  public static void expr(boolean condition) {
    engine.expr(condition);
  }

  public static void eq(Object expected, Object actual) {
    engine.eq(expected, actual);
  }

  public static void neq(Object notExpected, Object actual) {
    engine.neq(notExpected, actual);
  }

  public static void isTrue(boolean condition) {
    engine.isTrue(condition);
  }

  public static void isFalse(boolean condition) {
    engine.isFalse(condition);
  }

  public static void isNull(Object reference) {
    engine.isNull(reference);
  }

  public static void isNotNull(Object reference) {
    engine.isNotNull(reference);
  }

  public static void fail(String message) {
    engine.fail(message);
  }

}
