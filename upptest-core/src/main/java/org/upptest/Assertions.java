package org.upptest;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Objects;
import java.util.Set;

/**
 * The assertion engine. Each check either returns normally (the condition
 * held) or passes a failure message together with the location of the
 * calling code to the {@link FailureHandler} of this instance.
 * <p>
 * Equality checks use the natural equality of the operands (array operands
 * are compared element-wise). Failure messages embed the natural string
 * form of the operands. Operands whose class does not provide its own
 * {@code toString()} are rendered as a type tag, e.g., {@code <Widget>}.
 * When unequal operands render the same, as {@code 5} and {@code 5L} do,
 * the type tags are appended to both.
 * No locale-specific formatting is applied.
 * <p>
 * The {@link Assert} class provides static shortcuts to an instance which
 * uses the {@link FailureHandler#THROWING throwing} strategy.
 */
public final class Assertions {

  /** Frames of these classes are skipped when locating the caller. */
  private static final Set<String> engineClasses = Set.of(
    Assertions.class.getName(), Assert.class.getName()
  );

  private final FailureHandler failureHandler;


  public Assertions(final FailureHandler failureHandler) {
    this.failureHandler = Objects.requireNonNull(failureHandler);
  }

  /** Returns an engine which raises {@link AssertionFailure} on failures. */
  public static Assertions throwing() {
    return new Assertions(FailureHandler.THROWING);
  }

  public FailureHandler failureHandler() {
    return failureHandler;
  }

  //

  public void expr(final boolean condition) {
    if (!condition) {
      fail("Assert expression failed");
    }
  }

  public void eq(final Object expected, final Object actual) {
    if (!Objects.deepEquals(expected, actual)) {
      String expectedText = render(expected);
      String actualText = render(actual);
      if (expectedText.equals(actualText)) {
        // Equal renderings of unequal values, e.g., 5 and 5L.
        expectedText += " " + typeTagOf(expected);
        actualText += " " + typeTagOf(actual);
      }

      fail(String.format("Expected [%s] saw [%s]", expectedText, actualText));
    }
  }

  public void neq(final Object notExpected, final Object actual) {
    if (Objects.deepEquals(notExpected, actual)) {
      fail(String.format("Expected not [%s] saw [%s]", render(notExpected), render(actual)));
    }
  }

  public void isTrue(final boolean condition) {
    if (!condition) {
      fail("Expected [true] saw [false]");
    }
  }

  public void isFalse(final boolean condition) {
    if (condition) {
      fail("Expected [false] saw [true]");
    }
  }

  public void isNull(final Object reference) {
    if (reference != null) {
      fail("Expected [null]");
    }
  }

  public void isNotNull(final Object reference) {
    if (reference == null) {
      fail("Expected not [null]");
    }
  }

  /**
   * Fails unconditionally with the given message. Returns only if the
   * failure handler of this instance does not raise an exception.
   */
  public void fail(final String message) {
    failureHandler.handle(message, SourceLocation.callerOutside(engineClasses));
  }

  //

  /**
   * Renders a value for inclusion in a failure message.
   */
  static String render(final Object value) {
    if (value == null) {
      return "null";
    }

    final Class<?> valueClass = value.getClass();
    if (valueClass.isArray()) {
      // Wrap to get deep rendering for arrays of primitives as well.
      final String wrapped = Arrays.deepToString(new Object[] { value });
      return wrapped.substring(1, wrapped.length() - 1);
    }

    return hasOwnTextualForm(valueClass) ? String.valueOf(value) : typeTag(valueClass);
  }

  private static boolean hasOwnTextualForm(final Class<?> valueClass) {
    try {
      final Method toString = valueClass.getMethod("toString");
      return toString.getDeclaringClass() != Object.class;
    } catch (NoSuchMethodException e) {
      // Cannot happen for a public method of Object.
      return false;
    }
  }

  private static String typeTagOf(final Object value) {
    return (value != null) ? typeTag(value.getClass()) : "<null>";
  }

  private static String typeTag(final Class<?> valueClass) {
    final String simpleName = valueClass.getSimpleName();
    return "<" + (simpleName.isEmpty() ? valueClass.getName() : simpleName) + ">";
  }

}
