package org.upptest;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Represents a single unit test. Defines the test body and optional set up
 * and tear down hooks, and serves as a name space for test meta-data
 * annotations.
 * <p>
 * A fresh instance is created for each execution, so tests never share
 * instance state across runs. The execution driver calls {@link #setUp()},
 * {@link #run()} and {@link #tearDown()} in this order. The tear down hook
 * is called even if set up or the test body failed. The body is skipped
 * when set up fails.
 * <p>
 * Shared set up and tear down logic can be put into an abstract base class
 * implementing this interface, or into a {@link Fixture} composed into the
 * test through {@link TestDeclarations}.
 */
public interface TestCase {

  /**
   * Name of the test. Defaults to kebab-case variant of the test's class
   * name (without the package prefix). For example, the default name for
   * a class named {@code ParsesEmptyInput} will be {@code parses-empty-input}.
   */
  @Documented
  @Target(ElementType.TYPE)
  @Retention(RetentionPolicy.RUNTIME)
  @interface Name {
    String value();
  }

  /**
   * Free-form category of the test, available to filter predicates.
   * Defaults to an empty string.
   */
  @Documented
  @Target(ElementType.TYPE)
  @Retention(RetentionPolicy.RUNTIME)
  @interface Category {
    String value();
  }

  //

  /**
   * Prepares the test. Called before the test body. A failure here fails
   * the test and the body is not executed.
   */
  default void setUp() throws Exception {
    // No set up by default.
  }

  /**
   * The test body. Fails the test by raising an {@link AssertionFailure},
   * typically through {@link Assert}, or by throwing any other exception.
   */
  void run() throws Exception;

  /**
   * Cleans up after the test. Called exactly once per execution, whether
   * the test passed or failed.
   */
  default void tearDown() throws Exception {
    // No tear down by default.
  }

}
