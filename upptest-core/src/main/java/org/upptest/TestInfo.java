package org.upptest;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Describes a declared test. Holds the test metadata and a factory which
 * creates a fresh {@link TestCase} instance for each execution. Instances
 * are created once per declared test and are immutable afterwards.
 */
public final class TestInfo {

  private final Supplier<? extends TestCase> factory;

  private final String name;

  private final String category;

  private final SourceLocation location;


  public TestInfo(
    final Supplier<? extends TestCase> factory,
    final String name, final String category,
    final SourceLocation location
  ) {
    this.factory = Objects.requireNonNull(factory);
    this.name = Objects.requireNonNull(name);
    this.category = Objects.requireNonNull(category);
    this.location = Objects.requireNonNull(location);
  }

  /**
   * Creates a new instance of the described test.
   *
   * @throws IllegalStateException if the factory produced {@code null}.
   */
  public TestCase newTestCase() {
    final TestCase result = factory.get();
    if (result == null) {
      throw new IllegalStateException("factory of test '" + name + "' returned null");
    }

    return result;
  }

  public String name() { return name; }

  public String category() { return category; }

  /** Location of the test declaration. */
  public SourceLocation location() { return location; }

  public String sourceFile() { return location.fileName(); }

  public int sourceLine() { return location.lineNumber(); }


  @Override
  public String toString() {
    return String.format("%s [%s] (%s)", name, category, location);
  }

}
