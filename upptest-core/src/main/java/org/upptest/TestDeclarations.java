package org.upptest;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * The declaration surface for tests. Each declaration creates a
 * {@link TestInfo} for the test, records the location of the declaring
 * code, and hands the descriptor to the registrar this instance is bound
 * to. Declarations are expected to happen during registry initialization,
 * typically from {@link TestModule#declareTests(TestDeclarations)}.
 *
 * <pre>{@code
 *   public void declareTests(TestDeclarations tests) {
 *     tests.test("adds-numbers", "fast", () -> Assert.eq(4, 2 + 2));
 *     tests.test("reads-file", "io", TempDirFixture::new, dir -> { ... });
 *     tests.testClass(ParsesEmptyInput.class);
 *   }
 * }</pre>
 */
public final class TestDeclarations {

  private static final Set<String> declarationClasses = Set.of(TestDeclarations.class.getName());

  private final Consumer<TestInfo> registrar;


  public TestDeclarations(final Consumer<TestInfo> registrar) {
    this.registrar = Objects.requireNonNull(registrar);
  }

  /** A test body without a fixture. */
  @FunctionalInterface
  public interface Body {
    void run() throws Exception;
  }

  /** A test body which receives a fixture. */
  @FunctionalInterface
  public interface FixtureBody<F extends Fixture> {
    void run(F fixture) throws Exception;
  }

  //

  /**
   * Declares a test without a fixture.
   *
   * @return The registered descriptor.
   */
  public TestInfo test(final String name, final String category, final Body body) {
    Objects.requireNonNull(body);
    return register(() -> new BodyTestCase(body), name, category);
  }

  /**
   * Declares a test which uses a fixture. The fixture is created anew for
   * each execution; its set up and tear down hooks wrap the test body.
   *
   * @return The registered descriptor.
   */
  public <F extends Fixture> TestInfo test(
    final String name, final String category,
    final Supplier<F> fixtureFactory, final FixtureBody<F> body
  ) {
    Objects.requireNonNull(fixtureFactory);
    Objects.requireNonNull(body);
    return register(
      () -> new FixtureTestCase<>(fixtureFactory.get(), body), name, category
    );
  }

  /**
   * Declares a test implemented by a {@link TestCase} class, using the
   * given factory to create instances.
   *
   * @return The registered descriptor.
   */
  public TestInfo testCase(
    final String name, final String category,
    final Supplier<? extends TestCase> factory
  ) {
    return register(Objects.requireNonNull(factory), name, category);
  }

  /**
   * Declares a test implemented by a {@link TestCase} class. The name and
   * category are taken from the {@link TestCase.Name} and
   * {@link TestCase.Category} annotations, if present. Instances are
   * created using the zero arguments constructor.
   *
   * @return The registered descriptor.
   * @throws IllegalArgumentException if the class has no zero arguments
   *   constructor.
   */
  public TestInfo testClass(final Class<? extends TestCase> testClass) {
    final String name = testName(testClass);
    final String category = testCategory(testClass);
    final Constructor<? extends TestCase> constructor = zeroArgsConstructor(testClass);
    return register(() -> instantiate(constructor, name), name, category);
  }

  private TestInfo register(
    final Supplier<? extends TestCase> factory,
    final String name, final String category
  ) {
    final TestInfo result = new TestInfo(
      factory, name, category, SourceLocation.callerOutside(declarationClasses)
    );

    registrar.accept(result);
    return result;
  }

  //

  static String testName(final Class<?> testClass) {
    final TestCase.Name name = testClass.getAnnotation(TestCase.Name.class);
    return (name != null) ? name.value() : kebabCase(testClass.getSimpleName());
  }

  private static String testCategory(final Class<?> testClass) {
    final TestCase.Category category = testClass.getAnnotation(TestCase.Category.class);
    return (category != null) ? category.value() : "";
  }

  static String kebabCase(final String camelCase) {
    return camelCase
      .replaceAll("([a-z0-9])([A-Z])", "$1-$2")
      .replaceAll("([A-Z])([A-Z][a-z])", "$1-$2")
      .toLowerCase(Locale.ROOT);
  }

  private static <T extends TestCase> Constructor<T> zeroArgsConstructor(final Class<T> testClass) {
    try {
      final Constructor<T> result = testClass.getDeclaredConstructor();
      result.setAccessible(true);
      return result;

    } catch (NoSuchMethodException e) {
      throw new IllegalArgumentException(String.format(
        "test class %s has no zero arguments constructor", testClass.getName()
      ), e);
    }
  }

  private static TestCase instantiate(final Constructor<? extends TestCase> constructor, final String name) {
    try {
      return constructor.newInstance();

    } catch (InvocationTargetException e) {
      // Report the exception thrown by the constructor itself.
      throw new IllegalStateException(
        String.format("failed to create test case %s: %s", name, e.getCause()), e.getCause()
      );
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("failed to create test case " + name, e);
    }
  }

  //

  private static final class BodyTestCase implements TestCase {
    private final Body body;

    BodyTestCase(final Body body) {
      this.body = body;
    }

    @Override
    public void run() throws Exception {
      body.run();
    }
  }


  private static final class FixtureTestCase<F extends Fixture> implements TestCase {
    private final F fixture;
    private final FixtureBody<F> body;

    FixtureTestCase(final F fixture, final FixtureBody<F> body) {
      this.fixture = Objects.requireNonNull(fixture, "fixture factory returned null");
      this.body = body;
    }

    @Override
    public void setUp() throws Exception {
      fixture.setUp();
    }

    @Override
    public void run() throws Exception {
      body.run(fixture);
    }

    @Override
    public void tearDown() throws Exception {
      fixture.tearDown();
    }
  }

}
