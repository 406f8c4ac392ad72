package org.upptest.core;

import org.upptest.TestDeclarations;
import org.upptest.TestInfo;
import org.upptest.TestModule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/**
 * The process-wide catalog of declared tests. Represents an ordered
 * collection of {@link TestInfo} instances, each of which can create the
 * test it describes.
 * <p>
 * The registry is created on first access. Creating it runs the
 * initialization phase, in which every {@link TestModule} registered as a
 * service is asked to declare its tests. Descriptors are only ever
 * appended, never removed or reordered. Registration is expected to be
 * finished before the first test runs, therefore the registry performs
 * no locking.
 */
public final class TestRegistry {
  private static final Logger logger = Logging.getPackageLogger(TestRegistry.class);

  private final List<TestInfo> tests = new ArrayList<>();

  private final List<TestInfo> testsView = Collections.unmodifiableList(tests);


  TestRegistry() {}

  /**
   * Returns the process-wide registry, initializing it on first access.
   */
  public static TestRegistry get() {
    return Holder.instance;
  }

  /**
   * Appends a descriptor to the catalog. The registry does not check for
   * duplicates; callers must not register the same descriptor twice.
   */
  public void add(final TestInfo info) {
    tests.add(Objects.requireNonNull(info));
  }

  /**
   * Returns a read-only view of the catalog, in registration order. The
   * view reflects later registrations.
   */
  public List<TestInfo> tests() {
    return testsView;
  }

  /**
   * Returns a declaration surface which registers tests into this registry.
   * Intended for explicit registration at start-up, as an alternative to
   * {@link TestModule} services.
   */
  public TestDeclarations declarations() {
    return new TestDeclarations(this::add);
  }

  // Instance creation

  static TestRegistry createFromModules(final Iterable<? extends TestModule> modules) {
    final TestRegistry result = new TestRegistry();

    for (final TestModule module : modules) {
      final String moduleName = module.getClass().getName();
      final int countBefore = result.tests.size();

      try {
        module.declareTests(result.declarations());

      } catch (RuntimeException e) {
        throw new IllegalStateException("failed to declare tests of module " + moduleName, e);
      }

      final int declared = result.tests.size() - countBefore;
      logger.config(() -> String.format("Module %s declared %d test(s)", moduleName, declared));
    }

    logger.config(() -> String.format("Registry initialized with %d test(s)", result.tests.size()));
    return result;
  }


  private static final class Holder {
    static final TestRegistry instance = createFromModules(
      ServiceLoader.load(TestModule.class)
    );
  }

}
