package org.upptest;

/**
 * A group of test declarations. Implementations are listed in
 * {@code META-INF/services/org.upptest.TestModule} and are discovered by
 * the test registry when it is first accessed, before any test runs.
 * Each implementation must have a public zero arguments constructor.
 */
public interface TestModule {

  /**
   * Declares the tests of this module. Called exactly once, during the
   * initialization of the test registry. Tests are registered in the order
   * in which they are declared.
   *
   * @param tests The declaration surface bound to the registry.
   */
  void declareTests(TestDeclarations tests);

}
