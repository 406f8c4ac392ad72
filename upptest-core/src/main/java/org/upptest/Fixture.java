package org.upptest;

/**
 * Reusable set up and tear down logic shared by multiple tests. A fresh
 * fixture instance is created for each test execution and passed to the
 * test body. See {@link TestDeclarations#test(String, String, java.util.function.Supplier, TestDeclarations.FixtureBody)}.
 */
public interface Fixture {

  default void setUp() throws Exception {
    // No set up by default.
  }

  default void tearDown() throws Exception {
    // No tear down by default.
  }

}
