package org.upptest.core;

import org.upptest.Assert;
import org.upptest.TestDeclarations;
import org.upptest.TestModule;

/**
 * Registered in {@code META-INF/services/org.upptest.TestModule} of the
 * test resources, so that the process-wide registry picks it up.
 */
public final class SampleTestModule implements TestModule {

  static final String CATEGORY = "sample";

  @Override
  public void declareTests(TestDeclarations tests) {
    tests.test("sample-arithmetic", CATEGORY, () -> Assert.eq(4, 2 + 2));
    tests.test("sample-failing", CATEGORY + ",broken", () -> Assert.eq(5, 6));
    tests.test("sample-strings", CATEGORY, () -> Assert.neq("a", "b"));
  }

}
