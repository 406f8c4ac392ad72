package org.upptest.harness;

import org.junit.Test;
import org.upptest.SourceLocation;
import org.upptest.TestInfo;

import java.util.List;
import java.util.function.Predicate;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ConfigTest {

  private static TestInfo info(String name, String category) {
    return new TestInfo(() -> () -> { }, name, category, SourceLocation.unknown());
  }

  @Test
  public void categorySpecificationIsSplitOnCommas() {
    final Config config = new Config().withCategory("fast, io,,net");
    assertEquals(List.of("fast", "io", "net"), config.categories);
  }

  @Test
  public void emptyConfigSelectsEverything() {
    final Predicate<TestInfo> filter = new Config().filter();
    assertTrue(filter.test(info("anything", "")));
  }

  @Test
  public void filterCombinesCategoryAndName() {
    final Predicate<TestInfo> filter = new Config()
      .withCategory("db")
      .withNamePattern("^insert")
      .withNamePattern("^delete")
      .filter();

    assertTrue(filter.test(info("insert-row", "db,slow")));
    assertTrue(filter.test(info("delete-row", "db")));
    assertFalse(filter.test(info("select-row", "db")));
    assertFalse(filter.test(info("insert-row", "cache")));
  }

  @Test
  public void flagsAreSetFluently() {
    final Config config = new Config().withList().withQuiet();
    assertTrue(config.printList);
    assertTrue(config.quiet);
  }

}
