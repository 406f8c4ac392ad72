package org.upptest.harness;

import org.upptest.TestFilters;
import org.upptest.TestInfo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Harness settings. Filled in from the command line, or directly through
 * the {@code with*} methods.
 */
final class Config {

  final List<String> categories = new ArrayList<>();

  final List<String> namePatterns = new ArrayList<>();

  boolean printList = false;

  boolean quiet = false;


  Config withCategory(String v) {
    categories.addAll(
      Arrays.stream(v.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .collect(Collectors.toList())
    );

    return this;
  }

  Config withNamePattern(String regex) {
    namePatterns.add(regex);
    return this;
  }

  Config withList() {
    this.printList = true;
    return this;
  }

  Config withQuiet() {
    this.quiet = true;
    return this;
  }

  /**
   * Selects tests whose category contains any of the category strings and
   * whose name matches any of the name patterns. An empty list of either
   * kind does not restrict the selection.
   */
  Predicate<TestInfo> filter() {
    final Predicate<TestInfo> byCategory = TestFilters.anyOf(
      categories.stream().map(TestFilters::categoryContains).collect(Collectors.toList())
    );

    final Predicate<TestInfo> byName = TestFilters.anyOf(
      namePatterns.stream().map(TestFilters::nameMatches).collect(Collectors.toList())
    );

    return byCategory.and(byName);
  }

}
