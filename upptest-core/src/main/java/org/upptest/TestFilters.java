package org.upptest;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Ready-made predicates for selecting tests to run.
 */
public final class TestFilters {

  private TestFilters() {}

  /** Accepts all tests. */
  public static Predicate<TestInfo> all() {
    return info -> true;
  }

  /** Accepts tests whose category contains the given string. */
  public static Predicate<TestInfo> categoryContains(final String part) {
    Objects.requireNonNull(part);
    return info -> info.category().contains(part);
  }

  /** Accepts tests whose category is exactly the given string. */
  public static Predicate<TestInfo> categoryEquals(final String category) {
    Objects.requireNonNull(category);
    return info -> info.category().equals(category);
  }

  /** Accepts tests whose name contains a match of the given expression. */
  public static Predicate<TestInfo> nameMatches(final String regex) {
    final Pattern pattern = Pattern.compile(regex);
    return info -> pattern.matcher(info.name()).find();
  }

  /**
   * Accepts tests accepted by any of the given predicates. An empty
   * collection of predicates accepts all tests.
   */
  public static Predicate<TestInfo> anyOf(final Collection<? extends Predicate<TestInfo>> filters) {
    final List<Predicate<TestInfo>> copy = List.copyOf(filters);
    if (copy.isEmpty()) {
      return all();
    }

    return info -> copy.stream().anyMatch(f -> f.test(info));
  }

}
