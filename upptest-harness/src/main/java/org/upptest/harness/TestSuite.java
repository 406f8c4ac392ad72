package org.upptest.harness;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.upptest.Status;
import org.upptest.TestInfo;
import org.upptest.TestResult;
import org.upptest.core.Logging;
import org.upptest.core.TestRegistry;
import org.upptest.core.TestRunner;

import java.io.PrintStream;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;

/**
 * Command-line entry point. Runs the registered tests selected by the
 * command line options and exits with status 0 if all of them passed,
 * 1 if any failed or the registry could not be initialized, and 2 if the
 * command line could not be parsed.
 */
public final class TestSuite {
  private static final Logger logger = Logging.getPackageLogger(TestSuite.class);

  static final int EXIT_PASSED = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private static final String PROGRAM_NAME = "upptest";

  private TestSuite() {}

  public static void main(String[] args) {
    final int exitCode = run(args, () -> TestRegistry.get().tests(), System.out, System.err);
    System.exit(exitCode);
  }

  static int run(
    final String[] args,
    final Supplier<? extends List<TestInfo>> catalog,
    final PrintStream out,
    final PrintStream err
  ) {
    final CommandLineArgs parsedArgs = new CommandLineArgs();
    final JCommander parser = JCommander.newBuilder()
      .programName(PROGRAM_NAME)
      .addObject(parsedArgs)
      .build();

    try {
      parser.parse(args);

    } catch (ParameterException e) {
      err.println(e.getMessage());
      err.print(usage(parser));
      return EXIT_USAGE;
    }

    if (parsedArgs.help) {
      out.print(usage(parser));
      return EXIT_PASSED;
    }

    final List<TestInfo> tests;
    try {
      tests = catalog.get();

    } catch (ExceptionInInitializerError | RuntimeException e) {
      final Throwable cause = (e.getCause() != null) ? e.getCause() : e;
      logger.log(Level.SEVERE, "Failed to initialize test registry", cause);
      err.println("error: failed to initialize test registry: " + cause.getMessage());
      return EXIT_FAILED;
    }

    return runTests(tests, parsedArgs.toConfig(), out, new ResultSummary());
  }

  static int runTests(
    final List<TestInfo> tests,
    final Config config,
    final PrintStream out,
    final ResultSummary summary
  ) {
    final List<TestInfo> selected = tests.stream().filter(config.filter()).collect(toList());
    logger.config(() -> String.format(
      "Selected %d of %d registered test(s)", selected.size(), tests.size()
    ));

    if (config.printList) {
      selected.forEach(out::println);
      out.flush();
      return EXIT_PASSED;
    }

    // The summary counts each result before the reporter prints it.
    final EventDispatcher dispatcher = new EventDispatcher.Builder()
      .withPlugin(summary)
      .withPlugin(new ConsoleReporter(out, config.quiet, summary))
      .build();

    dispatcher.notifyBeforeRun(selected.size());
    final Status aggregate = TestRunner.run(selected, dispatcher::notifyOnTestResult);
    dispatcher.notifyAfterRun(aggregate);

    if (summary.failedCount() > 0) {
      logger.fine(() -> String.format(
        "Failed tests: %s",
        summary.failures().stream().map(TestResult::testName).collect(joining(", "))
      ));
    }

    return (aggregate == Status.PASS) ? EXIT_PASSED : EXIT_FAILED;
  }

  private static String usage(final JCommander parser) {
    final StringBuilder result = new StringBuilder();
    parser.getUsageFormatter().usage(result);
    return result.toString();
  }

}
