package org.upptest.harness;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.converters.IParameterSplitter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

final class CommandLineArgs {

  @Parameter(names = { "-h", "--help" }, help = true, description = "Show this help")
  boolean help = false;

  @Parameter(
    names = { "-c", "--category" },
    description = "Run tests whose category contains the given string (repeatable, comma-separated)"
  )
  List<String> categories = new ArrayList<>();

  @Parameter(
    names = { "-n", "--name" },
    description = "Run tests whose name matches the given regular expression (repeatable)",
    splitter = WholeValueSplitter.class,
    validateWith = RegexValidator.class
  )
  List<String> namePatterns = new ArrayList<>();

  @Parameter(names = { "--list" }, description = "Print the selected tests and exit")
  boolean printList = false;

  @Parameter(names = { "--quiet" }, description = "Print only failures and the summary")
  boolean quiet = false;


  Config toConfig() {
    final Config result = new Config();
    categories.forEach(result::withCategory);
    namePatterns.forEach(result::withNamePattern);

    if (printList) {
      result.withList();
    }

    if (quiet) {
      result.withQuiet();
    }

    return result;
  }

  /** Keeps regular expressions containing commas in one piece. */
  public static final class WholeValueSplitter implements IParameterSplitter {
    @Override
    public List<String> split(String value) {
      return List.of(value);
    }
  }

  public static final class RegexValidator implements IParameterValidator {
    @Override
    public void validate(String name, String value) throws ParameterException {
      try {
        Pattern.compile(value);
      } catch (PatternSyntaxException e) {
        throw new ParameterException(
          "Invalid regular expression for " + name + ": " + e.getDescription()
        );
      }
    }
  }

}
