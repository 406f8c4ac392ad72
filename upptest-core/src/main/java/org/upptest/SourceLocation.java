package org.upptest;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A source file name and line number, captured at the point where a test
 * was declared or where an assertion failed. The location is purely
 * diagnostic. When the location cannot be determined, the file name is
 * empty and the line number is zero.
 */
public final class SourceLocation {

  private static final SourceLocation UNKNOWN = new SourceLocation("", 0);

  private static final StackWalker walker = StackWalker.getInstance();

  private final String fileName;

  private final int lineNumber;


  public SourceLocation(final String fileName, final int lineNumber) {
    this.fileName = Objects.requireNonNull(fileName);
    this.lineNumber = Math.max(lineNumber, 0);
  }

  /** Returns the location used when the source is not known. */
  public static SourceLocation unknown() {
    return UNKNOWN;
  }

  /**
   * Determines the location of the innermost stack frame that does not
   * belong to any of the given classes. Used to find the user code that
   * called into one of the framework entry points.
   *
   * @param skippedClasses Classes whose frames are to be skipped.
   * @return The location of the calling frame, or {@link #unknown()} if
   *   there is no such frame or it carries no source information.
   */
  public static SourceLocation callerOutside(final Set<String> skippedClasses) {
    final Optional<StackWalker.StackFrame> caller = walker.walk(frames -> frames
      .filter(f -> !f.getClassName().equals(SourceLocation.class.getName()))
      .filter(f -> !skippedClasses.contains(f.getClassName()))
      .findFirst()
    );

    return caller.map(SourceLocation::fromFrame).orElse(UNKNOWN);
  }

  private static SourceLocation fromFrame(final StackWalker.StackFrame frame) {
    final String file = frame.getFileName();
    return (file != null) ? new SourceLocation(file, frame.getLineNumber()) : UNKNOWN;
  }


  public String fileName() { return fileName; }

  public int lineNumber() { return lineNumber; }

  public boolean isKnown() { return !fileName.isEmpty(); }


  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }

    if (!(obj instanceof SourceLocation)) {
      return false;
    }

    final SourceLocation that = (SourceLocation) obj;
    return lineNumber == that.lineNumber && fileName.equals(that.fileName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fileName, lineNumber);
  }

  @Override
  public String toString() {
    return isKnown() ? fileName + ":" + lineNumber : "<unknown>";
  }

}
