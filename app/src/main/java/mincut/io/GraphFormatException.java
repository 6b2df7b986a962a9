package mincut.io;

import java.io.IOException;
import java.nio.file.Path;

/** A graph file line that does not parse. Carries the offending file and 1-based line number. */
public final class GraphFormatException extends IOException {
  private static final long serialVersionUID = 1L;

  private final Path path;
  private final int lineNumber;

  public GraphFormatException(Path path, int lineNumber, String message) {
    super(path + ":" + lineNumber + ": " + message);
    this.path = path;
    this.lineNumber = lineNumber;
  }

  public GraphFormatException(Path path, int lineNumber, String message, Throwable cause) {
    this(path, lineNumber, message);
    initCause(cause);
  }

  public Path path() {
    return path;
  }

  public int lineNumber() {
    return lineNumber;
  }
}
