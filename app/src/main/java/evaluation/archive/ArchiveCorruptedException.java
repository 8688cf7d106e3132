package evaluation.archive;

import java.io.IOException;
import java.nio.file.Path;

/** An archive file contains a line that is not a valid record, or a key written twice. */
public final class ArchiveCorruptedException extends IOException {
  private static final long serialVersionUID = 1L;

  private final Path file;
  private final int lineNumber;

  public ArchiveCorruptedException(Path file, int lineNumber, String message, Throwable cause) {
    super(file + ":" + lineNumber + ": " + message, cause);
    this.file = file;
    this.lineNumber = lineNumber;
  }

  public Path file() {
    return file;
  }

  public int lineNumber() {
    return lineNumber;
  }
}
