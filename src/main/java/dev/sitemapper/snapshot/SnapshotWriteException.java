package dev.sitemapper.snapshot;

import java.nio.file.Path;
import org.springframework.boot.ExitCodeGenerator;

/**
 * Raised when snapshot output cannot be persisted. The crawl result is lost in that case, so the
 * run fails with exit status {@value #EXIT_CODE}.
 */
public class SnapshotWriteException extends RuntimeException implements ExitCodeGenerator {

  static final int EXIT_CODE = 3;

  private final transient Path path;

  public SnapshotWriteException(String message, Path path, Throwable cause) {
    super(message + ": " + path, cause);
    this.path = path;
  }

  /** The file or directory that could not be written. */
  public Path getPath() {
    return path;
  }

  @Override
  public int getExitCode() {
    return EXIT_CODE;
  }
}
