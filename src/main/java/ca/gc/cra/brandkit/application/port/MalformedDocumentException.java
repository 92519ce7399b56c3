package ca.gc.cra.brandkit.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised by {@link ConfigStore} when a document file exists but cannot be parsed into a mapping.
 *
 * @since 0.1.0
 */
public final class MalformedDocumentException extends IOException {
  private final transient Path path;

  public MalformedDocumentException(Path path, String message) {
    super(message);
    this.path = path;
  }

  public MalformedDocumentException(Path path, String message, Throwable cause) {
    super(message, cause);
    this.path = path;
  }

  /**
   * Returns the offending file.
   *
   * @return document path
   */
  public Path path() {
    return path;
  }
}
