package ca.gc.cra.halo.domain.error;

import java.nio.file.Path;

/**
 * A storage backend could not write or read a batch of results.
 *
 * @since 0.1.0
 */
public final class StorageException extends HaloException {
  private static final long serialVersionUID = 1L;

  private final transient Path path;

  public StorageException(Path path, String message, Throwable cause) {
    super(message, cause);
    this.path = path;
  }

  public StorageException(Path path, String message) {
    this(path, message, null);
  }

  /** Returns the target or source path, when known. */
  public Path path() {
    return path;
  }
}
