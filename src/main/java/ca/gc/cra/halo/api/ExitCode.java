package ca.gc.cra.halo.api;

/**
 * <strong>What:</strong> Process exit codes shared by HALO commands.
 * <p><strong>Why:</strong> Scripts wrapping the CLI can tell a missing camera from a bad argument.</p>
 * <p><strong>Thread-safety:</strong> Immutable enum.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Frame capture or file I/O failed. */
  IO_ERROR(3),
  /** Configuration was missing or malformed, including a missing cascade file. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** The camera or video file could not be opened. */
  DEVICE_UNAVAILABLE(6),
  /** Process was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /** Numeric value handed to {@link System#exit(int)}. */
  public int code() {
    return code;
  }
}
