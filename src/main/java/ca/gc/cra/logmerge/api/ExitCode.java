package ca.gc.cra.logmerge.api;

/**
 * <strong>What:</strong> Process exit codes of the {@code logmerge} command line.
 * <p><strong>Why:</strong> Scripts that schedule merges need to tell bad arguments from I/O trouble.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or configuration values were invalid. */
  INVALID_ARGS(2),
  /** Reading the configuration or writing output failed. */
  IO_ERROR(3),
  /** Configuration was rejected while the run was being wired. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
