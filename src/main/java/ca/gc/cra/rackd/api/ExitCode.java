package ca.gc.cra.rackd.api;

/**
 * <strong>What:</strong> Process exit codes returned by the {@code rackd} command-line tools.
 * <p><strong>Why:</strong> Lets schedulers and wrapper scripts tell a bad invocation apart from a failed scan.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Scan completed, or help/dry-run output was printed. */
  SUCCESS(0),
  /** Command-line arguments or configuration values were invalid. */
  INVALID_ARGS(2),
  /** The configuration file or scan report could not be read or written. */
  IO_ERROR(3),
  /** The scanner could not be wired from otherwise valid configuration. */
  CONFIG_ERROR(4),
  /** The scan reached the failed state or an unexpected error escaped. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
