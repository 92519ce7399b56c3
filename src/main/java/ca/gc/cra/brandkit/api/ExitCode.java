package ca.gc.cra.brandkit.api;

/**
 * <strong>What:</strong> Process exit codes returned by the Brandkit command-line tool.
 * <p><strong>Why:</strong> Lets scripts tell a missing brand from a protected one or a bad argument without
 * parsing log output.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enumerate the success and failure outcomes of {@link Main#run(String[])}.</li>
 *   <li>Expose the numeric value handed to {@link System#exit(int)}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or operation inputs were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while reading or writing registry files. */
  IO_ERROR(3),
  /** Settings were missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** The brand, template or asset does not exist. */
  NOT_FOUND(6),
  /** The brand or template already exists. */
  CONFLICT(7),
  /** A strict protection level (or an unverifiable one) blocked the operation. */
  PROTECTED(8),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
