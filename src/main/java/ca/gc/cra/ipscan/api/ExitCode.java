package ca.gc.cra.ipscan.api;

/**
 * <strong>What:</strong> Process exit codes returned by the scanner CLI.
 * <p><strong>Why:</strong> Lets container supervisors and scripts distinguish bad arguments from an unreachable
 * store or an interrupted run.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or configuration values were invalid. */
  INVALID_ARGS(2),
  /** I/O failure, including an unreachable result store during a one-shot scan. */
  IO_ERROR(3),
  /** Configuration was rejected after validation, while wiring the pipeline. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /**
   * Scan loop was interrupted. After SIGINT or SIGTERM the JVM reports the signal status (130 or 143) itself.
   */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value passed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
