package ca.gc.cra.protomine.api;

/**
 * <strong>What:</strong> Exit codes returned by the protomine command-line tools.
 * <p><strong>Why:</strong> Lets scripts tell a page that changed shape apart from a bad invocation or
 * an unreadable file.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Page layout did not match the configured dialect. */
  DIALECT_ERROR(6),
  /** Table markup could not be parsed. */
  FORMAT_ERROR(7);

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
