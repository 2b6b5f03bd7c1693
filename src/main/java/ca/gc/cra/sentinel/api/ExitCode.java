package ca.gc.cra.sentinel.api;

/**
 * <strong>What:</strong> Process exit codes returned by the SENTINEL CLI.
 * <p><strong>Why:</strong> CI pipelines gate merges on these values, so each outcome keeps a fixed number.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Analysis finished and no finding reached the {@code failOn} threshold. */
  SUCCESS(0),
  /** Analysis finished with at least one finding at or above {@code failOn}. */
  FINDINGS(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Source files could not be read. */
  IO_ERROR(3),
  /** Configuration file was missing or malformed. */
  CONFIG_ERROR(4),
  /** Worker pool failed to start or another unexpected failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Numeric value passed to {@link System#exit(int)}.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
