package ca.gc.cra.dataflow.api;

/**
 * Process exit codes reported by the dataflow CLI.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments could not be parsed or failed validation. */
  INVALID_ARGS(2),
  /** Input or configuration file could not be read. */
  IO_ERROR(3),
  /** Configuration was readable but inconsistent. */
  CONFIG_ERROR(4),
  /** The pipeline failed while running. */
  RUNTIME_FAILURE(5),
  /** The run was cancelled or the thread interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
