package ca.gc.cra.dataflow.application.pipeline;

/**
 * Raised by {@code complete} when the pipeline infrastructure itself failed, for example when a source threw
 * while producing items. Per-item failures never raise this exception.
 *
 * @since 0.1.0
 */
public final class PipelineExecutionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public PipelineExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
