package ca.gc.cra.dataflow.domain.run;

/**
 * Lifecycle status of a pipeline run.
 *
 * @since 0.1.0
 */
public enum RunStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED,
  CANCELLED
}
