package ca.gc.cra.dataflow.domain.run;

/**
 * Status of one step for one resource.
 *
 * @since 0.1.0
 */
public enum StepStatus {
  PENDING,
  IN_PROGRESS,
  COMPLETED,
  FAILED
}
