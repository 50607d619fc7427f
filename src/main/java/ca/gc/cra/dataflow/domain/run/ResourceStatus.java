package ca.gc.cra.dataflow.domain.run;

/**
 * <strong>What:</strong> Processing status of one resource within a run.
 * <p><strong>Role:</strong> Reported through {@code ProgressTracker#recordResourceComplete} and used by
 * resume-mode sources to decide which resources are still incomplete.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum ResourceStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED,
  CANCELLED;

  /**
   * Reports whether a resource in this status must be replayed by a retry or continuation run.
   *
   * @return {@code true} unless the resource completed or was cancelled
   */
  public boolean isIncomplete() {
    return this != COMPLETED && this != CANCELLED;
  }
}
