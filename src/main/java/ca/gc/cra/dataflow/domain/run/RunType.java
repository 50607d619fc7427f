package ca.gc.cra.dataflow.domain.run;

/**
 * <strong>What:</strong> Kind of pipeline run.
 * <p><strong>Why:</strong> Resume-mode sources replay only the incomplete resources of a previous run unless
 * the run is {@link #FRESH}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum RunType {
  /** Process every resource from the fresh source. */
  FRESH,
  /** Reprocess resources that failed or never finished on the reference run. */
  RETRY,
  /** Continue an interrupted run with its unfinished resources. */
  CONTINUATION
}
