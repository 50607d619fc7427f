package ca.gc.cra.dataflow.application.port;

import ca.gc.cra.dataflow.application.pipeline.CancellationSignal;
import ca.gc.cra.dataflow.domain.run.RunMetadata;

/**
 * Creates one {@link ProgressTracker} per run.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ProgressTrackerFactory {
  /**
   * Creates a tracker bound to a run.
   *
   * @param metadata run identity
   * @param cancellation run cancellation signal
   * @return tracker
   */
  ProgressTracker create(RunMetadata metadata, CancellationSignal cancellation);
}
