package ca.gc.cra.dataflow.application.port;

import ca.gc.cra.dataflow.application.pipeline.CancellationSignal;
import ca.gc.cra.dataflow.domain.run.RunMetadata;

/**
 * Creates one {@link ArtifactBatcher} per run.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ArtifactBatcherFactory {
  /**
   * Creates a batcher bound to a run.
   *
   * @param metadata run identity
   * @param cancellation run cancellation signal
   * @return batcher
   */
  ArtifactBatcher create(RunMetadata metadata, CancellationSignal cancellation);
}
