package ca.gc.cra.dataflow.infrastructure.artifact;

import ca.gc.cra.dataflow.application.pipeline.CancellationSignal;
import ca.gc.cra.dataflow.application.port.ArtifactBatcher;
import ca.gc.cra.dataflow.application.port.ArtifactBatcherFactory;
import ca.gc.cra.dataflow.application.port.ArtifactStoragePort;
import ca.gc.cra.dataflow.application.port.MetricsPort;
import ca.gc.cra.dataflow.domain.run.RunMetadata;
import java.time.Duration;
import java.util.Objects;

/**
 * Creates one {@link BatchingArtifactBatcher} per run, all writing to the same storage port.
 *
 * @since 0.1.0
 */
public final class BatchingArtifactBatcherFactory implements ArtifactBatcherFactory {
  private final ArtifactStoragePort storage;
  private final int batchSize;
  private final Duration flushInterval;
  private final MetricsPort metrics;

  public BatchingArtifactBatcherFactory(ArtifactStoragePort storage) {
    this(storage, BatchingArtifactBatcher.DEFAULT_BATCH_SIZE, BatchingArtifactBatcher.DEFAULT_FLUSH_INTERVAL,
        MetricsPort.NO_OP);
  }

  public BatchingArtifactBatcherFactory(
      ArtifactStoragePort storage, int batchSize, Duration flushInterval, MetricsPort metrics) {
    this.storage = Objects.requireNonNull(storage, "storage");
    this.batchSize = batchSize;
    this.flushInterval = Objects.requireNonNull(flushInterval, "flushInterval");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public ArtifactBatcher create(RunMetadata metadata, CancellationSignal cancellation) {
    return new BatchingArtifactBatcher(storage, metadata.runId(), batchSize, flushInterval, cancellation, metrics);
  }
}
