package ca.gc.cra.dataflow.infrastructure.progress;

import ca.gc.cra.dataflow.application.pipeline.CancellationSignal;
import ca.gc.cra.dataflow.application.port.MetricsPort;
import ca.gc.cra.dataflow.application.port.ProgressService;
import ca.gc.cra.dataflow.application.port.ProgressTracker;
import ca.gc.cra.dataflow.application.port.ProgressTrackerFactory;
import ca.gc.cra.dataflow.domain.run.RunMetadata;
import java.time.Duration;
import java.util.Objects;

/**
 * Creates one {@link BatchingProgressTracker} per run against a shared {@link ProgressService}.
 *
 * @since 0.1.0
 */
public final class BatchingProgressTrackerFactory implements ProgressTrackerFactory {
  private final ProgressService service;
  private final int batchSize;
  private final Duration flushInterval;
  private final MetricsPort metrics;

  public BatchingProgressTrackerFactory(ProgressService service) {
    this(service, BatchingProgressTracker.DEFAULT_BATCH_SIZE, BatchingProgressTracker.DEFAULT_FLUSH_INTERVAL,
        MetricsPort.NO_OP);
  }

  public BatchingProgressTrackerFactory(
      ProgressService service, int batchSize, Duration flushInterval, MetricsPort metrics) {
    this.service = Objects.requireNonNull(service, "service");
    this.batchSize = batchSize;
    this.flushInterval = Objects.requireNonNull(flushInterval, "flushInterval");
    this.metrics = metrics;
  }

  @Override
  public ProgressTracker create(RunMetadata metadata, CancellationSignal cancellation) {
    BatchingProgressTracker tracker = new BatchingProgressTracker(service, metadata, batchSize, flushInterval, metrics);
    if (cancellation != null) {
      cancellation.onCancel(tracker::cancel);
    }
    return tracker;
  }
}
