package ca.gc.cra.dataflow.infrastructure.artifact;

import ca.gc.cra.dataflow.application.pipeline.CancellationSignal;
import ca.gc.cra.dataflow.application.port.ArtifactBatcher;
import ca.gc.cra.dataflow.application.port.ArtifactStoragePort;
import ca.gc.cra.dataflow.application.port.MetricsPort;
import ca.gc.cra.dataflow.domain.run.ArtifactSaveRequest;
import ca.gc.cra.dataflow.domain.run.ArtifactSaveResult;
import ca.gc.cra.dataflow.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ArtifactBatcher} that hands artifacts to an {@link ArtifactStoragePort} in batches.
 * <p><strong>Why:</strong> Storage round trips are amortized over up to {@code batchSize} artifacts while the
 * flush interval bounds how long a queued artifact waits.</p>
 * <p><strong>Role:</strong> Adapter behind the artifact side-channel; one instance per pipeline run.</p>
 * <p><strong>Thread-safety:</strong> {@link #queueArtifactSave(ArtifactSaveRequest)} may be called from any
 * thread. A single writer thread owns the storage port.</p>
 *
 * @since 0.1.0
 */
public final class BatchingArtifactBatcher implements ArtifactBatcher {
  private static final Logger log = LoggerFactory.getLogger(BatchingArtifactBatcher.class);
  private static final long IDLE_POLL_MILLIS = 25L;

  /** Default number of artifacts per storage call. */
  public static final int DEFAULT_BATCH_SIZE = 100;
  /** Default upper bound on how long a partial batch waits. */
  public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofMillis(1000);

  private final ArtifactStoragePort storage;
  private final UUID runId;
  private final int batchSize;
  private final long flushIntervalNanos;
  private final CancellationSignal cancellation;
  private final MetricsPort metrics;
  private final BlockingQueue<ArtifactSaveRequest> queue = new LinkedBlockingQueue<>();
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicLong saved = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final Thread writer;

  /**
   * Creates a batcher and starts its writer thread.
   *
   * @param storage destination for artifact batches
   * @param runId run the artifacts belong to; used for thread naming and logs
   * @param batchSize maximum artifacts per storage call; must be positive
   * @param flushInterval maximum wait before a partial batch is written; must be positive
   * @param cancellation run cancellation; once cancelled, queued artifacts are dropped
   * @param metrics metrics sink
   */
  public BatchingArtifactBatcher(
      ArtifactStoragePort storage,
      UUID runId,
      int batchSize,
      Duration flushInterval,
      CancellationSignal cancellation,
      MetricsPort metrics) {
    this.storage = Objects.requireNonNull(storage, "storage");
    this.runId = Objects.requireNonNull(runId, "runId");
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive");
    }
    Objects.requireNonNull(flushInterval, "flushInterval");
    if (flushInterval.isZero() || flushInterval.isNegative()) {
      throw new IllegalArgumentException("flushInterval must be positive");
    }
    this.batchSize = batchSize;
    this.flushIntervalNanos = flushInterval.toNanos();
    this.cancellation = cancellation == null ? new CancellationSignal() : cancellation;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.writer = ExecutorFactories.newThread(
        "artifact-writer-" + runId.toString().substring(0, 8), this::writeLoop,
        (t, e) -> log.error("Artifact writer {} crashed", t.getName(), e));
    this.writer.start();
  }

  @Override
  public void queueArtifactSave(ArtifactSaveRequest request) {
    Objects.requireNonNull(request, "request");
    if (stopRequested.get()) {
      throw new IllegalStateException("Artifact batcher for run " + runId + " is finalized");
    }
    queue.add(request);
    metrics.increment("artifact.batcher.queued");
  }

  /**
   * Stops accepting artifacts, writes everything still queued and waits for the writer thread.
   *
   * @throws InterruptedException if interrupted while waiting for the writer
   */
  @Override
  public void finalizeBatcher() throws InterruptedException {
    if (!stopRequested.compareAndSet(false, true)) {
      return;
    }
    writer.join();
    log.info("Artifact batcher for run {} finished: {} saved, {} failed", runId, saved.get(), failed.get());
  }

  public long savedCount() {
    return saved.get();
  }

  public long failedCount() {
    return failed.get();
  }

  public int pendingCount() {
    return queue.size();
  }

  private void writeLoop() {
    List<ArtifactSaveRequest> batch = new ArrayList<>(batchSize);
    long batchStarted = System.nanoTime();
    try {
      while (true) {
        if (cancellation.isCancelled()) {
          int dropped = batch.size() + queue.size();
          if (dropped > 0) {
            log.warn("Run {} cancelled; dropping {} queued artifacts", runId, dropped);
            metrics.observe("artifact.batcher.dropped", dropped);
          }
          return;
        }
        if (stopRequested.get() && queue.isEmpty()) {
          break;
        }
        ArtifactSaveRequest next = queue.poll(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (next != null) {
          if (batch.isEmpty()) {
            batchStarted = System.nanoTime();
          }
          batch.add(next);
          queue.drainTo(batch, batchSize - batch.size());
        }
        boolean full = batch.size() >= batchSize;
        boolean stale = !batch.isEmpty() && System.nanoTime() - batchStarted >= flushIntervalNanos;
        if (full || stale) {
          flush(batch);
        }
      }
      flush(batch);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.warn("Artifact writer for run {} interrupted with {} artifacts unsaved", runId,
          batch.size() + queue.size());
    }
  }

  private void flush(List<ArtifactSaveRequest> batch) {
    if (batch.isEmpty()) {
      return;
    }
    long start = System.nanoTime();
    List<ArtifactSaveResult> results;
    try {
      results = storage.saveBatch(List.copyOf(batch));
    } catch (RuntimeException ex) {
      failed.addAndGet(batch.size());
      metrics.increment("artifact.batcher.flush.error");
      log.error("Failed to save batch of {} artifacts for run {}", batch.size(), runId, ex);
      batch.clear();
      return;
    }
    for (ArtifactSaveResult result : results) {
      if (result.success()) {
        saved.incrementAndGet();
      } else {
        failed.incrementAndGet();
        log.warn("Artifact {}/{} for resource run {} not saved: {}", result.request().stepName(),
            result.request().artifactName(), result.request().resourceRunId(), result.errorMessage());
      }
    }
    metrics.observe("artifact.batcher.flush.size", batch.size());
    metrics.observe("artifact.batcher.flush.latencyMs", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    batch.clear();
  }
}
