package ca.gc.cra.dataflow.infrastructure.progress;

import ca.gc.cra.dataflow.application.port.MetricsPort;
import ca.gc.cra.dataflow.application.port.ProgressService;
import ca.gc.cra.dataflow.application.port.ProgressTracker;
import ca.gc.cra.dataflow.domain.run.ResourceCompletionUpdate;
import ca.gc.cra.dataflow.domain.run.ResourceStartUpdate;
import ca.gc.cra.dataflow.domain.run.ResourceStatus;
import ca.gc.cra.dataflow.domain.run.RunMetadata;
import ca.gc.cra.dataflow.domain.run.RunStatus;
import ca.gc.cra.dataflow.domain.run.StepProgressUpdate;
import ca.gc.cra.dataflow.domain.run.StepStatus;
import ca.gc.cra.dataflow.infrastructure.exec.ExecutorFactories;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ProgressTracker} that buffers progress events and writes them to a
 * {@link ProgressService} in batches.
 * <p><strong>Why:</strong> Stage workers record progress on every item; buffering keeps service round trips off
 * the hot path.</p>
 * <p><strong>Role:</strong> Registers the run on construction and closes it during {@link #finalizeTracking()}
 * with {@link RunStatus#COMPLETED}, {@link RunStatus#FAILED} or {@link RunStatus#CANCELLED}.</p>
 * <p><strong>Thread-safety:</strong> Recording methods may be called from any thread. A single flusher thread
 * talks to the service, writing resource starts before step updates and step updates before completions.
 * Step updates the service defers are retried on the next flush.</p>
 *
 * @since 0.1.0
 */
public final class BatchingProgressTracker implements ProgressTracker {
  private static final Logger log = LoggerFactory.getLogger(BatchingProgressTracker.class);
  private static final long IDLE_POLL_MILLIS = 25L;

  /** Default number of pending events that triggers a flush. */
  public static final int DEFAULT_BATCH_SIZE = 100;
  /** Default upper bound on how long an event stays buffered. */
  public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofMillis(1000);

  private final ProgressService service;
  private final UUID runId;
  private final int batchSize;
  private final long flushIntervalNanos;
  private final MetricsPort metrics;
  private final Clock clock;
  private final BlockingQueue<ResourceStartUpdate> starts = new LinkedBlockingQueue<>();
  private final BlockingQueue<StepProgressUpdate> steps = new LinkedBlockingQueue<>();
  private final BlockingQueue<ResourceCompletionUpdate> completions = new LinkedBlockingQueue<>();
  private final List<StepProgressUpdate> deferred = new ArrayList<>();
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final AtomicInteger failedResources = new AtomicInteger();
  private final Object flushLock = new Object();
  private final Thread flusher;

  /**
   * Registers the run with the service and starts the flusher thread.
   *
   * @param service progress persistence
   * @param metadata run being tracked
   * @param batchSize pending events that trigger a flush; must be positive
   * @param flushInterval maximum time an event stays buffered; must be positive
   * @param metrics metrics sink
   */
  public BatchingProgressTracker(
      ProgressService service,
      RunMetadata metadata,
      int batchSize,
      Duration flushInterval,
      MetricsPort metrics) {
    this(service, metadata, batchSize, flushInterval, metrics, Clock.systemUTC());
  }

  BatchingProgressTracker(
      ProgressService service,
      RunMetadata metadata,
      int batchSize,
      Duration flushInterval,
      MetricsPort metrics,
      Clock clock) {
    this.service = Objects.requireNonNull(service, "service");
    Objects.requireNonNull(metadata, "metadata");
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive");
    }
    Objects.requireNonNull(flushInterval, "flushInterval");
    if (flushInterval.isZero() || flushInterval.isNegative()) {
      throw new IllegalArgumentException("flushInterval must be positive");
    }
    this.runId = metadata.runId();
    this.batchSize = batchSize;
    this.flushIntervalNanos = flushInterval.toNanos();
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
    service.createRun(metadata.toCreateRunRequest());
    this.flusher = ExecutorFactories.newThread(
        "progress-flusher-" + runId.toString().substring(0, 8), this::flushLoop,
        (t, e) -> log.error("Progress flusher {} crashed", t.getName(), e));
    this.flusher.start();
  }

  @Override
  public void recordResourceStart(String resourceId, String resourceType) {
    starts.add(new ResourceStartUpdate(resourceId, resourceType, clock.instant()));
  }

  @Override
  public void recordStepStart(List<String> resourceIds, String stepName) {
    enqueueSteps(resourceIds, stepName, StepStatus.IN_PROGRESS, null, null);
  }

  @Override
  public void recordStepComplete(List<String> resourceIds, String stepName, long durationMs) {
    enqueueSteps(resourceIds, stepName, StepStatus.COMPLETED, durationMs, null);
  }

  @Override
  public void recordStepFailed(List<String> resourceIds, String stepName, long durationMs, String errorMessage) {
    enqueueSteps(resourceIds, stepName, StepStatus.FAILED, durationMs, errorMessage);
  }

  @Override
  public void recordResourceComplete(
      String resourceId, ResourceStatus status, String errorMessage, String failedStep) {
    if (status == ResourceStatus.FAILED) {
      failedResources.incrementAndGet();
    }
    completions.add(new ResourceCompletionUpdate(resourceId, status, errorMessage, failedStep, clock.instant()));
  }

  /**
   * Flushes everything still buffered and closes the run in the progress service.
   */
  @Override
  public void finalizeTracking() {
    if (!stopRequested.compareAndSet(false, true)) {
      return;
    }
    try {
      flusher.join();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted waiting for progress flusher of run {}", runId);
    }
    flushPending();
    synchronized (flushLock) {
      if (!deferred.isEmpty()) {
        log.warn("Run {}: {} step updates never matched a resource and were dropped", runId, deferred.size());
        metrics.observe("progress.tracker.deferred.dropped", deferred.size());
        deferred.clear();
      }
    }
    RunStatus status = cancelled.get()
        ? RunStatus.CANCELLED
        : failedResources.get() > 0 ? RunStatus.FAILED : RunStatus.COMPLETED;
    try {
      service.completeRun(runId, status);
      log.info("Run {} closed as {}", runId, status);
    } catch (RuntimeException ex) {
      metrics.increment("progress.tracker.complete.error");
      log.error("Failed to close run {} as {}", runId, status, ex);
    }
  }

  @Override
  public void cancel() {
    cancelled.set(true);
  }

  private void enqueueSteps(
      List<String> resourceIds, String stepName, StepStatus status, Long durationMs, String errorMessage) {
    for (String resourceId : resourceIds) {
      steps.add(new StepProgressUpdate(resourceId, stepName, status, durationMs, errorMessage, clock.instant()));
    }
  }

  private int pendingCount() {
    return starts.size() + steps.size() + completions.size();
  }

  private void flushLoop() {
    long lastFlush = System.nanoTime();
    try {
      while (!stopRequested.get()) {
        TimeUnit.MILLISECONDS.sleep(IDLE_POLL_MILLIS);
        boolean full = pendingCount() >= batchSize;
        boolean stale = System.nanoTime() - lastFlush >= flushIntervalNanos;
        if (full || (stale && pendingCount() > 0)) {
          flushPending();
          lastFlush = System.nanoTime();
        }
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private void flushPending() {
    synchronized (flushLock) {
      List<ResourceStartUpdate> startBatch = new ArrayList<>();
      starts.drainTo(startBatch);
      List<StepProgressUpdate> stepBatch = new ArrayList<>(deferred);
      deferred.clear();
      steps.drainTo(stepBatch);
      List<ResourceCompletionUpdate> completionBatch = new ArrayList<>();
      completions.drainTo(completionBatch);

      if (!startBatch.isEmpty()) {
        try {
          service.createResourceRunsBatch(runId, startBatch);
        } catch (RuntimeException ex) {
          metrics.increment("progress.tracker.flush.error");
          log.error("Failed to record {} resource starts for run {}", startBatch.size(), runId, ex);
        }
      }
      if (!stepBatch.isEmpty()) {
        try {
          List<StepProgressUpdate> retry = service.updateStepProgressBatch(runId, stepBatch);
          if (retry != null && !retry.isEmpty()) {
            deferred.addAll(retry);
            log.debug("Run {}: {} step updates deferred", runId, retry.size());
          }
        } catch (RuntimeException ex) {
          metrics.increment("progress.tracker.flush.error");
          log.error("Failed to record {} step updates for run {}", stepBatch.size(), runId, ex);
        }
      }
      if (!completionBatch.isEmpty()) {
        try {
          service.completeResourceRunsBatch(runId, completionBatch);
        } catch (RuntimeException ex) {
          metrics.increment("progress.tracker.flush.error");
          log.error("Failed to record {} resource completions for run {}", completionBatch.size(), runId, ex);
        }
      }
      metrics.observe("progress.tracker.flush.size", startBatch.size() + stepBatch.size() + completionBatch.size());
    }
  }
}
