package ca.gc.cra.dataflow.infrastructure.memory;

import ca.gc.cra.dataflow.application.port.ProgressTracker;
import ca.gc.cra.dataflow.domain.run.PipelineSnapshot;
import ca.gc.cra.dataflow.domain.run.ResourceProgress;
import ca.gc.cra.dataflow.domain.run.ResourceStatus;
import ca.gc.cra.dataflow.domain.run.StepProgress;
import ca.gc.cra.dataflow.domain.run.StepStatus;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ProgressTracker} keeping per-resource progress in memory.
 * <p><strong>Role:</strong> Default tracker for local runs and tests; exposes {@link #getPipelineSnapshot()}.</p>
 * <p><strong>Thread-safety:</strong> Resource states live in a concurrent map; each state is guarded by its own
 * monitor. Counters only move when a resource first reaches a terminal status.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryProgressTracker implements ProgressTracker {
  private static final Logger log = LoggerFactory.getLogger(InMemoryProgressTracker.class);

  private final UUID runId;
  private final ConcurrentMap<String, ResourceState> resources = new ConcurrentHashMap<>();
  private final AtomicInteger completed = new AtomicInteger();
  private final AtomicInteger failed = new AtomicInteger();
  private final AtomicInteger finalizeCalls = new AtomicInteger();
  private final AtomicBoolean cancelled = new AtomicBoolean();

  public InMemoryProgressTracker(UUID runId) {
    this.runId = Objects.requireNonNull(runId, "runId");
  }

  @Override
  public void recordResourceStart(String resourceId, String resourceType) {
    resources.putIfAbsent(resourceId, new ResourceState(resourceId, resourceType));
  }

  @Override
  public void recordStepStart(List<String> resourceIds, String stepName) {
    for (String resourceId : resourceIds) {
      ResourceState state = resources.get(resourceId);
      if (state != null) {
        state.step(stepName, StepStatus.IN_PROGRESS, null, null);
      }
    }
  }

  @Override
  public void recordStepComplete(List<String> resourceIds, String stepName, long durationMs) {
    for (String resourceId : resourceIds) {
      ResourceState state = resources.get(resourceId);
      if (state != null) {
        state.step(stepName, StepStatus.COMPLETED, durationMs, null);
      }
    }
  }

  @Override
  public void recordStepFailed(List<String> resourceIds, String stepName, long durationMs, String errorMessage) {
    for (String resourceId : resourceIds) {
      ResourceState state = resources.get(resourceId);
      if (state != null) {
        state.step(stepName, StepStatus.FAILED, durationMs, errorMessage);
      }
    }
  }

  @Override
  public void recordResourceComplete(
      String resourceId, ResourceStatus status, String errorMessage, String failedStep) {
    ResourceState state = resources.get(resourceId);
    if (state == null) {
      log.debug("Completion recorded for unknown resource {}", resourceId);
      return;
    }
    ResourceStatus previous = state.complete(status, errorMessage, failedStep);
    if (isTerminal(previous)) {
      return;
    }
    if (status == ResourceStatus.COMPLETED) {
      completed.incrementAndGet();
    } else if (status == ResourceStatus.FAILED) {
      failed.incrementAndGet();
    }
  }

  @Override
  public void finalizeTracking() {
    finalizeCalls.incrementAndGet();
    PipelineSnapshot snapshot = getPipelineSnapshot();
    log.info("Run {} progress: {}/{} completed, {} failed, {} in progress", runId,
        snapshot.completedResources(), snapshot.totalResources(), snapshot.failedResources(),
        snapshot.processingResources());
  }

  @Override
  public void cancel() {
    cancelled.set(true);
  }

  /**
   * Summarizes the run so far.
   *
   * @return snapshot of every known resource
   */
  public PipelineSnapshot getPipelineSnapshot() {
    List<ResourceProgress> details = new ArrayList<>(resources.size());
    for (ResourceState state : resources.values()) {
      details.add(state.toProgress());
    }
    int total = details.size();
    int done = completed.get();
    int failures = failed.get();
    return new PipelineSnapshot(runId, total, done, failures, Math.max(0, total - done - failures), details);
  }

  /**
   * Returns the progress of one resource.
   *
   * @param resourceId resource identifier
   * @return progress, if the resource was started
   */
  public Optional<ResourceProgress> resource(String resourceId) {
    ResourceState state = resources.get(resourceId);
    return state == null ? Optional.empty() : Optional.of(state.toProgress());
  }

  public int finalizeCount() {
    return finalizeCalls.get();
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  private static boolean isTerminal(ResourceStatus status) {
    return status == ResourceStatus.COMPLETED
        || status == ResourceStatus.FAILED
        || status == ResourceStatus.CANCELLED;
  }

  private static final class ResourceState {
    private final String resourceId;
    private final String resourceType;
    private final Map<String, StepProgress> steps = new LinkedHashMap<>();
    private ResourceStatus status = ResourceStatus.PROCESSING;
    private String errorMessage;
    private String failedStep;

    private ResourceState(String resourceId, String resourceType) {
      this.resourceId = resourceId;
      this.resourceType = resourceType;
    }

    synchronized void step(String stepName, StepStatus stepStatus, Long durationMs, String error) {
      steps.put(stepName, new StepProgress(stepName, stepStatus, durationMs, error));
    }

    synchronized ResourceStatus complete(ResourceStatus next, String error, String step) {
      ResourceStatus previous = status;
      if (isTerminal(previous)) {
        return previous;
      }
      status = next;
      errorMessage = error;
      failedStep = step;
      return previous;
    }

    synchronized ResourceProgress toProgress() {
      return new ResourceProgress(resourceId, resourceType, status, new ArrayList<>(steps.values()),
          errorMessage, failedStep);
    }
  }
}
