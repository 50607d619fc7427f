package ca.gc.cra.dataflow.application.pipeline;

import ca.gc.cra.dataflow.application.port.MetricsPort;
import ca.gc.cra.dataflow.application.port.ProgressTracker;
import ca.gc.cra.dataflow.domain.run.ResourceStatus;
import ca.gc.cra.dataflow.logging.Logs;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stage-side view of the optional progress tracker and the metrics port.
 *
 * <p>A missing tracker turns every call into a no-op. Tracker exceptions are logged and never change the outcome
 * of the item being tracked.</p>
 */
final class StepTracking {
  private static final Logger log = LoggerFactory.getLogger(StepTracking.class);

  private final ProgressTracker tracker;
  private final MetricsPort metrics;
  private final String resourceType;

  StepTracking(PipelineContext context) {
    this.tracker = context.progressTracker().orElse(null);
    this.metrics = context.metrics();
    this.resourceType = context.resourceType();
  }

  void resourceStart(String resourceId) {
    if (tracker == null) {
      return;
    }
    try {
      tracker.recordResourceStart(resourceId, resourceType);
    } catch (RuntimeException ex) {
      warn("recordResourceStart", resourceId, ex);
    }
  }

  void stepStart(String resourceId, String stepName) {
    if (tracker == null) {
      return;
    }
    try {
      tracker.recordStepStart(List.of(resourceId), stepName);
    } catch (RuntimeException ex) {
      warn("recordStepStart", resourceId, ex);
    }
  }

  void stepComplete(String resourceId, String stepName, long durationMs) {
    metrics.increment(stepKey(stepName, "success"));
    metrics.observe(stepKey(stepName, "latencyMs"), durationMs);
    if (tracker == null) {
      return;
    }
    try {
      tracker.recordStepComplete(List.of(resourceId), stepName, durationMs);
    } catch (RuntimeException ex) {
      warn("recordStepComplete", resourceId, ex);
    }
  }

  void stepFailed(String resourceId, String stepName, long durationMs, String errorMessage) {
    metrics.increment(stepKey(stepName, "failure"));
    if (tracker == null) {
      return;
    }
    try {
      tracker.recordStepFailed(List.of(resourceId), stepName, durationMs, errorMessage);
      tracker.recordResourceComplete(resourceId, ResourceStatus.FAILED, errorMessage, stepName);
    } catch (RuntimeException ex) {
      warn("recordStepFailed", resourceId, ex);
    }
  }

  void resourceCompleted(String resourceId) {
    if (tracker == null) {
      return;
    }
    try {
      tracker.recordResourceComplete(resourceId, ResourceStatus.COMPLETED);
    } catch (RuntimeException ex) {
      warn("recordResourceComplete", resourceId, ex);
    }
  }

  static String stepKey(String stepName, String suffix) {
    return "pipeline.step." + stepName + '.' + suffix;
  }

  private static void warn(String operation, String resourceId, RuntimeException ex) {
    log.warn("Progress tracker {} failed for resource {}: {}", operation, Logs.truncate(resourceId, 128),
        ex.getMessage(), ex);
  }
}
