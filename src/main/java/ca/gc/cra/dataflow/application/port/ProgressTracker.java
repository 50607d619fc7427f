package ca.gc.cra.dataflow.application.port;

import ca.gc.cra.dataflow.domain.run.ResourceStatus;
import java.util.List;

/**
 * <strong>What:</strong> Port receiving per-resource and per-step progress events from pipeline stages.
 * <p><strong>Why:</strong> Overall run success is observed through per-resource status rather than through a
 * pipeline-level exception, so every stage reports its outcome here.</p>
 * <p><strong>Role:</strong> Optional output port held by the pipeline context; absent trackers disable tracking.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Record when a resource enters the pipeline and when it reaches a terminal status.</li>
 *   <li>Record step start, completion and failure for one or more resources.</li>
 *   <li>Flush buffered progress once the run drains.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent calls from many stage workers;
 * the engine performs no locking around these calls.</p>
 * <p><strong>Performance:</strong> Called on the hot path of every stage; implementations should buffer.</p>
 *
 * @since 0.1.0
 */
public interface ProgressTracker {
  /**
   * Records that a resource entered the pipeline.
   *
   * @param resourceId resource identifier
   * @param resourceType resource type tag of the run
   */
  void recordResourceStart(String resourceId, String resourceType);

  /**
   * Records that a step started for the given resources.
   *
   * @param resourceIds resources entering the step
   * @param stepName step name
   */
  void recordStepStart(List<String> resourceIds, String stepName);

  /**
   * Records that a step completed for the given resources.
   *
   * @param resourceIds resources leaving the step
   * @param stepName step name
   * @param durationMs elapsed milliseconds
   */
  void recordStepComplete(List<String> resourceIds, String stepName, long durationMs);

  /**
   * Records that a step failed for the given resources.
   *
   * @param resourceIds affected resources
   * @param stepName step name
   * @param durationMs elapsed milliseconds before the failure
   * @param errorMessage failure description
   */
  void recordStepFailed(List<String> resourceIds, String stepName, long durationMs, String errorMessage);

  /**
   * Records the terminal status of a resource.
   *
   * @param resourceId resource identifier
   * @param status terminal status
   * @param errorMessage failure description; {@code null} unless failed
   * @param failedStep failing step; {@code null} unless failed
   */
  void recordResourceComplete(String resourceId, ResourceStatus status, String errorMessage, String failedStep);

  /**
   * Records a terminal status without failure detail.
   *
   * @param resourceId resource identifier
   * @param status terminal status
   */
  default void recordResourceComplete(String resourceId, ResourceStatus status) {
    recordResourceComplete(resourceId, status, null, null);
  }

  /**
   * Flushes outstanding progress and releases tracker resources. The engine calls this exactly once per run,
   * after the graph has drained.
   */
  void finalizeTracking();

  /**
   * Signals that the run was cancelled. Called before {@link #finalizeTracking()} when the run unwinds early.
   */
  default void cancel() {}
}
