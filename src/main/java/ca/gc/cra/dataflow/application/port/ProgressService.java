package ca.gc.cra.dataflow.application.port;

import ca.gc.cra.dataflow.domain.run.CreateRunRequest;
import ca.gc.cra.dataflow.domain.run.PipelineRun;
import ca.gc.cra.dataflow.domain.run.ResourceCompletionUpdate;
import ca.gc.cra.dataflow.domain.run.ResourceStartUpdate;
import ca.gc.cra.dataflow.domain.run.RunStatus;
import ca.gc.cra.dataflow.domain.run.StepProgressUpdate;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * <strong>What:</strong> Port over the durable store of runs, resource runs and step progress.
 * <p><strong>Why:</strong> Resume-mode sources need the run history to replay only incomplete resources, and
 * batching trackers need a sink for buffered progress.</p>
 * <p><strong>Role:</strong> Optional output port; distinct from {@link ProgressTracker}, which stages call.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls.</p>
 *
 * @since 0.1.0
 */
public interface ProgressService {
  /**
   * Registers a run.
   *
   * @param request run description
   * @return registered run in {@code RUNNING} status
   */
  PipelineRun createRun(CreateRunRequest request);

  /**
   * Marks a run finished.
   *
   * @param runId run identifier
   * @param status terminal status
   */
  void completeRun(UUID runId, RunStatus status);

  /**
   * Returns the identifiers of resources on {@code runId} that neither completed nor were cancelled.
   *
   * @param runId reference run
   * @return incomplete resource identifiers; empty when the run is unknown
   */
  Set<String> getIncompleteResourceIds(UUID runId);

  /**
   * Creates resource runs for newly started resources.
   *
   * @param runId run identifier
   * @param updates started resources
   */
  void createResourceRunsBatch(UUID runId, List<ResourceStartUpdate> updates);

  /**
   * Applies step transitions.
   *
   * @param runId run identifier
   * @param updates step transitions
   * @return updates whose resource run does not exist yet; the caller retries them on a later flush
   */
  List<StepProgressUpdate> updateStepProgressBatch(UUID runId, List<StepProgressUpdate> updates);

  /**
   * Applies terminal resource statuses.
   *
   * @param runId run identifier
   * @param updates terminal statuses
   */
  void completeResourceRunsBatch(UUID runId, List<ResourceCompletionUpdate> updates);
}
