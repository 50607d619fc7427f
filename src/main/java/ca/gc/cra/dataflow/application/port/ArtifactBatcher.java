package ca.gc.cra.dataflow.application.port;

import ca.gc.cra.dataflow.domain.run.ArtifactSaveRequest;

/**
 * <strong>What:</strong> Port accepting artifact save requests for asynchronous, batched persistence.
 * <p><strong>Role:</strong> Optional collaborator of the artifact side-channel; absent batchers turn
 * {@code withArtifact} steps into pass-through steps.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent {@link #queueArtifactSave} calls.</p>
 *
 * @since 0.1.0
 */
public interface ArtifactBatcher {
  /**
   * Queues one artifact for persistence.
   *
   * @param request artifact save request
   * @throws Exception if the request cannot be queued
   */
  void queueArtifactSave(ArtifactSaveRequest request) throws Exception;

  /**
   * Drains queued requests, flushes them to storage and releases resources. The engine calls this exactly once
   * per run, after the tracker has been finalized.
   *
   * @throws Exception if the final flush fails
   */
  void finalizeBatcher() throws Exception;
}
