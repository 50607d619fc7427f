package ca.gc.cra.dataflow.domain.run;

import java.util.List;
import java.util.UUID;

/**
 * <strong>What:</strong> Point-in-time summary of a run's resources.
 * <p><strong>Role:</strong> Returned by in-memory trackers for monitoring and tests.</p>
 * <p><strong>Thread-safety:</strong> Immutable record holding an immutable resource list.</p>
 *
 * @param runId run identifier
 * @param totalResources number of resources seen
 * @param completedResources resources that completed
 * @param failedResources resources that failed
 * @param processingResources resources still in flight
 * @param resources per-resource detail
 * @since 0.1.0
 */
public record PipelineSnapshot(
    UUID runId,
    int totalResources,
    int completedResources,
    int failedResources,
    int processingResources,
    List<ResourceProgress> resources) {

  public PipelineSnapshot {
    resources = resources == null ? List.of() : List.copyOf(resources);
  }
}
