package ca.gc.cra.dataflow.application.port;

import java.util.Optional;
import java.util.UUID;

/**
 * <strong>What:</strong> Cache mapping a resource within a run to its resource-run identifier.
 * <p><strong>Role:</strong> Used by the artifact side-channel to address artifacts to the resource run that
 * produced them.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public interface ResourceRunCache {
  /**
   * Returns the resource-run identifier for a resource, creating one if absent.
   *
   * @param runId run identifier
   * @param resourceId resource identifier
   * @param resourceType resource type tag
   * @return resource-run identifier
   */
  UUID getOrCreate(UUID runId, String resourceId, String resourceType);

  /**
   * Looks up a cached resource-run identifier.
   *
   * @param runId run identifier
   * @param resourceId resource identifier
   * @return cached identifier, if any
   */
  Optional<UUID> tryGet(UUID runId, String resourceId);

  /**
   * Registers a known resource-run identifier.
   *
   * @param runId run identifier
   * @param resourceId resource identifier
   * @param resourceRunId resource-run identifier
   */
  void put(UUID runId, String resourceId, UUID resourceRunId);

  /**
   * Drops all entries of a run.
   *
   * @param runId run identifier
   */
  void clearRun(UUID runId);
}
