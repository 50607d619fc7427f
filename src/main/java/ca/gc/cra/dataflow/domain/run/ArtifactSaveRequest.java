package ca.gc.cra.dataflow.domain.run;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * <strong>What:</strong> Request to persist one artifact produced by a pipeline step.
 * <p><strong>Role:</strong> Produced by the artifact side-channel and consumed by artifact batchers and storage
 * adapters.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; {@code data} is shared by reference and should not be
 * mutated after queueing.</p>
 *
 * @param resourceRunId identifier of the resource run the artifact belongs to
 * @param stepName step that produced the artifact
 * @param artifactName artifact name, unique per step and resource run
 * @param data artifact payload
 * @param storageType target storage backend
 * @param createdAt time the request was created
 * @since 0.1.0
 */
public record ArtifactSaveRequest(
    UUID resourceRunId,
    String stepName,
    String artifactName,
    Object data,
    ArtifactStorageType storageType,
    Instant createdAt) {

  public ArtifactSaveRequest {
    Objects.requireNonNull(resourceRunId, "resourceRunId");
    Objects.requireNonNull(stepName, "stepName");
    Objects.requireNonNull(artifactName, "artifactName");
    storageType = storageType == null ? ArtifactStorageType.S3 : storageType;
    createdAt = createdAt == null ? Instant.now() : createdAt;
  }

  /**
   * Creates a request addressed to the given storage type, stamped with the current time.
   *
   * @param resourceRunId resource run identifier
   * @param stepName producing step
   * @param artifactName artifact name
   * @param data payload
   * @param storageType backend; {@code null} selects {@link ArtifactStorageType#S3}
   * @return request
   */
  public static ArtifactSaveRequest of(
      UUID resourceRunId, String stepName, String artifactName, Object data, ArtifactStorageType storageType) {
    return new ArtifactSaveRequest(resourceRunId, stepName, artifactName, data, storageType, Instant.now());
  }
}
