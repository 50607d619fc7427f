package ca.gc.cra.dataflow.domain.run;

import java.util.Objects;

/**
 * Outcome of persisting one artifact.
 *
 * @param request request that was processed
 * @param success whether the artifact was stored
 * @param location storage location when stored; {@code null} otherwise
 * @param errorMessage failure description when not stored; {@code null} otherwise
 * @since 0.1.0
 */
public record ArtifactSaveResult(
    ArtifactSaveRequest request, boolean success, String location, String errorMessage) {

  public ArtifactSaveResult {
    Objects.requireNonNull(request, "request");
  }

  public static ArtifactSaveResult stored(ArtifactSaveRequest request, String location) {
    return new ArtifactSaveResult(request, true, location, null);
  }

  public static ArtifactSaveResult failed(ArtifactSaveRequest request, String errorMessage) {
    return new ArtifactSaveResult(request, false, null, errorMessage);
  }
}
