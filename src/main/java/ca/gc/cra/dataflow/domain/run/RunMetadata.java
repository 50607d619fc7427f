package ca.gc.cra.dataflow.domain.run;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of a pipeline run handed to collaborator factories.
 *
 * @param runId run identifier
 * @param name pipeline name
 * @param category pipeline category
 * @param runType kind of run
 * @param parentRunId run this one resumes; {@code null} for fresh runs
 * @since 0.1.0
 */
public record RunMetadata(UUID runId, String name, String category, RunType runType, UUID parentRunId) {
  public RunMetadata {
    Objects.requireNonNull(runId, "runId");
    runType = runType == null ? RunType.FRESH : runType;
  }

  /**
   * Returns the run whose history a resume-mode source consults.
   *
   * @return parent run when set, otherwise this run
   */
  public UUID referenceRunId() {
    return parentRunId != null ? parentRunId : runId;
  }

  /**
   * Builds the registration request for a progress service.
   *
   * @return create-run request
   */
  public CreateRunRequest toCreateRunRequest() {
    return new CreateRunRequest(runId, name, category, runType, parentRunId);
  }
}
