package ca.gc.cra.dataflow.domain.run;

import java.util.Objects;
import java.util.UUID;

/**
 * Request to register a pipeline run with a progress service.
 *
 * @param runId identifier of the run
 * @param name pipeline name
 * @param category pipeline category
 * @param runType kind of run
 * @param parentRunId run this one resumes; {@code null} for fresh runs
 * @since 0.1.0
 */
public record CreateRunRequest(UUID runId, String name, String category, RunType runType, UUID parentRunId) {
  public CreateRunRequest {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(runType, "runType");
  }
}
