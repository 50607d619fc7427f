package ca.gc.cra.dataflow.domain.run;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Registered pipeline run as recorded by a progress service.
 *
 * @param runId run identifier
 * @param name pipeline name
 * @param category pipeline category
 * @param runType kind of run
 * @param parentRunId run this one resumes; may be {@code null}
 * @param status current run status
 * @param startedAt registration time
 * @param completedAt completion time; {@code null} while the run is active
 * @since 0.1.0
 */
public record PipelineRun(
    UUID runId,
    String name,
    String category,
    RunType runType,
    UUID parentRunId,
    RunStatus status,
    Instant startedAt,
    Instant completedAt) {

  public PipelineRun {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(status, "status");
  }

  /**
   * Returns a copy of this run marked with a terminal status.
   *
   * @param terminal final status
   * @param at completion time
   * @return completed run
   */
  public PipelineRun complete(RunStatus terminal, Instant at) {
    return new PipelineRun(runId, name, category, runType, parentRunId, terminal, startedAt, at);
  }
}
