package ca.gc.cra.dataflow.application.pipeline;

import ca.gc.cra.dataflow.application.port.ArtifactBatcher;
import ca.gc.cra.dataflow.application.port.MetricsPort;
import ca.gc.cra.dataflow.application.port.ResourceRunCache;
import ca.gc.cra.dataflow.domain.result.PipelineResult;
import ca.gc.cra.dataflow.domain.run.ArtifactSaveRequest;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;

/**
 * Persistence end of the artifact side-channel. Queues one save request per successful, non-null result and
 * emits nothing. Failures are logged and swallowed so they never affect the main path.
 *
 * @param <T> captured value type
 */
final class ArtifactCaptureStage<T> extends Stage<PipelineResult<T>, Void> {
  static final String PERSISTED_METRIC = "pipeline.artifact.queued";
  static final String FAILED_METRIC = "pipeline.artifact.failed";

  private final String stepName;
  private final ArtifactOptions<T> options;
  private final ArtifactBatcher batcher;
  private final ResourceRunCache cache;
  private final UUID runId;
  private final String resourceType;
  private final MetricsPort metrics;
  private final Logger logger;

  ArtifactCaptureStage(String stepName, ArtifactOptions<T> options, ArtifactBatcher batcher, PipelineContext context) {
    super(stepName + "_artifact", false);
    this.stepName = stepName;
    this.options = Objects.requireNonNull(options, "options");
    this.batcher = Objects.requireNonNull(batcher, "batcher");
    this.cache = context.resourceRunCache().orElse(null);
    this.runId = context.runId();
    this.resourceType = context.resourceType();
    this.metrics = context.metrics();
    this.logger = context.logger();
  }

  @Override
  void process(PipelineResult<T> result, Emitter<Void> out) {
    if (result.isFailure() || result.value() == null) {
      return;
    }
    T value = result.value();
    try {
      String name = options.resolveName(stepName, value);
      Object data = options.resolveData(value);
      String resourceId = options.resolveResourceId(value, result.resourceId());
      UUID resourceRunId = cache != null
          ? cache.getOrCreate(runId, resourceId, resourceType)
          : UUID.randomUUID();
      batcher.queueArtifactSave(ArtifactSaveRequest.of(resourceRunId, stepName, name, data, options.storageType()));
      metrics.increment(PERSISTED_METRIC);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted while queuing artifact for step {}", stepName);
    } catch (Exception ex) {
      metrics.increment(FAILED_METRIC);
      logger.error("Error queuing artifact for step {}", stepName, ex);
    }
  }
}
