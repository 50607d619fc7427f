package ca.gc.cra.dataflow.config;

import ca.gc.cra.dataflow.application.pipeline.PipelineContext;
import ca.gc.cra.dataflow.application.port.ArtifactStoragePort;
import ca.gc.cra.dataflow.application.port.MetricsPort;
import ca.gc.cra.dataflow.application.port.ProgressService;
import ca.gc.cra.dataflow.application.port.ResourceRunCache;
import ca.gc.cra.dataflow.domain.run.ArtifactStorageType;
import ca.gc.cra.dataflow.infrastructure.artifact.BatchingArtifactBatcherFactory;
import ca.gc.cra.dataflow.infrastructure.artifact.FileSystemArtifactStorage;
import ca.gc.cra.dataflow.infrastructure.memory.InMemoryArtifactStorage;
import ca.gc.cra.dataflow.infrastructure.memory.InMemoryProgressService;
import ca.gc.cra.dataflow.infrastructure.memory.InMemoryResourceRunCache;
import ca.gc.cra.dataflow.infrastructure.progress.BatchingProgressTrackerFactory;
import java.util.Objects;

/**
 * <strong>What:</strong> Composition root that turns a {@link PipelineConfig} into wired
 * {@link PipelineContext.Builder}s.
 * <p><strong>Why:</strong> Keeps adapter selection (memory or file artifacts, batching progress) out of pipeline
 * code; callers only add run-specific options before {@code build()}.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; the shared collaborators are thread-safe, so
 * builders may be created concurrently.</p>
 *
 * @since 0.1.0
 */
public final class PipelineContextFactory {
  private final PipelineConfig config;
  private final MetricsPort metrics;
  private final ProgressService progressService;
  private final ResourceRunCache resourceRunCache;
  private final ArtifactStoragePort artifactStorage;

  /**
   * Creates a factory wiring caller-supplied collaborators.
   *
   * @param config run settings
   * @param metrics metrics sink shared by every run
   * @param progressService progress persistence used for tracking and resume
   * @param resourceRunCache resource run id cache
   * @param artifactStorage artifact destination
   */
  public PipelineContextFactory(
      PipelineConfig config,
      MetricsPort metrics,
      ProgressService progressService,
      ResourceRunCache resourceRunCache,
      ArtifactStoragePort artifactStorage) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.progressService = Objects.requireNonNull(progressService, "progressService");
    this.resourceRunCache = Objects.requireNonNull(resourceRunCache, "resourceRunCache");
    this.artifactStorage = Objects.requireNonNull(artifactStorage, "artifactStorage");
  }

  /**
   * Creates a factory with in-process progress and cache, and memory or file artifacts as configured.
   *
   * @param config run settings
   * @param metrics metrics sink
   * @return factory
   */
  public static PipelineContextFactory create(PipelineConfig config, MetricsPort metrics) {
    ArtifactStoragePort storage = config.artifactStorage() == ArtifactStorageType.FILE_SYSTEM
        ? new FileSystemArtifactStorage(config.artifactDirectory())
        : new InMemoryArtifactStorage();
    return new PipelineContextFactory(
        config, metrics, new InMemoryProgressService(), new InMemoryResourceRunCache(), storage);
  }

  /**
   * Starts a builder for the configured resource type.
   *
   * @return pre-wired builder
   */
  public PipelineContext.Builder builder() {
    return builder(config.resourceType());
  }

  /**
   * Starts a builder for {@code resourceType} with every configured collaborator attached.
   *
   * @param resourceType resource type tag
   * @return pre-wired builder
   */
  public PipelineContext.Builder builder(String resourceType) {
    return PipelineContext.builder(resourceType)
        .withName(config.name())
        .withCategory(config.category())
        .withRunType(config.runType())
        .withParentRunId(config.parentRunId().orElse(null))
        .withDefaultStepOptions(config.stepOptions())
        .withMetrics(metrics)
        .withProgressService(progressService)
        .withResourceRunCache(resourceRunCache)
        .withProgressTrackerFactory(new BatchingProgressTrackerFactory(
            progressService, config.progressBatchSize(), config.progressFlushInterval(), metrics))
        .withArtifactBatcherFactory(new BatchingArtifactBatcherFactory(
            artifactStorage, config.artifactBatchSize(), config.artifactFlushInterval(), metrics));
  }

  public PipelineConfig config() {
    return config;
  }

  public ProgressService progressService() {
    return progressService;
  }

  public ArtifactStoragePort artifactStorage() {
    return artifactStorage;
  }
}
