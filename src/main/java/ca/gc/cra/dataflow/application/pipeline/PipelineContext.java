package ca.gc.cra.dataflow.application.pipeline;

import ca.gc.cra.dataflow.application.port.ArtifactBatcher;
import ca.gc.cra.dataflow.application.port.ArtifactBatcherFactory;
import ca.gc.cra.dataflow.application.port.MetricsPort;
import ca.gc.cra.dataflow.application.port.ProgressService;
import ca.gc.cra.dataflow.application.port.ProgressTracker;
import ca.gc.cra.dataflow.application.port.ProgressTrackerFactory;
import ca.gc.cra.dataflow.application.port.ResourceRunCache;
import ca.gc.cra.dataflow.domain.run.RunMetadata;
import ca.gc.cra.dataflow.domain.run.RunType;
import ca.gc.cra.dataflow.domain.run.StepOptions;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-run state shared by every stage of one pipeline.
 * <p><strong>Why:</strong> Stages need the run identity, the cancellation signal, default concurrency options and
 * the optional collaborators without global singletons.</p>
 * <p><strong>Role:</strong> Created once per run by {@link Builder}; owned by the thread that calls
 * {@code complete} and closed when it returns.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose the run identity and the resource-type tag recorded with every resource.</li>
 *   <li>Hold the optional progress tracker, artifact batcher, resource-run cache and progress service.</li>
 *   <li>Guarantee that collaborator finalization is attempted at most once.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable apart from the finalization flags; collaborators must be
 * internally synchronized.</p>
 * <p><strong>Observability:</strong> Carries the SLF4J logger used by stages and the {@link MetricsPort}.</p>
 *
 * @since 0.1.0
 */
public final class PipelineContext implements AutoCloseable {
  private final RunMetadata metadata;
  private final String resourceType;
  private final CancellationSignal cancellation;
  private final StepOptions defaultStepOptions;
  private final ProgressTracker progressTracker;
  private final ArtifactBatcher artifactBatcher;
  private final ResourceRunCache resourceRunCache;
  private final ProgressService progressService;
  private final MetricsPort metrics;
  private final Logger logger;
  private final AtomicBoolean trackerFinalized = new AtomicBoolean();
  private final AtomicBoolean batcherFinalized = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();

  private PipelineContext(Builder builder, RunMetadata metadata) {
    this.metadata = metadata;
    this.resourceType = builder.resourceType;
    this.cancellation = builder.cancellation;
    this.defaultStepOptions = builder.defaultStepOptions;
    this.progressTracker = builder.progressTracker != null
        ? builder.progressTracker
        : builder.progressTrackerFactory != null
            ? builder.progressTrackerFactory.create(metadata, builder.cancellation)
            : null;
    this.artifactBatcher = builder.artifactBatcher != null
        ? builder.artifactBatcher
        : builder.artifactBatcherFactory != null
            ? builder.artifactBatcherFactory.create(metadata, builder.cancellation)
            : null;
    this.resourceRunCache = builder.resourceRunCache;
    this.progressService = builder.progressService;
    this.metrics = builder.metrics;
    this.logger = builder.logger != null
        ? builder.logger
        : LoggerFactory.getLogger("dataflow.pipeline." + (metadata.name() == null ? "default" : metadata.name()));
  }

  /**
   * Starts a builder for a run processing resources tagged {@code resourceType}.
   *
   * @param resourceType resource type tag recorded with every resource; must not be blank
   * @return builder
   */
  public static Builder builder(String resourceType) {
    return new Builder(resourceType);
  }

  public UUID runId() {
    return metadata.runId();
  }

  public RunMetadata metadata() {
    return metadata;
  }

  public String resourceType() {
    return resourceType;
  }

  public String name() {
    return metadata.name();
  }

  public String category() {
    return metadata.category();
  }

  public RunType runType() {
    return metadata.runType();
  }

  public Optional<UUID> parentRunId() {
    return Optional.ofNullable(metadata.parentRunId());
  }

  public CancellationSignal cancellation() {
    return cancellation;
  }

  public StepOptions defaultStepOptions() {
    return defaultStepOptions;
  }

  /**
   * Resolves the options of one stage.
   *
   * @param override stage override; {@code null} selects the context default
   * @return effective options
   */
  public StepOptions resolveOptions(StepOptions override) {
    return override != null ? override : defaultStepOptions;
  }

  public Optional<ProgressTracker> progressTracker() {
    return Optional.ofNullable(progressTracker);
  }

  public Optional<ArtifactBatcher> artifactBatcher() {
    return Optional.ofNullable(artifactBatcher);
  }

  public Optional<ResourceRunCache> resourceRunCache() {
    return Optional.ofNullable(resourceRunCache);
  }

  public Optional<ProgressService> progressService() {
    return Optional.ofNullable(progressService);
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public Logger logger() {
    return logger;
  }

  boolean claimTrackerFinalization() {
    return trackerFinalized.compareAndSet(false, true);
  }

  boolean claimBatcherFinalization() {
    return batcherFinalized.compareAndSet(false, true);
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Releases the context. Collaborators are finalized by the pipeline before this is called.
   */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      logger.debug("Pipeline context for run {} closed", metadata.runId());
    }
  }

  /**
   * Fluent builder for {@link PipelineContext}.
   */
  public static final class Builder {
    private final String resourceType;
    private UUID runId;
    private String name = "pipeline";
    private String category = "default";
    private RunType runType = RunType.FRESH;
    private UUID parentRunId;
    private CancellationSignal cancellation = new CancellationSignal();
    private StepOptions defaultStepOptions = StepOptions.DEFAULT;
    private ProgressTracker progressTracker;
    private ProgressTrackerFactory progressTrackerFactory;
    private ArtifactBatcher artifactBatcher;
    private ArtifactBatcherFactory artifactBatcherFactory;
    private ResourceRunCache resourceRunCache;
    private ProgressService progressService;
    private MetricsPort metrics = MetricsPort.NO_OP;
    private Logger logger;

    private Builder(String resourceType) {
      Objects.requireNonNull(resourceType, "resourceType");
      if (resourceType.isBlank()) {
        throw new IllegalArgumentException("resourceType must not be blank");
      }
      this.resourceType = resourceType.trim();
    }

    public Builder withRunId(UUID runId) {
      this.runId = runId;
      return this;
    }

    public Builder withName(String name) {
      this.name = Objects.requireNonNull(name, "name");
      return this;
    }

    public Builder withCategory(String category) {
      this.category = Objects.requireNonNull(category, "category");
      return this;
    }

    public Builder withRunType(RunType runType) {
      this.runType = Objects.requireNonNull(runType, "runType");
      return this;
    }

    public Builder withParentRunId(UUID parentRunId) {
      this.parentRunId = parentRunId;
      return this;
    }

    public Builder withCancellation(CancellationSignal cancellation) {
      this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
      return this;
    }

    public Builder withDefaultStepOptions(StepOptions options) {
      this.defaultStepOptions = Objects.requireNonNull(options, "options");
      return this;
    }

    /**
     * Overrides the default worker count of every stage.
     *
     * @param maxParallelism worker count; must be positive
     * @return this builder
     * @throws IllegalArgumentException if {@code maxParallelism <= 0}
     */
    public Builder withDefaultMaxParallelism(int maxParallelism) {
      if (maxParallelism <= 0) {
        throw new IllegalArgumentException("maxParallelism must be greater than zero");
      }
      this.defaultStepOptions = defaultStepOptions.withMaxParallelism(maxParallelism);
      return this;
    }

    public Builder withProgressTracker(ProgressTracker tracker) {
      this.progressTracker = tracker;
      return this;
    }

    public Builder withProgressTrackerFactory(ProgressTrackerFactory factory) {
      this.progressTrackerFactory = factory;
      return this;
    }

    public Builder withArtifactBatcher(ArtifactBatcher batcher) {
      this.artifactBatcher = batcher;
      return this;
    }

    public Builder withArtifactBatcherFactory(ArtifactBatcherFactory factory) {
      this.artifactBatcherFactory = factory;
      return this;
    }

    public Builder withResourceRunCache(ResourceRunCache cache) {
      this.resourceRunCache = cache;
      return this;
    }

    public Builder withProgressService(ProgressService service) {
      this.progressService = service;
      return this;
    }

    public Builder withMetrics(MetricsPort metrics) {
      this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
      return this;
    }

    public Builder withLogger(Logger logger) {
      this.logger = logger;
      return this;
    }

    /**
     * Builds the context, generating a run id when none was supplied and invoking collaborator factories.
     *
     * @return new context
     */
    public PipelineContext build() {
      UUID effectiveRunId = runId != null ? runId : UUID.randomUUID();
      RunMetadata metadata = new RunMetadata(effectiveRunId, name, category, runType, parentRunId);
      return new PipelineContext(this, metadata);
    }
  }
}
