package ca.gc.cra.dataflow.application.pipeline;

import ca.gc.cra.dataflow.application.port.ArtifactBatcher;
import ca.gc.cra.dataflow.domain.result.PipelineResult;
import ca.gc.cra.dataflow.domain.run.StepOptions;
import ca.gc.cra.dataflow.logging.Logs;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.slf4j.Logger;

/**
 * <strong>What:</strong> Handle on the output of the most recently added stage.
 * <p><strong>Role:</strong> Every chaining call adds a stage fed by this handle's output and returns a new handle;
 * each handle can be continued exactly once. {@code complete} is the only terminal operation.</p>
 * <p><strong>Failure propagation:</strong> Stages added here forward incoming failure results without invoking
 * user code, keeping the resource id and failing step name.</p>
 * <p><strong>Thread-safety:</strong> Build the chain from one thread.</p>
 *
 * @param <R> raw item type of the pipeline
 * @param <O> value type produced by the current stage
 * @since 0.1.0
 */
public final class StepBuilder<R, O> {
  private final PipelineGraph graph;
  private final PipelineContext context;
  private final StageQueue<PipelineResult<O>> current;
  private final String stepName;
  private boolean used;

  StepBuilder(PipelineGraph graph, StageQueue<PipelineResult<O>> current, String stepName) {
    this.graph = graph;
    this.context = graph.context();
    this.current = current;
    this.stepName = stepName;
  }

  /**
   * Returns the name of the step whose output this handle points at.
   *
   * @return step name
   */
  public String stepName() {
    return stepName;
  }

  public <N> StepBuilder<R, N> transform(String stepName, StepFunction<? super O, ? extends N> transform) {
    return transform(stepName, transform, null);
  }

  /**
   * Adds a tracked transform.
   *
   * @param stepName step name
   * @param transform user transform
   * @param options stage options; {@code null} selects the context default
   * @param <N> output type
   * @return builder positioned after the new stage
   */
  public <N> StepBuilder<R, N> transform(
      String stepName, StepFunction<? super O, ? extends N> transform, StepOptions options) {
    Stage<PipelineResult<O>, PipelineResult<N>> stage = TrackedStages.downstream(stepName, transform, context);
    return next(stage, options);
  }

  public <N> StepBuilder<R, N> transformAsync(
      String stepName, Function<? super O, ? extends CompletionStage<? extends N>> transform) {
    return transform(stepName, StepFunction.fromAsync(transform), null);
  }

  public <N> StepBuilder<R, N> transformAsync(
      String stepName, Function<? super O, ? extends CompletionStage<? extends N>> transform, StepOptions options) {
    return transform(stepName, StepFunction.fromAsync(transform), options);
  }

  public <N> StepBuilder<R, N> transformMany(
      String stepName,
      StepFunction<? super O, ? extends Iterable<? extends N>> transform,
      Function<? super N, String> childIdSelector) {
    return transformMany(stepName, transform, childIdSelector, null);
  }

  /**
   * Adds a stage expanding each input into zero or more outputs, each tracked as its own resource.
   *
   * @param stepName step name
   * @param transform user expansion
   * @param childIdSelector derives the resource identifier of each output
   * @param options stage options; {@code null} selects the context default
   * @param <N> output type
   * @return builder positioned after the new stage
   */
  public <N> StepBuilder<R, N> transformMany(
      String stepName,
      StepFunction<? super O, ? extends Iterable<? extends N>> transform,
      Function<? super N, String> childIdSelector,
      StepOptions options) {
    Stage<PipelineResult<O>, PipelineResult<N>> stage =
        TrackedStages.downstreamMany(stepName, transform, childIdSelector, context);
    return next(stage, options);
  }

  public <K, N> StepBuilder<R, N> groupSequential(
      String stepName,
      Function<? super O, ? extends K> keySelector,
      BiFunction<? super K, List<O>, ? extends N> projector,
      Function<? super K, String> groupIdSelector) {
    return groupSequential(stepName, keySelector, projector, groupIdSelector, null, null);
  }

  public <K, N> StepBuilder<R, N> groupSequential(
      String stepName,
      Function<? super O, ? extends K> keySelector,
      BiFunction<? super K, List<O>, ? extends N> projector,
      Function<? super K, String> groupIdSelector,
      StepOptions options) {
    return groupSequential(stepName, keySelector, projector, groupIdSelector, null, options);
  }

  /**
   * Adds a single-worker stage folding runs of consecutive inputs that share a key into one output per run.
   * Inputs must arrive sorted by key.
   *
   * @param stepName step name
   * @param keySelector grouping key of an input
   * @param projector builds the output of one group from its key and a snapshot of its items
   * @param groupIdSelector resource identifier of a group
   * @param keyOrder when non-null, keys arriving out of this order are logged as warnings
   * @param options stage options; the worker count is ignored, only the capacity applies
   * @param <K> key type
   * @param <N> output type
   * @return builder positioned after the new stage
   */
  public <K, N> StepBuilder<R, N> groupSequential(
      String stepName,
      Function<? super O, ? extends K> keySelector,
      BiFunction<? super K, List<O>, ? extends N> projector,
      Function<? super K, String> groupIdSelector,
      Comparator<? super K> keyOrder,
      StepOptions options) {
    SequentialGroupingStage<O, K, N> stage =
        new SequentialGroupingStage<>(stepName, keySelector, projector, groupIdSelector, keyOrder, context);
    return next(stage, options);
  }

  public StepBuilder<R, List<O>> batch(int batchSize) {
    return batch(batchSize, null);
  }

  /**
   * Groups the next {@code batchSize} results, successful or not, into one list result named {@code Batch}.
   * Failed members are logged and left out of the list.
   *
   * @param batchSize members per batch; must be positive
   * @param options stage options; only the capacity applies
   * @return builder positioned after the batch stage
   */
  public StepBuilder<R, List<O>> batch(int batchSize, StepOptions options) {
    BatchStage<O> stage = new BatchStage<>(batchSize, context);
    return next(stage, options);
  }

  public StepBuilder<R, O> action(String stepName, StepAction<? super O> action) {
    return action(stepName, action, null);
  }

  /**
   * Adds a tracked side-effecting step that passes its input through unchanged.
   *
   * @param stepName step name
   * @param action user action
   * @param options stage options; {@code null} selects the context default
   * @return builder positioned after the action stage
   */
  public StepBuilder<R, O> action(String stepName, StepAction<? super O> action, StepOptions options) {
    Objects.requireNonNull(action, "action");
    StepFunction<O, O> passThrough = input -> {
      action.accept(input);
      return input;
    };
    return transform(stepName, passThrough, options);
  }

  public StepBuilder<R, O> withArtifact() {
    return withArtifact(ArtifactOptions.defaults());
  }

  public StepBuilder<R, O> withArtifact(String artifactName) {
    return withArtifact(ArtifactOptions.named(artifactName));
  }

  /**
   * Captures this step's successful outputs as artifacts on a side path that never blocks the main path. Without
   * an artifact batcher on the context this returns a handle on the same output and captures nothing.
   *
   * @param options capture options
   * @return builder positioned after the capture point
   */
  public StepBuilder<R, O> withArtifact(ArtifactOptions<O> options) {
    Objects.requireNonNull(options, "options");
    StageQueue<PipelineResult<O>> inbox = claim();
    ArtifactBatcher batcher = context.artifactBatcher().orElse(null);
    if (batcher == null) {
      context.logger().debug("No artifact batcher configured; skipping artifact capture for step {}", stepName);
      return new StepBuilder<>(graph, inbox, stepName);
    }
    ArtifactCaptureStage<O> capture = new ArtifactCaptureStage<>(stepName, options, batcher, context);
    StageQueue<PipelineResult<O>> main = graph.attachArtifactTap(inbox, capture, options.persistenceWorkers());
    return new StepBuilder<>(graph, main, stepName);
  }

  /**
   * Drains the pipeline, marking each successful result's resource id complete.
   *
   * @throws PipelineExecutionException if the pipeline infrastructure failed
   * @throws java.util.concurrent.CancellationException if the run was cancelled
   */
  public void complete() {
    drain(null);
  }

  /**
   * Drains the pipeline, marking the id extracted from each successful value complete.
   *
   * @param resourceIdExtractor id of a final value
   */
  public void complete(Function<? super O, String> resourceIdExtractor) {
    Objects.requireNonNull(resourceIdExtractor, "resourceIdExtractor");
    drain(value -> List.of(resourceIdExtractor.apply(value)));
  }

  /**
   * Drains the pipeline, marking every id extracted from each successful value complete. Used when one final
   * value stands for several resources, such as a batch.
   *
   * <p>Returns after every result has been drained, in-flight artifact captures have been queued, and the progress
   * tracker and artifact batcher have each been finalized once.</p>
   *
   * @param resourceIdsExtractor ids of a final value
   * @throws PipelineExecutionException if the pipeline infrastructure failed
   * @throws java.util.concurrent.CancellationException if the run was cancelled
   */
  public void completeMany(Function<? super O, ? extends Iterable<String>> resourceIdsExtractor) {
    Objects.requireNonNull(resourceIdsExtractor, "resourceIdsExtractor");
    drain(resourceIdsExtractor);
  }

  private void drain(Function<? super O, ? extends Iterable<String>> extractor) {
    StageQueue<PipelineResult<O>> tail = claim();
    StepTracking tracking = new StepTracking(context);
    Logger logger = context.logger();
    graph.run(tail, result -> {
      if (result.isFailure()) {
        context.metrics().increment("pipeline.complete.failure");
        logger.warn("Pipeline completed with failed resource {} at step {}: {}",
            Logs.truncate(result.resourceId(), 128), result.errorStep().orElse("unknown"),
            Logs.describe(result.errorMessage().orElse(PipelineResult.PREVIOUS_STEP_FAILED)));
        return;
      }
      if (result.value() == null) {
        return;
      }
      context.metrics().increment("pipeline.complete.success");
      if (extractor == null) {
        tracking.resourceCompleted(result.resourceId());
        return;
      }
      try {
        for (String resourceId : extractor.apply(result.value())) {
          tracking.resourceCompleted(resourceId);
        }
      } catch (RuntimeException ex) {
        logger.error("Error extracting resource ids for completion tracking", ex);
      }
    });
  }

  private <N> StepBuilder<R, N> next(Stage<PipelineResult<O>, PipelineResult<N>> stage, StepOptions options) {
    StageQueue<PipelineResult<O>> inbox = claim();
    StageQueue<PipelineResult<N>> outbox = graph.attach(stage, inbox, context.resolveOptions(options));
    return new StepBuilder<>(graph, outbox, stage.name());
  }

  private StageQueue<PipelineResult<O>> claim() {
    if (used) {
      throw new IllegalStateException("Step " + stepName + " has already been continued or completed");
    }
    used = true;
    return current;
  }
}
