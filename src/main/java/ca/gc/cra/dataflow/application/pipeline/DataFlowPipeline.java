package ca.gc.cra.dataflow.application.pipeline;

import ca.gc.cra.dataflow.domain.result.PipelineResult;
import ca.gc.cra.dataflow.domain.run.StepOptions;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * <strong>What:</strong> Entry point of the fluent pipeline API.
 * <p><strong>Why:</strong> Composes a source and a left-to-right chain of tracked stages bound to one
 * {@link PipelineContext}.</p>
 * <p><strong>Role:</strong> Root of the chain; the first stage call returns a {@link StepBuilder} and every
 * further call is made on the builder it returned.</p>
 * <p><strong>Usage:</strong></p>
 * <pre>{@code
 * DataFlowPipeline.create(context, Order::id)
 *     .fromIterable(orders)
 *     .transform("Enrich", enricher::enrich)
 *     .withArtifact(ArtifactOptions.named("enriched"))
 *     .batch(50)
 *     .action("Store", store::saveAll)
 *     .completeMany(batch -> batch.stream().map(EnrichedOrder::id).toList());
 * }</pre>
 * <p><strong>Thread-safety:</strong> Build the chain from one thread; stage execution is concurrent.</p>
 *
 * @param <T> raw item type produced by the source
 * @since 0.1.0
 */
public final class DataFlowPipeline<T> {
  private final PipelineContext context;
  private final Function<? super T, String> resourceIdSelector;
  private final PipelineGraph graph;
  private StageQueue<T> sourceQueue;
  private boolean chained;

  private DataFlowPipeline(PipelineContext context, Function<? super T, String> resourceIdSelector) {
    this.context = Objects.requireNonNull(context, "context");
    this.resourceIdSelector = Objects.requireNonNull(resourceIdSelector, "resourceIdSelector");
    this.graph = new PipelineGraph(context);
  }

  /**
   * Starts a pipeline bound to {@code context}.
   *
   * @param context run context
   * @param resourceIdSelector derives the resource identifier of a raw item
   * @param <T> raw item type
   * @return pipeline without a source
   */
  public static <T> DataFlowPipeline<T> create(PipelineContext context, Function<? super T, String> resourceIdSelector) {
    return new DataFlowPipeline<>(context, resourceIdSelector);
  }

  /**
   * Attaches the source. Resume-mode sources consult the progress service here.
   *
   * @param source item source
   * @return this pipeline
   * @throws IllegalStateException if a source is already attached, or the source lacks a required collaborator
   */
  public DataFlowPipeline<T> withSource(PipelineSource<T> source) {
    Objects.requireNonNull(source, "source");
    if (sourceQueue != null) {
      throw new IllegalStateException("A source is already attached");
    }
    ItemProducer<T> producer = source.open(context);
    sourceQueue = graph.bindSource(producer, source.description());
    return this;
  }

  public DataFlowPipeline<T> fromIterable(Iterable<? extends T> items) {
    return withSource(PipelineSource.fromIterable(items));
  }

  public DataFlowPipeline<T> fromSupplier(Supplier<? extends Iterable<? extends T>> factory) {
    return withSource(PipelineSource.fromSupplier(factory));
  }

  public DataFlowPipeline<T> fromStream(Function<CancellationSignal, ? extends Stream<? extends T>> factory) {
    return withSource(PipelineSource.fromStream(factory));
  }

  public DataFlowPipeline<T> fromPublisher(Flow.Publisher<? extends T> publisher) {
    return withSource(PipelineSource.fromPublisher(publisher));
  }

  public DataFlowPipeline<T> fromRunType(
      PipelineSource<T> fresh, Function<? super Set<String>, PipelineSource<T>> incompleteLoader) {
    return withSource(PipelineSource.fromRunType(fresh, incompleteLoader));
  }

  public <O> StepBuilder<T, O> transform(String stepName, StepFunction<? super T, ? extends O> transform) {
    return transform(stepName, transform, null);
  }

  /**
   * Adds the first stage, converting raw items into results.
   *
   * @param stepName step name
   * @param transform user transform
   * @param options stage options; {@code null} selects the context default
   * @param <O> output type
   * @return builder positioned after the new stage
   */
  public <O> StepBuilder<T, O> transform(
      String stepName, StepFunction<? super T, ? extends O> transform, StepOptions options) {
    StageQueue<T> inbox = claimSource();
    Stage<T, PipelineResult<O>> stage = TrackedStages.initial(stepName, transform, resourceIdSelector, context);
    return new StepBuilder<>(graph, graph.attach(stage, inbox, context.resolveOptions(options)), stepName);
  }

  public <O> StepBuilder<T, O> transformAsync(
      String stepName, Function<? super T, ? extends CompletionStage<? extends O>> transform) {
    return transform(stepName, StepFunction.fromAsync(transform), null);
  }

  public <O> StepBuilder<T, O> transformMany(
      String stepName,
      StepFunction<? super T, ? extends Iterable<? extends O>> transform,
      Function<? super O, String> childIdSelector) {
    return transformMany(stepName, transform, childIdSelector, null);
  }

  /**
   * Adds a first stage that expands each raw item into zero or more tracked outputs. A pass-through
   * {@code <stepName>_Init} stage wraps the raw items first.
   *
   * @param stepName step name
   * @param transform user expansion
   * @param childIdSelector derives the resource identifier of each output
   * @param options stage options; {@code null} selects the context default
   * @param <O> output type
   * @return builder positioned after the new stage
   */
  public <O> StepBuilder<T, O> transformMany(
      String stepName,
      StepFunction<? super T, ? extends Iterable<? extends O>> transform,
      Function<? super O, String> childIdSelector,
      StepOptions options) {
    return initStep(stepName, options).transformMany(stepName, transform, childIdSelector, options);
  }

  public <K, O> StepBuilder<T, O> groupSequential(
      String stepName,
      Function<? super T, ? extends K> keySelector,
      BiFunction<? super K, List<T>, ? extends O> projector,
      Function<? super K, String> groupIdSelector) {
    return groupSequential(stepName, keySelector, projector, groupIdSelector, null);
  }

  /**
   * Adds a first stage that folds runs of raw items sharing a key. A pass-through {@code <stepName>_Init} stage
   * wraps the raw items first; it always runs on one worker so the source order reaches the grouping stage intact.
   *
   * @param stepName step name
   * @param keySelector grouping key of an item
   * @param projector builds the output of one group from its key and items
   * @param groupIdSelector resource identifier of a group
   * @param options stage options; {@code null} selects the context default. Only the capacity applies.
   * @param <K> key type
   * @param <O> output type
   * @return builder positioned after the new stage
   */
  public <K, O> StepBuilder<T, O> groupSequential(
      String stepName,
      Function<? super T, ? extends K> keySelector,
      BiFunction<? super K, List<T>, ? extends O> projector,
      Function<? super K, String> groupIdSelector,
      StepOptions options) {
    StepOptions ordered = context.resolveOptions(options).withMaxParallelism(1);
    return initStep(stepName, ordered)
        .groupSequential(stepName, keySelector, projector, groupIdSelector, ordered);
  }

  private StepBuilder<T, T> initStep(String stepName, StepOptions options) {
    Objects.requireNonNull(stepName, "stepName");
    return transform(stepName + "_Init", item -> item, options);
  }

  private StageQueue<T> claimSource() {
    if (sourceQueue == null) {
      throw new IllegalStateException("A source must be attached before adding stages");
    }
    if (chained) {
      throw new IllegalStateException("The pipeline root has already been chained");
    }
    chained = true;
    return sourceQueue;
  }
}
