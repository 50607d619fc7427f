package ca.gc.cra.dataflow.application.pipeline;

import ca.gc.cra.dataflow.domain.result.PipelineResult;
import ca.gc.cra.dataflow.logging.Logs;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.slf4j.Logger;

/**
 * <strong>What:</strong> Folds runs of consecutive items sharing a key into one output per run.
 * <p><strong>Why:</strong> Sources sorted by a key (for example paged reads ordered by parent id) can be grouped
 * without buffering the whole stream.</p>
 * <p><strong>Role:</strong> Single-worker stage; holds at most one open group.</p>
 * <p><strong>State machine:</strong></p>
 * <ul>
 *   <li>No open group: the next item opens one.</li>
 *   <li>Same key as the open group: the item is appended.</li>
 *   <li>Different key: the open group is projected and emitted, then a new group opens with the item.</li>
 *   <li>Failure result: forwarded immediately; the open group is untouched.</li>
 *   <li>Upstream exhausted: the open group, if any, is projected and emitted.</li>
 * </ul>
 * <p><strong>Ordering:</strong> Input must arrive sorted by key. Mis-ordered input yields several short groups
 * for one key. When a key comparator is supplied, out-of-order keys are logged as warnings.</p>
 * <p><strong>Thread-safety:</strong> Confined to the stage's single worker.</p>
 *
 * @param <I> input value type
 * @param <K> grouping key type
 * @param <O> projected output type
 */
final class SequentialGroupingStage<I, K, O> extends Stage<PipelineResult<I>, PipelineResult<O>> {
  private final Function<? super I, ? extends K> keySelector;
  private final BiFunction<? super K, List<I>, ? extends O> projector;
  private final Function<? super K, String> groupIdSelector;
  private final Comparator<? super K> orderCheck;
  private final StepTracking tracking;
  private final Logger logger;

  private K currentKey;
  private List<I> currentItems = new ArrayList<>();
  private boolean hasCurrent;

  SequentialGroupingStage(
      String stepName,
      Function<? super I, ? extends K> keySelector,
      BiFunction<? super K, List<I>, ? extends O> projector,
      Function<? super K, String> groupIdSelector,
      Comparator<? super K> orderCheck,
      PipelineContext context) {
    super(stepName, true);
    this.keySelector = Objects.requireNonNull(keySelector, "keySelector");
    this.projector = Objects.requireNonNull(projector, "projector");
    this.groupIdSelector = Objects.requireNonNull(groupIdSelector, "groupIdSelector");
    this.orderCheck = orderCheck;
    this.tracking = new StepTracking(context);
    this.logger = context.logger();
  }

  @Override
  void process(PipelineResult<I> input, Emitter<PipelineResult<O>> out) throws InterruptedException {
    if (input.isFailure()) {
      out.emit(input.forwardFailure(name()));
      return;
    }
    I value = input.value();
    K key;
    try {
      key = keySelector.apply(value);
    } catch (RuntimeException ex) {
      logger.error("Could not derive grouping key in step {} for resource {}", name(),
          Logs.truncate(input.resourceId(), 128), ex);
      out.emit(PipelineResult.failure(input.resourceId(), PipelineResult.messageOf(ex), name()));
      return;
    }

    if (!hasCurrent) {
      hasCurrent = true;
      currentKey = key;
      currentItems = new ArrayList<>();
      currentItems.add(value);
      return;
    }
    if (Objects.equals(currentKey, key)) {
      currentItems.add(value);
      return;
    }
    if (orderCheck != null && orderCheck.compare(key, currentKey) < 0) {
      logger.warn("Step {} received key {} after {}; input is not sorted by the grouping key", name(),
          Logs.describe(key), Logs.describe(currentKey));
    }
    K previousKey = currentKey;
    List<I> previousItems = currentItems;
    currentKey = key;
    currentItems = new ArrayList<>();
    currentItems.add(value);
    emitGroup(previousKey, previousItems, out);
  }

  @Override
  void onUpstreamComplete(Emitter<PipelineResult<O>> out) throws InterruptedException {
    if (hasCurrent && !currentItems.isEmpty()) {
      List<I> finalItems = currentItems;
      currentItems = new ArrayList<>();
      hasCurrent = false;
      emitGroup(currentKey, finalItems, out);
    }
  }

  private void emitGroup(K key, List<I> items, Emitter<PipelineResult<O>> out) throws InterruptedException {
    String groupId;
    try {
      groupId = Objects.requireNonNull(groupIdSelector.apply(key), "group resource id");
    } catch (RuntimeException ex) {
      logger.error("Could not derive group id in step {} for key {}", name(), Logs.describe(key), ex);
      out.emit(PipelineResult.failure(String.valueOf(key), PipelineResult.messageOf(ex), name()));
      return;
    }
    tracking.resourceStart(groupId);
    List<I> snapshot = Collections.unmodifiableList(new ArrayList<>(items));
    long started = System.nanoTime();
    tracking.stepStart(groupId, name());
    PipelineResult<O> result;
    try {
      O output = projector.apply(key, snapshot);
      long elapsed = TrackedStages.elapsedMillis(started);
      tracking.stepComplete(groupId, name(), elapsed);
      result = PipelineResult.success(output, groupId, elapsed);
    } catch (RuntimeException ex) {
      result = TrackedStages.fail(name(), groupId, started, ex, tracking, logger);
    }
    out.emit(result);
  }
}
