package ca.gc.cra.dataflow.application.pipeline;

import ca.gc.cra.dataflow.domain.result.PipelineResult;
import ca.gc.cra.dataflow.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;

/**
 * Factory for tracked transform stages.
 *
 * <p>Every stage built here records progress around the user function, converts exceptions into failure
 * results carrying the exception message and the stage name, and forwards incoming failures without invoking the
 * user function. No exception thrown by user code leaves these stages.</p>
 */
final class TrackedStages {
  private TrackedStages() {}

  /**
   * Builds the first stage of a pipeline, which wraps raw source items into results.
   *
   * @param stepName step name
   * @param transform user transform
   * @param resourceIdSelector derives the resource identifier of a raw item
   * @param context run context
   * @param <T> raw item type
   * @param <O> output value type
   * @return stage
   */
  static <T, O> Stage<T, PipelineResult<O>> initial(
      String stepName,
      StepFunction<? super T, ? extends O> transform,
      Function<? super T, String> resourceIdSelector,
      PipelineContext context) {
    Objects.requireNonNull(transform, "transform");
    Objects.requireNonNull(resourceIdSelector, "resourceIdSelector");
    StepTracking tracking = new StepTracking(context);
    Logger logger = context.logger();
    return new Stage<>(stepName, false) {
      @Override
      void process(T input, Emitter<PipelineResult<O>> out) throws InterruptedException {
        String resourceId;
        try {
          resourceId = Objects.requireNonNull(resourceIdSelector.apply(input), "resource id");
        } catch (RuntimeException ex) {
          logger.error("Could not derive resource id in step {} for item {}", stepName, Logs.describe(input), ex);
          out.emit(PipelineResult.failure("", PipelineResult.messageOf(ex), stepName));
          return;
        }
        tracking.resourceStart(resourceId);
        out.emit(execute(stepName, resourceId, input, transform, tracking, logger));
      }
    };
  }

  /**
   * Builds a stage operating on the results of a previous stage.
   *
   * @param stepName step name
   * @param transform user transform
   * @param context run context
   * @param <I> input value type
   * @param <O> output value type
   * @return stage
   */
  static <I, O> Stage<PipelineResult<I>, PipelineResult<O>> downstream(
      String stepName, StepFunction<? super I, ? extends O> transform, PipelineContext context) {
    Objects.requireNonNull(transform, "transform");
    StepTracking tracking = new StepTracking(context);
    Logger logger = context.logger();
    return new Stage<>(stepName, false) {
      @Override
      void process(PipelineResult<I> input, Emitter<PipelineResult<O>> out) throws InterruptedException {
        if (input.isFailure()) {
          out.emit(input.forwardFailure(stepName));
          return;
        }
        out.emit(execute(stepName, input.resourceId(), input.value(), transform, tracking, logger));
      }
    };
  }

  /**
   * Builds a stage that expands one successful input into zero or more independently tracked outputs.
   *
   * @param stepName step name
   * @param transform user expansion
   * @param childIdSelector derives the resource identifier of each output
   * @param context run context
   * @param <I> input value type
   * @param <O> output value type
   * @return stage
   */
  static <I, O> Stage<PipelineResult<I>, PipelineResult<O>> downstreamMany(
      String stepName,
      StepFunction<? super I, ? extends Iterable<? extends O>> transform,
      Function<? super O, String> childIdSelector,
      PipelineContext context) {
    Objects.requireNonNull(transform, "transform");
    Objects.requireNonNull(childIdSelector, "childIdSelector");
    StepTracking tracking = new StepTracking(context);
    Logger logger = context.logger();
    return new Stage<>(stepName, false) {
      @Override
      void process(PipelineResult<I> input, Emitter<PipelineResult<O>> out) throws InterruptedException {
        if (input.isFailure()) {
          out.emit(input.forwardFailure(stepName));
          return;
        }
        String parentId = input.resourceId();
        long started = System.nanoTime();
        tracking.stepStart(parentId, stepName);
        List<PipelineResult<O>> children = new ArrayList<>();
        try {
          Iterable<? extends O> outputs = Objects.requireNonNull(transform.apply(input.value()), "outputs");
          long elapsed = elapsedMillis(started);
          tracking.stepComplete(parentId, stepName, elapsed);
          for (O output : outputs) {
            String childId = Objects.requireNonNull(childIdSelector.apply(output), "child resource id");
            tracking.resourceStart(childId);
            children.add(PipelineResult.success(output, childId));
          }
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          throw ex;
        } catch (Exception ex) {
          out.emit(fail(stepName, parentId, started, ex, tracking, logger));
          return;
        }
        for (PipelineResult<O> child : children) {
          out.emit(child);
        }
      }
    };
  }

  /**
   * Runs a tracked transform for one resource.
   *
   * @return success carrying the output, or failure carrying the exception message and {@code stepName}
   */
  static <I, O> PipelineResult<O> execute(
      String stepName,
      String resourceId,
      I input,
      StepFunction<? super I, ? extends O> transform,
      StepTracking tracking,
      Logger logger) throws InterruptedException {
    long started = System.nanoTime();
    tracking.stepStart(resourceId, stepName);
    try {
      O output = transform.apply(input);
      long elapsed = elapsedMillis(started);
      tracking.stepComplete(resourceId, stepName, elapsed);
      return PipelineResult.success(output, resourceId, elapsed);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw ex;
    } catch (Exception ex) {
      return fail(stepName, resourceId, started, ex, tracking, logger);
    }
  }

  static <O> PipelineResult<O> fail(
      String stepName, String resourceId, long startedNanos, Exception ex, StepTracking tracking, Logger logger) {
    long elapsed = elapsedMillis(startedNanos);
    String message = PipelineResult.messageOf(ex);
    logger.error("Error in step {} for resource {}", stepName, Logs.truncate(resourceId, 128), ex);
    tracking.stepFailed(resourceId, stepName, elapsed, message);
    return PipelineResult.failure(resourceId, message, stepName, elapsed);
  }

  static long elapsedMillis(long startedNanos) {
    return (System.nanoTime() - startedNanos) / 1_000_000L;
  }
}
