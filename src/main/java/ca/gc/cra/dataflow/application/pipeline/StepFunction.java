package ca.gc.cra.dataflow.application.pipeline;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * User transform applied by a pipeline stage. Exceptions thrown here become failure results.
 *
 * @param <I> input type
 * @param <O> output type
 * @since 0.1.0
 */
@FunctionalInterface
public interface StepFunction<I, O> {
  O apply(I input) throws Exception;

  /**
   * Adapts an asynchronous transform. The stage worker waits for the returned stage; a failed stage yields a
   * failure result carrying the cause's message.
   *
   * @param async asynchronous transform
   * @param <I> input type
   * @param <O> output type
   * @return blocking step function
   */
  static <I, O> StepFunction<I, O> fromAsync(Function<? super I, ? extends CompletionStage<? extends O>> async) {
    Objects.requireNonNull(async, "async");
    return input -> {
      CompletionStage<? extends O> stage = Objects.requireNonNull(async.apply(input), "async transform returned null");
      try {
        return stage.toCompletableFuture().get();
      } catch (ExecutionException | CompletionException ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof Exception exception) {
          throw exception;
        }
        throw ex;
      }
    };
  }
}
