package ca.gc.cra.dataflow.application.pipeline;

import java.util.Objects;

/**
 * One step of the pipeline graph. A {@link StageRunner} feeds it items from its inbox on one or more workers.
 *
 * @param <I> input item type
 * @param <O> output item type
 */
abstract class Stage<I, O> {
  private final String name;
  private final boolean singleWorker;

  protected Stage(String name, boolean singleWorker) {
    this.name = Objects.requireNonNull(name, "name");
    this.singleWorker = singleWorker;
  }

  final String name() {
    return name;
  }

  /**
   * Reports whether the stage keeps state that must be owned by exactly one worker.
   *
   * @return {@code true} to pin the stage to one worker regardless of its options
   */
  final boolean singleWorker() {
    return singleWorker;
  }

  /**
   * Handles one input item, emitting zero or more outputs.
   *
   * @param input item taken from the inbox
   * @param out downstream emitter
   * @throws InterruptedException if interrupted while emitting
   */
  abstract void process(I input, Emitter<O> out) throws InterruptedException;

  /**
   * Called once, after every input has been processed and before the outbox is completed.
   *
   * @param out downstream emitter
   * @throws InterruptedException if interrupted while emitting
   */
  void onUpstreamComplete(Emitter<O> out) throws InterruptedException {}

  /**
   * Sink for stage outputs.
   *
   * @param <O> output type
   */
  @FunctionalInterface
  interface Emitter<O> {
    void emit(O item) throws InterruptedException;
  }
}
