package ca.gc.cra.dataflow.application.pipeline;

import java.util.Objects;

/**
 * Duplicates every item onto the main outbox and a side queue. Both are unbounded, so a slow consumer on either
 * path never blocks the other and no item is dropped.
 *
 * @param <T> item type
 */
final class FanOutStage<T> extends Stage<T, T> {
  private final StageQueue<T> side;

  FanOutStage(String name, StageQueue<T> side) {
    super(name, true);
    this.side = Objects.requireNonNull(side, "side");
  }

  @Override
  void process(T input, Emitter<T> out) throws InterruptedException {
    side.put(input);
    out.emit(input);
  }

  @Override
  void onUpstreamComplete(Emitter<T> out) {
    side.complete();
  }
}
