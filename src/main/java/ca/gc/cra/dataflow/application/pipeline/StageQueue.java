package ca.gc.cra.dataflow.application.pipeline;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Queue connecting a stage to its consumer. Producers call {@link #complete()} once they are done; the consumer
 * sees {@code null} from {@link #next()} after the last item has been taken.
 *
 * <p>Blocking calls wake every {@value #POLL_MILLIS} ms to check the halt signal and throw
 * {@link CancellationException} once it fires.</p>
 *
 * @param <T> item type; {@code null} items are rejected
 */
final class StageQueue<T> {
  static final long POLL_MILLIS = 25L;

  private final String name;
  private final BlockingQueue<T> queue;
  private final CancellationSignal halt;
  private volatile boolean completed;

  private StageQueue(String name, BlockingQueue<T> queue, CancellationSignal halt) {
    this.name = name;
    this.queue = queue;
    this.halt = Objects.requireNonNull(halt, "halt");
  }

  /**
   * Creates a queue with the given capacity.
   *
   * @param name queue name used in diagnostics
   * @param capacity positive capacity, or a non-positive value for an unbounded queue
   * @param halt signal that aborts blocked calls
   * @param <T> item type
   * @return queue
   */
  static <T> StageQueue<T> create(String name, int capacity, CancellationSignal halt) {
    BlockingQueue<T> backing = capacity > 0 ? new ArrayBlockingQueue<>(capacity) : new LinkedBlockingQueue<>();
    return new StageQueue<>(name, backing, halt);
  }

  static <T> StageQueue<T> unbounded(String name, CancellationSignal halt) {
    return new StageQueue<>(name, new LinkedBlockingQueue<>(), halt);
  }

  String name() {
    return name;
  }

  /**
   * Adds an item, blocking while the queue is full.
   *
   * @param item item to add
   * @throws InterruptedException if interrupted while waiting
   * @throws CancellationException if the halt signal fires while waiting
   * @throws IllegalStateException if the queue was already completed
   */
  void put(T item) throws InterruptedException {
    Objects.requireNonNull(item, "item");
    halt.throwIfCancelled();
    if (completed) {
      throw new IllegalStateException("Queue " + name + " is already completed");
    }
    while (!queue.offer(item, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
      halt.throwIfCancelled();
    }
  }

  /**
   * Takes the next item, blocking while the queue is empty and not completed.
   *
   * @return next item, or {@code null} once the queue is completed and drained
   * @throws InterruptedException if interrupted while waiting
   * @throws CancellationException if the halt signal fires
   */
  T next() throws InterruptedException {
    while (true) {
      halt.throwIfCancelled();
      T item = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
      if (item != null) {
        return item;
      }
      if (completed && queue.isEmpty()) {
        return null;
      }
    }
  }

  /** Marks the producer side finished. */
  void complete() {
    completed = true;
  }

  boolean isCompleted() {
    return completed;
  }

  int size() {
    return queue.size();
  }
}
