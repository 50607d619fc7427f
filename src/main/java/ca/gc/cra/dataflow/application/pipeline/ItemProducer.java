package ca.gc.cra.dataflow.application.pipeline;

/**
 * Opened source that pushes its items into a sink. Invoked once, on the pipeline's source thread.
 *
 * @param <T> item type
 * @since 0.1.0
 */
@FunctionalInterface
public interface ItemProducer<T> {
  /**
   * Pushes every item into {@code sink}, blocking while the sink applies backpressure.
   *
   * @param sink destination of the items
   * @throws Exception if the underlying source fails
   */
  void produce(Sink<? super T> sink) throws Exception;

  /**
   * Destination of produced items.
   *
   * @param <T> item type
   */
  @FunctionalInterface
  interface Sink<T> {
    /**
     * Accepts one item.
     *
     * @param item non-null item
     * @throws InterruptedException if interrupted while the sink is full
     */
    void accept(T item) throws InterruptedException;
  }
}
