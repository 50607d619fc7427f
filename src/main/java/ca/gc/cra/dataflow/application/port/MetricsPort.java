package ca.gc.cra.dataflow.application.port;

/**
 * <strong>What:</strong> Domain port for emitting pipeline counters and latency observations.
 * <p><strong>Why:</strong> Keeps stage code independent of the metrics backend.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use by stage workers.</p>
 * <p><strong>Observability:</strong> Keys follow {@code pipeline.step.<step>.success|failure|latencyMs} and
 * {@code pipeline.artifact.*}.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the counter identified by {@code key}.
   *
   * @param key metric key
   */
  void increment(String key);

  /**
   * Records one observation for the histogram identified by {@code key}.
   *
   * @param key metric key
   * @param value observed value
   */
  void observe(String key, long value);

  /** Metrics sink that discards everything. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
