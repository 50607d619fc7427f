package ca.gc.cra.dataflow.domain.run;

/**
 * <strong>What:</strong> Concurrency options for one pipeline stage.
 * <p><strong>Why:</strong> Bounded inter-stage queues give backpressure while the worker count caps the
 * concurrent invocations of the user function.</p>
 * <p><strong>Role:</strong> Per-stage override; when absent the stage falls back to the context default.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param maxParallelism worker count; {@link #UNBOUNDED} lets the stage run as many items at once as the shared
 *     elastic pool ceiling allows
 * @param boundedCapacity capacity of the stage output queue; {@link #UNBOUNDED} for an unbounded queue
 * @since 0.1.0
 */
public record StepOptions(int maxParallelism, int boundedCapacity) {
  /** Marker for an unbounded worker count or queue capacity. */
  public static final int UNBOUNDED = -1;

  /** Unbounded parallelism and unbounded capacity. */
  public static final StepOptions DEFAULT = new StepOptions(UNBOUNDED, UNBOUNDED);

  /**
   * Validates the option values.
   *
   * @throws IllegalArgumentException when a value is neither positive nor {@link #UNBOUNDED}
   */
  public StepOptions {
    if (maxParallelism != UNBOUNDED && maxParallelism < 1) {
      throw new IllegalArgumentException("maxParallelism must be >= 1 or UNBOUNDED");
    }
    if (boundedCapacity != UNBOUNDED && boundedCapacity < 1) {
      throw new IllegalArgumentException("boundedCapacity must be >= 1 or UNBOUNDED");
    }
  }

  /**
   * Creates options with a fixed worker count and an unbounded output queue.
   *
   * @param maxParallelism worker count
   * @return options
   */
  public static StepOptions parallelism(int maxParallelism) {
    return new StepOptions(maxParallelism, UNBOUNDED);
  }

  public StepOptions withMaxParallelism(int value) {
    return new StepOptions(value, boundedCapacity);
  }

  public StepOptions withBoundedCapacity(int value) {
    return new StepOptions(maxParallelism, value);
  }

  public boolean unboundedParallelism() {
    return maxParallelism == UNBOUNDED;
  }

  public boolean unboundedCapacity() {
    return boundedCapacity == UNBOUNDED;
  }
}
