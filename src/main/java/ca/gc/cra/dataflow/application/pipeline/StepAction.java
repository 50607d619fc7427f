package ca.gc.cra.dataflow.application.pipeline;

/**
 * Side-effecting user action run by an {@code action} step; the input passes through unchanged.
 *
 * @param <T> item type
 * @since 0.1.0
 */
@FunctionalInterface
public interface StepAction<T> {
  void accept(T input) throws Exception;
}
