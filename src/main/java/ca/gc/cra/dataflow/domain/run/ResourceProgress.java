package ca.gc.cra.dataflow.domain.run;

import java.util.List;

/**
 * Point-in-time view of one resource's progress.
 *
 * @param resourceId resource identifier
 * @param resourceType resource type tag
 * @param status resource status
 * @param steps step progress in the order the steps started
 * @param errorMessage failure description; {@code null} unless failed
 * @param failedStep failing step; {@code null} unless failed
 * @since 0.1.0
 */
public record ResourceProgress(
    String resourceId,
    String resourceType,
    ResourceStatus status,
    List<StepProgress> steps,
    String errorMessage,
    String failedStep) {

  public ResourceProgress {
    steps = steps == null ? List.of() : List.copyOf(steps);
  }
}
