package ca.gc.cra.dataflow.domain.run;

import java.time.Instant;

/**
 * Batched terminal status for one resource.
 *
 * @param resourceId resource identifier
 * @param status terminal status
 * @param errorMessage failure description; {@code null} unless failed
 * @param failedStep failing step; {@code null} unless failed
 * @param completedAt completion time
 * @since 0.1.0
 */
public record ResourceCompletionUpdate(
    String resourceId,
    ResourceStatus status,
    String errorMessage,
    String failedStep,
    Instant completedAt) {}
