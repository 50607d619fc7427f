package ca.gc.cra.dataflow.domain.run;

import java.time.Instant;

/**
 * Batched step transition for one resource.
 *
 * @param resourceId resource identifier
 * @param stepName step name
 * @param status new step status
 * @param durationMs elapsed milliseconds; {@code null} for starts
 * @param errorMessage failure description; {@code null} unless failed
 * @param recordedAt time of the transition
 * @since 0.1.0
 */
public record StepProgressUpdate(
    String resourceId,
    String stepName,
    StepStatus status,
    Long durationMs,
    String errorMessage,
    Instant recordedAt) {}
