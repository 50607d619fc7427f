package ca.gc.cra.dataflow.domain.run;

/**
 * Progress of one step for one resource.
 *
 * @param stepName step name
 * @param status step status
 * @param durationMs elapsed milliseconds; {@code null} while in progress
 * @param errorMessage failure description; {@code null} unless failed
 * @since 0.1.0
 */
public record StepProgress(String stepName, StepStatus status, Long durationMs, String errorMessage) {}
