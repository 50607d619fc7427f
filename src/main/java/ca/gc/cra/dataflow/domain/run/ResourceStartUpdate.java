package ca.gc.cra.dataflow.domain.run;

import java.time.Instant;

/**
 * Batched notification that a resource entered the pipeline.
 *
 * @param resourceId resource identifier
 * @param resourceType resource type tag
 * @param startedAt time the resource started
 * @since 0.1.0
 */
public record ResourceStartUpdate(String resourceId, String resourceType, Instant startedAt) {}
