/**
 * Pipeline engine: fluent builder, stage graph and the tracked stages that carry {@code PipelineResult}s.
 * <p>Stages are linked by blocking queues and run on named worker threads; a failed item travels to the end of
 * the pipeline as a failure result instead of stopping the run. Artifact capture runs on a side path fed by a
 * fan-out stage so slow storage never stalls the main path.</p>
 * <p>Engine threads carry the MDC keys {@code pipeline} and {@code runId}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.dataflow.application.pipeline;
