/**
 * Progress tracker that batches events into a {@link ca.gc.cra.dataflow.application.port.ProgressService}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dataflow.infrastructure.progress;
