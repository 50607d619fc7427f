/**
 * <strong>Purpose:</strong> Collaborator contracts consumed by the pipeline engine.
 * <p><strong>Pipeline role:</strong> Infrastructure adapters implement these interfaces; every collaborator is
 * optional and its absence degrades the engine to no tracking or no persistence.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.dataflow.application.port;
