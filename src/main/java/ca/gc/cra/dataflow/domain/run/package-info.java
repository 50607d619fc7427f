/**
 * Run, resource, step and artifact model shared by the pipeline engine and its collaborators.
 * <p><strong>Concurrency:</strong> Types are immutable records or enums; safe to share across stage workers.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.dataflow.domain.run;
