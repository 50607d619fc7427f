/**
 * Thread and executor factories shared by the engine and the batching adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dataflow.infrastructure.exec;
