/**
 * Result envelope exchanged between pipeline stages.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dataflow.domain.result;
