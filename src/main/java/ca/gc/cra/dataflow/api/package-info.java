/**
 * Command-line entry points.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dataflow.api;
