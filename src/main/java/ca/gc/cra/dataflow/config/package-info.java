/**
 * Pipeline configuration: YAML loading, CLI/YAML merging and context wiring.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dataflow.config;
