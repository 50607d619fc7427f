/**
 * In-process collaborators for tests, samples and single-process resume.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dataflow.infrastructure.memory;
