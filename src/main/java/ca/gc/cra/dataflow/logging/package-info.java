/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound user-supplied values in log lines.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked from concurrent stage workers.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dataflow.logging;
