/**
 * OpenTelemetry-backed {@link ca.gc.cra.dataflow.application.port.MetricsPort} adapter.
 * <p>Export is disabled unless {@code metricsExporter=otlp}; the OTLP endpoint comes from
 * {@code otel.exporter.otlp.endpoint} or {@code OTEL_EXPORTER_OTLP_ENDPOINT}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.dataflow.infrastructure.metrics;
