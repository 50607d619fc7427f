package ca.gc.cra.dataflow.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterCounterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    OpenTelemetryBootstrap.BootstrapResult bootstrap = OpenTelemetryBootstrap.forTesting(reader);
    adapter = new OpenTelemetryMetricsAdapter(bootstrap);
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("pipeline.artifact.queued");
    adapter.increment("pipeline.artifact.queued");
    adapter.increment("pipeline.artifact.queued");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "pipeline.artifact.queued");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());

    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("pipeline.artifact.queued", point.getAttributes().get(OpenTelemetryMetricsAdapter.METRIC_KEY));

    AttributeKey<String> serviceName = AttributeKey.stringKey("service.name");
    assertEquals("dataflow", counter.getResource().getAttribute(serviceName));
    AttributeKey<String> serviceNamespace = AttributeKey.stringKey("service.namespace");
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(serviceNamespace));
  }

  @Test
  void stepCountersShareOneInstrumentKeyedByStep() {
    adapter.increment("pipeline.step.Parse.success");
    adapter.increment("pipeline.step.Parse.success");
    adapter.increment("pipeline.step.Enrich.success");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "pipeline.step.success");
    Map<String, Long> byStep = counter.getLongSumData().getPoints().stream()
        .collect(Collectors.toMap(
            point -> point.getAttributes().get(OpenTelemetryMetricsAdapter.STEP), LongPointData::getValue));

    assertEquals(Map.of("Parse", 2L, "Enrich", 1L), byStep);
  }

  @Test
  void createWithoutExporterIsNoop() {
    try (OpenTelemetryMetricsAdapter noop = OpenTelemetryMetricsAdapter.create("none")) {
      noop.increment("pipeline.complete.success");
      noop.observe("pipeline.step.Parse.latencyMs", 3L);

      assertFalse(noop.isExporting());
    }
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    Optional<MetricData> match = metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst();
    assertTrue(match.isPresent(), "Expected metric " + name + " to be exported");
    return match.orElseThrow();
  }
}
