package ca.gc.cra.dataflow.infrastructure.metrics;

import ca.gc.cra.dataflow.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <strong>What:</strong> {@link MetricsPort} backed by OpenTelemetry counters and histograms.
 * <p><strong>Why:</strong> Step keys such as {@code pipeline.step.Parse.latencyMs} would otherwise create one
 * instrument per step; they are folded into a single {@code pipeline.step.latencyMs} instrument carrying a
 * {@code dataflow.step} attribute.</p>
 * <p><strong>Thread-safety:</strong> Instruments are cached in concurrent maps; safe for all stage workers.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("dataflow.metric.key");
  static final AttributeKey<String> STEP = AttributeKey.stringKey("dataflow.step");
  private static final String STEP_PREFIX = "pipeline.step.";
  private static final String FALLBACK_NAME = "dataflow.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting through {@code exporter}.
   *
   * @param exporter {@code otlp} or {@code none}
   * @return adapter; records into a noop meter when export is disabled
   */
  public static OpenTelemetryMetricsAdapter create(String exporter) {
    return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.initialize(exporter));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  @Override
  public void increment(String key) {
    Instrument<LongCounter> instrument = counters.computeIfAbsent(
        Objects.requireNonNull(key, "key"), this::newCounter);
    instrument.handle().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> instrument = histograms.computeIfAbsent(
        Objects.requireNonNull(key, "key"), this::newHistogram);
    instrument.handle().record(value, instrument.attributes());
  }

  public boolean isExporting() {
    return !bootstrap.isNoop();
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private Instrument<LongCounter> newCounter(String key) {
    Name name = Name.of(key);
    LongCounter counter = meter.counterBuilder(name.instrument())
        .setUnit("1")
        .setDescription("Pipeline counter " + name.instrument())
        .build();
    return new Instrument<>(counter, name.attributes());
  }

  private Instrument<LongHistogram> newHistogram(String key) {
    Name name = Name.of(key);
    LongHistogram histogram = meter.histogramBuilder(name.instrument())
        .ofLongs()
        .setDescription("Pipeline observation " + name.instrument())
        .build();
    return new Instrument<>(histogram, name.attributes());
  }

  private record Instrument<H>(H handle, Attributes attributes) {}

  record Name(String instrument, Attributes attributes) {
    static Name of(String key) {
      if (key.startsWith(STEP_PREFIX)) {
        int last = key.lastIndexOf('.');
        if (last > STEP_PREFIX.length()) {
          String step = key.substring(STEP_PREFIX.length(), last);
          String measure = key.substring(last + 1);
          return new Name(sanitize(STEP_PREFIX + measure), Attributes.of(METRIC_KEY, key, STEP, step));
        }
      }
      return new Name(sanitize(key), Attributes.of(METRIC_KEY, key));
    }

    static String sanitize(String key) {
      String trimmed = key.trim().toLowerCase(Locale.ROOT);
      if (trimmed.isEmpty()) {
        return FALLBACK_NAME;
      }
      StringBuilder out = new StringBuilder(trimmed.length() + 1);
      if (!Character.isLetter(trimmed.charAt(0))) {
        out.append('m');
      }
      for (int i = 0; i < trimmed.length(); i++) {
        char c = trimmed.charAt(i);
        out.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
      }
      return out.toString();
    }
  }
}
