package ca.gc.cra.dataflow.config;

import ca.gc.cra.dataflow.domain.run.ArtifactStorageType;
import ca.gc.cra.dataflow.domain.run.RunType;
import ca.gc.cra.dataflow.domain.run.StepOptions;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * <strong>What:</strong> Validated settings for one pipeline run.
 * <p><strong>Why:</strong> Consolidates YAML and CLI key/value input so context wiring reads typed values only.</p>
 * <p><strong>Role:</strong> Input to {@link PipelineContextFactory}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param name pipeline name used for logging and run registration
 * @param category run category
 * @param resourceType logical type of the resources flowing through the pipeline
 * @param stepOptions default parallelism and buffer capacity for every step
 * @param runType fresh, retry or continuation
 * @param parentRunId run being retried or continued; required unless {@code runType} is {@link RunType#FRESH}
 * @param artifactStorage where artifacts are written ({@link ArtifactStorageType#MEMORY} or
 *     {@link ArtifactStorageType#FILE_SYSTEM})
 * @param artifactDirectory root directory for file-system artifacts
 * @param artifactBatchSize artifacts per storage call
 * @param artifactFlushInterval maximum wait before a partial artifact batch is written
 * @param progressBatchSize buffered progress events that trigger a flush
 * @param progressFlushInterval maximum time a progress event stays buffered
 * @param metricsExporter {@code otlp} or {@code none}
 * @since 0.1.0
 */
public record PipelineConfig(
    String name,
    String category,
    String resourceType,
    StepOptions stepOptions,
    RunType runType,
    Optional<UUID> parentRunId,
    ArtifactStorageType artifactStorage,
    Path artifactDirectory,
    int artifactBatchSize,
    Duration artifactFlushInterval,
    int progressBatchSize,
    Duration progressFlushInterval,
    String metricsExporter) {

  public static final String DEFAULT_NAME = "pipeline";
  public static final String DEFAULT_CATEGORY = "default";
  public static final String DEFAULT_RESOURCE_TYPE = "resource";
  public static final int DEFAULT_BATCH_SIZE = 100;
  public static final long DEFAULT_FLUSH_MILLIS = 1000L;

  public PipelineConfig {
    name = requireNonBlank("name", name);
    category = requireNonBlank("category", category);
    resourceType = requireNonBlank("resourceType", resourceType);
    stepOptions = Objects.requireNonNullElse(stepOptions, StepOptions.DEFAULT);
    runType = Objects.requireNonNullElse(runType, RunType.FRESH);
    parentRunId = parentRunId == null ? Optional.empty() : parentRunId;
    artifactStorage = Objects.requireNonNullElse(artifactStorage, ArtifactStorageType.MEMORY);
    if (artifactStorage != ArtifactStorageType.MEMORY && artifactStorage != ArtifactStorageType.FILE_SYSTEM) {
      throw new IllegalArgumentException("artifactStorage must be memory or file");
    }
    artifactDirectory = artifactDirectory == null
        ? defaultArtifactDirectory()
        : artifactDirectory.toAbsolutePath().normalize();
    requirePositive("artifactBatchSize", artifactBatchSize);
    requirePositive("progressBatchSize", progressBatchSize);
    artifactFlushInterval = requirePositive("artifactFlushIntervalMillis", artifactFlushInterval);
    progressFlushInterval = requirePositive("progressFlushIntervalMillis", progressFlushInterval);
    metricsExporter = metricsExporter == null || metricsExporter.isBlank()
        ? "none"
        : metricsExporter.trim().toLowerCase(Locale.ROOT);
    if (!metricsExporter.equals("none") && !metricsExporter.equals("otlp")) {
      throw new IllegalArgumentException("metricsExporter must be otlp or none");
    }
    if (runType != RunType.FRESH && parentRunId.isEmpty()) {
      throw new IllegalArgumentException("parentRunId is required when runType=" + runType);
    }
  }

  /**
   * Returns the configuration used when no keys are supplied.
   *
   * @return default configuration
   */
  public static PipelineConfig defaults() {
    return fromMap(Map.of());
  }

  /**
   * Builds configuration from flat key/value pairs, as produced by {@link YamlConfigLoader} and the CLI.
   *
   * @param options key/value pairs; unknown keys are ignored
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or violates an invariant
   */
  public static PipelineConfig fromMap(Map<String, String> options) {
    Map<String, String> map = options == null ? Map.of() : options;
    StepOptions stepOptions = new StepOptions(
        parseLimit("maxParallelism", map.get("maxParallelism")),
        parseLimit("boundedCapacity", map.get("boundedCapacity")));
    return new PipelineConfig(
        valueOr(map, "name", DEFAULT_NAME),
        valueOr(map, "category", DEFAULT_CATEGORY),
        valueOr(map, "resourceType", DEFAULT_RESOURCE_TYPE),
        stepOptions,
        parseRunType(map.get("runType")),
        parseUuid("parentRunId", map.get("parentRunId")),
        parseStorage(map.get("artifactStorage")),
        parsePath("artifactDirectory", map.get("artifactDirectory")),
        parseInt("artifactBatchSize", map.get("artifactBatchSize"), DEFAULT_BATCH_SIZE),
        Duration.ofMillis(parseLong("artifactFlushIntervalMillis", map.get("artifactFlushIntervalMillis"),
            DEFAULT_FLUSH_MILLIS)),
        parseInt("progressBatchSize", map.get("progressBatchSize"), DEFAULT_BATCH_SIZE),
        Duration.ofMillis(parseLong("progressFlushIntervalMillis", map.get("progressFlushIntervalMillis"),
            DEFAULT_FLUSH_MILLIS)),
        map.get("metricsExporter"));
  }

  private static String valueOr(Map<String, String> map, String key, String fallback) {
    String value = map.get(key);
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  private static String requireNonBlank(String name, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return value.trim();
  }

  private static void requirePositive(String name, int value) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }

  private static Duration requirePositive(String name, Duration value) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return value;
  }

  private static int parseLimit(String name, String value) {
    if (value == null || value.isBlank() || value.trim().equalsIgnoreCase("unbounded")) {
      return StepOptions.UNBOUNDED;
    }
    int parsed = parseInt(name, value, StepOptions.UNBOUNDED);
    if (parsed < 1 && parsed != StepOptions.UNBOUNDED) {
      throw new IllegalArgumentException(name + " must be >= 1 or 'unbounded'");
    }
    return parsed;
  }

  private static int parseInt(String name, String value, int fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer: " + value, ex);
    }
  }

  private static long parseLong(String name, String value, long fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer: " + value, ex);
    }
  }

  private static RunType parseRunType(String value) {
    if (value == null || value.isBlank()) {
      return RunType.FRESH;
    }
    try {
      return RunType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("runType must be fresh, retry or continuation: " + value, ex);
    }
  }

  private static Optional<UUID> parseUuid(String name, String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(UUID.fromString(value.trim()));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(name + " is not a valid UUID: " + value, ex);
    }
  }

  private static ArtifactStorageType parseStorage(String value) {
    if (value == null || value.isBlank()) {
      return ArtifactStorageType.MEMORY;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "memory" -> ArtifactStorageType.MEMORY;
      case "file", "filesystem", "file_system" -> ArtifactStorageType.FILE_SYSTEM;
      default -> throw new IllegalArgumentException("artifactStorage must be memory or file: " + value);
    };
  }

  private static Path parsePath(String name, String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    if (value.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    try {
      return Path.of(value.trim());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Path defaultArtifactDirectory() {
    String home = System.getProperty("user.home", ".");
    return Path.of(home, ".dataflow", "artifacts").toAbsolutePath().normalize();
  }
}
