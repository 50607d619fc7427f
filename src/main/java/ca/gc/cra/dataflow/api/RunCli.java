package ca.gc.cra.dataflow.api;

import ca.gc.cra.dataflow.application.pipeline.CancellationSignal;
import ca.gc.cra.dataflow.application.pipeline.PipelineContext;
import ca.gc.cra.dataflow.application.pipeline.PipelineExecutionException;
import ca.gc.cra.dataflow.config.ConfigMerger;
import ca.gc.cra.dataflow.config.PipelineConfig;
import ca.gc.cra.dataflow.config.PipelineContextFactory;
import ca.gc.cra.dataflow.config.YamlConfigLoader;
import ca.gc.cra.dataflow.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.dataflow.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code run} command: executes the word-count sample pipeline over a text file.
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String SECTION = "wordcount";
  private static final int DEFAULT_BATCH_SIZE = 50;
  private static final int DEFAULT_TOP = 10;
  private static final String SUMMARY_USAGE =
      "usage: dataflow run in=PATH [config=PATH] [batchSize=N] [top=N] [maxParallelism=N|unbounded] "
          + "[artifactStorage=memory|file] [artifactDirectory=PATH] [metricsExporter=otlp|none] [--verbose]";
  private static final String HELP_TEXT = """
      dataflow run: count words in a text file with a resumable pipeline

      Usage:
        dataflow run in=./book.txt [options]

      Required:
        in=PATH                      UTF-8 text file to count

      Optional:
        config=PATH                  YAML file; 'common' and 'wordcount' sections are merged
        batchSize=N                  Word counts per recorded batch (default 50)
        top=N                        Words listed in the summary (default 10)
        name=NAME                    Pipeline name (default wordcount)
        maxParallelism=N|unbounded   Default workers per step
        boundedCapacity=N|unbounded  Default buffer per step
        artifactStorage=memory|file  Where word-count artifacts are written (default memory)
        artifactDirectory=PATH       Root directory for file artifacts
        metricsExporter=otlp|none    Metrics export (default none)
        --verbose                    Enable DEBUG logging
        --help                       Show this message
      """;

  private RunCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.tokens()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String in = kv.remove("in");
    if (in == null || in.isBlank()) {
      log.error("Missing required argument in=PATH");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Path inputPath = Path.of(in);
    if (!Files.isRegularFile(inputPath)) {
      log.error("Input file does not exist: {}", inputPath);
      return ExitCode.IO_ERROR;
    }

    int batchSize;
    int top;
    try {
      batchSize = positive("batchSize", kv.remove("batchSize"), DEFAULT_BATCH_SIZE);
      top = positive("top", kv.remove("top"), DEFAULT_TOP);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = kv.remove("config");
    if (configPath != null && !configPath.isBlank()) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        return ExitCode.IO_ERROR;
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, SECTION);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    PipelineConfig config;
    try {
      Map<String, String> effective = ConfigMerger.merge(yaml, kv, Map.of("name", SECTION), log::warn);
      config = PipelineConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid pipeline configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    CancellationSignal cancellation = new CancellationSignal();
    Thread hook = new Thread(cancellation::cancel, "dataflow-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    try (OpenTelemetryMetricsAdapter metrics = OpenTelemetryMetricsAdapter.create(config.metricsExporter())) {
      PipelineContextFactory factory = PipelineContextFactory.create(config, metrics);
      PipelineContext context = factory.builder().withCancellation(cancellation).build();
      log.info("Starting run {} of {} over {} (artifacts: {})", context.runId(), config.name(), inputPath,
          config.artifactStorage());
      WordCountPipeline.Summary summary = new WordCountPipeline(batchSize).run(context, inputPath);
      printSummary(context, summary, top);
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Failed to read {}", inputPath, ex);
      return ExitCode.IO_ERROR;
    } catch (CancellationException ex) {
      log.warn("Run cancelled");
      return ExitCode.INTERRUPTED;
    } catch (PipelineExecutionException ex) {
      log.error("Pipeline failed", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      removeHook(hook);
    }
  }

  private static void printSummary(PipelineContext context, WordCountPipeline.Summary summary, int top) {
    CliPrinter.printf("run %s: %d tokens, %d distinct words, %d batches%n", context.runId(), summary.tokens(),
        summary.counts().size(), summary.batches());
    for (WordCountPipeline.WordCount count : summary.top(top)) {
      CliPrinter.printf("%8d  %s%n", count.count(), count.word());
    }
  }

  private static int positive(String name, String value, int fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    int parsed;
    try {
      parsed = Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer: " + value, ex);
    }
    if (parsed <= 0) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return parsed;
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutting down; shutdown hook left in place");
    }
  }
}
