package ca.gc.cra.dataflow.api;

import ca.gc.cra.dataflow.application.pipeline.DataFlowPipeline;
import ca.gc.cra.dataflow.application.pipeline.PipelineContext;
import ca.gc.cra.dataflow.application.pipeline.PipelineSource;
import ca.gc.cra.dataflow.domain.run.StepOptions;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Sample pipeline counting words in a text file.
 *
 * <p>Stages: tokens sorted by word are grouped per word ({@code CountWords}), each count is captured as an
 * artifact, counts are batched, and each batch is recorded ({@code Record}). Every resource is a word.</p>
 */
public final class WordCountPipeline {
  static final String COUNT_STEP = "CountWords";
  static final String RECORD_STEP = "Record";
  private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}']+");

  private final int batchSize;

  public WordCountPipeline(int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive");
    }
    this.batchSize = batchSize;
  }

  /** One word occurrence. Occurrences are tracked under their word, so a word is one resource. */
  public record Token(String word, int line, int position) {}

  /** Occurrences of one word. */
  public record WordCount(String word, int count, Set<Integer> lines) {}

  /** Outcome of a run. */
  public record Summary(int tokens, Map<String, WordCount> counts, int batches) {
    public List<WordCount> top(int limit) {
      return counts.values().stream()
          .sorted(Comparator.comparingInt(WordCount::count).reversed().thenComparing(WordCount::word))
          .limit(limit)
          .toList();
    }
  }

  /**
   * Reads and tokenizes {@code input}, then runs the pipeline to completion on {@code context}.
   *
   * @param context run context; closed when the run ends
   * @param input UTF-8 text file
   * @return counts per word
   * @throws IOException if the file cannot be read
   */
  public Summary run(PipelineContext context, Path input) throws IOException {
    List<Token> tokens = tokenize(Files.readAllLines(input, StandardCharsets.UTF_8));
    return run(context, tokens);
  }

  Summary run(PipelineContext context, List<Token> tokens) {
    Objects.requireNonNull(context, "context");
    Map<String, WordCount> counts = new ConcurrentSkipListMap<>();
    AtomicInteger batches = new AtomicInteger();

    DataFlowPipeline.<Token>create(context, Token::word)
        .fromRunType(
            PipelineSource.fromIterable(tokens),
            incomplete -> PipelineSource.fromIterable(tokens.stream()
                .filter(t -> incomplete.contains(t.word()))
                .toList()))
        .groupSequential(COUNT_STEP, Token::word, WordCountPipeline::count, word -> word,
            StepOptions.parallelism(1))
        .withArtifact("word-count")
        .batch(batchSize)
        .action(RECORD_STEP, batch -> {
          batches.incrementAndGet();
          for (WordCount count : batch) {
            counts.put(count.word(), count);
          }
        })
        .completeMany(batch -> batch.stream().map(WordCount::word).toList());
    return new Summary(tokens.size(), Map.copyOf(counts), batches.get());
  }

  static List<Token> tokenize(List<String> lines) {
    List<Token> tokens = new ArrayList<>();
    for (int i = 0; i < lines.size(); i++) {
      int position = 0;
      for (String raw : SEPARATORS.split(lines.get(i).toLowerCase(Locale.ROOT))) {
        if (!raw.isBlank()) {
          tokens.add(new Token(raw, i + 1, position++));
        }
      }
    }
    tokens.sort(Comparator.comparing(Token::word).thenComparingInt(Token::line).thenComparingInt(Token::position));
    return tokens;
  }

  private static WordCount count(String word, List<Token> group) {
    Set<Integer> lines = new TreeSet<>();
    for (Token token : group) {
      lines.add(token.line());
    }
    return new WordCount(word, group.size(), Set.copyOf(lines));
  }
}
