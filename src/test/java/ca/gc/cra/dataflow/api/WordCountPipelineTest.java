package ca.gc.cra.dataflow.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.dataflow.application.pipeline.PipelineContext;
import ca.gc.cra.dataflow.application.port.MetricsPort;
import ca.gc.cra.dataflow.domain.run.CreateRunRequest;
import ca.gc.cra.dataflow.domain.run.ResourceCompletionUpdate;
import ca.gc.cra.dataflow.domain.run.ResourceStartUpdate;
import ca.gc.cra.dataflow.domain.run.ResourceStatus;
import ca.gc.cra.dataflow.domain.run.RunType;
import ca.gc.cra.dataflow.infrastructure.artifact.BatchingArtifactBatcher;
import ca.gc.cra.dataflow.infrastructure.memory.InMemoryArtifactStorage;
import ca.gc.cra.dataflow.infrastructure.memory.InMemoryProgressService;
import ca.gc.cra.dataflow.infrastructure.memory.InMemoryProgressTracker;
import ca.gc.cra.dataflow.infrastructure.memory.InMemoryResourceRunCache;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class WordCountPipelineTest {

  @Test
  void tokenizeLowercasesSplitsAndSortsByWord() {
    List<WordCountPipeline.Token> tokens = WordCountPipeline.tokenize(List.of("The cat, the hat", "cat's"));

    assertEquals(List.of(
        new WordCountPipeline.Token("cat", 1, 1),
        new WordCountPipeline.Token("cat's", 2, 0),
        new WordCountPipeline.Token("hat", 1, 3),
        new WordCountPipeline.Token("the", 1, 0),
        new WordCountPipeline.Token("the", 1, 2)), tokens);
  }

  @Test
  void runCountsWordsTracksThemAndStoresArtifacts() throws Exception {
    UUID runId = UUID.randomUUID();
    InMemoryProgressTracker tracker = new InMemoryProgressTracker(runId);
    InMemoryArtifactStorage storage = new InMemoryArtifactStorage();
    PipelineContext ctx = PipelineContext.builder("word")
        .withRunId(runId)
        .withName("wordcount")
        .withProgressTracker(tracker)
        .withResourceRunCache(new InMemoryResourceRunCache())
        .withArtifactBatcher(new BatchingArtifactBatcher(
            storage, runId, 10, Duration.ofMillis(50), null, MetricsPort.NO_OP))
        .build();

    WordCountPipeline.Summary summary = new WordCountPipeline(2)
        .run(ctx, WordCountPipeline.tokenize(List.of("the cat", "the hat", "cat")));

    assertEquals(6, summary.tokens());
    assertEquals(2, summary.batches());
    assertEquals(Set.of("cat", "hat", "the"), summary.counts().keySet());
    assertEquals(new WordCountPipeline.WordCount("cat", 2, Set.of(1, 3)), summary.counts().get("cat"));
    assertEquals(List.of("cat", "the"),
        summary.top(2).stream().map(WordCountPipeline.WordCount::word).toList());
    assertEquals(3, tracker.getPipelineSnapshot().completedResources());
    assertEquals(ResourceStatus.COMPLETED, tracker.resource("hat").orElseThrow().status());
    assertEquals(3, storage.artifactCount());
    assertEquals(1, tracker.finalizeCount());
  }

  @Test
  void retryRecountsOnlyIncompleteWords() {
    InMemoryProgressService service = new InMemoryProgressService();
    UUID parent = UUID.randomUUID();
    Instant now = Instant.now();
    service.createRun(new CreateRunRequest(parent, "wordcount", "default", RunType.FRESH, null));
    service.createResourceRunsBatch(parent, List.of(
        new ResourceStartUpdate("cat", "word", now),
        new ResourceStartUpdate("hat", "word", now),
        new ResourceStartUpdate("the", "word", now)));
    service.completeResourceRunsBatch(parent, List.of(
        new ResourceCompletionUpdate("cat", ResourceStatus.FAILED, "boom", WordCountPipeline.RECORD_STEP, now),
        new ResourceCompletionUpdate("hat", ResourceStatus.COMPLETED, null, null, now),
        new ResourceCompletionUpdate("the", ResourceStatus.COMPLETED, null, null, now)));
    PipelineContext ctx = PipelineContext.builder("word")
        .withRunType(RunType.RETRY)
        .withParentRunId(parent)
        .withProgressService(service)
        .build();

    WordCountPipeline.Summary summary = new WordCountPipeline(5)
        .run(ctx, WordCountPipeline.tokenize(List.of("the cat", "the hat", "cat")));

    assertEquals(Set.of("cat"), summary.counts().keySet());
    assertEquals(2, summary.counts().get("cat").count());
    assertEquals(1, summary.batches());
  }

  @Test
  void rejectsNonPositiveBatchSize() {
    assertThrows(IllegalArgumentException.class, () -> new WordCountPipeline(0));
  }
}
