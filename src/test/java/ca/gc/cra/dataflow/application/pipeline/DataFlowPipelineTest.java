package ca.gc.cra.dataflow.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dataflow.application.port.MetricsPort;
import ca.gc.cra.dataflow.application.port.ProgressTracker;
import ca.gc.cra.dataflow.domain.run.CreateRunRequest;
import ca.gc.cra.dataflow.domain.run.ResourceCompletionUpdate;
import ca.gc.cra.dataflow.domain.run.ResourceStartUpdate;
import ca.gc.cra.dataflow.domain.run.ResourceStatus;
import ca.gc.cra.dataflow.domain.run.RunType;
import ca.gc.cra.dataflow.domain.run.StepOptions;
import ca.gc.cra.dataflow.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.dataflow.infrastructure.memory.InMemoryProgressService;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DataFlowPipelineTest {

  @Test
  void transformsRunInOrderWithSingleWorker() {
    RecordingProgressTracker tracker = new RecordingProgressTracker();
    PipelineContext ctx = singleWorkerContext().withProgressTracker(tracker).build();
    List<String> seen = new CopyOnWriteArrayList<>();

    DataFlowPipeline.<Integer>create(ctx, String::valueOf)
        .fromIterable(List.of(1, 2, 3, 4, 5))
        .transform("Double", value -> value * 2)
        .transform("Format", value -> "v" + value)
        .action("Collect", seen::add)
        .complete();

    assertEquals(List.of("v2", "v4", "v6", "v8", "v10"), seen);
    assertEquals(1, tracker.finalizeCalls.get());
    assertTrue(ctx.isClosed());
  }

  @Test
  void initialStageRecordsStartBeforeStepEvents() {
    RecordingProgressTracker tracker = new RecordingProgressTracker();
    PipelineContext ctx = singleWorkerContext().withProgressTracker(tracker).build();

    DataFlowPipeline.<String>create(ctx, s -> s)
        .fromIterable(List.of("a"))
        .transform("Parse", String::toUpperCase)
        .transform("Upper", s -> s + "!")
        .complete();

    assertEquals(List.of(
        "start:a",
        "stepStart:a:Parse",
        "stepComplete:a:Parse",
        "stepStart:a:Upper",
        "stepComplete:a:Upper",
        "complete:a:COMPLETED"), tracker.eventsFor("a"));
  }

  @Test
  void failedItemSkipsLaterStepsAndKeepsOriginalStep() {
    RecordingProgressTracker tracker = new RecordingProgressTracker();
    PipelineContext ctx = singleWorkerContext().withProgressTracker(tracker).build();
    List<String> upper = new CopyOnWriteArrayList<>();

    DataFlowPipeline.<String>create(ctx, s -> s)
        .fromIterable(List.of("a", "bad", "c"))
        .transform("Parse", value -> {
          if (value.equals("bad")) {
            throw new IllegalArgumentException("bad input");
          }
          return value;
        })
        .transform("Upper", value -> {
          upper.add(value);
          return value.toUpperCase();
        })
        .complete();

    assertEquals(List.of("a", "c"), upper);
    assertEquals(List.of(
        "start:bad",
        "stepStart:bad:Parse",
        "stepFailed:bad:Parse:bad input",
        "complete:bad:FAILED"), tracker.eventsFor("bad"));
    assertTrue(tracker.eventsFor("c").contains("complete:c:COMPLETED"));
  }

  @Test
  void failureKeepsResourceIdAndFirstFailedStepThroughEveryStageKind() {
    Logger logger = (Logger) LoggerFactory.getLogger("dataflow.pipeline.pass-through");
    logger.setLevel(Level.DEBUG);
    logger.setAdditive(false);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    RecordingProgressTracker tracker = new RecordingProgressTracker();
    RecordingArtifactBatcher batcher = new RecordingArtifactBatcher();
    PipelineContext ctx = singleWorkerContext()
        .withProgressTracker(tracker)
        .withArtifactBatcher(batcher)
        .withLogger(logger)
        .build();
    List<String> touched = new CopyOnWriteArrayList<>();
    List<String> groups = new CopyOnWriteArrayList<>();

    try {
      DataFlowPipeline.<String>create(ctx, s -> s)
          .fromIterable(List.of("a1", "bad", "b1"))
          .transform("Parse", value -> {
            if (value.equals("bad")) {
              throw new IllegalArgumentException("unparseable");
            }
            return value;
          })
          .transform("Enrich", value -> {
            touched.add("Enrich:" + value);
            return value + "!";
          })
          .withArtifact()
          .action("Audit", value -> touched.add("Audit:" + value))
          .<String>transformMany("Split", value -> {
            touched.add("Split:" + value);
            return List.of(value + "x", value + "y");
          }, child -> child)
          .groupSequential("Group", child -> child.substring(0, 1),
              (String key, List<String> members) -> key + members.size(), key -> "group-" + key)
          .action("Collect", groups::add)
          .complete();
    } finally {
      logger.detachAppender(appender);
      appender.stop();
      logger.setLevel(null);
      logger.setAdditive(true);
    }

    List<String> failures = new ArrayList<>();
    for (ILoggingEvent event : appender.list) {
      if (event.getFormattedMessage().startsWith("Pipeline completed with failed resource")) {
        failures.add(event.getFormattedMessage());
      }
    }
    assertEquals(List.of("Pipeline completed with failed resource bad at step Parse: unparseable"), failures);
    assertEquals(List.of("a2", "b2"), groups);
    assertFalse(touched.stream().anyMatch(entry -> entry.contains("bad")), touched.toString());
    assertEquals(Set.of("a1!", "b1!"), Set.copyOf(batcher.requests().stream().map(r -> r.data()).toList()));
    assertEquals(List.of(
        "start:bad",
        "stepStart:bad:Parse",
        "stepFailed:bad:Parse:unparseable",
        "complete:bad:FAILED"), tracker.eventsFor("bad"));
  }

  @Test
  void resourceIdSelectorFailureDoesNotStopTheRun() {
    PipelineContext ctx = singleWorkerContext().build();
    List<String> seen = new CopyOnWriteArrayList<>();

    DataFlowPipeline.<String>create(ctx, value -> {
          if (value.isEmpty()) {
            throw new IllegalArgumentException("empty id");
          }
          return value;
        })
        .fromIterable(List.of("a", "", "b"))
        .transform("Copy", value -> value)
        .action("Collect", seen::add)
        .complete();

    assertEquals(List.of("a", "b"), seen);
  }

  @Test
  void asyncTransformUnwrapsFailures() {
    RecordingProgressTracker tracker = new RecordingProgressTracker();
    PipelineContext ctx = singleWorkerContext().withProgressTracker(tracker).build();
    List<Integer> seen = new CopyOnWriteArrayList<>();

    DataFlowPipeline.<Integer>create(ctx, String::valueOf)
        .fromIterable(List.of(1, 2))
        .transformAsync("Lookup", value -> value == 2
            ? CompletableFuture.<Integer>failedFuture(new IllegalStateException("lookup failed"))
            : CompletableFuture.completedFuture(value * 10))
        .action("Collect", seen::add)
        .complete();

    assertEquals(List.of(10), seen);
    assertTrue(tracker.eventsFor("2").contains("stepFailed:2:Lookup:lookup failed"));
  }

  @Test
  void groupSequentialGroupsAdjacentKeys() {
    PipelineContext ctx = singleWorkerContext().build();
    List<Map.Entry<String, String>> groups = new CopyOnWriteArrayList<>();
    List<Map.Entry<String, String>> input = List.of(
        Map.entry("k1", "a"), Map.entry("k1", "b"), Map.entry("k2", "c"));

    DataFlowPipeline.<Map.Entry<String, String>>create(ctx, entry -> entry.getKey() + "/" + entry.getValue())
        .fromIterable(input)
        .groupSequential("Group", Map.Entry::getKey,
            (String key, List<Map.Entry<String, String>> members) -> {
              StringBuilder joined = new StringBuilder();
              members.forEach(member -> joined.append(member.getValue()));
              return Map.entry(key, joined.toString());
            },
            key -> key)
        .action("Collect", groups::add)
        .complete();

    assertEquals(List.of(Map.entry("k1", "ab"), Map.entry("k2", "c")), groups);
  }

  @Test
  void rootGroupSequentialKeepsSortedSourceTogetherOnUnboundedContext() {
    List<Map.Entry<Integer, Integer>> input = new ArrayList<>();
    for (int key = 0; key < 20; key++) {
      for (int member = 0; member < 50; member++) {
        input.add(Map.entry(key, member));
      }
    }

    for (int attempt = 0; attempt < 3; attempt++) {
      PipelineContext ctx = PipelineContext.builder("entry").build();
      List<Map.Entry<Integer, Integer>> groups = new CopyOnWriteArrayList<>();

      DataFlowPipeline.<Map.Entry<Integer, Integer>>create(ctx, entry -> entry.getKey() + "/" + entry.getValue())
          .fromIterable(input)
          .<Integer, Map.Entry<Integer, Integer>>groupSequential("Group", Map.Entry::getKey,
              (Integer key, List<Map.Entry<Integer, Integer>> members) -> Map.entry(key, members.size()),
              key -> "k" + key)
          .action("Collect", groups::add, StepOptions.parallelism(1))
          .complete();

      assertEquals(20, groups.size(), "groups on attempt " + attempt);
      for (int key = 0; key < 20; key++) {
        assertEquals(Map.entry(key, 50), groups.get(key));
      }
    }
  }

  @Test
  void groupSequentialTracksGroupsAsResources() {
    RecordingProgressTracker tracker = new RecordingProgressTracker();
    PipelineContext ctx = singleWorkerContext().withProgressTracker(tracker).build();

    DataFlowPipeline.<String>create(ctx, s -> s)
        .fromIterable(List.of("x1", "x2", "y1"))
        .groupSequential("Group", s -> s.substring(0, 1), (String key, List<String> members) -> members.size(),
            key -> "group-" + key)
        .complete();

    assertEquals(List.of(
        "start:group-x",
        "stepStart:group-x:Group",
        "stepComplete:group-x:Group",
        "complete:group-x:COMPLETED"), tracker.eventsFor("group-x"));
    assertTrue(tracker.eventsFor("x1").contains("stepComplete:x1:Group_Init"));
  }

  @Test
  void groupSequentialOnEmptySourceNeverCallsProjector() {
    PipelineContext ctx = singleWorkerContext().build();
    AtomicInteger projections = new AtomicInteger();

    DataFlowPipeline.<String>create(ctx, s -> s)
        .fromIterable(List.of())
        .groupSequential("Group", s -> s, (String key, List<String> members) -> projections.incrementAndGet(),
            key -> key)
        .complete();

    assertEquals(0, projections.get());
  }

  @Test
  void groupSequentialHandsProjectorImmutableSnapshot() {
    PipelineContext ctx = singleWorkerContext().build();
    List<List<String>> snapshots = new CopyOnWriteArrayList<>();

    DataFlowPipeline.<String>create(ctx, s -> s)
        .fromIterable(List.of("a1", "a2", "b1"))
        .groupSequential("Group", s -> s.charAt(0), (Character key, List<String> members) -> {
          snapshots.add(members);
          return members.size();
        }, String::valueOf)
        .complete();

    assertEquals(List.of(List.of("a1", "a2"), List.of("b1")), snapshots);
    assertThrows(UnsupportedOperationException.class, () -> snapshots.get(0).add("a3"));
  }

  @Test
  void batchEmitsFullBatchesAndFlushesRemainder() {
    PipelineContext ctx = singleWorkerContext().build();
    List<Integer> sizes = new CopyOnWriteArrayList<>();

    DataFlowPipeline.<Integer>create(ctx, String::valueOf)
        .fromIterable(List.of(1, 2, 3, 4, 5))
        .transform("Copy", value -> value)
        .batch(2)
        .action("Sizes", batch -> sizes.add(batch.size()))
        .complete();

    assertEquals(List.of(2, 2, 1), sizes);
  }

  @Test
  void batchDropsFailedMembers() {
    PipelineContext ctx = singleWorkerContext().build();
    List<List<Integer>> batches = new CopyOnWriteArrayList<>();

    DataFlowPipeline.<Integer>create(ctx, String::valueOf)
        .fromIterable(List.of(1, 2, 3, 4))
        .transform("Check", value -> {
          if (value == 2) {
            throw new IllegalStateException("rejected");
          }
          return value;
        })
        .batch(4)
        .action("Collect", batches::add)
        .complete();

    assertEquals(List.of(List.of(1, 3, 4)), batches);
  }

  @Test
  void batchRejectsNonPositiveSize() {
    PipelineContext ctx = singleWorkerContext().build();
    StepBuilder<String, String> step = DataFlowPipeline.<String>create(ctx, s -> s)
        .fromIterable(List.of("a"))
        .transform("Copy", s -> s);

    assertThrows(IllegalArgumentException.class, () -> step.batch(0));
  }

  @Test
  void transformManyStartsTrackingForEveryChild() {
    RecordingProgressTracker tracker = new RecordingProgressTracker();
    PipelineContext ctx = singleWorkerContext().withProgressTracker(tracker).build();
    List<String> children = new CopyOnWriteArrayList<>();

    DataFlowPipeline.<String>create(ctx, s -> s)
        .fromIterable(List.of("doc-1"))
        .transformMany("Split", doc -> List.of(doc + "#0", doc + "#1", doc + "#2"), child -> child)
        .action("Collect", children::add)
        .complete();

    assertEquals(List.of("doc-1#0", "doc-1#1", "doc-1#2"), children);
    assertTrue(tracker.eventsFor("doc-1").contains("stepComplete:doc-1:Split"));
    assertFalse(tracker.eventsFor("doc-1").contains("complete:doc-1:COMPLETED"));
    for (String child : children) {
      List<String> events = tracker.eventsFor(child);
      assertEquals("start:" + child, events.get(0));
      assertTrue(events.contains("complete:" + child + ":COMPLETED"));
    }
  }

  @Test
  void transformManyFailureIsRecordedOnParent() {
    RecordingProgressTracker tracker = new RecordingProgressTracker();
    PipelineContext ctx = singleWorkerContext().withProgressTracker(tracker).build();
    List<String> children = new CopyOnWriteArrayList<>();

    DataFlowPipeline.<String>create(ctx, s -> s)
        .fromIterable(List.of("doc-1", "doc-2"))
        .transformMany("Split", doc -> {
          if (doc.equals("doc-2")) {
            throw new IllegalStateException("unreadable");
          }
          return List.of(doc + "#0");
        }, child -> child)
        .action("Collect", children::add)
        .complete();

    assertEquals(List.of("doc-1#0"), children);
    assertTrue(tracker.eventsFor("doc-2").contains("stepFailed:doc-2:Split:unreadable"));
    assertTrue(tracker.eventsFor("doc-2").contains("complete:doc-2:FAILED"));
  }

  @Test
  void completeWithExtractorMarksExtractedIds() {
    RecordingProgressTracker tracker = new RecordingProgressTracker();
    PipelineContext ctx = singleWorkerContext().withProgressTracker(tracker).build();

    DataFlowPipeline.<String>create(ctx, s -> s)
        .fromIterable(List.of("a", "b"))
        .transform("Wrap", s -> "out-" + s)
        .complete(value -> value);

    assertTrue(tracker.events().contains("complete:out-a:COMPLETED"));
    assertTrue(tracker.events().contains("complete:out-b:COMPLETED"));
    assertFalse(tracker.events().contains("complete:a:COMPLETED"));
  }

  @Test
  void completeManyMarksEveryExtractedId() {
    RecordingProgressTracker tracker = new RecordingProgressTracker();
    PipelineContext ctx = singleWorkerContext().withProgressTracker(tracker).build();

    DataFlowPipeline.<String>create(ctx, s -> s)
        .fromIterable(List.of("a", "b", "c"))
        .transform("Copy", s -> s)
        .batch(3)
        .completeMany(batch -> batch);

    List<String> completions = new ArrayList<>();
    for (String event : tracker.events()) {
      if (event.startsWith("complete:")) {
        completions.add(event);
      }
    }
    assertEquals(List.of("complete:a:COMPLETED", "complete:b:COMPLETED", "complete:c:COMPLETED"), completions);
  }

  @Test
  void resumeWithoutProgressServiceFailsBeforeAnyItem() {
    AtomicInteger loads = new AtomicInteger();
    PipelineContext ctx = singleWorkerContext()
        .withRunType(RunType.RETRY)
        .withParentRunId(UUID.randomUUID())
        .build();
    DataFlowPipeline<String> pipeline = DataFlowPipeline.create(ctx, s -> s);

    IllegalStateException error = assertThrows(IllegalStateException.class,
        () -> pipeline.fromRunType(PipelineSource.of("a"), ids -> {
          loads.incrementAndGet();
          return PipelineSource.fromIterable(ids);
        }));

    assertTrue(error.getMessage().contains("ProgressService"));
    assertEquals(0, loads.get());
  }

  @Test
  void resumeProcessesOnlyIncompleteResourcesOfParentRun() {
    InMemoryProgressService service = new InMemoryProgressService();
    UUID parent = UUID.randomUUID();
    Instant now = Instant.now();
    service.createRun(new CreateRunRequest(parent, "ingest", "default", RunType.FRESH, null));
    service.createResourceRunsBatch(parent, List.of(
        new ResourceStartUpdate("r1", "item", now),
        new ResourceStartUpdate("r2", "item", now),
        new ResourceStartUpdate("r3", "item", now),
        new ResourceStartUpdate("r4", "item", now)));
    service.completeResourceRunsBatch(parent, List.of(
        new ResourceCompletionUpdate("r1", ResourceStatus.COMPLETED, null, null, now),
        new ResourceCompletionUpdate("r2", ResourceStatus.FAILED, "boom", "Parse", now),
        new ResourceCompletionUpdate("r3", ResourceStatus.COMPLETED, null, null, now)));

    PipelineContext ctx = singleWorkerContext()
        .withRunType(RunType.RETRY)
        .withParentRunId(parent)
        .withProgressService(service)
        .build();
    List<Set<String>> requested = new CopyOnWriteArrayList<>();
    List<String> processed = new CopyOnWriteArrayList<>();

    DataFlowPipeline.<String>create(ctx, s -> s)
        .fromRunType(PipelineSource.of("r1", "r2", "r3", "r4"), ids -> {
          requested.add(ids);
          return PipelineSource.fromIterable(new TreeSet<>(ids));
        })
        .transform("Parse", s -> s)
        .action("Collect", processed::add)
        .complete();

    assertEquals(List.of(Set.of("r2", "r4")), requested);
    assertEquals(List.of("r2", "r4"), processed);
  }

  @Test
  void freshRunUsesFreshSourceEvenWithService() {
    PipelineContext ctx = singleWorkerContext().withProgressService(new InMemoryProgressService()).build();
    List<String> processed = new CopyOnWriteArrayList<>();

    DataFlowPipeline.<String>create(ctx, s -> s)
        .fromRunType(PipelineSource.of("a", "b"), ids -> {
          throw new AssertionError("loader must not run for fresh runs");
        })
        .transform("Copy", s -> s)
        .action("Collect", processed::add)
        .complete();

    assertEquals(List.of("a", "b"), processed);
  }

  @Test
  void stepHandlesCannotBeReused() {
    PipelineContext ctx = singleWorkerContext().build();
    DataFlowPipeline<String> pipeline = DataFlowPipeline.<String>create(ctx, s -> s).fromIterable(List.of("a"));
    StepBuilder<String, String> first = pipeline.transform("Upper", String::toUpperCase);
    StepBuilder<String, String> second = first.transform("Trim", String::trim);

    assertThrows(IllegalStateException.class, () -> first.transform("Again", String::trim));
    assertThrows(IllegalStateException.class, () -> pipeline.transform("Other", String::trim));

    second.complete();

    assertThrows(IllegalStateException.class, second::complete);
  }

  @Test
  void stagesRequireASource() {
    PipelineContext ctx = singleWorkerContext().build();
    DataFlowPipeline<String> pipeline = DataFlowPipeline.create(ctx, s -> s);

    assertThrows(IllegalStateException.class, () -> pipeline.transform("Copy", s -> s));
  }

  @Test
  void secondSourceIsRejected() {
    PipelineContext ctx = singleWorkerContext().build();
    DataFlowPipeline<String> pipeline = DataFlowPipeline.<String>create(ctx, s -> s).fromIterable(List.of("a"));

    assertThrows(IllegalStateException.class, () -> pipeline.fromIterable(List.of("b")));
  }

  @Test
  void collaboratorsFinalizedExactlyOnce() {
    RecordingProgressTracker tracker = new RecordingProgressTracker();
    RecordingArtifactBatcher batcher = new RecordingArtifactBatcher();
    PipelineContext ctx = singleWorkerContext()
        .withProgressTracker(tracker)
        .withArtifactBatcher(batcher)
        .build();

    DataFlowPipeline.<String>create(ctx, s -> s)
        .fromIterable(List.of("a", "b"))
        .transform("Copy", s -> s)
        .withArtifact()
        .complete();

    assertEquals(1, tracker.finalizeCalls.get());
    assertEquals(1, batcher.finalizeCalls.get());
    assertEquals(0, tracker.cancelCalls.get());
  }

  @Test
  void cancellationStopsRunAndCancelsTracker() {
    RecordingProgressTracker tracker = new RecordingProgressTracker();
    PipelineContext ctx = PipelineContext.builder("item")
        .withDefaultStepOptions(new StepOptions(1, 16))
        .withProgressTracker(tracker)
        .build();
    AtomicInteger seen = new AtomicInteger();
    AtomicBoolean streamClosed = new AtomicBoolean();

    StepBuilder<Integer, Integer> step = DataFlowPipeline.<Integer>create(ctx, String::valueOf)
        .fromStream(signal -> Stream.iterate(0, i -> i + 1).onClose(() -> streamClosed.set(true)))
        .transform("Copy", value -> value)
        .action("Watch", value -> {
          if (seen.incrementAndGet() == 3) {
            ctx.cancellation().cancel();
          }
        });

    assertThrows(CancellationException.class, step::complete);
    assertEquals(1, tracker.cancelCalls.get());
    assertEquals(1, tracker.finalizeCalls.get());
    assertTrue(streamClosed.get());
  }

  @Test
  void sourceFailureSurfacesAsExecutionException() {
    RecordingProgressTracker tracker = new RecordingProgressTracker();
    PipelineContext ctx = singleWorkerContext().withProgressTracker(tracker).build();

    StepBuilder<String, String> step = DataFlowPipeline.<String>create(ctx, s -> s)
        .fromSupplier(() -> {
          throw new IllegalStateException("database unavailable");
        })
        .transform("Copy", s -> s);

    PipelineExecutionException error = assertThrows(PipelineExecutionException.class, step::complete);
    assertInstanceOf(IllegalStateException.class, error.getCause());
    assertEquals("database unavailable", error.getCause().getMessage());
    assertEquals(1, tracker.finalizeCalls.get());
  }

  @Test
  void trackerFailuresDoNotChangeOutcome() {
    ProgressTracker broken = new RecordingProgressTracker() {
      @Override
      public synchronized void recordStepStart(List<String> resourceIds, String stepName) {
        throw new IllegalStateException("tracker down");
      }
    };
    PipelineContext ctx = singleWorkerContext().withProgressTracker(broken).build();
    List<String> seen = new CopyOnWriteArrayList<>();

    DataFlowPipeline.<String>create(ctx, s -> s)
        .fromIterable(List.of("a", "b"))
        .transform("Copy", s -> s)
        .action("Collect", seen::add)
        .complete();

    assertEquals(List.of("a", "b"), seen);
  }

  @Test
  void stepMetricsAreReported() {
    CountingMetrics metrics = new CountingMetrics();
    PipelineContext ctx = singleWorkerContext().withMetrics(metrics).build();

    DataFlowPipeline.<Integer>create(ctx, String::valueOf)
        .fromIterable(List.of(1, 2, 3))
        .transform("Check", value -> {
          if (value == 3) {
            throw new IllegalArgumentException("odd one out");
          }
          return value;
        })
        .complete();

    assertEquals(2L, metrics.count("pipeline.step.Check.success"));
    assertEquals(1L, metrics.count("pipeline.step.Check.failure"));
    assertEquals(2L, metrics.count("pipeline.complete.success"));
    assertEquals(1L, metrics.count("pipeline.complete.failure"));
  }

  @Test
  void unboundedParallelismProcessesEveryItem() {
    PipelineContext ctx = PipelineContext.builder("item").build();
    Set<Integer> seen = ConcurrentHashMap.newKeySet();
    List<Integer> input = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      input.add(i);
    }

    DataFlowPipeline.<Integer>create(ctx, String::valueOf)
        .fromIterable(input)
        .transform("Square", value -> value * value)
        .action("Collect", seen::add)
        .complete();

    assertEquals(200, seen.size());
    assertTrue(seen.contains(199 * 199));
  }

  @Test
  void unboundedParallelismStaysWithinElasticPoolLimit() {
    PipelineContext ctx = PipelineContext.builder("item").build();
    int limit = ExecutorFactories.ELASTIC_POOL_LIMIT;
    AtomicInteger active = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    Set<String> workerThreads = ConcurrentHashMap.newKeySet();
    Set<Integer> seen = ConcurrentHashMap.newKeySet();
    List<Integer> input = new ArrayList<>();
    for (int i = 0; i < limit * 3; i++) {
      input.add(i);
    }

    DataFlowPipeline.<Integer>create(ctx, String::valueOf)
        .fromIterable(input)
        .transform("Slow", value -> {
          int now = active.incrementAndGet();
          peak.accumulateAndGet(now, Math::max);
          workerThreads.add(Thread.currentThread().getName());
          try {
            Thread.sleep(15);
          } finally {
            active.decrementAndGet();
          }
          return value;
        })
        .action("Collect", seen::add)
        .complete();

    assertEquals(limit * 3, seen.size());
    assertTrue(peak.get() <= limit, "peak " + peak.get() + " above " + limit);
    assertTrue(peak.get() > 1, "unbounded stage ran serially");
    assertTrue(workerThreads.size() <= limit, "threads " + workerThreads.size() + " above " + limit);
  }

  private static PipelineContext.Builder singleWorkerContext() {
    return PipelineContext.builder("item").withName("test-pipeline").withDefaultMaxParallelism(1);
  }

  private static final class CountingMetrics implements MetricsPort {
    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    @Override
    public void increment(String key) {
      counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public void observe(String key, long value) {
      counters.computeIfAbsent(key + ".observations", k -> new AtomicLong()).incrementAndGet();
    }

    long count(String key) {
      AtomicLong counter = counters.get(key);
      return counter == null ? 0L : counter.get();
    }
  }
}
