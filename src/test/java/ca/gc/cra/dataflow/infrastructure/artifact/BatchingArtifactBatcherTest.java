package ca.gc.cra.dataflow.infrastructure.artifact;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dataflow.application.pipeline.CancellationSignal;
import ca.gc.cra.dataflow.application.port.ArtifactBatcher;
import ca.gc.cra.dataflow.application.port.ArtifactStoragePort;
import ca.gc.cra.dataflow.application.port.MetricsPort;
import ca.gc.cra.dataflow.domain.run.ArtifactSaveRequest;
import ca.gc.cra.dataflow.domain.run.ArtifactSaveResult;
import ca.gc.cra.dataflow.domain.run.ArtifactStorageType;
import ca.gc.cra.dataflow.domain.run.RunMetadata;
import ca.gc.cra.dataflow.domain.run.RunType;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;

class BatchingArtifactBatcherTest {
  private final UUID runId = UUID.randomUUID();

  @Test
  void fullBatchesFlushAndFinalizeWritesRemainder() throws Exception {
    RecordingStorage storage = new RecordingStorage(null);
    CountingMetrics metrics = new CountingMetrics();
    BatchingArtifactBatcher batcher =
        new BatchingArtifactBatcher(storage, runId, 3, Duration.ofSeconds(30), null, metrics);

    for (int i = 0; i < 7; i++) {
      batcher.queueArtifactSave(request("a" + i));
    }
    batcher.finalizeBatcher();

    assertEquals(List.of(3, 3, 1), storage.batchSizes);
    assertEquals(7L, batcher.savedCount());
    assertEquals(0L, batcher.failedCount());
    assertEquals(0, batcher.pendingCount());
    assertEquals(7, metrics.queued.size());
  }

  @Test
  void staleBatchFlushesBeforeFinalize() throws Exception {
    RecordingStorage storage = new RecordingStorage(null);
    BatchingArtifactBatcher batcher =
        new BatchingArtifactBatcher(storage, runId, 100, Duration.ofMillis(50), null, MetricsPort.NO_OP);

    batcher.queueArtifactSave(request("a"));
    batcher.queueArtifactSave(request("b"));
    long deadline = System.currentTimeMillis() + 5_000;
    while (batcher.savedCount() < 2 && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }

    assertEquals(2L, batcher.savedCount());
    batcher.finalizeBatcher();
  }

  @Test
  void storageFailuresAreCountedNotThrown() throws Exception {
    RecordingStorage storage = new RecordingStorage("broken");
    BatchingArtifactBatcher batcher =
        new BatchingArtifactBatcher(storage, runId, 10, Duration.ofSeconds(30), null, MetricsPort.NO_OP);

    batcher.queueArtifactSave(request("ok"));
    batcher.queueArtifactSave(request("broken"));
    batcher.finalizeBatcher();

    assertEquals(1L, batcher.savedCount());
    assertEquals(1L, batcher.failedCount());
  }

  @Test
  void batchLevelStorageErrorFailsWholeBatch() throws Exception {
    ArtifactStoragePort storage = new ArtifactStoragePort() {
      @Override
      public ArtifactSaveResult save(ArtifactSaveRequest request) {
        throw new UnsupportedOperationException();
      }

      @Override
      public List<ArtifactSaveResult> saveBatch(List<ArtifactSaveRequest> requests) {
        throw new IllegalStateException("bucket offline");
      }
    };
    BatchingArtifactBatcher batcher =
        new BatchingArtifactBatcher(storage, runId, 10, Duration.ofSeconds(30), null, MetricsPort.NO_OP);

    batcher.queueArtifactSave(request("a"));
    batcher.queueArtifactSave(request("b"));
    batcher.finalizeBatcher();

    assertEquals(0L, batcher.savedCount());
    assertEquals(2L, batcher.failedCount());
  }

  @Test
  void queueAfterFinalizeIsRejectedAndFinalizeIsIdempotent() throws Exception {
    BatchingArtifactBatcher batcher = new BatchingArtifactBatcher(
        new RecordingStorage(null), runId, 10, Duration.ofSeconds(1), null, MetricsPort.NO_OP);

    batcher.finalizeBatcher();
    batcher.finalizeBatcher();

    assertThrows(IllegalStateException.class, () -> batcher.queueArtifactSave(request("late")));
  }

  @Test
  void cancelledRunDropsQueuedArtifacts() throws Exception {
    RecordingStorage storage = new RecordingStorage(null);
    CancellationSignal cancellation = new CancellationSignal();
    cancellation.cancel();
    BatchingArtifactBatcher batcher =
        new BatchingArtifactBatcher(storage, runId, 10, Duration.ofSeconds(30), cancellation, MetricsPort.NO_OP);

    batcher.queueArtifactSave(request("a"));
    batcher.finalizeBatcher();

    assertEquals(0L, batcher.savedCount());
    assertTrue(storage.batchSizes.isEmpty());
  }

  @Test
  void rejectsInvalidSettings() {
    RecordingStorage storage = new RecordingStorage(null);

    assertThrows(IllegalArgumentException.class,
        () -> new BatchingArtifactBatcher(storage, runId, 0, Duration.ofSeconds(1), null, null));
    assertThrows(IllegalArgumentException.class,
        () -> new BatchingArtifactBatcher(storage, runId, 1, Duration.ZERO, null, null));
  }

  @Test
  void factoryCreatesBatcherForRun() throws Exception {
    RecordingStorage storage = new RecordingStorage(null);
    BatchingArtifactBatcherFactory factory = new BatchingArtifactBatcherFactory(storage);
    RunMetadata metadata = new RunMetadata(runId, "ingest", "nightly", RunType.FRESH, null);

    ArtifactBatcher batcher = factory.create(metadata, new CancellationSignal());
    batcher.queueArtifactSave(request("a"));
    batcher.finalizeBatcher();

    assertInstanceOf(BatchingArtifactBatcher.class, batcher);
    assertEquals(List.of(1), storage.batchSizes);
  }

  private static ArtifactSaveRequest request(String name) {
    return ArtifactSaveRequest.of(UUID.randomUUID(), "Parse", name, name.toUpperCase(), ArtifactStorageType.MEMORY);
  }

  private static final class RecordingStorage implements ArtifactStoragePort {
    private final String failOn;
    final List<Integer> batchSizes = new CopyOnWriteArrayList<>();

    RecordingStorage(String failOn) {
      this.failOn = failOn;
    }

    @Override
    public ArtifactSaveResult save(ArtifactSaveRequest request) {
      if (request.artifactName().equals(failOn)) {
        throw new IllegalStateException("write refused");
      }
      return ArtifactSaveResult.stored(request, "test://" + request.artifactName());
    }

    @Override
    public List<ArtifactSaveResult> saveBatch(List<ArtifactSaveRequest> requests) {
      batchSizes.add(requests.size());
      return ArtifactStoragePort.super.saveBatch(requests);
    }
  }

  private static final class CountingMetrics implements MetricsPort {
    final List<String> queued = new CopyOnWriteArrayList<>();

    @Override
    public void increment(String key) {
      if (key.equals("artifact.batcher.queued")) {
        queued.add(key);
      }
    }

    @Override
    public void observe(String key, long value) {}
  }
}
