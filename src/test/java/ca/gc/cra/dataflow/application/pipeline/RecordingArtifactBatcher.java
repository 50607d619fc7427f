package ca.gc.cra.dataflow.application.pipeline;

import ca.gc.cra.dataflow.application.port.ArtifactBatcher;
import ca.gc.cra.dataflow.domain.run.ArtifactSaveRequest;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Batcher stub that keeps queued requests, optionally sleeping per request to simulate slow storage.
 */
class RecordingArtifactBatcher implements ArtifactBatcher {
  private final List<ArtifactSaveRequest> requests = new CopyOnWriteArrayList<>();
  private final long delayMillis;
  private final String failOnName;
  final AtomicInteger finalizeCalls = new AtomicInteger();
  volatile int queuedBeforeFinalize = -1;

  RecordingArtifactBatcher() {
    this(0L, null);
  }

  RecordingArtifactBatcher(long delayMillis, String failOnName) {
    this.delayMillis = delayMillis;
    this.failOnName = failOnName;
  }

  @Override
  public void queueArtifactSave(ArtifactSaveRequest request) throws Exception {
    if (delayMillis > 0) {
      Thread.sleep(delayMillis);
    }
    if (failOnName != null && failOnName.equals(request.artifactName())) {
      throw new IllegalStateException("storage unavailable");
    }
    requests.add(request);
  }

  @Override
  public void finalizeBatcher() {
    queuedBeforeFinalize = requests.size();
    finalizeCalls.incrementAndGet();
  }

  List<ArtifactSaveRequest> requests() {
    return List.copyOf(requests);
  }
}
