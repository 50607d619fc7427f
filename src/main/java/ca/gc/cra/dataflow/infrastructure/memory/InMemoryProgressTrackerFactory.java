package ca.gc.cra.dataflow.infrastructure.memory;

import ca.gc.cra.dataflow.application.pipeline.CancellationSignal;
import ca.gc.cra.dataflow.application.port.ProgressTracker;
import ca.gc.cra.dataflow.application.port.ProgressTrackerFactory;
import ca.gc.cra.dataflow.domain.run.RunMetadata;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Creates an {@link InMemoryProgressTracker} per run and keeps it reachable by run id.
 *
 * @since 0.1.0
 */
public final class InMemoryProgressTrackerFactory implements ProgressTrackerFactory {
  private final ConcurrentMap<UUID, InMemoryProgressTracker> trackers = new ConcurrentHashMap<>();

  @Override
  public ProgressTracker create(RunMetadata metadata, CancellationSignal cancellation) {
    return trackers.computeIfAbsent(metadata.runId(), InMemoryProgressTracker::new);
  }

  public Optional<InMemoryProgressTracker> tracker(UUID runId) {
    return Optional.ofNullable(trackers.get(runId));
  }
}
