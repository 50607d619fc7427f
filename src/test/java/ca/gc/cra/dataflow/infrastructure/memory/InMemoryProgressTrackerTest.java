package ca.gc.cra.dataflow.infrastructure.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dataflow.domain.run.PipelineSnapshot;
import ca.gc.cra.dataflow.domain.run.ResourceProgress;
import ca.gc.cra.dataflow.domain.run.ResourceStatus;
import ca.gc.cra.dataflow.domain.run.StepStatus;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class InMemoryProgressTrackerTest {
  private final UUID runId = UUID.randomUUID();

  @Test
  void snapshotCountsTerminalStatuses() {
    InMemoryProgressTracker tracker = new InMemoryProgressTracker(runId);
    tracker.recordResourceStart("a", "doc");
    tracker.recordResourceStart("b", "doc");
    tracker.recordResourceStart("c", "doc");
    tracker.recordResourceComplete("a", ResourceStatus.COMPLETED);
    tracker.recordResourceComplete("b", ResourceStatus.FAILED, "boom", "Parse");

    PipelineSnapshot snapshot = tracker.getPipelineSnapshot();

    assertEquals(runId, snapshot.runId());
    assertEquals(3, snapshot.totalResources());
    assertEquals(1, snapshot.completedResources());
    assertEquals(1, snapshot.failedResources());
    assertEquals(1, snapshot.processingResources());
  }

  @Test
  void stepEventsKeepLatestStatusPerStep() {
    InMemoryProgressTracker tracker = new InMemoryProgressTracker(runId);
    tracker.recordResourceStart("a", "doc");
    tracker.recordStepStart(List.of("a"), "Parse");
    tracker.recordStepComplete(List.of("a"), "Parse", 12L);
    tracker.recordStepStart(List.of("a"), "Enrich");
    tracker.recordStepFailed(List.of("a"), "Enrich", 3L, "lookup failed");

    ResourceProgress progress = tracker.resource("a").orElseThrow();

    assertEquals(2, progress.steps().size());
    assertEquals("Parse", progress.steps().get(0).stepName());
    assertEquals(StepStatus.COMPLETED, progress.steps().get(0).status());
    assertEquals(12L, progress.steps().get(0).durationMs());
    assertEquals(StepStatus.FAILED, progress.steps().get(1).status());
    assertEquals("lookup failed", progress.steps().get(1).errorMessage());
  }

  @Test
  void onlyFirstTerminalTransitionCounts() {
    InMemoryProgressTracker tracker = new InMemoryProgressTracker(runId);
    tracker.recordResourceStart("a", "doc");
    tracker.recordResourceComplete("a", ResourceStatus.FAILED, "boom", "Parse");
    tracker.recordResourceComplete("a", ResourceStatus.COMPLETED);

    PipelineSnapshot snapshot = tracker.getPipelineSnapshot();
    ResourceProgress progress = tracker.resource("a").orElseThrow();

    assertEquals(0, snapshot.completedResources());
    assertEquals(1, snapshot.failedResources());
    assertEquals(ResourceStatus.FAILED, progress.status());
    assertEquals("Parse", progress.failedStep());
    assertEquals("boom", progress.errorMessage());
  }

  @Test
  void eventsForUnknownResourcesAreIgnored() {
    InMemoryProgressTracker tracker = new InMemoryProgressTracker(runId);

    tracker.recordStepStart(List.of("ghost"), "Parse");
    tracker.recordResourceComplete("ghost", ResourceStatus.COMPLETED);

    assertTrue(tracker.resource("ghost").isEmpty());
    assertEquals(0, tracker.getPipelineSnapshot().totalResources());
  }

  @Test
  void repeatedStartKeepsExistingState() {
    InMemoryProgressTracker tracker = new InMemoryProgressTracker(runId);
    tracker.recordResourceStart("a", "doc");
    tracker.recordStepStart(List.of("a"), "Parse");
    tracker.recordResourceStart("a", "doc");

    assertEquals(1, tracker.resource("a").orElseThrow().steps().size());
  }

  @Test
  void finalizeAndCancelAreRecorded() {
    InMemoryProgressTracker tracker = new InMemoryProgressTracker(runId);
    assertFalse(tracker.isCancelled());

    tracker.cancel();
    tracker.finalizeTracking();

    assertTrue(tracker.isCancelled());
    assertEquals(1, tracker.finalizeCount());
  }
}
