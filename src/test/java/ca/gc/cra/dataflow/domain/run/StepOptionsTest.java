package ca.gc.cra.dataflow.domain.run;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class StepOptionsTest {

  @Test
  void defaultIsUnbounded() {
    assertTrue(StepOptions.DEFAULT.unboundedParallelism());
    assertTrue(StepOptions.DEFAULT.unboundedCapacity());
  }

  @Test
  void parallelismKeepsUnboundedCapacity() {
    StepOptions options = StepOptions.parallelism(3);

    assertEquals(3, options.maxParallelism());
    assertFalse(options.unboundedParallelism());
    assertTrue(options.unboundedCapacity());
    assertEquals(10, options.withBoundedCapacity(10).boundedCapacity());
  }

  @Test
  void rejectsNonPositiveLimits() {
    assertThrows(IllegalArgumentException.class, () -> new StepOptions(0, StepOptions.UNBOUNDED));
    assertThrows(IllegalArgumentException.class, () -> new StepOptions(1, -5));
  }

  @Test
  void runMetadataDefaultsAndReferenceRun() {
    UUID runId = UUID.randomUUID();
    UUID parent = UUID.randomUUID();

    RunMetadata fresh = new RunMetadata(runId, "p", "c", null, null);
    RunMetadata retry = new RunMetadata(runId, "p", "c", RunType.RETRY, parent);

    assertEquals(RunType.FRESH, fresh.runType());
    assertEquals(runId, fresh.referenceRunId());
    assertEquals(parent, retry.referenceRunId());
    assertEquals(parent, retry.toCreateRunRequest().parentRunId());
  }

  @Test
  void artifactRequestDefaultsToS3() {
    ArtifactSaveRequest request = new ArtifactSaveRequest(UUID.randomUUID(), "step", "name", "data", null, null);

    assertEquals(ArtifactStorageType.S3, request.storageType());
    assertTrue(request.createdAt() != null);
  }

  @Test
  void resourceStatusIncompleteness() {
    assertTrue(ResourceStatus.FAILED.isIncomplete());
    assertTrue(ResourceStatus.PROCESSING.isIncomplete());
    assertFalse(ResourceStatus.COMPLETED.isIncomplete());
  }
}
