package ca.gc.cra.dataflow.infrastructure.memory;

import ca.gc.cra.dataflow.application.port.ProgressService;
import ca.gc.cra.dataflow.domain.run.CreateRunRequest;
import ca.gc.cra.dataflow.domain.run.PipelineRun;
import ca.gc.cra.dataflow.domain.run.ResourceCompletionUpdate;
import ca.gc.cra.dataflow.domain.run.ResourceProgress;
import ca.gc.cra.dataflow.domain.run.ResourceStartUpdate;
import ca.gc.cra.dataflow.domain.run.ResourceStatus;
import ca.gc.cra.dataflow.domain.run.RunStatus;
import ca.gc.cra.dataflow.domain.run.StepProgress;
import ca.gc.cra.dataflow.domain.run.StepProgressUpdate;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ProgressService} that keeps run and resource records in process memory.
 * <p><strong>Why:</strong> Lets retry and continuation runs be exercised without a database; a later run in the
 * same process can ask which resources of an earlier run never completed.</p>
 * <p><strong>Thread-safety:</strong> Runs are held in a concurrent map; each run record is guarded by its own
 * monitor.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryProgressService implements ProgressService {
  private static final Logger log = LoggerFactory.getLogger(InMemoryProgressService.class);

  private final ConcurrentMap<UUID, RunRecord> runs = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryProgressService() {
    this(Clock.systemUTC());
  }

  public InMemoryProgressService(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public PipelineRun createRun(CreateRunRequest request) {
    Objects.requireNonNull(request, "request");
    RunRecord record = runs.computeIfAbsent(request.runId(), id -> new RunRecord(new PipelineRun(
        id, request.name(), request.category(), request.runType(), request.parentRunId(),
        RunStatus.RUNNING, clock.instant(), null)));
    log.debug("Run {} registered ({})", request.runId(), request.runType());
    return record.run();
  }

  @Override
  public void completeRun(UUID runId, RunStatus status) {
    RunRecord record = runs.get(runId);
    if (record == null) {
      log.warn("Cannot complete unknown run {}", runId);
      return;
    }
    record.complete(status, clock.instant());
  }

  @Override
  public Set<String> getIncompleteResourceIds(UUID runId) {
    RunRecord record = runs.get(runId);
    if (record == null) {
      log.warn("No records for run {}; nothing to resume", runId);
      return Set.of();
    }
    return record.incompleteIds();
  }

  @Override
  public void createResourceRunsBatch(UUID runId, List<ResourceStartUpdate> updates) {
    RunRecord record = require(runId);
    for (ResourceStartUpdate update : updates) {
      record.start(update.resourceId(), update.resourceType());
    }
  }

  @Override
  public List<StepProgressUpdate> updateStepProgressBatch(UUID runId, List<StepProgressUpdate> updates) {
    RunRecord record = require(runId);
    List<StepProgressUpdate> deferred = new ArrayList<>();
    for (StepProgressUpdate update : updates) {
      if (!record.step(update)) {
        deferred.add(update);
      }
    }
    return deferred;
  }

  @Override
  public void completeResourceRunsBatch(UUID runId, List<ResourceCompletionUpdate> updates) {
    RunRecord record = require(runId);
    for (ResourceCompletionUpdate update : updates) {
      record.completeResource(update);
    }
  }

  /**
   * Looks up a run.
   *
   * @param runId run identifier
   * @return run, if registered
   */
  public Optional<PipelineRun> run(UUID runId) {
    RunRecord record = runs.get(runId);
    return record == null ? Optional.empty() : Optional.of(record.run());
  }

  /**
   * Returns the recorded progress of every resource in a run.
   *
   * @param runId run identifier
   * @return resource progress in start order; empty if the run is unknown
   */
  public List<ResourceProgress> resources(UUID runId) {
    RunRecord record = runs.get(runId);
    return record == null ? List.of() : record.resources();
  }

  private RunRecord require(UUID runId) {
    RunRecord record = runs.get(runId);
    if (record == null) {
      throw new IllegalStateException("Run " + runId + " has not been created");
    }
    return record;
  }

  private static final class RunRecord {
    private PipelineRun run;
    private final Map<String, ResourceRecord> resources = new LinkedHashMap<>();

    RunRecord(PipelineRun run) {
      this.run = run;
    }

    synchronized PipelineRun run() {
      return run;
    }

    synchronized void complete(RunStatus status, Instant at) {
      run = run.complete(status, at);
    }

    synchronized void start(String resourceId, String resourceType) {
      ResourceRecord existing = resources.get(resourceId);
      if (existing == null) {
        resources.put(resourceId, new ResourceRecord(resourceId, resourceType));
      } else {
        existing.status = ResourceStatus.PROCESSING;
        existing.errorMessage = null;
        existing.failedStep = null;
      }
    }

    synchronized boolean step(StepProgressUpdate update) {
      ResourceRecord resource = resources.get(update.resourceId());
      if (resource == null) {
        return false;
      }
      resource.steps.put(update.stepName(), new StepProgress(
          update.stepName(), update.status(), update.durationMs(), update.errorMessage()));
      return true;
    }

    synchronized void completeResource(ResourceCompletionUpdate update) {
      ResourceRecord resource = resources.get(update.resourceId());
      if (resource == null) {
        log.debug("Completion for unknown resource {} ignored", update.resourceId());
        return;
      }
      resource.status = update.status();
      resource.errorMessage = update.errorMessage();
      resource.failedStep = update.failedStep();
    }

    synchronized Set<String> incompleteIds() {
      Set<String> ids = new LinkedHashSet<>();
      resources.values().stream()
          .filter(r -> r.status.isIncomplete())
          .forEach(r -> ids.add(r.resourceId));
      return Collections.unmodifiableSet(ids);
    }

    synchronized List<ResourceProgress> resources() {
      List<ResourceProgress> out = new ArrayList<>(resources.size());
      for (ResourceRecord r : resources.values()) {
        out.add(new ResourceProgress(r.resourceId, r.resourceType, r.status,
            new ArrayList<>(r.steps.values()), r.errorMessage, r.failedStep));
      }
      return out;
    }
  }

  private static final class ResourceRecord {
    private final String resourceId;
    private final String resourceType;
    private final Map<String, StepProgress> steps = new LinkedHashMap<>();
    private ResourceStatus status = ResourceStatus.PROCESSING;
    private String errorMessage;
    private String failedStep;

    ResourceRecord(String resourceId, String resourceType) {
      this.resourceId = resourceId;
      this.resourceType = resourceType;
    }
  }
}
