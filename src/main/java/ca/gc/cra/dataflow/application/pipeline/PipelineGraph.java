package ca.gc.cra.dataflow.application.pipeline;

import ca.gc.cra.dataflow.application.port.ArtifactBatcher;
import ca.gc.cra.dataflow.application.port.ProgressTracker;
import ca.gc.cra.dataflow.domain.run.StepOptions;
import ca.gc.cra.dataflow.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Owns the queues, stage runners and source thread of one run and drives them from {@code complete}.
 *
 * <p>Stages are registered while the fluent chain is built and only started once the terminal drain begins.
 * An infrastructure failure (a source throwing, a worker dying) is recorded and fires the internal halt signal,
 * which unblocks every queue so the run unwinds.</p>
 */
final class PipelineGraph {
  private static final Logger log = LoggerFactory.getLogger(PipelineGraph.class);
  private static final long SOURCE_JOIN_MILLIS = 5_000L;
  static final String MDC_PIPELINE = "pipeline";
  static final String MDC_RUN_ID = "runId";

  private final PipelineContext context;
  private final CancellationSignal halt;
  private final AtomicReference<Throwable> failure = new AtomicReference<>();
  private final List<StageRunner<?, ?>> runners = new ArrayList<>();
  private final List<StageRunner<?, ?>> artifactRunners = new ArrayList<>();
  private final Map<String, String> mdc;
  private final String threadPrefix;
  private final AtomicBoolean started = new AtomicBoolean();
  private Thread sourceThread;
  private Runnable sourceTask;

  PipelineGraph(PipelineContext context) {
    this.context = Objects.requireNonNull(context, "context");
    this.halt = context.cancellation().newChild();
    this.mdc = Map.of(
        MDC_PIPELINE, context.name() == null ? "pipeline" : context.name(),
        MDC_RUN_ID, context.runId().toString());
    this.threadPrefix = "df-" + sanitize(context.name());
  }

  PipelineContext context() {
    return context;
  }

  /**
   * Creates the queue that the source fills and binds the producer that fills it.
   */
  <T> StageQueue<T> bindSource(ItemProducer<T> producer, String description) {
    Objects.requireNonNull(producer, "producer");
    ensureNotStarted();
    if (sourceTask != null) {
      throw new IllegalStateException("A source is already attached");
    }
    StageQueue<T> queue = StageQueue.create("source", context.defaultStepOptions().boundedCapacity(), halt);
    sourceTask = () -> pumpSource(producer, queue, description);
    return queue;
  }

  /**
   * Registers a stage fed by {@code inbox}; returns the stage's outbox.
   */
  <I, O> StageQueue<O> attach(Stage<I, O> stage, StageQueue<I> inbox, StepOptions options) {
    ensureNotStarted();
    StageQueue<O> outbox = StageQueue.create(stage.name(), options.boundedCapacity(), halt);
    runners.add(newRunner(stage, inbox, outbox, options));
    return outbox;
  }

  /**
   * Inserts an artifact side-channel after {@code inbox}: a fan-out stage feeding an unbounded main buffer and an
   * unbounded side buffer consumed by persistence workers. Returns the main buffer.
   */
  <T> StageQueue<T> attachArtifactTap(StageQueue<T> inbox, Stage<T, Void> capture, int persistenceWorkers) {
    ensureNotStarted();
    StageQueue<T> side = StageQueue.unbounded(capture.name() + "-buffer", halt);
    StageQueue<T> main = StageQueue.unbounded(capture.name() + "-main", halt);
    FanOutStage<T> fanOut = new FanOutStage<>(capture.name() + "-fanout", side);
    runners.add(newRunner(fanOut, inbox, main, StepOptions.parallelism(1)));
    StageQueue<Void> discard = StageQueue.unbounded(capture.name() + "-done", halt);
    artifactRunners.add(newRunner(capture, side, discard, StepOptions.parallelism(persistenceWorkers)));
    return main;
  }

  /**
   * Starts everything, drains {@code tail} on the calling thread, waits for artifact persistence and finalizes the
   * collaborators exactly once.
   *
   * @throws PipelineExecutionException if the infrastructure failed
   * @throws CancellationException if the run was cancelled
   */
  <R> void run(StageQueue<R> tail, TerminalHandler<R> handler) {
    if (sourceTask == null) {
      throw new IllegalStateException("No source attached");
    }
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Pipeline already completed");
    }
    mdc.forEach(MDC::put);
    boolean interrupted = false;
    long drained = 0;
    try {
      log.info("Starting pipeline {} run {} with {} stages", context.name(), context.runId(), runners.size());
      startAll();
      try {
        R item;
        while ((item = tail.next()) != null) {
          handler.accept(item);
          drained++;
        }
        for (StageRunner<?, ?> runner : artifactRunners) {
          runner.awaitCompletion();
        }
      } catch (CancellationException ex) {
        log.debug("Pipeline {} drain halted", context.name());
      } catch (InterruptedException ex) {
        interrupted = true;
        halt.cancel();
      } catch (RuntimeException ex) {
        fail(ex);
      }
    } finally {
      stopAll();
      finalizeCollaborators();
      context.close();
      log.info("Pipeline {} run {} drained {} results", context.name(), context.runId(), drained);
      MDC.remove(MDC_PIPELINE);
      MDC.remove(MDC_RUN_ID);
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }

    Throwable error = failure.get();
    if (error != null) {
      throw new PipelineExecutionException("Pipeline " + context.name() + " run " + context.runId() + " failed",
          error);
    }
    if (interrupted || context.cancellation().isCancelled()) {
      throw new CancellationException("Pipeline " + context.name() + " run " + context.runId() + " cancelled");
    }
  }

  void fail(Throwable error) {
    if (failure.compareAndSet(null, error)) {
      log.error("Pipeline {} run {} failed; halting", context.name(), context.runId(), error);
    } else {
      Throwable first = failure.get();
      if (first != error) {
        first.addSuppressed(error);
      }
    }
    halt.cancel();
  }

  private <I, O> StageRunner<I, O> newRunner(
      Stage<I, O> stage, StageQueue<I> inbox, StageQueue<O> outbox, StepOptions options) {
    return new StageRunner<>(stage, inbox, outbox, options, halt, this::fail,
        threadPrefix + "-" + sanitize(stage.name()), mdc);
  }

  private void startAll() {
    for (StageRunner<?, ?> runner : artifactRunners) {
      runner.start();
    }
    for (StageRunner<?, ?> runner : runners) {
      runner.start();
    }
    sourceThread = ExecutorFactories.newThread(threadPrefix + "-source", sourceTask, (thread, ex) -> fail(ex));
    sourceThread.start();
  }

  private void stopAll() {
    if (sourceThread != null) {
      try {
        sourceThread.join(SOURCE_JOIN_MILLIS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      if (sourceThread.isAlive()) {
        log.warn("Source thread of pipeline {} still running; interrupting", context.name());
        sourceThread.interrupt();
      }
    }
    for (StageRunner<?, ?> runner : runners) {
      runner.stop();
    }
    for (StageRunner<?, ?> runner : artifactRunners) {
      runner.stop();
    }
  }

  private void finalizeCollaborators() {
    boolean cancelled = context.cancellation().isCancelled();
    ProgressTracker tracker = context.progressTracker().orElse(null);
    if (tracker != null && context.claimTrackerFinalization()) {
      try {
        if (cancelled) {
          tracker.cancel();
        }
        tracker.finalizeTracking();
      } catch (RuntimeException ex) {
        if (cancelled) {
          log.warn("Progress tracker finalization failed after cancellation", ex);
        } else {
          fail(ex);
        }
      }
    }
    ArtifactBatcher batcher = context.artifactBatcher().orElse(null);
    if (batcher != null && context.claimBatcherFinalization()) {
      try {
        batcher.finalizeBatcher();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while finalizing artifact batcher");
      } catch (Exception ex) {
        if (cancelled) {
          log.warn("Artifact batcher finalization failed after cancellation", ex);
        } else {
          fail(ex);
        }
      }
    }
  }

  private <T> void pumpSource(ItemProducer<T> producer, StageQueue<T> queue, String description) {
    mdc.forEach(MDC::put);
    long[] produced = new long[1];
    try {
      producer.produce(item -> {
        queue.put(Objects.requireNonNull(item, "source produced a null item"));
        produced[0]++;
      });
      log.debug("Source {} of pipeline {} produced {} items", description, context.name(), produced[0]);
    } catch (CancellationException ex) {
      log.debug("Source {} of pipeline {} halted", description, context.name());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("Source {} of pipeline {} interrupted", description, context.name());
    } catch (Exception ex) {
      fail(ex);
    } finally {
      queue.complete();
      MDC.clear();
    }
  }

  private void ensureNotStarted() {
    if (started.get()) {
      throw new IllegalStateException("Pipeline already completed; the graph can no longer be extended");
    }
  }

  private static String sanitize(String name) {
    if (name == null || name.isBlank()) {
      return "pipeline";
    }
    return name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "_");
  }

  /**
   * Consumer of drained results.
   *
   * @param <R> result type
   */
  @FunctionalInterface
  interface TerminalHandler<R> {
    void accept(R result);
  }
}
