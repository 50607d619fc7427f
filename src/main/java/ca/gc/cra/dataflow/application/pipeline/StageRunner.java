package ca.gc.cra.dataflow.application.pipeline;

import ca.gc.cra.dataflow.domain.run.StepOptions;
import ca.gc.cra.dataflow.infrastructure.exec.ExecutorFactories;
import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs one {@link Stage} between its inbox and outbox.
 *
 * <p>A bounded worker count starts that many long-lived worker loops, all pulling from the inbox. An unbounded
 * worker count starts a dispatcher that hands every item to an elastic pool; the dispatcher stops taking input
 * while {@link ExecutorFactories#ELASTIC_POOL_LIMIT} items are in flight, so the pool never outgrows that ceiling.
 * In both modes the outbox is completed exactly once, after the last input has been processed and
 * {@link Stage#onUpstreamComplete} has run.</p>
 */
final class StageRunner<I, O> {
  private static final Logger log = LoggerFactory.getLogger(StageRunner.class);
  private static final long SHUTDOWN_TIMEOUT_MILLIS = 5_000L;

  private final Stage<I, O> stage;
  private final StageQueue<I> inbox;
  private final StageQueue<O> outbox;
  private final int workers;
  private final CancellationSignal halt;
  private final Consumer<Throwable> failureSink;
  private final String threadPrefix;
  private final Map<String, String> mdc;
  private final AtomicInteger remainingWorkers = new AtomicInteger();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean finished = new AtomicBoolean();
  private final CountDownLatch completion = new CountDownLatch(1);
  private final InFlight inFlight = new InFlight();
  private ExecutorService workerPool;
  private Thread dispatcher;

  StageRunner(
      Stage<I, O> stage,
      StageQueue<I> inbox,
      StageQueue<O> outbox,
      StepOptions options,
      CancellationSignal halt,
      Consumer<Throwable> failureSink,
      String threadPrefix,
      Map<String, String> mdc) {
    this.stage = Objects.requireNonNull(stage, "stage");
    this.inbox = Objects.requireNonNull(inbox, "inbox");
    this.outbox = Objects.requireNonNull(outbox, "outbox");
    Objects.requireNonNull(options, "options");
    this.workers = stage.singleWorker() ? 1 : options.maxParallelism();
    this.halt = Objects.requireNonNull(halt, "halt");
    this.failureSink = Objects.requireNonNull(failureSink, "failureSink");
    this.threadPrefix = threadPrefix;
    this.mdc = Map.copyOf(mdc);
  }

  String stageName() {
    return stage.name();
  }

  StageQueue<O> outbox() {
    return outbox;
  }

  void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Stage " + stage.name() + " already started");
    }
    UncaughtExceptionHandler handler = (thread, ex) -> {
      log.error("Stage worker {} terminated unexpectedly", thread.getName(), ex);
      failureSink.accept(ex);
    };
    if (workers == StepOptions.UNBOUNDED) {
      workerPool = ExecutorFactories.newElasticPool(threadPrefix, handler);
      dispatcher = ExecutorFactories.newThread(threadPrefix + "-dispatch", this::dispatchLoop, handler);
      dispatcher.start();
    } else {
      remainingWorkers.set(workers);
      workerPool = ExecutorFactories.newWorkerPool(workers, threadPrefix, handler);
      for (int i = 0; i < workers; i++) {
        workerPool.execute(this::workerLoop);
      }
    }
    log.debug("Started stage {} with {} workers", stage.name(),
        workers == StepOptions.UNBOUNDED ? "unbounded" : workers);
  }

  /**
   * Waits until the outbox has been completed.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  void awaitCompletion() throws InterruptedException {
    completion.await();
  }

  boolean isFinished() {
    return finished.get();
  }

  void stop() {
    if (dispatcher != null) {
      try {
        dispatcher.join(SHUTDOWN_TIMEOUT_MILLIS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      if (dispatcher.isAlive()) {
        dispatcher.interrupt();
      }
    }
    if (!ExecutorFactories.shutdownGracefully(workerPool, SHUTDOWN_TIMEOUT_MILLIS)) {
      log.warn("Stage {} workers did not stop within {} ms", stage.name(), SHUTDOWN_TIMEOUT_MILLIS);
    }
  }

  private void workerLoop() {
    applyMdc();
    try {
      I item;
      while ((item = inbox.next()) != null) {
        stage.process(item, outbox::put);
      }
    } catch (CancellationException ex) {
      log.debug("Stage {} worker halted", stage.name());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("Stage {} worker interrupted", stage.name());
    } catch (RuntimeException ex) {
      log.error("Stage {} worker failed", stage.name(), ex);
      failureSink.accept(ex);
    } finally {
      if (remainingWorkers.decrementAndGet() == 0) {
        finish();
      }
      MDC.clear();
    }
  }

  private void dispatchLoop() {
    applyMdc();
    try {
      while (true) {
        inFlight.awaitBelow(ExecutorFactories.ELASTIC_POOL_LIMIT, halt);
        I current = inbox.next();
        if (current == null) {
          break;
        }
        inFlight.increment();
        try {
          workerPool.execute(() -> runTask(current));
        } catch (RejectedExecutionException ex) {
          inFlight.decrement();
          throw ex;
        }
      }
      inFlight.awaitIdle(halt);
    } catch (CancellationException ex) {
      log.debug("Stage {} dispatcher halted", stage.name());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("Stage {} dispatcher interrupted", stage.name());
    } catch (RuntimeException ex) {
      log.error("Stage {} dispatcher failed", stage.name(), ex);
      failureSink.accept(ex);
    } finally {
      finish();
      MDC.clear();
    }
  }

  private void runTask(I item) {
    applyMdc();
    try {
      stage.process(item, outbox::put);
    } catch (CancellationException ex) {
      log.debug("Stage {} task halted", stage.name());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } catch (RuntimeException ex) {
      log.error("Stage {} task failed", stage.name(), ex);
      failureSink.accept(ex);
    } finally {
      inFlight.decrement();
      MDC.clear();
    }
  }

  private void finish() {
    if (!finished.compareAndSet(false, true)) {
      return;
    }
    try {
      if (!halt.isCancelled()) {
        stage.onUpstreamComplete(outbox::put);
      }
    } catch (CancellationException ex) {
      log.debug("Stage {} halted while flushing", stage.name());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } catch (RuntimeException ex) {
      log.error("Stage {} failed while flushing", stage.name(), ex);
      failureSink.accept(ex);
    } finally {
      outbox.complete();
      completion.countDown();
      log.debug("Stage {} completed", stage.name());
    }
  }

  private void applyMdc() {
    mdc.forEach(MDC::put);
  }

  private static final class InFlight {
    private int count;

    synchronized void increment() {
      count++;
    }

    synchronized void decrement() {
      count--;
      notifyAll();
    }

    synchronized void awaitIdle(CancellationSignal halt) throws InterruptedException {
      awaitBelow(1, halt);
    }

    synchronized void awaitBelow(int limit, CancellationSignal halt) throws InterruptedException {
      while (count >= limit) {
        halt.throwIfCancelled();
        wait(StageQueue.POLL_MILLIS);
      }
    }
  }
}
