package ca.gc.cra.dataflow.application.pipeline;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Run-scoped cancellation flag shared by every queue and worker of a pipeline.
 * <p><strong>Role:</strong> Held by the pipeline context; stage queues poll it while blocked so that a
 * cancelled run unwinds promptly.</p>
 * <p><strong>Thread-safety:</strong> Lock-free; listeners run at most once on the cancelling thread.</p>
 *
 * @since 0.1.0
 */
public final class CancellationSignal {
  private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

  /**
   * Creates a signal that is cancelled whenever this one is, and can also be cancelled on its own.
   *
   * @return linked child signal
   */
  public CancellationSignal newChild() {
    CancellationSignal child = new CancellationSignal();
    onCancel(child::cancel);
    return child;
  }

  /**
   * Cancels the signal and runs registered listeners. Subsequent calls have no effect.
   */
  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    for (Runnable listener : listeners) {
      if (listeners.remove(listener)) {
        runListener(listener);
      }
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Throws when the signal has been cancelled.
   *
   * @throws CancellationException if cancelled
   */
  public void throwIfCancelled() {
    if (cancelled.get()) {
      throw new CancellationException("Pipeline run cancelled");
    }
  }

  /**
   * Registers a listener invoked once on cancellation, immediately if already cancelled.
   *
   * @param listener callback
   */
  public void onCancel(Runnable listener) {
    Objects.requireNonNull(listener, "listener");
    listeners.add(listener);
    if (cancelled.get() && listeners.remove(listener)) {
      runListener(listener);
    }
  }

  private static void runListener(Runnable listener) {
    try {
      listener.run();
    } catch (RuntimeException ex) {
      log.warn("Cancellation listener failed", ex);
    }
  }
}
