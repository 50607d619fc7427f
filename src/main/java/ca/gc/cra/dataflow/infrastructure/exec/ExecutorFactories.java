package ca.gc.cra.dataflow.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the named worker pools used by pipeline stages and collaborators.
 */
public final class ExecutorFactories {
  private static final String DEFAULT_PREFIX = "dataflow-worker";
  private static final long ELASTIC_KEEP_ALIVE_SECONDS = 30L;

  /** Most threads an elastic pool keeps alive at once: four per available processor, never fewer than eight. */
  public static final int ELASTIC_POOL_LIMIT = Math.max(8, Runtime.getRuntime().availableProcessors() * 4);

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor that runs exactly {@code size} long-lived worker loops.
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        threadFactory(prefix, handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds an elastic executor capped at {@link #ELASTIC_POOL_LIMIT} threads.
   *
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newElasticPool(String prefix, UncaughtExceptionHandler handler) {
    return newElasticPool(ELASTIC_POOL_LIMIT, prefix, handler);
  }

  /**
   * Builds an executor that starts threads on demand up to {@code maxThreads}, queues tasks beyond that, and
   * retires threads idle for longer than 30 seconds.
   *
   * @param maxThreads thread ceiling
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newElasticPool(int maxThreads, String prefix, UncaughtExceptionHandler handler) {
    if (maxThreads <= 0) {
      throw new IllegalArgumentException("maxThreads must be positive");
    }
    ThreadPoolExecutor pool = new ThreadPoolExecutor(
        maxThreads,
        maxThreads,
        ELASTIC_KEEP_ALIVE_SECONDS,
        TimeUnit.SECONDS,
        new LinkedBlockingQueue<>(),
        threadFactory(prefix, handler));
    pool.allowCoreThreadTimeOut(true);
    return pool;
  }

  /**
   * Creates a single named thread that is not yet started.
   *
   * @param name thread name
   * @param task body
   * @param handler uncaught exception handler
   * @return unstarted thread
   */
  public static Thread newThread(String name, Runnable task, UncaughtExceptionHandler handler) {
    Thread thread = new Thread(Objects.requireNonNull(task, "task"));
    thread.setName(name == null || name.isBlank() ? DEFAULT_PREFIX : name);
    thread.setDaemon(false);
    thread.setUncaughtExceptionHandler(Objects.requireNonNullElse(handler, (t, ex) -> {}));
    return thread;
  }

  /**
   * Shuts an executor down, waiting up to {@code timeoutMillis} before interrupting remaining tasks.
   *
   * @param executor executor to stop; ignored when {@code null}
   * @param timeoutMillis graceful wait
   * @return {@code true} if the executor terminated within the timeout
   */
  public static boolean shutdownGracefully(ExecutorService executor, long timeoutMillis) {
    if (executor == null) {
      return true;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
        executor.shutdownNow();
        return false;
      }
      return true;
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static ThreadFactory threadFactory(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? DEFAULT_PREFIX : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
