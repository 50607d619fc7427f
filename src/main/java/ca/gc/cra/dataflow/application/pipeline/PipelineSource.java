package ca.gc.cra.dataflow.application.pipeline;

import ca.gc.cra.dataflow.application.port.ProgressService;
import ca.gc.cra.dataflow.domain.run.RunType;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Flow;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Lazily materialized stream of the items a pipeline run processes.
 * <p><strong>Why:</strong> Runs start from a known collection, a factory evaluated at run start, an asynchronous
 * producer such as paged database reads, or a resume strategy that replays only unfinished resources.</p>
 * <p><strong>Role:</strong> Attached to a {@link DataFlowPipeline}; {@link #open(PipelineContext)} runs when the
 * source is attached, so configuration errors surface while the graph is being built, and the returned producer
 * runs on the source thread once {@code complete} is called.</p>
 * <p><strong>Thread-safety:</strong> Sources are immutable descriptions; the producer is used by one thread.</p>
 *
 * @param <T> item type
 * @since 0.1.0
 */
public final class PipelineSource<T> {
  private static final Logger log = LoggerFactory.getLogger(PipelineSource.class);
  private static final long POLL_MILLIS = 25L;

  private final String description;
  private final Function<PipelineContext, ItemProducer<T>> opener;

  private PipelineSource(String description, Function<PipelineContext, ItemProducer<T>> opener) {
    this.description = description;
    this.opener = opener;
  }

  /**
   * Source over an already-known collection.
   *
   * @param items items to process
   * @param <T> item type
   * @return source
   */
  public static <T> PipelineSource<T> fromIterable(Iterable<? extends T> items) {
    Objects.requireNonNull(items, "items");
    return new PipelineSource<>("iterable", context -> sink -> drain(items.iterator(), sink, context));
  }

  /**
   * Source over the given items.
   *
   * @param items items to process
   * @param <T> item type
   * @return source
   */
  @SafeVarargs
  public static <T> PipelineSource<T> of(T... items) {
    return fromIterable(List.of(items));
  }

  /**
   * Source whose collection is produced by {@code factory} when the run starts.
   *
   * @param factory collection factory, invoked once on the source thread
   * @param <T> item type
   * @return source
   */
  public static <T> PipelineSource<T> fromSupplier(Supplier<? extends Iterable<? extends T>> factory) {
    Objects.requireNonNull(factory, "factory");
    return new PipelineSource<>("supplier", context -> sink -> {
      Iterable<? extends T> items = Objects.requireNonNull(factory.get(), "source factory returned null");
      drain(items.iterator(), sink, context);
    });
  }

  /**
   * Source backed by a stream opened when the run starts. The stream is closed once drained.
   *
   * @param factory opens the stream; receives the run cancellation signal
   * @param <T> item type
   * @return source
   */
  public static <T> PipelineSource<T> fromStream(Function<CancellationSignal, ? extends Stream<? extends T>> factory) {
    Objects.requireNonNull(factory, "factory");
    return new PipelineSource<>("stream", context -> sink -> {
      try (Stream<? extends T> stream =
          Objects.requireNonNull(factory.apply(context.cancellation()), "stream factory returned null")) {
        drain(stream.iterator(), sink, context);
      }
    });
  }

  /**
   * Source backed by a reactive-streams publisher. Items are requested one at a time, so the publisher sees the
   * pipeline's backpressure.
   *
   * @param publisher item publisher
   * @param <T> item type
   * @return source
   */
  public static <T> PipelineSource<T> fromPublisher(Flow.Publisher<? extends T> publisher) {
    Objects.requireNonNull(publisher, "publisher");
    return new PipelineSource<>("publisher", context -> sink -> {
      PublisherBridge<T> bridge = new PublisherBridge<>();
      publisher.subscribe(bridge);
      bridge.drainInto(sink, context.cancellation());
    });
  }

  /**
   * Resume-aware source. A {@link RunType#FRESH} run uses {@code fresh}; any other run asks the context's
   * {@link ProgressService} for the resources left incomplete on the reference run (the parent run when set,
   * otherwise this run) and processes the source returned by {@code incompleteLoader} for exactly that set.
   *
   * @param fresh source for fresh runs
   * @param incompleteLoader loads the items for a set of incomplete resource identifiers
   * @param <T> item type
   * @return source
   * @throws IllegalStateException at open time, when a resume run has no progress service configured
   */
  public static <T> PipelineSource<T> fromRunType(
      PipelineSource<T> fresh, Function<? super Set<String>, PipelineSource<T>> incompleteLoader) {
    Objects.requireNonNull(fresh, "fresh");
    Objects.requireNonNull(incompleteLoader, "incompleteLoader");
    return new PipelineSource<>("runType", context -> {
      if (context.runType() == RunType.FRESH) {
        return fresh.open(context);
      }
      ProgressService service = context.progressService().orElseThrow(() -> new IllegalStateException(
          "Run type " + context.runType() + " requires a ProgressService on the pipeline context"));
      UUID referenceRunId = context.metadata().referenceRunId();
      Set<String> incomplete = Set.copyOf(service.getIncompleteResourceIds(referenceRunId));
      log.info("Run {} ({}) resumes {} incomplete resources from run {}", context.runId(), context.runType(),
          incomplete.size(), referenceRunId);
      PipelineSource<T> resumed =
          Objects.requireNonNull(incompleteLoader.apply(incomplete), "incomplete loader returned null");
      return resumed.open(context);
    });
  }

  /**
   * Opens the source against a run context.
   *
   * @param context run context
   * @return producer of the run's items
   * @throws IllegalStateException if the context lacks a collaborator this source requires
   */
  public ItemProducer<T> open(PipelineContext context) {
    Objects.requireNonNull(context, "context");
    return Objects.requireNonNull(opener.apply(context), "producer");
  }

  public String description() {
    return description;
  }

  private static <T> void drain(Iterator<? extends T> iterator, ItemProducer.Sink<? super T> sink,
      PipelineContext context) throws InterruptedException {
    while (iterator.hasNext()) {
      context.cancellation().throwIfCancelled();
      sink.accept(iterator.next());
    }
  }

  private static final class PublisherBridge<T> implements Flow.Subscriber<T> {
    private final LinkedBlockingQueue<Signal<T>> signals = new LinkedBlockingQueue<>();
    private volatile Flow.Subscription subscription;

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
      this.subscription = subscription;
      subscription.request(1);
    }

    @Override
    public void onNext(T item) {
      signals.add(new Item<>(item));
    }

    @Override
    public void onError(Throwable throwable) {
      signals.add(new Failure<>(throwable));
    }

    @Override
    public void onComplete() {
      signals.add(new Complete<>());
    }

    void drainInto(ItemProducer.Sink<? super T> sink, CancellationSignal cancellation) throws Exception {
      while (true) {
        Signal<T> signal = signals.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (signal == null) {
          if (cancellation.isCancelled()) {
            cancelSubscription();
            throw new CancellationException("Pipeline run cancelled");
          }
          continue;
        }
        if (signal instanceof Complete) {
          return;
        }
        if (signal instanceof Failure<T> failure) {
          Throwable cause = failure.cause();
          if (cause instanceof Exception exception) {
            throw exception;
          }
          throw new PipelineExecutionException("Publisher failed", cause);
        }
        Item<T> item = (Item<T>) signal;
        try {
          sink.accept(item.value());
        } catch (CancellationException | InterruptedException ex) {
          cancelSubscription();
          throw ex;
        }
        subscription.request(1);
      }
    }

    private void cancelSubscription() {
      Flow.Subscription current = subscription;
      if (current != null) {
        current.cancel();
      }
    }
  }

  private sealed interface Signal<T> permits Item, Failure, Complete {}

  private record Item<T>(T value) implements Signal<T> {}

  private record Failure<T>(Throwable cause) implements Signal<T> {}

  private record Complete<T>() implements Signal<T> {}
}
