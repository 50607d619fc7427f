package ca.gc.cra.dataflow.application.pipeline;

import ca.gc.cra.dataflow.domain.run.ArtifactStorageType;
import java.util.Objects;
import java.util.function.Function;

/**
 * <strong>What:</strong> Describes how a step's successful outputs are captured as artifacts.
 * <p><strong>Resolution order:</strong></p>
 * <ul>
 *   <li>Name: {@code nameFactory(value)}, else {@code artifactName}, else {@code <step>_output}.</li>
 *   <li>Payload: {@code dataSelector(value)}, else the value itself.</li>
 *   <li>Resource id: {@code resourceIdSelector(value)}, else the result's resource id.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; selector functions are invoked concurrently by persistence
 * workers.</p>
 *
 * @param <T> step output type
 * @since 0.1.0
 */
public final class ArtifactOptions<T> {
  /** Default number of concurrent persistence workers per captured step. */
  public static final int DEFAULT_PERSISTENCE_WORKERS = 4;

  private final String artifactName;
  private final Function<? super T, String> nameFactory;
  private final Function<? super T, String> resourceIdSelector;
  private final Function<? super T, ?> dataSelector;
  private final ArtifactStorageType storageType;
  private final int persistenceWorkers;

  private ArtifactOptions(
      String artifactName,
      Function<? super T, String> nameFactory,
      Function<? super T, String> resourceIdSelector,
      Function<? super T, ?> dataSelector,
      ArtifactStorageType storageType,
      int persistenceWorkers) {
    this.artifactName = artifactName;
    this.nameFactory = nameFactory;
    this.resourceIdSelector = resourceIdSelector;
    this.dataSelector = dataSelector;
    this.storageType = Objects.requireNonNull(storageType, "storageType");
    if (persistenceWorkers <= 0) {
      throw new IllegalArgumentException("persistenceWorkers must be positive");
    }
    this.persistenceWorkers = persistenceWorkers;
  }

  public static <T> ArtifactOptions<T> defaults() {
    return new ArtifactOptions<>(null, null, null, null, ArtifactStorageType.S3, DEFAULT_PERSISTENCE_WORKERS);
  }

  public static <T> ArtifactOptions<T> named(String artifactName) {
    return ArtifactOptions.<T>defaults().withArtifactName(artifactName);
  }

  public ArtifactOptions<T> withArtifactName(String name) {
    return new ArtifactOptions<>(name, nameFactory, resourceIdSelector, dataSelector, storageType,
        persistenceWorkers);
  }

  public ArtifactOptions<T> withNameFactory(Function<? super T, String> factory) {
    return new ArtifactOptions<>(artifactName, factory, resourceIdSelector, dataSelector, storageType,
        persistenceWorkers);
  }

  public ArtifactOptions<T> withResourceIdSelector(Function<? super T, String> selector) {
    return new ArtifactOptions<>(artifactName, nameFactory, selector, dataSelector, storageType,
        persistenceWorkers);
  }

  public ArtifactOptions<T> withDataSelector(Function<? super T, ?> selector) {
    return new ArtifactOptions<>(artifactName, nameFactory, resourceIdSelector, selector, storageType,
        persistenceWorkers);
  }

  public ArtifactOptions<T> withStorageType(ArtifactStorageType type) {
    return new ArtifactOptions<>(artifactName, nameFactory, resourceIdSelector, dataSelector, type,
        persistenceWorkers);
  }

  public ArtifactOptions<T> withPersistenceWorkers(int workers) {
    return new ArtifactOptions<>(artifactName, nameFactory, resourceIdSelector, dataSelector, storageType,
        workers);
  }

  String resolveName(String stepName, T value) {
    if (nameFactory != null) {
      return nameFactory.apply(value);
    }
    return artifactName != null ? artifactName : stepName + "_output";
  }

  Object resolveData(T value) {
    return dataSelector != null ? dataSelector.apply(value) : value;
  }

  String resolveResourceId(T value, String fallback) {
    return resourceIdSelector != null ? resourceIdSelector.apply(value) : fallback;
  }

  public ArtifactStorageType storageType() {
    return storageType;
  }

  public int persistenceWorkers() {
    return persistenceWorkers;
  }
}
