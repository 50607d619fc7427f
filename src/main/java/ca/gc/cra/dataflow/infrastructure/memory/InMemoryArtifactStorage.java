package ca.gc.cra.dataflow.infrastructure.memory;

import ca.gc.cra.dataflow.application.port.ArtifactStoragePort;
import ca.gc.cra.dataflow.domain.run.ArtifactSaveRequest;
import ca.gc.cra.dataflow.domain.run.ArtifactSaveResult;
import ca.gc.cra.dataflow.infrastructure.artifact.ArtifactJson;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps serialized artifacts in a concurrent map keyed by {@code <resourceRunId>/<step>/<artifact>}.
 *
 * @since 0.1.0
 */
public final class InMemoryArtifactStorage implements ArtifactStoragePort {
  static final String SCHEME = "memory://";

  private final Map<String, String> artifacts = new ConcurrentHashMap<>();

  @Override
  public ArtifactSaveResult save(ArtifactSaveRequest request) throws Exception {
    String key = ArtifactJson.storageKey(request.resourceRunId(), request.stepName(), request.artifactName());
    artifacts.put(key, ArtifactJson.write(request.data()));
    return ArtifactSaveResult.stored(request, SCHEME + key);
  }

  public int artifactCount() {
    return artifacts.size();
  }

  public Optional<String> artifact(String key) {
    return Optional.ofNullable(artifacts.get(key));
  }

  public List<String> keys() {
    return List.copyOf(artifacts.keySet());
  }

  public void clear() {
    artifacts.clear();
  }
}
