package ca.gc.cra.dataflow.infrastructure.memory;

import ca.gc.cra.dataflow.application.port.ResourceRunCache;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps {@code runId:resourceId} to a stable resource run identifier for the life of the process.
 *
 * @since 0.1.0
 */
public final class InMemoryResourceRunCache implements ResourceRunCache {
  private final ConcurrentMap<String, UUID> entries = new ConcurrentHashMap<>();

  @Override
  public UUID getOrCreate(UUID runId, String resourceId, String resourceType) {
    return entries.computeIfAbsent(key(runId, resourceId), k -> UUID.randomUUID());
  }

  @Override
  public Optional<UUID> tryGet(UUID runId, String resourceId) {
    return Optional.ofNullable(entries.get(key(runId, resourceId)));
  }

  @Override
  public void put(UUID runId, String resourceId, UUID resourceRunId) {
    entries.put(key(runId, resourceId), Objects.requireNonNull(resourceRunId, "resourceRunId"));
  }

  @Override
  public void clearRun(UUID runId) {
    String prefix = runId + ":";
    entries.keySet().removeIf(k -> k.startsWith(prefix));
  }

  public int size() {
    return entries.size();
  }

  private static String key(UUID runId, String resourceId) {
    return Objects.requireNonNull(runId, "runId") + ":" + Objects.requireNonNull(resourceId, "resourceId");
  }
}
