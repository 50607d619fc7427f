package ca.gc.cra.dataflow.application.port;

import ca.gc.cra.dataflow.domain.run.ArtifactSaveRequest;
import ca.gc.cra.dataflow.domain.run.ArtifactSaveResult;
import java.util.ArrayList;
import java.util.List;

/**
 * <strong>What:</strong> Output port storing artifact payloads.
 * <p><strong>Why:</strong> Lets batchers flush to memory, a file system or an object store without binding to a
 * vendor API.</p>
 * <p><strong>Thread-safety:</strong> Implementations document their guarantees; batchers call from their own
 * worker thread.</p>
 *
 * @since 0.1.0
 */
public interface ArtifactStoragePort {
  /**
   * Stores one artifact.
   *
   * @param request artifact save request
   * @return outcome of the save
   * @throws Exception if the store rejects the write
   */
  ArtifactSaveResult save(ArtifactSaveRequest request) throws Exception;

  /**
   * Stores a batch of artifacts. A failing member is reported in its result and does not stop the batch.
   *
   * @param requests artifacts to store
   * @return one result per request, in request order
   */
  default List<ArtifactSaveResult> saveBatch(List<ArtifactSaveRequest> requests) {
    List<ArtifactSaveResult> results = new ArrayList<>(requests.size());
    for (ArtifactSaveRequest request : requests) {
      try {
        results.add(save(request));
      } catch (Exception ex) {
        results.add(ArtifactSaveResult.failed(request, ex.getMessage()));
      }
    }
    return results;
  }
}
