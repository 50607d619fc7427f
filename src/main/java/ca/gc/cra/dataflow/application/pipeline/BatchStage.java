package ca.gc.cra.dataflow.application.pipeline;

import ca.gc.cra.dataflow.domain.result.PipelineResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;

/**
 * Collects consecutive results into fixed-size batches. Failed members are logged and dropped from the batch
 * value; the batch is keyed by its first successful member, or by an empty id when it has none. A trailing partial
 * batch is emitted when the upstream completes.
 *
 * @param <T> member value type
 */
final class BatchStage<T> extends Stage<PipelineResult<T>, PipelineResult<List<T>>> {
  static final String STEP_NAME = "Batch";

  private final int batchSize;
  private final Logger logger;
  private List<PipelineResult<T>> pending;

  BatchStage(int batchSize, PipelineContext context) {
    super(STEP_NAME, true);
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive");
    }
    this.batchSize = batchSize;
    this.logger = context.logger();
    this.pending = new ArrayList<>(batchSize);
  }

  @Override
  void process(PipelineResult<T> input, Emitter<PipelineResult<List<T>>> out) throws InterruptedException {
    pending.add(input);
    if (pending.size() >= batchSize) {
      flush(out);
    }
  }

  @Override
  void onUpstreamComplete(Emitter<PipelineResult<List<T>>> out) throws InterruptedException {
    if (!pending.isEmpty()) {
      flush(out);
    }
  }

  private void flush(Emitter<PipelineResult<List<T>>> out) throws InterruptedException {
    List<PipelineResult<T>> batch = pending;
    pending = new ArrayList<>(batchSize);
    List<T> values = new ArrayList<>(batch.size());
    String resourceId = null;
    for (PipelineResult<T> member : batch) {
      if (member.isFailure()) {
        logger.warn("Batch contains failed resource {} - Error: {}", member.resourceId(),
            member.errorMessage().orElse(PipelineResult.PREVIOUS_STEP_FAILED));
        continue;
      }
      if (member.value() == null) {
        continue;
      }
      if (resourceId == null) {
        resourceId = member.resourceId();
      }
      values.add(member.value());
    }
    out.emit(PipelineResult.success(Collections.unmodifiableList(values), resourceId == null ? "" : resourceId));
  }
}
