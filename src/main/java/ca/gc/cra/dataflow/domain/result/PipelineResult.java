package ca.gc.cra.dataflow.domain.result;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * <strong>What:</strong> Immutable success/failure envelope passed between pipeline stages.
 * <p><strong>Why:</strong> Stages never throw across their boundary; a failed item travels downstream as a
 * failure result so later stages can forward it without re-running business logic.
 * <p><strong>Role:</strong> Domain value exchanged by every stage queue and the terminal drain.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Carry the value and resource identifier of a successfully processed item.</li>
 *   <li>Carry the error message and failing step name of a failed item.</li>
 *   <li>Re-wrap failures for a new value type while preserving their resource identifier.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to publish across stage workers.</p>
 *
 * @param <T> value type carried on success
 * @since 0.1.0
 */
public final class PipelineResult<T> {
  /** Message used when a forwarded failure has no message of its own. */
  public static final String PREVIOUS_STEP_FAILED = "Previous step failed";

  private final boolean success;
  private final T value;
  private final String resourceId;
  private final String errorMessage;
  private final String errorStep;
  private final Long durationMs;

  private PipelineResult(
      boolean success,
      T value,
      String resourceId,
      String errorMessage,
      String errorStep,
      Long durationMs) {
    this.success = success;
    this.value = value;
    this.resourceId = Objects.requireNonNull(resourceId, "resourceId");
    this.errorMessage = errorMessage;
    this.errorStep = errorStep;
    this.durationMs = durationMs;
  }

  /**
   * Creates a successful result without timing information.
   *
   * @param value produced value; may be {@code null}
   * @param resourceId resource identifier; never {@code null}
   * @param <T> value type
   * @return success result
   */
  public static <T> PipelineResult<T> success(T value, String resourceId) {
    return new PipelineResult<>(true, value, resourceId, null, null, null);
  }

  /**
   * Creates a successful result carrying the elapsed processing time.
   *
   * @param value produced value; may be {@code null}
   * @param resourceId resource identifier; never {@code null}
   * @param durationMs elapsed milliseconds; {@code null} when not measured
   * @param <T> value type
   * @return success result
   */
  public static <T> PipelineResult<T> success(T value, String resourceId, Long durationMs) {
    return new PipelineResult<>(true, value, resourceId, null, null, durationMs);
  }

  /**
   * Creates a failed result without a step name.
   *
   * @param resourceId resource identifier; never {@code null}
   * @param errorMessage failure description
   * @param <T> value type of the stage that would have produced the value
   * @return failure result
   */
  public static <T> PipelineResult<T> failure(String resourceId, String errorMessage) {
    return new PipelineResult<>(false, null, resourceId, errorMessage, null, null);
  }

  /**
   * Creates a failed result attributed to {@code errorStep}.
   *
   * @param resourceId resource identifier; never {@code null}
   * @param errorMessage failure description
   * @param errorStep name of the failing step; may be {@code null}
   * @param <T> value type of the stage that would have produced the value
   * @return failure result
   */
  public static <T> PipelineResult<T> failure(String resourceId, String errorMessage, String errorStep) {
    return new PipelineResult<>(false, null, resourceId, errorMessage, errorStep, null);
  }

  /**
   * Creates a failed result attributed to {@code errorStep} with the time spent before failing.
   *
   * @param resourceId resource identifier; never {@code null}
   * @param errorMessage failure description
   * @param errorStep name of the failing step; may be {@code null}
   * @param durationMs elapsed milliseconds; may be {@code null}
   * @param <T> value type of the stage that would have produced the value
   * @return failure result
   */
  public static <T> PipelineResult<T> failure(
      String resourceId, String errorMessage, String errorStep, Long durationMs) {
    return new PipelineResult<>(false, null, resourceId, errorMessage, errorStep, durationMs);
  }

  public boolean isSuccess() {
    return success;
  }

  public boolean isFailure() {
    return !success;
  }

  /**
   * Returns the value produced by the stage. Only meaningful when {@link #isSuccess()} is {@code true}.
   *
   * @return value or {@code null}
   */
  public T value() {
    return value;
  }

  /**
   * Returns the value when this result is a success carrying a non-null value.
   *
   * @return optional value
   */
  public Optional<T> valueIfPresent() {
    return success ? Optional.ofNullable(value) : Optional.empty();
  }

  public String resourceId() {
    return resourceId;
  }

  public Optional<String> errorMessage() {
    return Optional.ofNullable(errorMessage);
  }

  public Optional<String> errorStep() {
    return Optional.ofNullable(errorStep);
  }

  public Optional<Long> durationMs() {
    return Optional.ofNullable(durationMs);
  }

  /**
   * Re-wraps this failure for a downstream value type.
   *
   * <p>The resource identifier is preserved, a missing message becomes {@link #PREVIOUS_STEP_FAILED}
   * and a missing step name becomes {@code fallbackStep}.</p>
   *
   * @param fallbackStep step name recorded when the failure carries none; may be {@code null}
   * @param <R> downstream value type
   * @return forwarded failure
   * @throws IllegalStateException if this result is a success
   */
  public <R> PipelineResult<R> forwardFailure(String fallbackStep) {
    if (success) {
      throw new IllegalStateException("Cannot forward a successful result as a failure");
    }
    String message = errorMessage != null ? errorMessage : PREVIOUS_STEP_FAILED;
    String step = errorStep != null ? errorStep : fallbackStep;
    return new PipelineResult<>(false, null, resourceId, message, step, durationMs);
  }

  /**
   * Converts the value of a success, or forwards a failure unchanged in content.
   *
   * <p>An exception thrown by {@code mapper} yields a failure carrying the exception message.</p>
   *
   * @param mapper value conversion
   * @param <R> converted value type
   * @return mapped result
   */
  public <R> PipelineResult<R> map(Function<? super T, ? extends R> mapper) {
    Objects.requireNonNull(mapper, "mapper");
    if (!success) {
      return forwardFailure(null);
    }
    try {
      return new PipelineResult<>(true, mapper.apply(value), resourceId, null, null, durationMs);
    } catch (RuntimeException ex) {
      return new PipelineResult<>(false, null, resourceId, messageOf(ex), null, durationMs);
    }
  }

  /**
   * Returns the exception message, or the exception class name when the message is blank.
   *
   * @param error failure cause
   * @return printable message
   */
  public static String messageOf(Throwable error) {
    String message = error.getMessage();
    return message == null || message.isBlank() ? error.getClass().getName() : message;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof PipelineResult<?> that)) {
      return false;
    }
    return success == that.success
        && Objects.equals(value, that.value)
        && resourceId.equals(that.resourceId)
        && Objects.equals(errorMessage, that.errorMessage)
        && Objects.equals(errorStep, that.errorStep)
        && Objects.equals(durationMs, that.durationMs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(success, value, resourceId, errorMessage, errorStep, durationMs);
  }

  @Override
  public String toString() {
    if (success) {
      return "PipelineResult[success, resourceId=" + resourceId + ", value=" + value
          + ", durationMs=" + durationMs + ']';
    }
    return "PipelineResult[failure, resourceId=" + resourceId + ", errorStep=" + errorStep
        + ", errorMessage=" + errorMessage + ']';
  }
}
