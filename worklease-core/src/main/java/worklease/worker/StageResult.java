package worklease.worker;

import java.util.Objects;

/**
 * Outcome of a {@link StageProcessor} call.
 */
public sealed interface StageResult permits StageResult.Success, StageResult.Failure {

  static StageResult success() {
    return Success.INSTANCE;
  }

  static StageResult failure(String message) {
    return new Failure(message);
  }

  /** The stage finished; the unit advances to {@code STAGE_k_DONE}. */
  final class Success implements StageResult {
    private static final Success INSTANCE = new Success();

    private Success() {
    }

    @Override
    public String toString() {
      return "Success";
    }
  }

  /**
   * The stage failed; the unit is retried or moved to {@code FAILED}.
   *
   * @param message error kept as the unit's last error
   */
  record Failure(String message) implements StageResult {
    public Failure {
      Objects.requireNonNull(message, "message");
    }
  }
}
