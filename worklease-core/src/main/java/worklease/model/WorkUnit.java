package worklease.model;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only snapshot of a persisted unit-of-work row.
 *
 * <p>{@code leaseOwner}, {@code leaseStartedAt} and {@code leaseStage} are non-null exactly
 * when {@code status} is {@link WorkStatus#PROCESSING}.
 *
 * @param stageCompletedAt completion timestamp per finished stage, keyed by 1-based stage number
 * @see worklease.spi.WorkStore#findById
 */
public record WorkUnit(
    String id,
    WorkStatus status,
    String leaseOwner,
    Instant leaseStartedAt,
    Integer leaseStage,
    int retryCount,
    String lastError,
    Instant createdAt,
    Map<Integer, Instant> stageCompletedAt
) {

  public WorkUnit {
    stageCompletedAt = stageCompletedAt == null ? Map.of() : Map.copyOf(stageCompletedAt);
  }

  public boolean isLeased() {
    return status instanceof WorkStatus.Processing;
  }

  /**
   * Returns when {@code stage} completed, or {@code null} if it has not.
   */
  public Instant completedAt(int stage) {
    return stageCompletedAt.get(stage);
  }
}
