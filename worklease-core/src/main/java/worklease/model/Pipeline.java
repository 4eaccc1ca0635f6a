package worklease.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shape of an N-stage enrichment pipeline and the single authority on which
 * {@link WorkStatus} changes are legal.
 *
 * <p>Stage 1 is pending in {@code PENDING_STAGE_1}; stage {@code k > 1} is pending in
 * {@code STAGE_<k-1>_DONE}. {@code STAGE_<N>_DONE} and {@code FAILED} are terminal.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class Pipeline {

  /** Stage count of the developer pipeline: profile fetch, then social enrichment. */
  public static final int DEFAULT_STAGE_COUNT = 2;

  private static final Pipeline DEFAULT = new Pipeline(DEFAULT_STAGE_COUNT);

  private final int stageCount;

  private Pipeline(int stageCount) {
    if (stageCount < 1) {
      throw new IllegalArgumentException("stageCount must be >= 1, got: " + stageCount);
    }
    this.stageCount = stageCount;
  }

  public static Pipeline ofStages(int stageCount) {
    return stageCount == DEFAULT_STAGE_COUNT ? DEFAULT : new Pipeline(stageCount);
  }

  public static Pipeline defaultPipeline() {
    return DEFAULT;
  }

  public int stageCount() {
    return stageCount;
  }

  /**
   * Returns the status a unit sits in while waiting for {@code stage}.
   *
   * @throws IllegalArgumentException if {@code stage} is outside {@code [1, stageCount]}
   */
  public WorkStatus pendingStatus(int stage) {
    checkStage(stage);
    return stage == 1 ? WorkStatus.PENDING : WorkStatus.stageDone(stage - 1);
  }

  /**
   * Returns the stage a claim from {@code status} will work on.
   *
   * @throws IllegalArgumentException if {@code status} is not claimable in this pipeline
   */
  public int stageClaimedFrom(WorkStatus status) {
    if (status instanceof WorkStatus.Pending) {
      return 1;
    }
    if (status instanceof WorkStatus.StageDone done && done.stage() < stageCount) {
      return done.stage() + 1;
    }
    throw new IllegalArgumentException("Cannot claim from status " + status
        + ": only pending, non-terminal states are claimable");
  }

  public boolean isClaimable(WorkStatus status) {
    return status instanceof WorkStatus.Pending
        || (status instanceof WorkStatus.StageDone done && done.stage() < stageCount);
  }

  public boolean isTerminal(WorkStatus status) {
    return status instanceof WorkStatus.Failed
        || (status instanceof WorkStatus.StageDone done && done.stage() >= stageCount);
  }

  public WorkStatus finalStatus() {
    return WorkStatus.stageDone(stageCount);
  }

  /**
   * All statuses a unit of this pipeline can be in, in lifecycle order.
   */
  public List<WorkStatus> statuses() {
    List<WorkStatus> all = new ArrayList<>(stageCount + 3);
    all.add(WorkStatus.PENDING);
    all.add(WorkStatus.PROCESSING);
    for (int stage = 1; stage <= stageCount; stage++) {
      all.add(WorkStatus.stageDone(stage));
    }
    all.add(WorkStatus.FAILED);
    return Collections.unmodifiableList(all);
  }

  /**
   * Applies {@code transition} to a unit in {@code from} working on {@code stage}.
   *
   * @param from       current status
   * @param transition requested edge
   * @param stage      stage the lease is (or will be) working on
   * @return the resulting status
   * @throws IllegalTransitionException if the edge is not defined from {@code from}
   * @throws IllegalArgumentException   if {@code stage} is outside {@code [1, stageCount]}
   */
  public WorkStatus transition(WorkStatus from, Transition transition, int stage) {
    checkStage(stage);
    if (isTerminal(from)) {
      throw new IllegalTransitionException(from, transition,
          "Status " + from + " is terminal; " + transition + " is not allowed");
    }
    return switch (transition) {
      case CLAIM -> {
        WorkStatus pending = pendingStatus(stage);
        if (!pending.equals(from)) {
          throw new IllegalTransitionException(from, transition,
              "Stage " + stage + " can only be claimed from " + pending + ", not " + from);
        }
        yield WorkStatus.PROCESSING;
      }
      case COMPLETE -> {
        requireProcessing(from, transition);
        yield WorkStatus.stageDone(stage);
      }
      case RETRY, RECLAIM -> {
        requireProcessing(from, transition);
        yield pendingStatus(stage);
      }
      case FAIL -> {
        requireProcessing(from, transition);
        yield WorkStatus.FAILED;
      }
    };
  }

  /**
   * Picks the failure edge for a unit whose failed attempt is number {@code retryCount + 1}.
   * The unit fails terminally exactly when that number reaches {@code maxRetries}.
   *
   * @param retryCount failed attempts recorded before this one
   * @param maxRetries failed attempts allowed per stage (must be &ge; 1)
   * @return {@link Transition#RETRY} or {@link Transition#FAIL}
   */
  public static Transition failureTransition(int retryCount, int maxRetries) {
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be >= 1, got: " + maxRetries);
    }
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0, got: " + retryCount);
    }
    return retryCount + 1 >= maxRetries ? Transition.FAIL : Transition.RETRY;
  }

  private static void requireProcessing(WorkStatus from, Transition transition) {
    if (!(from instanceof WorkStatus.Processing)) {
      throw new IllegalTransitionException(from, transition,
          transition + " requires PROCESSING, not " + from);
    }
  }

  private void checkStage(int stage) {
    if (stage < 1 || stage > stageCount) {
      throw new IllegalArgumentException(
          "stage must be in [1, " + stageCount + "], got: " + stage);
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Pipeline other && other.stageCount == stageCount;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(stageCount);
  }

  @Override
  public String toString() {
    return "Pipeline[stages=" + stageCount + "]";
  }
}
