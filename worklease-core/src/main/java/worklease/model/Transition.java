package worklease.model;

/**
 * Edges of the unit-of-work state machine. Stores compute every status they write by
 * passing one of these through {@link Pipeline#transition}.
 *
 * @see Pipeline#transition(WorkStatus, Transition, int)
 */
public enum Transition {
  /** Pending stage {@code k} to PROCESSING, by a successful claim. */
  CLAIM,
  /** PROCESSING to {@code STAGE_k_DONE}, by a success commit. */
  COMPLETE,
  /** PROCESSING back to pending stage {@code k}, by a failure commit with budget left. */
  RETRY,
  /** PROCESSING to FAILED, by a failure commit that exhausts the budget. */
  FAIL,
  /** PROCESSING back to pending stage {@code k}, by the stale-lease sweep. */
  RECLAIM
}
