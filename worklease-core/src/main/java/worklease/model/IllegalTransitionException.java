package worklease.model;

/**
 * Thrown when a status change is requested along an edge the state machine does not define,
 * for example claiming from PROCESSING or leaving a terminal state.
 */
public final class IllegalTransitionException extends RuntimeException {
  private final WorkStatus from;
  private final Transition transition;

  public IllegalTransitionException(WorkStatus from, Transition transition, String message) {
    super(message);
    this.from = from;
    this.transition = transition;
  }

  public WorkStatus from() {
    return from;
  }

  public Transition transition() {
    return transition;
  }
}
