package campaign.model;

/**
 * Thrown when a state machine is asked to make a move it does not allow, e.g. resuming a
 * completed campaign instance or rescheduling a completed step.
 */
public final class IllegalTransitionException extends RuntimeException {
  private final String from;
  private final String to;

  public IllegalTransitionException(Enum<?> from, Enum<?> to) {
    super("Illegal transition " + from.getDeclaringClass().getSimpleName() + ": " + from + " -> " + to);
    this.from = from.name();
    this.to = to.name();
  }

  public String from() {
    return from;
  }

  public String to() {
    return to;
  }
}
