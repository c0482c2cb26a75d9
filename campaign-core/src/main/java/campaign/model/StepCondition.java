package campaign.model;

/**
 * Branch guard evaluated at dispatch time against the previous step's outcome.
 */
public enum StepCondition {
  ALWAYS,
  IF_ENGAGED,
  IF_NOT_ENGAGED;

  /**
   * @param previousOutcome branch outcome of the previous step, {@code null} if none was
   *                        recorded or this is the first step
   */
  public boolean admits(String previousOutcome) {
    boolean engaged = StepOutcome.isEngagementValue(previousOutcome);
    return switch (this) {
      case ALWAYS -> true;
      case IF_ENGAGED -> engaged;
      case IF_NOT_ENGAGED -> !engaged;
    };
  }
}
