package campaign.model;

/**
 * What a step's delay is measured from.
 */
public enum StepAnchor {
  /** Delay counts from the contact's enrollment time. */
  ENROLLMENT,
  /** Delay counts from the moment the previous step reached a terminal outcome. */
  PREVIOUS_STEP
}
