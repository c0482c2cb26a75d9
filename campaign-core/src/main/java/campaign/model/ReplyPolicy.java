package campaign.model;

/**
 * What happens to a contact's remaining steps when the contact replies.
 */
public enum ReplyPolicy {
  /** Pause the instance; remaining steps wait for an explicit resume. */
  PAUSE,
  /** Skip every remaining step and complete the instance. */
  STOP
}
