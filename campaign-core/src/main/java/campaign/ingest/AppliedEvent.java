package campaign.ingest;

/**
 * What {@link TransitionEngine#apply} did with one normalized event.
 */
public record AppliedEvent(Status status, String tenantId, String messageId, String eventType) {

  public enum Status {
    APPLIED,
    /** The provider event id was already recorded. */
    DUPLICATE,
    /** No outbound message matched; nothing was recorded. */
    UNMATCHED
  }
}
