package campaign.model;

/**
 * Typed result of normalizing a provider webhook.
 */
public sealed interface NormalizedEvent permits MessageEvent, InboundMessage {

  /**
   * @return tenant the event belongs to, or {@code null} if the payload did not say
   */
  String tenantId();
}
