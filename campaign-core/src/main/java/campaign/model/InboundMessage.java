package campaign.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A reply captured on any channel.
 *
 * @param messageId outbound message this replies to, if the provider threaded it
 * @param raw       the reply as received
 */
public record InboundMessage(
    String id,
    String tenantId,
    String campaignId,
    String contactId,
    String messageId,
    Channel channel,
    String providerMessageId,
    String fromAddress,
    String subject,
    String body,
    String raw,
    Instant receivedAt) implements NormalizedEvent {

  public InboundMessage {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(receivedAt, "receivedAt");
  }

  public InboundMessage correlatedTo(OutboundMessage message) {
    return new InboundMessage(id, message.tenantId(), message.campaignId(), message.contactId(),
        message.id(), channel, providerMessageId, fromAddress, subject, body, raw, receivedAt);
  }
}
