package campaign.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One logical send, unique per {@code (tenantId, dedupeKey)}.
 */
public record OutboundMessage(
    String id,
    String tenantId,
    String campaignId,
    String contactId,
    String stepInstanceId,
    Channel channel,
    String address,
    String senderIdentityId,
    String dedupeKey,
    Map<String, String> content,
    OutboundMessageState state,
    String providerMessageId,
    int retryCount,
    String lastError,
    Instant createdAt,
    Instant updatedAt) {

  public OutboundMessage {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(address, "address");
    Objects.requireNonNull(dedupeKey, "dedupeKey");
    Objects.requireNonNull(state, "state");
    content = content == null ? Map.of() : Map.copyOf(content);
  }
}
