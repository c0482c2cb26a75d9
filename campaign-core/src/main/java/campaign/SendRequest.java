package campaign;

import campaign.model.Channel;

import java.util.Map;
import java.util.Objects;

/**
 * Everything a provider needs to deliver one rendered message.
 *
 * @param dedupeKey         idempotency key; providers that support one should forward it
 * @param outboundMessageId engine message id, echoed back in webhooks for correlation
 * @param metadata          correlation values to attach as provider custom arguments
 */
public record SendRequest(
    String tenantId,
    Channel channel,
    String senderIdentityId,
    String address,
    Map<String, String> content,
    String dedupeKey,
    String outboundMessageId,
    Map<String, String> metadata) {

  public SendRequest {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(address, "address");
    Objects.requireNonNull(dedupeKey, "dedupeKey");
    Objects.requireNonNull(outboundMessageId, "outboundMessageId");
    content = content == null ? Map.of() : Map.copyOf(content);
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
