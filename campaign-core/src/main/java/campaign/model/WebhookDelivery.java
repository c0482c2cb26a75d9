package campaign.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Verbatim archive of one inbound provider webhook call.
 *
 * @param tenantId resolved tenant; {@code null} until normalization finds one
 */
public record WebhookDelivery(
    String id,
    String tenantId,
    String provider,
    String eventType,
    String messageId,
    String payload,
    String signature,
    WebhookDeliveryStatus status,
    Instant receivedAt,
    Instant processedAt,
    String error) {

  public WebhookDelivery {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(provider, "provider");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(receivedAt, "receivedAt");
  }
}
