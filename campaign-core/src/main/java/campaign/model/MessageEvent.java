package campaign.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Delivery or engagement event for an {@link OutboundMessage}. Append-only.
 *
 * <p>Freshly normalized events may not know the internal message id yet; they carry the
 * references the provider echoed back ({@code dedupeKey}, {@code providerMessageId}) and
 * are resolved before being stored.
 *
 * @param providerEventId provider-unique event id used to drop replays, may be null
 */
public record MessageEvent(
    String id,
    String tenantId,
    String messageId,
    String dedupeKey,
    String providerMessageId,
    MessageEventType type,
    Instant eventAt,
    String providerEventId,
    Map<String, String> data) implements NormalizedEvent {

  public MessageEvent {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(eventAt, "eventAt");
    data = data == null ? Map.of() : Map.copyOf(data);
  }

  public MessageEvent resolvedTo(OutboundMessage message) {
    return new MessageEvent(id, message.tenantId(), message.id(), message.dedupeKey(),
        message.providerMessageId(), type, eventAt, providerEventId, data);
  }
}
