package campaign.ingest;

import campaign.model.Channel;
import campaign.model.InboundMessage;
import campaign.model.NormalizedEvent;
import campaign.model.WebhookDelivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Normalizes inbound reply payloads: a JSON object, or an array of them, with
 * {@code tenant_id}, {@code campaign_id}, {@code contact_id}, {@code in_reply_to} (the
 * outbound message id), {@code provider_message_id}, {@code channel}, {@code from},
 * {@code subject}, {@code text} and an optional ISO-8601 {@code received_at}.
 */
public final class InboundReplyNormalizer implements WebhookNormalizer {
  private static final Logger logger = Logger.getLogger(InboundReplyNormalizer.class.getName());

  public static final String PROVIDER = "inbound-reply";

  private final ObjectMapper mapper;

  public InboundReplyNormalizer() {
    this(new ObjectMapper());
  }

  public InboundReplyNormalizer(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public String provider() {
    return PROVIDER;
  }

  @Override
  public List<NormalizedEvent> normalize(WebhookDelivery delivery) {
    JsonNode root;
    try {
      root = mapper.readTree(delivery.payload());
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Inbound reply payload is not valid JSON", e);
    }
    if (root == null || !(root.isObject() || root.isArray())) {
      throw new IllegalArgumentException("Inbound reply payload must be a JSON object or array");
    }
    List<NormalizedEvent> replies = new ArrayList<>();
    if (root.isArray()) {
      for (int i = 0; i < root.size(); i++) {
        addReply(replies, root.get(i), i, delivery);
      }
    } else {
      addReply(replies, root, 0, delivery);
    }
    return replies;
  }

  private void addReply(List<NormalizedEvent> replies, JsonNode entry, int index,
      WebhookDelivery delivery) {
    String inReplyTo = text(entry, "in_reply_to");
    String providerMessageId = text(entry, "provider_message_id");
    String contactId = text(entry, "contact_id");
    if (inReplyTo == null && providerMessageId == null && contactId == null) {
      logger.log(Level.WARNING, "Skipping reply with nothing to correlate: {0}", entry);
      return;
    }
    Channel channel;
    try {
      String value = text(entry, "channel");
      channel = value == null ? Channel.EMAIL : Channel.fromValue(value);
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Skipping reply on unknown channel: {0}", entry);
      return;
    }
    replies.add(new InboundMessage(replyId(delivery, index), text(entry, "tenant_id"), text(entry, "campaign_id"),
        contactId, inReplyTo, channel, providerMessageId, text(entry, "from"), text(entry, "subject"),
        text(entry, "text"), entry.toString(), receivedAt(entry, delivery)));
  }

  /**
   * Same delivery and position give the same id, so replaying a delivery does not store
   * its replies twice.
   */
  static String replyId(WebhookDelivery delivery, int index) {
    return UUID.nameUUIDFromBytes((delivery.id() + ":" + index).getBytes(StandardCharsets.UTF_8)).toString();
  }

  private static Instant receivedAt(JsonNode entry, WebhookDelivery delivery) {
    String value = text(entry, "received_at");
    if (value == null) {
      return delivery.receivedAt();
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      return delivery.receivedAt();
    }
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    String text = value.asText();
    return text.isEmpty() ? null : text;
  }
}
