package campaign.ingest;

import campaign.model.MessageEvent;
import campaign.model.MessageEventType;
import campaign.model.NormalizedEvent;
import campaign.model.WebhookDelivery;
import campaign.util.Ids;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Normalizes SendGrid Event Webhook batches.
 *
 * <p>The payload is a JSON array. Entries without {@code email}, {@code event} or a
 * {@code timestamp} between the epoch and the end of year 9999, or whose {@code email}
 * lacks an {@code @}, are skipped, as
 * are event types that carry no campaign meaning ({@code processed}). Custom args
 * {@code tenant_id}, {@code outbound_message_id} and {@code dedupe_key} are read from the
 * top level of each entry, where SendGrid flattens them.
 */
public final class SendGridWebhookNormalizer implements WebhookNormalizer {
  private static final Logger logger = Logger.getLogger(SendGridWebhookNormalizer.class.getName());

  public static final String PROVIDER = "sendgrid";

  // 9999-12-31T23:59:59Z; every supported database can store it
  static final long MAX_TIMESTAMP = 253402300799L;

  private static final String[] DATA_FIELDS = {
      "email", "reason", "status", "type", "url", "useragent", "ip", "response", "attempt", "asm_group_id",
      "campaign_id"
  };

  private final ObjectMapper mapper;

  public SendGridWebhookNormalizer() {
    this(new ObjectMapper());
  }

  public SendGridWebhookNormalizer(ObjectMapper mapper) {
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
      throw new IllegalArgumentException("SendGrid payload is not valid JSON", e);
    }
    if (root == null || !root.isArray()) {
      throw new IllegalArgumentException("SendGrid payload must be a JSON array");
    }
    List<NormalizedEvent> events = new ArrayList<>();
    for (JsonNode entry : root) {
      MessageEvent event = toEvent(entry);
      if (event != null) {
        events.add(event);
      }
    }
    return events;
  }

  private MessageEvent toEvent(JsonNode entry) {
    String email = text(entry, "email");
    String eventName = text(entry, "event");
    long timestamp = entry.path("timestamp").asLong(0L);
    if (email == null || eventName == null || !entry.path("timestamp").isNumber()) {
      logger.log(Level.WARNING, "Skipping SendGrid event missing email, event or timestamp: {0}", entry);
      return null;
    }
    if (email.indexOf('@') < 0 || timestamp <= 0 || timestamp > MAX_TIMESTAMP) {
      logger.log(Level.WARNING, "Skipping SendGrid event with invalid email or timestamp: {0}", entry);
      return null;
    }
    MessageEventType type = mapType(eventName);
    if (type == null) {
      logger.log(Level.FINE, "Ignoring SendGrid event type {0}", eventName);
      return null;
    }

    Map<String, String> data = new LinkedHashMap<>();
    for (String field : DATA_FIELDS) {
      String value = text(entry, field);
      if (value != null) {
        data.put(field, value);
      }
    }
    return new MessageEvent(Ids.newId(), text(entry, "tenant_id"), text(entry, "outbound_message_id"),
        text(entry, "dedupe_key"), providerMessageId(entry), type, Instant.ofEpochSecond(timestamp),
        text(entry, "sg_event_id"), data);
  }

  static MessageEventType mapType(String eventName) {
    switch (eventName) {
      case "delivered":
        return MessageEventType.DELIVERED;
      case "deferred":
        return MessageEventType.DEFERRED;
      case "bounce":
        return MessageEventType.BOUNCED;
      case "dropped":
        return MessageEventType.DROPPED;
      case "open":
        return MessageEventType.OPENED;
      case "click":
        return MessageEventType.CLICKED;
      case "spamreport":
      case "spam_report":
        return MessageEventType.SPAM;
      case "unsubscribe":
        return MessageEventType.UNSUBSCRIBED;
      case "group_unsubscribe":
        return MessageEventType.GROUP_UNSUBSCRIBED;
      case "group_resubscribe":
        return MessageEventType.GROUP_RESUBSCRIBED;
      default:
        return null;
    }
  }

  /**
   * SendGrid suffixes {@code sg_message_id} with a filter id after the first dot; the
   * part before it is the id returned by the send API.
   */
  private static String providerMessageId(JsonNode entry) {
    String id = text(entry, "sg_message_id");
    if (id == null) {
      id = text(entry, "smtp-id");
    }
    if (id == null) {
      return null;
    }
    int dot = id.indexOf('.');
    return dot > 0 ? id.substring(0, dot) : id;
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
