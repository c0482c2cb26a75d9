package campaign.model;

import java.util.Arrays;

/**
 * Normalized delivery and engagement event types.
 */
public enum MessageEventType {
  DELIVERED("delivered"),
  DEFERRED("deferred"),
  BOUNCED("bounced"),
  DROPPED("dropped"),
  OPENED("opened"),
  CLICKED("clicked"),
  SPAM("spam"),
  UNSUBSCRIBED("unsubscribed"),
  GROUP_UNSUBSCRIBED("group_unsubscribed"),
  GROUP_RESUBSCRIBED("group_resubscribed");

  private final String value;

  MessageEventType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static MessageEventType fromValue(String value) {
    return Arrays.stream(values())
        .filter(t -> t.value.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown message event type: " + value));
  }
}
