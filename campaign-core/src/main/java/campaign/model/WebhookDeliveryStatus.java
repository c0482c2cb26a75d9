package campaign.model;

import java.util.Arrays;

public enum WebhookDeliveryStatus {
  RECEIVED(0),
  PROCESSED(1),
  PARTIAL_FAILURE(2),
  FAILED(3);

  private final int code;

  WebhookDeliveryStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static WebhookDeliveryStatus fromCode(int code) {
    return Arrays.stream(values())
        .filter(s -> s.code == code)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown delivery status code: " + code));
  }
}
