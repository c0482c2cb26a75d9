package campaign.ingest;

/**
 * Thrown when a webhook fails signature verification. The payload stays archived with
 * status {@code failed}.
 */
public class WebhookRejectedException extends RuntimeException {
  private final String deliveryId;

  public WebhookRejectedException(String deliveryId, String message) {
    super(message);
    this.deliveryId = deliveryId;
  }

  public String deliveryId() {
    return deliveryId;
  }
}
