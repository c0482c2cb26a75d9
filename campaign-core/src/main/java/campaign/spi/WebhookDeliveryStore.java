package campaign.spi;

import campaign.model.WebhookDelivery;
import campaign.model.WebhookDeliveryStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Raw webhook archive. Deliveries are addressed by provider because the tenant is only
 * known after normalization.
 */
public interface WebhookDeliveryStore {

  void insert(Connection conn, WebhookDelivery delivery);

  Optional<WebhookDelivery> find(Connection conn, String provider, String deliveryId);

  int updateOutcome(Connection conn, String deliveryId, WebhookDeliveryStatus status, String tenantId,
      String eventType, String messageId, String error, Instant processedAt);
}
