package campaign.jdbc.store;

import campaign.jdbc.JdbcTemplate;
import campaign.jdbc.spi.Dialect;
import campaign.model.WebhookDelivery;
import campaign.model.WebhookDeliveryStatus;
import campaign.spi.WebhookDeliveryStore;
import campaign.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * JDBC archive of raw webhook deliveries in {@code webhook_deliveries}.
 */
public final class JdbcWebhookDeliveryStore extends AbstractJdbcStore implements WebhookDeliveryStore {

  private static final String COLUMNS = "id, tenant_id, provider, event_type, message_id, payload, signature, "
      + "status, received_at, processed_at, error";

  public JdbcWebhookDeliveryStore(Dialect dialect, JsonCodec jsonCodec) {
    super(dialect, jsonCodec);
  }

  @Override
  public void insert(Connection conn, WebhookDelivery delivery) {
    JdbcTemplate.update(conn, "INSERT INTO webhook_deliveries (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?)",
        delivery.id(), delivery.tenantId(), delivery.provider(), delivery.eventType(), delivery.messageId(),
        delivery.payload(), delivery.signature(), delivery.status().code(), delivery.receivedAt(),
        delivery.processedAt(), JdbcTemplate.truncate(delivery.error()));
  }

  @Override
  public Optional<WebhookDelivery> find(Connection conn, String provider, String deliveryId) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM webhook_deliveries WHERE provider=? AND id=?",
        rs -> new WebhookDelivery(
            rs.getString("id"),
            rs.getString("tenant_id"),
            rs.getString("provider"),
            rs.getString("event_type"),
            rs.getString("message_id"),
            rs.getString("payload"),
            rs.getString("signature"),
            WebhookDeliveryStatus.fromCode(rs.getInt("status")),
            JdbcTemplate.instant(rs, "received_at"),
            JdbcTemplate.instant(rs, "processed_at"),
            rs.getString("error")),
        provider, deliveryId);
  }

  @Override
  public int updateOutcome(Connection conn, String deliveryId, WebhookDeliveryStatus status, String tenantId,
      String eventType, String messageId, String error, Instant processedAt) {
    return JdbcTemplate.update(conn, "UPDATE webhook_deliveries SET status=?, tenant_id=COALESCE(?, tenant_id),"
            + " event_type=COALESCE(?, event_type), message_id=COALESCE(?, message_id), error=?, processed_at=?"
            + " WHERE id=?",
        status.code(), tenantId, eventType, messageId, JdbcTemplate.truncate(error), processedAt, deliveryId);
  }
}
