package campaign.jdbc.store;

import campaign.jdbc.JdbcTemplate;
import campaign.jdbc.spi.Dialect;
import campaign.model.Channel;
import campaign.model.InboundMessage;
import campaign.spi.InboundMessageStore;
import campaign.util.JsonCodec;

import java.sql.Connection;
import java.util.List;

/**
 * JDBC store for {@code inbound_messages}.
 */
public final class JdbcInboundMessageStore extends AbstractJdbcStore implements InboundMessageStore {

  private static final String COLUMNS = "id, tenant_id, campaign_id, contact_id, message_id, channel, "
      + "provider_message_id, from_address, subject, body, raw, received_at";

  public JdbcInboundMessageStore(Dialect dialect, JsonCodec jsonCodec) {
    super(dialect, jsonCodec);
  }

  @Override
  public void insert(Connection conn, InboundMessage message) {
    JdbcTemplate.update(conn, "INSERT INTO inbound_messages (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)",
        message.id(), message.tenantId(), message.campaignId(), message.contactId(), message.messageId(),
        message.channel().value(), message.providerMessageId(), message.fromAddress(), message.subject(),
        message.body(), message.raw(), message.receivedAt());
  }

  @Override
  public boolean exists(Connection conn, String tenantId, String id) {
    return JdbcTemplate.queryOne(conn, "SELECT id FROM inbound_messages WHERE tenant_id=? AND id=?",
        rs -> rs.getString(1), tenantId, id).isPresent();
  }

  @Override
  public List<InboundMessage> listByContact(Connection conn, String tenantId, String campaignId, String contactId) {
    return JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM inbound_messages"
            + " WHERE tenant_id=? AND campaign_id=? AND contact_id=? ORDER BY received_at, id",
        rs -> new InboundMessage(
            rs.getString("id"),
            rs.getString("tenant_id"),
            rs.getString("campaign_id"),
            rs.getString("contact_id"),
            rs.getString("message_id"),
            Channel.fromValue(rs.getString("channel")),
            rs.getString("provider_message_id"),
            rs.getString("from_address"),
            rs.getString("subject"),
            rs.getString("body"),
            rs.getString("raw"),
            JdbcTemplate.instant(rs, "received_at")),
        tenantId, campaignId, contactId);
  }
}
