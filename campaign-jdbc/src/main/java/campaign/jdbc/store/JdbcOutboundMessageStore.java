package campaign.jdbc.store;

import campaign.jdbc.JdbcTemplate;
import campaign.jdbc.spi.Dialect;
import campaign.model.Channel;
import campaign.model.OutboundMessage;
import campaign.model.OutboundMessageState;
import campaign.spi.OutboundMessageStore;
import campaign.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC store for {@code outbound_messages}. The {@code (tenant_id, dedupe_key)} unique key is
 * what makes a send reservation idempotent.
 */
public final class JdbcOutboundMessageStore extends AbstractJdbcStore implements OutboundMessageStore {

  private static final String TABLE = "outbound_messages";
  private static final String COLUMNS = "id, tenant_id, campaign_id, contact_id, step_instance_id, channel, "
      + "address, sender_identity_id, dedupe_key, content, state, provider_message_id, retry_count, "
      + "last_error, created_at, updated_at";
  private static final String SELECT = "SELECT " + COLUMNS + " FROM " + TABLE;

  public JdbcOutboundMessageStore(Dialect dialect, JsonCodec jsonCodec) {
    super(dialect, jsonCodec);
  }

  @Override
  public boolean insertIfAbsent(Connection conn, OutboundMessage message) {
    return dialect.insertIfAbsent(conn, "INSERT INTO " + TABLE + " (" + COLUMNS + ")"
            + " VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
        message.id(), message.tenantId(), message.campaignId(), message.contactId(), message.stepInstanceId(),
        message.channel().value(), message.address(), message.senderIdentityId(), message.dedupeKey(),
        json(message.content()), message.state().code(), message.providerMessageId(), message.retryCount(),
        JdbcTemplate.truncate(message.lastError()), message.createdAt(), message.updatedAt());
  }

  @Override
  public Optional<OutboundMessage> find(Connection conn, String tenantId, String messageId) {
    return JdbcTemplate.queryOne(conn, SELECT + " WHERE tenant_id=? AND id=?", this::map, tenantId, messageId);
  }

  @Override
  public Optional<OutboundMessage> findByDedupeKey(Connection conn, String tenantId, String dedupeKey) {
    return JdbcTemplate.queryOne(conn, SELECT + " WHERE tenant_id=? AND dedupe_key=?", this::map,
        tenantId, dedupeKey);
  }

  @Override
  public Optional<OutboundMessage> findByProviderMessageId(Connection conn, String tenantId,
      String providerMessageId) {
    if (tenantId == null) {
      return JdbcTemplate.queryOne(conn, SELECT + " WHERE provider_message_id=? ORDER BY created_at DESC",
          this::map, providerMessageId);
    }
    return JdbcTemplate.queryOne(conn, SELECT + " WHERE tenant_id=? AND provider_message_id=?"
        + " ORDER BY created_at DESC", this::map, tenantId, providerMessageId);
  }

  @Override
  public Optional<OutboundMessage> findById(Connection conn, String messageId) {
    return JdbcTemplate.queryOne(conn, SELECT + " WHERE id=?", this::map, messageId);
  }

  @Override
  public List<OutboundMessage> listByStep(Connection conn, String tenantId, String stepInstanceId) {
    return JdbcTemplate.query(conn, SELECT + " WHERE tenant_id=? AND step_instance_id=? ORDER BY created_at, id",
        this::map, tenantId, stepInstanceId);
  }

  @Override
  public int markSent(Connection conn, String tenantId, String messageId, String providerMessageId, Instant now) {
    return JdbcTemplate.update(conn, "UPDATE " + TABLE
            + " SET state=CASE WHEN state=? THEN ? ELSE state END,"
            + " provider_message_id=COALESCE(provider_message_id, ?), last_error=NULL, updated_at=?"
            + " WHERE tenant_id=? AND id=?",
        OutboundMessageState.QUEUED.code(), OutboundMessageState.SENT.code(), providerMessageId, now,
        tenantId, messageId);
  }

  @Override
  public int recordAttemptFailure(Connection conn, String tenantId, String messageId, String error, Instant now) {
    return JdbcTemplate.update(conn, "UPDATE " + TABLE
            + " SET retry_count=retry_count+1, last_error=?, updated_at=? WHERE tenant_id=? AND id=?",
        JdbcTemplate.truncate(error), now, tenantId, messageId);
  }

  @Override
  public int updateState(Connection conn, String tenantId, String messageId, OutboundMessageState state,
      String error, Instant now) {
    return JdbcTemplate.update(conn, "UPDATE " + TABLE
            + " SET state=?, last_error=COALESCE(?, last_error), updated_at=? WHERE tenant_id=? AND id=?",
        state.code(), JdbcTemplate.truncate(error), now, tenantId, messageId);
  }

  private OutboundMessage map(ResultSet rs) throws SQLException {
    return new OutboundMessage(
        rs.getString("id"),
        rs.getString("tenant_id"),
        rs.getString("campaign_id"),
        rs.getString("contact_id"),
        rs.getString("step_instance_id"),
        Channel.fromValue(rs.getString("channel")),
        rs.getString("address"),
        rs.getString("sender_identity_id"),
        rs.getString("dedupe_key"),
        map(rs, "content"),
        OutboundMessageState.fromCode(rs.getInt("state")),
        rs.getString("provider_message_id"),
        rs.getInt("retry_count"),
        rs.getString("last_error"),
        JdbcTemplate.instant(rs, "created_at"),
        JdbcTemplate.instant(rs, "updated_at"));
  }
}
