package campaign.jdbc.store;

import campaign.jdbc.JdbcTemplate;
import campaign.jdbc.spi.Dialect;
import campaign.model.MessageEvent;
import campaign.model.MessageEventType;
import campaign.spi.MessageEventStore;
import campaign.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * JDBC store for {@code message_events}.
 */
public final class JdbcMessageEventStore extends AbstractJdbcStore implements MessageEventStore {

  private static final String COLUMNS = "id, tenant_id, message_id, dedupe_key, provider_message_id, "
      + "event_type, event_at, provider_event_id, data";

  public JdbcMessageEventStore(Dialect dialect, JsonCodec jsonCodec) {
    super(dialect, jsonCodec);
  }

  @Override
  public void insert(Connection conn, MessageEvent event) {
    JdbcTemplate.update(conn, "INSERT INTO message_events (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)",
        event.id(), event.tenantId(), event.messageId(), event.dedupeKey(), event.providerMessageId(),
        event.type().value(), event.eventAt(), event.providerEventId(), json(event.data()));
  }

  @Override
  public boolean existsByProviderEventId(Connection conn, String tenantId, String providerEventId) {
    if (providerEventId == null) {
      return false;
    }
    return !JdbcTemplate.query(conn, "SELECT id FROM message_events WHERE tenant_id=? AND provider_event_id=?",
        rs -> rs.getString(1), tenantId, providerEventId).isEmpty();
  }

  @Override
  public List<MessageEvent> listByMessage(Connection conn, String tenantId, String messageId) {
    return JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM message_events"
        + " WHERE tenant_id=? AND message_id=? ORDER BY event_at, id", this::map, tenantId, messageId);
  }

  private MessageEvent map(ResultSet rs) throws SQLException {
    return new MessageEvent(
        rs.getString("id"),
        rs.getString("tenant_id"),
        rs.getString("message_id"),
        rs.getString("dedupe_key"),
        rs.getString("provider_message_id"),
        MessageEventType.fromValue(rs.getString("event_type")),
        JdbcTemplate.instant(rs, "event_at"),
        rs.getString("provider_event_id"),
        map(rs, "data"));
  }
}
