package campaign.jdbc.store;

import campaign.jdbc.JdbcTemplate;
import campaign.jdbc.spi.Dialect;
import campaign.model.Channel;
import campaign.model.CommunicationSuppression;
import campaign.model.ContactUnsubscribe;
import campaign.model.EmailValidationResult;
import campaign.spi.SuppressionStore;
import campaign.util.JsonCodec;

import java.sql.Connection;
import java.util.Optional;

/**
 * JDBC store for suppressions, unsubscribes and e-mail validation results.
 *
 * <p>Upserts update first and insert when no row matched; a concurrent insert that wins the
 * race is overwritten by a second update.
 */
public final class JdbcSuppressionStore extends AbstractJdbcStore implements SuppressionStore {

  public JdbcSuppressionStore(Dialect dialect, JsonCodec jsonCodec) {
    super(dialect, jsonCodec);
  }

  @Override
  public void upsertSuppression(Connection conn, CommunicationSuppression s) {
    String update = "UPDATE communication_suppressions SET reason=?, suppressed_at=?, expires_at=?"
        + " WHERE tenant_id=? AND channel=? AND address=?";
    Object[] updateParams = {s.reason(), s.suppressedAt(), s.expiresAt(), s.tenantId(), s.channel().value(),
        s.address()};
    if (JdbcTemplate.update(conn, update, updateParams) > 0) {
      return;
    }
    boolean inserted = dialect.insertIfAbsent(conn, "INSERT INTO communication_suppressions"
            + " (tenant_id, channel, address, reason, suppressed_at, expires_at) VALUES (?,?,?,?,?,?)",
        s.tenantId(), s.channel().value(), s.address(), s.reason(), s.suppressedAt(), s.expiresAt());
    if (!inserted) {
      JdbcTemplate.update(conn, update, updateParams);
    }
  }

  @Override
  public Optional<CommunicationSuppression> findSuppression(Connection conn, String tenantId, Channel channel,
      String address) {
    return JdbcTemplate.queryOne(conn, "SELECT tenant_id, channel, address, reason, suppressed_at, expires_at"
            + " FROM communication_suppressions WHERE tenant_id=? AND channel=? AND address=?",
        rs -> new CommunicationSuppression(
            rs.getString("tenant_id"),
            Channel.fromValue(rs.getString("channel")),
            rs.getString("address"),
            rs.getString("reason"),
            JdbcTemplate.instant(rs, "suppressed_at"),
            JdbcTemplate.instant(rs, "expires_at")),
        tenantId, channel.value(), address);
  }

  @Override
  public int removeSuppression(Connection conn, String tenantId, Channel channel, String address) {
    return JdbcTemplate.update(conn, "DELETE FROM communication_suppressions"
        + " WHERE tenant_id=? AND channel=? AND address=?", tenantId, channel.value(), address);
  }

  @Override
  public void upsertUnsubscribe(Connection conn, ContactUnsubscribe u) {
    String update = "UPDATE contact_unsubscribes SET source=?, unsubscribed_at=?"
        + " WHERE tenant_id=? AND channel=? AND address=?";
    Object[] updateParams = {u.source(), u.unsubscribedAt(), u.tenantId(), u.channel().value(), u.address()};
    if (JdbcTemplate.update(conn, update, updateParams) > 0) {
      return;
    }
    boolean inserted = dialect.insertIfAbsent(conn, "INSERT INTO contact_unsubscribes"
            + " (tenant_id, channel, address, source, unsubscribed_at) VALUES (?,?,?,?,?)",
        u.tenantId(), u.channel().value(), u.address(), u.source(), u.unsubscribedAt());
    if (!inserted) {
      JdbcTemplate.update(conn, update, updateParams);
    }
  }

  @Override
  public Optional<ContactUnsubscribe> findUnsubscribe(Connection conn, String tenantId, Channel channel,
      String address) {
    return JdbcTemplate.queryOne(conn, "SELECT tenant_id, channel, address, source, unsubscribed_at"
            + " FROM contact_unsubscribes WHERE tenant_id=? AND channel=? AND address=?",
        rs -> new ContactUnsubscribe(
            rs.getString("tenant_id"),
            Channel.fromValue(rs.getString("channel")),
            rs.getString("address"),
            rs.getString("source"),
            JdbcTemplate.instant(rs, "unsubscribed_at")),
        tenantId, channel.value(), address);
  }

  @Override
  public int removeUnsubscribe(Connection conn, String tenantId, Channel channel, String address) {
    return JdbcTemplate.update(conn, "DELETE FROM contact_unsubscribes"
        + " WHERE tenant_id=? AND channel=? AND address=?", tenantId, channel.value(), address);
  }

  @Override
  public void upsertValidation(Connection conn, EmailValidationResult r) {
    String update = "UPDATE email_validation_results SET is_valid=?, reason=?, checked_at=?"
        + " WHERE tenant_id=? AND email=?";
    Object[] updateParams = {r.valid(), r.reason(), r.checkedAt(), r.tenantId(), r.email()};
    if (JdbcTemplate.update(conn, update, updateParams) > 0) {
      return;
    }
    boolean inserted = dialect.insertIfAbsent(conn, "INSERT INTO email_validation_results"
            + " (tenant_id, email, is_valid, reason, checked_at) VALUES (?,?,?,?,?)",
        r.tenantId(), r.email(), r.valid(), r.reason(), r.checkedAt());
    if (!inserted) {
      JdbcTemplate.update(conn, update, updateParams);
    }
  }

  @Override
  public Optional<EmailValidationResult> findValidation(Connection conn, String tenantId, String email) {
    return JdbcTemplate.queryOne(conn, "SELECT tenant_id, email, is_valid, reason, checked_at"
            + " FROM email_validation_results WHERE tenant_id=? AND email=?",
        rs -> new EmailValidationResult(
            rs.getString("tenant_id"),
            rs.getString("email"),
            rs.getBoolean("is_valid"),
            rs.getString("reason"),
            JdbcTemplate.instant(rs, "checked_at")),
        tenantId, email);
  }
}
