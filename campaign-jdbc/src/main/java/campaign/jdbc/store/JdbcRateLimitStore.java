package campaign.jdbc.store;

import campaign.jdbc.JdbcTemplate;
import campaign.jdbc.spi.Dialect;
import campaign.model.Channel;
import campaign.model.RateLimitScope;
import campaign.model.SendRateLimit;
import campaign.spi.RateLimitStore;
import campaign.util.Ids;
import campaign.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * JDBC store for send rate policies and their sliding-window ledger.
 *
 * <p>Tenant-scoped policies are stored with an empty {@code identity_id} so the unique key
 * covers them. Policy rows are locked tenant scope first, then identity scope.
 */
public final class JdbcRateLimitStore extends AbstractJdbcStore implements RateLimitStore {

  private static final String COLUMNS = "id, tenant_id, channel, scope, identity_id, window_ms, max_sends";
  private static final String NO_IDENTITY = "";

  public JdbcRateLimitStore(Dialect dialect, JsonCodec jsonCodec) {
    super(dialect, jsonCodec);
  }

  @Override
  public void upsertPolicy(Connection conn, SendRateLimit policy) {
    String identity = policy.identityId() == null ? NO_IDENTITY : policy.identityId();
    String update = "UPDATE send_rate_limits SET window_ms=?, max_sends=?"
        + " WHERE tenant_id=? AND channel=? AND scope=? AND identity_id=?";
    Object[] updateParams = {policy.window().toMillis(), policy.maxSends(), policy.tenantId(),
        policy.channel().value(), policy.scope().value(), identity};
    if (JdbcTemplate.update(conn, update, updateParams) > 0) {
      return;
    }
    boolean inserted = dialect.insertIfAbsent(conn, "INSERT INTO send_rate_limits (" + COLUMNS + ")"
            + " VALUES (?,?,?,?,?,?,?)",
        policy.id(), policy.tenantId(), policy.channel().value(), policy.scope().value(), identity,
        policy.window().toMillis(), policy.maxSends());
    if (!inserted) {
      JdbcTemplate.update(conn, update, updateParams);
    }
  }

  @Override
  public List<SendRateLimit> lockPolicies(Connection conn, String tenantId, Channel channel, String identityId) {
    return JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM send_rate_limits"
            + " WHERE tenant_id=? AND channel=? AND (scope=? OR (scope=? AND identity_id=?))"
            + " ORDER BY scope DESC, id FOR UPDATE",
        JdbcRateLimitStore::map, tenantId, channel.value(), RateLimitScope.TENANT.value(),
        RateLimitScope.IDENTITY.value(), identityId == null ? NO_IDENTITY : identityId);
  }

  @Override
  public int countSince(Connection conn, String policyId, Instant since) {
    return JdbcTemplate.query(conn, "SELECT COUNT(*) FROM send_rate_ledger WHERE policy_id=? AND sent_at > ?",
        rs -> rs.getInt(1), policyId, since).get(0);
  }

  @Override
  public void recordPermit(Connection conn, String policyId, Instant at) {
    JdbcTemplate.update(conn, "INSERT INTO send_rate_ledger (id, policy_id, sent_at) VALUES (?,?,?)",
        Ids.newId(), policyId, at);
  }

  @Override
  public int purgeBefore(Connection conn, String policyId, Instant before) {
    return JdbcTemplate.update(conn, "DELETE FROM send_rate_ledger WHERE policy_id=? AND sent_at <= ?",
        policyId, before);
  }

  private static SendRateLimit map(ResultSet rs) throws SQLException {
    RateLimitScope scope = RateLimitScope.fromValue(rs.getString("scope"));
    String identity = rs.getString("identity_id");
    return new SendRateLimit(
        rs.getString("id"),
        rs.getString("tenant_id"),
        Channel.fromValue(rs.getString("channel")),
        scope,
        scope == RateLimitScope.TENANT || NO_IDENTITY.equals(identity) ? null : identity,
        Duration.ofMillis(rs.getLong("window_ms")),
        rs.getInt("max_sends"));
  }
}
