package campaign.jdbc.dialect;

import campaign.jdbc.JdbcTemplate;
import campaign.jdbc.ScheduledActionRows;
import campaign.model.ScheduledAction;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * MySQL dialect, also used for TiDB.
 *
 * <p>MySQL rejects {@code LIMIT} inside an {@code IN} subquery on the updated table, so the
 * claim uses {@code UPDATE ... ORDER BY ... LIMIT}, which locks the rows it touches.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }

  @Override
  public List<ScheduledAction> claimDue(Connection conn, String tenantId, String ownerId, String claimToken,
      Instant now, Instant leaseExpiresAt, int limit) {
    String claimSql = "UPDATE " + TABLE + CLAIM_SET
        + " WHERE status=0 AND scheduled_at <= ?" + tenantFilter(tenantId)
        + " ORDER BY scheduled_at, id LIMIT ?";
    int updated = JdbcTemplate.update(conn, claimSql, claimParams(tenantId, ownerId, claimToken,
        now, leaseExpiresAt, limit));
    if (updated == 0) return List.of();
    String selectSql = "SELECT " + ScheduledActionRows.COLUMNS + " FROM " + TABLE
        + " WHERE claim_token=? AND status=1 ORDER BY scheduled_at, id";
    return JdbcTemplate.query(conn, selectSql, ScheduledActionRows.MAPPER, claimToken);
  }
}
