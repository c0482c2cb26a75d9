package campaign.jdbc.dialect;

import campaign.jdbc.JdbcTemplate;
import campaign.jdbc.ScheduledActionRows;
import campaign.model.ScheduledAction;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * PostgreSQL dialect.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<ScheduledAction> claimDue(Connection conn, String tenantId, String ownerId, String claimToken,
      Instant now, Instant leaseExpiresAt, int limit) {
    // Single round-trip: FOR UPDATE SKIP LOCKED + RETURNING
    String sql = "UPDATE " + TABLE + CLAIM_SET
        + " WHERE id IN ("
        + "SELECT id FROM " + TABLE
        + " WHERE status=0 AND scheduled_at <= ?" + tenantFilter(tenantId)
        + " ORDER BY scheduled_at, id LIMIT ?"
        + " FOR UPDATE SKIP LOCKED"
        + ") RETURNING " + ScheduledActionRows.COLUMNS;
    List<ScheduledAction> claimed = new ArrayList<>(JdbcTemplate.updateReturning(conn, sql,
        ScheduledActionRows.MAPPER, claimParams(tenantId, ownerId, claimToken, now, leaseExpiresAt, limit)));
    claimed.sort(Comparator.comparing(ScheduledAction::scheduledAt).thenComparing(ScheduledAction::id));
    return claimed;
  }

  /** A failed statement aborts a PostgreSQL transaction, so conflicts are resolved in SQL. */
  @Override
  public boolean insertIfAbsent(Connection conn, String insertSql, Object... params) {
    return JdbcTemplate.update(conn, insertSql + " ON CONFLICT DO NOTHING", params) > 0;
  }
}
