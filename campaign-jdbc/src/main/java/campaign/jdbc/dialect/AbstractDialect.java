package campaign.jdbc.dialect;

import campaign.jdbc.JdbcTemplate;
import campaign.jdbc.ScheduledActionRows;
import campaign.jdbc.spi.Dialect;
import campaign.model.ScheduledAction;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses can override methods to provide database-specific SQL.
 */
public abstract class AbstractDialect implements Dialect {

  protected static final String TABLE = ScheduledActionRows.TABLE;

  protected static final String CLAIM_SET = " SET status=1, claimed_by=?, claim_token=?, claimed_at=?,"
      + " lease_expires_at=?, updated_at=?";

  @Override
  public List<ScheduledAction> claimDue(Connection conn, String tenantId, String ownerId, String claimToken,
      Instant now, Instant leaseExpiresAt, int limit) {
    // Phase 1: UPDATE with subquery (H2-compatible default). The outer status check keeps a row
    // that another claimer committed while this statement waited on its lock out of the batch.
    String claimSql = "UPDATE " + TABLE + CLAIM_SET
        + " WHERE status=0 AND id IN ("
        + "SELECT id FROM " + TABLE
        + " WHERE status=0 AND scheduled_at <= ?" + tenantFilter(tenantId)
        + " ORDER BY scheduled_at, id LIMIT ?)";
    int updated = JdbcTemplate.update(conn, claimSql, claimParams(tenantId, ownerId, claimToken,
        now, leaseExpiresAt, limit));
    if (updated == 0) return List.of();
    // Phase 2: SELECT claimed rows
    String selectSql = "SELECT " + ScheduledActionRows.COLUMNS + " FROM " + TABLE
        + " WHERE claim_token=? AND status=1 ORDER BY scheduled_at, id";
    return JdbcTemplate.query(conn, selectSql, ScheduledActionRows.MAPPER, claimToken);
  }

  @Override
  public boolean insertIfAbsent(Connection conn, String insertSql, Object... params) {
    return JdbcTemplate.insertIgnoringDuplicate(conn, insertSql, params);
  }

  protected static String tenantFilter(String tenantId) {
    return tenantId == null ? "" : " AND tenant_id=?";
  }

  protected static Object[] claimParams(String tenantId, String ownerId, String claimToken,
      Instant now, Instant leaseExpiresAt, int limit) {
    List<Object> params = new ArrayList<>(List.of(ownerId, claimToken, now, leaseExpiresAt, now, now));
    if (tenantId != null) {
      params.add(tenantId);
    }
    params.add(limit);
    return params.toArray();
  }
}
