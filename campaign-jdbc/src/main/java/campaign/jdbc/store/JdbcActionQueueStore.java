package campaign.jdbc.store;

import campaign.jdbc.JdbcTemplate;
import campaign.jdbc.ScheduledActionRows;
import campaign.jdbc.spi.Dialect;
import campaign.model.ScheduledAction;
import campaign.spi.ActionQueueStore;
import campaign.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC action queue over {@code scheduled_actions}.
 *
 * <p>Status codes: 0=PENDING, 1=CLAIMED, 2=EXECUTING, 3=DONE, 4=FAILED, 5=CANCELED.
 */
public final class JdbcActionQueueStore extends AbstractJdbcStore implements ActionQueueStore {

  private static final String TABLE = ScheduledActionRows.TABLE;
  private static final String SELECT = "SELECT " + ScheduledActionRows.COLUMNS + " FROM " + TABLE;

  public JdbcActionQueueStore(Dialect dialect, JsonCodec jsonCodec) {
    super(dialect, jsonCodec);
  }

  @Override
  public void insert(Connection conn, ScheduledAction action) {
    JdbcTemplate.update(conn, "INSERT INTO " + TABLE + " (" + ScheduledActionRows.COLUMNS + ", updated_at)"
            + " VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
        action.id(), action.tenantId(), action.campaignId(), action.instanceId(), action.stepInstanceId(),
        action.scheduledAt(), action.status().code(), action.attempts(), action.claimedBy(),
        action.claimToken(), action.claimedAt(), action.leaseExpiresAt(),
        JdbcTemplate.truncate(action.lastError()), action.createdAt(), action.createdAt());
  }

  @Override
  public Optional<ScheduledAction> find(Connection conn, String tenantId, String actionId) {
    return JdbcTemplate.queryOne(conn, SELECT + " WHERE tenant_id=? AND id=?",
        ScheduledActionRows.MAPPER, tenantId, actionId);
  }

  @Override
  public List<ScheduledAction> listByStep(Connection conn, String tenantId, String stepInstanceId) {
    return JdbcTemplate.query(conn, SELECT + " WHERE tenant_id=? AND step_instance_id=? ORDER BY created_at, id",
        ScheduledActionRows.MAPPER, tenantId, stepInstanceId);
  }

  @Override
  public List<ScheduledAction> claimDue(Connection conn, String tenantId, String ownerId, String claimToken,
      Instant now, Instant leaseExpiresAt, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    return dialect.claimDue(conn, tenantId, ownerId, claimToken, now, leaseExpiresAt, limit);
  }

  @Override
  public int markExecuting(Connection conn, String actionId, String claimToken, Instant now) {
    return JdbcTemplate.update(conn, "UPDATE " + TABLE + " SET status=2, updated_at=?"
        + " WHERE id=? AND claim_token=? AND status=1", now, actionId, claimToken);
  }

  @Override
  public int markDone(Connection conn, String actionId, String claimToken, Instant now) {
    return JdbcTemplate.update(conn, "UPDATE " + TABLE + " SET status=3, lease_expires_at=NULL, updated_at=?"
        + " WHERE id=? AND claim_token=? AND status IN (1,2)", now, actionId, claimToken);
  }

  @Override
  public int markFailed(Connection conn, String actionId, String claimToken, String error, Instant now) {
    return JdbcTemplate.update(conn, "UPDATE " + TABLE
            + " SET status=4, attempts=attempts+1, last_error=?, lease_expires_at=NULL, updated_at=?"
            + " WHERE id=? AND claim_token=? AND status IN (1,2)",
        JdbcTemplate.truncate(error), now, actionId, claimToken);
  }

  @Override
  public int cancelClaimed(Connection conn, String actionId, String claimToken, String reason, Instant now) {
    return JdbcTemplate.update(conn, "UPDATE " + TABLE
            + " SET status=5, last_error=?, lease_expires_at=NULL, updated_at=?"
            + " WHERE id=? AND claim_token=? AND status IN (1,2)",
        JdbcTemplate.truncate(reason), now, actionId, claimToken);
  }

  @Override
  public int release(Connection conn, String actionId, String claimToken, Instant nextAt, String error,
      boolean countAttempt, Instant now) {
    return JdbcTemplate.update(conn, "UPDATE " + TABLE
            + " SET status=0, scheduled_at=?, attempts=attempts+?, last_error=?,"
            + " claimed_by=NULL, claim_token=NULL, claimed_at=NULL, lease_expires_at=NULL, updated_at=?"
            + " WHERE id=? AND claim_token=? AND status IN (1,2)",
        nextAt, countAttempt ? 1 : 0, JdbcTemplate.truncate(error), now, actionId, claimToken);
  }

  @Override
  public int cancelPendingByCampaign(Connection conn, String tenantId, String campaignId, String reason,
      Instant now) {
    return cancelPending(conn, "campaign_id", tenantId, campaignId, reason, now);
  }

  @Override
  public int cancelPendingByInstance(Connection conn, String tenantId, String instanceId, String reason,
      Instant now) {
    return cancelPending(conn, "instance_id", tenantId, instanceId, reason, now);
  }

  @Override
  public int cancelPendingByStep(Connection conn, String tenantId, String stepInstanceId, String reason,
      Instant now) {
    return cancelPending(conn, "step_instance_id", tenantId, stepInstanceId, reason, now);
  }

  @Override
  public boolean hasInFlight(Connection conn, String tenantId, String stepInstanceId) {
    return !JdbcTemplate.query(conn, "SELECT id FROM " + TABLE
            + " WHERE tenant_id=? AND step_instance_id=? AND status IN (0,1,2)",
        rs -> rs.getString(1), tenantId, stepInstanceId).isEmpty();
  }

  @Override
  public int reclaimExpired(Connection conn, Instant now) {
    return JdbcTemplate.update(conn, "UPDATE " + TABLE
            + " SET status=0, attempts=attempts+1, last_error=?,"
            + " claimed_by=NULL, claim_token=NULL, claimed_at=NULL, lease_expires_at=NULL, updated_at=?"
            + " WHERE status IN (1,2) AND lease_expires_at < ?",
        "lease expired", now, now);
  }

  @Override
  public Optional<Instant> oldestDue(Connection conn, Instant now) {
    List<Instant> rows = JdbcTemplate.query(conn, "SELECT MIN(scheduled_at) AS oldest FROM " + TABLE
            + " WHERE status=0 AND scheduled_at <= ?",
        rs -> JdbcTemplate.instant(rs, "oldest"), now);
    return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
  }

  private int cancelPending(Connection conn, String column, String tenantId, String value, String reason,
      Instant now) {
    return JdbcTemplate.update(conn, "UPDATE " + TABLE + " SET status=5, last_error=?, updated_at=?"
            + " WHERE tenant_id=? AND " + column + "=? AND status=0",
        JdbcTemplate.truncate(reason), now, tenantId, value);
  }
}
