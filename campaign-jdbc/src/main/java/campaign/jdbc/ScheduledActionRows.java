package campaign.jdbc;

import campaign.model.ScheduledAction;
import campaign.model.ScheduledActionStatus;

/**
 * Column list and row mapper shared by the action queue store and the dialect claim queries.
 */
public final class ScheduledActionRows {

  public static final String TABLE = "scheduled_actions";

  public static final String COLUMNS = "id, tenant_id, campaign_id, instance_id, step_instance_id, "
      + "scheduled_at, status, attempts, claimed_by, claim_token, claimed_at, lease_expires_at, "
      + "last_error, created_at";

  public static final JdbcTemplate.RowMapper<ScheduledAction> MAPPER = rs -> new ScheduledAction(
      rs.getString("id"),
      rs.getString("tenant_id"),
      rs.getString("campaign_id"),
      rs.getString("instance_id"),
      rs.getString("step_instance_id"),
      JdbcTemplate.instant(rs, "scheduled_at"),
      ScheduledActionStatus.fromCode(rs.getInt("status")),
      rs.getInt("attempts"),
      rs.getString("claimed_by"),
      rs.getString("claim_token"),
      JdbcTemplate.instant(rs, "claimed_at"),
      JdbcTemplate.instant(rs, "lease_expires_at"),
      rs.getString("last_error"),
      JdbcTemplate.instant(rs, "created_at"));

  private ScheduledActionRows() {
  }
}
