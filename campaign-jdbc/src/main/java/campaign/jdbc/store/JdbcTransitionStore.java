package campaign.jdbc.store;

import campaign.jdbc.JdbcTemplate;
import campaign.jdbc.spi.Dialect;
import campaign.model.CampaignTransition;
import campaign.model.TransitionSubject;
import campaign.spi.TransitionStore;
import campaign.util.JsonCodec;

import java.sql.Connection;
import java.util.List;

/**
 * Append-only JDBC store for {@code campaign_transitions}. Ids are monotonic, so ordering by
 * {@code id} after {@code occurred_at} preserves write order within one millisecond.
 */
public final class JdbcTransitionStore extends AbstractJdbcStore implements TransitionStore {

  private static final String COLUMNS = "id, tenant_id, campaign_id, instance_id, step_instance_id, subject, "
      + "from_status, to_status, reason, occurred_at";

  public JdbcTransitionStore(Dialect dialect, JsonCodec jsonCodec) {
    super(dialect, jsonCodec);
  }

  @Override
  public void insert(Connection conn, CampaignTransition transition) {
    JdbcTemplate.update(conn, "INSERT INTO campaign_transitions (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?)",
        transition.id(), transition.tenantId(), transition.campaignId(), transition.instanceId(),
        transition.stepInstanceId(), transition.subject().value(), transition.fromStatus(),
        transition.toStatus(), JdbcTemplate.truncate(transition.reason()), transition.occurredAt());
  }

  @Override
  public List<CampaignTransition> listByInstance(Connection conn, String tenantId, String instanceId) {
    return JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM campaign_transitions"
            + " WHERE tenant_id=? AND instance_id=? ORDER BY occurred_at, id",
        rs -> new CampaignTransition(
            rs.getString("id"),
            rs.getString("tenant_id"),
            rs.getString("campaign_id"),
            rs.getString("instance_id"),
            rs.getString("step_instance_id"),
            TransitionSubject.fromValue(rs.getString("subject")),
            rs.getString("from_status"),
            rs.getString("to_status"),
            rs.getString("reason"),
            JdbcTemplate.instant(rs, "occurred_at")),
        tenantId, instanceId);
  }
}
