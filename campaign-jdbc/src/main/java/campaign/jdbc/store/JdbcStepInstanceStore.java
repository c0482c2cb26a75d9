package campaign.jdbc.store;

import campaign.jdbc.JdbcTemplate;
import campaign.jdbc.spi.Dialect;
import campaign.model.CampaignStepInstance;
import campaign.model.Channel;
import campaign.model.StepAnchor;
import campaign.model.StepCondition;
import campaign.model.StepInstanceStatus;
import campaign.spi.StepInstanceStore;
import campaign.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * JDBC store for {@code campaign_step_instances}.
 */
public final class JdbcStepInstanceStore extends AbstractJdbcStore implements StepInstanceStore {

  private static final String TABLE = "campaign_step_instances";
  private static final String COLUMNS = "id, tenant_id, instance_id, campaign_id, contact_id, step_order, "
      + "channel, step_condition, anchor, delay_ms, send_window, rendered_config, scheduled_at, status, "
      + "branch_outcome, epoch, sent_at, last_error, updated_at";
  private static final String SELECT = "SELECT " + COLUMNS + " FROM " + TABLE;

  public JdbcStepInstanceStore(Dialect dialect, JsonCodec jsonCodec) {
    super(dialect, jsonCodec);
  }

  @Override
  public void insertAll(Connection conn, List<CampaignStepInstance> steps) {
    String sql = "INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    for (CampaignStepInstance step : steps) {
      JdbcTemplate.update(conn, sql,
          step.id(), step.tenantId(), step.instanceId(), step.campaignId(), step.contactId(), step.stepOrder(),
          step.channel().value(), step.condition().name(), step.anchor().name(), millis(step.delay()),
          window(step.sendWindow()), json(step.renderedConfig()), step.scheduledAt(), step.status().code(),
          step.branchOutcome(), step.epoch(), step.sentAt(), JdbcTemplate.truncate(step.lastError()),
          step.updatedAt());
    }
  }

  @Override
  public Optional<CampaignStepInstance> find(Connection conn, String tenantId, String stepInstanceId) {
    return JdbcTemplate.queryOne(conn, SELECT + " WHERE tenant_id=? AND id=?", this::map,
        tenantId, stepInstanceId);
  }

  @Override
  public Optional<CampaignStepInstance> lock(Connection conn, String tenantId, String stepInstanceId) {
    return JdbcTemplate.queryOne(conn, SELECT + " WHERE tenant_id=? AND id=? FOR UPDATE", this::map,
        tenantId, stepInstanceId);
  }

  @Override
  public List<CampaignStepInstance> listByInstance(Connection conn, String tenantId, String instanceId) {
    return JdbcTemplate.query(conn, SELECT + " WHERE tenant_id=? AND instance_id=? ORDER BY step_order",
        this::map, tenantId, instanceId);
  }

  @Override
  public int update(Connection conn, CampaignStepInstance step, StepInstanceStatus expectedStatus) {
    return JdbcTemplate.update(conn, "UPDATE " + TABLE
            + " SET scheduled_at=?, status=?, branch_outcome=?, epoch=?, sent_at=?, last_error=?, updated_at=?"
            + " WHERE tenant_id=? AND id=? AND status=?",
        step.scheduledAt(), step.status().code(), step.branchOutcome(), step.epoch(), step.sentAt(),
        JdbcTemplate.truncate(step.lastError()), step.updatedAt(),
        step.tenantId(), step.id(), expectedStatus.code());
  }

  private CampaignStepInstance map(ResultSet rs) throws SQLException {
    return new CampaignStepInstance(
        rs.getString("id"),
        rs.getString("tenant_id"),
        rs.getString("instance_id"),
        rs.getString("campaign_id"),
        rs.getString("contact_id"),
        rs.getInt("step_order"),
        Channel.fromValue(rs.getString("channel")),
        StepCondition.valueOf(rs.getString("step_condition")),
        StepAnchor.valueOf(rs.getString("anchor")),
        duration(rs, "delay_ms"),
        window(rs, "send_window"),
        map(rs, "rendered_config"),
        JdbcTemplate.instant(rs, "scheduled_at"),
        StepInstanceStatus.fromCode(rs.getInt("status")),
        rs.getString("branch_outcome"),
        rs.getInt("epoch"),
        JdbcTemplate.instant(rs, "sent_at"),
        rs.getString("last_error"),
        JdbcTemplate.instant(rs, "updated_at"));
  }
}
