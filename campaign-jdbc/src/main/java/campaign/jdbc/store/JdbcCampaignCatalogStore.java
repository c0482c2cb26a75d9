package campaign.jdbc.store;

import campaign.jdbc.JdbcTemplate;
import campaign.jdbc.spi.Dialect;
import campaign.model.CampaignPlanVersion;
import campaign.model.CampaignStepTemplate;
import campaign.model.CampaignTemplate;
import campaign.model.Channel;
import campaign.model.PlanStep;
import campaign.model.StepAnchor;
import campaign.model.StepCondition;
import campaign.spi.CampaignCatalogStore;
import campaign.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * JDBC store for templates, step templates and published plan versions.
 *
 * <p>A template or plan version with a {@code NULL} tenant is global and visible to every tenant.
 * Plan steps are copied into {@code campaign_plan_steps} at publish time and never updated.
 */
public final class JdbcCampaignCatalogStore extends AbstractJdbcStore implements CampaignCatalogStore {

  private static final String STEP_COLUMNS = "id, template_id, step_order, channel, config, delay_ms, anchor, "
      + "step_condition, send_window, created_at";
  private static final String PLAN_COLUMNS = "id, tenant_id, campaign_id, version, plan_hash, created_at";
  private static final String PLAN_STEP_COLUMNS = "plan_version_id, step_order, step_template_id, channel, "
      + "config, delay_ms, anchor, step_condition, send_window";
  private static final String VISIBLE = " AND (tenant_id IS NULL OR tenant_id=?)";

  public JdbcCampaignCatalogStore(Dialect dialect, JsonCodec jsonCodec) {
    super(dialect, jsonCodec);
  }

  @Override
  public void insertTemplate(Connection conn, CampaignTemplate template) {
    JdbcTemplate.update(conn, "INSERT INTO campaign_templates (id, tenant_id, name, created_at) VALUES (?,?,?,?)",
        template.id(), template.tenantId(), template.name(), template.createdAt());
  }

  @Override
  public Optional<CampaignTemplate> findTemplate(Connection conn, String tenantId, String templateId) {
    return JdbcTemplate.queryOne(conn, "SELECT id, tenant_id, name, created_at FROM campaign_templates"
            + " WHERE id=?" + VISIBLE,
        rs -> new CampaignTemplate(rs.getString("id"), rs.getString("tenant_id"), rs.getString("name"),
            JdbcTemplate.instant(rs, "created_at")),
        templateId, tenantId);
  }

  @Override
  public void insertStep(Connection conn, CampaignStepTemplate step) {
    JdbcTemplate.update(conn, "INSERT INTO campaign_step_templates (" + STEP_COLUMNS + ")"
            + " VALUES (?,?,?,?,?,?,?,?,?,?)",
        step.id(), step.templateId(), step.stepOrder(), step.channel().value(), json(step.config()),
        millis(step.delay()), step.anchor().name(), step.condition().name(), window(step.sendWindow()),
        step.createdAt());
  }

  @Override
  public int updateStep(Connection conn, CampaignStepTemplate step) {
    return JdbcTemplate.update(conn, "UPDATE campaign_step_templates SET step_order=?, channel=?, config=?,"
            + " delay_ms=?, anchor=?, step_condition=?, send_window=? WHERE id=? AND template_id=?",
        step.stepOrder(), step.channel().value(), json(step.config()), millis(step.delay()),
        step.anchor().name(), step.condition().name(), window(step.sendWindow()), step.id(), step.templateId());
  }

  @Override
  public Optional<CampaignStepTemplate> findStep(Connection conn, String templateId, String stepTemplateId) {
    return JdbcTemplate.queryOne(conn, "SELECT " + STEP_COLUMNS + " FROM campaign_step_templates"
        + " WHERE template_id=? AND id=?", this::mapStep, templateId, stepTemplateId);
  }

  @Override
  public List<CampaignStepTemplate> listSteps(Connection conn, String templateId) {
    return JdbcTemplate.query(conn, "SELECT " + STEP_COLUMNS + " FROM campaign_step_templates"
        + " WHERE template_id=? ORDER BY step_order", this::mapStep, templateId);
  }

  @Override
  public boolean isStepReferenced(Connection conn, String stepTemplateId) {
    return !JdbcTemplate.query(conn, "SELECT plan_version_id FROM campaign_plan_steps WHERE step_template_id=?",
        rs -> rs.getString(1), stepTemplateId).isEmpty();
  }

  @Override
  public void insertPlanVersion(Connection conn, CampaignPlanVersion planVersion) {
    JdbcTemplate.update(conn, "INSERT INTO campaign_plan_versions (" + PLAN_COLUMNS + ") VALUES (?,?,?,?,?,?)",
        planVersion.id(), planVersion.tenantId(), planVersion.campaignId(), planVersion.version(),
        planVersion.planHash(), planVersion.createdAt());
    String stepSql = "INSERT INTO campaign_plan_steps (" + PLAN_STEP_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)";
    for (PlanStep step : planVersion.steps()) {
      JdbcTemplate.update(conn, stepSql,
          planVersion.id(), step.stepOrder(), step.stepTemplateId(), step.channel().value(), json(step.config()),
          millis(step.delay()), step.anchor().name(), step.condition().name(), window(step.sendWindow()));
    }
  }

  @Override
  public Optional<CampaignPlanVersion> findPlanVersion(Connection conn, String tenantId, String planVersionId) {
    return JdbcTemplate.queryOne(conn, "SELECT " + PLAN_COLUMNS + " FROM campaign_plan_versions"
            + " WHERE id=?" + VISIBLE, rs -> rs.getString("id"), planVersionId, tenantId)
        .map(id -> loadPlanVersion(conn, id));
  }

  @Override
  public Optional<CampaignPlanVersion> latestPlanVersion(Connection conn, String tenantId, String campaignId) {
    return JdbcTemplate.queryOne(conn, "SELECT id FROM campaign_plan_versions"
            + " WHERE campaign_id=?" + VISIBLE + " ORDER BY version DESC LIMIT 1",
            rs -> rs.getString("id"), campaignId, tenantId)
        .map(id -> loadPlanVersion(conn, id));
  }

  private CampaignPlanVersion loadPlanVersion(Connection conn, String planVersionId) {
    List<PlanStep> steps = JdbcTemplate.query(conn, "SELECT " + PLAN_STEP_COLUMNS + " FROM campaign_plan_steps"
        + " WHERE plan_version_id=? ORDER BY step_order", this::mapPlanStep, planVersionId);
    return JdbcTemplate.queryOne(conn, "SELECT " + PLAN_COLUMNS + " FROM campaign_plan_versions WHERE id=?",
        rs -> new CampaignPlanVersion(
            rs.getString("id"),
            rs.getString("tenant_id"),
            rs.getString("campaign_id"),
            rs.getInt("version"),
            rs.getString("plan_hash"),
            steps,
            JdbcTemplate.instant(rs, "created_at")),
        planVersionId).orElseThrow();
  }

  private CampaignStepTemplate mapStep(ResultSet rs) throws SQLException {
    return new CampaignStepTemplate(
        rs.getString("id"),
        rs.getString("template_id"),
        rs.getInt("step_order"),
        Channel.fromValue(rs.getString("channel")),
        map(rs, "config"),
        duration(rs, "delay_ms"),
        StepAnchor.valueOf(rs.getString("anchor")),
        StepCondition.valueOf(rs.getString("step_condition")),
        window(rs, "send_window"),
        JdbcTemplate.instant(rs, "created_at"));
  }

  private PlanStep mapPlanStep(ResultSet rs) throws SQLException {
    return new PlanStep(
        rs.getInt("step_order"),
        rs.getString("step_template_id"),
        Channel.fromValue(rs.getString("channel")),
        map(rs, "config"),
        duration(rs, "delay_ms"),
        StepAnchor.valueOf(rs.getString("anchor")),
        StepCondition.valueOf(rs.getString("step_condition")),
        window(rs, "send_window"));
  }
}
