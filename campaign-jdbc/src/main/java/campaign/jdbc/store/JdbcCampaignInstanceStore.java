package campaign.jdbc.store;

import campaign.jdbc.JdbcTemplate;
import campaign.jdbc.spi.Dialect;
import campaign.model.CampaignInstanceStatus;
import campaign.model.Channel;
import campaign.model.ContactCampaignInstance;
import campaign.spi.CampaignInstanceStore;
import campaign.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC store for {@code contact_campaign_instances}.
 *
 * <p>Addresses and variables are stored as JSON objects; addresses are keyed by channel value.
 */
public final class JdbcCampaignInstanceStore extends AbstractJdbcStore implements CampaignInstanceStore {

  private static final String TABLE = "contact_campaign_instances";
  private static final String COLUMNS = "id, tenant_id, campaign_id, contact_id, plan_version_id, status, "
      + "addresses, variables, sender_identity_id, timezone, enrolled_at, completed_at, updated_at";
  private static final String SELECT = "SELECT " + COLUMNS + " FROM " + TABLE;

  public JdbcCampaignInstanceStore(Dialect dialect, JsonCodec jsonCodec) {
    super(dialect, jsonCodec);
  }

  @Override
  public void insert(Connection conn, ContactCampaignInstance instance) {
    Map<String, String> addresses = new LinkedHashMap<>();
    instance.addresses().forEach((channel, address) -> addresses.put(channel.value(), address));
    JdbcTemplate.update(conn, "INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)",
        instance.id(), instance.tenantId(), instance.campaignId(), instance.contactId(),
        instance.planVersionId(), instance.status().code(), json(addresses), json(instance.variables()),
        instance.senderIdentityId(), instance.timezone().getId(), instance.enrolledAt(),
        instance.completedAt(), instance.updatedAt());
  }

  @Override
  public Optional<ContactCampaignInstance> find(Connection conn, String tenantId, String instanceId) {
    return JdbcTemplate.queryOne(conn, SELECT + " WHERE tenant_id=? AND id=?", this::map, tenantId, instanceId);
  }

  @Override
  public Optional<ContactCampaignInstance> findByContact(Connection conn, String tenantId, String campaignId,
      String contactId) {
    return JdbcTemplate.queryOne(conn, SELECT + " WHERE tenant_id=? AND campaign_id=? AND contact_id=?",
        this::map, tenantId, campaignId, contactId);
  }

  @Override
  public Optional<ContactCampaignInstance> lock(Connection conn, String tenantId, String instanceId) {
    return JdbcTemplate.queryOne(conn, SELECT + " WHERE tenant_id=? AND id=? FOR UPDATE", this::map,
        tenantId, instanceId);
  }

  @Override
  public List<ContactCampaignInstance> listOpenByCampaign(Connection conn, String tenantId, String campaignId) {
    return JdbcTemplate.query(conn, SELECT + " WHERE tenant_id=? AND campaign_id=? AND status<>? ORDER BY id",
        this::map, tenantId, campaignId, CampaignInstanceStatus.COMPLETED.code());
  }

  @Override
  public int updateStatus(Connection conn, String tenantId, String instanceId, CampaignInstanceStatus expected,
      CampaignInstanceStatus next, Instant completedAt, Instant now) {
    return JdbcTemplate.update(conn, "UPDATE " + TABLE + " SET status=?, completed_at=?, updated_at=?"
            + " WHERE tenant_id=? AND id=? AND status=?",
        next.code(), completedAt, now, tenantId, instanceId, expected.code());
  }

  private ContactCampaignInstance map(ResultSet rs) throws SQLException {
    Map<Channel, String> addresses = new EnumMap<>(Channel.class);
    map(rs, "addresses").forEach((channel, address) -> addresses.put(Channel.fromValue(channel), address));
    return new ContactCampaignInstance(
        rs.getString("id"),
        rs.getString("tenant_id"),
        rs.getString("campaign_id"),
        rs.getString("contact_id"),
        rs.getString("plan_version_id"),
        CampaignInstanceStatus.fromCode(rs.getInt("status")),
        addresses,
        map(rs, "variables"),
        rs.getString("sender_identity_id"),
        ZoneId.of(rs.getString("timezone")),
        JdbcTemplate.instant(rs, "enrolled_at"),
        JdbcTemplate.instant(rs, "completed_at"),
        JdbcTemplate.instant(rs, "updated_at"));
  }
}
