package campaign.model;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;

/**
 * One contact's participation in one campaign.
 */
public record ContactCampaignInstance(
    String id,
    String tenantId,
    String campaignId,
    String contactId,
    String planVersionId,
    CampaignInstanceStatus status,
    Map<Channel, String> addresses,
    Map<String, String> variables,
    String senderIdentityId,
    ZoneId timezone,
    Instant enrolledAt,
    Instant completedAt,
    Instant updatedAt) {

  public ContactCampaignInstance {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(campaignId, "campaignId");
    Objects.requireNonNull(contactId, "contactId");
    Objects.requireNonNull(planVersionId, "planVersionId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(timezone, "timezone");
    Objects.requireNonNull(enrolledAt, "enrolledAt");
    addresses = addresses == null ? Map.of() : Map.copyOf(addresses);
    variables = variables == null ? Map.of() : Map.copyOf(variables);
  }

  public String address(Channel channel) {
    return addresses.get(channel);
  }

  public boolean isActive() {
    return status == CampaignInstanceStatus.ACTIVE;
  }
}
