package campaign.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Reusable campaign definition. Its id is the campaign id referenced by plan versions,
 * instances and actions.
 *
 * @param tenantId owning tenant, or {@code null} for a global template
 */
public record CampaignTemplate(String id, String tenantId, String name, Instant createdAt) {

  public CampaignTemplate {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public boolean isGlobal() {
    return tenantId == null;
  }
}
