package campaign.spi;

import campaign.model.CampaignInstanceStatus;
import campaign.model.ContactCampaignInstance;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface CampaignInstanceStore {

  void insert(Connection conn, ContactCampaignInstance instance);

  Optional<ContactCampaignInstance> find(Connection conn, String tenantId, String instanceId);

  Optional<ContactCampaignInstance> findByContact(Connection conn, String tenantId, String campaignId,
      String contactId);

  /**
   * Reads the instance and holds a row lock on it until the transaction ends.
   */
  Optional<ContactCampaignInstance> lock(Connection conn, String tenantId, String instanceId);

  List<ContactCampaignInstance> listOpenByCampaign(Connection conn, String tenantId, String campaignId);

  /**
   * Compare-and-set on the status column.
   *
   * @param completedAt stamped when {@code next} is completed, otherwise ignored
   * @return rows updated
   */
  int updateStatus(Connection conn, String tenantId, String instanceId, CampaignInstanceStatus expected,
      CampaignInstanceStatus next, Instant completedAt, Instant now);
}
