package campaign.spi;

import campaign.model.CampaignTransition;

import java.sql.Connection;
import java.util.List;

public interface TransitionStore {

  void insert(Connection conn, CampaignTransition transition);

  /**
   * @return the instance's transitions, oldest first
   */
  List<CampaignTransition> listByInstance(Connection conn, String tenantId, String instanceId);
}
