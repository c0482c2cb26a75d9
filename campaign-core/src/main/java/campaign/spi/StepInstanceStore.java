package campaign.spi;

import campaign.model.CampaignStepInstance;
import campaign.model.StepInstanceStatus;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

public interface StepInstanceStore {

  void insertAll(Connection conn, List<CampaignStepInstance> steps);

  Optional<CampaignStepInstance> find(Connection conn, String tenantId, String stepInstanceId);

  /**
   * Reads the step and holds a row lock on it until the transaction ends.
   */
  Optional<CampaignStepInstance> lock(Connection conn, String tenantId, String stepInstanceId);

  /**
   * @return the instance's steps ordered by {@code stepOrder}
   */
  List<CampaignStepInstance> listByInstance(Connection conn, String tenantId, String instanceId);

  /**
   * Writes the mutable columns of {@code step} if the stored status still equals
   * {@code expectedStatus}.
   *
   * @return rows updated, {@code 0} if the status changed underneath
   */
  int update(Connection conn, CampaignStepInstance step, StepInstanceStatus expectedStatus);
}
