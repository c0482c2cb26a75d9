package campaign.spi;

import campaign.model.CampaignPlanVersion;
import campaign.model.CampaignStepTemplate;
import campaign.model.CampaignTemplate;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Templates, step templates and plan versions. Lookups by tenant also see global
 * ({@code tenant_id IS NULL}) templates.
 */
public interface CampaignCatalogStore {

  void insertTemplate(Connection conn, CampaignTemplate template);

  Optional<CampaignTemplate> findTemplate(Connection conn, String tenantId, String templateId);

  void insertStep(Connection conn, CampaignStepTemplate step);

  int updateStep(Connection conn, CampaignStepTemplate step);

  Optional<CampaignStepTemplate> findStep(Connection conn, String templateId, String stepTemplateId);

  List<CampaignStepTemplate> listSteps(Connection conn, String templateId);

  boolean isStepReferenced(Connection conn, String stepTemplateId);

  void insertPlanVersion(Connection conn, CampaignPlanVersion planVersion);

  Optional<CampaignPlanVersion> findPlanVersion(Connection conn, String tenantId, String planVersionId);

  Optional<CampaignPlanVersion> latestPlanVersion(Connection conn, String tenantId, String campaignId);
}
