package campaign.model;

import campaign.util.Ids;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Append-only audit record of one state change to a campaign instance or a step instance.
 */
public record CampaignTransition(
    String id,
    String tenantId,
    String campaignId,
    String instanceId,
    String stepInstanceId,
    TransitionSubject subject,
    String fromStatus,
    String toStatus,
    String reason,
    Instant occurredAt) {

  public CampaignTransition {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(instanceId, "instanceId");
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(toStatus, "toStatus");
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(occurredAt, "occurredAt");
  }

  public static CampaignTransition ofInstance(ContactCampaignInstance instance,
      CampaignInstanceStatus from, CampaignInstanceStatus to, String reason, Instant at) {
    return new CampaignTransition(Ids.newId(), instance.tenantId(), instance.campaignId(),
        instance.id(), null, TransitionSubject.CAMPAIGN,
        from == null ? null : from.name().toLowerCase(Locale.ROOT), to.name().toLowerCase(Locale.ROOT), reason, at);
  }

  public static CampaignTransition ofStep(CampaignStepInstance step,
      StepInstanceStatus from, StepInstanceStatus to, String reason, Instant at) {
    return new CampaignTransition(Ids.newId(), step.tenantId(), step.campaignId(),
        step.instanceId(), step.id(), TransitionSubject.STEP,
        from == null ? null : from.name().toLowerCase(Locale.ROOT), to.name().toLowerCase(Locale.ROOT), reason, at);
  }
}
