package campaign.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One concrete, schedulable execution of a plan step for one contact.
 *
 * <p>{@code epoch} increases on every reschedule and is part of the dedupe key, so a
 * rescheduled step is a new logical send.
 */
public record CampaignStepInstance(
    String id,
    String tenantId,
    String instanceId,
    String campaignId,
    String contactId,
    int stepOrder,
    Channel channel,
    StepCondition condition,
    StepAnchor anchor,
    Duration delay,
    SendWindow sendWindow,
    Map<String, String> renderedConfig,
    Instant scheduledAt,
    StepInstanceStatus status,
    String branchOutcome,
    int epoch,
    Instant sentAt,
    String lastError,
    Instant updatedAt) {

  public CampaignStepInstance {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(instanceId, "instanceId");
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(condition, "condition");
    Objects.requireNonNull(anchor, "anchor");
    Objects.requireNonNull(delay, "delay");
    Objects.requireNonNull(scheduledAt, "scheduledAt");
    Objects.requireNonNull(status, "status");
    renderedConfig = renderedConfig == null ? Map.of() : Map.copyOf(renderedConfig);
  }

  public CampaignStepInstance withStatus(StepInstanceStatus next, String error, Instant now) {
    return new CampaignStepInstance(id, tenantId, instanceId, campaignId, contactId, stepOrder,
        channel, condition, anchor, delay, sendWindow, renderedConfig, scheduledAt,
        status.transitionTo(next), branchOutcome, epoch, sentAt, error, now);
  }

  public CampaignStepInstance sent(Instant now) {
    return new CampaignStepInstance(id, tenantId, instanceId, campaignId, contactId, stepOrder,
        channel, condition, anchor, delay, sendWindow, renderedConfig, scheduledAt,
        status.transitionTo(StepInstanceStatus.SENT), branchOutcome, epoch, now, null, now);
  }

  public CampaignStepInstance withBranchOutcome(String outcome, Instant now) {
    return new CampaignStepInstance(id, tenantId, instanceId, campaignId, contactId, stepOrder,
        channel, condition, anchor, delay, sendWindow, renderedConfig, scheduledAt,
        status, outcome, epoch, sentAt, lastError, now);
  }

  public CampaignStepInstance withScheduledAt(Instant at, Instant now) {
    return new CampaignStepInstance(id, tenantId, instanceId, campaignId, contactId, stepOrder,
        channel, condition, anchor, delay, sendWindow, renderedConfig, at,
        status, branchOutcome, epoch, sentAt, lastError, now);
  }

  /**
   * Returns this step reset to {@code PENDING} at {@code at} with the next epoch.
   *
   * @throws IllegalTransitionException if the step is completed
   */
  public CampaignStepInstance rescheduled(Instant at, Instant now) {
    return new CampaignStepInstance(id, tenantId, instanceId, campaignId, contactId, stepOrder,
        channel, condition, anchor, delay, sendWindow, renderedConfig, at,
        status.reschedule(), null, epoch + 1, null, null, now);
  }
}
