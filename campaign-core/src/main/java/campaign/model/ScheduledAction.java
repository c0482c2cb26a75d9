package campaign.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable queue row: "execute this step instance at or after {@code scheduledAt}".
 *
 * <p>{@code claimToken} is unique per claim call; terminal updates are fenced on it so
 * a worker whose lease expired cannot overwrite the state written by the next owner.
 */
public record ScheduledAction(
    String id,
    String tenantId,
    String campaignId,
    String instanceId,
    String stepInstanceId,
    Instant scheduledAt,
    ScheduledActionStatus status,
    int attempts,
    String claimedBy,
    String claimToken,
    Instant claimedAt,
    Instant leaseExpiresAt,
    String lastError,
    Instant createdAt) {

  public ScheduledAction {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(stepInstanceId, "stepInstanceId");
    Objects.requireNonNull(scheduledAt, "scheduledAt");
    Objects.requireNonNull(status, "status");
  }

  public static ScheduledAction pending(String id, CampaignStepInstance step, Instant scheduledAt, Instant now) {
    return new ScheduledAction(id, step.tenantId(), step.campaignId(), step.instanceId(), step.id(),
        scheduledAt, ScheduledActionStatus.PENDING, 0, null, null, null, null, null, now);
  }
}
