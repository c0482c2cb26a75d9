package campaign.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of a template's steps, identified by {@code (campaignId, version)}.
 */
public record CampaignPlanVersion(
    String id,
    String tenantId,
    String campaignId,
    int version,
    String planHash,
    List<PlanStep> steps,
    Instant createdAt) {

  public CampaignPlanVersion {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(campaignId, "campaignId");
    Objects.requireNonNull(planHash, "planHash");
    Objects.requireNonNull(createdAt, "createdAt");
    if (version < 1) {
      throw new IllegalArgumentException("version must be >= 1");
    }
    steps = steps == null ? List.of() : steps.stream()
        .sorted(Comparator.comparingInt(PlanStep::stepOrder))
        .toList();
  }

  public Set<Channel> channels() {
    return steps.stream().map(PlanStep::channel).collect(Collectors.toSet());
  }
}
