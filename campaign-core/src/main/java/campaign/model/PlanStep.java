package campaign.model;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * A step as frozen inside a {@link CampaignPlanVersion}.
 */
public record PlanStep(
    int stepOrder,
    String stepTemplateId,
    Channel channel,
    Map<String, String> config,
    Duration delay,
    StepAnchor anchor,
    StepCondition condition,
    SendWindow sendWindow) {

  public PlanStep {
    Objects.requireNonNull(stepTemplateId, "stepTemplateId");
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(delay, "delay");
    Objects.requireNonNull(anchor, "anchor");
    Objects.requireNonNull(condition, "condition");
    config = config == null ? Map.of() : Map.copyOf(config);
  }
}
