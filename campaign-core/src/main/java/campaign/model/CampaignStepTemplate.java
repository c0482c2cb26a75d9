package campaign.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One ordered step of a {@link CampaignTemplate}.
 *
 * @param config     rendering configuration with {@code {{variable}}} placeholders
 * @param delay      offset from the anchor, never negative
 * @param sendWindow optional local-time window, {@code null} for any time
 */
public record CampaignStepTemplate(
    String id,
    String templateId,
    int stepOrder,
    Channel channel,
    Map<String, String> config,
    Duration delay,
    StepAnchor anchor,
    StepCondition condition,
    SendWindow sendWindow,
    Instant createdAt) {

  public CampaignStepTemplate {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(templateId, "templateId");
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(delay, "delay");
    Objects.requireNonNull(anchor, "anchor");
    Objects.requireNonNull(condition, "condition");
    Objects.requireNonNull(createdAt, "createdAt");
    if (stepOrder < 1) {
      throw new IllegalArgumentException("stepOrder must be >= 1");
    }
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative");
    }
    config = config == null ? Map.of() : Map.copyOf(config);
  }

  public PlanStep toPlanStep() {
    return new PlanStep(stepOrder, id, channel, config, delay, anchor, condition, sendWindow);
  }
}
