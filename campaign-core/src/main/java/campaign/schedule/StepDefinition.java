package campaign.schedule;

import campaign.model.Channel;
import campaign.model.SendWindow;
import campaign.model.StepAnchor;
import campaign.model.StepCondition;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Input for {@link CampaignCatalog#addStep} and {@link CampaignCatalog#replaceStep}.
 */
public record StepDefinition(
    int stepOrder,
    Channel channel,
    Map<String, String> config,
    Duration delay,
    StepAnchor anchor,
    StepCondition condition,
    SendWindow sendWindow) {

  public StepDefinition {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(delay, "delay");
    Objects.requireNonNull(anchor, "anchor");
    Objects.requireNonNull(condition, "condition");
    config = config == null ? Map.of() : Map.copyOf(config);
  }

  /**
   * An unconditional step anchored to enrollment with no send window.
   */
  public static StepDefinition of(int stepOrder, Channel channel, Duration delay, Map<String, String> config) {
    return new StepDefinition(stepOrder, channel, config, delay, StepAnchor.ENROLLMENT, StepCondition.ALWAYS, null);
  }

  public StepDefinition anchoredTo(StepAnchor anchor) {
    return new StepDefinition(stepOrder, channel, config, delay, anchor, condition, sendWindow);
  }

  public StepDefinition when(StepCondition condition) {
    return new StepDefinition(stepOrder, channel, config, delay, anchor, condition, sendWindow);
  }

  public StepDefinition within(SendWindow sendWindow) {
    return new StepDefinition(stepOrder, channel, config, delay, anchor, condition, sendWindow);
  }
}
