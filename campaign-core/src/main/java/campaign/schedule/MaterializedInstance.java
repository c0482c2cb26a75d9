package campaign.schedule;

import campaign.model.CampaignStepInstance;
import campaign.model.ContactCampaignInstance;

import java.util.List;

/**
 * Result of enrolling a contact: the new instance and its steps in plan order.
 */
public record MaterializedInstance(ContactCampaignInstance instance, List<CampaignStepInstance> steps) {

  public MaterializedInstance {
    steps = List.copyOf(steps);
  }

  public CampaignStepInstance step(int stepOrder) {
    return steps.stream()
        .filter(s -> s.stepOrder() == stepOrder)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("No step " + stepOrder));
  }
}
