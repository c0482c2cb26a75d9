package campaign.model;

import java.util.Locale;

/**
 * Kind of entity a {@link CampaignTransition} describes.
 */
public enum TransitionSubject {
  CAMPAIGN,
  STEP;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static TransitionSubject fromValue(String value) {
    return TransitionSubject.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
