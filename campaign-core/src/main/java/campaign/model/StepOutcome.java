package campaign.model;

import java.util.Locale;

/**
 * Signal passed to the step scheduler when something happens to a step instance.
 */
public enum StepOutcome {
  SENT,
  DELIVERED,
  COMPLETED,
  OPENED,
  CLICKED,
  REPLIED,
  BOUNCED,
  DROPPED,
  SKIPPED,
  FAILED;

  /** Value stored in {@code branch_outcome}. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isEngagement() {
    return this == OPENED || this == CLICKED || this == REPLIED;
  }

  static boolean isEngagementValue(String value) {
    return OPENED.value().equals(value) || CLICKED.value().equals(value) || REPLIED.value().equals(value);
  }
}
