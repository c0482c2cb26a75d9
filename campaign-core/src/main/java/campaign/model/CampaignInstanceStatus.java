package campaign.model;

import java.util.Arrays;

/**
 * Lifecycle of a {@link ContactCampaignInstance}: {@code ACTIVE <-> PAUSED},
 * {@code ACTIVE|PAUSED -> COMPLETED}. {@code COMPLETED} is final.
 */
public enum CampaignInstanceStatus {
  ACTIVE(0),
  PAUSED(1),
  COMPLETED(2);

  private final int code;

  CampaignInstanceStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean canTransitionTo(CampaignInstanceStatus next) {
    return switch (this) {
      case ACTIVE -> next == PAUSED || next == COMPLETED;
      case PAUSED -> next == ACTIVE || next == COMPLETED;
      case COMPLETED -> false;
    };
  }

  public CampaignInstanceStatus transitionTo(CampaignInstanceStatus next) {
    if (!canTransitionTo(next)) {
      throw new IllegalTransitionException(this, next);
    }
    return next;
  }

  public static CampaignInstanceStatus fromCode(int code) {
    return Arrays.stream(values())
        .filter(s -> s.code == code)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown instance status code: " + code));
  }
}
