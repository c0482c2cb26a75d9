package campaign.model;

import java.util.Arrays;

/**
 * Lifecycle of a {@link ScheduledAction}:
 * {@code PENDING -> CLAIMED -> EXECUTING -> {DONE | FAILED | CANCELED}}, plus
 * {@code PENDING -> CANCELED} for campaign-level cancellation.
 *
 * <p>{@code CLAIMED}/{@code EXECUTING -> PENDING} is the release path, used by retry
 * backoff, rate-limit deferral and the lease reclaim sweep.
 */
public enum ScheduledActionStatus {
  PENDING(0),
  CLAIMED(1),
  EXECUTING(2),
  DONE(3),
  FAILED(4),
  CANCELED(5);

  private final int code;

  ScheduledActionStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this == DONE || this == FAILED || this == CANCELED;
  }

  public boolean isInFlight() {
    return this == PENDING || this == CLAIMED || this == EXECUTING;
  }

  public boolean canTransitionTo(ScheduledActionStatus next) {
    return switch (this) {
      case PENDING -> next == CLAIMED || next == CANCELED;
      case CLAIMED -> next == EXECUTING || next == PENDING || next == FAILED || next == CANCELED;
      case EXECUTING -> next == DONE || next == FAILED || next == CANCELED || next == PENDING;
      case DONE, FAILED, CANCELED -> false;
    };
  }

  public ScheduledActionStatus transitionTo(ScheduledActionStatus next) {
    if (!canTransitionTo(next)) {
      throw new IllegalTransitionException(this, next);
    }
    return next;
  }

  public static ScheduledActionStatus fromCode(int code) {
    return Arrays.stream(values())
        .filter(s -> s.code == code)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown action status code: " + code));
  }
}
