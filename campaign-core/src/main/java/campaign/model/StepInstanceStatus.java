package campaign.model;

import java.util.Arrays;

/**
 * Lifecycle of a {@link CampaignStepInstance}.
 *
 * <pre>
 * PENDING -> SENT -> COMPLETED
 * PENDING -> SKIPPED
 * PENDING -> FAILED
 * </pre>
 *
 * <p>{@code SENT}, {@code SKIPPED} and {@code FAILED} may return to {@code PENDING} only
 * through {@link #reschedule()}. {@code COMPLETED} is final.
 */
public enum StepInstanceStatus {
  PENDING(0),
  SENT(1),
  COMPLETED(2),
  SKIPPED(3),
  FAILED(4);

  private final int code;

  StepInstanceStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == SKIPPED || this == FAILED;
  }

  public boolean canTransitionTo(StepInstanceStatus next) {
    return switch (this) {
      case PENDING -> next == SENT || next == SKIPPED || next == FAILED;
      case SENT -> next == COMPLETED;
      case COMPLETED, SKIPPED, FAILED -> false;
    };
  }

  public StepInstanceStatus transitionTo(StepInstanceStatus next) {
    if (!canTransitionTo(next)) {
      throw new IllegalTransitionException(this, next);
    }
    return next;
  }

  /**
   * Returns {@code PENDING} if this status may be rescheduled.
   *
   * @throws IllegalTransitionException for {@code COMPLETED}
   */
  public StepInstanceStatus reschedule() {
    if (this == COMPLETED) {
      throw new IllegalTransitionException(this, PENDING);
    }
    return PENDING;
  }

  public static StepInstanceStatus fromCode(int code) {
    return Arrays.stream(values())
        .filter(s -> s.code == code)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown step status code: " + code));
  }
}
