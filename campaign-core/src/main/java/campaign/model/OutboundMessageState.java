package campaign.model;

import java.util.Arrays;

/**
 * Provider acknowledgment state of an {@link OutboundMessage}.
 *
 * <p>{@code QUEUED} means the dedupe key is reserved but no provider has accepted the
 * message yet.
 */
public enum OutboundMessageState {
  QUEUED(0),
  SENT(1),
  DELIVERED(2),
  BOUNCED(3),
  DROPPED(4),
  FAILED(5);

  private final int code;

  OutboundMessageState(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isAcknowledged() {
    return this != QUEUED;
  }

  public static OutboundMessageState fromCode(int code) {
    return Arrays.stream(values())
        .filter(s -> s.code == code)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown message state code: " + code));
  }
}
