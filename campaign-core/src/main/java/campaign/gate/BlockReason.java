package campaign.gate;

import java.util.Locale;

/**
 * Why {@link SuppressionGate} refused a destination. Checked in declaration order.
 */
public enum BlockReason {
  SUPPRESSED,
  UNSUBSCRIBED,
  INVALID_ADDRESS;

  /** Value written as the skip reason. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
