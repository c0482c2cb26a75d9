package campaign.model;

import java.util.Locale;

/**
 * Outreach channel of a step, a message or a deny-list entry.
 */
public enum Channel {
  EMAIL,
  SMS,
  CALL;

  /** Lower-case name used in stored rows. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Channel fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("channel must not be null");
    }
    return Channel.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
