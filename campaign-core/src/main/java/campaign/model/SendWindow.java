package campaign.model;

import java.time.LocalTime;
import java.util.Objects;

/**
 * Local-time window {@code [start, end)} in which a step may be sent. A window whose end
 * is before its start wraps past midnight (e.g. 22:00-06:00).
 */
public record SendWindow(LocalTime start, LocalTime end) {

  public SendWindow {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.equals(end)) {
      throw new IllegalArgumentException("send window must not be empty: " + start + "-" + end);
    }
  }

  public boolean contains(LocalTime time) {
    if (start.isBefore(end)) {
      return !time.isBefore(start) && time.isBefore(end);
    }
    return !time.isBefore(start) || time.isBefore(end);
  }

  /** Parses {@code HH:mm-HH:mm}. */
  public static SendWindow parse(String text) {
    Objects.requireNonNull(text, "text");
    int dash = text.indexOf('-');
    if (dash <= 0) {
      throw new IllegalArgumentException("Invalid send window: " + text);
    }
    return new SendWindow(LocalTime.parse(text.substring(0, dash).trim()),
        LocalTime.parse(text.substring(dash + 1).trim()));
  }

  @Override
  public String toString() {
    return start + "-" + end;
  }
}
