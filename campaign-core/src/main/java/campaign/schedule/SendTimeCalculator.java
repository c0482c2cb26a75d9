package campaign.schedule;

import campaign.model.SendWindow;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Computes when a step should fire: anchor time plus delay, pushed forward into the
 * step's send window in the contact's timezone.
 */
public final class SendTimeCalculator {

  public Instant compute(Instant anchor, Duration delay, SendWindow window, ZoneId zone) {
    Objects.requireNonNull(anchor, "anchor");
    Objects.requireNonNull(delay, "delay");
    return adjustToWindow(anchor.plus(delay), window, zone);
  }

  /**
   * Returns {@code at} unchanged when it falls inside {@code window}, otherwise the next
   * window start after it. Windows may wrap midnight.
   */
  public Instant adjustToWindow(Instant at, SendWindow window, ZoneId zone) {
    Objects.requireNonNull(at, "at");
    if (window == null) {
      return at;
    }
    ZoneId effectiveZone = zone != null ? zone : ZoneId.of("UTC");
    ZonedDateTime local = at.atZone(effectiveZone);
    if (window.contains(local.toLocalTime())) {
      return at;
    }
    ZonedDateTime start = local.toLocalDate().atTime(window.start()).atZone(effectiveZone);
    if (start.isBefore(local)) {
      start = local.toLocalDate().plusDays(1).atTime(window.start()).atZone(effectiveZone);
    }
    return start.toInstant();
  }
}
