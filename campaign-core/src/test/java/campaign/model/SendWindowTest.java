package campaign.model;

import org.junit.jupiter.api.Test;

import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

class SendWindowTest {

  @Test
  void parsesAndFormats() {
    SendWindow window = SendWindow.parse(" 09:00 - 17:30 ");
    assertEquals(LocalTime.of(9, 0), window.start());
    assertEquals(LocalTime.of(17, 30), window.end());
    assertEquals("09:00-17:30", window.toString());
    assertEquals(window, SendWindow.parse(window.toString()));
  }

  @Test
  void daytimeWindowIsHalfOpen() {
    SendWindow window = SendWindow.parse("09:00-17:00");
    assertTrue(window.contains(LocalTime.of(9, 0)));
    assertTrue(window.contains(LocalTime.of(16, 59)));
    assertFalse(window.contains(LocalTime.of(17, 0)));
    assertFalse(window.contains(LocalTime.of(8, 59)));
  }

  @Test
  void overnightWindowWraps() {
    SendWindow window = SendWindow.parse("22:00-06:00");
    assertTrue(window.contains(LocalTime.of(23, 0)));
    assertTrue(window.contains(LocalTime.of(2, 0)));
    assertFalse(window.contains(LocalTime.of(6, 0)));
    assertFalse(window.contains(LocalTime.NOON));
  }

  @Test
  void rejectsMalformedOrEmptyWindows() {
    assertThrows(IllegalArgumentException.class, () -> SendWindow.parse("0900"));
    assertThrows(IllegalArgumentException.class, () -> SendWindow.parse("-17:00"));
    assertThrows(IllegalArgumentException.class, () -> SendWindow.parse("09:00-09:00"));
  }
}
