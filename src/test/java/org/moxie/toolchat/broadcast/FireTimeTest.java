package org.moxie.toolchat.broadcast;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

class FireTimeTest {

  private static final ZoneId ZONE = ZoneId.of("Asia/Shanghai");

  @Test
  void testParse() {
    assertEquals(new FireTime(8, 0), FireTime.parse("08:00"));
    assertEquals(new FireTime(7, 5), FireTime.parse("7:05"));
    assertEquals("07:05", FireTime.parse(" 7:05 ").toString());
  }

  @Test
  void testMalformedRejected() {
    assertThrows(IllegalArgumentException.class, () -> FireTime.parse("8am"));
    assertThrows(IllegalArgumentException.class, () -> FireTime.parse("24:00"));
    assertThrows(IllegalArgumentException.class, () -> FireTime.parse("08:60"));
    assertThrows(IllegalArgumentException.class, () -> FireTime.parse("08:00:00"));
    assertThrows(IllegalArgumentException.class, () -> FireTime.parse(null));
  }

  @Test
  void testLaterTodayFiresToday() {
    ZonedDateTime now = ZonedDateTime.of(2025, 3, 10, 7, 30, 0, 0, ZONE);

    assertEquals(ZonedDateTime.of(2025, 3, 10, 8, 0, 0, 0, ZONE), new FireTime(8, 0).nextFireAfter(now));
  }

  @Test
  void testPassedTimeFiresTomorrow() {
    ZonedDateTime now = ZonedDateTime.of(2025, 3, 10, 9, 0, 0, 0, ZONE);

    assertEquals(ZonedDateTime.of(2025, 3, 11, 8, 0, 0, 0, ZONE), new FireTime(8, 0).nextFireAfter(now));
  }

  @Test
  void testExactlyNowFiresTomorrow() {
    ZonedDateTime now = ZonedDateTime.of(2025, 3, 10, 8, 0, 0, 0, ZONE);

    assertEquals(ZonedDateTime.of(2025, 3, 11, 8, 0, 0, 0, ZONE), new FireTime(8, 0).nextFireAfter(now));
  }
}
