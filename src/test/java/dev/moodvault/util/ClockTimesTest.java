/* Moodvault © 2025 — MIT */
package dev.moodvault.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.moodvault.api.ErrorCode;
import dev.moodvault.api.ValidationException;
import java.time.LocalTime;
import org.junit.jupiter.api.Test;

class ClockTimesTest {

  @Test
  void normalizesToZeroPaddedHoursAndMinutes() {
    assertEquals("09:05", ClockTimes.normalize("9:05"));
    assertEquals("21:30", ClockTimes.normalize(" 21:30 "));
    assertEquals("00:00", ClockTimes.normalize("0:00"));
  }

  @Test
  void blankMeansNoReminder() {
    assertNull(ClockTimes.normalize(null));
    assertNull(ClockTimes.normalize("   "));
  }

  @Test
  void rejectsMalformedTimes() {
    for (String raw : new String[] {"24:00", "12:60", "7pm", "1230", "12:5"}) {
      ValidationException e =
          assertThrows(ValidationException.class, () -> ClockTimes.normalize(raw), raw);
      assertEquals(ErrorCode.INVALID_CLOCK, e.errorCode());
    }
  }

  @Test
  void formatDropsSeconds() {
    assertEquals("07:45", ClockTimes.format(LocalTime.of(7, 45, 59)));
  }
}
