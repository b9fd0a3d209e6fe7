/* Moodvault © 2025 — MIT */
package dev.moodvault.util;

import dev.moodvault.api.ErrorCode;
import dev.moodvault.api.ValidationException;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/** Helpers for the {@code HH:MM} wall-clock strings used by reminder scheduling. */
public final class ClockTimes {
  private static final Pattern HH_MM = Pattern.compile("\\d{1,2}:\\d{2}");
  private static final DateTimeFormatter FORMAT =
      DateTimeFormatter.ofPattern("HH:mm").withLocale(Locale.ROOT);

  private ClockTimes() {}

  /**
   * Normalizes a reminder time to zero-padded {@code HH:MM}.
   *
   * <p>{@code null} and blank input mean "no reminder" and yield {@code null}.
   *
   * @param raw user or caller supplied time, e.g. {@code "9:05"} or {@code "21:30"}
   * @return canonical {@code HH:MM} string, or {@code null}
   * @throws ValidationException if the value is not a valid 24-hour time
   */
  public static String normalize(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    return FORMAT.format(parse(raw));
  }

  /**
   * Parses {@code HH:MM} (hour may be a single digit).
   *
   * @param raw time string
   * @return parsed local time
   * @throws ValidationException if the value is not a valid 24-hour time
   */
  public static LocalTime parse(String raw) {
    String trimmed = raw == null ? "" : raw.trim();
    if (!HH_MM.matcher(trimmed).matches()) {
      throw new ValidationException(
          ErrorCode.INVALID_CLOCK, "expected HH:MM but got '" + raw + "'");
    }
    String padded = trimmed.length() == 4 ? "0" + trimmed : trimmed;
    try {
      return LocalTime.parse(padded, FORMAT);
    } catch (DateTimeParseException e) {
      throw new ValidationException(ErrorCode.INVALID_CLOCK, "invalid time '" + raw + "'", e);
    }
  }

  /**
   * Formats a time as {@code HH:MM}, dropping seconds.
   *
   * @param time time to format
   * @return canonical string
   */
  public static String format(LocalTime time) {
    return FORMAT.format(time);
  }
}
