/* Moodvault © 2025 — MIT */
package dev.moodvault.api;

import java.time.LocalDate;

/**
 * Inclusive date window used by range reads. Either bound may be {@code null} (open).
 *
 * @param from first day included, or {@code null}
 * @param to last day included, or {@code null}
 */
public record DateRange(LocalDate from, LocalDate to) {
  private static final DateRange ALL = new DateRange(null, null);

  public DateRange {
    if (from != null && to != null && from.isAfter(to)) {
      throw new IllegalArgumentException("range start " + from + " is after end " + to);
    }
  }

  /** Unbounded range. */
  public static DateRange all() {
    return ALL;
  }

  public static DateRange between(LocalDate from, LocalDate to) {
    return new DateRange(from, to);
  }

  public static DateRange since(LocalDate from) {
    return new DateRange(from, null);
  }

  public boolean contains(LocalDate date) {
    if (date == null) {
      return false;
    }
    return (from == null || !date.isBefore(from)) && (to == null || !date.isAfter(to));
  }

  public boolean isUnbounded() {
    return from == null && to == null;
  }
}
