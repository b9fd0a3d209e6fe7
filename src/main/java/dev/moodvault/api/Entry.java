/* Moodvault © 2025 — MIT */
package dev.moodvault.api;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One decrypted diary entry. At most one exists per {@code (owner, date)}.
 *
 * @param owner owner identifier
 * @param date calendar day the entry describes
 * @param fields decrypted attributes
 * @param createdAt when the entry was first written
 */
public record Entry(long owner, LocalDate date, EntryFields fields, Instant createdAt) {
  public Entry {
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(fields, "fields");
    Objects.requireNonNull(createdAt, "createdAt");
  }
}
