/* Moodvault © 2025 — MIT */
package dev.moodvault.api;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Entry point used by the diary's conversation handlers.
 *
 * <p>Write methods report persistence failures as {@code false} instead of throwing so handlers
 * can tell the user to retry; the cached copy of a failed write is kept and flushed again later.
 * Every call is synchronous.
 */
public interface DiaryStore {

  /**
   * Saves (or replaces) the entry of {@code owner} for {@code date}.
   *
   * @param owner owner identifier
   * @param date calendar day
   * @param fields entry attributes
   * @return {@code true} if the entry reached durable storage
   */
  boolean saveEntry(long owner, LocalDate date, EntryFields fields);

  /**
   * Returns every readable entry of {@code owner}, newest first.
   *
   * @param owner owner identifier
   * @return entries plus the count of rows that could not be decrypted
   */
  default ReadResult getEntries(long owner) {
    return getEntries(owner, DateRange.all());
  }

  /**
   * Returns the readable entries of {@code owner} within {@code range}, newest first.
   *
   * @param owner owner identifier
   * @param range inclusive date window
   * @return entries plus the count of rows that could not be decrypted
   */
  ReadResult getEntries(long owner, DateRange range);

  /**
   * Checks whether {@code owner} already has an entry for {@code date}. Never decrypts.
   *
   * @param owner owner identifier
   * @param date calendar day
   * @return {@code true} when an entry exists
   */
  boolean hasEntry(long owner, LocalDate date);

  /**
   * Lists the days on which {@code owner} has entries, newest first. Never decrypts.
   *
   * @param owner owner identifier
   * @return entry dates
   */
  List<LocalDate> entryDates(long owner);

  /**
   * Deletes one entry.
   *
   * @param owner owner identifier
   * @param date calendar day
   * @return {@code true} if a row was removed
   */
  boolean deleteEntry(long owner, LocalDate date);

  /**
   * Deletes every entry of {@code owner}. The user row is kept.
   *
   * @param owner owner identifier
   * @return {@code true} if the delete reached durable storage
   */
  boolean deleteAll(long owner);

  /**
   * Creates or updates a user. All columns are written on every call.
   *
   * @param owner owner identifier
   * @param displayName display name, may be {@code null}
   * @param notificationTime reminder time {@code HH:MM}; {@code null} disables reminders
   * @return {@code true} if the row was written
   * @throws ValidationException if {@code notificationTime} is not a valid {@code HH:MM} time
   */
  boolean upsertUser(long owner, String displayName, String notificationTime);

  /**
   * Looks up a user.
   *
   * @param owner owner identifier
   * @return user if registered
   */
  Optional<User> findUser(long owner);

  /**
   * Lists owners whose reminder time equals {@code clockTime}. Polled once per minute.
   *
   * @param clockTime wall-clock time {@code HH:MM}
   * @return matching owner identifiers
   */
  List<Long> usersDueForNotification(String clockTime);

  /**
   * Seals entries into a self-contained payload readable with {@code passphrase}.
   *
   * @param entries entries to share
   * @param passphrase passphrase agreed with the recipient
   * @return opaque payload (JSON envelope)
   * @throws ValidationException with {@link ErrorCode#INVALID_PASSPHRASE} if {@code passphrase} is
   *     {@code null} or blank
   */
  String exportForSharing(List<Entry> entries, String passphrase);

  /**
   * Opens a payload produced by {@link #exportForSharing(List, String)}.
   *
   * @param payload opaque payload
   * @param passphrase passphrase supplied by the recipient
   * @return shared entries
   * @throws DecryptException on a wrong passphrase or damaged payload
   */
  List<Entry> importShared(String payload, String passphrase);
}
