/* Moodvault © 2025 — MIT */
package dev.moodvault.api;

import java.util.List;

/**
 * Outcome of a multi-row read.
 *
 * <p>Rows that failed to decrypt are left out of {@link #entries()} and counted in {@link
 * #skipped()} so callers can tell an empty history from a damaged one.
 *
 * @param entries decrypted entries, newest first
 * @param skipped number of stored rows that could not be decrypted
 */
public record ReadResult(List<Entry> entries, int skipped) {
  private static final ReadResult EMPTY = new ReadResult(List.of(), 0);

  public ReadResult {
    entries = List.copyOf(entries);
    if (skipped < 0) {
      throw new IllegalArgumentException("skipped must be >= 0");
    }
  }

  public static ReadResult empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  /** Whether at least one stored row could not be decrypted. */
  public boolean hasSkipped() {
    return skipped > 0;
  }
}
