/* Moodvault © 2025 — MIT */
package dev.moodvault.migration;

/**
 * Outcome of one legacy import run.
 *
 * @param filesScanned legacy entry files found
 * @param ownersImported owners whose file was imported and renamed
 * @param ownersSkipped owners left alone because they already had entries
 * @param entriesImported entries written to the store
 * @param recordsFailed legacy rows that could not be parsed or decrypted
 * @param usersImported user rows imported from the legacy user list
 * @param filesFailed files left in place after a read or persistence fault
 */
public record MigrationReport(
    int filesScanned,
    int ownersImported,
    int ownersSkipped,
    int entriesImported,
    int recordsFailed,
    int usersImported,
    int filesFailed) {

  /** Report of a run that found nothing to do. */
  public static MigrationReport empty() {
    return new MigrationReport(0, 0, 0, 0, 0, 0, 0);
  }

  /** Whether anything was written. */
  public boolean importedAnything() {
    return entriesImported > 0 || usersImported > 0;
  }
}
