/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import dev.moodvault.api.DiaryStore;
import dev.moodvault.crypto.EntryCipher;
import dev.moodvault.migration.MigrationReport;
import java.io.IOException;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Service locator for the diary storage engine.
 *
 * <p>Created once at boot by {@link CoreServices#start(Config)}. Each accessor returns a singleton
 * owned by the core. Call {@link #shutdown()} on exit to flush pending writes and release the
 * connection pool and scheduler.
 */
public interface Services {

  /**
   * Public facade used by request handlers.
   *
   * @return the diary store singleton
   */
  DiaryStore diary();

  /**
   * Write-through entry cache sitting in front of the store.
   *
   * @return the entry cache singleton
   */
  EntryCache cache();

  /**
   * SQLite-backed entry and user store.
   *
   * @return the store singleton
   */
  EntryStore store();

  /**
   * Payload cipher together with its key deriver.
   *
   * @return the cipher singleton
   */
  EntryCipher cipher();

  /**
   * Snapshot exporter for operators.
   *
   * @return the backup exporter
   */
  BackupExporter backups();

  /**
   * Background scheduler for cache sweeps, key expiry and scheduled backups (daemon threads).
   *
   * @return the scheduled executor service
   */
  ScheduledExecutorService scheduler();

  /**
   * Metrics registry.
   *
   * @return metrics registry or {@code null} when unavailable
   */
  default Metrics metrics() {
    return null;
  }

  /**
   * Outcome of the legacy import run during startup.
   *
   * @return the report, empty when the import is disabled
   */
  MigrationReport migrationReport();

  /**
   * Flushes pending cache writes, stops background work and closes the connection pool.
   *
   * <p>After this call the accessor methods are no longer guaranteed to be usable.
   *
   * @throws IOException if closing resources fails
   */
  void shutdown() throws IOException;
}
