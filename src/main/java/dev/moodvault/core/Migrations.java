/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Idempotent schema migrations for the diary tables. */
public final class Migrations {
  private static final Logger LOG = LoggerFactory.getLogger("moodvault");
  private static final int CURRENT_VERSION = 1;

  private static final String[] DDL = {
    """
    CREATE TABLE IF NOT EXISTS schema_version (
      version       INTEGER NOT NULL PRIMARY KEY,
      applied_at_s  INTEGER NOT NULL
    )
    """,
    """
    CREATE TABLE IF NOT EXISTS users (
      id                 INTEGER NOT NULL PRIMARY KEY,
      display_name       TEXT    NULL,
      notification_time  TEXT    NULL,
      created_at_s       INTEGER NOT NULL,
      updated_at_s       INTEGER NOT NULL
    )
    """,
    """
    CREATE TABLE IF NOT EXISTS entries (
      owner           INTEGER NOT NULL REFERENCES users(id) ON DELETE CASCADE,
      entry_date      TEXT    NOT NULL,
      payload         BLOB    NOT NULL,
      schema_version  INTEGER NOT NULL,
      created_at_s    INTEGER NOT NULL,
      updated_at_s    INTEGER NOT NULL,
      UNIQUE (owner, entry_date)
    )
    """,
    "CREATE INDEX IF NOT EXISTS idx_entries_owner ON entries(owner)",
    "CREATE INDEX IF NOT EXISTS idx_entries_date ON entries(entry_date)",
    """
    CREATE INDEX IF NOT EXISTS idx_users_notification
      ON users(notification_time) WHERE notification_time IS NOT NULL
    """
  };

  private Migrations() {}

  /**
   * Applies idempotent DDL. Each statement is executed independently; failures are logged and the
   * migrator proceeds with remaining statements, leaving the recorded version unchanged.
   *
   * @param ds datasource of the diary database
   * @return {@code true} when every statement succeeded and the version was recorded
   */
  public static boolean apply(DataSource ds) {
    boolean allSucceeded = true;
    try (Connection c = ds.getConnection();
        Statement st = c.createStatement()) {
      for (String sql : DDL) {
        try {
          st.execute(sql);
        } catch (SQLException e) {
          allSucceeded = false;
          LOG.warn(
              "(moodvault) code={} op={} message={} sql=\n{}",
              SqlErrorCodes.classify(e),
              "migrations.apply",
              e.getMessage(),
              sql);
        }
      }
    } catch (SQLException e) {
      throw new RuntimeException("Migration failed", e);
    }

    if (!allSucceeded) {
      LOG.warn("(moodvault) migrations completed with errors; schema version unchanged");
      return false;
    }
    recordSchemaVersion(ds);
    return true;
  }

  /** Current schema version number. */
  public static int currentVersion() {
    return CURRENT_VERSION;
  }

  private static void recordSchemaVersion(DataSource ds) {
    try (Connection c = ds.getConnection();
        PreparedStatement ps =
            c.prepareStatement(
                "INSERT INTO schema_version(version, applied_at_s) VALUES(?, ?) "
                    + "ON CONFLICT(version) DO NOTHING")) {
      ps.setInt(1, CURRENT_VERSION);
      ps.setLong(2, Instant.now().getEpochSecond());
      if (ps.executeUpdate() > 0) {
        LOG.info("(moodvault) schema version recorded: {}", CURRENT_VERSION);
      }
    } catch (SQLException e) {
      throw new RuntimeException("Failed to record schema version", e);
    }
  }
}
