/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Validates that the database schema version matches the runtime expectation. */
public final class SchemaVerifier {
  private static final Logger LOG = LoggerFactory.getLogger("moodvault");

  private SchemaVerifier() {}

  /**
   * Ensures the schema version recorded in the database is compatible with this build.
   *
   * @param ds datasource of the diary database
   * @throws IllegalStateException if the version is missing, older or newer than expected
   */
  public static void verify(DataSource ds) {
    int expected = Migrations.currentVersion();
    try (Connection c = ds.getConnection();
        PreparedStatement ps =
            c.prepareStatement("SELECT MAX(version) FROM schema_version");
        ResultSet rs = ps.executeQuery()) {
      int version = rs.next() ? rs.getInt(1) : 0;
      if (version == 0) {
        throw new IllegalStateException(
            "schema_version table is empty; migrations may not have been applied correctly");
      }
      if (version > expected) {
        throw new IllegalStateException(
            "Database schema version "
                + version
                + " is newer than supported runtime version "
                + expected);
      }
      if (version < expected) {
        throw new IllegalStateException(
            "Database schema version "
                + version
                + " is older than required runtime version "
                + expected);
      }
      LOG.info("(moodvault) schema version {} verified", version);
    } catch (SQLException e) {
      throw new RuntimeException("Failed to verify schema version", e);
    }
  }
}
