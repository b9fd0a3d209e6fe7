/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import dev.moodvault.api.ErrorCode;
import java.sql.SQLException;
import java.util.Locale;

/** Maps JDBC {@link SQLException} instances raised by SQLite to Moodvault {@link ErrorCode}s. */
public final class SqlErrorCodes {
  private static final int SQLITE_READONLY = 8;
  private static final int SQLITE_BUSY = 5;
  private static final int SQLITE_LOCKED = 6;
  private static final int SQLITE_IOERR = 10;
  private static final int SQLITE_CORRUPT = 11;
  private static final int SQLITE_FULL = 13;
  private static final int SQLITE_CANTOPEN = 14;
  private static final int SQLITE_CONSTRAINT = 19;
  private static final int SQLITE_NOTADB = 26;

  private SqlErrorCodes() {}

  /**
   * Classifies a SQL exception into one of the canonical {@link ErrorCode} values.
   *
   * <p>Extended result codes are reduced to their primary code first. When the driver supplies no
   * code the message is inspected for the {@code [SQLITE_*]} marker.
   *
   * @param e SQL exception thrown by the SQLite driver
   * @return mapped {@link ErrorCode}, defaulting to {@link ErrorCode#CONNECTION_LOST}
   */
  public static ErrorCode classify(SQLException e) {
    if (e == null) {
      return ErrorCode.CONNECTION_LOST;
    }
    ErrorCode byVendor = fromVendor(e.getErrorCode() & 0xff);
    if (byVendor != null) {
      return byVendor;
    }

    String state = e.getSQLState();
    if (state != null && state.startsWith("23")) {
      return ErrorCode.CONSTRAINT_VIOLATION;
    }

    String message = e.getMessage();
    if (message != null) {
      String lower = message.toLowerCase(Locale.ROOT);
      if (lower.contains("sqlite_busy")
          || lower.contains("sqlite_locked")
          || lower.contains("database is locked")) {
        return ErrorCode.DATABASE_BUSY;
      }
      if (lower.contains("sqlite_constraint") || lower.contains("unique constraint")) {
        return ErrorCode.CONSTRAINT_VIOLATION;
      }
      if (lower.contains("sqlite_corrupt") || lower.contains("sqlite_notadb")) {
        return ErrorCode.DATABASE_CORRUPT;
      }
      if (lower.contains("sqlite_ioerr")
          || lower.contains("sqlite_full")
          || lower.contains("sqlite_readonly")) {
        return ErrorCode.IO_FAILURE;
      }
    }
    return ErrorCode.CONNECTION_LOST;
  }

  private static ErrorCode fromVendor(int primary) {
    switch (primary) {
      case SQLITE_BUSY:
      case SQLITE_LOCKED:
        return ErrorCode.DATABASE_BUSY;
      case SQLITE_CONSTRAINT:
        return ErrorCode.CONSTRAINT_VIOLATION;
      case SQLITE_CORRUPT:
      case SQLITE_NOTADB:
        return ErrorCode.DATABASE_CORRUPT;
      case SQLITE_IOERR:
      case SQLITE_FULL:
      case SQLITE_READONLY:
        return ErrorCode.IO_FAILURE;
      case SQLITE_CANTOPEN:
        return ErrorCode.CONNECTION_LOST;
      default:
        return null;
    }
  }
}
