/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import dev.moodvault.api.DateRange;
import dev.moodvault.api.DecryptException;
import dev.moodvault.api.Entry;
import dev.moodvault.api.EntryFields;
import dev.moodvault.api.ErrorCode;
import dev.moodvault.api.PersistenceException;
import dev.moodvault.api.ReadResult;
import dev.moodvault.api.User;
import dev.moodvault.api.ValidationException;
import dev.moodvault.crypto.EntryCipher;
import dev.moodvault.util.ClockTimes;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import javax.crypto.SecretKey;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SQLite-backed store of encrypted entries and plain user rows.
 *
 * <p>Every database round trip runs under one store lock over the single pooled connection. Key
 * derivation and encryption happen before the lock is taken; decryption after it is released. The
 * store never calls back into the cache, so the lock is always the innermost one held.
 */
public final class EntryStore {
  private static final Logger LOG = LoggerFactory.getLogger("moodvault");

  private static final String ENSURE_USER =
      "INSERT INTO users(id, display_name, notification_time, created_at_s, updated_at_s) "
          + "VALUES(?, NULL, NULL, ?, ?) ON CONFLICT(id) DO NOTHING";
  private static final String UPSERT_ENTRY =
      "INSERT INTO entries(owner, entry_date, payload, schema_version, created_at_s, updated_at_s) "
          + "VALUES(?,?,?,?,?,?) ON CONFLICT(owner, entry_date) DO UPDATE SET "
          + "payload=excluded.payload, schema_version=excluded.schema_version, "
          + "updated_at_s=excluded.updated_at_s";
  private static final String UPSERT_USER =
      "INSERT INTO users(id, display_name, notification_time, created_at_s, updated_at_s) "
          + "VALUES(?,?,?,?,?) ON CONFLICT(id) DO UPDATE SET "
          + "display_name=excluded.display_name, notification_time=excluded.notification_time, "
          + "updated_at_s=excluded.updated_at_s";

  private final DataSource ds;
  private final EntryCipher cipher;
  private final Metrics metrics;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  /**
   * Creates a new instance.
   *
   * @param ds shared datasource (single connection)
   * @param cipher payload cipher and key source
   * @param metrics metrics registry, may be {@code null}
   */
  public EntryStore(DataSource ds, EntryCipher cipher, Metrics metrics) {
    this(ds, cipher, metrics, Clock.systemUTC());
  }

  EntryStore(DataSource ds, EntryCipher cipher, Metrics metrics, Clock clock) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.cipher = Objects.requireNonNull(cipher, "cipher");
    this.metrics = metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Encrypts and stores {@code fields} as the entry of {@code owner} for {@code date}, replacing
   * any previous entry of that day. The user row is created if missing.
   *
   * @return the stored entry
   * @throws PersistenceException on an encryption or database fault
   */
  public Entry upsertEntry(long owner, LocalDate date, EntryFields fields) {
    return upsertEntry(new Entry(owner, date, fields, clock.instant()));
  }

  /**
   * Encrypts and stores {@code entry}, replacing any previous entry of the same day.
   *
   * @param entry entry to persist
   * @return {@code entry}
   * @throws PersistenceException on an encryption or database fault
   */
  public Entry upsertEntry(Entry entry) {
    byte[] payload = seal(entry);
    long nowS = clock.instant().getEpochSecond();
    try {
      withConnection(
          "store.upsertEntry",
          c -> {
            c.setAutoCommit(false);
            try {
              try (PreparedStatement ps = c.prepareStatement(ENSURE_USER)) {
                ps.setLong(1, entry.owner());
                ps.setLong(2, nowS);
                ps.setLong(3, nowS);
                ps.executeUpdate();
              }
              try (PreparedStatement ps = c.prepareStatement(UPSERT_ENTRY)) {
                ps.setLong(1, entry.owner());
                ps.setString(2, entry.date().toString());
                ps.setBytes(3, payload);
                ps.setInt(4, EntryFields.SCHEMA_VERSION);
                ps.setLong(5, nowS);
                ps.setLong(6, nowS);
                ps.executeUpdate();
              }
              c.commit();
            } catch (SQLException e) {
              rollbackQuietly(c);
              throw e;
            } finally {
              c.setAutoCommit(true);
            }
            return null;
          });
      recordWrite(true, null);
      return entry;
    } catch (PersistenceException e) {
      recordWrite(false, e.errorCode());
      throw e;
    }
  }

  /**
   * Reads the entries of {@code owner} within {@code range}, newest first.
   *
   * <p>Rows that cannot be decrypted or decoded are skipped, logged and counted; they never abort
   * the read.
   *
   * @param owner owner identifier
   * @param range inclusive date window; {@code null} means unbounded
   * @return readable entries plus the skipped count
   * @throws PersistenceException on a database fault
   */
  public ReadResult readEntries(long owner, DateRange range) {
    DateRange window = range == null ? DateRange.all() : range;
    StringBuilder sql =
        new StringBuilder("SELECT entry_date, payload FROM entries WHERE owner=?");
    if (window.from() != null) {
      sql.append(" AND entry_date >= ?");
    }
    if (window.to() != null) {
      sql.append(" AND entry_date <= ?");
    }
    sql.append(" ORDER BY entry_date DESC");

    List<StoredRow> rows;
    try {
      rows =
          withConnection(
              "store.readEntries",
              c -> {
                try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                  int idx = 1;
                  ps.setLong(idx++, owner);
                  if (window.from() != null) {
                    ps.setString(idx++, window.from().toString());
                  }
                  if (window.to() != null) {
                    ps.setString(idx, window.to().toString());
                  }
                  List<StoredRow> out = new ArrayList<>();
                  try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                      out.add(new StoredRow(rs.getString(1), rs.getBytes(2)));
                    }
                  }
                  return out;
                }
              });
    } catch (PersistenceException e) {
      if (metrics != null) {
        metrics.recordEntryRead(false, e.errorCode(), 0);
      }
      throw e;
    }

    if (rows.isEmpty()) {
      if (metrics != null) {
        metrics.recordEntryRead(true, null, 0);
      }
      return ReadResult.empty();
    }

    SecretKey key = cipher.keys().deriveKey(owner);
    List<Entry> entries = new ArrayList<>(rows.size());
    int skipped = 0;
    for (StoredRow row : rows) {
      try {
        entries.add(EntryCodec.decode(owner, cipher.decrypt(row.payload(), key)));
      } catch (DecryptException | ValidationException e) {
        skipped++;
        if (metrics != null && e instanceof DecryptException) {
          metrics.recordDecryptFailure();
        }
        LOG.warn(
            "(moodvault) code={} op={} message={} owner={} date={}",
            e.errorCode(),
            "store.readEntries",
            e.getMessage(),
            owner,
            row.date());
      }
    }
    if (metrics != null) {
      metrics.recordEntryRead(true, null, skipped);
    }
    return new ReadResult(entries, skipped);
  }

  /**
   * Checks whether an entry exists without decrypting it.
   *
   * @throws PersistenceException on a database fault
   */
  public boolean hasEntry(long owner, LocalDate date) {
    return withConnection(
        "store.hasEntry",
        c -> {
          try (PreparedStatement ps =
              c.prepareStatement("SELECT 1 FROM entries WHERE owner=? AND entry_date=?")) {
            ps.setLong(1, owner);
            ps.setString(2, date.toString());
            try (ResultSet rs = ps.executeQuery()) {
              return rs.next();
            }
          }
        });
  }

  /**
   * Lists the entry dates of {@code owner}, newest first, without decrypting.
   *
   * @throws PersistenceException on a database fault
   */
  public List<LocalDate> entryDates(long owner) {
    return withConnection(
        "store.entryDates",
        c -> {
          try (PreparedStatement ps =
              c.prepareStatement(
                  "SELECT entry_date FROM entries WHERE owner=? ORDER BY entry_date DESC")) {
            ps.setLong(1, owner);
            List<LocalDate> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
              while (rs.next()) {
                out.add(LocalDate.parse(rs.getString(1)));
              }
            }
            return out;
          }
        });
  }

  /**
   * Counts the stored entries of {@code owner}.
   *
   * @throws PersistenceException on a database fault
   */
  public int countEntries(long owner) {
    return withConnection(
        "store.countEntries",
        c -> {
          try (PreparedStatement ps =
              c.prepareStatement("SELECT COUNT(*) FROM entries WHERE owner=?")) {
            ps.setLong(1, owner);
            try (ResultSet rs = ps.executeQuery()) {
              return rs.next() ? rs.getInt(1) : 0;
            }
          }
        });
  }

  /**
   * Checks whether a user row exists for {@code owner}.
   *
   * @throws PersistenceException on a database fault
   */
  public boolean ownerExists(long owner) {
    return withConnection(
        "store.ownerExists",
        c -> {
          try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM users WHERE id=?")) {
            ps.setLong(1, owner);
            try (ResultSet rs = ps.executeQuery()) {
              return rs.next();
            }
          }
        });
  }

  /**
   * Deletes one entry.
   *
   * @return {@code true} if a row was removed
   * @throws PersistenceException on a database fault
   */
  public boolean deleteEntry(long owner, LocalDate date) {
    try {
      int removed =
          withConnection(
              "store.deleteEntry",
              c -> {
                try (PreparedStatement ps =
                    c.prepareStatement("DELETE FROM entries WHERE owner=? AND entry_date=?")) {
                  ps.setLong(1, owner);
                  ps.setString(2, date.toString());
                  return ps.executeUpdate();
                }
              });
      recordWrite(true, null);
      return removed > 0;
    } catch (PersistenceException e) {
      recordWrite(false, e.errorCode());
      throw e;
    }
  }

  /**
   * Deletes every entry of {@code owner}; the user row stays.
   *
   * @return number of rows removed
   * @throws PersistenceException on a database fault
   */
  public int deleteAllEntries(long owner) {
    try {
      int removed =
          withConnection(
              "store.deleteAllEntries",
              c -> {
                try (PreparedStatement ps =
                    c.prepareStatement("DELETE FROM entries WHERE owner=?")) {
                  ps.setLong(1, owner);
                  return ps.executeUpdate();
                }
              });
      recordWrite(true, null);
      return removed;
    } catch (PersistenceException e) {
      recordWrite(false, e.errorCode());
      throw e;
    }
  }

  /**
   * Creates or updates a user, writing every column. A {@code null} or blank time stores SQL
   * {@code NULL}.
   *
   * @param owner owner identifier
   * @param displayName display name, may be {@code null}
   * @param notificationTime reminder time {@code HH:MM}, or {@code null}
   * @throws ValidationException if the time is not a valid {@code HH:MM}
   * @throws PersistenceException on a database fault
   */
  public void upsertUser(long owner, String displayName, String notificationTime) {
    String time = ClockTimes.normalize(notificationTime);
    long nowS = clock.instant().getEpochSecond();
    try {
      withConnection(
          "store.upsertUser",
          c -> {
            try (PreparedStatement ps = c.prepareStatement(UPSERT_USER)) {
              ps.setLong(1, owner);
              setNullableString(ps, 2, displayName);
              setNullableString(ps, 3, time);
              ps.setLong(4, nowS);
              ps.setLong(5, nowS);
              return ps.executeUpdate();
            }
          });
      if (metrics != null) {
        metrics.recordUserWrite(true, null);
      }
    } catch (PersistenceException e) {
      if (metrics != null) {
        metrics.recordUserWrite(false, e.errorCode());
      }
      throw e;
    }
  }

  /**
   * Looks up a user row.
   *
   * @throws PersistenceException on a database fault
   */
  public Optional<User> findUser(long owner) {
    return withConnection(
        "store.findUser",
        c -> {
          try (PreparedStatement ps =
              c.prepareStatement(
                  "SELECT display_name, notification_time FROM users WHERE id=?")) {
            ps.setLong(1, owner);
            try (ResultSet rs = ps.executeQuery()) {
              if (!rs.next()) {
                return Optional.empty();
              }
              return Optional.of(new User(owner, rs.getString(1), rs.getString(2)));
            }
          }
        });
  }

  /**
   * Lists owners whose reminder time equals {@code clockTime}.
   *
   * @param clockTime {@code HH:MM}; single-digit hours are accepted
   * @return matching owners in ascending order
   * @throws ValidationException if the time is not a valid {@code HH:MM}
   * @throws PersistenceException on a database fault
   */
  public List<Long> usersDueForNotification(String clockTime) {
    String time = ClockTimes.normalize(clockTime);
    if (time == null) {
      throw new ValidationException(ErrorCode.INVALID_CLOCK, "clock time must not be blank");
    }
    return withConnection(
        "store.usersDueForNotification",
        c -> {
          try (PreparedStatement ps =
              c.prepareStatement("SELECT id FROM users WHERE notification_time=? ORDER BY id")) {
            ps.setString(1, time);
            List<Long> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
              while (rs.next()) {
                out.add(rs.getLong(1));
              }
            }
            return out;
          }
        });
  }

  /**
   * Runs {@code work} on the pooled connection under the store lock.
   *
   * @param op operation name used in logs
   * @param work JDBC work
   * @return work result
   * @throws PersistenceException if the connection or the work fails
   */
  <T> T withConnection(String op, SqlWork<T> work) {
    lock.lock();
    try (Connection c = ds.getConnection()) {
      return work.run(c);
    } catch (SQLException e) {
      ErrorCode code = SqlErrorCodes.classify(e);
      LOG.warn(
          "(moodvault) code={} op={} message={} sqlState={} vendor={}",
          code,
          op,
          e.getMessage(),
          e.getSQLState(),
          e.getErrorCode(),
          e);
      throw new PersistenceException(code, op + " failed: " + e.getMessage(), e);
    } finally {
      lock.unlock();
    }
  }

  private byte[] seal(Entry entry) {
    SecretKey key = cipher.keys().deriveKey(entry.owner());
    try {
      return cipher.encrypt(EntryCodec.encode(entry), key);
    } catch (IllegalStateException e) {
      recordWrite(false, ErrorCode.ENCRYPT_FAILED);
      LOG.error(
          "(moodvault) code={} op={} message={} owner={}",
          ErrorCode.ENCRYPT_FAILED,
          "store.upsertEntry",
          e.getMessage(),
          entry.owner());
      throw new PersistenceException(ErrorCode.ENCRYPT_FAILED, "entry encryption failed", e);
    }
  }

  private void recordWrite(boolean ok, ErrorCode code) {
    if (metrics != null) {
      metrics.recordEntryWrite(ok, code);
    }
  }

  private static void setNullableString(PreparedStatement ps, int idx, String value)
      throws SQLException {
    if (value == null) {
      ps.setNull(idx, Types.VARCHAR);
    } else {
      ps.setString(idx, value);
    }
  }

  private static void rollbackQuietly(Connection c) {
    try {
      c.rollback();
    } catch (SQLException rollback) {
      LOG.debug("(moodvault) rollback failed", rollback);
    }
  }

  /** JDBC work executed under the store lock. */
  @FunctionalInterface
  interface SqlWork<T> {
    T run(Connection c) throws SQLException;
  }

  private record StoredRow(String date, byte[] payload) {}
}
