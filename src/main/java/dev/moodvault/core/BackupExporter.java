/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import com.google.gson.stream.JsonWriter;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes JSONL snapshots of the diary database.
 *
 * <p>User rows are written as-is; entry payloads stay encrypted (base64), so a snapshot is only
 * useful together with the secret salts. Each snapshot gets a {@code .sha256} sidecar and old
 * snapshots are pruned by age and count.
 */
public final class BackupExporter {
  private static final Logger LOG = LoggerFactory.getLogger("moodvault");
  private static final DateTimeFormatter TS =
      DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

  private final EntryStore store;
  private final Config.Backup cfg;
  private final Clock clock;

  /**
   * Creates an exporter.
   *
   * @param store store whose lock and connection are used for the snapshot
   * @param cfg backup settings
   */
  public BackupExporter(EntryStore store, Config.Backup cfg) {
    this(store, cfg, Clock.systemUTC());
  }

  BackupExporter(EntryStore store, Config.Backup cfg, Clock clock) {
    this.store = store;
    this.cfg = cfg;
    this.clock = clock;
  }

  /**
   * Writes a snapshot into the configured directory.
   *
   * @return metadata about the export
   * @throws IOException if writing to disk fails
   */
  public Result exportNow() throws IOException {
    return exportTo(Path.of(cfg.outDir()), cfg.gzip());
  }

  /**
   * Writes a snapshot into {@code outDir}.
   *
   * @param outDir destination directory, created if missing
   * @param gzip compress the snapshot
   * @return metadata about the export
   * @throws IOException if writing to disk fails
   * @throws dev.moodvault.api.PersistenceException if reading the database fails
   */
  public Result exportTo(Path outDir, boolean gzip) throws IOException {
    Files.createDirectories(outDir);
    String stamp = TS.format(clock.instant());
    try {
      Result result =
          store.withConnection(
              "backup.export",
              c -> {
                try {
                  return writeSnapshot(c, outDir, stamp, gzip);
                } catch (IOException e) {
                  throw new UncheckedIOException(e);
                }
              });
      prune(outDir, cfg.prune(), result.file());
      LOG.info(
          "(moodvault) op=backup.export file={} users={} entries={}",
          result.file().getFileName(),
          result.users(),
          result.entries());
      return result;
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  private Result writeSnapshot(Connection c, Path outDir, String stamp, boolean gzip)
      throws IOException, SQLException {
    while (true) {
      String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
      String baseName = "moodvault-" + stamp + "-" + suffix + ".jsonl" + (gzip ? ".gz" : "");
      Path outFile = outDir.resolve(baseName);
      MessageDigest sha = sha256();
      try (DigestOutputStream digestStream =
              new DigestOutputStream(
                  Files.newOutputStream(outFile, StandardOpenOption.CREATE_NEW), sha);
          OutputStream dataOut = gzip ? new GZIPOutputStream(digestStream) : digestStream;
          BufferedWriter writer =
              new BufferedWriter(new OutputStreamWriter(dataOut, StandardCharsets.UTF_8))) {
        writeHeader(writer);
        long users = dumpUsers(writer, c);
        long entries = dumpEntries(writer, c);
        writer.flush();
        if (dataOut instanceof GZIPOutputStream gz) {
          gz.finish();
        }
        Files.writeString(
            outDir.resolve(baseName + ".sha256"), HexFormat.of().formatHex(sha.digest()));
        return new Result(outFile, users, entries);
      } catch (FileAlreadyExistsException exists) {
        LOG.debug("(moodvault) op=backup.export name collision {}; retrying", baseName);
      }
    }
  }

  private void writeHeader(BufferedWriter writer) throws IOException {
    writeJsonLine(
        writer,
        json -> {
          json.name("version").value("jsonl/v1");
          json.name("generatedAt").value(Instant.now(clock).toString());
          json.name("schemaVersion").value(Migrations.currentVersion());
        });
  }

  private static long dumpUsers(BufferedWriter writer, Connection c)
      throws SQLException, IOException {
    String sql =
        "SELECT id, display_name, notification_time, created_at_s, updated_at_s FROM users "
            + "ORDER BY id";
    try (PreparedStatement ps = c.prepareStatement(sql);
        ResultSet rs = ps.executeQuery()) {
      long count = 0;
      while (rs.next()) {
        long id = rs.getLong("id");
        String name = rs.getString("display_name");
        String time = rs.getString("notification_time");
        long createdAt = rs.getLong("created_at_s");
        long updatedAt = rs.getLong("updated_at_s");
        writeJsonLine(
            writer,
            json -> {
              json.name("table").value("users");
              json.name("id").value(id);
              json.name("displayName").value(name);
              json.name("notificationTime").value(time);
              json.name("createdAt").value(createdAt);
              json.name("updatedAt").value(updatedAt);
            });
        count++;
      }
      return count;
    }
  }

  private static long dumpEntries(BufferedWriter writer, Connection c)
      throws SQLException, IOException {
    String sql =
        "SELECT owner, entry_date, payload, schema_version, created_at_s, updated_at_s "
            + "FROM entries ORDER BY owner, entry_date";
    try (PreparedStatement ps = c.prepareStatement(sql);
        ResultSet rs = ps.executeQuery()) {
      long count = 0;
      while (rs.next()) {
        long owner = rs.getLong("owner");
        String date = rs.getString("entry_date");
        String payload = Base64.getEncoder().encodeToString(rs.getBytes("payload"));
        int version = rs.getInt("schema_version");
        long createdAt = rs.getLong("created_at_s");
        long updatedAt = rs.getLong("updated_at_s");
        writeJsonLine(
            writer,
            json -> {
              json.name("table").value("entries");
              json.name("owner").value(owner);
              json.name("date").value(date);
              json.name("payload").value(payload);
              json.name("schemaVersion").value(version);
              json.name("createdAt").value(createdAt);
              json.name("updatedAt").value(updatedAt);
            });
        count++;
      }
      return count;
    }
  }

  private void prune(Path dir, Config.Prune prune, Path newest) throws IOException {
    if (prune == null) {
      return;
    }
    List<Path> files;
    try (var stream = Files.list(dir)) {
      files =
          stream
              .filter(p -> !Files.isDirectory(p))
              .filter(
                  p -> {
                    String name = p.getFileName().toString();
                    return name.startsWith("moodvault-")
                        && (name.endsWith(".jsonl") || name.endsWith(".jsonl.gz"));
                  })
              .sorted()
              .toList();
    }
    int toRemove = Math.max(0, files.size() - Math.max(1, prune.keepMax()));
    long nowMs = clock.millis();
    for (Path p : files) {
      if (p.equals(newest)) {
        continue;
      }
      if (toRemove > 0) {
        delete(dir, p);
        toRemove--;
        continue;
      }
      if (prune.keepDays() == 0) {
        continue;
      }
      long ageDays = (nowMs - Files.getLastModifiedTime(p).toMillis()) / 86_400_000L;
      if (ageDays > prune.keepDays()) {
        delete(dir, p);
      }
    }
  }

  private static void delete(Path dir, Path file) throws IOException {
    Files.deleteIfExists(file);
    Files.deleteIfExists(dir.resolve(file.getFileName().toString() + ".sha256"));
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 missing", e);
    }
  }

  private static void writeJsonLine(BufferedWriter writer, RowWriter rowWriter) throws IOException {
    StringWriter buffer = new StringWriter();
    try (JsonWriter jsonWriter = new JsonWriter(buffer)) {
      jsonWriter.setSerializeNulls(true);
      jsonWriter.beginObject();
      rowWriter.write(jsonWriter);
      jsonWriter.endObject();
    }
    writer.write(buffer.toString());
    writer.write('\n');
  }

  @FunctionalInterface
  private interface RowWriter {
    void write(JsonWriter writer) throws IOException;
  }

  /**
   * Summary of an export run.
   *
   * @param file snapshot that was written
   * @param users user rows exported
   * @param entries entry rows exported
   */
  public record Result(Path file, long users, long entries) {}
}
