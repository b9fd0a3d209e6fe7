/* Moodvault © 2025 — MIT */
package dev.moodvault.migration;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import dev.moodvault.api.Entry;
import dev.moodvault.api.EntryFields;
import dev.moodvault.api.ErrorCode;
import dev.moodvault.api.PersistenceException;
import dev.moodvault.api.ValidationException;
import dev.moodvault.core.Config;
import dev.moodvault.core.EntryStore;
import dev.moodvault.crypto.SecretMaterial;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot import of the legacy per-owner CSV files into the store.
 *
 * <p>The legacy user list is imported first, then every {@code user_<owner>_data.csv}. An owner
 * that already has entries is skipped and its file left untouched. Imported files are renamed to
 * {@code <name>.migrated}; nothing is ever deleted.
 *
 * <p>While a file is being imported an {@code <name>.importing} marker sits next to it. A
 * persistence fault leaves both in place; the next run sees the marker, resumes the file and skips
 * only the days that already made it into the store.
 */
public final class MigrationRunner {
  private static final Logger LOG = LoggerFactory.getLogger("moodvault");
  private static final Pattern ENTRY_FILE = Pattern.compile("user_(-?\\d+)_data\\.csv");
  static final String MIGRATED_SUFFIX = ".migrated";
  static final String IMPORTING_SUFFIX = ".importing";

  private final EntryStore store;
  private final SecretMaterial secrets;
  private final Path legacyDir;
  private final String usersFile;
  private final int iterations;

  /**
   * Creates a runner from the {@code migration} config block.
   *
   * @param store destination store
   * @param secrets salts shared with the legacy deployment
   * @param cfg migration settings
   */
  public MigrationRunner(EntryStore store, SecretMaterial secrets, Config.Migration cfg) {
    this(store, secrets, Path.of(cfg.legacyDir()), cfg.usersFile(), cfg.legacyIterations());
  }

  MigrationRunner(
      EntryStore store, SecretMaterial secrets, Path legacyDir, String usersFile, int iterations) {
    this.store = Objects.requireNonNull(store, "store");
    this.secrets = Objects.requireNonNull(secrets, "secrets");
    this.legacyDir = Objects.requireNonNull(legacyDir, "legacyDir");
    this.usersFile = usersFile;
    this.iterations = iterations;
  }

  /**
   * Imports whatever legacy data is still waiting in the legacy directory.
   *
   * @return counters of the run; all zero when there was nothing to import
   */
  public MigrationReport run() {
    if (!Files.isDirectory(legacyDir)) {
      LOG.debug("(moodvault) op=migration.run legacy dir {} not present", legacyDir);
      return MigrationReport.empty();
    }
    Counters counters = new Counters();
    if (usersFile != null && !usersFile.isBlank()) {
      importUsers(legacyDir.resolve(usersFile), counters);
    }

    List<Path> files;
    try {
      files = listEntryFiles();
    } catch (IOException e) {
      LOG.warn(
          "(moodvault) code={} op={} message={}",
          ErrorCode.IO_FAILURE,
          "migration.scan",
          e.getMessage());
      return counters.toReport();
    }
    for (Path file : files) {
      counters.filesScanned++;
      importEntryFile(file, counters);
    }

    MigrationReport report = counters.toReport();
    if (report.filesScanned() > 0 || report.usersImported() > 0) {
      LOG.info(
          "(moodvault) op=migration.run files={} owners={} skipped={} entries={} "
              + "failedRecords={} users={} failedFiles={}",
          report.filesScanned(),
          report.ownersImported(),
          report.ownersSkipped(),
          report.entriesImported(),
          report.recordsFailed(),
          report.usersImported(),
          report.filesFailed());
    }
    return report;
  }

  private List<Path> listEntryFiles() throws IOException {
    try (var stream = Files.list(legacyDir)) {
      return stream
          .filter(Files::isRegularFile)
          .filter(p -> ENTRY_FILE.matcher(p.getFileName().toString()).matches())
          .sorted()
          .toList();
    }
  }

  private void importUsers(Path file, Counters counters) {
    if (!Files.isRegularFile(file)) {
      return;
    }
    LegacyCsv.Table table;
    try {
      table = LegacyCsv.parse(Files.readString(file, StandardCharsets.UTF_8));
    } catch (IOException e) {
      counters.filesFailed++;
      LOG.warn(
          "(moodvault) code={} op={} message={} file={}",
          ErrorCode.IO_FAILURE,
          "migration.users",
          e.getMessage(),
          file.getFileName());
      return;
    }
    int idCol = table.column("chat_id");
    int usernameCol = table.column("username");
    int firstNameCol = table.column("first_name");
    int timeCol = table.column("notification_time");
    if (idCol < 0) {
      counters.filesFailed++;
      LOG.warn("(moodvault) op=migration.users {} has no chat_id column", file.getFileName());
      return;
    }

    try {
      for (List<String> row : table.rows()) {
        long id;
        try {
          id = parseOwner(LegacyCsv.Table.cell(row, idCol));
        } catch (ValidationException e) {
          counters.recordsFailed++;
          LOG.warn("(moodvault) op=migration.users skipping row: {}", e.getMessage());
          continue;
        }
        if (store.ownerExists(id)) {
          continue;
        }
        String firstName = nullable(LegacyCsv.Table.cell(row, firstNameCol));
        String displayName =
            firstName != null ? firstName : nullable(LegacyCsv.Table.cell(row, usernameCol));
        String time = nullable(LegacyCsv.Table.cell(row, timeCol));
        try {
          store.upsertUser(id, displayName, time);
          counters.usersImported++;
        } catch (ValidationException e) {
          counters.recordsFailed++;
          LOG.warn(
              "(moodvault) code={} op={} message={} owner={}",
              e.errorCode(),
              "migration.users",
              e.getMessage(),
              id);
        }
      }
    } catch (PersistenceException e) {
      counters.filesFailed++;
      return;
    }
    markMigrated(file, counters);
  }

  private void importEntryFile(Path file, Counters counters) {
    Matcher m = ENTRY_FILE.matcher(file.getFileName().toString());
    if (!m.matches()) {
      return;
    }
    long owner;
    try {
      owner = Long.parseLong(m.group(1));
    } catch (NumberFormatException e) {
      counters.filesFailed++;
      LOG.warn("(moodvault) op=migration.entries owner id out of range in {}", file.getFileName());
      return;
    }

    Path marker = file.resolveSibling(file.getFileName().toString() + IMPORTING_SUFFIX);
    boolean resuming = Files.exists(marker);
    try {
      if (!resuming && store.countEntries(owner) > 0) {
        counters.ownersSkipped++;
        LOG.info(
            "(moodvault) op=migration.entries owner={} already has entries; leaving {} in place",
            owner,
            file.getFileName());
        return;
      }
    } catch (PersistenceException e) {
      counters.filesFailed++;
      return;
    }

    LegacyCsv.Table table;
    try {
      table = LegacyCsv.parse(Files.readString(file, StandardCharsets.UTF_8));
    } catch (IOException e) {
      counters.filesFailed++;
      LOG.warn(
          "(moodvault) code={} op={} message={} file={}",
          ErrorCode.IO_FAILURE,
          "migration.entries",
          e.getMessage(),
          file.getFileName());
      return;
    }
    int dateCol = table.column("date");
    int dataCol = table.column("encrypted_data");
    if (dataCol < 0) {
      counters.filesFailed++;
      LOG.warn(
          "(moodvault) op=migration.entries {} has no encrypted_data column", file.getFileName());
      return;
    }

    byte[] key = LegacyKeys.derive(secrets, owner, iterations);
    List<Entry> decoded = new ArrayList<>();
    int line = 1;
    for (List<String> row : table.rows()) {
      line++;
      try {
        decoded.add(
            decodeRecord(
                owner,
                LegacyCsv.Table.cell(row, dateCol),
                LegacyCsv.Table.cell(row, dataCol),
                key));
      } catch (ValidationException e) {
        counters.recordsFailed++;
        LOG.warn(
            "(moodvault) code={} op={} message={} owner={} line={}",
            e.errorCode(),
            "migration.entries",
            e.getMessage(),
            owner,
            line);
      }
    }

    if (!resuming && !createMarker(marker, counters)) {
      return;
    }

    int written = 0;
    int present = 0;
    try {
      for (Entry entry : decoded) {
        if (resuming && store.hasEntry(owner, entry.date())) {
          present++;
          continue;
        }
        store.upsertEntry(entry);
        written++;
      }
    } catch (PersistenceException e) {
      counters.entriesImported += written;
      counters.filesFailed++;
      LOG.warn(
          "(moodvault) op=migration.entries owner={} stopped after {} entries; file kept for retry",
          owner,
          written);
      return;
    }
    counters.entriesImported += written;
    if (resuming) {
      LOG.info(
          "(moodvault) op=migration.entries owner={} resumed; {} entries were already imported",
          owner,
          present);
    }
    if (markMigrated(file, counters)) {
      counters.ownersImported++;
      removeMarker(marker);
    }
  }

  private static boolean createMarker(Path marker, Counters counters) {
    try {
      Files.writeString(marker, Instant.now().toString(), StandardCharsets.UTF_8);
      return true;
    } catch (IOException e) {
      counters.filesFailed++;
      LOG.warn(
          "(moodvault) code={} op={} message={} file={}",
          ErrorCode.IO_FAILURE,
          "migration.marker",
          e.getMessage(),
          marker.getFileName());
      return false;
    }
  }

  private static void removeMarker(Path marker) {
    try {
      Files.deleteIfExists(marker);
    } catch (IOException e) {
      LOG.warn(
          "(moodvault) code={} op={} message={} file={}",
          ErrorCode.IO_FAILURE,
          "migration.marker",
          e.getMessage(),
          marker.getFileName());
    }
  }

  /**
   * Turns one legacy row into an entry.
   *
   * @throws ValidationException if the row cannot be decoded
   */
  static Entry decodeRecord(long owner, String csvDate, String encryptedData, byte[] key) {
    if (encryptedData == null) {
      throw new ValidationException(ErrorCode.INVALID_RECORD, "encrypted_data is empty");
    }
    String token;
    try {
      token = new String(Base64.getDecoder().decode(encryptedData), StandardCharsets.US_ASCII);
    } catch (IllegalArgumentException e) {
      throw new ValidationException(ErrorCode.INVALID_RECORD, "encrypted_data is not base64", e);
    }
    FernetToken.Opened opened = FernetToken.open(token, key);

    JsonObject obj;
    try {
      JsonElement root =
          JsonParser.parseString(new String(opened.plaintext(), StandardCharsets.UTF_8));
      if (!root.isJsonObject()) {
        throw new ValidationException(ErrorCode.INVALID_RECORD, "record is not a JSON object");
      }
      obj = root.getAsJsonObject();
    } catch (JsonParseException e) {
      throw new ValidationException(ErrorCode.INVALID_RECORD, "record is not valid JSON", e);
    }

    String rawDate = csvDate;
    if (rawDate == null && obj.has("date") && obj.get("date").isJsonPrimitive()) {
      rawDate = obj.get("date").getAsString();
    }
    if (rawDate == null) {
      throw new ValidationException(ErrorCode.INVALID_RECORD, "record has no date");
    }
    LocalDate date;
    try {
      date = LocalDate.parse(rawDate.length() > 10 ? rawDate.substring(0, 10) : rawDate);
    } catch (DateTimeException e) {
      throw new ValidationException(ErrorCode.INVALID_RECORD, "record date is invalid", e);
    }

    EntryFields.Builder fields = EntryFields.builder();
    for (Map.Entry<String, JsonElement> e : obj.entrySet()) {
      if (!EntryFields.NAMES.contains(e.getKey())) {
        continue;
      }
      JsonElement value = e.getValue();
      fields.set(e.getKey(), value.isJsonPrimitive() ? nullable(value.getAsString()) : null);
    }
    return new Entry(owner, date, fields.build(), opened.issuedAt());
  }

  private static long parseOwner(String raw) {
    if (raw == null) {
      throw new ValidationException(ErrorCode.INVALID_RECORD, "chat_id is empty");
    }
    try {
      return Long.parseLong(raw);
    } catch (NumberFormatException e) {
      throw new ValidationException(ErrorCode.INVALID_RECORD, "chat_id is not a number: " + raw);
    }
  }

  /** Maps the placeholders pandas writes for missing values to {@code null}. */
  private static String nullable(String value) {
    if (value == null) {
      return null;
    }
    String lower = value.trim().toLowerCase(Locale.ROOT);
    if (lower.isEmpty() || lower.equals("nan") || lower.equals("none") || lower.equals("null")) {
      return null;
    }
    return value.trim();
  }

  private static boolean markMigrated(Path file, Counters counters) {
    Path target = file.resolveSibling(file.getFileName().toString() + MIGRATED_SUFFIX);
    if (Files.exists(target)) {
      target =
          file.resolveSibling(
              file.getFileName().toString() + MIGRATED_SUFFIX + "." + System.currentTimeMillis());
    }
    try {
      Files.move(file, target, StandardCopyOption.ATOMIC_MOVE);
      return true;
    } catch (IOException e) {
      counters.filesFailed++;
      LOG.warn(
          "(moodvault) code={} op={} message={} file={}",
          ErrorCode.IO_FAILURE,
          "migration.rename",
          e.getMessage(),
          file.getFileName());
      return false;
    }
  }

  private static final class Counters {
    int filesScanned;
    int ownersImported;
    int ownersSkipped;
    int entriesImported;
    int recordsFailed;
    int usersImported;
    int filesFailed;

    MigrationReport toReport() {
      return new MigrationReport(
          filesScanned,
          ownersImported,
          ownersSkipped,
          entriesImported,
          recordsFailed,
          usersImported,
          filesFailed);
    }
  }
}
