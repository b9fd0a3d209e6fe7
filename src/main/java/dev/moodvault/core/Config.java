/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runtime configuration loaded from {@code config/moodvault.json5}.
 *
 * <p>The loader:
 *
 * <ul>
 *   <li>Writes a commented template on first boot.
 *   <li>Emits a {@code moodvault.json5.example} snapshot next to it on every boot.
 *   <li>Supports environment overrides for the database path and both salts ({@code
 *       MOODVAULT_DB_PATH}, {@code MOODVAULT_SYSTEM_SALT}, {@code MOODVAULT_SECRET_SALT}).
 *   <li>Validates every value and names the offending key on failure.
 * </ul>
 */
public final class Config {

  static final String TEMPLATE =
      """
      // Moodvault v1.0.0 configuration (JSON5 with comments)
      // Drop into config/moodvault.json5. Environment overrides: MOODVAULT_DB_PATH, MOODVAULT_SYSTEM_SALT, MOODVAULT_SECRET_SALT.
      {
        core: {
          db: {
            path: "./data/moodvault.db",
            pool: {
              connectionTimeoutMs: 10000,
              busyTimeoutMs: 5000,
              startupAttempts: 3
            }
          },
          crypto: {
            // base64 salts; leave empty to use (or generate) the secrets file
            systemSalt: "",
            secretSalt: "",
            secretsFile: "./config/moodvault.secrets.json",
            ownerIterations: 100000,
            passphraseIterations: 50000,
            keyTtlSeconds: 3600,
            keyCacheMaxOwners: 10000
          },
          cache: {
            maxOwners: 1000,
            ttlSeconds: 1800,
            sweepEverySeconds: 60,
            writeThrough: true
          },
          log: {
            json: false,
            slowQueryMs: 250,
            level: "INFO"
          }
        },
        migration: {
          enabled: true,
          legacyDir: "./data",
          usersFile: "users.csv",
          legacyIterations: 100000
        },
        backup: {
          enabled: false,
          outDir: "./backups/moodvault",
          everyHours: 24,
          gzip: true,
          prune: { keepDays: 14, keepMax: 60 }
        }
      }
      """;

  private final Db db;
  private final Crypto crypto;
  private final Cache cache;
  private final Log log;
  private final Migration migration;
  private final Backup backup;

  Config(Db db, Crypto crypto, Cache cache, Log log, Migration migration, Backup backup) {
    this.db = db;
    this.crypto = crypto;
    this.cache = cache;
    this.log = log;
    this.migration = migration;
    this.backup = backup;
  }

  /**
   * Database block.
   *
   * @return database settings
   */
  public Db db() {
    return db;
  }

  /**
   * Key derivation and secret material block.
   *
   * @return crypto settings
   */
  public Crypto crypto() {
    return crypto;
  }

  /**
   * Entry cache block.
   *
   * @return cache settings
   */
  public Cache cache() {
    return cache;
  }

  /**
   * Logging block.
   *
   * @return logging settings
   */
  public Log log() {
    return log;
  }

  /**
   * Legacy import block.
   *
   * @return migration settings
   */
  public Migration migration() {
    return migration;
  }

  /**
   * Snapshot export block.
   *
   * @return backup settings
   */
  public Backup backup() {
    return backup;
  }

  /**
   * Loads configuration, writing a default file if it does not exist and always refreshing the
   * commented example alongside it.
   *
   * @param path config path
   * @return parsed config
   */
  public static Config loadOrWriteDefault(Path path) {
    return loadOrWriteDefault(path, System.getenv());
  }

  static Config loadOrWriteDefault(Path path, Map<String, String> env) {
    try {
      Path configDir = path.getParent();
      Path exampleDir = configDir != null ? configDir : Path.of(".");
      ConfigTemplateWriter.writeExample(exampleDir.resolve("moodvault.json5.example"), TEMPLATE);

      if (!Files.exists(path)) {
        if (configDir != null) {
          Files.createDirectories(configDir);
        }
        Files.writeString(path, TEMPLATE, StandardCharsets.UTF_8);
      }

      return parse(Files.readString(path, StandardCharsets.UTF_8), env);
    } catch (IOException e) {
      throw new RuntimeException("Failed to read config: " + path, e);
    }
  }

  /**
   * Parses JSON5 text without touching the file system.
   *
   * @param raw JSON5 document
   * @param env environment overrides
   * @return validated config
   */
  static Config parse(String raw, Map<String, String> env) {
    JsonObject root;
    try {
      root = JsonParser.parseString(stripJson5(raw)).getAsJsonObject();
    } catch (JsonParseException | IllegalStateException e) {
      throw new IllegalStateException("config is not a valid JSON5 object", e);
    }
    JsonObject core = optObject(root, "core");
    if (core == null) {
      throw new IllegalStateException("config missing core{} block");
    }

    Config config =
        new Config(
            parseDb(optObject(core, "db"), env),
            parseCrypto(optObject(core, "crypto"), env),
            parseCache(optObject(core, "cache")),
            parseLog(optObject(core, "log")),
            parseMigration(optObject(root, "migration")),
            parseBackup(optObject(root, "backup")));
    validate(config);
    return config;
  }

  /**
   * Removes comments and trailing commas while leaving quoted strings untouched.
   *
   * @param raw JSON5 text
   * @return strict JSON text
   */
  static String stripJson5(String raw) {
    StringBuilder out = new StringBuilder(raw.length());
    int i = 0;
    int n = raw.length();
    while (i < n) {
      char ch = raw.charAt(i);
      if (ch == '"' || ch == '\'') {
        int end = skipString(raw, i, ch);
        out.append(raw, i, end);
        i = end;
      } else if (ch == '/' && i + 1 < n && raw.charAt(i + 1) == '/') {
        while (i < n && raw.charAt(i) != '\n') {
          i++;
        }
      } else if (ch == '/' && i + 1 < n && raw.charAt(i + 1) == '*') {
        int close = raw.indexOf("*/", i + 2);
        i = close < 0 ? n : close + 2;
      } else if (ch == ',' && nextSignificantCloses(raw, i + 1)) {
        i++;
      } else {
        out.append(ch);
        i++;
      }
    }
    return out.toString();
  }

  private static int skipString(String raw, int start, char quote) {
    int i = start + 1;
    while (i < raw.length()) {
      char ch = raw.charAt(i);
      if (ch == '\\') {
        i += 2;
        continue;
      }
      i++;
      if (ch == quote) {
        break;
      }
    }
    return Math.min(i, raw.length());
  }

  private static boolean nextSignificantCloses(String raw, int from) {
    int i = from;
    while (i < raw.length()) {
      char ch = raw.charAt(i);
      if (Character.isWhitespace(ch)) {
        i++;
      } else if (ch == '/' && i + 1 < raw.length() && raw.charAt(i + 1) == '/') {
        while (i < raw.length() && raw.charAt(i) != '\n') {
          i++;
        }
      } else if (ch == '/' && i + 1 < raw.length() && raw.charAt(i + 1) == '*') {
        int close = raw.indexOf("*/", i + 2);
        i = close < 0 ? raw.length() : close + 2;
      } else {
        return ch == '}' || ch == ']';
      }
    }
    return false;
  }

  private static Db parseDb(JsonObject db, Map<String, String> env) {
    if (db == null) {
      throw new IllegalStateException("config missing core.db{}");
    }
    String envPath = env.get("MOODVAULT_DB_PATH");
    String path = envPath != null ? envPath : optString(db, "path", "./data/moodvault.db");
    JsonObject poolObj = optObject(db, "pool");
    return new Db(
        path,
        new Pool(
            optLong(poolObj, "connectionTimeoutMs", 10_000L),
            optInt(poolObj, "busyTimeoutMs", 5_000),
            optInt(poolObj, "startupAttempts", 3)));
  }

  private static Crypto parseCrypto(JsonObject crypto, Map<String, String> env) {
    String envSystem = env.get("MOODVAULT_SYSTEM_SALT");
    String envSecret = env.get("MOODVAULT_SECRET_SALT");
    String systemSalt = envSystem != null ? envSystem : optString(crypto, "systemSalt", "");
    String secretSalt = envSecret != null ? envSecret : optString(crypto, "secretSalt", "");
    return new Crypto(
        systemSalt,
        secretSalt,
        optString(crypto, "secretsFile", "./config/moodvault.secrets.json"),
        optInt(crypto, "ownerIterations", 100_000),
        optInt(crypto, "passphraseIterations", 50_000),
        optInt(crypto, "keyTtlSeconds", 3600),
        optInt(crypto, "keyCacheMaxOwners", 10_000));
  }

  private static Cache parseCache(JsonObject cache) {
    return new Cache(
        optInt(cache, "maxOwners", 1000),
        optInt(cache, "ttlSeconds", 1800),
        optInt(cache, "sweepEverySeconds", 60),
        optBoolean(cache, "writeThrough", true));
  }

  private static Log parseLog(JsonObject log) {
    if (log == null) {
      return new Log(false, 250L, "INFO");
    }
    boolean json = optBoolean(log, "json", false);
    long slow = optLong(log, "slowQueryMs", 250L);
    String level = optString(log, "level", "INFO");
    return new Log(json, slow, level);
  }

  private static Migration parseMigration(JsonObject migration) {
    return new Migration(
        optBoolean(migration, "enabled", true),
        optString(migration, "legacyDir", "./data"),
        optString(migration, "usersFile", "users.csv"),
        optInt(migration, "legacyIterations", 100_000));
  }

  private static Backup parseBackup(JsonObject backup) {
    JsonObject prune = optObject(backup, "prune");
    return new Backup(
        optBoolean(backup, "enabled", false),
        optString(backup, "outDir", "./backups/moodvault"),
        optInt(backup, "everyHours", 24),
        optBoolean(backup, "gzip", true),
        new Prune(optInt(prune, "keepDays", 14), optInt(prune, "keepMax", 60)));
  }

  private static JsonObject optObject(JsonObject parent, String key) {
    return parent != null && parent.has(key) && parent.get(key).isJsonObject()
        ? parent.getAsJsonObject(key)
        : null;
  }

  private static boolean optBoolean(JsonObject obj, String key, boolean def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsBoolean() : def;
  }

  private static int optInt(JsonObject obj, String key, int def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsInt() : def;
  }

  private static long optLong(JsonObject obj, String key, long def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsLong() : def;
  }

  private static String optString(JsonObject obj, String key, String def) {
    return obj != null && obj.has(key) && !obj.get(key).isJsonNull()
        ? obj.get(key).getAsString()
        : def;
  }

  private static void validate(Config cfg) {
    validateDb(cfg.db());
    validateCrypto(cfg.crypto());
    validateCache(cfg.cache());
    validateLog(cfg.log());
    validateMigration(cfg.migration());
    validateBackup(cfg.backup());
  }

  private static void validateDb(Db db) {
    requireNonBlank(db.path(), "core.db.path");
    ensureValidPath(db.path(), "core.db.path");
    long connectionTimeout = db.pool().connectionTimeoutMs();
    if (connectionTimeout < 1_000 || connectionTimeout > 120_000) {
      throw new IllegalStateException(
          "core.db.pool.connectionTimeoutMs must be between 1000 and 120000");
    }
    int busy = db.pool().busyTimeoutMs();
    if (busy < 0 || busy > 60_000) {
      throw new IllegalStateException("core.db.pool.busyTimeoutMs must be between 0 and 60000");
    }
    int attempts = db.pool().startupAttempts();
    if (attempts < 1 || attempts > 10) {
      throw new IllegalStateException("core.db.pool.startupAttempts must be between 1 and 10");
    }
  }

  private static void validateCrypto(Crypto crypto) {
    boolean hasSystem = !crypto.systemSalt().isBlank();
    boolean hasSecret = !crypto.secretSalt().isBlank();
    if (hasSystem != hasSecret) {
      throw new IllegalStateException(
          "core.crypto.systemSalt and core.crypto.secretSalt must be set together");
    }
    if (!hasSystem) {
      requireNonBlank(crypto.secretsFile(), "core.crypto.secretsFile");
      ensureValidPath(crypto.secretsFile(), "core.crypto.secretsFile");
    }
    if (crypto.ownerIterations() < 10_000) {
      throw new IllegalStateException("core.crypto.ownerIterations must be >= 10000");
    }
    if (crypto.passphraseIterations() < 10_000) {
      throw new IllegalStateException("core.crypto.passphraseIterations must be >= 10000");
    }
    if (crypto.keyTtlSeconds() < 1) {
      throw new IllegalStateException("core.crypto.keyTtlSeconds must be >= 1");
    }
    if (crypto.keyCacheMaxOwners() < 1) {
      throw new IllegalStateException("core.crypto.keyCacheMaxOwners must be >= 1");
    }
  }

  private static void validateCache(Cache cache) {
    if (cache.maxOwners() < 1) {
      throw new IllegalStateException("core.cache.maxOwners must be >= 1");
    }
    if (cache.ttlSeconds() < 1) {
      throw new IllegalStateException("core.cache.ttlSeconds must be >= 1");
    }
    if (cache.sweepEverySeconds() < 1 || cache.sweepEverySeconds() > 3600) {
      throw new IllegalStateException("core.cache.sweepEverySeconds must be between 1 and 3600");
    }
  }

  private static void validateLog(Log log) {
    if (log.slowQueryMs() < 0) {
      throw new IllegalStateException("core.log.slowQueryMs must be >= 0");
    }
    requireNonBlank(log.level(), "core.log.level");
    String normalized = log.level().toUpperCase(Locale.ROOT);
    if (!List.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR").contains(normalized)) {
      throw new IllegalStateException("core.log.level must be TRACE, DEBUG, INFO, WARN, or ERROR");
    }
  }

  private static void validateMigration(Migration migration) {
    if (!migration.enabled()) {
      return;
    }
    requireNonBlank(migration.legacyDir(), "migration.legacyDir");
    ensureValidPath(migration.legacyDir(), "migration.legacyDir");
    requireNonBlank(migration.usersFile(), "migration.usersFile");
    if (migration.legacyIterations() < 1) {
      throw new IllegalStateException("migration.legacyIterations must be >= 1");
    }
  }

  private static void validateBackup(Backup backup) {
    requireNonBlank(backup.outDir(), "backup.outDir");
    ensureValidPath(backup.outDir(), "backup.outDir");
    if (backup.everyHours() < 1 || backup.everyHours() > 24 * 30) {
      throw new IllegalStateException("backup.everyHours must be between 1 and 720");
    }
    if (backup.prune().keepDays() < 0) {
      throw new IllegalStateException("backup.prune.keepDays must be >= 0");
    }
    if (backup.prune().keepMax() < 1) {
      throw new IllegalStateException("backup.prune.keepMax must be >= 1");
    }
    if (backup.prune().keepDays() > 3650) {
      throw new IllegalStateException("backup.prune.keepDays must be <= 3650");
    }
    if (backup.prune().keepMax() > 1000) {
      throw new IllegalStateException("backup.prune.keepMax must be <= 1000");
    }
  }

  private static void requireNonBlank(String value, String field) {
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalStateException(field + " must be provided");
    }
  }

  private static void ensureValidPath(String value, String field) {
    try {
      Path.of(value);
    } catch (Exception e) {
      throw new IllegalStateException(field + " must be a valid file system path", e);
    }
  }

  /**
   * Database settings.
   *
   * @param path SQLite database file
   * @param pool connection pool tuning
   */
  public record Db(String path, Pool pool) {
    /** JDBC URL of the database file. */
    public String jdbcUrl() {
      return "jdbc:sqlite:" + path;
    }
  }

  /**
   * Connection pool tuning. The pool always holds a single connection.
   *
   * @param connectionTimeoutMs how long a caller waits for the connection
   * @param busyTimeoutMs SQLite busy timeout applied to the connection
   * @param startupAttempts attempts to open the pool before giving up
   */
  public record Pool(long connectionTimeoutMs, int busyTimeoutMs, int startupAttempts) {}

  /**
   * Key derivation settings.
   *
   * @param systemSalt base64 system salt, blank to use the secrets file
   * @param secretSalt base64 secret salt, blank to use the secrets file
   * @param secretsFile file holding generated salts
   * @param ownerIterations PBKDF2 iterations for per-owner keys
   * @param passphraseIterations PBKDF2 iterations for sharing passphrases
   * @param keyTtlSeconds lifetime of a cached owner key
   * @param keyCacheMaxOwners upper bound on cached owner keys
   */
  public record Crypto(
      String systemSalt,
      String secretSalt,
      String secretsFile,
      int ownerIterations,
      int passphraseIterations,
      int keyTtlSeconds,
      int keyCacheMaxOwners) {
    /** Whether both salts are configured inline (or through the environment). */
    public boolean hasInlineSalts() {
      return !systemSalt.isBlank() && !secretSalt.isBlank();
    }
  }

  /**
   * Entry cache settings.
   *
   * @param maxOwners owners held in memory at once
   * @param ttlSeconds idle lifetime of a slot
   * @param sweepEverySeconds cadence of the background sweep
   * @param writeThrough flush every write immediately
   */
  public record Cache(int maxOwners, int ttlSeconds, int sweepEverySeconds, boolean writeThrough) {}

  /**
   * Logging settings.
   *
   * @param json emit JSON lines instead of plain text
   * @param slowQueryMs slow SQL threshold; {@code 0} disables detection
   * @param level root log level
   */
  public record Log(boolean json, long slowQueryMs, String level) {}

  /**
   * Legacy import settings.
   *
   * @param enabled run the import at startup
   * @param legacyDir directory holding {@code user_<id>_data.csv} files
   * @param usersFile legacy user list file name inside {@code legacyDir}
   * @param legacyIterations PBKDF2 iterations used by the legacy format
   */
  public record Migration(
      boolean enabled, String legacyDir, String usersFile, int legacyIterations) {}

  /**
   * Snapshot export settings.
   *
   * @param enabled schedule periodic exports
   * @param outDir export directory
   * @param everyHours export cadence
   * @param gzip compress exports
   * @param prune retention policy
   */
  public record Backup(boolean enabled, String outDir, int everyHours, boolean gzip, Prune prune) {}

  /**
   * Retention of snapshot exports.
   *
   * @param keepDays delete exports older than this many days; {@code 0} keeps all
   * @param keepMax upper bound on kept exports
   */
  public record Prune(int keepDays, int keepMax) {}
}
