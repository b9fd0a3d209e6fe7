/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dev.moodvault.api.DiaryStore;
import dev.moodvault.api.ErrorCode;
import dev.moodvault.api.VaultException;
import dev.moodvault.crypto.EntryCipher;
import dev.moodvault.crypto.KeyDeriver;
import dev.moodvault.crypto.SecretMaterial;
import dev.moodvault.migration.MigrationReport;
import dev.moodvault.migration.MigrationRunner;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires together all service implementations and manages shared resources (Hikari pool, scheduler).
 */
public final class CoreServices implements Services, java.io.Closeable {
  private static final Logger LOG = LoggerFactory.getLogger("moodvault");

  private final HikariDataSource pool;
  private final EntryCipher cipher;
  private final EntryStore store;
  private final EntryCache cache;
  private final DiaryStore diary;
  private final BackupExporter backups;
  private final ScheduledExecutorService scheduler;
  private final Metrics metrics;
  private final MigrationReport migrationReport;

  private CoreServices(
      HikariDataSource pool,
      EntryCipher cipher,
      EntryStore store,
      EntryCache cache,
      DiaryStore diary,
      BackupExporter backups,
      ScheduledExecutorService scheduler,
      Metrics metrics,
      MigrationReport migrationReport) {
    this.pool = pool;
    this.cipher = cipher;
    this.store = store;
    this.cache = cache;
    this.diary = diary;
    this.backups = backups;
    this.scheduler = scheduler;
    this.metrics = metrics;
    this.migrationReport = migrationReport;
  }

  /**
   * Starts core services using the provided configuration.
   *
   * @param cfg runtime configuration
   * @return service container
   * @throws dev.moodvault.api.KeyDerivationException if the secret salts are missing or unusable
   */
  public static Services start(Config cfg) {
    String backend = LogbackConfigurator.configure(cfg.log());
    LOG.info(
        "(moodvault) op=boot logging backend={} level={} json={}",
        backend,
        cfg.log().level(),
        cfg.log().json());
    SecretMaterial secrets = SecretsFile.resolve(cfg.crypto());

    HikariDataSource ds = openPool(cfg.db());
    Metrics metrics = null;
    try {
      DataSource dataSource = SlowQueryDataSource.wrap(ds, cfg.log().slowQueryMs());
      if (!Migrations.apply(dataSource)) {
        throw new IllegalStateException("schema migrations did not complete");
      }
      SchemaVerifier.verify(dataSource);

      metrics = new Metrics();
      Config.Crypto crypto = cfg.crypto();
      KeyDeriver keys =
          new KeyDeriver(
              secrets,
              new KeyDeriver.Settings(
                  crypto.ownerIterations(),
                  crypto.passphraseIterations(),
                  Duration.ofSeconds(crypto.keyTtlSeconds()),
                  crypto.keyCacheMaxOwners()),
              metrics);
      EntryCipher cipher = new EntryCipher(keys);
      EntryStore store = new EntryStore(dataSource, cipher, metrics);

      MigrationReport report = MigrationReport.empty();
      if (cfg.migration().enabled()) {
        report = new MigrationRunner(store, secrets, cfg.migration()).run();
      }

      Config.Cache cacheCfg = cfg.cache();
      EntryCache cache =
          new EntryCache(
              store,
              new EntryCache.Settings(
                  cacheCfg.maxOwners(),
                  Duration.ofSeconds(cacheCfg.ttlSeconds()),
                  cacheCfg.writeThrough()),
              metrics);
      DiaryStore diary = new DiaryStoreImpl(cache, store, cipher, metrics);
      BackupExporter backups = new BackupExporter(store, cfg.backup());

      ScheduledExecutorService scheduler =
          Executors.newScheduledThreadPool(
              1,
              r -> {
                Thread t = new Thread(r, "moodvault-scheduler");
                t.setDaemon(true);
                return t;
              });
      schedule(scheduler, cfg, cache, keys, backups);

      return new CoreServices(
          ds, cipher, store, cache, diary, backups, scheduler, metrics, report);
    } catch (RuntimeException e) {
      if (metrics != null) {
        metrics.close();
      }
      ds.close();
      throw e;
    }
  }

  private static HikariDataSource openPool(Config.Db db) {
    Path dbFile = Path.of(db.path()).toAbsolutePath();
    try {
      if (dbFile.getParent() != null) {
        Files.createDirectories(dbFile.getParent());
      }
    } catch (IOException e) {
      throw new IllegalStateException("cannot create database directory for " + dbFile, e);
    }

    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(db.jdbcUrl());
    hc.setDriverClassName("org.sqlite.JDBC");
    hc.setMaximumPoolSize(1);
    hc.setMinimumIdle(1);
    hc.setConnectionTimeout(db.pool().connectionTimeoutMs());
    hc.setAutoCommit(true);
    hc.setPoolName("moodvault-hikari");
    hc.setConnectionInitSql("PRAGMA foreign_keys=ON");
    hc.addDataSourceProperty("foreign_keys", "true");
    hc.addDataSourceProperty("journal_mode", "WAL");
    hc.addDataSourceProperty("busy_timeout", String.valueOf(db.pool().busyTimeoutMs()));

    RuntimeException last = null;
    int attempts = Math.max(1, db.pool().startupAttempts());
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        return new HikariDataSource(hc);
      } catch (RuntimeException ex) {
        last = ex;
        LOG.warn(
            "(moodvault) failed to start Hikari (attempt {}/{}): {}",
            attempt,
            attempts,
            ex.getMessage());
        if (attempt < attempts) {
          try {
            Thread.sleep(250L * attempt);
          } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            break;
          }
        }
      }
    }
    throw new IllegalStateException("Unable to start datasource", last);
  }

  private static void schedule(
      ScheduledExecutorService scheduler,
      Config cfg,
      EntryCache cache,
      KeyDeriver keys,
      BackupExporter backups) {
    long sweepEvery = cfg.cache().sweepEverySeconds();
    scheduler.scheduleWithFixedDelay(
        () ->
            runGuarded(
                "cache.sweep",
                () -> {
                  cache.sweep();
                  keys.sweepExpired();
                }),
        sweepEvery,
        sweepEvery,
        TimeUnit.SECONDS);

    if (cfg.backup().enabled()) {
      long everyHours = cfg.backup().everyHours();
      scheduler.scheduleWithFixedDelay(
          () ->
              runGuarded(
                  "backup.export",
                  () -> {
                    try {
                      backups.exportNow();
                    } catch (IOException e) {
                      LOG.warn(
                          "(moodvault) code={} op={} message={}",
                          ErrorCode.IO_FAILURE,
                          "backup.export",
                          e.getMessage());
                    }
                  }),
          everyHours,
          everyHours,
          TimeUnit.HOURS);
    }
  }

  /** Keeps a failing periodic task from cancelling its own schedule. */
  private static void runGuarded(String op, Runnable task) {
    try {
      task.run();
    } catch (VaultException e) {
      LOG.warn("(moodvault) code={} op={} message={}", e.errorCode(), op, e.getMessage());
    } catch (RuntimeException e) {
      LOG.warn("(moodvault) op={} background task failed", op, e);
    }
  }

  @Override
  public DiaryStore diary() {
    return diary;
  }

  @Override
  public EntryCache cache() {
    return cache;
  }

  @Override
  public EntryStore store() {
    return store;
  }

  @Override
  public EntryCipher cipher() {
    return cipher;
  }

  @Override
  public BackupExporter backups() {
    return backups;
  }

  @Override
  public ScheduledExecutorService scheduler() {
    return scheduler;
  }

  @Override
  public Metrics metrics() {
    return metrics;
  }

  @Override
  public MigrationReport migrationReport() {
    return migrationReport;
  }

  /** Flushes the cache, then closes background resources and the connection pool. */
  @Override
  public void shutdown() throws IOException {
    scheduler.shutdownNow();
    try {
      int stillDirty = cache.flushAll();
      if (stillDirty > 0) {
        LOG.warn(
            "(moodvault) code={} op={} message={}",
            "CACHE_FLUSH_INCOMPLETE",
            "shutdown",
            stillDirty + " owner(s) still have unsaved entries");
      }
    } catch (RuntimeException e) {
      LOG.warn("(moodvault) op=shutdown cache flush failed", e);
    }
    metrics.close();
    pool.close();
  }

  /** Alias for {@link #shutdown()}. */
  @Override
  public void close() throws IOException {
    shutdown();
  }
}
