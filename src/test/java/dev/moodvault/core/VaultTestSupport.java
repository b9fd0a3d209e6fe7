/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dev.moodvault.crypto.EntryCipher;
import dev.moodvault.crypto.KeyDeriver;
import dev.moodvault.crypto.SecretMaterial;
import java.nio.file.Path;
import java.time.Duration;

/** Temporary SQLite database with the full schema plus a fast key deriver. */
final class VaultTestSupport implements AutoCloseable {
  static final String SYSTEM_SALT_B64 = "c3lzdGVtLXNhbHQtMTIzNA==";
  static final String SECRET_SALT_B64 = "c2VjcmV0LXNhbHQtNTY3OA==";
  static final SecretMaterial SECRETS = SecretMaterial.fromBase64(SYSTEM_SALT_B64, SECRET_SALT_B64);
  static final KeyDeriver.Settings FAST_KEYS =
      new KeyDeriver.Settings(1_000, 1_000, Duration.ofMinutes(10), 1_000);

  final HikariDataSource pool;
  final EntryCipher cipher;
  final EntryStore store;

  private VaultTestSupport(HikariDataSource pool, Metrics metrics) {
    this.pool = pool;
    this.cipher = new EntryCipher(new KeyDeriver(SECRETS, FAST_KEYS, metrics));
    this.store = new EntryStore(pool, cipher, metrics);
  }

  static VaultTestSupport open(Path dir) {
    return open(dir, null);
  }

  static VaultTestSupport open(Path dir, Metrics metrics) {
    HikariDataSource pool = pool(dir.resolve("moodvault-test.db"));
    if (!Migrations.apply(pool)) {
      pool.close();
      throw new IllegalStateException("migrations failed");
    }
    return new VaultTestSupport(pool, metrics);
  }

  static HikariDataSource pool(Path dbFile) {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl("jdbc:sqlite:" + dbFile);
    hc.setDriverClassName("org.sqlite.JDBC");
    hc.setMaximumPoolSize(1);
    hc.setConnectionInitSql("PRAGMA foreign_keys=ON");
    hc.setPoolName("moodvault-test");
    return new HikariDataSource(hc);
  }

  @Override
  public void close() {
    pool.close();
  }
}
