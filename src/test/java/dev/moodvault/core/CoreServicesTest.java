/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.moodvault.api.EntryFields;
import dev.moodvault.api.KeyDerivationException;
import dev.moodvault.api.ReadResult;
import dev.moodvault.api.User;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;
import javax.management.ObjectName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CoreServicesTest {
  private static final LocalDate DAY = LocalDate.of(2024, 1, 5);

  @TempDir Path tempDir;

  private Config config(boolean inlineSalts) {
    String raw =
        Config.TEMPLATE
            .replace("ownerIterations: 100000", "ownerIterations: 10000")
            .replace("passphraseIterations: 50000", "passphraseIterations: 10000")
            .replace("legacyIterations: 100000", "legacyIterations: 1000")
            .replace("legacyDir: \"./data\"", "legacyDir: \"" + tempDir.resolve("legacy") + "\"")
            .replace(
                "secretsFile: \"./config/moodvault.secrets.json\"",
                "secretsFile: \"" + tempDir.resolve("secrets.json") + "\"")
            .replace(
                "outDir: \"./backups/moodvault\"",
                "outDir: \"" + tempDir.resolve("backups") + "\"");
    Map<String, String> env =
        inlineSalts
            ? Map.of(
                "MOODVAULT_DB_PATH", tempDir.resolve("db").resolve("diary.db").toString(),
                "MOODVAULT_SYSTEM_SALT", VaultTestSupport.SYSTEM_SALT_B64,
                "MOODVAULT_SECRET_SALT", VaultTestSupport.SECRET_SALT_B64)
            : Map.of("MOODVAULT_DB_PATH", tempDir.resolve("db").resolve("diary.db").toString());
    return Config.parse(raw, env);
  }

  @Test
  void startImportsLegacyUsersAndServesDiary() throws Exception {
    Path legacy = Files.createDirectories(tempDir.resolve("legacy"));
    Files.writeString(
        legacy.resolve("users.csv"),
        "chat_id,username,first_name,notification_time\n7,sam,,8:30\n");

    Services services = CoreServices.start(config(true));
    try {
      assertEquals(1, services.migrationReport().usersImported());
      User sam = services.diary().findUser(7L).orElseThrow();
      assertEquals("sam", sam.displayName());
      assertEquals("08:30", sam.notificationTime());

      assertTrue(services.diary().saveEntry(42L, DAY, EntryFields.builder().mood("7").build()));
      assertEquals(1, services.diary().getEntries(42L).size());
      assertNotNull(services.metrics());
      assertEquals(1, services.metrics().view().getEntryWriteSuccess());

      BackupExporter.Result backup = services.backups().exportNow();
      assertEquals(1, backup.entries());
      assertTrue(Files.exists(backup.file()));
    } finally {
      services.shutdown();
    }

    Services reopened = CoreServices.start(config(true));
    try {
      ReadResult entries = reopened.diary().getEntries(42L);
      assertEquals(1, entries.size());
      assertEquals("7", entries.entries().get(0).fields().mood());
      assertEquals(0, reopened.migrationReport().usersImported());
    } finally {
      reopened.shutdown();
    }
  }

  @Test
  void deferredWritesAreFlushedOnShutdown() throws Exception {
    Config base = config(true);
    Config deferred =
        new Config(
            base.db(),
            base.crypto(),
            new Config.Cache(100, 1800, 60, false),
            base.log(),
            base.migration(),
            base.backup());

    Services services = CoreServices.start(deferred);
    services.diary().saveEntry(42L, DAY, EntryFields.builder().sleep("6").build());
    assertEquals(0, services.store().countEntries(42L));
    services.shutdown();

    Services reopened = CoreServices.start(base);
    try {
      assertEquals(1, reopened.store().countEntries(42L));
    } finally {
      reopened.shutdown();
    }
  }

  @Test
  void generatedSecretsAreReusedAcrossRestarts() throws Exception {
    Services first = CoreServices.start(config(false));
    try {
      first.diary().saveEntry(42L, DAY, EntryFields.builder().mood("3").build());
    } finally {
      first.shutdown();
    }
    assertTrue(Files.exists(tempDir.resolve("secrets.json")));

    Services second = CoreServices.start(config(false));
    try {
      assertEquals("3", second.diary().getEntries(42L).entries().get(0).fields().mood());
    } finally {
      second.shutdown();
    }
  }

  @Test
  void unreadableSecretsFileStopsStartup() throws Exception {
    Files.writeString(tempDir.resolve("secrets.json"), "garbage");

    assertThrows(KeyDerivationException.class, () -> CoreServices.start(config(false)));
  }

  @Test
  void failedStartupReleasesMetricsRegistration() throws Exception {
    Config base = config(true);
    Config broken =
        new Config(
            base.db(),
            base.crypto(),
            new Config.Cache(0, 1800, 60, true),
            base.log(),
            base.migration(),
            base.backup());

    assertThrows(IllegalArgumentException.class, () -> CoreServices.start(broken));

    assertFalse(
        ManagementFactory.getPlatformMBeanServer()
            .isRegistered(new ObjectName(Metrics.MBEAN_NAME)));
    Services services = CoreServices.start(base);
    services.shutdown();
  }
}
