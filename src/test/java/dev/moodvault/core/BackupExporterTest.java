/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import dev.moodvault.api.EntryFields;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BackupExporterTest {
  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  @TempDir Path tempDir;

  private VaultTestSupport vault;
  private Path outDir;

  @BeforeEach
  void setUp() {
    vault = VaultTestSupport.open(tempDir);
    outDir = tempDir.resolve("backups");
    vault.store.upsertUser(42L, "Ann", "21:00");
    vault.store.upsertEntry(
        42L, LocalDate.of(2024, 1, 5), EntryFields.builder().mood("7").comment("walked").build());
    vault.store.upsertEntry(
        43L, LocalDate.of(2024, 1, 6), EntryFields.builder().sleep("5").build());
  }

  @AfterEach
  void tearDown() {
    vault.close();
  }

  private BackupExporter exporter(Instant at, int keepMax) {
    Config.Backup cfg =
        new Config.Backup(true, outDir.toString(), 24, false, new Config.Prune(0, keepMax));
    return new BackupExporter(vault.store, cfg, Clock.fixed(at, ZoneOffset.UTC));
  }

  private static String sha256Hex(byte[] bytes) throws Exception {
    return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
  }

  @Test
  void plainExportWritesHeaderRowsAndSidecar() throws Exception {
    BackupExporter.Result result = exporter(NOW, 10).exportTo(outDir, false);

    assertEquals(2, result.users());
    assertEquals(2, result.entries());
    String name = result.file().getFileName().toString();
    assertTrue(name.matches("moodvault-20240601-120000-[0-9a-f]{12}\\.jsonl"), name);

    List<String> lines = Files.readAllLines(result.file());
    assertEquals(5, lines.size());
    JsonObject header = JsonParser.parseString(lines.get(0)).getAsJsonObject();
    assertEquals("jsonl/v1", header.get("version").getAsString());
    assertEquals(Migrations.currentVersion(), header.get("schemaVersion").getAsInt());

    JsonObject user = JsonParser.parseString(lines.get(1)).getAsJsonObject();
    assertEquals("users", user.get("table").getAsString());
    assertEquals("Ann", user.get("displayName").getAsString());
    JsonObject second = JsonParser.parseString(lines.get(2)).getAsJsonObject();
    assertTrue(second.get("notificationTime").isJsonNull());

    JsonObject entry = JsonParser.parseString(lines.get(3)).getAsJsonObject();
    assertEquals("entries", entry.get("table").getAsString());
    assertEquals("2024-01-05", entry.get("date").getAsString());
    assertFalse(String.join("\n", lines).contains("walked"), "payloads must stay encrypted");

    Path sidecar = result.file().resolveSibling(name + ".sha256");
    assertEquals(sha256Hex(Files.readAllBytes(result.file())), Files.readString(sidecar));
  }

  @Test
  void gzipExportIsReadableAndChecksummed() throws Exception {
    BackupExporter.Result result = exporter(NOW, 10).exportTo(outDir, true);

    assertTrue(result.file().getFileName().toString().endsWith(".jsonl.gz"));
    List<String> lines;
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(
                new GZIPInputStream(Files.newInputStream(result.file())),
                StandardCharsets.UTF_8))) {
      lines = reader.lines().collect(Collectors.toList());
    }
    assertEquals(5, lines.size());

    Path sidecar = result.file().resolveSibling(result.file().getFileName() + ".sha256");
    assertEquals(sha256Hex(Files.readAllBytes(result.file())), Files.readString(sidecar));
  }

  @Test
  void pruneKeepsNewestExportsUpToKeepMax() throws Exception {
    exporter(NOW, 2).exportTo(outDir, false);
    exporter(NOW.plusSeconds(60), 2).exportTo(outDir, false);
    BackupExporter.Result newest = exporter(NOW.plusSeconds(120), 2).exportTo(outDir, false);

    List<String> snapshots;
    List<String> sidecars;
    try (Stream<Path> files = Files.list(outDir)) {
      List<String> names = files.map(p -> p.getFileName().toString()).sorted().toList();
      snapshots = names.stream().filter(n -> n.endsWith(".jsonl")).toList();
      sidecars = names.stream().filter(n -> n.endsWith(".sha256")).toList();
    }
    assertEquals(2, snapshots.size());
    assertEquals(2, sidecars.size());
    assertFalse(snapshots.stream().anyMatch(n -> n.contains("-120000-")));
    assertTrue(snapshots.contains(newest.file().getFileName().toString()));
  }

  @Test
  void exportNowUsesConfiguredDirectory() throws Exception {
    Config.Backup cfg =
        new Config.Backup(true, outDir.toString(), 24, true, new Config.Prune(14, 60));
    BackupExporter.Result result =
        new BackupExporter(vault.store, cfg, Clock.fixed(NOW, ZoneOffset.UTC)).exportNow();

    assertEquals(outDir, result.file().getParent());
    assertTrue(result.file().getFileName().toString().endsWith(".gz"));
  }
}
