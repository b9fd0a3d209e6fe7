/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigTest {

  @TempDir Path tempDir;

  @Test
  void stripJson5_preservesQuotedCommasWhileRemovingTrailing() {
    String raw =
        "{\n"
            + "  // comment\n"
            + "  \"array\": [\n"
            + "    \",]\"\n"
            + "  ,\n"
            + "  ],\n"
            + "  \"object\": {\n"
            + "    \"value\": \",} // not a comment\"\n"
            + "  },\n"
            + "}\n";

    JsonObject parsed = JsonParser.parseString(Config.stripJson5(raw)).getAsJsonObject();
    JsonArray array = parsed.getAsJsonArray("array");
    assertEquals(",]", array.get(0).getAsString(), "quoted comma should remain untouched");
    assertEquals(
        ",} // not a comment", parsed.getAsJsonObject("object").get("value").getAsString());
  }

  @Test
  void templateParsesToDefaults() {
    Config cfg = Config.parse(Config.TEMPLATE, Map.of());

    assertEquals("./data/moodvault.db", cfg.db().path());
    assertEquals("jdbc:sqlite:./data/moodvault.db", cfg.db().jdbcUrl());
    assertFalse(cfg.crypto().hasInlineSalts());
    assertEquals(100_000, cfg.crypto().ownerIterations());
    assertEquals(1000, cfg.cache().maxOwners());
    assertEquals(1800, cfg.cache().ttlSeconds());
    assertTrue(cfg.cache().writeThrough());
    assertEquals("INFO", cfg.log().level());
    assertTrue(cfg.migration().enabled());
    assertFalse(cfg.backup().enabled());
    assertEquals(60, cfg.backup().prune().keepMax());
  }

  @Test
  void environmentOverridesPathAndSalts() {
    Config cfg =
        Config.parse(
            Config.TEMPLATE,
            Map.of(
                "MOODVAULT_DB_PATH", "/srv/diary.db",
                "MOODVAULT_SYSTEM_SALT", VaultTestSupport.SYSTEM_SALT_B64,
                "MOODVAULT_SECRET_SALT", VaultTestSupport.SECRET_SALT_B64));

    assertEquals("/srv/diary.db", cfg.db().path());
    assertTrue(cfg.crypto().hasInlineSalts());
    assertEquals(VaultTestSupport.SYSTEM_SALT_B64, cfg.crypto().systemSalt());
  }

  @Test
  void validationNamesTheOffendingKey() {
    String lowIterations = Config.TEMPLATE.replace("ownerIterations: 100000", "ownerIterations: 5");
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> Config.parse(lowIterations, Map.of()));
    assertTrue(e.getMessage().contains("core.crypto.ownerIterations"));

    String oneSalt = Config.TEMPLATE.replace("systemSalt: \"\"", "systemSalt: \"YWJj\"");
    e = assertThrows(IllegalStateException.class, () -> Config.parse(oneSalt, Map.of()));
    assertTrue(e.getMessage().contains("must be set together"));

    String badLevel = Config.TEMPLATE.replace("level: \"INFO\"", "level: \"LOUD\"");
    e = assertThrows(IllegalStateException.class, () -> Config.parse(badLevel, Map.of()));
    assertTrue(e.getMessage().contains("core.log.level"));

    String badSweep = Config.TEMPLATE.replace("sweepEverySeconds: 60", "sweepEverySeconds: 0");
    e = assertThrows(IllegalStateException.class, () -> Config.parse(badSweep, Map.of()));
    assertTrue(e.getMessage().contains("core.cache.sweepEverySeconds"));
  }

  @Test
  void missingCoreBlockIsRejected() {
    assertThrows(IllegalStateException.class, () -> Config.parse("{ backup: {} }", Map.of()));
    assertThrows(IllegalStateException.class, () -> Config.parse("[1, 2]", Map.of()));
  }

  @Test
  void firstBootWritesTemplateAndExample() throws Exception {
    Path configFile = tempDir.resolve("config").resolve("moodvault.json5");

    Config cfg = Config.loadOrWriteDefault(configFile, Map.of());

    assertTrue(Files.exists(configFile));
    assertTrue(Files.exists(tempDir.resolve("config").resolve("moodvault.json5.example")));
    assertEquals(Config.TEMPLATE, Files.readString(configFile));
    assertEquals(1000, cfg.cache().maxOwners());
  }

  @Test
  void existingFileIsNotOverwritten() throws Exception {
    Path configFile = tempDir.resolve("moodvault.json5");
    Files.writeString(
        configFile, Config.TEMPLATE.replace("maxOwners: 1000", "maxOwners: 5"));

    Config cfg = Config.loadOrWriteDefault(configFile, Map.of());

    assertEquals(5, cfg.cache().maxOwners());
    assertTrue(Files.readString(configFile).contains("maxOwners: 5"));
  }
}
