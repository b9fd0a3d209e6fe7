/* Moodvault © 2025 — MIT */
package dev.moodvault.core;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import dev.moodvault.api.KeyDerivationException;
import dev.moodvault.crypto.SecretMaterial;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.SecureRandom;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the system-wide salts.
 *
 * <p>Inline salts from the config (or environment) win. Otherwise the salts are read from the
 * secrets file, which is generated with fresh random values on first boot. The file must be backed
 * up together with the database; without it no entry can be decrypted.
 */
final class SecretsFile {
  private static final Logger LOG = LoggerFactory.getLogger("moodvault");
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  private SecretsFile() {}

  static SecretMaterial resolve(Config.Crypto crypto) {
    return resolve(crypto, new SecureRandom());
  }

  static SecretMaterial resolve(Config.Crypto crypto, SecureRandom random) {
    if (crypto.hasInlineSalts()) {
      return SecretMaterial.fromBase64(crypto.systemSalt(), crypto.secretSalt());
    }
    Path path = Path.of(crypto.secretsFile());
    if (Files.exists(path)) {
      return read(path);
    }
    SecretMaterial generated = SecretMaterial.generate(random);
    write(path, generated);
    LOG.warn(
        "(moodvault) code={} op={} message={} path={}",
        "SECRETS_GENERATED",
        "secrets.bootstrap",
        "generated new salts; back this file up together with the database",
        path.toAbsolutePath());
    return generated;
  }

  private static SecretMaterial read(Path path) {
    try {
      Stored stored = GSON.fromJson(Files.readString(path, StandardCharsets.UTF_8), Stored.class);
      if (stored == null) {
        throw new KeyDerivationException("secrets file is empty: " + path);
      }
      return SecretMaterial.fromBase64(stored.systemSalt, stored.secretSalt);
    } catch (IOException | JsonParseException e) {
      throw new KeyDerivationException("failed to read secrets file " + path, e);
    }
  }

  private static void write(Path path, SecretMaterial material) {
    Stored stored = new Stored();
    stored.systemSalt = material.systemSaltBase64();
    stored.secretSalt = material.secretSaltBase64();
    stored.createdAt = Instant.now().toString();
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
      Files.writeString(tmp, GSON.toJson(stored), StandardCharsets.UTF_8);
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new KeyDerivationException("failed to write secrets file " + path, e);
    }
  }

  private static final class Stored {
    @SerializedName("system_salt")
    String systemSalt;

    @SerializedName("secret_salt")
    String secretSalt;

    @SerializedName("created_at")
    String createdAt;
  }
}
