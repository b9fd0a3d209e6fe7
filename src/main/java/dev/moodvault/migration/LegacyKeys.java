/* Moodvault © 2025 — MIT */
package dev.moodvault.migration;

import dev.moodvault.crypto.Pbkdf2;
import dev.moodvault.crypto.SecretMaterial;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Per-owner key of the legacy CSV format. */
final class LegacyKeys {
  static final int DEFAULT_ITERATIONS = 100_000;

  private LegacyKeys() {}

  /**
   * Derives the 32 byte Fernet key the legacy bot used for {@code owner}.
   *
   * <p>Password {@code "telegram-mood-tracker-<owner>-<sha256hex(secret salt)>"}, salted with the
   * raw system salt.
   */
  static byte[] derive(SecretMaterial secrets, long owner, int iterations) {
    String password =
        "telegram-mood-tracker-" + owner + "-" + sha256Hex(secrets.secretSalt());
    return Pbkdf2.derive(password.toCharArray(), secrets.systemSalt(), iterations, 32);
  }

  static String sha256Hex(byte[] data) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 missing", e);
    }
  }
}
