/* Moodvault © 2025 — MIT */
package dev.moodvault.crypto;

import dev.moodvault.api.KeyDerivationException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * System-wide salts that, together with an owner identifier, determine every per-owner key.
 *
 * <p>Losing either salt makes all stored entries unreadable. Instances never print their bytes.
 *
 * @param systemSalt salt mixed verbatim into every owner salt
 * @param secretSalt salt mixed in through its SHA-256 digest
 */
public record SecretMaterial(byte[] systemSalt, byte[] secretSalt) {
  /** Length of generated salts in bytes. */
  public static final int GENERATED_SALT_BYTES = 16;

  public SecretMaterial {
    if (systemSalt == null || systemSalt.length == 0) {
      throw new KeyDerivationException("system salt is not configured");
    }
    if (secretSalt == null || secretSalt.length == 0) {
      throw new KeyDerivationException("secret salt is not configured");
    }
    systemSalt = systemSalt.clone();
    secretSalt = secretSalt.clone();
  }

  /**
   * Decodes base64 salts as stored in configuration or the secrets file.
   *
   * @param systemSaltB64 base64 system salt
   * @param secretSaltB64 base64 secret salt
   * @return decoded material
   * @throws KeyDerivationException if either value is missing or not valid base64
   */
  public static SecretMaterial fromBase64(String systemSaltB64, String secretSaltB64) {
    return new SecretMaterial(decode("system", systemSaltB64), decode("secret", secretSaltB64));
  }

  /**
   * Generates fresh random salts.
   *
   * @param random randomness source
   * @return new material
   */
  public static SecretMaterial generate(SecureRandom random) {
    byte[] system = new byte[GENERATED_SALT_BYTES];
    byte[] secret = new byte[GENERATED_SALT_BYTES];
    random.nextBytes(system);
    random.nextBytes(secret);
    return new SecretMaterial(system, secret);
  }

  @Override
  public byte[] systemSalt() {
    return systemSalt.clone();
  }

  @Override
  public byte[] secretSalt() {
    return secretSalt.clone();
  }

  public String systemSaltBase64() {
    return Base64.getEncoder().encodeToString(systemSalt);
  }

  public String secretSaltBase64() {
    return Base64.getEncoder().encodeToString(secretSalt);
  }

  /** SHA-256 of the secret salt. */
  public byte[] secretDigest() {
    try {
      return MessageDigest.getInstance("SHA-256").digest(secretSalt);
    } catch (NoSuchAlgorithmException e) {
      throw new KeyDerivationException("SHA-256 missing", e);
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SecretMaterial other
        && Arrays.equals(systemSalt, other.systemSalt)
        && Arrays.equals(secretSalt, other.secretSalt);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(systemSalt) + Arrays.hashCode(secretSalt);
  }

  @Override
  public String toString() {
    return "SecretMaterial[redacted]";
  }

  private static byte[] decode(String label, String b64) {
    if (b64 == null || b64.isBlank()) {
      throw new KeyDerivationException(label + " salt is not configured");
    }
    try {
      return Base64.getDecoder().decode(b64.trim());
    } catch (IllegalArgumentException e) {
      throw new KeyDerivationException(label + " salt is not valid base64", e);
    }
  }
}
