/* Moodvault © 2025 — MIT */
package dev.moodvault.crypto;

import dev.moodvault.api.KeyDerivationException;
import java.security.NoSuchAlgorithmException;
import java.security.spec.InvalidKeySpecException;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

/** PBKDF2-HMAC-SHA256 key stretching. */
public final class Pbkdf2 {
  private static final String ALGORITHM = "PBKDF2WithHmacSHA256";

  private Pbkdf2() {}

  /**
   * Stretches {@code password} into {@code keyBytes} bytes of key material.
   *
   * @param password secret input; cleared from the key spec before returning
   * @param salt salt bytes
   * @param iterations iteration count
   * @param keyBytes output length in bytes
   * @return derived bytes
   * @throws KeyDerivationException if the algorithm is unavailable or the parameters are rejected
   */
  public static byte[] derive(char[] password, byte[] salt, int iterations, int keyBytes) {
    PBEKeySpec spec = new PBEKeySpec(password, salt, iterations, keyBytes * 8);
    try {
      return SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
    } catch (NoSuchAlgorithmException e) {
      throw new KeyDerivationException(ALGORITHM + " is not available in this runtime", e);
    } catch (InvalidKeySpecException e) {
      throw new KeyDerivationException("key stretching parameters rejected", e);
    } finally {
      spec.clearPassword();
    }
  }
}
