/* Moodvault © 2025 — MIT */
package dev.moodvault.migration;

import dev.moodvault.api.ErrorCode;
import dev.moodvault.api.ValidationException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * Read-only decoder for Fernet tokens, the record format of the legacy CSV files.
 *
 * <p>Layout: {@code 0x80 ‖ timestamp(8) ‖ iv(16) ‖ AES-128-CBC ciphertext ‖ HMAC-SHA256(32)},
 * with the HMAC computed over everything before it. The 32 byte key splits into a signing half and an
 * encryption half.
 */
final class FernetToken {
  static final byte VERSION = (byte) 0x80;
  private static final int TS_BYTES = 8;
  private static final int IV_BYTES = 16;
  private static final int MAC_BYTES = 32;
  private static final int BLOCK = 16;

  private FernetToken() {}

  /**
   * Verified plaintext of a token.
   *
   * @param plaintext decrypted bytes
   * @param issuedAt timestamp carried by the token
   */
  record Opened(byte[] plaintext, Instant issuedAt) {}

  /**
   * Verifies and decrypts {@code token}.
   *
   * @param token base64url token text
   * @param key 32 raw key bytes
   * @return plaintext and issue time
   * @throws ValidationException if the token is malformed or does not verify under {@code key}
   */
  static Opened open(String token, byte[] key) {
    if (key == null || key.length != 32) {
      throw new IllegalArgumentException("Fernet keys are 32 bytes");
    }
    byte[] raw;
    try {
      raw = Base64.getUrlDecoder().decode(token.trim().getBytes(StandardCharsets.US_ASCII));
    } catch (IllegalArgumentException e) {
      throw invalid("token is not base64url", e);
    }
    int minLength = 1 + TS_BYTES + IV_BYTES + BLOCK + MAC_BYTES;
    if (raw.length < minLength || (raw.length - minLength) % BLOCK != 0) {
      throw invalid("token has an invalid length", null);
    }
    if (raw[0] != VERSION) {
      throw invalid("token version is not supported", null);
    }

    int macAt = raw.length - MAC_BYTES;
    try {
      Mac mac = Mac.getInstance("HmacSHA256");
      mac.init(new SecretKeySpec(key, 0, 16, "HmacSHA256"));
      mac.update(raw, 0, macAt);
      byte[] expected = mac.doFinal();
      if (!MessageDigest.isEqual(expected, Arrays.copyOfRange(raw, macAt, raw.length))) {
        throw invalid("token signature does not verify", null);
      }

      long ts = ByteBuffer.wrap(raw, 1, TS_BYTES).getLong();
      int ivAt = 1 + TS_BYTES;
      int ctAt = ivAt + IV_BYTES;
      Cipher aes = Cipher.getInstance("AES/CBC/PKCS5Padding");
      aes.init(
          Cipher.DECRYPT_MODE,
          new SecretKeySpec(key, 16, 16, "AES"),
          new IvParameterSpec(raw, ivAt, IV_BYTES));
      byte[] plaintext = aes.doFinal(raw, ctAt, macAt - ctAt);
      return new Opened(plaintext, Instant.ofEpochSecond(ts));
    } catch (GeneralSecurityException e) {
      throw invalid("token could not be decrypted", e);
    } catch (DateTimeException e) {
      throw invalid("token timestamp is out of range", e);
    }
  }

  private static ValidationException invalid(String message, Throwable cause) {
    return new ValidationException(ErrorCode.INVALID_RECORD, message, cause);
  }
}
