/* Moodvault © 2025 — MIT */
package dev.moodvault.migration;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/** Writes records the way the legacy bot did, so imports can be tested end to end. */
final class LegacyFixtures {
  private static final SecureRandom RANDOM = new SecureRandom();

  private LegacyFixtures() {}

  static String fernet(byte[] key, Instant issuedAt, String plaintext) throws Exception {
    byte[] iv = new byte[16];
    RANDOM.nextBytes(iv);
    Cipher aes = Cipher.getInstance("AES/CBC/PKCS5Padding");
    aes.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, 16, 16, "AES"), new IvParameterSpec(iv));
    byte[] ct = aes.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

    ByteBuffer signed = ByteBuffer.allocate(1 + 8 + 16 + ct.length);
    signed.put(FernetToken.VERSION).putLong(issuedAt.getEpochSecond()).put(iv).put(ct);
    Mac mac = Mac.getInstance("HmacSHA256");
    mac.init(new SecretKeySpec(key, 0, 16, "HmacSHA256"));
    byte[] tag = mac.doFinal(signed.array());

    ByteBuffer token = ByteBuffer.allocate(signed.capacity() + tag.length);
    token.put(signed.array()).put(tag);
    return Base64.getUrlEncoder().encodeToString(token.array());
  }

  /** Value of the {@code encrypted_data} column: the token text, base64 encoded once more. */
  static String encryptedData(byte[] key, Instant issuedAt, String json) throws Exception {
    String token = fernet(key, issuedAt, json);
    return Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.US_ASCII));
  }
}
