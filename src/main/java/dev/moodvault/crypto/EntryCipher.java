/* Moodvault © 2025 — MIT */
package dev.moodvault.crypto;

import dev.moodvault.api.DecryptException;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;

/**
 * Authenticated encryption of entry payloads.
 *
 * <p>Blob layout: one format byte ({@value #FORMAT_V1}), a 12-byte random IV, then the AES-GCM
 * ciphertext with its 128-bit tag appended. The format byte is bound as associated data. Passphrase
 * sealed blobs are prefixed with the 32-byte derivation salt.
 */
public final class EntryCipher {
  /** Current blob format marker. */
  public static final byte FORMAT_V1 = 0x01;

  static final int IV_BYTES = 12;
  static final int TAG_BITS = 128;
  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int MIN_BLOB = 1 + IV_BYTES + TAG_BITS / 8;

  private final KeyDeriver keys;
  private final SecureRandom random;

  public EntryCipher(KeyDeriver keys) {
    this(keys, new SecureRandom());
  }

  EntryCipher(KeyDeriver keys, SecureRandom random) {
    this.keys = Objects.requireNonNull(keys, "keys");
    this.random = Objects.requireNonNull(random, "random");
  }

  /** Key deriver backing this cipher. */
  public KeyDeriver keys() {
    return keys;
  }

  /**
   * Encrypts {@code plaintext} under {@code key}.
   *
   * @param plaintext bytes to protect
   * @param key AES key
   * @return format byte, IV and ciphertext with tag
   * @throws IllegalStateException if the runtime rejects the key or cipher
   */
  public byte[] encrypt(byte[] plaintext, SecretKey key) {
    byte[] iv = new byte[IV_BYTES];
    random.nextBytes(iv);
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
      cipher.updateAAD(new byte[] {FORMAT_V1});
      byte[] sealed = cipher.doFinal(plaintext);
      return ByteBuffer.allocate(1 + IV_BYTES + sealed.length)
          .put(FORMAT_V1)
          .put(iv)
          .put(sealed)
          .array();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("encryption failed: " + e.getClass().getSimpleName(), e);
    }
  }

  /**
   * Decrypts a blob produced by {@link #encrypt(byte[], SecretKey)}.
   *
   * @param blob stored blob
   * @param key AES key
   * @return plaintext
   * @throws DecryptException if the blob is truncated, has an unknown format, or fails
   *     authentication
   */
  public byte[] decrypt(byte[] blob, SecretKey key) {
    if (blob == null || blob.length < MIN_BLOB) {
      throw new DecryptException("blob too short");
    }
    if (blob[0] != FORMAT_V1) {
      throw new DecryptException("unknown blob format " + (blob[0] & 0xff));
    }
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(
          Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, blob, 1, IV_BYTES));
      cipher.updateAAD(blob, 0, 1);
      return cipher.doFinal(blob, 1 + IV_BYTES, blob.length - 1 - IV_BYTES);
    } catch (AEADBadTagException e) {
      throw new DecryptException("authentication failed", e);
    } catch (GeneralSecurityException e) {
      throw new DecryptException("decryption failed: " + e.getClass().getSimpleName(), e);
    }
  }

  /**
   * Encrypts {@code plaintext} under a key stretched from {@code passphrase}.
   *
   * @param plaintext bytes to protect
   * @param passphrase non-blank passphrase
   * @return salt followed by the blob
   * @throws IllegalArgumentException if the passphrase is blank
   */
  public byte[] sealWithPassphrase(byte[] plaintext, String passphrase) {
    PassphraseKey pk = keys.derivePassphraseKey(passphrase);
    byte[] blob = encrypt(plaintext, pk.key());
    byte[] salt = pk.salt();
    return ByteBuffer.allocate(salt.length + blob.length).put(salt).put(blob).array();
  }

  /**
   * Opens a blob produced by {@link #sealWithPassphrase(byte[], String)}.
   *
   * @param sealed salt followed by the blob
   * @param passphrase passphrase supplied by the reader
   * @return plaintext
   * @throws DecryptException on a wrong passphrase, blank passphrase or damaged input
   */
  public byte[] openWithPassphrase(byte[] sealed, String passphrase) {
    if (passphrase == null || passphrase.isBlank()) {
      throw new DecryptException("passphrase is blank");
    }
    if (sealed == null || sealed.length < KeyDeriver.PASSPHRASE_SALT_BYTES + MIN_BLOB) {
      throw new DecryptException("sealed payload too short");
    }
    byte[] salt = Arrays.copyOfRange(sealed, 0, KeyDeriver.PASSPHRASE_SALT_BYTES);
    byte[] blob = Arrays.copyOfRange(sealed, KeyDeriver.PASSPHRASE_SALT_BYTES, sealed.length);
    PassphraseKey pk = keys.derivePassphraseKey(passphrase, salt);
    return decrypt(blob, pk.key());
  }
}
