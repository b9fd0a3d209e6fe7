/* Moodvault © 2025 — MIT */
package dev.moodvault.crypto;

import javax.crypto.SecretKey;

/**
 * Key stretched from a user passphrase together with the salt needed to rebuild it.
 *
 * @param key AES key
 * @param salt random salt used for this derivation
 */
public record PassphraseKey(SecretKey key, byte[] salt) {
  public PassphraseKey {
    salt = salt.clone();
  }

  @Override
  public byte[] salt() {
    return salt.clone();
  }

  @Override
  public String toString() {
    return "PassphraseKey[redacted]";
  }
}
