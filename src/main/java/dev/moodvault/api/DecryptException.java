/* Moodvault © 2025 — MIT */
package dev.moodvault.api;

/**
 * Indicates a blob could not be opened: wrong key or passphrase, truncation, corruption or
 * tampering all map here. Callers treat it as "no data available".
 */
public final class DecryptException extends VaultException {

  public DecryptException(String message) {
    super(ErrorCode.DECRYPT_FAILED, message);
  }

  public DecryptException(String message, Throwable cause) {
    super(ErrorCode.DECRYPT_FAILED, message, cause);
  }
}
