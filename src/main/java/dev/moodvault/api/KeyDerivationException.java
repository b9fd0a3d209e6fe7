/* Moodvault © 2025 — MIT */
package dev.moodvault.api;

/** Indicates the key deriver is misconfigured. Fatal at startup, never per request. */
public final class KeyDerivationException extends VaultException {

  public KeyDerivationException(String message) {
    super(ErrorCode.KEY_DERIVATION_FAILED, message);
  }

  public KeyDerivationException(String message, Throwable cause) {
    super(ErrorCode.KEY_DERIVATION_FAILED, message, cause);
  }
}
