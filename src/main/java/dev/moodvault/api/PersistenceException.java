/* Moodvault © 2025 — MIT */
package dev.moodvault.api;

/** Indicates a write or read could not reach durable storage. */
public final class PersistenceException extends VaultException {

  public PersistenceException(ErrorCode errorCode, String message) {
    super(errorCode, message);
  }

  public PersistenceException(ErrorCode errorCode, String message, Throwable cause) {
    super(errorCode, message, cause);
  }
}
