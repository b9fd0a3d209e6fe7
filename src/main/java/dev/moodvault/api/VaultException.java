/* Moodvault © 2025 — MIT */
package dev.moodvault.api;

/** Base type for every failure the engine surfaces to callers. */
public abstract class VaultException extends RuntimeException {
  private final ErrorCode errorCode;

  protected VaultException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  protected VaultException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public ErrorCode errorCode() {
    return errorCode;
  }
}
