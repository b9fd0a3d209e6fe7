/* Moodvault © 2025 — MIT */
package dev.moodvault.api;

/** Indicates input (a legacy record, a clock time, a field name) failed validation. */
public final class ValidationException extends VaultException {

  public ValidationException(ErrorCode errorCode, String message) {
    super(errorCode, message);
  }

  public ValidationException(ErrorCode errorCode, String message, Throwable cause) {
    super(errorCode, message, cause);
  }
}
