/* Moodvault © 2025 — MIT */
package dev.moodvault.api;

/**
 * Canonical error/result codes produced by Moodvault subsystems.
 *
 * <p>Codes travel inside {@link VaultException} subclasses and appear in the structured {@code
 * code=} field of every warning the engine logs.
 */
public enum ErrorCode {
  /** Secret material is missing or the key-stretching algorithm is unavailable. */
  KEY_DERIVATION_FAILED,

  /** Blob could not be authenticated with the supplied key or passphrase. */
  DECRYPT_FAILED,

  /** Plaintext could not be sealed; the write was not persisted. */
  ENCRYPT_FAILED,

  /** Database file could not be opened or the connection was lost. */
  CONNECTION_LOST,

  /** Database was busy or locked beyond the configured busy timeout. */
  DATABASE_BUSY,

  /** A uniqueness, foreign-key or check constraint rejected the statement. */
  CONSTRAINT_VIOLATION,

  /** Disk I/O failed or the disk is full. */
  IO_FAILURE,

  /** The database file is malformed. */
  DATABASE_CORRUPT,

  /** Referenced owner does not exist. */
  UNKNOWN_OWNER,

  /** Legacy or shared record could not be parsed. */
  INVALID_RECORD,

  /** Invalid clock time supplied (expected {@code HH:MM}). */
  INVALID_CLOCK,

  /** Field name outside the entry schema. */
  UNKNOWN_FIELD,

  /** Missing or blank passphrase for a shared export. */
  INVALID_PASSPHRASE;
}
