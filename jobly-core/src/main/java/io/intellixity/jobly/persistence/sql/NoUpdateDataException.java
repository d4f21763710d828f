package io.intellixity.jobly.persistence.sql;

/**
 * Raised when a partial update carries no fields.
 * <p>
 * This is a client-input error: no SQL is produced and retrying with the same input cannot succeed.
 */
public final class NoUpdateDataException extends RuntimeException {
  public NoUpdateDataException() {
    super("No data");
  }
}
