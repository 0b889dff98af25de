package opsaudit;

/**
 * Thrown at start-up when the audit store cannot be reached or lacks the expected schema.
 * The lifecycle controller turns it into a disabled pipeline instead of propagating it.
 */
public class StoreUnavailableException extends RuntimeException {

  public StoreUnavailableException(String message) {
    super(message);
  }

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
