package relay;

/**
 * Unchecked wrapper for failures reaching a backing store (connection errors, failed statements).
 */
public class StoreException extends RuntimeException {
  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
