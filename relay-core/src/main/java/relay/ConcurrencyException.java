package relay;

/**
 * Raised when an optimistic-concurrency update kept losing against other writers and the
 * internal retry budget ({@link ControlPlaneConfig#getConcurrencyRetries()}) ran out.
 */
public final class ConcurrencyException extends RuntimeException {
  public ConcurrencyException(String message) {
    super(message);
  }
}
