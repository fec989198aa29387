package relay;

/**
 * Raised when a project, draft or delivery the caller referenced does not exist.
 */
public final class NotFoundException extends RuntimeException {
  public NotFoundException(String message) {
    super(message);
  }
}
