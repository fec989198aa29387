package relay;

import java.util.Objects;

/**
 * Raised when a request carries a malformed or out-of-range field.
 *
 * <p>Always thrown before any state is mutated, so the caller may correct the input and resubmit.
 */
public final class ValidationException extends RuntimeException {
  private final String field;

  public ValidationException(String field, String message) {
    super(field + ": " + message);
    this.field = Objects.requireNonNull(field, "field");
  }

  /**
   * Name of the offending field, in wire form (e.g. {@code max_retrying}).
   */
  public String field() {
    return field;
  }
}
