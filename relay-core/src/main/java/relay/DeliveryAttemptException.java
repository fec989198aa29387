package relay;

/**
 * Thrown by a {@link relay.spi.ConnectorTransport} when a delivery attempt could not complete,
 * e.g. the endpoint was unreachable or rejected the request.
 *
 * <p>The pump records the failure as an attempt; the delivery is never dropped.
 */
public class DeliveryAttemptException extends Exception {
  private final Integer statusCode;

  public DeliveryAttemptException(String message) {
    this(message, null, null);
  }

  public DeliveryAttemptException(String message, Integer statusCode) {
    this(message, statusCode, null);
  }

  public DeliveryAttemptException(String message, Integer statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /**
   * HTTP status code returned by the endpoint, or {@code null} if no response was received.
   */
  public Integer statusCode() {
    return statusCode;
  }
}
