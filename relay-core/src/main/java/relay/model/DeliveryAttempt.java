package relay.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one attempt against a delivery.
 */
public record DeliveryAttempt(
    String id,
    String deliveryId,
    Instant attemptedAt,
    Integer statusCode,
    String error,
    long latencyMs) {

  public DeliveryAttempt {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(deliveryId, "deliveryId");
    Objects.requireNonNull(attemptedAt, "attemptedAt");
    if (latencyMs < 0) {
      throw new IllegalArgumentException("latencyMs must be >= 0");
    }
  }

  /**
   * An attempt succeeded when the endpoint answered with a 2xx status.
   */
  public boolean success() {
    return AttemptOutcome.isSuccessStatus(statusCode);
  }
}
