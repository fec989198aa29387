package relay.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A status change for one delivery, applied by the store as a compare-and-set on
 * {@code expectedAttemptCount} and the target status' legal sources.
 *
 * <p>Instances are built by {@link relay.delivery.DeliveryStateMachine}; every field of the
 * delivery's retry state is spelled out so the store never merges partial updates.
 */
public record DeliveryTransition(
    DeliveryStatus status,
    int expectedAttemptCount,
    int attemptCount,
    Integer lastStatusCode,
    String lastError,
    Instant nextAttemptAt,
    String deadLetterReason,
    Instant deliveredAt) {

  public DeliveryTransition {
    Objects.requireNonNull(status, "status");
    if (attemptCount < 0 || expectedAttemptCount < 0) {
      throw new IllegalArgumentException("attempt counts must be >= 0");
    }
  }
}
