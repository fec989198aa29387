package relay.delivery;

import relay.model.AttemptOutcome;
import relay.model.ConnectorDelivery;
import relay.model.DeliveryStatus;
import relay.model.DeliveryTransition;

import java.time.Instant;
import java.util.Objects;

/**
 * Computes every legal delivery transition. Pure apart from the retry policy's jitter.
 *
 * <ul>
 *   <li>2xx attempt: DELIVERED.
 *   <li>Failed attempt with budget left: RETRYING, next attempt after backoff.
 *   <li>Failed attempt that used the last of the budget: DEAD_LETTERED.
 *   <li>No transport for the connector type: DEAD_LETTERED without an attempt.
 *   <li>Redrive: DEAD_LETTERED back to QUEUED with a fresh budget.
 * </ul>
 */
public final class DeliveryStateMachine {
  public static final String EXHAUSTED_REASON = "connector delivery exhausted retries";

  private final RetryPolicy retryPolicy;

  public DeliveryStateMachine(RetryPolicy retryPolicy) {
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
  }

  public DeliveryTransition onOutcome(ConnectorDelivery delivery, AttemptOutcome outcome, Instant now) {
    requireStatus(delivery, true);
    int attempts = delivery.attemptCount() + 1;
    if (outcome.success()) {
      return new DeliveryTransition(DeliveryStatus.DELIVERED, delivery.attemptCount(), attempts,
          outcome.statusCode(), null, null, null, now);
    }
    String error = describeFailure(outcome);
    if (attempts >= delivery.maxAttempts()) {
      return new DeliveryTransition(DeliveryStatus.DEAD_LETTERED, delivery.attemptCount(), attempts,
          outcome.statusCode(), error, null, error != null ? error : EXHAUSTED_REASON, null);
    }
    Instant next = now.plusMillis(retryPolicy.computeDelayMs(attempts));
    return new DeliveryTransition(DeliveryStatus.RETRYING, delivery.attemptCount(), attempts,
        outcome.statusCode(), error, next, null, null);
  }

  public DeliveryTransition unroutable(ConnectorDelivery delivery, String reason) {
    requireStatus(delivery, true);
    Objects.requireNonNull(reason, "reason");
    return new DeliveryTransition(DeliveryStatus.DEAD_LETTERED, delivery.attemptCount(), delivery.attemptCount(),
        delivery.lastStatusCode(), reason, null, reason, null);
  }

  public DeliveryTransition requeue(ConnectorDelivery delivery, Instant now) {
    requireStatus(delivery, false);
    return new DeliveryTransition(DeliveryStatus.QUEUED, delivery.attemptCount(), 0,
        null, null, now, null, null);
  }

  static String describeFailure(AttemptOutcome outcome) {
    if (outcome.error() != null && !outcome.error().isBlank()) {
      return outcome.error();
    }
    if (outcome.statusCode() != null) {
      return "HTTP " + outcome.statusCode();
    }
    return null;
  }

  private static void requireStatus(ConnectorDelivery delivery, boolean pending) {
    Objects.requireNonNull(delivery, "delivery");
    if (pending && !delivery.status().isPending()) {
      throw new IllegalStateException("delivery " + delivery.id() + " is " + delivery.status().wireName());
    }
    if (!pending && delivery.status() != DeliveryStatus.DEAD_LETTERED) {
      throw new IllegalStateException("delivery " + delivery.id() + " is not dead_lettered");
    }
  }
}
