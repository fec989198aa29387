package relay.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One payload queued for delivery to a project's connector, together with its retry state.
 *
 * <p>The canonical constructor enforces the status invariants: {@code deliveredAt} is set only
 * when delivered, {@code deadLetterReason} only when dead-lettered, {@code nextAttemptAt} only
 * while pending, and {@code attemptCount} never exceeds {@code maxAttempts}.
 *
 * @param id               unique delivery id (ULID)
 * @param projectId        owning project
 * @param connectorType    canonical connector type (see {@link ConnectorKind#normalize})
 * @param idempotencyKey   optional client-supplied deduplication key
 * @param payloadHash      SHA-256 hex digest of {@code payloadJson}
 * @param payloadJson      payload body re-sent on every attempt
 * @param status           current lifecycle state
 * @param attemptCount     attempts made since the last (re)queue
 * @param maxAttempts      attempt budget before dead-lettering
 * @param lastStatusCode   status code of the most recent attempt, if any
 * @param lastError        error of the most recent failed attempt, if any
 * @param nextAttemptAt    earliest time the pump may attempt again
 * @param deadLetterReason why the delivery was quarantined
 * @param deliveredAt      time of the successful attempt
 * @param createdAt        enqueue time
 * @param updatedAt        time of the last transition
 */
public record ConnectorDelivery(
    String id,
    String projectId,
    String connectorType,
    String idempotencyKey,
    String payloadHash,
    String payloadJson,
    DeliveryStatus status,
    int attemptCount,
    int maxAttempts,
    Integer lastStatusCode,
    String lastError,
    Instant nextAttemptAt,
    String deadLetterReason,
    Instant deliveredAt,
    Instant createdAt,
    Instant updatedAt) {

  public ConnectorDelivery {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(connectorType, "connectorType");
    Objects.requireNonNull(payloadHash, "payloadHash");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (attemptCount < 0 || attemptCount > maxAttempts) {
      throw new IllegalArgumentException("attemptCount must be in 0.." + maxAttempts + ", got: " + attemptCount);
    }
    if ((deliveredAt != null) != (status == DeliveryStatus.DELIVERED)) {
      throw new IllegalArgumentException("deliveredAt must be set iff status is delivered");
    }
    if ((deadLetterReason != null) != (status == DeliveryStatus.DEAD_LETTERED)) {
      throw new IllegalArgumentException("deadLetterReason must be set iff status is dead_lettered");
    }
    if ((nextAttemptAt != null) != status.isPending()) {
      throw new IllegalArgumentException("nextAttemptAt must be set iff status is queued or retrying");
    }
  }

  /**
   * Creates a freshly queued delivery that is immediately due.
   */
  public static ConnectorDelivery queued(String id, String projectId, String connectorType,
      String idempotencyKey, String payloadHash, String payloadJson, int maxAttempts, Instant now) {
    return new ConnectorDelivery(id, projectId, connectorType, idempotencyKey, payloadHash,
        payloadJson, DeliveryStatus.QUEUED, 0, maxAttempts, null, null, now, null, null, now, now);
  }

  /**
   * Queued deliveries are always due; retrying ones once their backoff has elapsed.
   */
  public boolean isDue(Instant now) {
    return switch (status) {
      case QUEUED -> true;
      case RETRYING -> nextAttemptAt != null && !nextAttemptAt.isAfter(now);
      case DELIVERED, DEAD_LETTERED -> false;
    };
  }

  /**
   * Returns the state after {@code transition}, as the store persists it.
   */
  public ConnectorDelivery apply(DeliveryTransition transition, Instant now) {
    return new ConnectorDelivery(id, projectId, connectorType, idempotencyKey, payloadHash,
        payloadJson, transition.status(), transition.attemptCount(), maxAttempts,
        transition.lastStatusCode(), transition.lastError(), transition.nextAttemptAt(),
        transition.deadLetterReason(), transition.deliveredAt(), createdAt, now);
  }
}
