package relay.model;

import java.util.Objects;

/**
 * Enqueue request for a connector delivery.
 *
 * @param projectId      owning project
 * @param connectorType  connector type or one of its aliases
 * @param idempotencyKey optional deduplication key; blank keys are treated as absent
 * @param payloadJson    payload body
 * @param maxAttempts    attempt budget, or {@code null} for the configured default
 */
public record NewDelivery(
    String projectId,
    String connectorType,
    String idempotencyKey,
    String payloadJson,
    Integer maxAttempts) {

  public NewDelivery {
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(connectorType, "connectorType");
    Objects.requireNonNull(payloadJson, "payloadJson");
  }

  public static NewDelivery of(String projectId, String connectorType, String payloadJson) {
    return new NewDelivery(projectId, connectorType, null, payloadJson, null);
  }

  public NewDelivery withIdempotencyKey(String key) {
    return new NewDelivery(projectId, connectorType, key, payloadJson, maxAttempts);
  }

  public NewDelivery withMaxAttempts(Integer attempts) {
    return new NewDelivery(projectId, connectorType, idempotencyKey, payloadJson, attempts);
  }
}
