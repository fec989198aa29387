package relay.delivery;

import relay.model.ConnectorDelivery;
import relay.model.DeliveryAttempt;

import java.util.List;
import java.util.Map;

/**
 * A point-in-time sample of a connector's newest deliveries and their attempts, read on one
 * connection for analytics.
 */
public record DeliverySnapshot(List<ConnectorDelivery> deliveries, Map<String, List<DeliveryAttempt>> attemptsByDelivery) {
  public DeliverySnapshot {
    deliveries = List.copyOf(deliveries);
    attemptsByDelivery = Map.copyOf(attemptsByDelivery);
  }
}
