package relay.insights;

import java.time.Instant;
import java.util.List;

/**
 * Health metrics for one connector's deliveries created within {@code [windowStart, windowEnd)}.
 * Derived on demand, never persisted.
 *
 * @param windowStart            inclusive window start
 * @param windowEnd              exclusive window end
 * @param deliveryCount          deliveries created in the window
 * @param statusCounts           those deliveries by status
 * @param deliverySuccessRate    delivered / deliveryCount, 0 for an empty window
 * @param attemptCount           attempts recorded against those deliveries
 * @param attemptSuccessRate     2xx attempts / attemptCount, 0 when there are no attempts
 * @param avgAttemptsPerDelivery mean attempt count per delivery
 * @param maxAttemptsObserved    highest attempt count of any delivery
 * @param topErrors              up to five most frequent error messages
 */
public record ConnectorInsights(
    Instant windowStart,
    Instant windowEnd,
    int deliveryCount,
    StatusCounts statusCounts,
    double deliverySuccessRate,
    int attemptCount,
    double attemptSuccessRate,
    double avgAttemptsPerDelivery,
    int maxAttemptsObserved,
    List<ErrorFrequency> topErrors) {

  public ConnectorInsights {
    topErrors = List.copyOf(topErrors);
  }

  /** Total occurrences across the reported error messages. */
  public int errorOccurrences() {
    return topErrors.stream().mapToInt(ErrorFrequency::count).sum();
  }
}
