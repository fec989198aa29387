package relay.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Objects;

/**
 * Point-in-time queue counts for one connector of one project.
 *
 * @param connectorType         canonical connector type
 * @param total                 all deliveries ever enqueued
 * @param queued                deliveries waiting for their first attempt
 * @param retrying              deliveries waiting for a retry
 * @param delivered             deliveries that succeeded
 * @param deadLettered          deliveries quarantined after exhausting attempts
 * @param dueNow                pending deliveries the pump may attempt right now
 * @param earliestNextAttemptAt earliest scheduled attempt among pending deliveries
 */
public record DeliverySummary(
    String connectorType,
    int total,
    int queued,
    int retrying,
    int delivered,
    int deadLettered,
    int dueNow,
    Instant earliestNextAttemptAt) {

  public DeliverySummary {
    Objects.requireNonNull(connectorType, "connectorType");
  }

  public static DeliverySummary empty(String connectorType) {
    return new DeliverySummary(connectorType, 0, 0, 0, 0, 0, 0, null);
  }

  /**
   * Computes a summary from a delivery population, evaluating {@code dueNow} at {@code now}.
   */
  public static DeliverySummary of(String connectorType, Collection<ConnectorDelivery> deliveries, Instant now) {
    int queued = 0;
    int retrying = 0;
    int delivered = 0;
    int dead = 0;
    int due = 0;
    Instant earliest = null;
    for (ConnectorDelivery d : deliveries) {
      switch (d.status()) {
        case QUEUED -> queued++;
        case RETRYING -> retrying++;
        case DELIVERED -> delivered++;
        case DEAD_LETTERED -> dead++;
      }
      if (d.isDue(now)) {
        due++;
      }
      if (d.nextAttemptAt() != null && (earliest == null || d.nextAttemptAt().isBefore(earliest))) {
        earliest = d.nextAttemptAt();
      }
    }
    return new DeliverySummary(connectorType, deliveries.size(), queued, retrying, delivered, dead, due, earliest);
  }

  /**
   * Deliveries still owed an attempt.
   */
  public int outstanding() {
    return queued + retrying;
  }
}
