package relay.insights;

import relay.audit.AuditEvent;
import relay.audit.AuditPayload;
import relay.model.ConnectorDelivery;
import relay.model.DeliveryStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Compares a connector's outcomes in the current lookback window against the window immediately
 * before it.
 *
 * <p>Deliveries are bucketed by creation time. Dead-lettered deliveries never get a completion
 * timestamp, so creation time is the only field every delivery carries.
 */
public final class OutcomeSummarizer {

  private OutcomeSummarizer() {}

  /**
   * Splits deliveries into {@code [now - L, now)} (current) and {@code [now - 2L, now - L)}
   * (baseline), where {@code L = lookbackHours}.
   */
  public static OutcomeTrend summarizeOutcomes(Collection<ConnectorDelivery> deliveries, int lookbackHours, Instant now) {
    Objects.requireNonNull(deliveries, "deliveries");
    Objects.requireNonNull(now, "now");
    if (lookbackHours < 1) {
      throw new IllegalArgumentException("lookbackHours must be >= 1");
    }
    Duration window = Duration.ofHours(lookbackHours);
    Instant currentStart = now.minus(window);
    Instant baselineStart = currentStart.minus(window);
    OutcomeWindow current = summarize(deliveries, currentStart, now);
    OutcomeWindow baseline = summarize(deliveries, baselineStart, currentStart);
    return new OutcomeTrend(current, baseline, OutcomeDelta.between(current, baseline));
  }

  /**
   * Reconstructs the backpressure policy-update feed from audit events, newest first.
   */
  public static List<PolicyUpdate> policyUpdates(Collection<AuditEvent> events) {
    List<PolicyUpdate> updates = new ArrayList<>();
    for (AuditEvent event : events) {
      if (event.payload() instanceof AuditPayload.PolicyUpdated updated) {
        updates.add(new PolicyUpdate(event.createdAt(), event.actor(), updated.policyVersion(), updated.applied()));
      }
    }
    updates.sort(Comparator.comparing(PolicyUpdate::appliedAt).reversed());
    return updates;
  }

  private static OutcomeWindow summarize(Collection<ConnectorDelivery> deliveries, Instant start, Instant end) {
    int total = 0;
    int delivered = 0;
    int dead = 0;
    for (ConnectorDelivery d : deliveries) {
      if (d.createdAt().isBefore(start) || !d.createdAt().isBefore(end)) {
        continue;
      }
      total++;
      if (d.status() == DeliveryStatus.DELIVERED) {
        delivered++;
      } else if (d.status() == DeliveryStatus.DEAD_LETTERED) {
        dead++;
      }
    }
    return new OutcomeWindow(start, end, total, delivered, dead,
        InsightsEngine.rate(delivered, total), InsightsEngine.rate(dead, total));
  }
}
