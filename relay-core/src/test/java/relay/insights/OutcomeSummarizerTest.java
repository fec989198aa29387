package relay.insights;

import org.junit.jupiter.api.Test;
import relay.audit.AuditEvent;
import relay.audit.AuditPayload;
import relay.backpressure.PolicyPatch;
import relay.model.ConnectorDelivery;
import relay.support.Deliveries;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeSummarizerTest {
  private static final Instant NOW = Instant.parse("2026-02-21T12:00:00Z");

  @Test
  void splitsCurrentAndBaselineWindowsByCreationTime() {
    List<ConnectorDelivery> rows = List.of(
        Deliveries.delivered("p", "webhook", Instant.parse("2026-02-21T10:59:00Z")),
        Deliveries.deadLettered("p", "webhook", Instant.parse("2026-02-21T09:00:00Z"), 5, "HTTP 500"),
        Deliveries.delivered("p", "webhook", Instant.parse("2026-02-20T22:50:00Z")),
        Deliveries.delivered("p", "webhook", Instant.parse("2026-02-19T22:50:00Z")));

    OutcomeTrend trend = OutcomeSummarizer.summarizeOutcomes(rows, 12, NOW);

    assertEquals(Instant.parse("2026-02-21T00:00:00Z"), trend.current().start());
    assertEquals(Instant.parse("2026-02-20T12:00:00Z"), trend.baseline().start());
    assertEquals(2, trend.current().totalDeliveries());
    assertEquals(0.5, trend.current().deliverySuccessRate());
    assertEquals(0.5, trend.current().deadLetterRate());
    assertEquals(1, trend.baseline().totalDeliveries());
    assertEquals(1.0, trend.baseline().deliverySuccessRate());

    assertEquals(1, trend.delta().totalDeliveries());
    assertEquals(0, trend.delta().delivered());
    assertEquals(1, trend.delta().deadLettered());
    assertEquals(-0.5, trend.delta().deliverySuccessRate(), 1e-9);
    assertEquals(0.5, trend.delta().deadLetterRate(), 1e-9);
  }

  @Test
  void windowBoundaryBelongsToCurrent() {
    List<ConnectorDelivery> rows = List.of(
        Deliveries.queued("p", "slack", Instant.parse("2026-02-21T11:00:00Z")));

    OutcomeTrend trend = OutcomeSummarizer.summarizeOutcomes(rows, 1, NOW);

    assertEquals(1, trend.current().totalDeliveries());
    assertEquals(0, trend.baseline().totalDeliveries());
    assertEquals(0.0, trend.current().deliverySuccessRate());
  }

  @Test
  void policyUpdatesAreNewestFirstAndIgnoreOtherEvents() {
    PolicyPatch first = PolicyPatch.builder().maxDueNow(10).build();
    PolicyPatch second = PolicyPatch.builder().enabled(false).build();
    List<AuditEvent> events = List.of(
        new AuditEvent("e1", "p", "alice", new AuditPayload.PolicyUpdated(1, 1, first), NOW.minusSeconds(60)),
        new AuditEvent("e2", "p", "bob", new AuditPayload.DraftApproved(2, "bob", 1, 1), NOW.minusSeconds(30)),
        new AuditEvent("e3", "p", "carol", new AuditPayload.PolicyUpdated(2, 2, second), NOW));

    List<PolicyUpdate> updates = OutcomeSummarizer.policyUpdates(events);

    assertEquals(2, updates.size());
    assertEquals(new PolicyUpdate(NOW, "carol", 2, second), updates.get(0));
    assertEquals("alice", updates.get(1).actor());
  }
}
