package relay;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import relay.audit.AuditEvent;
import relay.audit.AuditPayload;
import relay.audit.InMemoryAuditLog;
import relay.backpressure.DraftAmendment;
import relay.backpressure.InMemoryPolicyStore;
import relay.backpressure.PolicyPatch;
import relay.backpressure.Simulation;
import relay.backpressure.ThrottleReason;
import relay.guardian.GuardianPolicyPatch;
import relay.insights.ConnectorInsights;
import relay.model.DeliveryStatus;
import relay.model.NewDelivery;
import relay.pump.ConnectorDrain;
import relay.reliability.RankedConnector;
import relay.reliability.Recommendation;
import relay.spi.ConnectorTransport;
import relay.spi.ConnectorTransport.TransportResponse;
import relay.support.InMemoryDeliveryStore;
import relay.support.MutableClock;
import relay.transport.ConnectorConfigs;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class ConnectorControlPlaneTest {
  private static final Instant NOW = Instant.parse("2026-02-21T12:00:00Z");

  private final MutableClock clock = new MutableClock(NOW);
  private final InMemoryDeliveryStore store = new InMemoryDeliveryStore();
  private final InMemoryAuditLog auditLog = new InMemoryAuditLog(clock);
  private final Map<String, ConnectorTransport> transports = new ConcurrentHashMap<>();
  private final ConnectorControlPlane plane = ConnectorControlPlane.builder()
      .connectionProvider(InMemoryDeliveryStore.connections())
      .deliveryStore(store)
      .policyStore(new InMemoryPolicyStore())
      .auditLog(auditLog)
      .transports(type -> Optional.ofNullable(transports.get(type)))
      .clock(clock)
      .pumpEnabled(false)
      .guardianEnabled(false)
      .build();

  @AfterEach
  void tearDown() {
    plane.close();
  }

  // ── Builder validation ───────────────────────────────────────────

  @Test
  void builderRequiresStores() {
    assertThrows(NullPointerException.class, () -> ConnectorControlPlane.builder()
        .connectionProvider(InMemoryDeliveryStore.connections())
        .policyStore(new InMemoryPolicyStore())
        .auditLog(auditLog)
        .transports(type -> Optional.empty())
        .build());
  }

  // ── Deliveries ───────────────────────────────────────────────────

  @Test
  void enqueueThenDrainDeliversAndFeedsInsights() {
    transports.put("webhook", d -> TransportResponse.of(200));
    for (int i = 0; i < 3; i++) {
      plane.enqueue(NewDelivery.of("p", "webhook", "{\"n\":\"" + i + "\"}"));
    }

    ConnectorDrain drain = plane.processQueue("p", "webhook", 10);

    assertEquals(3, drain.delivered());
    assertEquals(3, store.count(DeliveryStatus.DELIVERED));
    ConnectorInsights insights = plane.insights("p", "webhook", 24);
    assertEquals(1.0, insights.deliverySuccessRate());
    assertEquals(3, insights.attemptCount());
    RankedConnector ranked = plane.rankReliability("p", 24).get(0);
    assertEquals(Recommendation.HEALTHY, ranked.recommendation());
  }

  @Test
  void processProjectCoversEveryConnector() {
    transports.put("webhook", d -> TransportResponse.of(200));
    transports.put("slack", d -> new TransportResponse(500, "boom"));
    plane.enqueue(NewDelivery.of("p", "webhook", "{}"));
    plane.enqueue(NewDelivery.of("p", "Slack_Webhook", "{}"));

    var report = plane.processProject("p", 10);

    assertEquals(1, report.delivered());
    assertEquals(1, report.retried());
  }

  @Test
  void validateConnectorConfigDelegates() {
    ConnectorConfigs.ConfigValidation v = plane.validateConnectorConfig("webhook", Map.of("targetUrl", "nope"));

    assertFalse(v.ok());
  }

  // ── Backpressure ─────────────────────────────────────────────────

  @Test
  void missingDraftIsNotFound() {
    NotFoundException e = assertThrows(NotFoundException.class, () -> plane.getDraft("p"));
    assertTrue(e.getMessage().contains("draft not found"));
    assertThrows(NotFoundException.class, () -> plane.simulateDraft("p", List.of(), 25));
  }

  @Test
  void simulateDraftComparesAgainstLivePolicy() {
    for (int i = 0; i < 5; i++) {
      plane.enqueue(NewDelivery.of("p", "webhook", "{\"n\":\"" + i + "\"}"));
    }
    plane.upsertDraft("p", "alice", DraftAmendment.of(PolicyPatch.builder().maxDueNow(2).build()));

    Simulation simulation = plane.simulateDraft("p", List.of(), 25);

    assertEquals(5, simulation.currentTotal());
    assertEquals(2, simulation.candidateTotal());
    assertEquals(-3, simulation.delta());
    assertEquals(0, simulation.throttledBefore());
    assertEquals(1, simulation.throttledAfter());
    assertEquals(ThrottleReason.DUE_NOW_LIMIT, simulation.connectors().get(0).candidate().reason());
    assertEquals(0L, plane.livePolicy("p").version());
  }

  @Test
  void approvedDraftFlowsThroughToPump() {
    transports.put("webhook", d -> TransportResponse.of(200));
    for (int i = 0; i < 5; i++) {
      plane.enqueue(NewDelivery.of("p", "webhook", "{\"n\":\"" + i + "\"}"));
    }
    plane.upsertDraft("p", "alice", DraftAmendment.of(PolicyPatch.builder().maxDueNow(2).build()));
    plane.approveDraft("p", "bob");
    assertTrue(plane.evaluateActivation("p").ready());
    plane.applyDraft("p", "alice");

    ConnectorDrain drain = plane.processQueue("p", "webhook", 25);

    assertEquals(2, drain.delivered());
    assertTrue(drain.decision().throttled());
    assertEquals(1, plane.policyUpdates("p", 10).size());
  }

  // ── Timeline ─────────────────────────────────────────────────────

  @Test
  void actionTimelineShowsOnlyPolicyAndGuardianEvents() {
    transports.put("webhook", d -> TransportResponse.of(200));
    plane.enqueue(NewDelivery.of("p", "webhook", "{}"));
    plane.upsertDraft("p", "alice", DraftAmendment.of(PolicyPatch.builder().maxRetrying(10).build()));
    plane.approveDraft("p", "bob");
    plane.applyDraft("p", "alice");
    plane.processQueue("p", "webhook", 10);
    plane.upsertGuardianPolicy("p", "ops", GuardianPolicyPatch.builder().enabled(true).build());

    List<AuditEvent> timeline = plane.actionTimeline("p", 10);

    assertEquals(List.of(
        AuditPayload.GUARDIAN_POLICY_UPDATED,
        AuditPayload.POLICY_UPDATED,
        AuditPayload.DRAFT_APPROVED,
        AuditPayload.DRAFT_UPDATED), timeline.stream().map(AuditEvent::eventType).toList());
    assertEquals(2, plane.actionTimeline("p", 2).size());
  }

  @Test
  void policyEventsStayVisibleBehindDeliveryTraffic() {
    plane.upsertDraft("p", "alice", DraftAmendment.of(PolicyPatch.builder().maxRetrying(10).build()));
    plane.approveDraft("p", "bob");
    plane.applyDraft("p", "alice");
    for (int i = 0; i < 1200; i++) {
      plane.enqueue(NewDelivery.of("p", "slack", "{\"n\":\"" + i + "\"}"));
    }

    assertEquals(1, plane.policyUpdates("p", 10).size());
    assertEquals(AuditPayload.POLICY_UPDATED, plane.actionTimeline("p", 1).get(0).eventType());
  }

  @Test
  void actionTimelineLimitIsBounded() {
    assertThrows(ValidationException.class, () -> plane.actionTimeline("p", 0));
    assertThrows(ValidationException.class, () -> plane.actionTimeline("p", 1001));
  }

  // ── Lifecycle ────────────────────────────────────────────────────

  @Test
  void startIsIdempotentAndCloseStopsLoops() {
    ConnectorControlPlane running = ConnectorControlPlane.builder()
        .connectionProvider(InMemoryDeliveryStore.connections())
        .deliveryStore(store)
        .policyStore(new InMemoryPolicyStore())
        .auditLog(auditLog)
        .transports(type -> Optional.empty())
        .build();

    running.start();
    running.start();
    running.close();

    assertThrows(IllegalStateException.class, () -> running.pump().start());
    assertThrows(IllegalStateException.class, () -> running.guardian().start());
  }
}
