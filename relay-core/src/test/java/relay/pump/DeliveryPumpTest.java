package relay.pump;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import relay.ControlPlaneConfig;
import relay.DeliveryAttemptException;
import relay.audit.AuditEvent;
import relay.audit.AuditPayload;
import relay.audit.InMemoryAuditLog;
import relay.backpressure.BackpressureSettings;
import relay.backpressure.DraftAmendment;
import relay.backpressure.InMemoryPolicyStore;
import relay.backpressure.PolicyLifecycle;
import relay.backpressure.PolicyPatch;
import relay.backpressure.ThrottleReason;
import relay.delivery.DeliveryQueue;
import relay.delivery.DeliveryStateMachine;
import relay.delivery.ExponentialBackoffRetryPolicy;
import relay.model.ConnectorDelivery;
import relay.model.DeliveryAttempt;
import relay.model.DeliveryStatus;
import relay.model.NewDelivery;
import relay.spi.ConnectorTransport;
import relay.spi.ConnectorTransport.TransportResponse;
import relay.spi.TransportRegistry;
import relay.support.CountingMetrics;
import relay.support.InMemoryDeliveryStore;
import relay.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryPumpTest {
    private static final Instant START = Instant.parse("2026-02-21T12:00:00Z");

    private final InMemoryDeliveryStore store = new InMemoryDeliveryStore();
    private final InMemoryAuditLog auditLog = new InMemoryAuditLog();
    private final MutableClock clock = new MutableClock(START);
    private final CountingMetrics metrics = new CountingMetrics();
    private final ControlPlaneConfig config = new ControlPlaneConfig();
    private final DeliveryStateMachine stateMachine =
        new DeliveryStateMachine(new ExponentialBackoffRetryPolicy(1000, 60_000));
    private final DeliveryQueue queue = new DeliveryQueue(InMemoryDeliveryStore.connections(), store, auditLog,
        stateMachine, config, clock, metrics);
    private final PolicyLifecycle lifecycle = new PolicyLifecycle(new InMemoryPolicyStore(), auditLog, config, clock);
    private final Map<String, ConnectorTransport> transports = new ConcurrentHashMap<>();

    private DeliveryPump pump;

    @AfterEach
    void tearDown() {
        if (pump != null) {
            pump.close();
        }
    }

    private DeliveryPump.Builder builder() {
        TransportRegistry registry = type -> Optional.ofNullable(transports.get(type));
        return DeliveryPump.builder()
            .connectionProvider(InMemoryDeliveryStore.connections())
            .deliveryStore(store)
            .deliveryQueue(queue)
            .policies(lifecycle)
            .transports(registry)
            .stateMachine(stateMachine)
            .auditLog(auditLog)
            .metrics(metrics)
            .clock(clock);
    }

    private ConnectorDelivery enqueue(String type, String payload) {
        return queue.enqueue(NewDelivery.of("proj", type, payload)).delivery();
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsMissingCollaborators() {
        assertThrows(NullPointerException.class, () -> DeliveryPump.builder().build());
        assertThrows(NullPointerException.class, () -> builder().policies(null).build());
    }

    @Test
    void builderRejectsBadSettings() {
        assertThrows(IllegalArgumentException.class, () -> builder().workerCount(0).build());
        assertThrows(IllegalArgumentException.class, () -> builder().requestedLimit(101).build());
        assertThrows(IllegalArgumentException.class, () -> builder().attemptTimeoutMs(0).build());
        assertThrows(IllegalArgumentException.class, () -> builder().claimLocking("node-1", Duration.ZERO));
    }

    // ── Outcomes ────────────────────────────────────────────────────

    @Test
    void successfulAttemptDelivers() {
        transports.put("webhook", d -> TransportResponse.of(204));
        pump = builder().build();
        ConnectorDelivery d = enqueue("webhook", "{\"n\":1}");

        ConnectorDrain drain = pump.drain("proj", "webhook", 10);

        assertEquals(1, drain.delivered());
        ConnectorDelivery stored = store.get(d.id());
        assertEquals(DeliveryStatus.DELIVERED, stored.status());
        assertEquals(1, stored.attemptCount());
        assertEquals(START, stored.deliveredAt());
        List<DeliveryAttempt> attempts = queue.listAttempts(d.id());
        assertEquals(1, attempts.size());
        assertTrue(attempts.get(0).success());
        assertEquals(1, metrics.delivered.get());

        List<String> types = auditLog.listEvents("proj", 10).stream().map(AuditEvent::eventType).toList();
        assertTrue(types.contains(AuditPayload.DELIVERY_ATTEMPTED));
        assertTrue(types.contains(AuditPayload.DELIVERY_DELIVERED));
    }

    @Test
    void nonSuccessResponseSchedulesRetry() {
        transports.put("webhook", d -> new TransportResponse(503, "busy"));
        pump = builder().build();
        ConnectorDelivery d = enqueue("webhook", "{}");

        ConnectorDrain drain = pump.drain("proj", "webhook", 10);

        assertEquals(1, drain.retried());
        ConnectorDelivery stored = store.get(d.id());
        assertEquals(DeliveryStatus.RETRYING, stored.status());
        assertEquals(503, stored.lastStatusCode());
        assertEquals("remote endpoint returned 503", stored.lastError());
        assertEquals(START.plusMillis(1000), stored.nextAttemptAt());

        // Not due again until the backoff elapses.
        assertEquals(0, pump.drain("proj", "webhook", 10).attempted());
        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, pump.drain("proj", "webhook", 10).retried());
        assertEquals(2, store.get(d.id()).attemptCount());
    }

    @Test
    void exhaustedBudgetDeadLetters() {
        transports.put("webhook", d -> {
            throw new DeliveryAttemptException("connection refused");
        });
        pump = builder().build();
        ConnectorDelivery d = queue.enqueue(NewDelivery.of("proj", "webhook", "{}").withMaxAttempts(1)).delivery();

        ConnectorDrain drain = pump.drain("proj", "webhook", 10);

        assertEquals(1, drain.deadLettered());
        ConnectorDelivery stored = store.get(d.id());
        assertEquals(DeliveryStatus.DEAD_LETTERED, stored.status());
        assertEquals("connection refused", stored.deadLetterReason());
        assertEquals(1, metrics.deadLettered.get());
    }

    @Test
    void attemptExceptionCarriesStatusCode() {
        transports.put("webhook", d -> {
            throw new DeliveryAttemptException("rate limited", 429);
        });
        pump = builder().build();
        ConnectorDelivery d = enqueue("webhook", "{}");

        pump.drain("proj", "webhook", 10);

        assertEquals(429, store.get(d.id()).lastStatusCode());
        assertEquals("rate limited", store.get(d.id()).lastError());
    }

    @Test
    void slowEndpointTimesOut() {
        transports.put("webhook", d -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return TransportResponse.of(200);
        });
        pump = builder().attemptTimeoutMs(100).build();
        ConnectorDelivery d = enqueue("webhook", "{}");

        ConnectorDrain drain = pump.drain("proj", "webhook", 10);

        assertEquals(1, drain.retried());
        assertEquals("attempt timed out after 100ms", store.get(d.id()).lastError());
    }

    @Test
    void timeoutStartsWhenWorkerPicksAttemptUp() {
        AtomicInteger sent = new AtomicInteger();
        transports.put("webhook", d -> {
            try {
                Thread.sleep(150);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            sent.incrementAndGet();
            return TransportResponse.of(200);
        });
        pump = builder().workerCount(1).attemptTimeoutMs(400).build();
        for (int i = 0; i < 4; i++) {
            enqueue("webhook", "{\"n\":" + i + "}");
        }

        ConnectorDrain drain = pump.drain("proj", "webhook", 10);

        assertEquals(4, drain.delivered());
        assertEquals(0, drain.retried());
        assertEquals(4, sent.get());
        assertEquals(4, store.count(DeliveryStatus.DELIVERED));
        for (ConnectorDelivery row : store.all()) {
            List<DeliveryAttempt> attempts = queue.listAttempts(row.id());
            assertEquals(1, attempts.size());
            assertTrue(attempts.get(0).success());
        }
    }

    @Test
    void attemptThatNeverGetsWorkerIsNotCharged() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch released = new CountDownLatch(1);
        transports.put("webhook", d -> {
            calls.incrementAndGet();
            // Holds the only worker past its timeout and ignores the cancel.
            long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(600);
            while (System.nanoTime() < until) {
                try {
                    released.await(until - System.nanoTime(), TimeUnit.NANOSECONDS);
                } catch (InterruptedException ignored) {
                    // keep holding the worker
                }
            }
            return TransportResponse.of(200);
        });
        pump = builder().workerCount(1).attemptTimeoutMs(100).build();
        enqueue("webhook", "{\"n\":1}");
        enqueue("webhook", "{\"n\":2}");

        ConnectorDrain drain = pump.drain("proj", "webhook", 10);

        assertEquals(1, drain.retried());
        assertEquals(1, drain.skipped());
        assertEquals(1, calls.get());
        ConnectorDelivery untouched = store.all().stream()
            .filter(d -> d.status() == DeliveryStatus.QUEUED)
            .findFirst()
            .orElseThrow();
        assertEquals(0, untouched.attemptCount());
        assertTrue(queue.listAttempts(untouched.id()).isEmpty());
        released.countDown();
    }

    @Test
    void connectorWithoutTransportIsDeadLettered() {
        pump = builder().build();
        ConnectorDelivery d = enqueue("sqs", "{}");

        ConnectorDrain drain = pump.drain("proj", "sqs", 10);

        assertEquals(1, drain.deadLettered());
        ConnectorDelivery stored = store.get(d.id());
        assertEquals(DeliveryStatus.DEAD_LETTERED, stored.status());
        assertEquals(0, stored.attemptCount());
        assertEquals(DeliveryPump.NO_TRANSPORT_REASON + "sqs", stored.deadLetterReason());
        assertTrue(queue.listAttempts(d.id()).isEmpty());
    }

    // ── Backpressure ────────────────────────────────────────────────

    @Test
    void drainIsBoundedByLivePolicy() {
        applyPolicy(PolicyPatch.builder().maxRetrying(2).build());
        transports.put("webhook", d -> TransportResponse.of(200));
        pump = builder().build();
        for (int i = 0; i < 5; i++) {
            enqueue("webhook", "{\"n\":" + i + "}");
        }

        ConnectorDrain drain = pump.drain("proj", "webhook", 10);

        assertEquals(2, drain.delivered());
        assertEquals(5, drain.decision().queueDepth());
        assertEquals(2, drain.decision().effectiveLimit());
        assertTrue(drain.decision().throttled());
        assertEquals(ThrottleReason.RETRYING_LIMIT, drain.decision().reason());
        assertEquals(3, store.count(DeliveryStatus.QUEUED));
    }

    @Test
    void connectorOverrideTakesPrecedence() {
        applyPolicy(PolicyPatch.builder()
            .maxRetrying(1)
            .connectorOverride("slack", new BackpressureSettings(true, 3, 3, 1))
            .build());
        transports.put("webhook", d -> TransportResponse.of(200));
        transports.put("slack", d -> TransportResponse.of(200));
        pump = builder().build();
        for (int i = 0; i < 4; i++) {
            enqueue("webhook", "{\"n\":" + i + "}");
            enqueue("slack", "{\"n\":" + i + "}");
        }

        DrainReport report = pump.drain("proj", 10);

        Map<String, ConnectorDrain> byType = new HashMap<>();
        report.connectors().forEach(c -> byType.put(c.connectorType(), c));
        assertEquals(3, byType.get("slack").delivered());
        assertEquals(1, byType.get("webhook").delivered());
        assertEquals(2, report.throttledConnectors());
    }

    @Test
    void disabledPolicyDrainsNothing() {
        applyPolicy(PolicyPatch.builder().enabled(false).build());
        AtomicInteger calls = new AtomicInteger();
        transports.put("webhook", d -> {
            calls.incrementAndGet();
            return TransportResponse.of(200);
        });
        pump = builder().build();
        enqueue("webhook", "{}");

        ConnectorDrain drain = pump.drain("proj", "webhook", 10);

        assertEquals(0, drain.decision().effectiveLimit());
        assertEquals(ThrottleReason.DISABLED, drain.decision().reason());
        assertEquals(0, calls.get());
    }

    @Test
    void projectDrainSkipsIdleConnectors() {
        transports.put("webhook", d -> TransportResponse.of(200));
        pump = builder().build();
        enqueue("webhook", "{}");
        pump.drain("proj", "webhook", 10);
        enqueue("jira", "{}");
        transports.put("jira", d -> TransportResponse.of(201));

        DrainReport report = pump.drain("proj", 10);

        assertEquals(1, report.connectors().size());
        assertEquals("jira", report.connectors().get(0).connectorType());
        assertEquals(1, report.delivered());
    }

    // ── Scheduling and claiming ─────────────────────────────────────

    @Test
    void tickDrainsEveryPendingProject() {
        transports.put("webhook", d -> TransportResponse.of(200));
        pump = builder().build();
        queue.enqueue(NewDelivery.of("a", "webhook", "{}"));
        queue.enqueue(NewDelivery.of("b", "webhook", "{}"));

        pump.tick();

        assertEquals(2, store.count(DeliveryStatus.DELIVERED));
    }

    @Test
    void claimLockingModeDelivers() {
        transports.put("webhook", d -> TransportResponse.of(200));
        pump = builder().claimLocking("node-1", Duration.ofMinutes(5)).build();
        enqueue("webhook", "{}");

        assertEquals(1, pump.drain("proj", "webhook", 10).delivered());
    }

    @Test
    void rowHeldByAnotherDrainIsSkipped() {
        transports.put("webhook", d -> TransportResponse.of(200));
        DefaultInFlightTracker tracker = new DefaultInFlightTracker();
        pump = builder().inFlightTracker(tracker).build();
        ConnectorDelivery d = enqueue("webhook", "{}");
        assertTrue(tracker.tryAcquire(d.id()));

        ConnectorDrain drain = pump.drain("proj", "webhook", 10);

        assertEquals(1, drain.skipped());
        assertEquals(DeliveryStatus.QUEUED, store.get(d.id()).status());
    }

    @Test
    void closedPumpCannotStart() {
        pump = builder().build();
        pump.close();

        assertThrows(IllegalStateException.class, pump::start);
    }

    private void applyPolicy(PolicyPatch patch) {
        lifecycle.upsertDraft("proj", "alice", DraftAmendment.of(patch));
        lifecycle.recordApproval("proj", "bob");
        lifecycle.applyDraft("proj", "alice");
    }
}
