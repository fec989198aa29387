package relay.pump;

import com.github.f4b6a3.ulid.UlidCreator;
import relay.ConcurrencyException;
import relay.DeliveryAttemptException;
import relay.audit.AuditPayload;
import relay.backpressure.BackpressureGate;
import relay.backpressure.BackpressurePolicy;
import relay.backpressure.GateDecision;
import relay.backpressure.PolicyLifecycle;
import relay.delivery.DeliveryQueue;
import relay.delivery.DeliveryStateMachine;
import relay.model.AttemptOutcome;
import relay.model.ConnectorDelivery;
import relay.model.DeliveryAttempt;
import relay.model.DeliveryStatus;
import relay.model.DeliverySummary;
import relay.model.DeliveryTransition;
import relay.spi.AuditLog;
import relay.spi.ConnectionProvider;
import relay.spi.ConnectorTransport;
import relay.spi.ConnectorTransport.TransportResponse;
import relay.spi.DeliveryStore;
import relay.spi.MetricsExporter;
import relay.spi.TransportRegistry;
import relay.util.Arguments;
import relay.util.ConnectionTemplate;
import relay.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled worker that drains due deliveries, sized per connector by the project's live
 * backpressure policy.
 *
 * <p>Each tick visits every project with pending deliveries. For each connector with due work
 * it asks {@link BackpressureGate} for the effective limit, fetches that many due rows and
 * attempts them in parallel on the worker pool, each bounded by the attempt timeout. The
 * resulting transition is written with a compare-and-set on the attempt count; a lost race
 * leaves the row to whoever won it.
 *
 * <p>Operates in two modes:
 * <ul>
 *   <li><b>Single-node</b> (default): uses {@link DeliveryStore#listDue} with no locking.
 *   <li><b>Multi-node</b>: uses {@link DeliveryStore#claimDue} to lease rows. Enabled via
 *       {@link Builder#claimLocking}.
 * </ul>
 *
 * <p>A tick that fires while the previous one is still running is skipped.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class DeliveryPump implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(DeliveryPump.class.getName());

    public static final String NO_TRANSPORT_REASON = "no transport registered for connector type ";
    public static final int MAX_REQUESTED_LIMIT = 100;

    private final ConnectionProvider connectionProvider;
    private final DeliveryStore deliveryStore;
    private final DeliveryQueue deliveryQueue;
    private final PolicyLifecycle policies;
    private final TransportRegistry transports;
    private final DeliveryStateMachine stateMachine;
    private final AuditLog auditLog;
    private final MetricsExporter metrics;
    private final InFlightTracker inFlightTracker;
    private final Clock clock;
    private final int requestedLimit;
    private final long intervalMs;
    private final long attemptTimeoutMs;
    private final String ownerId;
    private final Duration lockTimeout;

    private final AtomicBoolean ticking = new AtomicBoolean();
    private final ExecutorService workers;
    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> tickTask;
    private volatile boolean closed;

    private DeliveryPump(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
        this.deliveryQueue = Objects.requireNonNull(builder.deliveryQueue, "deliveryQueue");
        this.policies = Objects.requireNonNull(builder.policies, "policies");
        this.transports = Objects.requireNonNull(builder.transports, "transports");
        this.stateMachine = Objects.requireNonNull(builder.stateMachine, "stateMachine");
        this.auditLog = Objects.requireNonNull(builder.auditLog, "auditLog");

        if (builder.requestedLimit <= 0 || builder.requestedLimit > MAX_REQUESTED_LIMIT) {
            throw new IllegalArgumentException("requestedLimit must be in 1.." + MAX_REQUESTED_LIMIT);
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be > 0");
        }
        if (builder.attemptTimeoutMs <= 0L) {
            throw new IllegalArgumentException("attemptTimeoutMs must be > 0");
        }

        this.requestedLimit = builder.requestedLimit;
        this.intervalMs = builder.intervalMs;
        this.attemptTimeoutMs = builder.attemptTimeoutMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.inFlightTracker = builder.inFlightTracker != null
            ? builder.inFlightTracker
            : new DefaultInFlightTracker(builder.attemptTimeoutMs * 2);
        this.ownerId = builder.ownerId;
        this.lockTimeout = builder.lockTimeout;
        this.workers = Executors.newFixedThreadPool(builder.workerCount, new DaemonThreadFactory("relay-pump-worker-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduled drain loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("DeliveryPump has been closed");
        }
        if (tickTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("relay-pump-"));
        tickTask = scheduler.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Drains every project with pending deliveries once. Called by the scheduler, but may also be
     * invoked directly.
     */
    public void tick() {
        if (closed) {
            return;
        }
        if (!ticking.compareAndSet(false, true)) {
            metrics.incrementSkippedTicks();
            logger.log(Level.FINE, "Skipping pump tick; previous tick still running");
            return;
        }
        try {
            for (String projectId : deliveryQueue.listProjectsWithPending()) {
                if (closed) {
                    return;
                }
                try {
                    drain(projectId, requestedLimit);
                } catch (RuntimeException e) {
                    logger.log(Level.SEVERE, "Drain failed for project " + projectId, e);
                }
            }
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Pump tick failed", t);
        } finally {
            ticking.set(false);
        }
    }

    /**
     * Drains one project's due deliveries once, connector by connector.
     *
     * @param projectId      the project to drain
     * @param requestedLimit the per-connector drain the caller would like, before backpressure
     * @return decisions and outcome counts for each connector that had due work
     */
    public DrainReport drain(String projectId, int requestedLimit) {
        String project = Arguments.projectId(projectId);
        Arguments.range("requested_limit", requestedLimit, 1, MAX_REQUESTED_LIMIT);
        BackpressurePolicy policy = policies.livePolicy(project);

        List<ConnectorDrain> drains = new ArrayList<>();
        for (String connectorType : deliveryQueue.listConnectorTypes(project)) {
            ConnectorDrain drained = drainConnector(project, connectorType, requestedLimit, policy);
            if (drained.decision().queueDepth() > 0) {
                drains.add(drained);
            }
        }
        DrainReport report = new DrainReport(project, drains);
        if (report.delivered() + report.retried() + report.deadLettered() > 0) {
            logger.log(Level.FINE, "Drained project {0}: delivered={1} retried={2} deadLettered={3}",
                new Object[] {project, report.delivered(), report.retried(), report.deadLettered()});
        }
        return report;
    }

    /**
     * Drains one connector of one project once, under the project's live backpressure policy.
     */
    public ConnectorDrain drain(String projectId, String connectorType, int requestedLimit) {
        String project = Arguments.projectId(projectId);
        String type = Arguments.connectorType(connectorType);
        Arguments.range("requested_limit", requestedLimit, 1, MAX_REQUESTED_LIMIT);
        return drainConnector(project, type, requestedLimit, policies.livePolicy(project));
    }

    private ConnectorDrain drainConnector(String projectId, String connectorType, int requestedLimit,
                                          BackpressurePolicy policy) {
        DeliverySummary summary = deliveryQueue.summarize(projectId, connectorType);
        GateDecision decision = BackpressureGate.decide(requestedLimit, summary, policy.settingsFor(connectorType));
        if (decision.throttled()) {
            logger.log(Level.FINE, "Throttled {0}/{1} to {2} of {3} due ({4})", new Object[] {
                projectId, connectorType, decision.effectiveLimit(), decision.queueDepth(), decision.reason()});
        }
        if (decision.effectiveLimit() == 0) {
            return new ConnectorDrain(connectorType, decision, 0, 0, 0, 0);
        }
        Instant now = clock.instant();
        List<ConnectorDelivery> due = fetchDue(projectId, connectorType, now, decision.effectiveLimit());
        if (!due.isEmpty()) {
            // Rows come back oldest schedule first.
            Instant oldest = due.get(0).nextAttemptAt();
            metrics.recordOldestDueLagMs(Math.max(0L, Duration.between(oldest, now).toMillis()));
        }
        return attemptAll(connectorType, decision, due);
    }

    private List<ConnectorDelivery> fetchDue(String projectId, String connectorType, Instant now, int limit) {
        if (ownerId != null) {
            Instant lockExpiry = now.minus(lockTimeout);
            return ConnectionTemplate.inTransaction(connectionProvider, "claim due deliveries",
                conn -> deliveryStore.claimDue(conn, ownerId, projectId, connectorType, now, lockExpiry, limit));
        }
        return ConnectionTemplate.withConnection(connectionProvider, "list due deliveries",
            conn -> deliveryStore.listDue(conn, projectId, connectorType, now, limit));
    }

    private ConnectorDrain attemptAll(String connectorType, GateDecision decision, List<ConnectorDelivery> due) {
        int delivered = 0;
        int retried = 0;
        int deadLettered = 0;
        int skipped = 0;

        Optional<ConnectorTransport> transport = transports.transportFor(connectorType);
        List<InFlight> inFlight = new ArrayList<>();
        for (ConnectorDelivery row : due) {
            if (!inFlightTracker.tryAcquire(row.id())) {
                skipped++;
                continue;
            }
            if (transport.isEmpty()) {
                try {
                    if (deadLetterUnroutable(row)) {
                        deadLettered++;
                    } else {
                        skipped++;
                    }
                } finally {
                    inFlightTracker.release(row.id());
                }
                continue;
            }
            InFlight attempt = new InFlight(row);
            attempt.future = workers.submit(attempt.task(transport.get()));
            inFlight.add(attempt);
        }

        for (InFlight attempt : inFlight) {
            try {
                AttemptOutcome outcome = await(attempt);
                if (outcome == null) {
                    skipped++;
                    continue;
                }
                DeliveryStatus status = recordOutcome(attempt.row, outcome);
                if (status == null) {
                    skipped++;
                } else if (status == DeliveryStatus.DELIVERED) {
                    delivered++;
                } else if (status == DeliveryStatus.RETRYING) {
                    retried++;
                } else {
                    deadLettered++;
                }
            } catch (RuntimeException e) {
                skipped++;
                logger.log(Level.SEVERE, "Failed to record attempt for delivery " + attempt.row.id(), e);
            } finally {
                inFlightTracker.release(attempt.row.id());
            }
        }
        return new ConnectorDrain(connectorType, decision, delivered, retried, deadLettered, skipped);
    }

    /**
     * Waits for the attempt within its timeout, counted from the moment a worker picked it up.
     * Returns {@code null} when the attempt is not counted: this thread was interrupted, or no
     * worker became free within one timeout and the attempt was withdrawn before it ran.
     */
    private AttemptOutcome await(InFlight attempt) {
        try {
            if (!attempt.started.await(attemptTimeoutMs, TimeUnit.MILLISECONDS) && attempt.future.cancel(false)) {
                logger.log(Level.WARNING, "No worker free for delivery {0} within {1}ms; leaving it due",
                    new Object[] {attempt.row.id(), attemptTimeoutMs});
                return null;
            }
            attempt.started.await();
            long remainingNanos = TimeUnit.MILLISECONDS.toNanos(attemptTimeoutMs)
                - (System.nanoTime() - attempt.startNanos);
            TransportResponse response = attempt.future.get(Math.max(0L, remainingNanos), TimeUnit.NANOSECONDS);
            long latencyMs = attempt.elapsedMs();
            if (response.statusCode() >= 200 && response.statusCode() < 300) {
                return AttemptOutcome.succeeded(response.statusCode(), latencyMs);
            }
            return AttemptOutcome.failed(response.statusCode(),
                "remote endpoint returned " + response.statusCode(), latencyMs);
        } catch (TimeoutException e) {
            attempt.future.cancel(true);
            return AttemptOutcome.failed(null, "attempt timed out after " + attemptTimeoutMs + "ms", attempt.elapsedMs());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DeliveryAttemptException failure) {
                return AttemptOutcome.failed(failure.statusCode(), failure.getMessage(), attempt.elapsedMs());
            }
            logger.log(Level.WARNING, "Transport threw for delivery " + attempt.row.id(), cause);
            return AttemptOutcome.failed(null, String.valueOf(cause), attempt.elapsedMs());
        } catch (InterruptedException e) {
            attempt.future.cancel(true);
            Thread.currentThread().interrupt();
            return null;
        }
    }

    /**
     * Persists the transition and the attempt row together. Returns the new status, or
     * {@code null} when a concurrent writer already moved the delivery.
     */
    private DeliveryStatus recordOutcome(ConnectorDelivery row, AttemptOutcome outcome) {
        Instant now = clock.instant();
        DeliveryTransition transition = stateMachine.onOutcome(row, outcome, now);
        DeliveryAttempt attempt = new DeliveryAttempt(UlidCreator.getMonotonicUlid().toString(), row.id(), now,
            outcome.statusCode(), transition.lastError(), outcome.latencyMs());
        try {
            ConnectionTemplate.inTransaction(connectionProvider, "record delivery attempt", conn -> {
                if (deliveryStore.transitionDelivery(conn, row.id(), transition, now) != 1) {
                    throw new ConcurrencyException("delivery " + row.id() + " changed during its attempt");
                }
                deliveryStore.recordAttempt(conn, attempt);
                return null;
            });
        } catch (ConcurrencyException e) {
            logger.log(Level.WARNING, "Discarding attempt result: {0}", e.getMessage());
            return null;
        }

        metrics.recordAttemptLatencyMs(outcome.latencyMs());
        auditLog.appendEvent(row.projectId(), DeliveryQueue.SYSTEM_ACTOR, new AuditPayload.DeliveryAttempted(
            row.id(), row.connectorType(), transition.attemptCount(), outcome.statusCode(), transition.lastError(),
            outcome.latencyMs()));
        switch (transition.status()) {
            case DELIVERED -> {
                metrics.incrementDelivered();
                auditLog.appendEvent(row.projectId(), DeliveryQueue.SYSTEM_ACTOR,
                    new AuditPayload.Delivered(row.id(), row.connectorType(), transition.attemptCount()));
            }
            case RETRYING -> metrics.incrementRetried();
            case DEAD_LETTERED -> {
                metrics.incrementDeadLettered();
                auditLog.appendEvent(row.projectId(), DeliveryQueue.SYSTEM_ACTOR, new AuditPayload.DeadLettered(
                    row.id(), row.connectorType(), transition.attemptCount(), transition.deadLetterReason()));
                logger.log(Level.WARNING, "Dead-lettered delivery {0} ({1}) after {2} attempts: {3}", new Object[] {
                    row.id(), row.connectorType(), transition.attemptCount(), transition.deadLetterReason()});
            }
            default -> throw new IllegalStateException("unexpected transition to " + transition.status());
        }
        return transition.status();
    }

    private boolean deadLetterUnroutable(ConnectorDelivery row) {
        String reason = NO_TRANSPORT_REASON + row.connectorType();
        DeliveryTransition transition = stateMachine.unroutable(row, reason);
        Instant now = clock.instant();
        int updated = ConnectionTemplate.withConnection(connectionProvider, "dead-letter unroutable delivery",
            conn -> deliveryStore.transitionDelivery(conn, row.id(), transition, now));
        if (updated != 1) {
            return false;
        }
        metrics.incrementDeadLettered();
        auditLog.appendEvent(row.projectId(), DeliveryQueue.SYSTEM_ACTOR, new AuditPayload.DeadLettered(
            row.id(), row.connectorType(), row.attemptCount(), reason));
        logger.log(Level.WARNING, "Dead-lettered delivery {0}: {1}", new Object[] {row.id(), reason});
        return true;
    }

    /**
     * Cancels the drain schedule and shuts down the scheduler and worker threads.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        workers.shutdownNow();
        try {
            if (scheduler != null) {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            }
            workers.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One submitted attempt. The worker stamps {@code startNanos} before calling the transport.
     */
    private static final class InFlight {
        private final ConnectorDelivery row;
        private final CountDownLatch started = new CountDownLatch(1);
        private volatile long startNanos;
        private Future<TransportResponse> future;

        InFlight(ConnectorDelivery row) {
            this.row = row;
        }

        Callable<TransportResponse> task(ConnectorTransport target) {
            return () -> {
                startNanos = System.nanoTime();
                started.countDown();
                return target.deliver(row);
            };
        }

        long elapsedMs() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }
    }

    /**
     * Builder for {@link DeliveryPump}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private DeliveryStore deliveryStore;
        private DeliveryQueue deliveryQueue;
        private PolicyLifecycle policies;
        private TransportRegistry transports;
        private DeliveryStateMachine stateMachine;
        private AuditLog auditLog;
        private MetricsExporter metrics;
        private InFlightTracker inFlightTracker;
        private Clock clock;
        private int requestedLimit = 25;
        private long intervalMs = 5000L;
        private int workerCount = 4;
        private long attemptTimeoutMs = 10_000L;
        private String ownerId;
        private Duration lockTimeout;

        private Builder() {
        }

        /** <b>Required.</b> */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** <b>Required.</b> */
        public Builder deliveryStore(DeliveryStore deliveryStore) {
            this.deliveryStore = deliveryStore;
            return this;
        }

        /** <b>Required.</b> Used for project discovery and queue summaries. */
        public Builder deliveryQueue(DeliveryQueue deliveryQueue) {
            this.deliveryQueue = deliveryQueue;
            return this;
        }

        /** <b>Required.</b> Source of each project's live backpressure policy. */
        public Builder policies(PolicyLifecycle policies) {
            this.policies = policies;
            return this;
        }

        /** <b>Required.</b> */
        public Builder transports(TransportRegistry transports) {
            this.transports = transports;
            return this;
        }

        /** <b>Required.</b> */
        public Builder stateMachine(DeliveryStateMachine stateMachine) {
            this.stateMachine = stateMachine;
            return this;
        }

        /** <b>Required.</b> */
        public Builder auditLog(AuditLog auditLog) {
            this.auditLog = auditLog;
            return this;
        }

        /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /** Optional. Defaults to a {@link DefaultInFlightTracker} with a TTL of twice the attempt timeout. */
        public Builder inFlightTracker(InFlightTracker inFlightTracker) {
            this.inFlightTracker = inFlightTracker;
            return this;
        }

        /** Optional. Defaults to the UTC system clock. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Per-connector drain requested on every scheduled tick, before backpressure.
         *
         * <p>Optional. Defaults to {@code 25}. Must be in {@code 1..100}.
         */
        public Builder requestedLimit(int requestedLimit) {
            this.requestedLimit = requestedLimit;
            return this;
        }

        /** Optional. Defaults to {@code 5000} ms. Must be &gt; 0. */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /** Optional. Defaults to {@code 4}. Must be &gt; 0. */
        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        /** Optional. Defaults to {@code 10000} ms. Must be &gt; 0. */
        public Builder attemptTimeoutMs(long attemptTimeoutMs) {
            this.attemptTimeoutMs = attemptTimeoutMs;
            return this;
        }

        /**
         * Enables lease-based claiming for multi-node deployments with an auto-generated owner ID.
         *
         * @param lockTimeout how long a leased delivery stays locked before another node may claim it
         * @return this builder
         */
        public Builder claimLocking(Duration lockTimeout) {
            return claimLocking("pump-" + UUID.randomUUID().toString().substring(0, 8), lockTimeout);
        }

        /**
         * Enables lease-based claiming for multi-node deployments with an explicit owner ID.
         *
         * @param ownerId     unique identifier for this pump instance (e.g. hostname or pod name)
         * @param lockTimeout how long a leased delivery stays locked before another node may claim it
         * @return this builder
         */
        public Builder claimLocking(String ownerId, Duration lockTimeout) {
            this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
            this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
            if (lockTimeout.isNegative() || lockTimeout.isZero()) {
                throw new IllegalArgumentException("lockTimeout must be positive");
            }
            return this;
        }

        /**
         * Builds the pump. Call {@link DeliveryPump#start()} to begin the drain schedule.
         *
         * @throws NullPointerException     if a required collaborator is missing
         * @throws IllegalArgumentException if a numeric setting is out of range
         */
        public DeliveryPump build() {
            return new DeliveryPump(this);
        }
    }
}
