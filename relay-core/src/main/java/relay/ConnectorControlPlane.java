package relay;

import relay.audit.AuditEvent;
import relay.audit.AuditPayload;
import relay.backpressure.ActivationDecision;
import relay.backpressure.ActivationSweepResult;
import relay.backpressure.BackpressureDraft;
import relay.backpressure.BackpressurePolicy;
import relay.backpressure.BackpressureSimulator;
import relay.backpressure.DraftAmendment;
import relay.backpressure.PolicyLifecycle;
import relay.backpressure.PolicyPatch;
import relay.backpressure.Simulation;
import relay.backpressure.TuningAdvisor;
import relay.backpressure.TuningSuggestion;
import relay.delivery.DeliveryQueue;
import relay.delivery.DeliveryStateMachine;
import relay.delivery.ExponentialBackoffRetryPolicy;
import relay.delivery.RetryPolicy;
import relay.guardian.GuardianController;
import relay.guardian.GuardianPolicies;
import relay.guardian.GuardianPolicy;
import relay.guardian.GuardianPolicyPatch;
import relay.guardian.GuardianRunReport;
import relay.insights.ConnectorInsights;
import relay.insights.OutcomeTrend;
import relay.insights.PolicyUpdate;
import relay.model.ConnectorDelivery;
import relay.model.DeliveryAttempt;
import relay.model.DeliverySummary;
import relay.model.EnqueueResult;
import relay.model.NewDelivery;
import relay.pump.ConnectorDrain;
import relay.pump.DeliveryPump;
import relay.pump.DrainReport;
import relay.reliability.RankedConnector;
import relay.reliability.ReliabilityRanker;
import relay.reliability.TrendComparison;
import relay.spi.AuditLog;
import relay.spi.ConnectionProvider;
import relay.spi.DeliveryStore;
import relay.spi.MetricsExporter;
import relay.spi.PolicyStore;
import relay.spi.TransportRegistry;
import relay.transport.ConnectorConfigs;
import relay.util.Arguments;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the delivery queue, analytics, backpressure lifecycle, pump
 * and guardian over one set of stores, and exposes every query and mutation the surrounding
 * product calls.
 *
 * <p>Read endpoints take point-in-time snapshots and never lock. Every mutation is an explicit
 * state transition that is validated before anything is written.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (ConnectorControlPlane plane = ConnectorControlPlane.builder()
 *     .connectionProvider(connProvider)
 *     .deliveryStore(store)
 *     .policyStore(policyStore)
 *     .auditLog(auditLog)
 *     .transports(DefaultTransportRegistry.http(configs, Duration.ofSeconds(10)))
 *     .build()) {
 *   plane.start();
 *   plane.enqueue(NewDelivery.of("proj-1", "webhook", "{\"id\":1}"));
 * }
 * }</pre>
 */
public final class ConnectorControlPlane implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectorControlPlane.class.getName());

  /** Audit event types shown on the action timeline. */
  static final Set<String> TIMELINE_EVENT_TYPES = Set.of(
      AuditPayload.DRAFT_UPDATED,
      AuditPayload.DRAFT_APPROVED,
      AuditPayload.POLICY_UPDATED,
      AuditPayload.GUARDIAN_POLICY_UPDATED,
      AuditPayload.GUARDIAN_ACTION_EXECUTED,
      AuditPayload.GUARDIAN_ACTION_FAILED);

  private final ControlPlaneConfig config;
  private final AuditLog auditLog;
  private final DeliveryQueue queue;
  private final ConnectorAnalytics analytics;
  private final PolicyLifecycle lifecycle;
  private final TuningAdvisor advisor;
  private final GuardianPolicies guardianPolicies;
  private final DeliveryPump pump;
  private final GuardianController guardian;
  private final boolean pumpEnabled;
  private final boolean guardianEnabled;
  private final AtomicBoolean started = new AtomicBoolean();

  private ConnectorControlPlane(Builder b) {
    this.config = b.config;
    this.auditLog = b.auditLog;
    this.pumpEnabled = b.pumpEnabled;
    this.guardianEnabled = b.guardianEnabled;
    MetricsExporter metrics = b.metrics != null ? b.metrics : MetricsExporter.NOOP;
    Clock clock = b.clock != null ? b.clock : Clock.systemUTC();
    RetryPolicy retryPolicy = b.retryPolicy != null
        ? b.retryPolicy
        : new ExponentialBackoffRetryPolicy(config.getRetryBaseDelayMs(), config.getRetryMaxDelayMs(),
            config.getRetryJitter());
    DeliveryStateMachine stateMachine = new DeliveryStateMachine(retryPolicy);

    this.queue = new DeliveryQueue(b.connectionProvider, b.deliveryStore, auditLog, stateMachine, config, clock, metrics);
    this.analytics = new ConnectorAnalytics(queue, auditLog, new ReliabilityRanker(), config, clock);
    this.lifecycle = new PolicyLifecycle(b.policyStore, auditLog, config, clock);
    this.advisor = new TuningAdvisor(config);
    this.guardianPolicies = new GuardianPolicies(b.policyStore, auditLog, config);

    DeliveryPump.Builder pb = DeliveryPump.builder()
        .connectionProvider(b.connectionProvider)
        .deliveryStore(b.deliveryStore)
        .deliveryQueue(queue)
        .policies(lifecycle)
        .transports(b.transports)
        .stateMachine(stateMachine)
        .auditLog(auditLog)
        .metrics(metrics)
        .clock(clock)
        .requestedLimit(config.getPumpRequestedLimit())
        .intervalMs(config.getPumpIntervalMs())
        .workerCount(config.getPumpWorkers())
        .attemptTimeoutMs(config.getAttemptTimeoutMs());
    if (b.ownerId != null) {
      pb.claimLocking(b.ownerId, b.lockTimeout);
    }
    this.pump = pb.build();
    try {
      this.guardian = GuardianController.builder()
          .analytics(analytics)
          .deliveryQueue(queue)
          .pump(pump)
          .policies(guardianPolicies)
          .auditLog(auditLog)
          .metrics(metrics)
          .clock(clock)
          .intervalMs(config.getGuardianIntervalMs())
          .build();
    } catch (RuntimeException e) {
      pump.close();
      throw e;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the background pump and guardian loops (those enabled on the builder).
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    if (pumpEnabled) {
      pump.start();
    }
    if (guardianEnabled) {
      guardian.start();
    }
    logger.log(Level.INFO, "Connector control plane started (pump={0}, guardian={1})",
        new Object[] {pumpEnabled, guardianEnabled});
  }

  // ── Deliveries ───────────────────────────────────────────────────

  public EnqueueResult enqueue(NewDelivery request) {
    return queue.enqueue(request);
  }

  public ConnectorDelivery getDelivery(String deliveryId) {
    return queue.getDelivery(deliveryId);
  }

  public List<ConnectorDelivery> listDeliveries(String projectId, String connectorType, int limit) {
    return queue.listDeliveries(projectId, connectorType, limit);
  }

  public List<DeliveryAttempt> listAttempts(String deliveryId) {
    return queue.listAttempts(deliveryId);
  }

  public DeliverySummary summarize(String projectId, String connectorType) {
    return queue.summarize(projectId, connectorType);
  }

  public Map<String, DeliverySummary> summarizeAll(String projectId) {
    return queue.summarizeAll(projectId);
  }

  public List<ConnectorDelivery> redriveDeadLetters(String projectId, String connectorType, int limit,
      int minDeadLetterMinutes, String actor) {
    return queue.redriveDeadLetters(projectId, connectorType, limit, minDeadLetterMinutes, actor);
  }

  /**
   * Queue-drain trigger: one backpressure-bounded drain of one connector.
   */
  public ConnectorDrain processQueue(String projectId, String connectorType, int requestedLimit) {
    return pump.drain(projectId, connectorType, requestedLimit);
  }

  /**
   * One backpressure-bounded drain of every connector of a project.
   */
  public DrainReport processProject(String projectId, int requestedLimit) {
    return pump.drain(projectId, requestedLimit);
  }

  public ConnectorConfigs.ConfigValidation validateConnectorConfig(String connectorType, Map<String, String> settings) {
    return ConnectorConfigs.validate(connectorType, settings);
  }

  // ── Analytics ────────────────────────────────────────────────────

  public ConnectorInsights insights(String projectId, String connectorType, int lookbackHours) {
    return analytics.insights(projectId, connectorType, lookbackHours);
  }

  public OutcomeTrend outcomes(String projectId, String connectorType, int lookbackHours) {
    return analytics.outcomes(projectId, connectorType, lookbackHours);
  }

  public List<PolicyUpdate> policyUpdates(String projectId, int limit) {
    return analytics.policyUpdates(projectId, limit);
  }

  public List<RankedConnector> rankReliability(String projectId, int lookbackHours) {
    return analytics.rankReliability(projectId, lookbackHours);
  }

  public List<TrendComparison> reliabilityTrend(String projectId, int lookbackHours) {
    return analytics.reliabilityTrend(projectId, lookbackHours);
  }

  // ── Backpressure ─────────────────────────────────────────────────

  public BackpressurePolicy livePolicy(String projectId) {
    return lifecycle.livePolicy(Arguments.projectId(projectId));
  }

  public BackpressureDraft getDraft(String projectId) {
    String project = Arguments.projectId(projectId);
    return lifecycle.findDraft(project)
        .orElseThrow(() -> new NotFoundException("draft not found for project " + project));
  }

  public BackpressureDraft upsertDraft(String projectId, String actor, DraftAmendment amendment) {
    return lifecycle.upsertDraft(Arguments.projectId(projectId), actor, amendment);
  }

  public BackpressureDraft approveDraft(String projectId, String actor) {
    return lifecycle.recordApproval(Arguments.projectId(projectId), actor);
  }

  public ActivationDecision evaluateActivation(String projectId) {
    return lifecycle.evaluateActivation(Arguments.projectId(projectId));
  }

  public BackpressurePolicy applyDraft(String projectId, String actor) {
    return lifecycle.applyDraft(Arguments.projectId(projectId), actor);
  }

  public List<ActivationSweepResult> activateReadyDrafts(String actor, boolean dryRun) {
    return lifecycle.activateReadyDrafts(actor, dryRun);
  }

  /**
   * Compares the live policy with the live policy amended by {@code candidate}, against the
   * current queue.
   *
   * @param connectorTypes connectors to simulate; empty for every connector with deliveries
   */
  public Simulation simulate(String projectId, Collection<String> connectorTypes, int requestedLimit,
      PolicyPatch candidate) {
    Objects.requireNonNull(candidate, "candidate");
    String project = Arguments.projectId(projectId);
    List<String> types = normalizeTypes(connectorTypes);
    BackpressurePolicy live = lifecycle.livePolicy(project);
    BackpressurePolicy proposed = candidate.applyTo(live, live.version() + 1, live.updatedAt());
    return BackpressureSimulator.simulate(types, requestedLimit, queue.summarizeAll(project), live, proposed);
  }

  /**
   * Simulates the project's pending draft against the live policy.
   *
   * @throws NotFoundException if the project has no draft
   */
  public Simulation simulateDraft(String projectId, Collection<String> connectorTypes, int requestedLimit) {
    return simulate(projectId, connectorTypes, requestedLimit, getDraft(projectId).proposed());
  }

  public TuningSuggestion recommendTuning(String projectId) {
    return advisor.suggest(queue.summarizeAll(projectId).values());
  }

  // ── Guardian ─────────────────────────────────────────────────────

  public GuardianPolicy guardianPolicy(String projectId) {
    return guardianPolicies.policyFor(projectId);
  }

  public GuardianPolicy upsertGuardianPolicy(String projectId, String actor, GuardianPolicyPatch patch) {
    return guardianPolicies.upsert(projectId, actor, patch);
  }

  public GuardianRunReport runGuardian(String projectId, boolean dryRun) {
    return guardian.runOnce(projectId, dryRun);
  }

  /**
   * Policy, draft and guardian audit events for the project, newest first.
   *
   * @param limit maximum events returned (1..1000)
   */
  public List<AuditEvent> actionTimeline(String projectId, int limit) {
    String project = Arguments.projectId(projectId);
    Arguments.range("limit", limit, 1, ConnectorAnalytics.MAX_AUDIT_LIMIT);
    return auditLog.listEvents(project, TIMELINE_EVENT_TYPES, null, limit);
  }

  public ControlPlaneConfig config() {
    return config;
  }

  DeliveryPump pump() {
    return pump;
  }

  GuardianController guardian() {
    return guardian;
  }

  private static List<String> normalizeTypes(Collection<String> connectorTypes) {
    List<String> types = new ArrayList<>();
    if (connectorTypes != null) {
      for (String type : connectorTypes) {
        types.add(Arguments.connectorType(type));
      }
    }
    return types;
  }

  /**
   * Stops the guardian, then the pump. The stores are owned by the caller and left open.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      guardian.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      pump.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link ConnectorControlPlane}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DeliveryStore deliveryStore;
    private PolicyStore policyStore;
    private AuditLog auditLog;
    private TransportRegistry transports;
    private ControlPlaneConfig config = new ControlPlaneConfig();
    private MetricsExporter metrics;
    private RetryPolicy retryPolicy;
    private Clock clock;
    private boolean pumpEnabled = true;
    private boolean guardianEnabled = true;
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

    /** <b>Required.</b> */
    public Builder policyStore(PolicyStore policyStore) {
      this.policyStore = policyStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder auditLog(AuditLog auditLog) {
      this.auditLog = auditLog;
      return this;
    }

    /** <b>Required.</b> */
    public Builder transports(TransportRegistry transports) {
      this.transports = transports;
      return this;
    }

    /** Optional. Defaults to a fresh {@link ControlPlaneConfig}. */
    public Builder config(ControlPlaneConfig config) {
      this.config = config;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to exponential backoff from the config's retry settings. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Optional. Defaults to the UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Optional. Whether {@link #start()} schedules the pump. Defaults to {@code true}. */
    public Builder pumpEnabled(boolean pumpEnabled) {
      this.pumpEnabled = pumpEnabled;
      return this;
    }

    /** Optional. Whether {@link #start()} schedules the guardian. Defaults to {@code true}. */
    public Builder guardianEnabled(boolean guardianEnabled) {
      this.guardianEnabled = guardianEnabled;
      return this;
    }

    /**
     * Makes the pump lease due deliveries so several nodes can share one database.
     *
     * @param ownerId     unique identifier for this node
     * @param lockTimeout how long a lease lasts before another node may claim the delivery
     */
    public Builder claimLocking(String ownerId, Duration lockTimeout) {
      this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
      this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
      return this;
    }

    /**
     * @throws NullPointerException if a required collaborator is missing
     */
    public ConnectorControlPlane build() {
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(deliveryStore, "deliveryStore");
      Objects.requireNonNull(policyStore, "policyStore");
      Objects.requireNonNull(auditLog, "auditLog");
      Objects.requireNonNull(transports, "transports");
      Objects.requireNonNull(config, "config");
      return new ConnectorControlPlane(this);
    }
  }
}
