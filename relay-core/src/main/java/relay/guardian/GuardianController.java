package relay.guardian;

import relay.ConcurrencyException;
import relay.ConnectorAnalytics;
import relay.audit.AuditEvent;
import relay.audit.AuditPayload;
import relay.delivery.DeliveryQueue;
import relay.model.ConnectorDelivery;
import relay.model.DeliverySummary;
import relay.pump.ConnectorDrain;
import relay.pump.DeliveryPump;
import relay.reliability.RankedConnector;
import relay.reliability.Recommendation;
import relay.spi.AuditLog;
import relay.spi.MetricsExporter;
import relay.util.Arguments;
import relay.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Control loop that turns reliability rankings into bounded remediation.
 *
 * <p>A run over one project loads its {@link GuardianPolicy}, ranks the project's connectors,
 * selects actions above the risk threshold up to the per-run quota, holds back connectors still
 * in cooldown, and executes the rest:
 * <ul>
 *   <li>{@code process_queue}: one pump drain of the connector, requesting {@code actionLimit}.
 *   <li>{@code redrive_dead_letters}: redrive up to {@code actionLimit} dead letters older than
 *       {@code minDeadLetterMinutes}, then drain what was redriven.
 * </ul>
 *
 * <p>Every action is audited. A failed action is recorded and the run carries on. Only one run
 * per project is in flight at a time; an overlapping scheduled run is skipped.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class GuardianController implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(GuardianController.class.getName());

  public static final String DEFAULT_ACTOR = "guardian";
  static final int COOLDOWN_EVENT_LIMIT = 1000;
  private static final Set<String> ACTION_EVENT_TYPES =
      Set.of(AuditPayload.GUARDIAN_ACTION_EXECUTED, AuditPayload.GUARDIAN_ACTION_FAILED);

  private final ConnectorAnalytics analytics;
  private final DeliveryQueue deliveryQueue;
  private final DeliveryPump pump;
  private final GuardianPolicies policies;
  private final AuditLog auditLog;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final String actor;
  private final long intervalMs;

  private final Set<String> running = ConcurrentHashMap.newKeySet();
  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> tickTask;
  private volatile boolean closed;

  private GuardianController(Builder builder) {
    this.analytics = Objects.requireNonNull(builder.analytics, "analytics");
    this.deliveryQueue = Objects.requireNonNull(builder.deliveryQueue, "deliveryQueue");
    this.pump = Objects.requireNonNull(builder.pump, "pump");
    this.policies = Objects.requireNonNull(builder.policies, "policies");
    this.auditLog = Objects.requireNonNull(builder.auditLog, "auditLog");
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    if (builder.actor == null || builder.actor.isBlank()) {
      throw new IllegalArgumentException("actor must not be blank");
    }
    this.intervalMs = builder.intervalMs;
    this.actor = builder.actor;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled guardian loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("GuardianController has been closed");
    }
    if (tickTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("relay-guardian-"));
    tickTask = scheduler.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Runs the guardian once over every project with an enabled policy.
   */
  public void tick() {
    if (closed) {
      return;
    }
    try {
      for (String projectId : policies.guardedProjects()) {
        if (closed) {
          return;
        }
        try {
          if (tryRun(projectId, false).isEmpty()) {
            metrics.incrementSkippedTicks();
            logger.log(Level.FINE, "Skipping guardian run for project {0}; previous run still in flight", projectId);
          }
        } catch (RuntimeException e) {
          logger.log(Level.SEVERE, "Guardian run failed for project " + projectId, e);
        }
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Guardian tick failed", t);
    }
  }

  /**
   * Runs the guardian once over one project.
   *
   * @param dryRun plan and audit the actions without redriving or draining anything
   * @throws ConcurrencyException if a run for the project is already in flight
   */
  public GuardianRunReport runOnce(String projectId, boolean dryRun) {
    String project = Arguments.projectId(projectId);
    return tryRun(project, dryRun).orElseThrow(() ->
        new ConcurrencyException("guardian run already in progress for project " + project));
  }

  private Optional<GuardianRunReport> tryRun(String projectId, boolean dryRun) {
    if (!running.add(projectId)) {
      return Optional.empty();
    }
    try {
      return Optional.of(run(projectId, dryRun));
    } finally {
      running.remove(projectId);
    }
  }

  private GuardianRunReport run(String projectId, boolean dryRun) {
    Instant now = clock.instant();
    GuardianPolicy policy = policies.policyFor(projectId);
    if (!policy.enabled()) {
      return GuardianRunReport.disabled(projectId, now, dryRun);
    }

    List<RankedConnector> ranked = analytics.rankReliability(projectId, policy.lookbackHours());
    List<GuardianAction> candidates = ActionPlanner.selectActions(ranked, policy.riskThreshold(),
        policy.maxActionsPerProject(), policy.allowProcessQueue(), policy.allowRedriveDeadLetters());
    CooldownResult cooldown = ActionPlanner.applyCooldown(candidates,
        lastActionTimes(projectId, policy.cooldownMinutes(), now), policy.cooldownMinutes(), now);

    List<GuardianActionResult> executed = new ArrayList<>();
    for (GuardianAction action : cooldown.eligible()) {
      executed.add(execute(projectId, action, policy, dryRun));
    }
    if (!executed.isEmpty() || !cooldown.skipped().isEmpty()) {
      logger.log(Level.INFO, "Guardian run for project {0}{1}: {2} executed, {3} in cooldown", new Object[] {
          projectId, dryRun ? " (dry run)" : "", executed.size(), cooldown.skipped().size()});
    }
    return new GuardianRunReport(projectId, now, dryRun, true, candidates, executed, cooldown.skipped());
  }

  private GuardianActionResult execute(String projectId, GuardianAction action, GuardianPolicy policy,
      boolean dryRun) {
    String type = action.connectorType();
    try {
      int affected = dryRun ? plannedImpact(projectId, action, policy) : perform(projectId, action, policy);
      auditLog.appendEvent(projectId, actor,
          new AuditPayload.GuardianActionExecuted(type, action.action(), action.riskScore(), affected, dryRun));
      if (!dryRun) {
        metrics.incrementGuardianActions();
      }
      return new GuardianActionResult(action, affected, null);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Guardian action " + action.action().wireName() + " failed for "
          + projectId + "/" + type, e);
      String error = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
      auditLog.appendEvent(projectId, actor, new AuditPayload.GuardianActionFailed(type, action.action(), error));
      return new GuardianActionResult(action, 0, error);
    }
  }

  private int perform(String projectId, GuardianAction action, GuardianPolicy policy) {
    String type = action.connectorType();
    if (action.action() == Recommendation.REDRIVE_DEAD_LETTERS) {
      List<ConnectorDelivery> redriven = deliveryQueue.redriveDeadLetters(projectId, type,
          policy.actionLimit(), policy.minDeadLetterMinutes(), actor);
      if (!redriven.isEmpty()) {
        pump.drain(projectId, type, redriven.size());
      }
      return redriven.size();
    }
    ConnectorDrain drained = pump.drain(projectId, type, policy.actionLimit());
    return drained.attempted();
  }

  private int plannedImpact(String projectId, GuardianAction action, GuardianPolicy policy) {
    DeliverySummary summary = deliveryQueue.summarize(projectId, action.connectorType());
    int backlog = action.action() == Recommendation.REDRIVE_DEAD_LETTERS ? summary.deadLettered() : summary.dueNow();
    return Math.min(backlog, policy.actionLimit());
  }

  /**
   * Latest real (non dry-run) guardian action per connector, executed or failed, within the
   * cooldown window ending at {@code now}.
   */
  private Map<String, Instant> lastActionTimes(String projectId, int cooldownMinutes, Instant now) {
    Map<String, Instant> last = new HashMap<>();
    if (cooldownMinutes <= 0) {
      return last;
    }
    Instant since = now.minus(Duration.ofMinutes(cooldownMinutes));
    for (AuditEvent event : auditLog.listEvents(projectId, ACTION_EVENT_TYPES, since, COOLDOWN_EVENT_LIMIT)) {
      if (event.payload() instanceof AuditPayload.GuardianActionExecuted executed && !executed.dryRun()) {
        last.merge(executed.connectorType(), event.createdAt(), GuardianController::later);
      } else if (event.payload() instanceof AuditPayload.GuardianActionFailed failed) {
        last.merge(failed.connectorType(), event.createdAt(), GuardianController::later);
      }
    }
    return last;
  }

  private static Instant later(Instant a, Instant b) {
    return a.isAfter(b) ? a : b;
  }

  /**
   * Cancels the guardian schedule and shuts down the scheduler thread.
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
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Builder for {@link GuardianController}.
   */
  public static final class Builder {
    private ConnectorAnalytics analytics;
    private DeliveryQueue deliveryQueue;
    private DeliveryPump pump;
    private GuardianPolicies policies;
    private AuditLog auditLog;
    private MetricsExporter metrics;
    private Clock clock;
    private String actor = DEFAULT_ACTOR;
    private long intervalMs = 60_000L;

    private Builder() {
    }

    /** <b>Required.</b> Source of the reliability ranking. */
    public Builder analytics(ConnectorAnalytics analytics) {
      this.analytics = analytics;
      return this;
    }

    /** <b>Required.</b> Used to redrive dead letters. */
    public Builder deliveryQueue(DeliveryQueue deliveryQueue) {
      this.deliveryQueue = deliveryQueue;
      return this;
    }

    /** <b>Required.</b> Used to drain queues. */
    public Builder pump(DeliveryPump pump) {
      this.pump = pump;
      return this;
    }

    /** <b>Required.</b> */
    public Builder policies(GuardianPolicies policies) {
      this.policies = policies;
      return this;
    }

    /** <b>Required.</b> Actions are audited here, and cooldowns are derived from it. */
    public Builder auditLog(AuditLog auditLog) {
      this.auditLog = auditLog;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to the UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Optional. Actor recorded on guardian audit events. Defaults to {@code "guardian"}. */
    public Builder actor(String actor) {
      this.actor = actor;
      return this;
    }

    /** Optional. Defaults to {@code 60000} ms. Must be &gt; 0. */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    public GuardianController build() {
      return new GuardianController(this);
    }
  }
}
