package relay.delivery;

import com.github.f4b6a3.ulid.UlidCreator;
import relay.ControlPlaneConfig;
import relay.NotFoundException;
import relay.ValidationException;
import relay.audit.AuditPayload;
import relay.model.ConnectorDelivery;
import relay.model.DeliveryAttempt;
import relay.model.DeliverySummary;
import relay.model.EnqueueResult;
import relay.model.NewDelivery;
import relay.spi.AuditLog;
import relay.spi.ConnectionProvider;
import relay.spi.DeliveryStore;
import relay.spi.MetricsExporter;
import relay.util.Arguments;
import relay.util.ConnectionTemplate;
import relay.util.Hashing;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Write and read facade over the delivery store: deduplicating enqueue, dead-letter redrive and
 * queue summaries.
 *
 * <p>An enqueue with an idempotency key returns the existing delivery for that key. Without a
 * key, a delivery with the same payload hash for the same project and connector is returned
 * instead. Either way the result is flagged as a duplicate and nothing is written.
 */
public final class DeliveryQueue {
  private static final Logger logger = Logger.getLogger(DeliveryQueue.class.getName());

  public static final String SYSTEM_ACTOR = "system";
  public static final int MAX_LIST_LIMIT = 1000;
  public static final int MAX_REDRIVE_LIMIT = 100;
  public static final int MAX_DEAD_LETTER_AGE_MINUTES = 10_080;

  private final ConnectionProvider connectionProvider;
  private final DeliveryStore deliveryStore;
  private final AuditLog auditLog;
  private final DeliveryStateMachine stateMachine;
  private final ControlPlaneConfig config;
  private final Clock clock;
  private final MetricsExporter metrics;

  public DeliveryQueue(ConnectionProvider connectionProvider, DeliveryStore deliveryStore, AuditLog auditLog,
      DeliveryStateMachine stateMachine, ControlPlaneConfig config, Clock clock, MetricsExporter metrics) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.deliveryStore = Objects.requireNonNull(deliveryStore, "deliveryStore");
    this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
    this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  public EnqueueResult enqueue(NewDelivery request) {
    Objects.requireNonNull(request, "request");
    String projectId = Arguments.projectId(request.projectId());
    String connectorType = Arguments.connectorType(request.connectorType());
    String key = Arguments.idempotencyKey(request.idempotencyKey());
    int maxAttempts = request.maxAttempts() == null
        ? config.getDefaultMaxAttempts()
        : Arguments.range("max_attempts", request.maxAttempts(), 1, ControlPlaneConfig.MAX_ATTEMPTS_UPPER_BOUND);
    String payloadHash = Hashing.sha256Hex(request.payloadJson());
    Instant now = clock.instant();

    EnqueueResult result = ConnectionTemplate.withConnection(connectionProvider, "enqueue delivery", conn -> {
      Optional<ConnectorDelivery> existing = findExisting(conn, projectId, connectorType, key, payloadHash);
      if (existing.isPresent()) {
        return new EnqueueResult(existing.get(), true);
      }
      ConnectorDelivery delivery = ConnectorDelivery.queued(UlidCreator.getMonotonicUlid().toString(),
          projectId, connectorType, key, payloadHash, request.payloadJson(), maxAttempts, now);
      try {
        deliveryStore.insertDelivery(conn, delivery);
      } catch (RuntimeException e) {
        // A concurrent enqueue may have won the unique index on the idempotency key.
        Optional<ConnectorDelivery> raced = findExisting(conn, projectId, connectorType, key, payloadHash);
        if (raced.isPresent()) {
          return new EnqueueResult(raced.get(), true);
        }
        throw e;
      }
      return new EnqueueResult(delivery, false);
    });

    if (result.duplicate()) {
      metrics.incrementDuplicates();
      logger.log(Level.FINE, "Duplicate enqueue for project {0} connector {1} answered with {2}",
          new Object[] {projectId, connectorType, result.delivery().id()});
    } else {
      metrics.incrementEnqueued();
      auditLog.appendEvent(projectId, SYSTEM_ACTOR,
          new AuditPayload.DeliveryQueued(result.delivery().id(), connectorType, false));
    }
    return result;
  }

  /**
   * Returns up to {@code limit} dead letters of one connector, dead for at least
   * {@code minDeadLetterMinutes}, to the queue with a fresh attempt budget.
   *
   * @return the requeued deliveries; rows changed concurrently are skipped
   */
  public List<ConnectorDelivery> redriveDeadLetters(String projectId, String connectorType, int limit,
      int minDeadLetterMinutes, String actor) {
    String project = Arguments.projectId(projectId);
    String type = Arguments.connectorType(connectorType);
    Arguments.range("limit", limit, 1, MAX_REDRIVE_LIMIT);
    Arguments.range("min_dead_letter_minutes", minDeadLetterMinutes, 0, MAX_DEAD_LETTER_AGE_MINUTES);
    if (actor == null || actor.isBlank()) {
      throw new ValidationException("actor", "must not be blank");
    }
    Instant now = clock.instant();
    Instant deadBefore = now.minus(Duration.ofMinutes(minDeadLetterMinutes));

    List<ConnectorDelivery> requeued = ConnectionTemplate.withConnection(connectionProvider,
        "redrive dead letters", conn -> {
          List<ConnectorDelivery> redriven = new ArrayList<>();
          for (ConnectorDelivery dead : deliveryStore.listDeadLettered(conn, project, type, deadBefore, limit)) {
            var transition = stateMachine.requeue(dead, now);
            if (deliveryStore.transitionDelivery(conn, dead.id(), transition, now) == 1) {
              redriven.add(dead.apply(transition, now));
            }
          }
          return redriven;
        });

    for (ConnectorDelivery delivery : requeued) {
      auditLog.appendEvent(project, actor.trim(), new AuditPayload.DeliveryQueued(delivery.id(), type, true));
    }
    if (!requeued.isEmpty()) {
      metrics.incrementRedriven(requeued.size());
      logger.log(Level.INFO, "Redrove {0} dead letters for project {1} connector {2}",
          new Object[] {requeued.size(), project, type});
    }
    return requeued;
  }

  public DeliverySummary summarize(String projectId, String connectorType) {
    String project = Arguments.projectId(projectId);
    String type = Arguments.connectorType(connectorType);
    Instant now = clock.instant();
    return ConnectionTemplate.withConnection(connectionProvider, "summarize deliveries",
        conn -> deliveryStore.summarize(conn, project, type, now));
  }

  /**
   * Summarizes every connector type the project has deliveries for, keyed by type in sorted order.
   */
  public Map<String, DeliverySummary> summarizeAll(String projectId) {
    String project = Arguments.projectId(projectId);
    Instant now = clock.instant();
    return ConnectionTemplate.withConnection(connectionProvider, "summarize deliveries", conn -> {
      Map<String, DeliverySummary> summaries = new LinkedHashMap<>();
      for (String type : deliveryStore.listConnectorTypes(conn, project)) {
        summaries.put(type, deliveryStore.summarize(conn, project, type, now));
      }
      return summaries;
    });
  }

  public List<ConnectorDelivery> listDeliveries(String projectId, String connectorType, int limit) {
    String project = Arguments.projectId(projectId);
    String type = connectorType == null ? null : Arguments.connectorType(connectorType);
    Arguments.range("limit", limit, 1, MAX_LIST_LIMIT);
    return ConnectionTemplate.withConnection(connectionProvider, "list deliveries",
        conn -> deliveryStore.listDeliveries(conn, project, type, limit));
  }

  public ConnectorDelivery getDelivery(String deliveryId) {
    Objects.requireNonNull(deliveryId, "deliveryId");
    return ConnectionTemplate.withConnection(connectionProvider, "load delivery",
        conn -> deliveryStore.findById(conn, deliveryId))
        .orElseThrow(() -> new NotFoundException("delivery not found: " + deliveryId));
  }

  public List<DeliveryAttempt> listAttempts(String deliveryId) {
    ConnectorDelivery delivery = getDelivery(deliveryId);
    return ConnectionTemplate.withConnection(connectionProvider, "list attempts",
        conn -> deliveryStore.listAttempts(conn, delivery.id()));
  }

  /**
   * Reads the newest {@code limit} deliveries of one connector with their attempts.
   */
  public DeliverySnapshot snapshot(String projectId, String connectorType, int limit) {
    String project = Arguments.projectId(projectId);
    String type = Arguments.connectorType(connectorType);
    Arguments.range("limit", limit, 1, MAX_LIST_LIMIT);
    return ConnectionTemplate.withConnection(connectionProvider, "load delivery snapshot", conn -> {
      List<ConnectorDelivery> deliveries = deliveryStore.listDeliveries(conn, project, type, limit);
      Map<String, List<DeliveryAttempt>> attempts = new LinkedHashMap<>();
      for (ConnectorDelivery delivery : deliveries) {
        attempts.put(delivery.id(), deliveryStore.listAttempts(conn, delivery.id()));
      }
      return new DeliverySnapshot(deliveries, attempts);
    });
  }

  public List<String> listConnectorTypes(String projectId) {
    String project = Arguments.projectId(projectId);
    return ConnectionTemplate.withConnection(connectionProvider, "list connector types",
        conn -> deliveryStore.listConnectorTypes(conn, project));
  }

  public List<String> listProjectsWithPending() {
    return ConnectionTemplate.withConnection(connectionProvider, "list projects",
        deliveryStore::listProjectsWithPending);
  }

  private Optional<ConnectorDelivery> findExisting(Connection conn, String projectId, String connectorType,
      String key, String payloadHash) {
    if (key != null) {
      return deliveryStore.findByIdempotencyKey(conn, projectId, connectorType, key);
    }
    return deliveryStore.findByPayloadHash(conn, projectId, connectorType, payloadHash);
  }
}
