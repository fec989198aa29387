package relay.support;

import relay.model.ConnectorDelivery;
import relay.model.DeliveryAttempt;
import relay.model.DeliveryStatus;
import relay.model.DeliverySummary;
import relay.model.DeliveryTransition;
import relay.spi.ConnectionProvider;
import relay.spi.DeliveryStore;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Heap-backed DeliveryStore for unit tests that don't need real JDBC. Honors the same
 * compare-and-set rules as the JDBC stores.
 */
public class InMemoryDeliveryStore implements DeliveryStore {
  private final Map<String, ConnectorDelivery> rows = new LinkedHashMap<>();
  private final Map<String, List<DeliveryAttempt>> attempts = new LinkedHashMap<>();
  private final Map<String, String> leases = new LinkedHashMap<>();
  public final AtomicInteger transitions = new AtomicInteger();

  public static ConnectionProvider connections() {
    return () -> (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> null);
  }

  /** Stores a row as-is, bypassing the dedup check. */
  public synchronized void put(ConnectorDelivery delivery) {
    rows.put(delivery.id(), delivery);
  }

  public synchronized void putAttempt(DeliveryAttempt attempt) {
    attempts.computeIfAbsent(attempt.deliveryId(), k -> new ArrayList<>()).add(attempt);
  }

  public synchronized ConnectorDelivery get(String id) {
    return rows.get(id);
  }

  @Override
  public synchronized void insertDelivery(Connection conn, ConnectorDelivery delivery) {
    if (delivery.idempotencyKey() != null && findByIdempotencyKey(conn, delivery.projectId(),
        delivery.connectorType(), delivery.idempotencyKey()).isPresent()) {
      throw new IllegalStateException("duplicate idempotency key " + delivery.idempotencyKey());
    }
    rows.put(delivery.id(), delivery);
  }

  @Override
  public synchronized Optional<ConnectorDelivery> findById(Connection conn, String deliveryId) {
    return Optional.ofNullable(rows.get(deliveryId));
  }

  @Override
  public synchronized Optional<ConnectorDelivery> findByIdempotencyKey(Connection conn, String projectId,
      String connectorType, String idempotencyKey) {
    return rows.values().stream()
        .filter(d -> d.projectId().equals(projectId) && d.connectorType().equals(connectorType)
            && idempotencyKey.equals(d.idempotencyKey()))
        .findFirst();
  }

  @Override
  public synchronized Optional<ConnectorDelivery> findByPayloadHash(Connection conn, String projectId,
      String connectorType, String payloadHash) {
    return rows.values().stream()
        .filter(d -> d.projectId().equals(projectId) && d.connectorType().equals(connectorType)
            && d.payloadHash().equals(payloadHash))
        .findFirst();
  }

  @Override
  public synchronized List<ConnectorDelivery> listDeliveries(Connection conn, String projectId,
      String connectorType, int limit) {
    return rows.values().stream()
        .filter(d -> d.projectId().equals(projectId)
            && (connectorType == null || d.connectorType().equals(connectorType)))
        .sorted(Comparator.comparing(ConnectorDelivery::createdAt).reversed())
        .limit(limit)
        .collect(Collectors.toList());
  }

  @Override
  public synchronized List<ConnectorDelivery> listDue(Connection conn, String projectId, String connectorType,
      Instant now, int limit) {
    return due(projectId, connectorType, now).limit(limit).collect(Collectors.toList());
  }

  @Override
  public synchronized List<ConnectorDelivery> claimDue(Connection conn, String ownerId, String projectId,
      String connectorType, Instant now, Instant lockExpiry, int limit) {
    List<ConnectorDelivery> claimed = due(projectId, connectorType, now)
        .filter(d -> !leases.containsKey(d.id()) || leases.get(d.id()).equals(ownerId))
        .limit(limit)
        .collect(Collectors.toList());
    claimed.forEach(d -> leases.put(d.id(), ownerId));
    return claimed;
  }

  private Stream<ConnectorDelivery> due(String projectId, String connectorType, Instant now) {
    return rows.values().stream()
        .filter(d -> d.projectId().equals(projectId) && d.connectorType().equals(connectorType) && d.isDue(now))
        .sorted(Comparator.comparing(ConnectorDelivery::nextAttemptAt));
  }

  @Override
  public synchronized List<ConnectorDelivery> listDeadLettered(Connection conn, String projectId,
      String connectorType, Instant deadBefore, int limit) {
    return rows.values().stream()
        .filter(d -> d.projectId().equals(projectId) && d.connectorType().equals(connectorType)
            && d.status() == DeliveryStatus.DEAD_LETTERED && !d.updatedAt().isAfter(deadBefore))
        .sorted(Comparator.comparing(ConnectorDelivery::updatedAt))
        .limit(limit)
        .collect(Collectors.toList());
  }

  @Override
  public synchronized List<String> listProjectsWithPending(Connection conn) {
    return new ArrayList<>(rows.values().stream()
        .filter(d -> d.status().isPending())
        .map(ConnectorDelivery::projectId)
        .collect(Collectors.toCollection(TreeSet::new)));
  }

  @Override
  public synchronized List<String> listConnectorTypes(Connection conn, String projectId) {
    return new ArrayList<>(rows.values().stream()
        .filter(d -> d.projectId().equals(projectId))
        .map(ConnectorDelivery::connectorType)
        .collect(Collectors.toCollection(TreeSet::new)));
  }

  @Override
  public synchronized DeliverySummary summarize(Connection conn, String projectId, String connectorType,
      Instant now) {
    List<ConnectorDelivery> matching = rows.values().stream()
        .filter(d -> d.projectId().equals(projectId) && d.connectorType().equals(connectorType))
        .collect(Collectors.toList());
    return DeliverySummary.of(connectorType, matching, now);
  }

  @Override
  public synchronized List<DeliveryAttempt> listAttempts(Connection conn, String deliveryId) {
    return List.copyOf(attempts.getOrDefault(deliveryId, List.of()));
  }

  @Override
  public synchronized void recordAttempt(Connection conn, DeliveryAttempt attempt) {
    putAttempt(attempt);
  }

  @Override
  public synchronized int transitionDelivery(Connection conn, String deliveryId, DeliveryTransition transition,
      Instant now) {
    ConnectorDelivery current = rows.get(deliveryId);
    if (current == null
        || current.attemptCount() != transition.expectedAttemptCount()
        || !transition.status().legalSources().contains(current.status())) {
      return 0;
    }
    rows.put(deliveryId, current.apply(transition, now));
    leases.remove(deliveryId);
    transitions.incrementAndGet();
    return 1;
  }

  public synchronized List<ConnectorDelivery> all() {
    return List.copyOf(rows.values());
  }

  public synchronized long count(DeliveryStatus status) {
    return rows.values().stream().filter(d -> Objects.equals(d.status(), status)).count();
  }
}
