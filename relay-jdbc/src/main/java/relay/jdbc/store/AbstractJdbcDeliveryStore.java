package relay.jdbc.store;

import relay.jdbc.JdbcTemplate;
import relay.jdbc.TableNames;
import relay.model.ConnectorDelivery;
import relay.model.DeliveryAttempt;
import relay.model.DeliveryStatus;
import relay.model.DeliverySummary;
import relay.model.DeliveryTransition;
import relay.spi.DeliveryStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static relay.jdbc.JdbcTemplate.instant;
import static relay.jdbc.JdbcTemplate.nullableInt;
import static relay.jdbc.JdbcTemplate.timestamp;

/**
 * Base JDBC delivery store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #claimDue} to provide database-specific claim strategies.
 * Register custom implementations via
 * {@code META-INF/services/relay.jdbc.store.AbstractJdbcDeliveryStore}.
 *
 * @see JdbcDeliveryStores
 */
public abstract class AbstractJdbcDeliveryStore implements DeliveryStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String PENDING_STATUS_IN =
      "(" + DeliveryStatus.QUEUED.code() + "," + DeliveryStatus.RETRYING.code() + ")";

  /** Queued rows are always due; retrying rows once their backoff has elapsed. */
  protected static final String DUE_PREDICATE =
      "(status=" + DeliveryStatus.QUEUED.code()
          + " OR (status=" + DeliveryStatus.RETRYING.code() + " AND next_attempt_at <= ?))";

  protected static final String DELIVERY_COLUMNS =
      "id, project_id, connector_type, idempotency_key, payload_hash, payload, status, "
          + "attempt_count, max_attempts, last_status_code, last_error, next_attempt_at, "
          + "dead_letter_reason, delivered_at, created_at, updated_at";

  protected static final JdbcTemplate.RowMapper<ConnectorDelivery> DELIVERY_ROW_MAPPER = rs -> new ConnectorDelivery(
      rs.getString("id"),
      rs.getString("project_id"),
      rs.getString("connector_type"),
      rs.getString("idempotency_key"),
      rs.getString("payload_hash"),
      rs.getString("payload"),
      DeliveryStatus.fromCode(rs.getInt("status")),
      rs.getInt("attempt_count"),
      rs.getInt("max_attempts"),
      nullableInt(rs, "last_status_code"),
      rs.getString("last_error"),
      instant(rs, "next_attempt_at"),
      rs.getString("dead_letter_reason"),
      instant(rs, "delivered_at"),
      instant(rs, "created_at"),
      instant(rs, "updated_at"));

  private static final JdbcTemplate.RowMapper<DeliveryAttempt> ATTEMPT_ROW_MAPPER = rs -> new DeliveryAttempt(
      rs.getString("id"),
      rs.getString("delivery_id"),
      instant(rs, "attempted_at"),
      nullableInt(rs, "status_code"),
      rs.getString("error"),
      rs.getLong("latency_ms"));

  private final TableNames tables;

  protected AbstractJdbcDeliveryStore() {
    this(TableNames.defaults());
  }

  protected AbstractJdbcDeliveryStore(TableNames tables) {
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  /**
   * Unique identifier for this delivery store (e.g., "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this delivery store handles (e.g., "jdbc:postgresql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect reading and writing the given tables.
   */
  public abstract AbstractJdbcDeliveryStore withTables(TableNames tables);

  public TableNames tables() {
    return tables;
  }

  protected String tableName() {
    return tables.deliveries();
  }

  @Override
  public void insertDelivery(Connection conn, ConnectorDelivery d) {
    String sql = "INSERT INTO " + tableName() + " (" + DELIVERY_COLUMNS + ", locked_by, locked_at)"
        + " VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,NULL,NULL)";
    JdbcTemplate.update(conn, sql,
        d.id(), d.projectId(), d.connectorType(), d.idempotencyKey(), d.payloadHash(), d.payloadJson(),
        d.status().code(), d.attemptCount(), d.maxAttempts(), d.lastStatusCode(), truncateError(d.lastError()),
        timestamp(d.nextAttemptAt()), truncateError(d.deadLetterReason()), timestamp(d.deliveredAt()),
        timestamp(d.createdAt()), timestamp(d.updatedAt()));
  }

  @Override
  public Optional<ConnectorDelivery> findById(Connection conn, String deliveryId) {
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + tableName() + " WHERE id=?";
    return first(JdbcTemplate.query(conn, sql, DELIVERY_ROW_MAPPER, deliveryId));
  }

  @Override
  public Optional<ConnectorDelivery> findByIdempotencyKey(Connection conn, String projectId,
      String connectorType, String idempotencyKey) {
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + tableName()
        + " WHERE project_id=? AND connector_type=? AND idempotency_key=?";
    return first(JdbcTemplate.query(conn, sql, DELIVERY_ROW_MAPPER, projectId, connectorType, idempotencyKey));
  }

  @Override
  public Optional<ConnectorDelivery> findByPayloadHash(Connection conn, String projectId,
      String connectorType, String payloadHash) {
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + tableName()
        + " WHERE project_id=? AND connector_type=? AND payload_hash=? ORDER BY created_at, id LIMIT 1";
    return first(JdbcTemplate.query(conn, sql, DELIVERY_ROW_MAPPER, projectId, connectorType, payloadHash));
  }

  @Override
  public List<ConnectorDelivery> listDeliveries(Connection conn, String projectId, String connectorType, int limit) {
    if (connectorType == null) {
      String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + tableName()
          + " WHERE project_id=? ORDER BY created_at DESC, id DESC LIMIT ?";
      return JdbcTemplate.query(conn, sql, DELIVERY_ROW_MAPPER, projectId, limit);
    }
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + tableName()
        + " WHERE project_id=? AND connector_type=? ORDER BY created_at DESC, id DESC LIMIT ?";
    return JdbcTemplate.query(conn, sql, DELIVERY_ROW_MAPPER, projectId, connectorType, limit);
  }

  @Override
  public List<ConnectorDelivery> listDue(Connection conn, String projectId, String connectorType,
      Instant now, int limit) {
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + tableName()
        + " WHERE project_id=? AND connector_type=? AND " + DUE_PREDICATE
        + " ORDER BY next_attempt_at, id LIMIT ?";
    return JdbcTemplate.query(conn, sql, DELIVERY_ROW_MAPPER, projectId, connectorType, Timestamp.from(now), limit);
  }

  @Override
  public List<ConnectorDelivery> claimDue(Connection conn, String ownerId, String projectId,
      String connectorType, Instant now, Instant lockExpiry, int limit) {
    // Truncate to millis so the stored lease matches the follow-up query
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    // Phase 1: UPDATE with subquery (H2-compatible default)
    String claimSql = "UPDATE " + tableName() + " SET locked_by=?, locked_at=? "
        + "WHERE id IN ("
        + "SELECT id FROM " + tableName()
        + " WHERE project_id=? AND connector_type=? AND " + DUE_PREDICATE
        + " AND (locked_by IS NULL OR locked_at < ?)"
        + " ORDER BY next_attempt_at, id LIMIT ?)";
    int updated = JdbcTemplate.update(conn, claimSql,
        ownerId, Timestamp.from(nowMs), projectId, connectorType, Timestamp.from(now),
        Timestamp.from(lockExpiry), limit);
    if (updated == 0) return List.of();
    // Phase 2: SELECT rows leased in this cycle
    return selectClaimed(conn, ownerId, nowMs);
  }

  /**
   * Selects rows leased by the given owner at the given lock timestamp.
   * Shared by subclasses that use a two-phase claim (UPDATE then SELECT).
   */
  protected List<ConnectorDelivery> selectClaimed(Connection conn, String ownerId, Instant lockedAt) {
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + tableName()
        + " WHERE locked_by=? AND locked_at=? ORDER BY next_attempt_at, id";
    return JdbcTemplate.query(conn, sql, DELIVERY_ROW_MAPPER, ownerId, Timestamp.from(lockedAt));
  }

  @Override
  public List<ConnectorDelivery> listDeadLettered(Connection conn, String projectId, String connectorType,
      Instant deadBefore, int limit) {
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + tableName()
        + " WHERE project_id=? AND connector_type=? AND status=" + DeliveryStatus.DEAD_LETTERED.code()
        + " AND updated_at <= ? ORDER BY updated_at, id LIMIT ?";
    return JdbcTemplate.query(conn, sql, DELIVERY_ROW_MAPPER, projectId, connectorType,
        Timestamp.from(deadBefore), limit);
  }

  @Override
  public List<String> listProjectsWithPending(Connection conn) {
    String sql = "SELECT DISTINCT project_id FROM " + tableName()
        + " WHERE status IN " + PENDING_STATUS_IN + " ORDER BY project_id";
    return JdbcTemplate.query(conn, sql, rs -> rs.getString("project_id"));
  }

  @Override
  public List<String> listConnectorTypes(Connection conn, String projectId) {
    String sql = "SELECT DISTINCT connector_type FROM " + tableName()
        + " WHERE project_id=? ORDER BY connector_type";
    return JdbcTemplate.query(conn, sql, rs -> rs.getString("connector_type"), projectId);
  }

  @Override
  public DeliverySummary summarize(Connection conn, String projectId, String connectorType, Instant now) {
    String sql = "SELECT COUNT(*) AS total, "
        + countWhere("status=" + DeliveryStatus.QUEUED.code()) + " AS queued, "
        + countWhere("status=" + DeliveryStatus.RETRYING.code()) + " AS retrying, "
        + countWhere("status=" + DeliveryStatus.DELIVERED.code()) + " AS delivered, "
        + countWhere("status=" + DeliveryStatus.DEAD_LETTERED.code()) + " AS dead_lettered, "
        + countWhere(DUE_PREDICATE) + " AS due_now, "
        + "MIN(next_attempt_at) AS earliest_next_attempt_at "
        + "FROM " + tableName() + " WHERE project_id=? AND connector_type=?";
    return JdbcTemplate.query(conn, sql, rs -> new DeliverySummary(connectorType,
            rs.getInt("total"),
            rs.getInt("queued"),
            rs.getInt("retrying"),
            rs.getInt("delivered"),
            rs.getInt("dead_lettered"),
            rs.getInt("due_now"),
            instant(rs, "earliest_next_attempt_at")),
        Timestamp.from(now), projectId, connectorType).get(0);
  }

  @Override
  public List<DeliveryAttempt> listAttempts(Connection conn, String deliveryId) {
    String sql = "SELECT id, delivery_id, attempted_at, status_code, error, latency_ms FROM "
        + tables.attempts() + " WHERE delivery_id=? ORDER BY attempted_at, id";
    return JdbcTemplate.query(conn, sql, ATTEMPT_ROW_MAPPER, deliveryId);
  }

  @Override
  public void recordAttempt(Connection conn, DeliveryAttempt attempt) {
    String sql = "INSERT INTO " + tables.attempts()
        + " (id, delivery_id, attempted_at, status_code, error, latency_ms) VALUES (?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql, attempt.id(), attempt.deliveryId(), Timestamp.from(attempt.attemptedAt()),
        attempt.statusCode(), truncateError(attempt.error()), attempt.latencyMs());
  }

  @Override
  public int transitionDelivery(Connection conn, String deliveryId, DeliveryTransition t, Instant now) {
    String sources = t.status().legalSources().stream()
        .map(s -> Integer.toString(s.code()))
        .sorted()
        .collect(Collectors.joining(",", "(", ")"));
    String sql = "UPDATE " + tableName()
        + " SET status=?, attempt_count=?, last_status_code=?, last_error=?, next_attempt_at=?,"
        + " dead_letter_reason=?, delivered_at=?, updated_at=?, locked_by=NULL, locked_at=NULL"
        + " WHERE id=? AND attempt_count=? AND status IN " + sources;
    return JdbcTemplate.update(conn, sql,
        t.status().code(), t.attemptCount(), t.lastStatusCode(), truncateError(t.lastError()),
        timestamp(t.nextAttemptAt()), truncateError(t.deadLetterReason()), timestamp(t.deliveredAt()),
        Timestamp.from(now), deliveryId, t.expectedAttemptCount());
  }

  private static String countWhere(String predicate) {
    return "COALESCE(SUM(CASE WHEN " + predicate + " THEN 1 ELSE 0 END), 0)";
  }

  private static <T> Optional<T> first(List<T> rows) {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
