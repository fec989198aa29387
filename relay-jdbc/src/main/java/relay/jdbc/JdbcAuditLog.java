package relay.jdbc;

import com.github.f4b6a3.ulid.UlidCreator;
import relay.audit.AuditEvent;
import relay.audit.AuditPayload;
import relay.spi.AuditLog;
import relay.spi.ConnectionProvider;
import relay.util.ConnectionTemplate;
import relay.util.JsonCodec;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@link AuditLog} persisted to the {@code audit_event} table.
 *
 * <p>Payloads are stored as flat JSON objects and decoded back through
 * {@link AuditPayload#decode}. Event ids are monotonic ULIDs, so ordering by id is ordering by
 * append time.
 */
public final class JdbcAuditLog implements AuditLog {
  private final ConnectionProvider connections;
  private final TableNames tables;
  private final JsonCodec jsonCodec;
  private final Clock clock;

  public JdbcAuditLog(ConnectionProvider connections) {
    this(connections, TableNames.defaults(), JsonCodec.getDefault(), Clock.systemUTC());
  }

  public JdbcAuditLog(ConnectionProvider connections, TableNames tables, JsonCodec jsonCodec, Clock clock) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public AuditEvent appendEvent(String projectId, String actor, AuditPayload payload) {
    AuditEvent event = new AuditEvent(UlidCreator.getMonotonicUlid().toString(), projectId, actor, payload,
        clock.instant());
    String sql = "INSERT INTO " + tables.auditEvents()
        + " (id, project_id, actor, event_type, metadata, created_at) VALUES (?,?,?,?,?,?)";
    ConnectionTemplate.withConnection(connections, "append audit event", conn ->
        JdbcTemplate.update(conn, sql, event.id(), projectId, actor, payload.eventType(),
            jsonCodec.toJson(payload.toMetadata()), Timestamp.from(event.createdAt())));
    return event;
  }

  @Override
  public List<AuditEvent> listEvents(String projectId, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    String sql = "SELECT id, project_id, actor, event_type, metadata, created_at FROM " + tables.auditEvents()
        + " WHERE project_id=? ORDER BY id DESC LIMIT ?";
    return ConnectionTemplate.withConnection(connections, "list audit events", conn ->
        JdbcTemplate.query(conn, sql, this::mapEvent, projectId, limit));
  }

  @Override
  public List<AuditEvent> listEvents(String projectId, Set<String> eventTypes, Instant since, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    if (eventTypes.isEmpty()) {
      throw new IllegalArgumentException("eventTypes must not be empty");
    }
    List<Object> params = new ArrayList<>();
    params.add(projectId);
    params.addAll(eventTypes);
    StringBuilder sql = new StringBuilder("SELECT id, project_id, actor, event_type, metadata, created_at FROM ")
        .append(tables.auditEvents())
        .append(" WHERE project_id=? AND event_type IN (")
        .append(String.join(",", Collections.nCopies(eventTypes.size(), "?")))
        .append(")");
    if (since != null) {
      sql.append(" AND created_at>=?");
      params.add(Timestamp.from(since));
    }
    sql.append(" ORDER BY id DESC LIMIT ?");
    params.add(limit);
    return ConnectionTemplate.withConnection(connections, "list audit events by type", conn ->
        JdbcTemplate.query(conn, sql.toString(), this::mapEvent, params.toArray()));
  }

  private AuditEvent mapEvent(ResultSet rs) throws SQLException {
    return new AuditEvent(
        rs.getString("id"),
        rs.getString("project_id"),
        rs.getString("actor"),
        AuditPayload.decode(rs.getString("event_type"), jsonCodec.parseObject(rs.getString("metadata"))),
        rs.getTimestamp("created_at").toInstant());
  }
}
