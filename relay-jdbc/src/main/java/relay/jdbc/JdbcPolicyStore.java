package relay.jdbc;

import relay.StoreException;
import relay.backpressure.BackpressureDraft;
import relay.backpressure.BackpressurePolicy;
import relay.backpressure.PolicyMetadata;
import relay.guardian.GuardianPolicy;
import relay.spi.ConnectionProvider;
import relay.spi.PolicyStore;
import relay.util.ConnectionTemplate;
import relay.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link PolicyStore} persisted to the {@code backpressure_policy}, {@code backpressure_draft}
 * and {@code guardian_policy} tables.
 *
 * <p>Each row holds its document as a flat JSON object (see {@link PolicyMetadata}) next to a
 * {@code version} column used for compare-and-set. A first write races on the primary key; the
 * loser sees {@code false}.
 */
public final class JdbcPolicyStore implements PolicyStore {
  private final ConnectionProvider connections;
  private final TableNames tables;
  private final JsonCodec jsonCodec;
  private final Clock clock;

  public JdbcPolicyStore(ConnectionProvider connections) {
    this(connections, TableNames.defaults(), JsonCodec.getDefault(), Clock.systemUTC());
  }

  public JdbcPolicyStore(ConnectionProvider connections, TableNames tables, JsonCodec jsonCodec, Clock clock) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Optional<BackpressurePolicy> findPolicy(String projectId) {
    String sql = "SELECT document FROM " + tables.policies() + " WHERE project_id=?";
    return ConnectionTemplate.withConnection(connections, "load backpressure policy", conn ->
        first(JdbcTemplate.query(conn, sql,
            rs -> PolicyMetadata.decodePolicy(projectId, jsonCodec.parseObject(rs.getString("document"))),
            projectId)));
  }

  @Override
  public Optional<BackpressureDraft> findDraft(String projectId) {
    String sql = "SELECT document FROM " + tables.drafts() + " WHERE project_id=?";
    return ConnectionTemplate.withConnection(connections, "load backpressure draft", conn ->
        first(JdbcTemplate.query(conn, sql,
            rs -> PolicyMetadata.decodeDraft(projectId, jsonCodec.parseObject(rs.getString("document"))),
            projectId)));
  }

  @Override
  public List<BackpressureDraft> listDrafts() {
    String sql = "SELECT project_id, document FROM " + tables.drafts() + " ORDER BY project_id";
    return ConnectionTemplate.withConnection(connections, "list backpressure drafts", conn ->
        JdbcTemplate.query(conn, sql, rs -> PolicyMetadata.decodeDraft(rs.getString("project_id"),
            jsonCodec.parseObject(rs.getString("document")))));
  }

  @Override
  public boolean saveDraft(BackpressureDraft draft, long expectedVersion) {
    String document = jsonCodec.toJson(PolicyMetadata.encodeDraft(draft));
    Timestamp updatedAt = Timestamp.from(draft.updatedAt());
    return ConnectionTemplate.withConnection(connections, "save backpressure draft", conn -> {
      if (expectedVersion == 0L) {
        return insertIfAbsent(conn, "INSERT INTO " + tables.drafts()
                + " (project_id, version, document, updated_at) VALUES (?,?,?,?)",
            draft.projectId(), draft.version(), document, updatedAt);
      }
      return JdbcTemplate.update(conn, "UPDATE " + tables.drafts()
              + " SET version=?, document=?, updated_at=? WHERE project_id=? AND version=?",
          draft.version(), document, updatedAt, draft.projectId(), expectedVersion) == 1;
    });
  }

  @Override
  public boolean applyDraft(String projectId, long expectedDraftVersion, BackpressurePolicy policy,
      long expectedPolicyVersion) {
    try (Connection conn = connections.getConnection()) {
      conn.setAutoCommit(false);
      try {
        boolean applied = applyDraft(conn, projectId, expectedDraftVersion, policy, expectedPolicyVersion);
        if (applied) {
          conn.commit();
        } else {
          conn.rollback();
        }
        return applied;
      } catch (RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new StoreException("Failed to apply backpressure draft", e);
    }
  }

  private boolean applyDraft(Connection conn, String projectId, long expectedDraftVersion,
      BackpressurePolicy policy, long expectedPolicyVersion) {
    int deleted = JdbcTemplate.update(conn,
        "DELETE FROM " + tables.drafts() + " WHERE project_id=? AND version=?",
        projectId, expectedDraftVersion);
    if (deleted != 1) {
      return false;
    }
    String document = jsonCodec.toJson(PolicyMetadata.encodePolicy(policy));
    Instant updatedAt = policy.updatedAt() != null ? policy.updatedAt() : clock.instant();
    if (expectedPolicyVersion == 0L) {
      return insertIfAbsent(conn, "INSERT INTO " + tables.policies()
              + " (project_id, version, document, updated_at) VALUES (?,?,?,?)",
          projectId, policy.version(), document, Timestamp.from(updatedAt));
    }
    return JdbcTemplate.update(conn, "UPDATE " + tables.policies()
            + " SET version=?, document=?, updated_at=? WHERE project_id=? AND version=?",
        policy.version(), document, Timestamp.from(updatedAt), projectId, expectedPolicyVersion) == 1;
  }

  @Override
  public Optional<GuardianPolicy> findGuardianPolicy(String projectId) {
    String sql = "SELECT document FROM " + tables.guardianPolicies() + " WHERE project_id=?";
    return ConnectionTemplate.withConnection(connections, "load guardian policy", conn ->
        first(JdbcTemplate.query(conn, sql,
            rs -> GuardianPolicy.fromMetadata(projectId, jsonCodec.parseObject(rs.getString("document"))),
            projectId)));
  }

  @Override
  public void saveGuardianPolicy(GuardianPolicy policy) {
    String document = jsonCodec.toJson(policy.toMetadata());
    Timestamp now = Timestamp.from(clock.instant());
    String updateSql = "UPDATE " + tables.guardianPolicies()
        + " SET is_enabled=?, document=?, updated_at=? WHERE project_id=?";
    ConnectionTemplate.withConnection(connections, "save guardian policy", conn -> {
      if (JdbcTemplate.update(conn, updateSql, policy.enabled(), document, now, policy.projectId()) == 1) {
        return null;
      }
      boolean inserted = insertIfAbsent(conn, "INSERT INTO " + tables.guardianPolicies()
              + " (project_id, is_enabled, document, updated_at) VALUES (?,?,?,?)",
          policy.projectId(), policy.enabled(), document, now);
      if (!inserted) {
        // Lost the first-write race; last writer wins.
        JdbcTemplate.update(conn, updateSql, policy.enabled(), document, now, policy.projectId());
      }
      return null;
    });
  }

  @Override
  public List<String> listGuardedProjects() {
    String sql = "SELECT project_id FROM " + tables.guardianPolicies()
        + " WHERE is_enabled=? ORDER BY project_id";
    return ConnectionTemplate.withConnection(connections, "list guarded projects", conn ->
        JdbcTemplate.query(conn, sql, rs -> rs.getString("project_id"), Boolean.TRUE));
  }

  private static boolean insertIfAbsent(Connection conn, String sql, Object... params) {
    try {
      return JdbcTemplate.update(conn, sql, params) == 1;
    } catch (StoreException e) {
      if (JdbcTemplate.isConstraintViolation(e)) {
        return false;
      }
      throw e;
    }
  }

  private static <T> Optional<T> first(List<T> rows) {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }
}
