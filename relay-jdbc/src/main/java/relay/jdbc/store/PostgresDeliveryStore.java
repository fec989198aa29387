package relay.jdbc.store;

import relay.jdbc.JdbcTemplate;
import relay.jdbc.TableNames;
import relay.model.ConnectorDelivery;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;

/**
 * PostgreSQL delivery store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a single-round-trip claim.
 */
public final class PostgresDeliveryStore extends AbstractJdbcDeliveryStore {

  public PostgresDeliveryStore() {
    super();
  }

  public PostgresDeliveryStore(TableNames tables) {
    super(tables);
  }

  @Override
  public AbstractJdbcDeliveryStore withTables(TableNames tables) {
    return new PostgresDeliveryStore(tables);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<ConnectorDelivery> claimDue(Connection conn, String ownerId, String projectId,
      String connectorType, Instant now, Instant lockExpiry, int limit) {
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String sql = "UPDATE " + tableName() + " SET locked_by=?, locked_at=? "
        + "WHERE id IN ("
        + "SELECT id FROM " + tableName()
        + " WHERE project_id=? AND connector_type=? AND " + DUE_PREDICATE
        + " AND (locked_by IS NULL OR locked_at < ?)"
        + " ORDER BY next_attempt_at, id LIMIT ?"
        + " FOR UPDATE SKIP LOCKED"
        + ") RETURNING " + DELIVERY_COLUMNS;
    List<ConnectorDelivery> claimed = JdbcTemplate.updateReturning(conn, sql, DELIVERY_ROW_MAPPER,
        ownerId, Timestamp.from(nowMs), projectId, connectorType, Timestamp.from(now),
        Timestamp.from(lockExpiry), limit);
    // RETURNING has no ORDER BY
    return claimed.stream()
        .sorted(Comparator.comparing(ConnectorDelivery::nextAttemptAt).thenComparing(ConnectorDelivery::id))
        .toList();
  }
}
