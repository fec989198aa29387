package relay.spi;

import relay.model.ConnectorDelivery;
import relay.model.DeliveryAttempt;
import relay.model.DeliverySummary;
import relay.model.DeliveryTransition;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for connector deliveries and their attempts.
 *
 * <p>Deliveries move through QUEUED → RETRYING* → DELIVERED | DEAD_LETTERED, and back to QUEUED
 * only by redrive. Rows are never deleted.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls transaction
 * boundaries. Implementations live in the {@code relay-jdbc} module.
 *
 * @see relay.jdbc.store.AbstractJdbcDeliveryStore
 */
public interface DeliveryStore {

    /**
     * Inserts a new delivery.
     *
     * <p>Implementations should reject a second row with the same
     * {@code (project_id, connector_type, idempotency_key)} by throwing.
     *
     * @param conn     the JDBC connection
     * @param delivery the delivery to persist
     */
    void insertDelivery(Connection conn, ConnectorDelivery delivery);

    Optional<ConnectorDelivery> findById(Connection conn, String deliveryId);

    Optional<ConnectorDelivery> findByIdempotencyKey(Connection conn, String projectId,
        String connectorType, String idempotencyKey);

    Optional<ConnectorDelivery> findByPayloadHash(Connection conn, String projectId,
        String connectorType, String payloadHash);

    /**
     * Lists deliveries newest first.
     *
     * @param conn          the JDBC connection
     * @param projectId     owning project
     * @param connectorType connector filter, or {@code null} for all connectors
     * @param limit         maximum rows to return
     * @return deliveries ordered by {@code created_at} descending
     */
    List<ConnectorDelivery> listDeliveries(Connection conn, String projectId, String connectorType, int limit);

    /**
     * Lists deliveries of one connector that are due at {@code now}, oldest schedule first.
     */
    List<ConnectorDelivery> listDue(Connection conn, String projectId, String connectorType,
        Instant now, int limit);

    /**
     * Leases due deliveries to {@code ownerId} so concurrent pumps on other nodes skip them.
     *
     * <p>Rows whose lease is older than {@code lockExpiry} are reclaimable. A lease is released
     * by the next {@link #transitionDelivery} on the row.
     *
     * @return the leased deliveries, oldest schedule first
     */
    List<ConnectorDelivery> claimDue(Connection conn, String ownerId, String projectId,
        String connectorType, Instant now, Instant lockExpiry, int limit);

    /**
     * Lists dead-lettered deliveries last updated at or before {@code deadBefore}, oldest first.
     */
    List<ConnectorDelivery> listDeadLettered(Connection conn, String projectId, String connectorType,
        Instant deadBefore, int limit);

    /**
     * Returns the distinct projects that have at least one pending delivery.
     */
    List<String> listProjectsWithPending(Connection conn);

    /**
     * Returns the distinct connector types a project has deliveries for, sorted.
     */
    List<String> listConnectorTypes(Connection conn, String projectId);

    /**
     * Computes queue counts for one connector, evaluating due-ness at {@code now}.
     */
    DeliverySummary summarize(Connection conn, String projectId, String connectorType, Instant now);

    /**
     * Lists a delivery's attempts, oldest first.
     */
    List<DeliveryAttempt> listAttempts(Connection conn, String deliveryId);

    void recordAttempt(Connection conn, DeliveryAttempt attempt);

    /**
     * Applies a status transition if the row still has {@code transition.expectedAttemptCount()}
     * attempts and is in one of the target status' {@link relay.model.DeliveryStatus#legalSources()}.
     *
     * @param conn       the JDBC connection
     * @param deliveryId the delivery to update
     * @param transition the new retry state
     * @param now        value for {@code updated_at}
     * @return the number of rows updated (0 when another writer got there first)
     */
    int transitionDelivery(Connection conn, String deliveryId, DeliveryTransition transition, Instant now);
}
