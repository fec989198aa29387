package relay.jdbc.store;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import relay.StoreException;
import relay.jdbc.H2Databases;
import relay.jdbc.TableNames;
import relay.model.ConnectorDelivery;
import relay.model.DeliveryAttempt;
import relay.model.DeliveryStatus;
import relay.model.DeliverySummary;
import relay.model.DeliveryTransition;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcDeliveryStoreTest {

    private static final Instant NOW = Instant.parse("2026-02-21T12:00:00Z");
    private static final String HASH = "0".repeat(64);

    private JdbcDataSource dataSource;
    private H2DeliveryStore store;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = H2Databases.create();
        store = new H2DeliveryStore();
    }

    @Test
    void insertedDeliveryReadsBackUnchanged() throws SQLException {
        ConnectorDelivery delivery = queued("d-1", "webhook", "key-1", NOW);

        try (Connection conn = dataSource.getConnection()) {
            store.insertDelivery(conn, delivery);

            assertEquals(delivery, store.findById(conn, "d-1").orElseThrow());
            assertEquals(delivery, store.findByIdempotencyKey(conn, "p", "webhook", "key-1").orElseThrow());
            assertTrue(store.findById(conn, "missing").isEmpty());
        }
    }

    @Test
    void duplicateIdempotencyKeyIsRejectedButNullKeysAreNot() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insertDelivery(conn, queued("d-1", "webhook", "key-1", NOW));
            store.insertDelivery(conn, queued("d-2", "webhook", null, NOW));
            store.insertDelivery(conn, queued("d-3", "webhook", null, NOW));
            store.insertDelivery(conn, queued("d-4", "slack", "key-1", NOW));

            assertThrows(StoreException.class,
                    () -> store.insertDelivery(conn, queued("d-5", "webhook", "key-1", NOW)));
            assertEquals(4, store.listDeliveries(conn, "p", null, 10).size());
        }
    }

    @Test
    void payloadHashLookupReturnsOldestMatch() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insertDelivery(conn, queued("d-2", "webhook", null, NOW.plusSeconds(5)));
            store.insertDelivery(conn, queued("d-1", "webhook", null, NOW));

            assertEquals("d-1", store.findByPayloadHash(conn, "p", "webhook", HASH).orElseThrow().id());
            assertTrue(store.findByPayloadHash(conn, "p", "slack", HASH).isEmpty());
        }
    }

    @Test
    void listDeliveriesIsNewestFirstAndFiltersConnector() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insertDelivery(conn, queued("d-1", "webhook", null, NOW));
            store.insertDelivery(conn, queued("d-2", "slack", null, NOW.plusSeconds(1)));
            store.insertDelivery(conn, queued("d-3", "webhook", null, NOW.plusSeconds(2)));

            assertEquals(List.of("d-3", "d-2", "d-1"), ids(store.listDeliveries(conn, "p", null, 10)));
            assertEquals(List.of("d-3", "d-1"), ids(store.listDeliveries(conn, "p", "webhook", 10)));
            assertEquals(List.of("d-3"), ids(store.listDeliveries(conn, "p", null, 1)));
        }
    }

    @Test
    void retryingRowsAreDueOnlyAfterBackoff() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insertDelivery(conn, queued("d-1", "webhook", null, NOW));
            store.insertDelivery(conn, queued("d-2", "webhook", null, NOW.plusSeconds(1)));
            assertEquals(1, store.transitionDelivery(conn, "d-1", retry(0, NOW.plusSeconds(60)), NOW));

            assertEquals(List.of("d-2"), ids(store.listDue(conn, "p", "webhook", NOW.plusSeconds(30), 10)));
            assertEquals(List.of("d-1", "d-2"),
                    ids(store.listDue(conn, "p", "webhook", NOW.plusSeconds(60), 10)).stream().sorted().toList());
        }
    }

    @Test
    void transitionIsCompareAndSetOnAttemptCount() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insertDelivery(conn, queued("d-1", "webhook", null, NOW));

            assertEquals(1, store.transitionDelivery(conn, "d-1", retry(0, NOW.plusSeconds(1)), NOW));
            assertEquals(0, store.transitionDelivery(conn, "d-1", retry(0, NOW.plusSeconds(1)), NOW));

            ConnectorDelivery row = store.findById(conn, "d-1").orElseThrow();
            assertEquals(DeliveryStatus.RETRYING, row.status());
            assertEquals(1, row.attemptCount());
            assertEquals(503, row.lastStatusCode());
            assertEquals("remote endpoint returned 503", row.lastError());
        }
    }

    @Test
    void illegalSourceStatusIsNotUpdated() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insertDelivery(conn, queued("d-1", "webhook", null, NOW));
            DeliveryTransition requeue = new DeliveryTransition(DeliveryStatus.QUEUED, 0, 0,
                    null, null, NOW, null, null);

            assertEquals(0, store.transitionDelivery(conn, "d-1", requeue, NOW));
        }
    }

    @Test
    void deliveredTransitionRecordsTerminalState() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insertDelivery(conn, queued("d-1", "webhook", null, NOW));
            DeliveryTransition delivered = new DeliveryTransition(DeliveryStatus.DELIVERED, 0, 1,
                    200, null, null, null, NOW.plusSeconds(1));

            assertEquals(1, store.transitionDelivery(conn, "d-1", delivered, NOW.plusSeconds(1)));

            ConnectorDelivery row = store.findById(conn, "d-1").orElseThrow();
            assertEquals(DeliveryStatus.DELIVERED, row.status());
            assertNull(row.nextAttemptAt());
            assertEquals(NOW.plusSeconds(1), row.deliveredAt());
            assertTrue(store.listProjectsWithPending(conn).isEmpty());
        }
    }

    @Test
    void claimLeasesRowsUntilTheyExpire() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insertDelivery(conn, queued("d-1", "webhook", null, NOW));
            store.insertDelivery(conn, queued("d-2", "webhook", null, NOW.plusSeconds(1)));
            store.insertDelivery(conn, queued("d-3", "webhook", null, NOW.plusSeconds(2)));
            Instant claimAt = NOW.plusSeconds(10);
            Instant lockExpiry = claimAt.minus(Duration.ofMinutes(5));

            List<ConnectorDelivery> first = store.claimDue(conn, "node-a", "p", "webhook", claimAt, lockExpiry, 2);
            List<ConnectorDelivery> second = store.claimDue(conn, "node-b", "p", "webhook", claimAt, lockExpiry, 10);
            List<ConnectorDelivery> none = store.claimDue(conn, "node-c", "p", "webhook", claimAt, lockExpiry, 10);

            assertEquals(List.of("d-1", "d-2"), ids(first));
            assertEquals(List.of("d-3"), ids(second));
            assertTrue(none.isEmpty());

            Instant later = claimAt.plus(Duration.ofMinutes(6));
            List<ConnectorDelivery> reclaimed = store.claimDue(conn, "node-c", "p", "webhook", later,
                    later.minus(Duration.ofMinutes(5)), 10);
            assertEquals(3, reclaimed.size());
        }
    }

    @Test
    void transitionReleasesLease() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insertDelivery(conn, queued("d-1", "webhook", null, NOW));
            store.claimDue(conn, "node-a", "p", "webhook", NOW, NOW.minusSeconds(300), 10);

            store.transitionDelivery(conn, "d-1", retry(0, NOW), NOW);

            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT locked_by, locked_at FROM relay_connector_delivery WHERE id = ?")) {
                ps.setString(1, "d-1");
                try (ResultSet rs = ps.executeQuery()) {
                    assertTrue(rs.next());
                    assertNull(rs.getString("locked_by"));
                    assertNull(rs.getTimestamp("locked_at"));
                }
            }
            assertEquals(1, store.claimDue(conn, "node-b", "p", "webhook", NOW.plusSeconds(1),
                    NOW.minusSeconds(300), 10).size());
        }
    }

    @Test
    void summarizeCountsEveryStatus() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insertDelivery(conn, queued("d-1", "webhook", null, NOW));
            store.insertDelivery(conn, queued("d-2", "webhook", null, NOW));
            store.insertDelivery(conn, queued("d-3", "webhook", null, NOW));
            store.insertDelivery(conn, queued("d-4", "webhook", null, NOW));
            store.transitionDelivery(conn, "d-2", retry(0, NOW.plusSeconds(120)), NOW);
            store.transitionDelivery(conn, "d-3", new DeliveryTransition(DeliveryStatus.DELIVERED, 0, 1,
                    200, null, null, null, NOW), NOW);
            store.transitionDelivery(conn, "d-4", new DeliveryTransition(DeliveryStatus.DEAD_LETTERED, 0, 1,
                    500, "boom", null, "boom", null), NOW);

            DeliverySummary summary = store.summarize(conn, "p", "webhook", NOW.plusSeconds(60));

            assertEquals(new DeliverySummary("webhook", 4, 1, 1, 1, 1, 1, NOW), summary);
            assertEquals(DeliverySummary.empty("slack"), store.summarize(conn, "p", "slack", NOW));
        }
    }

    @Test
    void deadLetteredListingHonorsAgeCutoff() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insertDelivery(conn, queued("d-1", "webhook", null, NOW));
            store.insertDelivery(conn, queued("d-2", "webhook", null, NOW));
            DeliveryTransition dead = new DeliveryTransition(DeliveryStatus.DEAD_LETTERED, 0, 1,
                    500, "boom", null, "boom", null);
            store.transitionDelivery(conn, "d-1", dead, NOW);
            store.transitionDelivery(conn, "d-2", dead, NOW.plus(Duration.ofHours(1)));

            assertEquals(List.of("d-1"), ids(store.listDeadLettered(conn, "p", "webhook", NOW.plusSeconds(60), 10)));
            assertEquals(List.of("d-1", "d-2"),
                    ids(store.listDeadLettered(conn, "p", "webhook", NOW.plus(Duration.ofHours(2)), 10)));
        }
    }

    @Test
    void projectAndConnectorListingsAreSortedAndDistinct() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insertDelivery(conn, queued("d-1", "webhook", null, NOW));
            store.insertDelivery(conn, queued("d-2", "slack", null, NOW));
            store.insertDelivery(conn, queued("d-3", "slack", null, NOW));
            store.insertDelivery(conn, ConnectorDelivery.queued("d-4", "other", "jira", null, HASH, "{}", 3, NOW));

            assertEquals(List.of("other", "p"), store.listProjectsWithPending(conn));
            assertEquals(List.of("slack", "webhook"), store.listConnectorTypes(conn, "p"));
        }
    }

    @Test
    void attemptsListOldestFirst() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insertDelivery(conn, queued("d-1", "webhook", null, NOW));
            DeliveryAttempt second = new DeliveryAttempt("a-2", "d-1", NOW.plusSeconds(5), 200, null, 8);
            DeliveryAttempt first = new DeliveryAttempt("a-1", "d-1", NOW, null, "request timed out after 10000ms", 10_000);
            store.recordAttempt(conn, second);
            store.recordAttempt(conn, first);

            assertEquals(List.of(first, second), store.listAttempts(conn, "d-1"));
            assertTrue(store.listAttempts(conn, "d-2").isEmpty());
        }
    }

    @Test
    void longErrorsAreTruncated() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insertDelivery(conn, queued("d-1", "webhook", null, NOW));
            DeliveryTransition transition = new DeliveryTransition(DeliveryStatus.RETRYING, 0, 1,
                    null, "x".repeat(5000), NOW, null, null);

            store.transitionDelivery(conn, "d-1", transition, NOW);

            String error = store.findById(conn, "d-1").orElseThrow().lastError();
            assertEquals(4000, error.length());
            assertTrue(error.endsWith("..."));
        }
    }

    @Test
    void customTablePrefix() throws SQLException {
        JdbcDataSource prefixed = H2Databases.create("ops_");
        AbstractJdbcDeliveryStore opsStore = store.withTables(TableNames.withPrefix("ops_"));

        try (Connection conn = prefixed.getConnection()) {
            opsStore.insertDelivery(conn, queued("d-1", "webhook", null, NOW));

            assertEquals("ops_connector_delivery", opsStore.tables().deliveries());
            assertFalse(opsStore.findById(conn, "d-1").isEmpty());
        }
    }

    private static ConnectorDelivery queued(String id, String type, String key, Instant createdAt) {
        return ConnectorDelivery.queued(id, "p", type, key, HASH, "{\"n\":\"" + id + "\"}", 3, createdAt);
    }

    private static DeliveryTransition retry(int expectedAttempts, Instant nextAttemptAt) {
        return new DeliveryTransition(DeliveryStatus.RETRYING, expectedAttempts, expectedAttempts + 1,
                503, "remote endpoint returned 503", nextAttemptAt, null, null);
    }

    private static List<String> ids(List<ConnectorDelivery> deliveries) {
        return deliveries.stream().map(ConnectorDelivery::id).toList();
    }
}
