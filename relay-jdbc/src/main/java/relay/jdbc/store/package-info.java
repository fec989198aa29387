/**
 * JDBC {@link relay.spi.DeliveryStore} implementations and their ServiceLoader registry.
 *
 * @see relay.jdbc.store.JdbcDeliveryStores
 */
package relay.jdbc.store;
