/**
 * JDBC persistence for the control plane: delivery stores, the audit log and the policy store.
 *
 * <p>Schema scripts for H2 and PostgreSQL ship as {@code relay/jdbc/schema-h2.sql} and
 * {@code relay/jdbc/schema-postgresql.sql} on the classpath.
 */
package relay.jdbc;
