package relay.util;

import relay.StoreException;
import relay.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Connection and transaction boilerplate shared by the components that talk to a
 * {@link relay.spi.DeliveryStore}.
 */
public final class ConnectionTemplate {

  @FunctionalInterface
  public interface ConnectionCallback<T> {
    T apply(Connection conn) throws SQLException;
  }

  /** Runs {@code callback} on an auto-commit connection. */
  public static <T> T withConnection(ConnectionProvider provider, String description,
      ConnectionCallback<T> callback) {
    try (Connection conn = provider.getConnection()) {
      conn.setAutoCommit(true);
      return callback.apply(conn);
    } catch (SQLException e) {
      throw new StoreException("Failed to " + description, e);
    }
  }

  /** Runs {@code callback} in a transaction; any exception rolls it back and propagates. */
  public static <T> T inTransaction(ConnectionProvider provider, String description,
      ConnectionCallback<T> callback) {
    try (Connection conn = provider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = callback.apply(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new StoreException("Failed to " + description, e);
    }
  }

  private ConnectionTemplate() {}
}
