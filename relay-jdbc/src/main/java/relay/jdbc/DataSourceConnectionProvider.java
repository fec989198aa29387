package relay.jdbc;

import relay.StoreException;
import relay.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} over a {@link DataSource}. Each control-plane operation borrows one
 * connection and returns it when done, so a pooled data source is recommended.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }

  public DataSource dataSource() {
    return dataSource;
  }

  /**
   * URL the driver reports for this data source; used to pick the delivery store flavour.
   *
   * @throws StoreException if no connection can be opened
   */
  public String jdbcUrl() {
    try (Connection conn = dataSource.getConnection()) {
      return conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new StoreException("Cannot read the JDBC URL of the data source", e);
    }
  }
}
