package relay.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Fresh in-memory H2 databases with the bundled schema applied.
 */
public final class H2Databases {

    private H2Databases() {
    }

    public static JdbcDataSource create() throws SQLException {
        return create(TableNames.DEFAULT_PREFIX);
    }

    /** Creates a database whose tables use {@code prefix} instead of the default one. */
    public static JdbcDataSource create(String prefix) throws SQLException {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        String script = schema().replace(TableNames.DEFAULT_PREFIX, prefix);
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            for (String ddl : script.split(";")) {
                if (!ddl.isBlank()) {
                    st.execute(ddl);
                }
            }
        }
        return dataSource;
    }

    private static String schema() {
        try (InputStream in = H2Databases.class.getResourceAsStream("/relay/jdbc/schema-h2.sql")) {
            if (in == null) {
                throw new IllegalStateException("schema-h2.sql not on classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
