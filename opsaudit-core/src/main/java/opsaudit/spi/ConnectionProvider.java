package opsaudit.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for batch flushes, retention sweeps and start-up verification.
 *
 * <p>Callers are responsible for closing the returned connection. Implementations must be
 * safe for concurrent use: every worker and the sweeper obtain their own connection.
 *
 * @see opsaudit.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
