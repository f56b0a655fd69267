package uow.jdbc.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to transactional resources and repositories.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * <p>A provider is the context key of every {@link uow.jdbc.tx.JdbcTransactional}
 * built on it: resources whose providers are equal share one transaction, so
 * implementations over the same database should be equal.
 *
 * @see uow.jdbc.DataSourceConnectionProvider
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
