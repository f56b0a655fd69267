package uow.jdbc.tx;

import uow.jdbc.spi.ConnectionProvider;
import uow.spi.ContextKeyProvider;
import uow.spi.Transactional;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link Transactional} resource over a {@link ConnectionProvider}. Each
 * {@link #begin()} obtains a connection, disables auto-commit, and wraps it in a
 * {@link JdbcTx}.
 *
 * <p>The context key is the connection provider: within one unit of work, every
 * resource built on an equal provider uses the same connection and transaction.
 *
 * <pre>{@code
 * var db = new JdbcTransactional(new DataSourceConnectionProvider(dataSource));
 * UnitOfWork.of(db).run(lookup -> {
 *   Connection conn = lookup.find(db, JdbcTx.class).orElseThrow().connection();
 *   // ...
 * });
 * }</pre>
 *
 * @see JdbcTx
 * @see uow.jdbc.AbstractJdbcRepository
 */
public class JdbcTransactional implements Transactional, ContextKeyProvider {
  private final ConnectionProvider connectionProvider;

  public JdbcTransactional(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /**
   * Begins a new transaction on a fresh connection.
   *
   * @return the transaction handle
   * @throws SQLException if a connection cannot be obtained or prepared
   */
  @Override
  public JdbcTx begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return new JdbcTx(connection);
  }

  @Override
  public final Object contextKey() {
    return connectionProvider;
  }

  public final ConnectionProvider connectionProvider() {
    return connectionProvider;
  }
}
