package uow.jdbc;

import uow.TxLookup;
import uow.jdbc.JdbcTemplate.ConnectionCallback;
import uow.jdbc.JdbcTemplate.RowMapper;
import uow.jdbc.spi.ConnectionProvider;
import uow.jdbc.tx.JdbcTransactional;

import java.util.List;

/**
 * Base class for SQL-backed repositories that take part in a unit of work.
 *
 * <p>A repository is itself a {@link JdbcTransactional}, so it can be passed to
 * {@link uow.UnitOfWork#of(Object...)} directly. Repositories over the same
 * connection provider share one transaction.
 *
 * <p>Every data access method receives the {@link TxLookup} of the current run. When
 * the lookup holds a transaction for this repository, statements run on its
 * connection; otherwise a fresh auto-commit connection is used and closed again,
 * so the same methods also work outside a unit of work with {@link TxLookup#empty()}.
 *
 * <pre>{@code
 * final class OrderRepository extends AbstractJdbcRepository {
 *   OrderRepository(ConnectionProvider provider) {
 *     super(provider);
 *   }
 *
 *   void insert(TxLookup lookup, String id, long amount) {
 *     update(lookup, "INSERT INTO orders (id, amount) VALUES (?, ?)", id, amount);
 *   }
 * }
 * }</pre>
 */
public abstract class AbstractJdbcRepository extends JdbcTransactional {

  protected AbstractJdbcRepository(ConnectionProvider connectionProvider) {
    super(connectionProvider);
  }

  /**
   * Returns {@code true} if {@code lookup} holds an active transaction for this repository.
   */
  protected boolean inTransaction(TxLookup lookup) {
    return JdbcTemplate.activeTransaction(lookup, this).isPresent();
  }

  /**
   * Runs {@code callback} on the transactional connection if one is active, otherwise
   * on a new auto-commit connection.
   *
   * @throws RepositoryException if the callback or obtaining a connection fails
   */
  protected <T> T withConnection(TxLookup lookup, ConnectionCallback<T> callback) {
    return JdbcTemplate.execute(lookup, this, callback);
  }

  /** Execute INSERT/UPDATE/DELETE, return rows affected. */
  protected int update(TxLookup lookup, String sql, Object... params) {
    return JdbcTemplate.update(lookup, this, sql, params);
  }

  /** Execute SELECT, map rows. */
  protected <T> List<T> query(TxLookup lookup, String sql, RowMapper<T> mapper, Object... params) {
    return JdbcTemplate.query(lookup, this, sql, mapper, params);
  }
}
