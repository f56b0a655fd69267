package uow.jdbc;

import uow.TxLookup;
import uow.jdbc.tx.JdbcTransactional;
import uow.jdbc.tx.JdbcTx;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lightweight JDBC helper to reduce boilerplate in repository implementations.
 *
 * <p>The lookup-based variants pick the connection for a {@link JdbcTransactional}
 * resource: the connection of its active transaction in the current run, or a fresh
 * auto-commit connection from its provider, closed again afterwards.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  @FunctionalInterface
  public interface ConnectionCallback<T> {
    T apply(Connection connection) throws SQLException;
  }

  /**
   * Returns the transaction of {@code resource} in {@code lookup}, if one is still active.
   */
  public static Optional<JdbcTx> activeTransaction(TxLookup lookup, JdbcTransactional resource) {
    return lookup.find(resource, JdbcTx.class).filter(JdbcTx::isActive);
  }

  /**
   * Runs {@code callback} on the transactional connection of {@code resource} if one is
   * active, otherwise on a new auto-commit connection.
   *
   * @throws RepositoryException if the callback or obtaining a connection fails
   */
  public static <T> T execute(TxLookup lookup, JdbcTransactional resource,
      ConnectionCallback<T> callback) {
    Optional<JdbcTx> tx = activeTransaction(lookup, resource);
    try {
      if (tx.isPresent()) {
        return callback.apply(tx.get().connection());
      }
      try (Connection connection = resource.connectionProvider().getConnection()) {
        return callback.apply(connection);
      }
    } catch (SQLException e) {
      throw new RepositoryException("Failed to access " + resource.getClass().getSimpleName(), e);
    }
  }

  /** Execute INSERT/UPDATE/DELETE for {@code resource}, return rows affected. */
  public static int update(TxLookup lookup, JdbcTransactional resource, String sql, Object... params) {
    return execute(lookup, resource, conn -> update(conn, sql, params));
  }

  /** Execute SELECT for {@code resource}, map rows. */
  public static <T> List<T> query(TxLookup lookup, JdbcTransactional resource, String sql,
      RowMapper<T> mapper, Object... params) {
    return execute(lookup, resource, conn -> query(conn, sql, mapper, params));
  }

  /** Execute INSERT/UPDATE/DELETE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new RepositoryException("Failed to execute update: " + sql, e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new RepositoryException("Failed to execute query: " + sql, e);
    }
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
