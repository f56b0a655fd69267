package uow.jdbc.tx;

import uow.spi.Tx;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A {@link Tx} over a single JDBC connection with auto-commit disabled.
 *
 * <p>{@link #commit()} and {@link #rollback()} complete the transaction: registered
 * callbacks run, auto-commit is restored, and the connection is closed. Once completed,
 * both become no-ops, so a unit of work may roll back a handle that already committed.
 * If neither is called, {@link #close()} rolls back.
 *
 * @see JdbcTransactional
 */
public final class JdbcTx implements Tx, AutoCloseable {
  private final Connection connection;
  private final List<Runnable> afterCommit = new ArrayList<>();
  private final List<Runnable> afterRollback = new ArrayList<>();
  private boolean completed;

  JdbcTx(Connection connection) {
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  /**
   * Returns the connection bound to this transaction.
   *
   * @throws IllegalStateException if the transaction already completed
   */
  public Connection connection() {
    requireActive();
    return connection;
  }

  /**
   * Returns {@code true} until the transaction committed or rolled back.
   */
  public boolean isActive() {
    return !completed;
  }

  /**
   * Registers a callback to run after this transaction commits.
   *
   * @param callback action to execute post-commit
   * @throws IllegalStateException if the transaction already completed
   */
  public void afterCommit(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    requireActive();
    afterCommit.add(callback);
  }

  /**
   * Registers a callback to run after this transaction rolls back.
   *
   * @param callback action to execute post-rollback
   * @throws IllegalStateException if the transaction already completed
   */
  public void afterRollback(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    requireActive();
    afterRollback.add(callback);
  }

  /**
   * Commits the connection. On failure the connection is rolled back and released
   * before the failure is rethrown. A no-op once completed.
   *
   * @throws SQLException if the commit fails
   * @throws RuntimeException the first exception thrown by an after-commit callback
   */
  @Override
  public void commit() throws SQLException {
    if (completed) {
      return;
    }
    boolean committed = false;
    try {
      connection.commit();
      committed = true;
    } catch (SQLException e) {
      safeRollback(e);
      throw e;
    } finally {
      finalizeTx(committed);
    }
  }

  /**
   * Rolls back the connection. A no-op once completed.
   *
   * @throws SQLException if the rollback fails
   */
  @Override
  public void rollback() throws SQLException {
    if (completed) {
      return;
    }
    try {
      connection.rollback();
    } finally {
      finalizeTx(false);
    }
  }

  @Override
  public void close() throws SQLException {
    if (!completed) {
      rollback();
    }
  }

  private void finalizeTx(boolean committed) throws SQLException {
    RuntimeException callbackException = null;
    try {
      runCallbacks(committed ? afterCommit : afterRollback);
    } catch (RuntimeException e) {
      callbackException = e;
    } finally {
      completed = true;
      afterCommit.clear();
      afterRollback.clear();
      try {
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        if (callbackException != null) callbackException.addSuppressed(e);
      } finally {
        connection.close();
      }
    }
    if (callbackException != null) {
      throw callbackException;
    }
  }

  private static void runCallbacks(List<Runnable> callbacks) {
    RuntimeException first = null;
    for (Runnable callback : callbacks) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  private void safeRollback(SQLException failure) {
    try {
      connection.rollback();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  private void requireActive() {
    if (completed) {
      throw new IllegalStateException("Transaction already completed");
    }
  }
}
