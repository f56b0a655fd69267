package uow.spi;

import uow.RunPhase;

/**
 * Observability hook for unit-of-work runs.
 *
 * <p>Besides counting outcomes, this is where failures that never become a run's
 * result surface: a failed rollback during cleanup is reported through
 * {@link #onRollbackFailure(Tx, Exception)} while the run still reports the
 * original failure.
 *
 * <p>All methods default to no-ops. Exceptions thrown by a listener are logged
 * and never change the outcome of a run.
 */
public interface UnitOfWorkListener {

  /**
   * No-op instance that discards all notifications.
   */
  UnitOfWorkListener NOOP = new UnitOfWorkListener() {
  };

  /**
   * Called after every begun transaction committed.
   *
   * @param transactionCount number of distinct transactions committed
   */
  default void onCommitted(int transactionCount) {
  }

  /**
   * Called after the begun transactions were rolled back.
   *
   * @param phase the phase the run failed in
   * @param cause the failure the run reports
   */
  default void onRolledBack(RunPhase phase, Exception cause) {
  }

  /**
   * Called when rolling back a single transaction fails during cleanup.
   *
   * @param tx      the handle whose rollback failed
   * @param failure the rollback failure
   */
  default void onRollbackFailure(Tx tx, Exception failure) {
  }

  /**
   * Records the wall-clock duration of a whole run, successful or not.
   *
   * @param nanos duration in nanoseconds (always non-negative)
   */
  default void recordRunDurationNanos(long nanos) {
  }
}
