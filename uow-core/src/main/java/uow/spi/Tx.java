package uow.spi;

/**
 * A single resource's in-flight transaction.
 *
 * <p>Handles are created by {@link Transactional#begin()} and owned by the
 * {@link uow.UnitOfWork} for the duration of one run, which calls
 * {@link #commit()} or {@link #rollback()} on them.
 *
 * <p>{@link #rollback()} must be safe to call when {@link #commit()} was never
 * attempted, and also after a successful commit: when a later participant fails
 * to commit, every begun handle is rolled back, including those that already
 * committed. Implementations typically treat that call as a no-op.
 *
 * @see uow.NopTx
 */
public interface Tx {

  /**
   * Commits the work done under this transaction.
   *
   * @throws Exception if the underlying resource fails to commit
   */
  void commit() throws Exception;

  /**
   * Discards the work done under this transaction.
   *
   * @throws Exception if the underlying resource fails to roll back
   */
  void rollback() throws Exception;
}
