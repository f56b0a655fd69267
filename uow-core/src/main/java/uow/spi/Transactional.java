package uow.spi;

/**
 * A resource capable of starting a transaction.
 *
 * <p>A {@link uow.UnitOfWork} calls {@link #begin()} at most once per run for each
 * distinct coordination key. Resources that want to share a physical transaction
 * with other resources also implement {@link ContextKeyProvider}.
 *
 * @see Tx
 * @see ContextKeyProvider
 */
public interface Transactional {

  /**
   * Starts a new transaction on this resource.
   *
   * @return the handle of the started transaction, never {@code null}
   * @throws Exception if the transaction cannot be started
   */
  Tx begin() throws Exception;
}
