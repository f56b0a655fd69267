package uow;

import uow.spi.Tx;

/**
 * A transaction handle that does nothing on commit or rollback.
 *
 * <p>Lets resources without real transactional behavior (in-memory caches, test
 * doubles, temporary adapters) take part in a {@link UnitOfWork}:
 * <pre>{@code
 * class InMemoryCache implements Transactional {
 *   public Tx begin() {
 *     return NopTx.INSTANCE;
 *   }
 * }
 * }</pre>
 */
public final class NopTx implements Tx {

  /** Shared instance; the handle is stateless. */
  public static final NopTx INSTANCE = new NopTx();

  private NopTx() {
  }

  @Override
  public void commit() {
  }

  @Override
  public void rollback() {
  }

  @Override
  public String toString() {
    return "NopTx";
  }
}
