package uow;

import uow.spi.UnitOfWorkListener;

/**
 * Creates {@link UnitOfWork} instances that share one {@link UnitOfWorkListener}.
 *
 * <p>Useful when units of work are assembled per request from different
 * repositories but should report to the same metrics backend.
 */
public final class UnitOfWorkFactory {
  private final UnitOfWorkListener listener;

  public UnitOfWorkFactory() {
    this(UnitOfWorkListener.NOOP);
  }

  /**
   * @param listener listener for every created unit of work; {@code null} defaults to
   *                 {@link UnitOfWorkListener#NOOP}
   */
  public UnitOfWorkFactory(UnitOfWorkListener listener) {
    this.listener = listener == null ? UnitOfWorkListener.NOOP : listener;
  }

  /**
   * Creates a unit of work over the given candidates.
   *
   * @throws UnitOfWorkException if a candidate is not {@link uow.spi.Transactional}
   */
  public UnitOfWork create(Object... candidates) {
    return UnitOfWork.builder()
        .listener(listener)
        .resources(candidates)
        .build();
  }

  public UnitOfWorkListener listener() {
    return listener;
  }
}
