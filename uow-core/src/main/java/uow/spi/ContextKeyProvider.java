package uow.spi;

/**
 * Optional capability of a {@link Transactional} resource: declares the key
 * identifying the transactional context it belongs to.
 *
 * <p>Resources returning equal keys are coalesced into one transaction. Only the
 * first of them (in construction order) is asked to {@link Transactional#begin()};
 * the others see the same {@link Tx} through the lookup. A {@code null} key falls
 * back to the resource's own identity.
 *
 * <p>Typical keys are the {@code DataSource} or transaction manager a group of
 * repositories is built on.
 */
public interface ContextKeyProvider {

  /**
   * Returns the key of the transactional context this resource participates in.
   * Keys are compared with {@link Object#equals(Object)}.
   */
  Object contextKey();
}
