package uow;

import uow.spi.Tx;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the live transaction handle of a resource while a unit of work runs.
 *
 * <p>An empty result means the resource takes no part in the current transaction;
 * callers fall back to non-transactional behavior.
 *
 * @see UnitOfWork#run(TxLookup, Work)
 */
@FunctionalInterface
public interface TxLookup {

  /**
   * Returns the transaction handle begun for {@code resource}'s coordination key.
   *
   * @param resource the resource to resolve
   * @return the handle, or empty if no transaction was begun for the resource
   */
  Optional<Tx> find(Object resource);

  /**
   * Returns the transaction handle of {@code resource} if it is an instance of {@code type}.
   *
   * @param resource the resource to resolve
   * @param type     expected handle type
   * @param <T>      handle type
   * @return the handle, or empty if none was begun or it has another type
   */
  default <T extends Tx> Optional<T> find(Object resource, Class<T> type) {
    Objects.requireNonNull(type, "type");
    return find(resource).filter(type::isInstance).map(type::cast);
  }

  /**
   * Returns a lookup that resolves nothing.
   */
  static TxLookup empty() {
    return resource -> {
      Objects.requireNonNull(resource, "resource");
      return Optional.empty();
    };
  }
}
