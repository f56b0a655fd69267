package uow;

/**
 * Body of a unit of work that produces a result.
 *
 * @param <T> the result type
 * @see UnitOfWork#call(WorkFunction)
 */
@FunctionalInterface
public interface WorkFunction<T> {

  T apply(TxLookup lookup) throws Exception;
}
