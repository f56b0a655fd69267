package uow;

/**
 * The caller-supplied body of a unit of work.
 *
 * <p>Throwing aborts the unit of work and rolls back every participant.
 */
@FunctionalInterface
public interface Work {

  void execute(TxLookup lookup) throws Exception;
}
