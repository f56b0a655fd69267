package uow;

/**
 * Phases of a {@link UnitOfWork} run that can fail and trigger a rollback.
 */
public enum RunPhase {
  /** Starting the participants' transactions. */
  BEGIN,
  /** Running the caller-supplied work. */
  EXECUTE,
  /** Committing the participants' transactions. */
  COMMIT
}
