package uow;

/**
 * Unchecked exception raised by {@link UnitOfWork} itself: when a candidate passed
 * at construction is not transactional, or when the work threw a non-{@link Exception}
 * throwable that was recovered at the run boundary.
 *
 * <p>Failures of the participants and of the work are never wrapped in this type;
 * they surface unchanged.
 */
public final class UnitOfWorkException extends RuntimeException {

  public UnitOfWorkException(String message) {
    super(message);
  }

  public UnitOfWorkException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Converts a recovered throwable into the exception a run reports.
   * {@link Exception}s are returned as-is; anything else is wrapped with a
   * {@code "recovered: "} message prefix.
   */
  static Exception recovered(Throwable t) {
    if (t instanceof Exception e) {
      return e;
    }
    return new UnitOfWorkException("recovered: " + t, t);
  }
}
