package uow.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link JdbcTemplate} and
 * {@link AbstractJdbcRepository} subclasses.
 */
public final class RepositoryException extends RuntimeException {
  public RepositoryException(String message, Throwable cause) {
    super(message, cause);
  }
}
