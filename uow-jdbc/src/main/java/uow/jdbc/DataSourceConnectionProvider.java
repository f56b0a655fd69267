package uow.jdbc;

import uow.jdbc.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} backed by a {@link DataSource}.
 * Delegates directly to {@link DataSource#getConnection()}.
 *
 * <p>Two providers are equal when they wrap the same {@code DataSource} instance,
 * so repositories created with separate providers over one data source still
 * share a transaction.
 *
 * @see ConnectionProvider
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }

  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DataSourceConnectionProvider other && other.dataSource == dataSource;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(dataSource);
  }

  @Override
  public String toString() {
    return "DataSourceConnectionProvider[" + dataSource + "]";
  }
}
