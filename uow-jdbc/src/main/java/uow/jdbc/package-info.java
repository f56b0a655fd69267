/**
 * JDBC participants for units of work.
 *
 * <p>{@link uow.jdbc.AbstractJdbcRepository} is the base class for SQL-backed
 * repositories: it joins the transaction of the current run when there is one and
 * falls back to auto-commit otherwise. {@link uow.jdbc.DataSourceConnectionProvider}
 * adapts a {@link javax.sql.DataSource}; {@link uow.jdbc.JdbcTemplate} removes
 * statement boilerplate.
 *
 * @see uow.jdbc.AbstractJdbcRepository
 * @see uow.jdbc.DataSourceConnectionProvider
 * @see uow.jdbc.tx.JdbcTransactional
 */
package uow.jdbc;
