/**
 * JDBC transactions taking part in a unit of work.
 *
 * <p>{@link uow.jdbc.tx.JdbcTransactional} begins {@link uow.jdbc.tx.JdbcTx} handles on
 * connections from a {@link uow.jdbc.spi.ConnectionProvider}; resources over the same
 * provider share one handle.
 *
 * @see uow.jdbc.tx.JdbcTransactional
 * @see uow.jdbc.tx.JdbcTx
 */
package uow.jdbc.tx;
