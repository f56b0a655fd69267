/**
 * Extension points of the JDBC module.
 *
 * @see uow.jdbc.spi.ConnectionProvider
 */
package uow.jdbc.spi;
