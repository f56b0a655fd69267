/**
 * Service Provider Interfaces (SPI) implemented by resources taking part in a unit of work.
 *
 * <p>{@link uow.spi.Transactional} and {@link uow.spi.Tx} are the two contracts every
 * participant satisfies; {@link uow.spi.ContextKeyProvider} lets several resources
 * share one transaction; {@link uow.spi.UnitOfWorkListener} exports run outcomes and
 * cleanup failures.
 *
 * @see uow.spi.Transactional
 * @see uow.spi.Tx
 * @see uow.spi.ContextKeyProvider
 * @see uow.spi.UnitOfWorkListener
 */
package uow.spi;
