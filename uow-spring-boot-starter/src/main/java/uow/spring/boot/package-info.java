/**
 * Spring Boot auto-configuration for units of work.
 *
 * <p>{@link uow.spring.boot.UnitOfWorkAutoConfiguration} exposes a
 * {@link uow.UnitOfWorkFactory} and, given a single transaction manager, a
 * {@link uow.spring.PlatformTransactional} configured from {@code uow.transaction.*}.
 * {@link uow.spring.boot.UnitOfWorkMicrometerAutoConfiguration} adds metrics when a
 * {@code MeterRegistry} is available.
 *
 * @see uow.spring.boot.UnitOfWorkAutoConfiguration
 * @see uow.spring.boot.UnitOfWorkProperties
 */
package uow.spring.boot;
