/**
 * Micrometer bridge for exporting unit-of-work metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link uow.micrometer.MicrometerUnitOfWorkListener} implements the
 * {@link uow.spi.UnitOfWorkListener} SPI using Micrometer counters and a timer.
 *
 * @see uow.micrometer.MicrometerUnitOfWorkListener
 */
package uow.micrometer;
