package uow.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import uow.micrometer.MicrometerUnitOfWorkListener;
import uow.spi.UnitOfWorkListener;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerUnitOfWorkListener} when Micrometer is on the classpath,
 * a {@link MeterRegistry} bean exists and {@code uow.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link UnitOfWorkAutoConfiguration} so the listener is available to
 * the {@link uow.UnitOfWorkFactory}.
 */
@AutoConfiguration(
    before = UnitOfWorkAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerUnitOfWorkListener.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "uow.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(UnitOfWorkProperties.class)
public class UnitOfWorkMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(UnitOfWorkListener.class)
  public MicrometerUnitOfWorkListener micrometerUnitOfWorkListener(
      MeterRegistry meterRegistry, UnitOfWorkProperties props) {
    return new MicrometerUnitOfWorkListener(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
