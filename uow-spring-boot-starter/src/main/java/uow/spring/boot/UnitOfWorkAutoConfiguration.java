package uow.spring.boot;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnSingleCandidate;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionDefinition;
import uow.UnitOfWork;
import uow.UnitOfWorkFactory;
import uow.spi.UnitOfWorkListener;
import uow.spring.PlatformTransactional;

/**
 * Auto-configuration for units of work.
 *
 * <p>Provides a {@link UnitOfWorkFactory} reporting to the application's
 * {@link UnitOfWorkListener}, if exactly one is defined. When the context holds a
 * single {@link PlatformTransactionManager}, it is also exposed as a
 * {@link PlatformTransactional} resource whose transactions follow
 * {@code uow.transaction.*}.
 *
 * @see UnitOfWorkProperties
 * @see UnitOfWorkMicrometerAutoConfiguration
 */
@AutoConfiguration(afterName = {
    "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration",
    "org.springframework.boot.autoconfigure.transaction.TransactionAutoConfiguration"})
@ConditionalOnClass(UnitOfWork.class)
@EnableConfigurationProperties(UnitOfWorkProperties.class)
public class UnitOfWorkAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public UnitOfWorkFactory unitOfWorkFactory(ObjectProvider<UnitOfWorkListener> listenerProvider) {
    return new UnitOfWorkFactory(listenerProvider.getIfUnique());
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnSingleCandidate(PlatformTransactionManager.class)
  public PlatformTransactional platformTransactional(
      PlatformTransactionManager transactionManager, UnitOfWorkProperties props) {
    UnitOfWorkProperties.Transaction tx = props.getTransaction();
    DefaultTransactionDefinition definition = new DefaultTransactionDefinition();
    definition.setName(UnitOfWork.class.getName());
    definition.setIsolationLevel(tx.getIsolation().value());
    definition.setTimeout(tx.getTimeoutSeconds());
    definition.setReadOnly(tx.isReadOnly());
    return new PlatformTransactional(transactionManager, definition);
  }
}
