package uow.spring;

import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import uow.spi.ContextKeyProvider;
import uow.spi.Transactional;

import java.util.Objects;

/**
 * {@link Transactional} resource that begins transactions through a Spring
 * {@link PlatformTransactionManager}.
 *
 * <p>The context key is the transaction manager, so every resource over the same
 * manager shares one Spring transaction within a unit of work. Code running inside
 * the work reaches that transaction the usual Spring way (e.g. through
 * {@code JdbcTemplate} or {@code DataSourceUtils}), since Spring binds it to the
 * calling thread.
 *
 * <p>Spring requires transactions on one thread to complete in reverse begin order,
 * while a unit of work commits in begin order. A single unit of work can therefore
 * hold only one Spring transaction manager: with two, the first commit fails before
 * anything is committed and every participant is rolled back. To span several
 * databases, pair one Spring manager with non-Spring resources, or nest units of
 * work with one manager each.
 *
 * @see SpringTx
 */
public final class PlatformTransactional implements Transactional, ContextKeyProvider {
  private final PlatformTransactionManager transactionManager;
  private final TransactionDefinition definition;

  /**
   * Creates a resource beginning transactions with default settings.
   */
  public PlatformTransactional(PlatformTransactionManager transactionManager) {
    this(transactionManager, TransactionDefinition.withDefaults());
  }

  public PlatformTransactional(PlatformTransactionManager transactionManager,
      TransactionDefinition definition) {
    this.transactionManager = Objects.requireNonNull(transactionManager, "transactionManager");
    this.definition = Objects.requireNonNull(definition, "definition");
  }

  /**
   * Begins a transaction according to the configured definition.
   *
   * @throws org.springframework.transaction.TransactionException if the manager cannot begin
   */
  @Override
  public SpringTx begin() {
    TransactionStatus status = transactionManager.getTransaction(definition);
    return SpringTx.begin(transactionManager, status);
  }

  @Override
  public Object contextKey() {
    return transactionManager;
  }

  public PlatformTransactionManager transactionManager() {
    return transactionManager;
  }

  public TransactionDefinition definition() {
    return definition;
  }
}
