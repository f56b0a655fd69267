/**
 * Spring Framework integration.
 *
 * <p>{@link uow.spring.PlatformTransactional} lets any Spring
 * {@link org.springframework.transaction.PlatformTransactionManager} take part in a
 * unit of work.
 *
 * @see uow.spring.PlatformTransactional
 * @see uow.spring.SpringTx
 */
package uow.spring;
