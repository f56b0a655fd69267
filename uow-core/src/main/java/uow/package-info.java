/**
 * Root API of uow: coordinates several independently transactional resources so that
 * a group of operations spanning them commits or rolls back as one unit.
 *
 * <h2>Core Design</h2>
 * <p>Every participant implements {@link uow.spi.Transactional} and hands out a
 * {@link uow.spi.Tx} when asked to begin. A {@link uow.UnitOfWork} begins one transaction
 * per distinct coordination key, runs the caller's {@link uow.Work} with a
 * {@link uow.TxLookup} resolving the live handle of each resource, then commits all
 * handles in begin order, or rolls them all back if anything failed. The first failure
 * is reported unchanged; rollback failures are attached to it as suppressed exceptions.
 *
 * <p>Resources implementing {@link uow.spi.ContextKeyProvider} that return equal keys
 * share a single transaction, e.g. several repositories over one {@code DataSource}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>uow-core</b>: contracts and coordinator (zero external deps)</li>
 *   <li><b>uow-jdbc</b>: JDBC resources and repositories</li>
 *   <li><b>uow-micrometer</b>: Micrometer run metrics</li>
 *   <li><b>uow-spring-adapter</b>: Spring transaction manager integration</li>
 *   <li><b>uow-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 * var orders       = new OrderRepository(connProvider);
 * var audit        = new AuditRepository(connProvider);  // same provider: same transaction
 * var cache        = new CacheResource();                 // begins a NopTx
 *
 * UnitOfWork unit = UnitOfWork.of(orders, audit, cache);
 * unit.run(lookup -> {
 *   orders.insert(lookup, order);
 *   audit.record(lookup, "order placed");
 *   cache.put(lookup, order.id(), order);
 * });
 * }</pre>
 *
 * @see uow.UnitOfWork
 * @see uow.TxLookup
 * @see uow.NopTx
 * @see uow.spi.Transactional
 * @see uow.spi.Tx
 */
package uow;
