package uow.spring;

import uow.NopTx;
import uow.UnitOfWork;
import uow.spi.Transactional;
import uow.spi.Tx;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.UnexpectedRollbackException;
import org.springframework.transaction.support.DefaultTransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlatformTransactionalTest {
  private DataSourceTransactionManager txManager;
  private JdbcTemplate jdbc;

  @BeforeEach
  void setup() {
    DataSource dataSource = h2("uow_spring_");
    this.txManager = new DataSourceTransactionManager(dataSource);
    this.jdbc = new JdbcTemplate(dataSource);
    jdbc.execute("CREATE TABLE account (id VARCHAR(36) PRIMARY KEY, balance INT NOT NULL)");
  }

  @Test
  void commitPersistsWritesMadeThroughSpring() throws Exception {
    PlatformTransactional resource = new PlatformTransactional(txManager);

    UnitOfWork.of(resource).run(lookup -> {
      assertTrue(TransactionSynchronizationManager.isActualTransactionActive());
      jdbc.update("INSERT INTO account (id, balance) VALUES (?, ?)", "acc-1", 100);
    });

    assertEquals(1, count());
    assertFalse(TransactionSynchronizationManager.isActualTransactionActive());
  }

  @Test
  void workFailureRollsBackSpringTransaction() {
    IOException boom = new IOException("boom");

    Exception ex = assertThrows(Exception.class,
        () -> UnitOfWork.of(new PlatformTransactional(txManager)).run(lookup -> {
          jdbc.update("INSERT INTO account (id, balance) VALUES (?, ?)", "acc-1", 100);
          throw boom;
        }));

    assertSame(boom, ex);
    assertEquals(0, count());
    assertFalse(TransactionSynchronizationManager.isActualTransactionActive());
  }

  @Test
  void resourcesOverOneManagerShareTheTransaction() throws Exception {
    PlatformTransactional accounts = new PlatformTransactional(txManager);
    PlatformTransactional ledger = new PlatformTransactional(txManager);

    UnitOfWork.of(accounts, ledger).run(lookup -> {
      Tx first = lookup.find(accounts).orElseThrow();
      assertSame(first, lookup.find(ledger).orElseThrow());
      assertInstanceOf(SpringTx.class, first);
      jdbc.update("INSERT INTO account (id, balance) VALUES (?, ?)", "acc-1", 100);
    });

    assertEquals(1, count());
  }

  @Test
  void sharedTransactionRollsBackOnce() {
    PlatformTransactional accounts = new PlatformTransactional(txManager);
    PlatformTransactional ledger = new PlatformTransactional(txManager);

    assertThrows(IllegalStateException.class,
        () -> UnitOfWork.of(accounts, ledger).run(lookup -> {
          jdbc.update("INSERT INTO account (id, balance) VALUES (?, ?)", "acc-1", 100);
          jdbc.update("INSERT INTO account (id, balance) VALUES (?, ?)", "acc-2", 50);
          throw new IllegalStateException("insufficient funds");
        }));

    assertEquals(0, count());
  }

  @Test
  void commitFailureOfOtherResourceRollsBackSpringWrites() {
    List<String> journal = new ArrayList<>();
    IOException commitErr = new IOException("cache commit err");
    Transactional cache = () -> new Tx() {
      @Override
      public void commit() throws Exception {
        journal.add("commit:cache");
        throw commitErr;
      }

      @Override
      public void rollback() {
        journal.add("rollback:cache");
      }
    };

    Exception ex = assertThrows(Exception.class,
        () -> UnitOfWork.of(cache, new PlatformTransactional(txManager)).run(lookup ->
            jdbc.update("INSERT INTO account (id, balance) VALUES (?, ?)", "acc-1", 100)));

    assertSame(commitErr, ex);
    assertEquals(List.of("commit:cache", "rollback:cache"), journal);
    assertEquals(0, count());
  }

  @Test
  void rollbackOnlyStatusFailsTheUnit() {
    List<String> journal = new ArrayList<>();
    Transactional cache = journaling("cache", journal);
    PlatformTransactional resource = new PlatformTransactional(txManager);

    assertThrows(UnexpectedRollbackException.class,
        () -> UnitOfWork.of(resource, cache).run(lookup -> {
          jdbc.update("INSERT INTO account (id, balance) VALUES (?, ?)", "acc-1", 100);
          lookup.find(resource, SpringTx.class).orElseThrow().status().setRollbackOnly();
        }));

    assertEquals(List.of("rollback:cache"), journal);
    assertEquals(0, count());
    assertThreadIsClean();
  }

  @Test
  void twoManagersInOneUnitRollBackBothWithoutCommitting() {
    DataSource otherDb = h2("uow_spring_other_");
    JdbcTemplate otherJdbc = new JdbcTemplate(otherDb);
    otherJdbc.execute("CREATE TABLE account (id VARCHAR(36) PRIMARY KEY, balance INT NOT NULL)");
    PlatformTransactional first = new PlatformTransactional(txManager);
    PlatformTransactional second = new PlatformTransactional(new DataSourceTransactionManager(otherDb));

    IllegalTransactionStateException ex = assertThrows(IllegalTransactionStateException.class,
        () -> UnitOfWork.of(first, second).run(lookup -> {
          jdbc.update("INSERT INTO account (id, balance) VALUES (?, ?)", "acc-1", 100);
          otherJdbc.update("INSERT INTO account (id, balance) VALUES (?, ?)", "acc-2", 50);
        }));

    assertTrue(ex.getMessage().contains("reverse begin order"));
    assertEquals(0, count());
    assertEquals(0, otherJdbc.queryForObject("SELECT COUNT(*) FROM account", Integer.class).intValue());
    assertThreadIsClean();
  }

  @Test
  void nestedUnitsMayUseDifferentManagers() throws Exception {
    DataSource otherDb = h2("uow_spring_other_");
    JdbcTemplate otherJdbc = new JdbcTemplate(otherDb);
    otherJdbc.execute("CREATE TABLE account (id VARCHAR(36) PRIMARY KEY, balance INT NOT NULL)");
    PlatformTransactional outer = new PlatformTransactional(txManager);
    PlatformTransactional inner = new PlatformTransactional(new DataSourceTransactionManager(otherDb));

    UnitOfWork.of(outer).run(outerLookup -> {
      jdbc.update("INSERT INTO account (id, balance) VALUES (?, ?)", "acc-1", 100);
      UnitOfWork.of(inner).run(outerLookup, innerLookup ->
          otherJdbc.update("INSERT INTO account (id, balance) VALUES (?, ?)", "acc-2", 50));
    });

    assertEquals(1, count());
    assertEquals(1, otherJdbc.queryForObject("SELECT COUNT(*) FROM account", Integer.class).intValue());
    assertThreadIsClean();
  }

  @Test
  void rollbackAfterCommitIsNoop() {
    SpringTx tx = new PlatformTransactional(txManager).begin();
    jdbc.update("INSERT INTO account (id, balance) VALUES (?, ?)", "acc-1", 100);

    tx.commit();
    tx.rollback();
    tx.commit();

    assertTrue(tx.status().isCompleted());
    assertEquals(1, count());
  }

  @Test
  void definitionIsAppliedOnBegin() throws Exception {
    DefaultTransactionDefinition definition = new DefaultTransactionDefinition();
    definition.setReadOnly(true);
    definition.setIsolationLevel(TransactionDefinition.ISOLATION_SERIALIZABLE);
    PlatformTransactional resource = new PlatformTransactional(txManager, definition);
    AtomicInteger seen = new AtomicInteger();

    UnitOfWork.of(resource).run(lookup -> {
      assertTrue(TransactionSynchronizationManager.isCurrentTransactionReadOnly());
      seen.set(TransactionSynchronizationManager.getCurrentTransactionIsolationLevel());
    });

    assertSame(definition, resource.definition());
    assertEquals(TransactionDefinition.ISOLATION_SERIALIZABLE, seen.get());
  }

  @Test
  void contextKeyIsTheTransactionManager() {
    PlatformTransactional resource = new PlatformTransactional(txManager);

    assertSame(txManager, resource.contextKey());
    assertSame(txManager, resource.transactionManager());
  }

  @Test
  void mixesWithOtherResources() throws Exception {
    Transactional nop = () -> NopTx.INSTANCE;
    PlatformTransactional resource = new PlatformTransactional(txManager);

    UnitOfWork.of(nop, resource).run(lookup -> {
      assertSame(NopTx.INSTANCE, lookup.find(nop).orElseThrow());
      jdbc.update("INSERT INTO account (id, balance) VALUES (?, ?)", "acc-1", 100);
    });

    assertEquals(1, count());
  }

  private static DataSource h2(String prefix) {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + prefix + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    return ds;
  }

  private static Transactional journaling(String name, List<String> journal) {
    return () -> new Tx() {
      @Override
      public void commit() {
        journal.add("commit:" + name);
      }

      @Override
      public void rollback() {
        journal.add("rollback:" + name);
      }
    };
  }

  private static void assertThreadIsClean() {
    assertTrue(TransactionSynchronizationManager.getResourceMap().isEmpty());
    assertFalse(TransactionSynchronizationManager.isSynchronizationActive());
  }

  private int count() {
    Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM account", Integer.class);
    return n == null ? 0 : n;
  }
}
