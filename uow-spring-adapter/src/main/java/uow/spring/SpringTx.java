package uow.spring;

import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.UnexpectedRollbackException;
import uow.spi.Tx;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * {@link Tx} over a Spring {@link TransactionStatus}.
 *
 * <p>Spring binds transactions to the calling thread and requires them to complete in
 * reverse begin order. Handles begun on one thread are therefore tracked as a stack:
 * committing a handle while a newer one is still open fails without committing
 * anything, and rolling it back first rolls back the newer ones.
 *
 * <p>Once the status is completed, further commit or rollback calls are no-ops, so a
 * unit of work may roll back a handle that already committed.
 */
public final class SpringTx implements Tx {
  private static final ThreadLocal<Deque<SpringTx>> open = new ThreadLocal<>();

  private final PlatformTransactionManager transactionManager;
  private final TransactionStatus status;

  private SpringTx(PlatformTransactionManager transactionManager, TransactionStatus status) {
    this.transactionManager = transactionManager;
    this.status = status;
  }

  static SpringTx begin(PlatformTransactionManager transactionManager, TransactionStatus status) {
    SpringTx tx = new SpringTx(
        Objects.requireNonNull(transactionManager, "transactionManager"),
        Objects.requireNonNull(status, "status"));
    Deque<SpringTx> stack = open.get();
    if (stack == null) {
      stack = new ArrayDeque<>();
      open.set(stack);
    }
    stack.push(tx);
    return tx;
  }

  /**
   * Returns the Spring status of this transaction, e.g. to mark it rollback-only.
   */
  public TransactionStatus status() {
    return status;
  }

  /**
   * Commits the transaction.
   *
   * @throws IllegalTransactionStateException if a transaction begun later on this thread
   *                                          is still open; nothing is committed
   * @throws UnexpectedRollbackException      if the status was marked rollback-only; the
   *                                          transaction is rolled back instead
   */
  @Override
  public void commit() {
    if (status.isCompleted()) {
      closed();
      return;
    }
    SpringTx newer = newestOpen();
    if (newer != this) {
      throw new IllegalTransactionStateException("Cannot commit " + this
          + " while " + newer + " begun after it on the same thread is still open;"
          + " Spring transactions must complete in reverse begin order");
    }
    if (status.isRollbackOnly()) {
      rollback();
      throw new UnexpectedRollbackException(
          "Transaction rolled back because it has been marked as rollback-only");
    }
    try {
      transactionManager.commit(status);
    } finally {
      closed();
    }
  }

  /**
   * Rolls back the transaction, after rolling back any transaction begun later on this
   * thread that is still open.
   */
  @Override
  public void rollback() {
    if (status.isCompleted()) {
      closed();
      return;
    }
    RuntimeException first = null;
    SpringTx newer;
    while ((newer = newestOpen()) != this && newer != null) {
      try {
        newer.rollback();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    try {
      transactionManager.rollback(status);
    } catch (RuntimeException e) {
      if (first != null) e.addSuppressed(first);
      throw e;
    } finally {
      closed();
    }
    if (first != null) throw first;
  }

  @Override
  public String toString() {
    return "SpringTx[" + transactionManager.getClass().getSimpleName() + "@"
        + Integer.toHexString(System.identityHashCode(transactionManager)) + "]";
  }

  private static SpringTx newestOpen() {
    Deque<SpringTx> stack = open.get();
    if (stack == null) {
      return null;
    }
    // handles completed directly through their status
    while (!stack.isEmpty() && stack.peek().status.isCompleted()) {
      stack.pop();
    }
    return stack.peek();
  }

  private void closed() {
    Deque<SpringTx> stack = open.get();
    if (stack == null) {
      return;
    }
    stack.remove(this);
    if (stack.isEmpty()) {
      open.remove();
    }
  }
}
