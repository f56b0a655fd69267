package uow;

import uow.spi.ContextKeyProvider;
import uow.spi.Transactional;
import uow.spi.Tx;
import uow.spi.UnitOfWorkListener;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a group of operations over several independently transactional resources
 * as a single all-or-nothing unit.
 *
 * <p>Each {@link #run(Work) run}:
 * <ol>
 *   <li>begins one transaction per distinct coordination key, in construction order;</li>
 *   <li>invokes the work with a {@link TxLookup} resolving each resource's live handle;</li>
 *   <li>commits every begun handle in begin order if the work succeeds, or rolls them all
 *       back in begin order if beginning, the work, or a commit fails.</li>
 * </ol>
 *
 * <p>The coordination key of a resource is its {@link ContextKeyProvider#contextKey()
 * context key} if it provides one, otherwise its own identity. Resources sharing a key
 * share one transaction: it is begun, committed, and rolled back exactly once.
 *
 * <p>Commits are sequential and best-effort, not atomic across resources. When a commit
 * fails, the handles that already committed are rolled back too, which only undoes
 * anything if the resource supports it.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * UnitOfWork unit = UnitOfWork.of(orders, inventory);
 * unit.run(lookup -> {
 *   orders.place(lookup, order);
 *   inventory.reserve(lookup, order.items());
 * });
 * }</pre>
 *
 * <p>Runs execute synchronously on the calling thread. Per-run state is never shared
 * between runs, so the coordinator itself may be reused; whether runs may overlap is
 * up to the resources.
 *
 * @see Transactional
 * @see Tx
 * @see TxLookup
 */
public final class UnitOfWork {
  private static final Logger logger = Logger.getLogger(UnitOfWork.class.getName());

  private final List<Transactional> resources;
  private final UnitOfWorkListener listener;

  private UnitOfWork(List<Transactional> resources, UnitOfWorkListener listener) {
    this.resources = List.copyOf(resources);
    this.listener = listener;
  }

  /**
   * Creates a unit of work over the given candidates with no listener.
   *
   * @param candidates the participating resources, in begin order
   * @return a new unit of work; nothing is begun yet
   * @throws UnitOfWorkException if a candidate is not {@link Transactional}
   */
  public static UnitOfWork of(Object... candidates) {
    return builder().resources(candidates).build();
  }

  /**
   * Creates a builder for a unit of work.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the participating resources in construction order.
   */
  public List<Transactional> resources() {
    return resources;
  }

  /**
   * Runs {@code work} as one unit of work.
   *
   * @param work the operations to run
   * @throws Exception the failure of the first step that failed: a begin failure, the
   *                   exception thrown by the work, or a commit failure
   * @see #run(TxLookup, Work)
   */
  public void run(Work work) throws Exception {
    run(TxLookup.empty(), work);
  }

  /**
   * Runs {@code work} as one unit of work, resolving resources that take no part in it
   * through {@code base}.
   *
   * <p>Passing the lookup of an enclosing unit of work lets nested code keep seeing
   * the outer transactions.
   *
   * @param base lookup consulted for resources without a transaction in this run
   * @param work the operations to run
   * @throws Exception the failure of the first step that failed
   */
  public void run(TxLookup base, Work work) throws Exception {
    Objects.requireNonNull(work, "work");
    call(base, lookup -> {
      work.execute(lookup);
      return null;
    });
  }

  /**
   * Runs {@code fn} as one unit of work and returns its result once every
   * transaction committed.
   *
   * @param fn  the operations to run
   * @param <T> result type
   * @return the result of {@code fn}
   * @throws Exception the failure of the first step that failed
   */
  public <T> T call(WorkFunction<T> fn) throws Exception {
    return call(TxLookup.empty(), fn);
  }

  /**
   * Runs {@code fn} as one unit of work, resolving resources that take no part in it
   * through {@code base}.
   *
   * <p>Any {@link Exception} thrown by {@code fn} is rethrown unchanged after rollback.
   * Other throwables are recovered and reported as a {@link UnitOfWorkException} whose
   * message starts with {@code "recovered: "}. Rollback failures never replace the
   * reported failure; they are attached to it as {@linkplain Throwable#getSuppressed()
   * suppressed} exceptions and passed to the listener.
   *
   * @param base lookup consulted for resources without a transaction in this run
   * @param fn   the operations to run
   * @param <T>  result type
   * @return the result of {@code fn}
   * @throws Exception the failure of the first step that failed
   */
  public <T> T call(TxLookup base, WorkFunction<T> fn) throws Exception {
    Objects.requireNonNull(base, "base");
    Objects.requireNonNull(fn, "fn");
    long start = System.nanoTime();
    try {
      return new Run(base).execute(fn);
    } finally {
      long elapsed = Math.max(0L, System.nanoTime() - start);
      notifyListener("recordRunDurationNanos", () -> listener.recordRunDurationNanos(elapsed));
    }
  }

  static Object coordinationKey(Object resource) {
    if (resource instanceof ContextKeyProvider provider) {
      Object key = provider.contextKey();
      if (key != null) {
        return key;
      }
    }
    return new IdentityKey(resource);
  }

  private void notifyListener(String callback, Runnable notification) {
    try {
      notification.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "UnitOfWorkListener." + callback + " failed", e);
    }
  }

  /**
   * State of a single run: the context map and the handles begun, in begin order.
   */
  private final class Run implements TxLookup {
    private final TxLookup base;
    private final Map<Object, Tx> contexts = new HashMap<>();
    private final List<Tx> begun = new ArrayList<>();

    private Run(TxLookup base) {
      this.base = base;
    }

    <T> T execute(WorkFunction<T> fn) throws Exception {
      try {
        try {
          beginAll();
        } catch (Throwable t) {
          throw rollbackAll(RunPhase.BEGIN, UnitOfWorkException.recovered(t));
        }

        T result;
        try {
          result = fn.apply(this);
        } catch (Throwable t) {
          throw rollbackAll(RunPhase.EXECUTE, UnitOfWorkException.recovered(t));
        }

        commitAll();
        return result;
      } finally {
        contexts.clear();
        begun.clear();
      }
    }

    @Override
    public Optional<Tx> find(Object resource) {
      Objects.requireNonNull(resource, "resource");
      Tx tx = contexts.get(coordinationKey(resource));
      return tx != null ? Optional.of(tx) : base.find(resource);
    }

    private void beginAll() throws Exception {
      for (Transactional resource : resources) {
        Object key = coordinationKey(resource);
        if (contexts.containsKey(key)) {
          logger.log(Level.FINE, "Sharing transaction of context {0}", key);
          continue;
        }
        Tx tx = Objects.requireNonNull(resource.begin(),
            () -> resource.getClass().getName() + ".begin() returned null");
        contexts.put(key, tx);
        begun.add(tx);
      }
      logger.log(Level.FINE, "Begun {0} transaction(s) for {1} resource(s)",
          new Object[] {begun.size(), resources.size()});
    }

    private void commitAll() throws Exception {
      for (Tx tx : begun) {
        try {
          tx.commit();
        } catch (Throwable t) {
          throw rollbackAll(RunPhase.COMMIT, UnitOfWorkException.recovered(t));
        }
      }
      int committed = begun.size();
      logger.log(Level.FINE, "Committed {0} transaction(s)", committed);
      notifyListener("onCommitted", () -> listener.onCommitted(committed));
    }

    /**
     * Rolls back every begun handle and returns {@code cause} for rethrowing.
     */
    private Exception rollbackAll(RunPhase phase, Exception cause) {
      for (Tx tx : begun) {
        try {
          tx.rollback();
        } catch (Throwable t) {
          Exception e = UnitOfWorkException.recovered(t);
          logger.log(Level.WARNING, "Rollback of " + tx + " failed after " + phase + " failure", t);
          if (e != cause) {
            cause.addSuppressed(e);
          }
          notifyListener("onRollbackFailure", () -> listener.onRollbackFailure(tx, e));
        }
      }
      logger.log(Level.FINE, "Rolled back {0} transaction(s) after {1} failure: {2}",
          new Object[] {begun.size(), phase, cause});
      notifyListener("onRolledBack", () -> listener.onRolledBack(phase, cause));
      return cause;
    }
  }

  /**
   * Coordination key of a resource without a context key: equal only to itself.
   */
  private static final class IdentityKey {
    private final Object resource;

    private IdentityKey(Object resource) {
      this.resource = resource;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof IdentityKey other && other.resource == resource;
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(resource);
    }

    @Override
    public String toString() {
      return resource.getClass().getName() + "@" + Integer.toHexString(hashCode());
    }
  }

  /**
   * Builder for {@link UnitOfWork}. Candidates are validated by {@link #build()}.
   */
  public static final class Builder {
    private final List<Object> candidates = new ArrayList<>();
    private UnitOfWorkListener listener = UnitOfWorkListener.NOOP;

    private Builder() {
    }

    /**
     * Adds one candidate resource.
     */
    public Builder resource(Object candidate) {
      candidates.add(candidate);
      return this;
    }

    /**
     * Adds candidate resources in order.
     */
    public Builder resources(Object... candidates) {
      Objects.requireNonNull(candidates, "candidates");
      this.candidates.addAll(Arrays.asList(candidates));
      return this;
    }

    /**
     * Adds candidate resources in iteration order.
     */
    public Builder resources(Collection<?> candidates) {
      Objects.requireNonNull(candidates, "candidates");
      this.candidates.addAll(candidates);
      return this;
    }

    /**
     * Sets the run listener; {@code null} defaults to {@link UnitOfWorkListener#NOOP}.
     */
    public Builder listener(UnitOfWorkListener listener) {
      this.listener = listener == null ? UnitOfWorkListener.NOOP : listener;
      return this;
    }

    /**
     * Validates the candidates and creates the unit of work.
     *
     * @throws UnitOfWorkException naming the type of the first candidate that does not
     *                             implement {@link Transactional}
     */
    public UnitOfWork build() {
      List<Transactional> resources = new ArrayList<>(candidates.size());
      for (Object candidate : candidates) {
        if (!(candidate instanceof Transactional transactional)) {
          String type = candidate == null ? "null" : candidate.getClass().getName();
          throw new UnitOfWorkException("cannot create unit of work: component " + type
              + " does not implement " + Transactional.class.getName());
        }
        resources.add(transactional);
      }
      return new UnitOfWork(resources, listener);
    }
  }
}
