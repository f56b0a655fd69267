package uow.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import uow.RunPhase;
import uow.spi.Tx;
import uow.spi.UnitOfWorkListener;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link UnitOfWorkListener}.
 *
 * <p>Registers counters and a timer with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code uow.run.committed}: runs that committed every transaction</li>
 *   <li>{@code uow.transactions.committed}: transactions committed by those runs</li>
 *   <li>{@code uow.run.rolled.back}: runs rolled back, tagged {@code phase=begin|execute|commit}</li>
 *   <li>{@code uow.rollback.failure}: individual rollbacks that failed during cleanup</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code uow.run.duration}: duration of whole runs</li>
 * </ul>
 *
 * @see UnitOfWorkListener
 */
public final class MicrometerUnitOfWorkListener implements UnitOfWorkListener, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter runsCommitted;
  private final Counter transactionsCommitted;
  private final Map<RunPhase, Counter> runsRolledBack = new EnumMap<>(RunPhase.class);
  private final Counter rollbackFailures;
  private final Timer runDuration;
  private volatile boolean closed;

  /**
   * Creates a listener with the default metric name prefix {@code "uow"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerUnitOfWorkListener(MeterRegistry registry) {
    this(registry, "uow");
  }

  /**
   * Creates a listener with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.uow"})
   */
  public MicrometerUnitOfWorkListener(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.runsCommitted = Counter.builder(namePrefix + ".run.committed")
        .description("Units of work that committed every transaction")
        .register(registry);
    this.transactionsCommitted = Counter.builder(namePrefix + ".transactions.committed")
        .description("Transactions committed by successful units of work")
        .register(registry);
    for (RunPhase phase : RunPhase.values()) {
      runsRolledBack.put(phase, Counter.builder(namePrefix + ".run.rolled.back")
          .description("Units of work rolled back")
          .tag("phase", phase.name().toLowerCase(Locale.ROOT))
          .register(registry));
    }
    this.rollbackFailures = Counter.builder(namePrefix + ".rollback.failure")
        .description("Rollbacks that failed during cleanup")
        .register(registry);
    this.runDuration = Timer.builder(namePrefix + ".run.duration")
        .description("Duration of units of work")
        .register(registry);
  }

  @Override
  public void onCommitted(int transactionCount) {
    if (closed) return;
    runsCommitted.increment();
    transactionsCommitted.increment(transactionCount);
  }

  @Override
  public void onRolledBack(RunPhase phase, Exception cause) {
    if (closed) return;
    runsRolledBack.get(phase).increment();
  }

  @Override
  public void onRollbackFailure(Tx tx, Exception failure) {
    if (closed) return;
    rollbackFailures.increment();
  }

  @Override
  public void recordRunDurationNanos(long nanos) {
    if (closed) return;
    runDuration.record(nanos, TimeUnit.NANOSECONDS);
  }

  /**
   * Removes all meters registered by this listener from the registry.
   *
   * <p>Call this when the listener is no longer needed to prevent stale meters.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(runsCommitted, transactionsCommitted,
        rollbackFailures, runDuration));
    meters.addAll(runsRolledBack.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
