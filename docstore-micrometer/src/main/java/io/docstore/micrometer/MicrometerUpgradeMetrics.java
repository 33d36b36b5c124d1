package io.docstore.micrometer;

import io.docstore.spi.UpgradeMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link UpgradeMetrics}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code docstore.upgrade.databases.visited}: databases the maintenance procedure was invoked for</li>
 *   <li>{@code docstore.upgrade.databases.failed}: the visited databases whose procedure failed or raised an error</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code docstore.upgrade.sweep.duration.ms}: duration of the last sweep in milliseconds</li>
 * </ul>
 *
 * @see UpgradeMetrics
 */
public final class MicrometerUpgradeMetrics implements UpgradeMetrics, AutoCloseable {
  public static final String DEFAULT_NAME_PREFIX = "docstore.upgrade";

  private final MeterRegistry registry;
  private final Counter databasesVisited;
  private final Counter databaseFailures;
  private final Gauge sweepDurationGauge;

  private final AtomicLong sweepDurationMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates metrics with the default name prefix {@value #DEFAULT_NAME_PREFIX}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerUpgradeMetrics(MeterRegistry registry) {
    this(registry, DEFAULT_NAME_PREFIX);
  }

  /**
   * Creates metrics with a custom name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "node1.upgrade"})
   */
  public MicrometerUpgradeMetrics(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.databasesVisited = Counter.builder(namePrefix + ".databases.visited")
        .description("Databases the maintenance procedure was invoked for")
        .register(registry);
    this.databaseFailures = Counter.builder(namePrefix + ".databases.failed")
        .description("Visited databases whose maintenance procedure failed or raised an error")
        .register(registry);
    this.sweepDurationGauge = Gauge.builder(namePrefix + ".sweep.duration.ms", sweepDurationMs, AtomicLong::get)
        .description("Duration of the last init/upgrade sweep in milliseconds")
        .register(registry);
  }

  @Override
  public void incrementDatabasesVisited() {
    if (closed) return;
    databasesVisited.increment();
  }

  @Override
  public void incrementDatabaseFailures() {
    if (closed) return;
    databaseFailures.increment();
  }

  @Override
  public void recordSweepDurationMs(long durationMs) {
    if (closed) return;
    sweepDurationMs.set(durationMs);
  }

  /**
   * Removes all meters registered by this instance from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(databasesVisited, databaseFailures, sweepDurationGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
