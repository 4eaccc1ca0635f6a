package worklease.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import worklease.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code worklease.claimed}: units leased by claims</li>
 *   <li>{@code worklease.succeeded}: stages completed</li>
 *   <li>{@code worklease.retried}: failed attempts returned to pending</li>
 *   <li>{@code worklease.failed}: units moved to FAILED</li>
 *   <li>{@code worklease.reclaimed}: stale leases returned to pending</li>
 *   <li>{@code worklease.lease.lost}: outcome commits rejected for a lost lease</li>
 *   <li>{@code worklease.store.errors}: claim or commit failures against the store</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code worklease.batch.last.size}: size of the most recent claimed batch</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter claimed;
  private final Counter succeeded;
  private final Counter retried;
  private final Counter failed;
  private final Counter reclaimed;
  private final Counter leaseLost;
  private final Counter storeErrors;
  private final Gauge lastBatchGauge;

  private final AtomicInteger lastBatchSize = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "worklease"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "worklease");
  }

  /**
   * Creates an exporter with a custom metric name prefix, e.g. one per pipeline.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "developers.worklease"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.claimed = Counter.builder(namePrefix + ".claimed")
        .description("Units leased by claims")
        .register(registry);
    this.succeeded = Counter.builder(namePrefix + ".succeeded")
        .description("Stages completed")
        .register(registry);
    this.retried = Counter.builder(namePrefix + ".retried")
        .description("Failed attempts returned to pending")
        .register(registry);
    this.failed = Counter.builder(namePrefix + ".failed")
        .description("Units moved to FAILED")
        .register(registry);
    this.reclaimed = Counter.builder(namePrefix + ".reclaimed")
        .description("Stale leases returned to pending")
        .register(registry);
    this.leaseLost = Counter.builder(namePrefix + ".lease.lost")
        .description("Outcome commits rejected because the lease was lost")
        .register(registry);
    this.storeErrors = Counter.builder(namePrefix + ".store.errors")
        .description("Claim or commit failures against the store")
        .register(registry);

    this.lastBatchGauge = Gauge.builder(namePrefix + ".batch.last.size", lastBatchSize, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementClaimed(int count) {
    if (closed || count <= 0) return;
    claimed.increment(count);
  }

  @Override
  public void incrementSucceeded() {
    if (closed) return;
    succeeded.increment();
  }

  @Override
  public void incrementRetried() {
    if (closed) return;
    retried.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementReclaimed(int count) {
    if (closed || count <= 0) return;
    reclaimed.increment(count);
  }

  @Override
  public void incrementLeaseLost() {
    if (closed) return;
    leaseLost.increment();
  }

  @Override
  public void incrementStoreErrors() {
    if (closed) return;
    storeErrors.increment();
  }

  @Override
  public void recordBatchSize(int size) {
    if (closed) return;
    lastBatchSize.set(size);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(claimed, succeeded, retried, failed, reclaimed,
        leaseLost, storeErrors, lastBatchGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
