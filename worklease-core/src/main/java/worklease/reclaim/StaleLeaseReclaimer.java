package worklease.reclaim;

import worklease.spi.ConnectionProvider;
import worklease.spi.MetricsExporter;
import worklease.spi.WorkStore;
import worklease.spi.WorkStoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Returns leases held longer than their timeout to the pending status of the stage they
 * were working on. The retry count is untouched: a stale lease is not a failed attempt.
 *
 * <p>Each sweep runs in one transaction and is idempotent. Call it from a
 * {@link ReclaimScheduler}, or before each claim via
 * {@link worklease.worker.StageWorker.Builder#reclaimBeforeClaim}.
 */
public final class StaleLeaseReclaimer {
  private static final Logger logger = Logger.getLogger(StaleLeaseReclaimer.class.getName());

  private final ConnectionProvider connectionProvider;
  private final WorkStore workStore;
  private final LeaseTimeouts timeouts;
  private final Clock clock;
  private final MetricsExporter metrics;

  public StaleLeaseReclaimer(ConnectionProvider connectionProvider, WorkStore workStore,
      LeaseTimeouts timeouts) {
    this(connectionProvider, workStore, timeouts, Clock.systemUTC(), MetricsExporter.NOOP);
  }

  public StaleLeaseReclaimer(ConnectionProvider connectionProvider, WorkStore workStore,
      LeaseTimeouts timeouts, Clock clock, MetricsExporter metrics) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.workStore = Objects.requireNonNull(workStore, "workStore");
    this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  public LeaseTimeouts timeouts() {
    return timeouts;
  }

  /**
   * Reclaims leases older than the configured timeouts.
   *
   * @return number of units returned to their pending status
   * @throws WorkStoreException if the sweep fails; nothing is reclaimed
   */
  public int reclaimStale() {
    Instant now = clock.instant();
    int reclaimed = inTransaction(conn -> {
      if (!timeouts.hasOverrides()) {
        return workStore.reclaimStale(conn, now.minus(timeouts.defaultTimeout()));
      }
      int total = 0;
      for (int stage = 1; stage <= workStore.pipeline().stageCount(); stage++) {
        total += workStore.reclaimStale(conn, stage, now.minus(timeouts.forStage(stage)));
      }
      return total;
    });
    record(reclaimed);
    return reclaimed;
  }

  /**
   * Reclaims every lease older than {@code timeout}, ignoring the configured timeouts.
   *
   * @param timeout lease age beyond which a lease is stale (positive)
   * @return number of units returned to their pending status
   */
  public int reclaimStale(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
    }
    Instant cutoff = clock.instant().minus(timeout);
    int reclaimed = inTransaction(conn -> workStore.reclaimStale(conn, cutoff));
    record(reclaimed);
    return reclaimed;
  }

  private void record(int reclaimed) {
    metrics.incrementReclaimed(reclaimed);
    if (reclaimed > 0) {
      logger.log(Level.INFO, "Reclaimed {0} stale leases", reclaimed);
    }
  }

  private int inTransaction(SweepWork work) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        int reclaimed = work.run(conn);
        conn.commit();
        return reclaimed;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new WorkStoreException("Failed to reclaim stale leases", e);
    }
  }

  @FunctionalInterface
  private interface SweepWork {
    int run(Connection conn);
  }
}
