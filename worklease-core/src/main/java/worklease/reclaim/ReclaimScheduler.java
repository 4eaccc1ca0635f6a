package worklease.reclaim;

import worklease.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a {@link StaleLeaseReclaimer} on a fixed delay, independent of any worker.
 *
 * <p>Builder pattern, {@link AutoCloseable}, one daemon thread, synchronized lifecycle.
 * A failed sweep is logged and retried at the next interval.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see ReclaimScheduler.Builder
 */
public final class ReclaimScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ReclaimScheduler.class.getName());

  private final StaleLeaseReclaimer reclaimer;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> reclaimTask;
  private volatile boolean closed;

  private ReclaimScheduler(Builder builder) {
    this.reclaimer = Objects.requireNonNull(builder.reclaimer, "reclaimer");
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled reclaim loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("ReclaimScheduler has been closed");
    }
    if (reclaimTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("worklease-reclaim-"));
    reclaimTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Executes a single sweep. May be invoked directly for testing or one-off sweeps.
   *
   * @return units reclaimed, or {@code 0} if closed or the sweep failed
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      return reclaimer.reclaimStale();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Reclaim cycle failed", t);
      return 0;
    }
  }

  /** Cancels the reclaim schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (reclaimTask != null) {
      reclaimTask.cancel(false);
      reclaimTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link ReclaimScheduler}. */
  public static final class Builder {
    private StaleLeaseReclaimer reclaimer;
    private long intervalSeconds = 300;

    private Builder() {}

    /**
     * Sets the reclaimer run on each tick.
     *
     * <p><b>Required.</b>
     *
     * @param reclaimer the stale-lease reclaimer
     * @return this builder
     */
    public Builder reclaimer(StaleLeaseReclaimer reclaimer) {
      this.reclaimer = reclaimer;
      return this;
    }

    /**
     * Sets the delay in seconds between sweeps.
     *
     * <p>Optional. Defaults to {@code 300} (5 minutes). Must be &gt; 0.
     *
     * @param intervalSeconds reclaim interval in seconds
     * @return this builder
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /**
     * Builds the scheduler. Call {@link ReclaimScheduler#start()} to begin.
     *
     * @return a new {@link ReclaimScheduler} instance
     * @throws NullPointerException     if {@code reclaimer} is null
     * @throws IllegalArgumentException if {@code intervalSeconds <= 0}
     */
    public ReclaimScheduler build() {
      return new ReclaimScheduler(this);
    }
  }
}
