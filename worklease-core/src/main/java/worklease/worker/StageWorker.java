package worklease.worker;

import worklease.lease.LeaseLostException;
import worklease.lease.LeaseManager;
import worklease.lease.LeaseOwners;
import worklease.model.IllegalTransitionException;
import worklease.model.LeasedUnit;
import worklease.model.WorkStatus;
import worklease.reclaim.LeaseTimeouts;
import worklease.reclaim.StaleLeaseReclaimer;
import worklease.spi.MetricsExporter;
import worklease.spi.WorkStoreException;
import worklease.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polling consumer for one pipeline stage.
 *
 * <p>Each cycle optionally reclaims stale leases, claims a batch of units waiting for the
 * stage, runs each through the {@link StageProcessor}, and commits each outcome in its own
 * transaction. A full batch is followed immediately by another claim in the same cycle; an
 * empty or short batch ends the cycle until the next scheduled poll.
 *
 * <p>Units that already failed wait {@link RetryPolicy#computeDelayMs} before being
 * re-attempted. The backoff of a unit must end before its lease times out; otherwise the
 * rest of the batch is left to the reclaimer. Before each processor call the worker checks
 * that it still holds the unit's lease and skips the unit if not. A commit that fails against the store is retried up to
 * {@code commitAttempts} times; after that the lease is abandoned to the reclaimer.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * <p>This class is thread-safe. The {@link #start()} and {@link #close()} methods are
 * synchronized to prevent concurrent lifecycle transitions.
 *
 * @see StageWorker.Builder
 * @see LeaseManager
 */
public final class StageWorker implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(StageWorker.class.getName());

    private final LeaseManager leaseManager;
    private final StaleLeaseReclaimer reclaimer;
    private final StageProcessor processor;
    private final int stage;
    private final WorkStatus fromStatus;
    private final int batchSize;
    private final long intervalMs;
    private final String leaseOwner;
    private final RetryPolicy retryPolicy;
    private final RetryPolicy commitRetryPolicy;
    private final int commitAttempts;
    private final LeaseTimeouts leaseTimeouts;
    private final Clock clock;
    private final MetricsExporter metrics;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    private StageWorker(Builder builder) {
        this.leaseManager = Objects.requireNonNull(builder.leaseManager, "leaseManager");
        this.processor = Objects.requireNonNull(builder.processor, "processor");

        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.commitAttempts <= 0) {
            throw new IllegalArgumentException("commitAttempts must be > 0");
        }
        if (builder.leaseOwner != null && builder.leaseOwner.isBlank()) {
            throw new IllegalArgumentException("leaseOwner must not be blank");
        }

        this.stage = builder.stage;
        this.fromStatus = leaseManager.pipeline().pendingStatus(stage);
        this.reclaimer = builder.reclaimer;
        this.batchSize = builder.batchSize;
        this.intervalMs = builder.intervalMs;
        this.leaseOwner = builder.leaseOwner != null ? builder.leaseOwner : LeaseOwners.unique();
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
        this.commitRetryPolicy = builder.commitRetryPolicy != null
                ? builder.commitRetryPolicy : new ExponentialBackoffRetryPolicy(100, 2_000);
        this.commitAttempts = builder.commitAttempts;
        if (builder.leaseTimeouts != null) {
            this.leaseTimeouts = builder.leaseTimeouts;
        } else {
            this.leaseTimeouts = reclaimer != null ? reclaimer.timeouts() : LeaseTimeouts.defaults();
        }
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String leaseOwner() {
        return leaseOwner;
    }

    public int stage() {
        return stage;
    }

    /**
     * Starts the scheduled polling loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("StageWorker has been closed");
        }
        if (pollTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(
                new DaemonThreadFactory("worklease-stage" + stage + "-"));
        pollTask = scheduler.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.log(Level.INFO, "Stage {0} worker {1} started (batchSize={2}, intervalMs={3})",
                new Object[]{stage, leaseOwner, batchSize, intervalMs});
    }

    /**
     * Executes a single poll cycle. Called automatically by the scheduler, but may also be
     * invoked directly for testing.
     *
     * @return number of units processed in this cycle
     */
    public int poll() {
        if (closed) {
            return 0;
        }
        int processed = 0;
        try {
            while (!closed) {
                if (reclaimer != null) {
                    reclaim();
                }
                List<LeasedUnit> batch = claimBatch();
                if (batch == null || batch.isEmpty()) {
                    break;
                }
                for (int i = 0; i < batch.size(); i++) {
                    LeasedUnit unit = batch.get(i);
                    if (Thread.currentThread().isInterrupted()) {
                        logger.log(Level.WARNING, "Worker {0} interrupted; leaving {1} leases to the reclaimer",
                                new Object[]{leaseOwner, batch.size() - i});
                        return processed;
                    }
                    long delayMs = unit.retryCount() > 0 ? retryPolicy.computeDelayMs(unit.retryCount()) : 0L;
                    long remainingMs = leaseRemainingMs(unit);
                    if (delayMs >= remainingMs) {
                        logger.log(Level.WARNING,
                                "Lease on unit {0} has {1} ms left, less than its {2} ms backoff; "
                                        + "leaving {3} leases to the reclaimer",
                                new Object[]{unit.unitId(), Math.max(0L, remainingMs), delayMs, batch.size() - i});
                        return processed;
                    }
                    if (process(unit, delayMs)) {
                        processed++;
                    }
                }
                if (batch.size() < batchSize) {
                    break;
                }
            }
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Poll cycle failed", t);
        }
        return processed;
    }

    private void reclaim() {
        try {
            reclaimer.reclaimStale();
        } catch (WorkStoreException e) {
            metrics.incrementStoreErrors();
            logger.log(Level.SEVERE, "Stale-lease sweep before claim failed", e);
        }
    }

    /**
     * Returns {@code null} on failure, to distinguish from a successful empty claim.
     */
    private List<LeasedUnit> claimBatch() {
        try {
            return leaseManager.claim(fromStatus, batchSize, leaseOwner);
        } catch (WorkStoreException e) {
            metrics.incrementStoreErrors();
            logger.log(Level.SEVERE, "Failed to claim units from " + fromStatus, e);
            return null;
        }
    }

    private long leaseRemainingMs(LeasedUnit unit) {
        Duration timeout = leaseTimeouts.forStage(unit.stage());
        return Duration.between(clock.instant(), unit.leaseStartedAt().plus(timeout)).toMillis();
    }

    /**
     * Returns {@code false} if the unit was abandoned before its outcome was committed.
     */
    private boolean process(LeasedUnit unit, long delayMs) {
        if (!sleep(delayMs) || !stillLeased(unit)) {
            return false;
        }

        StageResult result;
        try {
            result = processor.process(unit.unitId());
            if (result == null) {
                result = StageResult.failure("StageProcessor returned null");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.log(Level.WARNING, "Interrupted while processing unit " + unit.unitId(), e);
            return false;
        } catch (Exception e) {
            logger.log(Level.FINE, "Stage " + stage + " failed for unit " + unit.unitId(), e);
            result = StageResult.failure(describe(e));
        }
        return commit(unit, result);
    }

    private boolean stillLeased(LeasedUnit unit) {
        try {
            if (leaseManager.holdsLease(unit)) {
                return true;
            }
            metrics.incrementLeaseLost();
            logger.log(Level.WARNING, "Worker {0} no longer holds the lease on unit {1}; skipping it",
                    new Object[]{leaseOwner, unit.unitId()});
        } catch (WorkStoreException e) {
            metrics.incrementStoreErrors();
            logger.log(Level.SEVERE, "Cannot verify lease on unit " + unit.unitId() + "; skipping it", e);
        }
        return false;
    }

    private boolean commit(LeasedUnit unit, StageResult result) {
        for (int attempt = 1; attempt <= commitAttempts; attempt++) {
            try {
                if (result instanceof StageResult.Failure failure) {
                    leaseManager.fail(unit, failure.message());
                } else {
                    leaseManager.complete(unit);
                }
                return true;
            } catch (LeaseLostException e) {
                logger.log(Level.WARNING, e.getMessage());
                return false;
            } catch (IllegalTransitionException e) {
                logger.log(Level.SEVERE, "Rejected outcome for unit " + unit.unitId(), e);
                return false;
            } catch (WorkStoreException e) {
                metrics.incrementStoreErrors();
                if (attempt == commitAttempts) {
                    logger.log(Level.SEVERE, "Giving up committing unit " + unit.unitId()
                            + " after " + commitAttempts + " attempts; lease left to the reclaimer", e);
                    return false;
                }
                logger.log(Level.WARNING, "Commit attempt " + attempt + " failed for unit " + unit.unitId(), e);
                if (!sleep(commitRetryPolicy.computeDelayMs(attempt))) {
                    return false;
                }
            }
        }
        return false;
    }

    private static boolean sleep(long delayMs) {
        if (delayMs <= 0L) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank()
                ? e.getClass().getName()
                : e.getClass().getSimpleName() + ": " + message;
    }

    /**
     * Cancels the polling schedule and shuts down the scheduler thread. Units leased by an
     * in-flight cycle that does not finish in time are recovered by the reclaimer.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
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

    /**
     * Builder for {@link StageWorker}.
     */
    public static final class Builder {
        private LeaseManager leaseManager;
        private StaleLeaseReclaimer reclaimer;
        private StageProcessor processor;
        private int stage = 1;
        private int batchSize = 50;
        private long intervalMs = 5000;
        private String leaseOwner;
        private RetryPolicy retryPolicy;
        private RetryPolicy commitRetryPolicy;
        private int commitAttempts = 3;
        private LeaseTimeouts leaseTimeouts;
        private Clock clock;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the lease manager used to claim units and commit outcomes.
         *
         * <p><b>Required.</b>
         *
         * @param leaseManager the lease manager
         * @return this builder
         */
        public Builder leaseManager(LeaseManager leaseManager) {
            this.leaseManager = leaseManager;
            return this;
        }

        /**
         * Sets the collaborator that performs the stage for one unit.
         *
         * <p><b>Required.</b>
         *
         * @param processor the stage processor
         * @return this builder
         */
        public Builder processor(StageProcessor processor) {
            this.processor = processor;
            return this;
        }

        /**
         * Sets the 1-based stage this worker processes.
         *
         * <p>Optional. Defaults to {@code 1}. Must be within the lease manager's pipeline.
         *
         * @param stage stage number
         * @return this builder
         */
        public Builder stage(int stage) {
            this.stage = stage;
            return this;
        }

        /**
         * Sets the maximum number of units claimed at once.
         *
         * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
         *
         * @param batchSize max units per claim
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the delay between poll cycles in milliseconds.
         *
         * <p>Optional. Defaults to {@code 5000} ms. Must be &gt; 0.
         *
         * @param intervalMs polling interval in milliseconds
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Sets the identity recorded on leases taken by this worker.
         *
         * <p>Optional. Defaults to {@link LeaseOwners#unique()}.
         *
         * @param leaseOwner unique identifier for this worker (e.g. hostname and pid)
         * @return this builder
         */
        public Builder leaseOwner(String leaseOwner) {
            this.leaseOwner = leaseOwner;
            return this;
        }

        /**
         * Sweeps stale leases before every claim, for deployments without a
         * {@link worklease.reclaim.ReclaimScheduler}.
         *
         * <p>Optional. Disabled by default.
         *
         * @param reclaimer the reclaimer to run before each claim
         * @return this builder
         */
        public Builder reclaimBeforeClaim(StaleLeaseReclaimer reclaimer) {
            this.reclaimer = Objects.requireNonNull(reclaimer, "reclaimer");
            return this;
        }

        /**
         * Sets the backoff applied before re-attempting a unit that already failed.
         *
         * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} (5 s base, 5 min cap).
         *
         * @param retryPolicy the retry policy
         * @return this builder
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Sets the backoff between attempts to commit an outcome after a store failure.
         *
         * <p>Optional. Defaults to exponential backoff from 100 ms to 2 s.
         *
         * @param commitRetryPolicy the commit retry policy
         * @return this builder
         */
        public Builder commitRetryPolicy(RetryPolicy commitRetryPolicy) {
            this.commitRetryPolicy = commitRetryPolicy;
            return this;
        }

        /**
         * Sets how many times an outcome commit is attempted before the lease is abandoned.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &gt; 0.
         *
         * @param commitAttempts commit attempts per unit
         * @return this builder
         */
        public Builder commitAttempts(int commitAttempts) {
            this.commitAttempts = commitAttempts;
            return this;
        }

        /**
         * Sets the lease timeouts the reclaimer enforces, so the worker stops a batch before
         * waiting out a lease that would be reclaimed.
         *
         * <p>Optional. Defaults to the timeouts of the {@link #reclaimBeforeClaim} reclaimer,
         * or {@link LeaseTimeouts#defaults()}.
         *
         * @param leaseTimeouts lease timeouts per stage
         * @return this builder
         */
        public Builder leaseTimeouts(LeaseTimeouts leaseTimeouts) {
            this.leaseTimeouts = leaseTimeouts;
            return this;
        }

        /**
         * Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock clock used to compute lease deadlines
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the metrics exporter for store-error and lost-lease counters.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}. Claim and outcome counters
         * are recorded by the {@link LeaseManager}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Builds the worker. Call {@link StageWorker#start()} to begin polling.
         *
         * @return a new {@link StageWorker} instance
         * @throws NullPointerException     if {@code leaseManager} or {@code processor} is null
         * @throws IllegalArgumentException if {@code stage} is outside the pipeline,
         *                                  {@code batchSize <= 0}, {@code intervalMs <= 0},
         *                                  or {@code commitAttempts <= 0}
         */
        public StageWorker build() {
            return new StageWorker(this);
        }
    }
}
