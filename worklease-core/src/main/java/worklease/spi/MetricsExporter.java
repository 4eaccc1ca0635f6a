package worklease.spi;

/**
 * Observability hook for exporting claim, outcome and reclaim counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see worklease.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Adds the number of units leased by one claim.
     *
     * @param count units claimed (may be zero)
     */
    void incrementClaimed(int count);

    /**
     * Increments the count of units whose stage completed.
     */
    void incrementSucceeded();

    /**
     * Increments the count of failed attempts that returned the unit to its pending status.
     */
    void incrementRetried();

    /**
     * Increments the count of units moved to FAILED.
     */
    void incrementFailed();

    /**
     * Adds the number of stale leases returned to the pool by one sweep.
     *
     * @param count units reclaimed (may be zero)
     */
    void incrementReclaimed(int count);

    /**
     * Increments the count of outcome commits rejected because the lease was no longer held.
     */
    default void incrementLeaseLost() {
    }

    /**
     * Increments the count of claim or commit operations that failed against the store.
     */
    default void incrementStoreErrors() {
    }

    /**
     * Records the size of the most recent claimed batch.
     */
    default void recordBatchSize(int size) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementClaimed(int count) {
        }

        @Override
        public void incrementSucceeded() {
        }

        @Override
        public void incrementRetried() {
        }

        @Override
        public void incrementFailed() {
        }

        @Override
        public void incrementReclaimed(int count) {
        }
    }
}
