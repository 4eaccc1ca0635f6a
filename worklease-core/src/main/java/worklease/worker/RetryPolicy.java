package worklease.worker;

/**
 * Strategy for computing how long to wait before re-attempting a unit that already failed.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param attempts the number of failed attempts so far (1-based; 0 means none)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);
}
