package worklease.worker;

/**
 * Performs one pipeline stage for one unit, for example fetching a developer profile.
 *
 * <p>Invoked by {@link StageWorker} while the worker holds the unit's lease. Returning
 * {@link StageResult#failure(String)} and throwing are treated alike: the attempt counts
 * against the unit's retry budget and the message becomes its last error. Implementations
 * should finish well within the lease timeout, including their own internal retries.
 */
@FunctionalInterface
public interface StageProcessor {

    /**
     * @param unitId id of the leased unit
     * @return the outcome; never {@code null}
     * @throws Exception on failure, equivalent to returning a failure result
     */
    StageResult process(String unitId) throws Exception;
}
