/**
 * Polling stage workers and the retry backoff they apply.
 *
 * @see worklease.worker.StageWorker
 * @see worklease.worker.StageProcessor
 * @see worklease.worker.RetryPolicy
 */
package worklease.worker;
