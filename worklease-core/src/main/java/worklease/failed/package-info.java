/**
 * Inspection of units that exhausted their retry budget.
 */
package worklease.failed;
