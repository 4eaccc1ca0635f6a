/**
 * Atomic batch claim and lease-guarded outcome commits.
 *
 * @see worklease.lease.LeaseManager
 */
package worklease.lease;
