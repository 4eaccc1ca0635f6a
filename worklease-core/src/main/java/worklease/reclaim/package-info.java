/**
 * Stale-lease reclamation: returning abandoned leases to the claimable pool.
 *
 * @see worklease.reclaim.StaleLeaseReclaimer
 * @see worklease.reclaim.ReclaimScheduler
 */
package worklease.reclaim;
