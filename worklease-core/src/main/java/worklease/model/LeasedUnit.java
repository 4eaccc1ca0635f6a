package worklease.model;

import java.time.Instant;

/**
 * A unit returned by a successful claim: the caller now holds its lease.
 *
 * @param unitId         unit identifier
 * @param stage          stage the lease works on
 * @param leaseOwner     the claimer's identity
 * @param leaseStartedAt when the lease was taken
 * @param retryCount     failed attempts recorded for this stage so far
 */
public record LeasedUnit(
    String unitId,
    int stage,
    String leaseOwner,
    Instant leaseStartedAt,
    int retryCount
) {}
