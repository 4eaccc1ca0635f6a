package worklease.lease;

/**
 * Thrown when an outcome is committed for a unit the caller no longer leases: the unit is
 * missing, not {@code PROCESSING}, or leased by another owner (typically after the
 * reclaimer returned a stale lease to the pool). Nothing is changed.
 */
public final class LeaseLostException extends RuntimeException {
  private final String unitId;
  private final String leaseOwner;

  public LeaseLostException(String unitId, String leaseOwner, String message) {
    super(message);
    this.unitId = unitId;
    this.leaseOwner = leaseOwner;
  }

  public String unitId() {
    return unitId;
  }

  public String leaseOwner() {
    return leaseOwner;
  }
}
