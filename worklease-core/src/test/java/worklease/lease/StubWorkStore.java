package worklease.lease;

import worklease.model.LeasedUnit;
import worklease.model.Pipeline;
import worklease.model.WorkStatus;
import worklease.model.WorkUnit;
import worklease.spi.WorkStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal WorkStore stub for unit tests that don't need real JDBC.
 */
class StubWorkStore implements WorkStore {

  @Override
  public Pipeline pipeline() {
    return Pipeline.defaultPipeline();
  }

  @Override
  public boolean insertNew(Connection conn, String id, Instant now) {
    return true;
  }

  @Override
  public List<LeasedUnit> claim(Connection conn, WorkStatus fromStatus, String leaseOwner,
      Instant now, int limit) {
    return List.of();
  }

  @Override
  public Optional<WorkUnit> findForUpdate(Connection conn, String id) {
    return Optional.empty();
  }

  @Override
  public Optional<WorkUnit> findById(Connection conn, String id) {
    return Optional.empty();
  }

  @Override
  public int markStageDone(Connection conn, String id, String leaseOwner, int stage, Instant now) {
    return 0;
  }

  @Override
  public int markRetry(Connection conn, String id, String leaseOwner, int stage, String error) {
    return 0;
  }

  @Override
  public int markFailed(Connection conn, String id, String leaseOwner, int stage, String error) {
    return 0;
  }

  @Override
  public int reclaimStale(Connection conn, Instant cutoff) {
    return 0;
  }

  @Override
  public int reclaimStale(Connection conn, int stage, Instant cutoff) {
    return 0;
  }

  @Override
  public List<WorkUnit> queryFailed(Connection conn, int limit) {
    return List.of();
  }

  @Override
  public Map<WorkStatus, Long> countByStatus(Connection conn) {
    return Map.of();
  }
}
