package worklease.failed;

import worklease.model.WorkStatus;
import worklease.model.WorkUnit;
import worklease.spi.ConnectionProvider;
import worklease.spi.WorkStore;
import worklease.spi.WorkStoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only facade over units that ended in {@code FAILED}, with the error that ended them.
 *
 * <p>FAILED is terminal, so there is no replay. Store failures are logged and reported as
 * an empty result.
 *
 * @see WorkStore#queryFailed
 */
public final class FailedUnitInspector {
  private static final Logger logger = Logger.getLogger(FailedUnitInspector.class.getName());

  private final ConnectionProvider connectionProvider;
  private final WorkStore workStore;

  public FailedUnitInspector(ConnectionProvider connectionProvider, WorkStore workStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.workStore = Objects.requireNonNull(workStore, "workStore");
  }

  /**
   * Lists failed units, oldest first.
   *
   * @param limit maximum number of units to return
   * @return failed units with their last error
   */
  public List<WorkUnit> query(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0, got: " + limit);
    }
    try (Connection conn = connectionProvider.getConnection()) {
      return workStore.queryFailed(conn, limit);
    } catch (SQLException | WorkStoreException e) {
      logger.log(Level.SEVERE, "Failed to query failed units", e);
      return List.of();
    }
  }

  /**
   * Counts failed units.
   */
  public long count() {
    try (Connection conn = connectionProvider.getConnection()) {
      return workStore.countByStatus(conn).getOrDefault(WorkStatus.FAILED, 0L);
    } catch (SQLException | WorkStoreException e) {
      logger.log(Level.SEVERE, "Failed to count failed units", e);
      return 0L;
    }
  }

  /**
   * Looks up one unit in any status.
   */
  public Optional<WorkUnit> find(String unitId) {
    Objects.requireNonNull(unitId, "unitId");
    try (Connection conn = connectionProvider.getConnection()) {
      return workStore.findById(conn, unitId);
    } catch (SQLException | WorkStoreException e) {
      logger.log(Level.SEVERE, "Failed to read unit: " + unitId, e);
      return Optional.empty();
    }
  }
}
