package worklease.jdbc.store;

import worklease.model.Pipeline;

import java.sql.SQLException;
import java.util.List;

/**
 * H2 work store, used for tests and single-process deployments.
 *
 * <p>Claims with the portable compare-and-swap loop. A lease attempt on a row that a
 * concurrent claimer is updating waits for that transaction; when it fails with a lock
 * timeout or concurrent-update error the row is skipped.
 */
public final class H2WorkStore extends AbstractJdbcWorkStore {
  private static final int LOCK_TIMEOUT = 50200;
  private static final int CONCURRENT_UPDATE = 90131;
  private static final int DEADLOCK = 40001;

  public H2WorkStore() {
    super();
  }

  public H2WorkStore(String tableName) {
    super(tableName);
  }

  public H2WorkStore(String tableName, Pipeline pipeline) {
    super(tableName, pipeline);
  }

  @Override
  public AbstractJdbcWorkStore withSettings(String tableName, Pipeline pipeline) {
    return new H2WorkStore(tableName, pipeline);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected boolean isRowLockConflict(SQLException e) {
    int code = e.getErrorCode();
    return code == LOCK_TIMEOUT || code == CONCURRENT_UPDATE || code == DEADLOCK
        || super.isRowLockConflict(e);
  }
}
