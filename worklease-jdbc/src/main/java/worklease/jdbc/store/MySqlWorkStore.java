package worklease.jdbc.store;

import worklease.jdbc.JdbcTemplate;
import worklease.model.LeasedUnit;
import worklease.model.Pipeline;
import worklease.model.WorkStatus;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * MySQL 8 work store. Also compatible with TiDB.
 *
 * <p>Claims in two statements inside the caller's transaction: a
 * {@code SELECT ... FOR UPDATE SKIP LOCKED} that locks the candidates, then an
 * {@code UPDATE ... WHERE id IN (...)} over exactly those rows. Inserts with
 * {@code INSERT IGNORE}.
 */
public final class MySqlWorkStore extends AbstractJdbcWorkStore {

  public MySqlWorkStore() {
    super();
  }

  public MySqlWorkStore(String tableName) {
    super(tableName);
  }

  public MySqlWorkStore(String tableName, Pipeline pipeline) {
    super(tableName, pipeline);
  }

  @Override
  public AbstractJdbcWorkStore withSettings(String tableName, Pipeline pipeline) {
    return new MySqlWorkStore(tableName, pipeline);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public boolean insertNew(Connection conn, String id, Instant now) {
    Objects.requireNonNull(id, "id");
    return JdbcTemplate.update(conn, insertSql("INSERT IGNORE INTO"), id,
        WorkStatus.PENDING.code(), Timestamp.from(now.truncatedTo(ChronoUnit.MILLIS))) > 0;
  }

  @Override
  public List<LeasedUnit> claim(Connection conn, WorkStatus fromStatus, String leaseOwner,
      Instant now, int limit) {
    int stage = claimedStage(fromStatus);
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String lockSql = "SELECT id, retry_count FROM " + tableName() +
        " WHERE status=? ORDER BY id LIMIT ? FOR UPDATE SKIP LOCKED";
    List<Candidate> locked = JdbcTemplate.query(conn, lockSql, CANDIDATE_ROW_MAPPER,
        fromStatus.code(), limit);
    if (locked.isEmpty()) {
      return List.of();
    }

    String leaseSql = "UPDATE " + tableName() +
        " SET status='" + PROCESSING + "', lease_owner=?, lease_started_at=?, lease_stage=?" +
        " WHERE id IN (" + JdbcTemplate.placeholders(locked.size()) + ")";
    List<Object> params = new ArrayList<>(locked.size() + 3);
    params.add(leaseOwner);
    params.add(Timestamp.from(nowMs));
    params.add(stage);
    List<LeasedUnit> claimed = new ArrayList<>(locked.size());
    for (Candidate candidate : locked) {
      params.add(candidate.id());
      claimed.add(new LeasedUnit(candidate.id(), stage, leaseOwner, nowMs, candidate.retryCount()));
    }
    JdbcTemplate.update(conn, leaseSql, params.toArray());
    return claimed;
  }
}
