package worklease.jdbc.store;

import worklease.jdbc.JdbcTemplate;
import worklease.model.LeasedUnit;
import worklease.model.Pipeline;
import worklease.model.WorkStatus;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * PostgreSQL work store.
 *
 * <p>Claims with {@code FOR UPDATE SKIP LOCKED} and {@code RETURNING} in a single
 * round-trip; inserts with {@code ON CONFLICT DO NOTHING}.
 */
public final class PostgresWorkStore extends AbstractJdbcWorkStore {

  public PostgresWorkStore() {
    super();
  }

  public PostgresWorkStore(String tableName) {
    super(tableName);
  }

  public PostgresWorkStore(String tableName, Pipeline pipeline) {
    super(tableName, pipeline);
  }

  @Override
  public AbstractJdbcWorkStore withSettings(String tableName, Pipeline pipeline) {
    return new PostgresWorkStore(tableName, pipeline);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public boolean insertNew(Connection conn, String id, Instant now) {
    Objects.requireNonNull(id, "id");
    String sql = insertSql("INSERT INTO") + " ON CONFLICT (id) DO NOTHING";
    return JdbcTemplate.update(conn, sql, id, WorkStatus.PENDING.code(),
        Timestamp.from(now.truncatedTo(ChronoUnit.MILLIS))) > 0;
  }

  @Override
  public List<LeasedUnit> claim(Connection conn, WorkStatus fromStatus, String leaseOwner,
      Instant now, int limit) {
    int stage = claimedStage(fromStatus);
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String sql = "UPDATE " + tableName() +
        " SET status='" + PROCESSING + "', lease_owner=?, lease_started_at=?, lease_stage=?" +
        " WHERE id IN (" +
        "SELECT id FROM " + tableName() + " WHERE status=? ORDER BY id LIMIT ?" +
        " FOR UPDATE SKIP LOCKED" +
        ") RETURNING id, retry_count";
    List<Candidate> rows = JdbcTemplate.updateReturning(conn, sql, CANDIDATE_ROW_MAPPER,
        leaseOwner, Timestamp.from(nowMs), stage, fromStatus.code(), limit);
    return rows.stream()
        .sorted(Comparator.comparing(Candidate::id))
        .map(c -> new LeasedUnit(c.id(), stage, leaseOwner, nowMs, c.retryCount()))
        .toList();
  }
}
