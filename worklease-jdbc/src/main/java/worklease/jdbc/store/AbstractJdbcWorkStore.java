package worklease.jdbc.store;

import worklease.jdbc.JdbcTemplate;
import worklease.jdbc.TableNames;
import worklease.model.LeasedUnit;
import worklease.model.Pipeline;
import worklease.model.Transition;
import worklease.model.WorkStatus;
import worklease.model.WorkUnit;
import worklease.spi.WorkStore;
import worklease.spi.WorkStoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Base JDBC work store with standard SQL implementations.
 *
 * <p>The default {@link #claim} is portable: it selects candidate ids and leases each one
 * with a compare-and-swap on {@code status}, all inside the caller's transaction. A row
 * another transaction is changing is skipped when {@link #isRowLockConflict} recognises
 * the error. Subclasses override {@link #claim} with {@code FOR UPDATE SKIP LOCKED} where
 * the database supports it, and {@link #insertNew} with a native insert-or-ignore.
 *
 * <p>Register custom implementations via
 * {@code META-INF/services/worklease.jdbc.store.AbstractJdbcWorkStore}.
 *
 * @see JdbcWorkStores
 */
public abstract class AbstractJdbcWorkStore implements WorkStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String PROCESSING = WorkStatus.PROCESSING.code();
  protected static final String FAILED = WorkStatus.FAILED.code();

  protected static final JdbcTemplate.RowMapper<Candidate> CANDIDATE_ROW_MAPPER =
      rs -> new Candidate(rs.getString("id"), rs.getInt("retry_count"));

  private final String tableName;
  private final Pipeline pipeline;
  private final String columns;

  protected AbstractJdbcWorkStore() {
    this(TableNames.DEFAULT_TABLE, Pipeline.defaultPipeline());
  }

  protected AbstractJdbcWorkStore(String tableName) {
    this(tableName, Pipeline.defaultPipeline());
  }

  protected AbstractJdbcWorkStore(String tableName, Pipeline pipeline) {
    this.tableName = TableNames.validate(tableName);
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    StringBuilder cols = new StringBuilder(
        "id, status, lease_owner, lease_started_at, lease_stage, retry_count, last_error, created_at");
    for (int stage = 1; stage <= pipeline.stageCount(); stage++) {
      cols.append(", ").append(stageDoneColumn(stage));
    }
    this.columns = cols.toString();
  }

  /**
   * Unique identifier for this work store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this work store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect over another table and pipeline.
   */
  public abstract AbstractJdbcWorkStore withSettings(String tableName, Pipeline pipeline);

  protected String tableName() {
    return tableName;
  }

  @Override
  public Pipeline pipeline() {
    return pipeline;
  }

  protected String columns() {
    return columns;
  }

  protected static String stageDoneColumn(int stage) {
    return "stage_" + stage + "_done_at";
  }

  @Override
  public boolean insertNew(Connection conn, String id, Instant now) {
    Objects.requireNonNull(id, "id");
    if (findById(conn, id).isPresent()) {
      return false;
    }
    return JdbcTemplate.update(conn, insertSql("INSERT INTO"), id, WorkStatus.PENDING.code(),
        Timestamp.from(now.truncatedTo(ChronoUnit.MILLIS))) > 0;
  }

  /**
   * Returns {@code <verb> <table> (id, status, retry_count, created_at) VALUES (?,?,0,?)}.
   */
  protected String insertSql(String verb) {
    return verb + " " + tableName() + " (id, status, retry_count, created_at) VALUES (?,?,0,?)";
  }

  @Override
  public List<LeasedUnit> claim(Connection conn, WorkStatus fromStatus, String leaseOwner,
      Instant now, int limit) {
    int stage = claimedStage(fromStatus);
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String selectSql = "SELECT id, retry_count FROM " + tableName() +
        " WHERE status=? ORDER BY id LIMIT ?";
    String leaseSql = "UPDATE " + tableName() +
        " SET status='" + PROCESSING + "', lease_owner=?, lease_started_at=?, lease_stage=?" +
        " WHERE id=? AND status=?";

    List<LeasedUnit> claimed = new ArrayList<>();
    Set<String> attempted = new HashSet<>();
    while (claimed.size() < limit) {
      int want = limit - claimed.size();
      List<Candidate> candidates = JdbcTemplate.query(conn, selectSql, CANDIDATE_ROW_MAPPER,
          fromStatus.code(), want + attempted.size());
      boolean progressed = false;
      for (Candidate candidate : candidates) {
        if (claimed.size() >= limit) {
          break;
        }
        if (!attempted.add(candidate.id())) {
          continue;
        }
        progressed = true;
        if (tryLease(conn, leaseSql, candidate.id(), fromStatus, leaseOwner, nowMs, stage)) {
          // retry_count is read before the swap; it only paces backoff
          claimed.add(new LeasedUnit(candidate.id(), stage, leaseOwner, nowMs, candidate.retryCount()));
        }
      }
      if (!progressed) {
        break;
      }
    }
    return claimed;
  }

  /**
   * Stage a claim from {@code fromStatus} leases, checked as a {@link Transition#CLAIM}.
   *
   * @throws IllegalArgumentException if {@code fromStatus} is not claimable
   */
  protected int claimedStage(WorkStatus fromStatus) {
    int stage = pipeline.stageClaimedFrom(fromStatus);
    pipeline.transition(fromStatus, Transition.CLAIM, stage);
    return stage;
  }

  /** Status written when a lease on {@code stage} ends by {@code transition}. */
  protected WorkStatus target(Transition transition, int stage) {
    return pipeline.transition(WorkStatus.PROCESSING, transition, stage);
  }

  private boolean tryLease(Connection conn, String sql, String id, WorkStatus fromStatus,
      String leaseOwner, Instant nowMs, int stage) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, leaseOwner);
      ps.setTimestamp(2, Timestamp.from(nowMs));
      ps.setInt(3, stage);
      ps.setString(4, id);
      ps.setString(5, fromStatus.code());
      return ps.executeUpdate() == 1;
    } catch (SQLException e) {
      if (isRowLockConflict(e)) {
        return false;
      }
      throw new WorkStoreException("Failed to lease unit " + id, e);
    }
  }

  /**
   * Whether {@code e} means the row is being changed by another transaction, so the claim
   * should skip it rather than fail. Defaults to SQLSTATE {@code 40001}.
   */
  protected boolean isRowLockConflict(SQLException e) {
    return "40001".equals(e.getSQLState());
  }

  @Override
  public Optional<WorkUnit> findForUpdate(Connection conn, String id) {
    String sql = "SELECT " + columns() + " FROM " + tableName() + " WHERE id=? FOR UPDATE";
    return JdbcTemplate.queryOne(conn, sql, this::mapUnit, id);
  }

  @Override
  public Optional<WorkUnit> findById(Connection conn, String id) {
    String sql = "SELECT " + columns() + " FROM " + tableName() + " WHERE id=?";
    return JdbcTemplate.queryOne(conn, sql, this::mapUnit, id);
  }

  @Override
  public int markStageDone(Connection conn, String id, String leaseOwner, int stage, Instant now) {
    WorkStatus done = target(Transition.COMPLETE, stage);
    String sql = "UPDATE " + tableName() +
        " SET status=?, " + stageDoneColumn(stage) + "=?, retry_count=0, last_error=NULL, " +
        "lease_owner=NULL, lease_started_at=NULL, lease_stage=NULL" +
        " WHERE id=? AND status='" + PROCESSING + "' AND lease_owner=? AND lease_stage=?";
    return JdbcTemplate.update(conn, sql, done.code(),
        Timestamp.from(now.truncatedTo(ChronoUnit.MILLIS)), id, leaseOwner, stage);
  }

  @Override
  public int markRetry(Connection conn, String id, String leaseOwner, int stage, String error) {
    String sql = "UPDATE " + tableName() +
        " SET status=?, retry_count=retry_count+1, last_error=?, " +
        "lease_owner=NULL, lease_started_at=NULL, lease_stage=NULL" +
        " WHERE id=? AND status='" + PROCESSING + "' AND lease_owner=? AND lease_stage=?";
    return JdbcTemplate.update(conn, sql, target(Transition.RETRY, stage).code(),
        truncateError(error), id, leaseOwner, stage);
  }

  @Override
  public int markFailed(Connection conn, String id, String leaseOwner, int stage, String error) {
    String sql = "UPDATE " + tableName() +
        " SET status=?, retry_count=retry_count+1, last_error=?, " +
        "lease_owner=NULL, lease_started_at=NULL, lease_stage=NULL" +
        " WHERE id=? AND status='" + PROCESSING + "' AND lease_owner=? AND lease_stage=?";
    return JdbcTemplate.update(conn, sql, target(Transition.FAIL, stage).code(),
        truncateError(error), id, leaseOwner, stage);
  }

  @Override
  public int reclaimStale(Connection conn, Instant cutoff) {
    // status must be assigned before lease_stage is cleared (MySQL applies SET left to right)
    StringBuilder sql = new StringBuilder("UPDATE ").append(tableName())
        .append(" SET status=CASE lease_stage");
    for (int stage = 1; stage <= pipeline.stageCount(); stage++) {
      sql.append(" WHEN ").append(stage)
          .append(" THEN '").append(target(Transition.RECLAIM, stage).code()).append('\'');
    }
    sql.append(" END, lease_owner=NULL, lease_started_at=NULL, lease_stage=NULL")
        .append(" WHERE status='").append(PROCESSING).append("' AND lease_started_at<?")
        .append(" AND lease_stage BETWEEN 1 AND ").append(pipeline.stageCount());
    return JdbcTemplate.update(conn, sql.toString(), Timestamp.from(cutoff));
  }

  @Override
  public int reclaimStale(Connection conn, int stage, Instant cutoff) {
    String sql = "UPDATE " + tableName() +
        " SET status=?, lease_owner=NULL, lease_started_at=NULL, lease_stage=NULL" +
        " WHERE status='" + PROCESSING + "' AND lease_stage=? AND lease_started_at<?";
    return JdbcTemplate.update(conn, sql, target(Transition.RECLAIM, stage).code(), stage,
        Timestamp.from(cutoff));
  }

  @Override
  public List<WorkUnit> queryFailed(Connection conn, int limit) {
    String sql = "SELECT " + columns() + " FROM " + tableName() +
        " WHERE status='" + FAILED + "' ORDER BY created_at, id LIMIT ?";
    return JdbcTemplate.query(conn, sql, this::mapUnit, limit);
  }

  @Override
  public Map<WorkStatus, Long> countByStatus(Connection conn) {
    String sql = "SELECT status, COUNT(*) AS cnt FROM " + tableName() + " GROUP BY status";
    List<Map.Entry<WorkStatus, Long>> rows = JdbcTemplate.query(conn, sql,
        rs -> Map.entry(WorkStatus.fromCode(rs.getString("status")), rs.getLong("cnt")));
    Map<WorkStatus, Long> counts = new LinkedHashMap<>();
    for (Map.Entry<WorkStatus, Long> row : rows) {
      counts.merge(row.getKey(), row.getValue(), Long::sum);
    }
    return counts;
  }

  protected WorkUnit mapUnit(ResultSet rs) throws SQLException {
    Map<Integer, Instant> completed = new HashMap<>();
    for (int stage = 1; stage <= pipeline.stageCount(); stage++) {
      Instant doneAt = toInstant(rs.getTimestamp(stageDoneColumn(stage)));
      if (doneAt != null) {
        completed.put(stage, doneAt);
      }
    }
    int leaseStage = rs.getInt("lease_stage");
    Integer stage = rs.wasNull() ? null : leaseStage;
    return new WorkUnit(
        rs.getString("id"),
        WorkStatus.fromCode(rs.getString("status")),
        rs.getString("lease_owner"),
        toInstant(rs.getTimestamp("lease_started_at")),
        stage,
        rs.getInt("retry_count"),
        rs.getString("last_error"),
        toInstant(rs.getTimestamp("created_at")),
        completed);
  }

  private static Instant toInstant(Timestamp ts) {
    return ts == null ? null : ts.toInstant();
  }

  protected static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }

  /** Claim candidate: id plus the retry count seen when it was selected. */
  protected record Candidate(String id, int retryCount) {}

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[table=" + tableName + ", " + pipeline + "]";
  }
}
