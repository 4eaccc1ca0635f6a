package worklease.lease;

import worklease.model.LeasedUnit;
import worklease.model.Pipeline;
import worklease.model.PipelineStats;
import worklease.model.Transition;
import worklease.model.WorkStatus;
import worklease.model.WorkUnit;
import worklease.spi.ConnectionProvider;
import worklease.spi.MetricsExporter;
import worklease.spi.WorkStore;
import worklease.spi.WorkStoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Claims batches of units and commits per-unit outcomes, each in its own transaction.
 *
 * <p>A claim leases up to {@code limit} units in one transaction, skipping rows that a
 * concurrent claimer holds locked, so concurrent claims over the same pool receive
 * disjoint sets. Outcome commits ({@link #complete}, {@link #fail}) re-read the unit under
 * a row lock, verify that the caller still holds its lease, and apply the transition the
 * {@link Pipeline} allows; anything else raises an exception and changes nothing.
 *
 * <p>Create instances via {@link #builder()}. Instances are thread-safe.
 *
 * @see LeaseManager.Builder
 * @see WorkStore
 */
public final class LeaseManager {
  private static final Logger logger = Logger.getLogger(LeaseManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final WorkStore workStore;
  private final Pipeline pipeline;
  private final int maxRetries;
  private final Clock clock;
  private final MetricsExporter metrics;

  private LeaseManager(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.workStore = Objects.requireNonNull(builder.workStore, "workStore");
    if (builder.maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be >= 1, got: " + builder.maxRetries);
    }
    this.pipeline = workStore.pipeline();
    this.maxRetries = builder.maxRetries;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Pipeline pipeline() {
    return pipeline;
  }

  public int maxRetries() {
    return maxRetries;
  }

  /**
   * Leases up to {@code limit} units currently in {@code fromStatus}.
   *
   * @param fromStatus a claimable status: {@code PENDING_STAGE_1} or a non-final {@code STAGE_k_DONE}
   * @param limit      maximum number of units (&gt; 0)
   * @param leaseOwner the claimer's identity (non-blank)
   * @return the leased units, possibly empty
   * @throws IllegalArgumentException if {@code fromStatus} is not claimable, {@code limit <= 0},
   *                                  or {@code leaseOwner} is blank
   * @throws WorkStoreException       if the claim transaction fails; nothing is leased
   */
  public List<LeasedUnit> claim(WorkStatus fromStatus, int limit, String leaseOwner) {
    Objects.requireNonNull(fromStatus, "fromStatus");
    if (!pipeline.isClaimable(fromStatus)) {
      throw new IllegalArgumentException("Cannot claim from " + fromStatus
          + ": status is in flight or terminal in " + pipeline);
    }
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0, got: " + limit);
    }
    requireOwner(leaseOwner);

    Instant now = clock.instant();
    List<LeasedUnit> claimed = inTransaction("claim from " + fromStatus,
        conn -> workStore.claim(conn, fromStatus, leaseOwner, now, limit));
    metrics.incrementClaimed(claimed.size());
    metrics.recordBatchSize(claimed.size());
    if (logger.isLoggable(Level.FINE)) {
      logger.log(Level.FINE, "{0} claimed {1} of {2} requested units from {3}",
          new Object[]{leaseOwner, claimed.size(), limit, fromStatus});
    }
    return claimed;
  }

  /**
   * Leases up to {@code limit} units waiting for {@code stage}.
   *
   * @see #claim(WorkStatus, int, String)
   */
  public List<LeasedUnit> claimStage(int stage, int limit, String leaseOwner) {
    return claim(pipeline.pendingStatus(stage), limit, leaseOwner);
  }

  /**
   * Records success of the leased stage and releases the lease.
   *
   * @return the new status, {@code STAGE_k_DONE}
   * @throws LeaseLostException if {@code leaseOwner} does not hold the unit's lease
   */
  public WorkStatus complete(String unitId, String leaseOwner) {
    Objects.requireNonNull(unitId, "unitId");
    requireOwner(leaseOwner);
    Instant now = clock.instant();
    WorkStatus next = inTransaction("complete " + unitId, conn -> {
      WorkUnit unit = leasedBy(conn, unitId, leaseOwner);
      int stage = unit.leaseStage();
      WorkStatus target = pipeline.transition(unit.status(), Transition.COMPLETE, stage);
      if (workStore.markStageDone(conn, unitId, leaseOwner, stage, now) == 0) {
        throw leaseLost(unitId, leaseOwner, "lease released concurrently");
      }
      return target;
    });
    metrics.incrementSucceeded();
    return next;
  }

  public WorkStatus complete(LeasedUnit unit) {
    return complete(unit.unitId(), unit.leaseOwner());
  }

  /**
   * Records a failed attempt on the leased stage and releases the lease. The unit returns to
   * its pending status while attempts remain, otherwise it moves to {@code FAILED}.
   *
   * @param error message kept as the unit's last error (may be {@code null})
   * @return the new status, the stage's pending status or {@code FAILED}
   * @throws LeaseLostException if {@code leaseOwner} does not hold the unit's lease
   */
  public WorkStatus fail(String unitId, String leaseOwner, String error) {
    Objects.requireNonNull(unitId, "unitId");
    requireOwner(leaseOwner);
    WorkStatus next = inTransaction("fail " + unitId, conn -> {
      WorkUnit unit = leasedBy(conn, unitId, leaseOwner);
      int stage = unit.leaseStage();
      Transition transition = Pipeline.failureTransition(unit.retryCount(), maxRetries);
      WorkStatus target = pipeline.transition(unit.status(), transition, stage);
      int updated = transition == Transition.FAIL
          ? workStore.markFailed(conn, unitId, leaseOwner, stage, error)
          : workStore.markRetry(conn, unitId, leaseOwner, stage, error);
      if (updated == 0) {
        throw leaseLost(unitId, leaseOwner, "lease released concurrently");
      }
      return target;
    });
    if (next instanceof WorkStatus.Failed) {
      metrics.incrementFailed();
      logger.log(Level.WARNING, "Unit {0} failed after {1} attempts: {2}",
          new Object[]{unitId, maxRetries, error});
    } else {
      metrics.incrementRetried();
    }
    return next;
  }

  public WorkStatus fail(LeasedUnit unit, String error) {
    return fail(unit.unitId(), unit.leaseOwner(), error);
  }

  /**
   * Inserts new units in {@code PENDING_STAGE_1}. Ids that already exist are skipped;
   * duplicates within {@code unitIds} count once.
   *
   * @return number of units inserted
   */
  public int enqueue(Collection<String> unitIds) {
    Objects.requireNonNull(unitIds, "unitIds");
    LinkedHashSet<String> ids = new LinkedHashSet<>();
    for (String id : unitIds) {
      if (id == null || id.isBlank()) {
        throw new IllegalArgumentException("unit id must not be blank");
      }
      ids.add(id);
    }
    if (ids.isEmpty()) {
      return 0;
    }
    Instant now = clock.instant();
    return inTransaction("enqueue", conn -> workStore.insertBatch(conn, ids, now));
  }

  public Optional<WorkUnit> find(String unitId) {
    Objects.requireNonNull(unitId, "unitId");
    try (Connection conn = connectionProvider.getConnection()) {
      return workStore.findById(conn, unitId);
    } catch (SQLException e) {
      throw new WorkStoreException("Failed to read unit " + unitId, e);
    }
  }

  /**
   * Whether {@code unit}'s lease is still held: the unit is {@code PROCESSING} on the same
   * stage under the same owner. A lease that was reclaimed, or reclaimed and claimed again
   * by another worker, is no longer held.
   *
   * @throws WorkStoreException if the unit cannot be read
   */
  public boolean holdsLease(LeasedUnit unit) {
    Objects.requireNonNull(unit, "unit");
    return find(unit.unitId())
        .filter(WorkUnit::isLeased)
        .filter(current -> unit.leaseOwner().equals(current.leaseOwner()))
        .filter(current -> current.leaseStage() != null && current.leaseStage() == unit.stage())
        .isPresent();
  }

  /**
   * Counts units per status.
   */
  public PipelineStats stats() {
    try (Connection conn = connectionProvider.getConnection()) {
      return new PipelineStats(pipeline, workStore.countByStatus(conn));
    } catch (SQLException e) {
      throw new WorkStoreException("Failed to count units by status", e);
    }
  }

  private WorkUnit leasedBy(Connection conn, String unitId, String leaseOwner) {
    WorkUnit unit = workStore.findForUpdate(conn, unitId)
        .orElseThrow(() -> leaseLost(unitId, leaseOwner, "unit does not exist"));
    if (!unit.isLeased()) {
      throw leaseLost(unitId, leaseOwner, "unit is " + unit.status());
    }
    if (!leaseOwner.equals(unit.leaseOwner())) {
      throw leaseLost(unitId, leaseOwner, "lease is held by " + unit.leaseOwner());
    }
    return unit;
  }

  private LeaseLostException leaseLost(String unitId, String leaseOwner, String reason) {
    metrics.incrementLeaseLost();
    return new LeaseLostException(unitId, leaseOwner,
        "Lease on unit " + unitId + " is not held by " + leaseOwner + ": " + reason);
  }

  private <T> T inTransaction(String operation, Function<Connection, T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = work.apply(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new WorkStoreException("Failed to " + operation, e);
    }
  }

  private static void requireOwner(String leaseOwner) {
    if (leaseOwner == null || leaseOwner.isBlank()) {
      throw new IllegalArgumentException("leaseOwner must not be blank");
    }
  }

  /**
   * Builder for {@link LeaseManager}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private WorkStore workStore;
    private int maxRetries = 3;
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * Sets the connection provider; every claim and commit takes its own connection.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the store holding the units. Its {@link WorkStore#pipeline()} decides the
     * claimable statuses and legal transitions.
     *
     * <p><b>Required.</b>
     *
     * @param workStore the persistence backend
     * @return this builder
     */
    public Builder workStore(WorkStore workStore) {
      this.workStore = workStore;
      return this;
    }

    /**
     * Sets the number of failed attempts per stage after which a unit moves to FAILED.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     *
     * @param maxRetries attempts allowed per stage
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets the clock used for lease start and stage completion timestamps.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the metrics exporter for claim and outcome counters.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the lease manager.
     *
     * @return a new {@link LeaseManager}
     * @throws NullPointerException     if {@code connectionProvider} or {@code workStore} is null
     * @throws IllegalArgumentException if {@code maxRetries < 1}
     */
    public LeaseManager build() {
      return new LeaseManager(this);
    }
  }
}
