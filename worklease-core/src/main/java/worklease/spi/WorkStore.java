package worklease.spi;

import worklease.model.LeasedUnit;
import worklease.model.Pipeline;
import worklease.model.WorkStatus;
import worklease.model.WorkUnit;

import java.sql.Connection;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence contract for units of work and their leases.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries; a claim or a reclaim must run inside one transaction.
 * Failures surface as {@link WorkStoreException}. Implementations live in the
 * {@code worklease-jdbc} module.
 *
 * <p>Every lease-guarded write matches on {@code status = PROCESSING} and the caller's
 * lease owner, so a unit whose lease was reclaimed (and possibly re-claimed by someone
 * else) is never overwritten by its previous holder.
 *
 * @see worklease.jdbc.store.AbstractJdbcWorkStore
 */
public interface WorkStore {

    /**
     * Returns the pipeline whose status codes and stage columns this store reads and writes.
     */
    Pipeline pipeline();

    /**
     * Inserts a unit in {@link WorkStatus#PENDING} unless a unit with the same id exists.
     *
     * @param conn the JDBC connection
     * @param id   unit identifier
     * @param now  creation timestamp
     * @return {@code true} if a row was inserted
     */
    boolean insertNew(Connection conn, String id, Instant now);

    /**
     * Inserts several units, silently skipping ids that already exist.
     *
     * <p>Default loops {@link #insertNew}.
     *
     * @return number of rows inserted
     */
    default int insertBatch(Connection conn, Collection<String> ids, Instant now) {
        int inserted = 0;
        for (String id : ids) {
            if (insertNew(conn, id, now)) {
                inserted++;
            }
        }
        return inserted;
    }

    /**
     * Atomically leases up to {@code limit} units currently in {@code fromStatus}, skipping
     * rows another transaction holds locked. Must run inside the caller's transaction.
     *
     * @param conn       the JDBC connection, with auto-commit disabled
     * @param fromStatus a claimable status of {@link #pipeline()}
     * @param leaseOwner identity recorded as the lease owner
     * @param now        lease start timestamp
     * @param limit      maximum number of units to lease (&gt; 0)
     * @return the leased units; empty when nothing is eligible
     */
    List<LeasedUnit> claim(Connection conn, WorkStatus fromStatus, String leaseOwner, Instant now, int limit);

    /**
     * Reads a unit and locks its row until the transaction ends.
     */
    Optional<WorkUnit> findForUpdate(Connection conn, String id);

    /**
     * Reads a unit without locking.
     */
    Optional<WorkUnit> findById(Connection conn, String id);

    /**
     * Records completion of {@code stage}: clears the lease, resets {@code retry_count},
     * clears {@code last_error} and stamps the stage's completion time.
     *
     * @return rows updated (0 when the caller no longer holds the lease)
     */
    int markStageDone(Connection conn, String id, String leaseOwner, int stage, Instant now);

    /**
     * Returns a failed unit to the pending status of {@code stage}, incrementing
     * {@code retry_count} and recording {@code error}.
     *
     * @return rows updated (0 when the caller no longer holds the lease)
     */
    int markRetry(Connection conn, String id, String leaseOwner, int stage, String error);

    /**
     * Moves a unit leased on {@code stage} to {@link WorkStatus#FAILED}, incrementing
     * {@code retry_count} and recording {@code error}.
     *
     * @return rows updated (0 when the caller no longer holds the lease)
     */
    int markFailed(Connection conn, String id, String leaseOwner, int stage, String error);

    /**
     * Returns every lease started before {@code cutoff} to the pending status of its stage,
     * leaving {@code retry_count} untouched.
     *
     * @return number of units reclaimed
     */
    int reclaimStale(Connection conn, Instant cutoff);

    /**
     * Like {@link #reclaimStale(Connection, Instant)} but only for leases on {@code stage}.
     */
    int reclaimStale(Connection conn, int stage, Instant cutoff);

    /**
     * Lists {@link WorkStatus#FAILED} units, oldest first.
     */
    List<WorkUnit> queryFailed(Connection conn, int limit);

    /**
     * Counts units grouped by status. Statuses with no units may be absent.
     */
    Map<WorkStatus, Long> countByStatus(Connection conn);
}
