package io.reposync.storage;

import io.reposync.model.SyncJob;
import io.reposync.model.SyncJobState;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable queue of external service sync jobs.
 *
 * <p>A dequeued job is leased: it carries a lease token and an epoch that every later write for
 * that job must present. The resetter bumps the epoch when it takes a job back, so a handler that
 * lost its lease can no longer complete or fail it.
 */
public final class SyncJobStore {
    private static final String STALLED_MESSAGE = "stalled too many times";
    private final Database database;

    public SyncJobStore(Database database) {
        this.database = database;
    }

    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    /**
     * Queues one job for every live, non cloud-default service whose next sync time has passed
     * and that has no job queued or processing.
     *
     * @return number of jobs queued
     */
    public int enqueueSyncJobs(long nowMs) {
        String sql = """
                INSERT INTO sync_jobs(external_service_id,state,queued_at_ms)
                SELECT es.id,?,? FROM external_services es
                WHERE es.deleted_at_ms=0 AND es.cloud_default=0 AND es.next_sync_at_ms<=?
                  AND NOT EXISTS (
                      SELECT 1 FROM sync_jobs j WHERE j.external_service_id=es.id AND j.state IN (?,?)
                  )
                """;
        return exec(sql, ps -> {
            ps.setString(1, SyncJobState.QUEUED.name());
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.setString(4, SyncJobState.QUEUED.name());
            ps.setString(5, SyncJobState.PROCESSING.name());
        });
    }

    /**
     * Queues a job for one service right away, ignoring its next sync time.
     *
     * @return the new job id, empty when the service is missing, cloud default, or already has a
     *         job queued or processing
     */
    public Optional<Long> enqueueSingleSyncJob(long serviceId, long nowMs) {
        String sql = """
                INSERT INTO sync_jobs(external_service_id,state,queued_at_ms)
                SELECT es.id,?,? FROM external_services es
                WHERE es.id=? AND es.deleted_at_ms=0 AND es.cloud_default=0
                  AND NOT EXISTS (
                      SELECT 1 FROM sync_jobs j WHERE j.external_service_id=es.id AND j.state IN (?,?)
                  )
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql);
                 PreparedStatement idPs = c.prepareStatement("SELECT last_insert_rowid()")) {
                ps.setString(1, SyncJobState.QUEUED.name());
                ps.setLong(2, nowMs);
                ps.setLong(3, serviceId);
                ps.setString(4, SyncJobState.QUEUED.name());
                ps.setString(5, SyncJobState.PROCESSING.name());
                if (ps.executeUpdate() == 0) {
                    c.commit();
                    return Optional.empty();
                }
                long id;
                try (ResultSet rs = idPs.executeQuery()) {
                    rs.next();
                    id = rs.getLong(1);
                }
                c.commit();
                return Optional.of(id);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to enqueue sync job for service: " + serviceId, e);
        }
    }

    /**
     * Leases the oldest queued job whose service has no other job processing.
     */
    public Optional<LeasedJob> dequeue(String workerId, long nowMs) {
        String select = """
                SELECT j.id FROM sync_jobs j
                WHERE j.state=?
                  AND NOT EXISTS (
                      SELECT 1 FROM sync_jobs p WHERE p.external_service_id=j.external_service_id AND p.state=?
                  )
                ORDER BY j.queued_at_ms ASC, j.id ASC LIMIT 1
                """;
        String claim = "UPDATE sync_jobs SET state=?,worker_id=?,lease_token=?,lease_epoch=lease_epoch+1,"
                + "started_at_ms=?,last_heartbeat_at_ms=? WHERE id=? AND state=?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement sel = c.prepareStatement(select);
                 PreparedStatement upd = c.prepareStatement(claim)) {
                sel.setString(1, SyncJobState.QUEUED.name());
                sel.setString(2, SyncJobState.PROCESSING.name());
                long jobId;
                try (ResultSet rs = sel.executeQuery()) {
                    if (!rs.next()) {
                        c.commit();
                        return Optional.empty();
                    }
                    jobId = rs.getLong("id");
                }
                String token = UUID.randomUUID().toString();
                upd.setString(1, SyncJobState.PROCESSING.name());
                upd.setString(2, workerId);
                upd.setString(3, token);
                upd.setLong(4, nowMs);
                upd.setLong(5, nowMs);
                upd.setLong(6, jobId);
                upd.setString(7, SyncJobState.QUEUED.name());
                if (upd.executeUpdate() == 0) {
                    c.commit();
                    return Optional.empty();
                }
                SyncJob job = loadJob(c, jobId).orElseThrow();
                c.commit();
                return Optional.of(new LeasedJob(job, token, job.leaseEpoch()));
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to dequeue sync job", e);
        }
    }

    public boolean heartbeat(long jobId, String leaseToken, long leaseEpoch, long nowMs) {
        String sql = "UPDATE sync_jobs SET last_heartbeat_at_ms=? WHERE id=? AND state=? AND lease_token=? AND lease_epoch=?";
        return exec(sql, ps -> {
            ps.setLong(1, nowMs);
            ps.setLong(2, jobId);
            ps.setString(3, SyncJobState.PROCESSING.name());
            ps.setString(4, leaseToken);
            ps.setLong(5, leaseEpoch);
        }) == 1;
    }

    public boolean markCompleted(long jobId, String leaseToken, long leaseEpoch, long nowMs) {
        String sql = "UPDATE sync_jobs SET state=?,finished_at_ms=?,failure_message=NULL,lease_token=NULL "
                + "WHERE id=? AND state=? AND lease_token=? AND lease_epoch=?";
        return exec(sql, ps -> {
            ps.setString(1, SyncJobState.COMPLETED.name());
            ps.setLong(2, nowMs);
            ps.setLong(3, jobId);
            ps.setString(4, SyncJobState.PROCESSING.name());
            ps.setString(5, leaseToken);
            ps.setLong(6, leaseEpoch);
        }) == 1;
    }

    public boolean markErrored(long jobId, String leaseToken, long leaseEpoch, String message, long nowMs) {
        String sql = "UPDATE sync_jobs SET state=?,finished_at_ms=?,failure_message=?,num_failures=num_failures+1,lease_token=NULL "
                + "WHERE id=? AND state=? AND lease_token=? AND lease_epoch=?";
        return exec(sql, ps -> {
            ps.setString(1, SyncJobState.ERRORED.name());
            ps.setLong(2, nowMs);
            ps.setString(3, message == null ? "" : message);
            ps.setLong(4, jobId);
            ps.setString(5, SyncJobState.PROCESSING.name());
            ps.setString(6, leaseToken);
            ps.setLong(7, leaseEpoch);
        }) == 1;
    }

    /**
     * Takes back processing jobs whose last heartbeat is at or before {@code cutoffMs}. Jobs
     * reset fewer than {@code maxNumResets} times are queued again; the rest are errored.
     */
    public ResetSummary resetStalled(long nowMs, long cutoffMs, int maxNumResets) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement requeue = c.prepareStatement(
                    "UPDATE sync_jobs SET state=?,num_resets=num_resets+1,worker_id=NULL,lease_token=NULL,"
                            + "lease_epoch=lease_epoch+1,queued_at_ms=? "
                            + "WHERE state=? AND last_heartbeat_at_ms<=? AND num_resets<?");
                 PreparedStatement fail = c.prepareStatement(
                         "UPDATE sync_jobs SET state=?,failure_message=?,finished_at_ms=?,num_failures=num_failures+1,"
                                 + "lease_token=NULL,lease_epoch=lease_epoch+1 "
                                 + "WHERE state=? AND last_heartbeat_at_ms<=? AND num_resets>=?")) {
                requeue.setString(1, SyncJobState.QUEUED.name());
                requeue.setLong(2, nowMs);
                requeue.setString(3, SyncJobState.PROCESSING.name());
                requeue.setLong(4, cutoffMs);
                requeue.setInt(5, maxNumResets);
                int requeued = requeue.executeUpdate();

                fail.setString(1, SyncJobState.ERRORED.name());
                fail.setString(2, STALLED_MESSAGE);
                fail.setLong(3, nowMs);
                fail.setString(4, SyncJobState.PROCESSING.name());
                fail.setLong(5, cutoffMs);
                fail.setInt(6, maxNumResets);
                int errored = fail.executeUpdate();
                c.commit();
                return new ResetSummary(requeued, errored);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to reset stalled sync jobs", e);
        }
    }

    /**
     * Deletes finished jobs older than {@code cutoffMs}.
     */
    public int cleanupOldJobs(long cutoffMs) {
        String sql = "DELETE FROM sync_jobs WHERE state IN (?,?) AND finished_at_ms<?";
        return exec(sql, ps -> {
            ps.setString(1, SyncJobState.COMPLETED.name());
            ps.setString(2, SyncJobState.ERRORED.name());
            ps.setLong(3, cutoffMs);
        });
    }

    public Optional<SyncJob> getJob(long jobId) {
        try (Connection c = database.openConnection()) {
            return loadJob(c, jobId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load sync job: " + jobId, e);
        }
    }

    /**
     * Newest jobs first. A serviceId of 0 lists jobs of every service.
     */
    public List<SyncJob> listJobs(long serviceId, int limit) {
        String sql = "SELECT " + Rows.JOB_COLUMNS + " FROM sync_jobs"
                + (serviceId > 0 ? " WHERE external_service_id=?" : "")
                + " ORDER BY id DESC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            if (serviceId > 0) {
                ps.setLong(idx++, serviceId);
            }
            ps.setInt(idx, limit <= 0 ? 100 : limit);
            List<SyncJob> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(Rows.job(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list sync jobs", e);
        }
    }

    /**
     * Failure message of the service's most recently finished job, if that job errored.
     */
    public Optional<String> lastSyncError(long serviceId) {
        String sql = "SELECT state,failure_message FROM sync_jobs WHERE external_service_id=? AND state IN (?,?) "
                + "ORDER BY finished_at_ms DESC, id DESC LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, serviceId);
            ps.setString(2, SyncJobState.COMPLETED.name());
            ps.setString(3, SyncJobState.ERRORED.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next() || !SyncJobState.ERRORED.name().equals(rs.getString("state"))) {
                    return Optional.empty();
                }
                return Optional.ofNullable(rs.getString("failure_message"));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load last sync error for service: " + serviceId, e);
        }
    }

    /**
     * Latest sync error of every live service owned by the given user or org. Both zero means
     * site-owned services.
     */
    public List<SyncErrorSummary> syncErrorSummaries(long userId, long orgId) {
        String owner;
        if (userId > 0) {
            owner = "es.namespace_user_id=" + userId;
        } else if (orgId > 0) {
            owner = "es.namespace_org_id=" + orgId;
        } else {
            owner = "es.namespace_user_id=0 AND es.namespace_org_id=0";
        }
        String sql = """
                SELECT es.id,es.display_name,j.failure_message,j.finished_at_ms
                FROM external_services es
                JOIN sync_jobs j ON j.id=(
                    SELECT j2.id FROM sync_jobs j2
                    WHERE j2.external_service_id=es.id AND j2.state IN (?,?)
                    ORDER BY j2.finished_at_ms DESC, j2.id DESC LIMIT 1
                )
                WHERE es.deleted_at_ms=0 AND j.state=? AND
                """ + owner + " ORDER BY es.id";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, SyncJobState.COMPLETED.name());
            ps.setString(2, SyncJobState.ERRORED.name());
            ps.setString(3, SyncJobState.ERRORED.name());
            List<SyncErrorSummary> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SyncErrorSummary(
                            rs.getLong("id"),
                            rs.getString("display_name"),
                            rs.getString("failure_message"),
                            rs.getLong("finished_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load sync error summaries", e);
        }
    }

    public Map<String, Integer> countJobsByState() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (SyncJobState state : SyncJobState.values()) {
            out.put(state.name().toLowerCase(), 0);
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT state, COUNT(*) AS cnt FROM sync_jobs GROUP BY state");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString("state").toLowerCase(), rs.getInt("cnt"));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count sync jobs", e);
        }
    }

    private Optional<SyncJob> loadJob(Connection c, long jobId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + Rows.JOB_COLUMNS + " FROM sync_jobs WHERE id=?")) {
            ps.setLong(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(Rows.job(rs)) : Optional.empty();
            }
        }
    }

    private int exec(String sql, Binder binder) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("DB exec failed", e);
        }
    }

    public record LeasedJob(SyncJob job, String leaseToken, long leaseEpoch) {
    }

    public record ResetSummary(int requeued, int errored) {
    }

    public record SyncErrorSummary(long serviceId, String displayName, String message, long finishedAtMs) {
    }
}
