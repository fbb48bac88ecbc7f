package io.reposync.storage;

import io.reposync.model.ExternalService;
import io.reposync.model.ExternalServiceKind;
import io.reposync.model.Repo;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Repository inventory and external service configuration on SQLite.
 *
 * <p>Every write runs in its own transaction. Reads see live rows only unless stated otherwise.
 */
public final class Store {
    private final Database database;
    private final Clock clock;

    public Store(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @FunctionalInterface
    public interface TxWork<T> {
        T apply(StoreTx tx) throws SQLException;
    }

    /**
     * Runs {@code work} in one IMMEDIATE transaction, committing when it returns and rolling back
     * when it throws. Runtime exceptions and errors from the work propagate unchanged.
     */
    public <T> T transact(TxWork<T> work) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                T out = work.apply(new StoreTx(c, clock.millis()));
                c.commit();
                return out;
            } catch (SQLException | RuntimeException | Error e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed store transaction", e);
        }
    }

    public Optional<Repo> getRepo(long id) {
        try (Connection c = database.openConnection()) {
            return Rows.loadRepo(c, id).filter(r -> !r.isDeleted());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load repo: " + id, e);
        }
    }

    public Optional<Repo> getRepoByName(String name) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + Rows.REPO_COLUMNS + " FROM repos WHERE name=? AND deleted_at_ms=0")) {
            ps.setString(1, name);
            List<Repo> rows = Rows.readRepos(c, ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load repo: " + name, e);
        }
    }

    /**
     * Live repos ordered by id. A non-positive limit lists everything.
     */
    public List<Repo> listRepos(int limit) {
        String sql = "SELECT " + Rows.REPO_COLUMNS + " FROM repos WHERE deleted_at_ms=0 ORDER BY id"
                + (limit > 0 ? " LIMIT " + limit : "");
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            return Rows.readRepos(c, ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list repos", e);
        }
    }

    public List<Repo> listReposForService(long serviceId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + prefixed("r.") + " FROM repos r JOIN external_service_repos esr ON esr.repo_id=r.id "
                             + "WHERE esr.external_service_id=? AND r.deleted_at_ms=0 ORDER BY r.id")) {
            ps.setLong(1, serviceId);
            return Rows.readRepos(c, ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list repos for service: " + serviceId, e);
        }
    }

    public int countRepos() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM repos WHERE deleted_at_ms=0");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count repos", e);
        }
    }

    /**
     * Unlinks every repo of {@code svc} whose id is not in {@code keepIds}. A repo left without
     * any service is soft-deleted and reported in {@link DeletionOutcome#deleted()}. Each repo is
     * handled in its own transaction; failures are collected and do not stop the sweep.
     */
    public DeletionOutcome deleteExternalServiceReposNotIn(ExternalService svc, Set<Long> keepIds) {
        List<Repo> candidates = new ArrayList<>();
        for (Repo r : listReposForService(svc.id())) {
            if (!keepIds.contains(r.id())) {
                candidates.add(r);
            }
        }
        List<Repo> deleted = new ArrayList<>();
        Map<Long, RuntimeException> failures = new LinkedHashMap<>();
        for (Repo r : candidates) {
            try {
                if (unlink(svc.id(), r.id())) {
                    deleted.add(r);
                }
            } catch (RuntimeException e) {
                failures.put(r.id(), e);
            }
        }
        return new DeletionOutcome(deleted, failures);
    }

    /**
     * Unlinks one repo from {@code svc}, soft-deleting it when no other service still lists it.
     *
     * @return true when the repo itself was deleted
     */
    public boolean deleteExternalServiceRepo(ExternalService svc, long repoId) {
        return unlink(svc.id(), repoId);
    }

    private boolean unlink(long serviceId, long repoId) {
        return transact(tx -> tx.unlinkRepo(serviceId, repoId));
    }

    public Optional<ExternalService> getExternalService(long id) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + Rows.SERVICE_COLUMNS + " FROM external_services WHERE id=? AND deleted_at_ms=0")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(Rows.service(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load external service: " + id, e);
        }
    }

    public List<ExternalService> listExternalServices(ServiceQuery query) {
        StringBuilder sql = new StringBuilder("SELECT " + Rows.SERVICE_COLUMNS + " FROM external_services WHERE deleted_at_ms=0");
        if (query.onlyCloudDefault()) {
            sql.append(" AND cloud_default=1");
        }
        if (!query.kinds().isEmpty()) {
            sql.append(" AND kind IN (");
            for (int i = 0; i < query.kinds().size(); i++) {
                sql.append(i == 0 ? "?" : ",?");
            }
            sql.append(')');
        }
        sql.append(" ORDER BY id");
        if (query.limit() > 0) {
            sql.append(" LIMIT ").append(query.limit());
        }
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            for (int i = 0; i < query.kinds().size(); i++) {
                ps.setString(i + 1, query.kinds().get(i).name());
            }
            List<ExternalService> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(Rows.service(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list external services", e);
        }
    }

    /**
     * Inserts a service when its id is 0, otherwise rewrites the stored row.
     *
     * @return the stored row
     */
    public ExternalService upsertExternalService(ExternalService svc) {
        long nowMs = clock.millis();
        try (Connection c = database.openConnection()) {
            long id = svc.id();
            if (id == 0L) {
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO external_services(kind,display_name,config,namespace_user_id,namespace_org_id,cloud_default,"
                                + "last_sync_at_ms,next_sync_at_ms,created_at_ms,updated_at_ms,deleted_at_ms) VALUES(?,?,?,?,?,?,?,?,?,?,0)")) {
                    bindService(ps, svc);
                    ps.setLong(9, nowMs);
                    ps.setLong(10, nowMs);
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = c.prepareStatement("SELECT last_insert_rowid()");
                     ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    id = rs.getLong(1);
                }
            } else {
                try (PreparedStatement ps = c.prepareStatement(
                        "UPDATE external_services SET kind=?,display_name=?,config=?,namespace_user_id=?,namespace_org_id=?,"
                                + "cloud_default=?,last_sync_at_ms=?,next_sync_at_ms=?,updated_at_ms=? WHERE id=?")) {
                    bindService(ps, svc);
                    ps.setLong(9, nowMs);
                    ps.setLong(10, id);
                    if (ps.executeUpdate() != 1) {
                        throw new IllegalArgumentException("External service not found: " + id);
                    }
                }
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + Rows.SERVICE_COLUMNS + " FROM external_services WHERE id=?")) {
                ps.setLong(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    return Rows.service(rs);
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to upsert external service: " + svc.displayName(), e);
        }
    }

    private static void bindService(PreparedStatement ps, ExternalService svc) throws SQLException {
        ps.setString(1, svc.kind().name());
        ps.setString(2, svc.displayName());
        ps.setString(3, svc.config());
        ps.setLong(4, svc.namespaceUserId());
        ps.setLong(5, svc.namespaceOrgId());
        ps.setInt(6, svc.cloudDefault() ? 1 : 0);
        ps.setLong(7, svc.lastSyncAtMs());
        ps.setLong(8, svc.nextSyncAtMs());
    }

    private static String prefixed(String alias) {
        StringBuilder sb = new StringBuilder();
        for (String col : Rows.REPO_COLUMNS.split(",")) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(alias).append(col);
        }
        return sb.toString();
    }

    public record ServiceQuery(List<ExternalServiceKind> kinds, boolean onlyCloudDefault, int limit) {
        public ServiceQuery {
            kinds = kinds == null ? List.of() : List.copyOf(kinds);
        }

        public static ServiceQuery all() {
            return new ServiceQuery(List.of(), false, 0);
        }
    }

    public record DeletionOutcome(List<Repo> deleted, Map<Long, RuntimeException> failures) {
        public DeletionOutcome {
            deleted = List.copyOf(deleted);
            failures = Map.copyOf(failures);
        }
    }
}
