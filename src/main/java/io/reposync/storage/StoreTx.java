package io.reposync.storage;

import io.reposync.model.ExternalRepoSpec;
import io.reposync.model.ExternalService;
import io.reposync.model.Repo;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Repo writes bound to one open transaction. Only valid inside {@link Store#transact}.
 */
public final class StoreTx {
    private final Connection c;
    private final long nowMs;

    StoreTx(Connection c, long nowMs) {
        this.c = c;
        this.nowMs = nowMs;
    }

    public long nowMs() {
        return nowMs;
    }

    /**
     * Every stored row, deleted ones included, whose name equals {@code name} or whose external
     * spec equals {@code spec}.
     */
    public List<Repo> listReposByNameOrSpec(String name, ExternalRepoSpec spec) throws SQLException {
        boolean hasSpec = spec != null && !spec.id().isEmpty();
        String sql = "SELECT " + Rows.REPO_COLUMNS + " FROM repos WHERE name=?"
                + (hasSpec ? " OR (external_id=? AND external_service_type=? AND external_service_id=?)" : "")
                + " ORDER BY id";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, name);
            if (hasSpec) {
                ps.setString(2, spec.id());
                ps.setString(3, spec.serviceType());
                ps.setString(4, spec.serviceId());
            }
            return Rows.readRepos(c, ps);
        }
    }

    /**
     * Inserts a sourced repo and links it to {@code svc}.
     *
     * @return the stored row, with its id
     */
    public Repo createExternalServiceRepo(ExternalService svc, Repo r) throws SQLException {
        long id;
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO repos(name,uri,description,fork,archived,private,stars,external_id,external_service_type,"
                        + "external_service_id,metadata,created_at_ms,updated_at_ms,deleted_at_ms) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,0)")) {
            bindRepoFields(ps, r);
            ps.setLong(12, nowMs);
            ps.setLong(13, nowMs);
            ps.executeUpdate();
        }
        try (PreparedStatement ps = c.prepareStatement("SELECT last_insert_rowid()");
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            id = rs.getLong(1);
        }
        linkService(svc, id, r.sources().getOrDefault(svc.id(), ""));
        return reload(id);
    }

    /**
     * Writes every tracked field of {@code r}, clears any soft deletion and links it to {@code svc}.
     */
    public Repo updateExternalServiceRepo(ExternalService svc, Repo r) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE repos SET name=?,uri=?,description=?,fork=?,archived=?,private=?,stars=?,external_id=?,"
                        + "external_service_type=?,external_service_id=?,metadata=?,updated_at_ms=?,deleted_at_ms=0 WHERE id=?")) {
            bindRepoFields(ps, r);
            ps.setLong(12, nowMs);
            ps.setLong(13, r.id());
            if (ps.executeUpdate() != 1) {
                throw new IllegalStateException("Repo row vanished during update: " + r.id());
            }
        }
        for (Map.Entry<Long, String> e : r.sources().entrySet()) {
            if (e.getKey() != svc.id()) {
                continue;
            }
            linkService(svc, r.id(), e.getValue());
        }
        if (!r.sources().containsKey(svc.id())) {
            linkService(svc, r.id(), "");
        }
        return reload(r.id());
    }

    /**
     * Soft-deletes a repo: drops its service links, stamps deleted_at_ms and renames it out of
     * the way so the name can be reused.
     */
    public void deleteRepo(long repoId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM external_service_repos WHERE repo_id=?")) {
            ps.setLong(1, repoId);
            ps.executeUpdate();
        }
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE repos SET deleted_at_ms=?,updated_at_ms=?,name='DELETED-' || ? || '-' || id || '-' || name "
                        + "WHERE id=? AND deleted_at_ms=0")) {
            ps.setLong(1, nowMs);
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.setLong(4, repoId);
            ps.executeUpdate();
        }
    }

    /**
     * Removes the link between a service and a repo, soft-deleting the repo when that was its
     * last link.
     *
     * @return true when the repo was deleted
     */
    public boolean unlinkRepo(long serviceId, long repoId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "DELETE FROM external_service_repos WHERE external_service_id=? AND repo_id=?")) {
            ps.setLong(1, serviceId);
            ps.setLong(2, repoId);
            ps.executeUpdate();
        }
        try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM external_service_repos WHERE repo_id=?")) {
            ps.setLong(1, repoId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next() && rs.getInt(1) > 0) {
                    return false;
                }
            }
        }
        deleteRepo(repoId);
        return true;
    }

    /**
     * Live repos added through user- or org-owned services. Both ids zero counts site-wide,
     * otherwise only the given namespace.
     */
    public int countNamespacedRepos(long userId, long orgId) throws SQLException {
        String sql = "SELECT COUNT(DISTINCT r.id) FROM repos r JOIN external_service_repos esr ON esr.repo_id=r.id "
                + "WHERE r.deleted_at_ms=0 AND ";
        if (userId > 0) {
            sql += "esr.user_id=" + userId;
        } else if (orgId > 0) {
            sql += "esr.org_id=" + orgId;
        } else {
            sql += "(esr.user_id>0 OR esr.org_id>0)";
        }
        try (PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private Repo reload(long id) throws SQLException {
        return Rows.loadRepo(c, id)
                .orElseThrow(() -> new IllegalStateException("Repo row missing after write: " + id));
    }

    private void linkService(ExternalService svc, long repoId, String cloneUrl) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO external_service_repos(external_service_id,repo_id,clone_url,user_id,org_id,created_at_ms) "
                        + "VALUES(?,?,?,?,?,?) ON CONFLICT(external_service_id,repo_id) DO UPDATE SET clone_url=excluded.clone_url")) {
            ps.setLong(1, svc.id());
            ps.setLong(2, repoId);
            ps.setString(3, cloneUrl == null ? "" : cloneUrl);
            ps.setLong(4, svc.namespaceUserId());
            ps.setLong(5, svc.namespaceOrgId());
            ps.setLong(6, nowMs);
            ps.executeUpdate();
        }
    }

    private static void bindRepoFields(PreparedStatement ps, Repo r) throws SQLException {
        ps.setString(1, r.name());
        ps.setString(2, r.uri());
        ps.setString(3, r.description());
        ps.setInt(4, r.fork() ? 1 : 0);
        ps.setInt(5, r.archived() ? 1 : 0);
        ps.setInt(6, r.privateRepo() ? 1 : 0);
        ps.setInt(7, r.stars());
        ps.setString(8, r.externalRepo().id());
        ps.setString(9, r.externalRepo().serviceType());
        ps.setString(10, r.externalRepo().serviceId());
        ps.setString(11, r.metadata());
    }
}
