package io.reposync.storage;

import io.reposync.model.ExternalRepoSpec;
import io.reposync.model.ExternalService;
import io.reposync.model.ExternalServiceKind;
import io.reposync.model.Repo;
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

/**
 * Row mapping shared by the stores.
 */
final class Rows {
    static final String REPO_COLUMNS = "id,name,uri,description,fork,archived,private,stars,external_id,"
            + "external_service_type,external_service_id,metadata,created_at_ms,updated_at_ms,deleted_at_ms";
    static final String SERVICE_COLUMNS = "id,kind,display_name,config,namespace_user_id,namespace_org_id,"
            + "cloud_default,last_sync_at_ms,next_sync_at_ms,created_at_ms,updated_at_ms,deleted_at_ms";
    static final String JOB_COLUMNS = "id,external_service_id,state,failure_message,queued_at_ms,started_at_ms,"
            + "finished_at_ms,last_heartbeat_at_ms,num_resets,num_failures,worker_id,lease_token,lease_epoch";

    private Rows() {
    }

    static Optional<Repo> loadRepo(Connection c, long id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + REPO_COLUMNS + " FROM repos WHERE id=?")) {
            ps.setLong(1, id);
            List<Repo> rows = readRepos(c, ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        }
    }

    /**
     * Executes a repo query and attaches each row's sources.
     */
    static List<Repo> readRepos(Connection c, PreparedStatement ps) throws SQLException {
        List<Repo> bare = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                bare.add(repo(rs, Map.of()));
            }
        }
        List<Repo> out = new ArrayList<>(bare.size());
        for (Repo r : bare) {
            Map<Long, String> sources = loadSources(c, r.id());
            out.add(sources.isEmpty() ? r : new Repo(r.id(), r.name(), r.uri(), r.description(), r.fork(),
                    r.archived(), r.privateRepo(), r.stars(), r.externalRepo(), r.metadata(), sources,
                    r.createdAtMs(), r.updatedAtMs(), r.deletedAtMs()));
        }
        return out;
    }

    static Map<Long, String> loadSources(Connection c, long repoId) throws SQLException {
        Map<Long, String> sources = new LinkedHashMap<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT external_service_id,clone_url FROM external_service_repos WHERE repo_id=? ORDER BY external_service_id")) {
            ps.setLong(1, repoId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    sources.put(rs.getLong("external_service_id"), rs.getString("clone_url"));
                }
            }
        }
        return sources;
    }

    static Repo repo(ResultSet rs, Map<Long, String> sources) throws SQLException {
        return new Repo(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("uri"),
                rs.getString("description"),
                rs.getInt("fork") == 1,
                rs.getInt("archived") == 1,
                rs.getInt("private") == 1,
                rs.getInt("stars"),
                new ExternalRepoSpec(
                        rs.getString("external_id"),
                        rs.getString("external_service_type"),
                        rs.getString("external_service_id")
                ),
                rs.getString("metadata"),
                sources,
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms"),
                rs.getLong("deleted_at_ms")
        );
    }

    static ExternalService service(ResultSet rs) throws SQLException {
        return new ExternalService(
                rs.getLong("id"),
                ExternalServiceKind.valueOf(rs.getString("kind")),
                rs.getString("display_name"),
                rs.getString("config"),
                rs.getLong("namespace_user_id"),
                rs.getLong("namespace_org_id"),
                rs.getInt("cloud_default") == 1,
                rs.getLong("last_sync_at_ms"),
                rs.getLong("next_sync_at_ms"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms"),
                rs.getLong("deleted_at_ms")
        );
    }

    static SyncJob job(ResultSet rs) throws SQLException {
        return new SyncJob(
                rs.getLong("id"),
                rs.getLong("external_service_id"),
                SyncJobState.valueOf(rs.getString("state")),
                rs.getString("failure_message"),
                rs.getLong("queued_at_ms"),
                rs.getLong("started_at_ms"),
                rs.getLong("finished_at_ms"),
                rs.getLong("last_heartbeat_at_ms"),
                rs.getInt("num_resets"),
                rs.getInt("num_failures"),
                rs.getString("worker_id"),
                rs.getString("lease_token"),
                rs.getLong("lease_epoch")
        );
    }
}
