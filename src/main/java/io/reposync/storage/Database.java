package io.reposync.storage;

import io.reposync.config.RepoSyncConfig;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private static final int BUSY_TIMEOUT_MS = 5_000;
    private final RepoSyncConfig config;
    private final String jdbcUrl;

    public Database(RepoSyncConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        applyAndValidatePragmas();
        initSchema();
    }

    /**
     * Opens a connection whose transactions take the write lock up front and wait on a busy
     * database instead of failing, so concurrent writers serialize.
     */
    public Connection openConnection() throws SQLException {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setBusyTimeout(BUSY_TIMEOUT_MS);
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        sqlite.enforceForeignKeys(true);
        return DriverManager.getConnection(jdbcUrl, sqlite.toProperties());
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.eventsDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS external_services (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        kind TEXT NOT NULL,
                        display_name TEXT NOT NULL,
                        config TEXT NOT NULL DEFAULT '{}',
                        namespace_user_id INTEGER NOT NULL DEFAULT 0,
                        namespace_org_id INTEGER NOT NULL DEFAULT 0,
                        cloud_default INTEGER NOT NULL DEFAULT 0,
                        last_sync_at_ms INTEGER NOT NULL DEFAULT 0,
                        next_sync_at_ms INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        deleted_at_ms INTEGER NOT NULL DEFAULT 0,
                        CHECK (NOT (namespace_user_id > 0 AND namespace_org_id > 0))
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS repos (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        name TEXT NOT NULL UNIQUE,
                        uri TEXT NOT NULL DEFAULT '',
                        description TEXT NOT NULL DEFAULT '',
                        fork INTEGER NOT NULL DEFAULT 0,
                        archived INTEGER NOT NULL DEFAULT 0,
                        private INTEGER NOT NULL DEFAULT 0,
                        stars INTEGER NOT NULL DEFAULT 0,
                        external_id TEXT NOT NULL DEFAULT '',
                        external_service_type TEXT NOT NULL DEFAULT '',
                        external_service_id TEXT NOT NULL DEFAULT '',
                        metadata TEXT NOT NULL DEFAULT '{}',
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        deleted_at_ms INTEGER NOT NULL DEFAULT 0
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS external_service_repos (
                        external_service_id INTEGER NOT NULL,
                        repo_id INTEGER NOT NULL,
                        clone_url TEXT NOT NULL DEFAULT '',
                        user_id INTEGER NOT NULL DEFAULT 0,
                        org_id INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(external_service_id, repo_id),
                        FOREIGN KEY(external_service_id) REFERENCES external_services(id),
                        FOREIGN KEY(repo_id) REFERENCES repos(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS sync_jobs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        external_service_id INTEGER NOT NULL,
                        state TEXT NOT NULL,
                        failure_message TEXT,
                        queued_at_ms INTEGER NOT NULL,
                        started_at_ms INTEGER NOT NULL DEFAULT 0,
                        finished_at_ms INTEGER NOT NULL DEFAULT 0,
                        last_heartbeat_at_ms INTEGER NOT NULL DEFAULT 0,
                        num_resets INTEGER NOT NULL DEFAULT 0,
                        num_failures INTEGER NOT NULL DEFAULT 0,
                        worker_id TEXT,
                        lease_token TEXT,
                        lease_epoch INTEGER NOT NULL DEFAULT 0,
                        FOREIGN KEY(external_service_id) REFERENCES external_services(id)
                    )
                    """);

            st.execute("CREATE UNIQUE INDEX IF NOT EXISTS uq_external_services_cloud_default ON external_services(kind) WHERE cloud_default=1 AND deleted_at_ms=0");
            st.execute("CREATE UNIQUE INDEX IF NOT EXISTS uq_repos_external_spec ON repos(external_service_type, external_service_id, external_id) WHERE external_id<>''");
            st.execute("CREATE INDEX IF NOT EXISTS idx_external_services_next_sync ON external_services(deleted_at_ms, next_sync_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_external_service_repos_repo ON external_service_repos(repo_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_external_service_repos_namespace ON external_service_repos(user_id, org_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_sync_jobs_state_queued ON sync_jobs(state, queued_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_sync_jobs_service_state ON sync_jobs(external_service_id, state)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
