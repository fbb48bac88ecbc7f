package io.reposync.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Layout of a reposync data root.
 */
public final class RepoSyncConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DB_FILE = "reposync.db";
    public static final String SETTINGS_FILE = "reposync-settings.json";
    public static final String EVENTS_DIR = "events";
    public static final String EVENTS_FILE = "sync-events.jsonl";

    private final Path rootDir;

    public RepoSyncConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static RepoSyncConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new RepoSyncConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve(DB_FILE);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path eventsDir() {
        return rootDir.resolve(EVENTS_DIR);
    }

    public Path eventsFile() {
        return eventsDir().resolve(EVENTS_FILE);
    }
}
