package io.reposync.config;

import io.reposync.observability.SyncEventLog;
import io.reposync.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Serves the current {@link SyncSettings}, reloading {@code reposync-settings.json} when its
 * modification time changes. The file is checked at most once per second. A file that fails to
 * parse on a timed check leaves the last good settings in place; only a forced reload reports it.
 */
public final class SettingsStore implements Supplier<SyncSettings> {
    private static final long CHECK_INTERVAL_MS = 1_000L;

    private final Path settingsFile;
    private final Clock clock;
    private final SyncEventLog eventLog;
    private volatile SyncSettings current;
    private long fileMtimeMs;
    private long lastCheckAtMs;

    public SettingsStore(Path settingsFile, Clock clock, SyncEventLog eventLog) {
        this.settingsFile = settingsFile;
        this.clock = clock;
        this.eventLog = eventLog;
        this.current = SyncSettings.defaults();
        this.fileMtimeMs = -1L;
        this.lastCheckAtMs = Long.MIN_VALUE;
        reload(true);
    }

    @Override
    public SyncSettings get() {
        long now = clock.millis();
        synchronized (this) {
            if (lastCheckAtMs == Long.MIN_VALUE || now - lastCheckAtMs >= CHECK_INTERVAL_MS) {
                reload(false);
            }
        }
        return current;
    }

    public synchronized SettingsReloadOutcome reload(boolean force) {
        long checkedAtMs = clock.millis();
        lastCheckAtMs = checkedAtMs;
        long mtime = resolveFileMtimeMs(settingsFile);
        if (!force && mtime == fileMtimeMs) {
            return new SettingsReloadOutcome(false, mtime >= 0L, settingsFile.toString(), "unchanged", checkedAtMs, List.of());
        }
        SyncSettings previous = current;
        if (mtime < 0L) {
            SyncSettings defaults = SyncSettings.defaults();
            current = defaults;
            fileMtimeMs = -1L;
            List<String> changedFields = previous.changedFields(defaults);
            if (!changedFields.isEmpty()) {
                logLoad("ok_default", changedFields, mtime);
            }
            return new SettingsReloadOutcome(!changedFields.isEmpty(), false, settingsFile.toString(), "defaults",
                    checkedAtMs, changedFields);
        }
        try {
            SyncSettings.SyncSettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SyncSettings.SyncSettingsFile.class);
            SyncSettings resolved = SyncSettings.fromFile(file, SyncSettings.defaults());
            current = resolved;
            fileMtimeMs = mtime;
            List<String> changedFields = previous.changedFields(resolved);
            boolean changed = !changedFields.isEmpty();
            logLoad(changed ? "reloaded" : "ok", changedFields, mtime);
            return new SettingsReloadOutcome(changed, true, settingsFile.toString(),
                    changed ? "reloaded" : "unchanged_content", checkedAtMs, changedFields);
        } catch (IOException e) {
            if (force) {
                throw new RuntimeException("Failed to load sync settings: " + settingsFile, e);
            }
            // Keep the last good settings; the file is parsed again once its mtime moves.
            fileMtimeMs = mtime;
            logFailed(e, mtime);
            return new SettingsReloadOutcome(false, true, settingsFile.toString(), "failed", checkedAtMs, List.of());
        }
    }

    private void logFailed(IOException e, long mtime) {
        eventLog.log(SyncEventLog.SyncEvent.of(
                "settings.load",
                "settings",
                "failed",
                Map.of(
                        "config", settingsFile.toString(),
                        "error", String.valueOf(e.getMessage()),
                        "config_mtime_ms", mtime
                )
        ));
    }

    private void logLoad(String result, List<String> changedFields, long mtime) {
        eventLog.log(SyncEventLog.SyncEvent.of(
                "settings.load",
                "settings",
                result,
                Map.of(
                        "config", settingsFile.toString(),
                        "changed_count", changedFields.size(),
                        "changed_fields", changedFields,
                        "config_mtime_ms", mtime
                )
        ));
    }

    private static long resolveFileMtimeMs(Path path) {
        if (!Files.exists(path)) {
            return -1L;
        }
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings mtime: " + path, e);
        }
    }

    public record SettingsReloadOutcome(
            boolean changed,
            boolean fileExists,
            String config,
            String status,
            long checkedAtMs,
            List<String> changedFields
    ) {
    }
}
