package io.reposync.sync;

import io.reposync.config.SyncSettings;
import io.reposync.model.Diff;
import io.reposync.model.Repo;
import io.reposync.observability.SyncEventLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Relays committed diffs from the {@link SyncedChannel} to the clone scheduler and the
 * permission syncer on its own thread.
 */
public final class SyncedWatcher implements AutoCloseable {
    private static final long POLL_MS = 200L;

    private final SyncedChannel synced;
    private final CloneScheduler cloneScheduler;
    private final PermsSyncer permsSyncer;
    private final Supplier<SyncSettings> settings;
    private final SyncEventLog eventLog;
    private volatile boolean running;
    private Thread thread;

    public SyncedWatcher(SyncedChannel synced, CloneScheduler cloneScheduler, PermsSyncer permsSyncer,
                         Supplier<SyncSettings> settings, SyncEventLog eventLog) {
        this.synced = synced;
        this.cloneScheduler = cloneScheduler;
        this.permsSyncer = permsSyncer;
        this.settings = settings;
        this.eventLog = eventLog;
    }

    public synchronized void start() {
        if (thread != null) {
            return;
        }
        running = true;
        thread = new Thread(this::loop, "reposync-synced-watcher");
        thread.setDaemon(true);
        thread.start();
    }

    private void loop() {
        while (running) {
            Diff diff;
            try {
                diff = synced.poll(POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (diff != null) {
                relay(diff);
            }
        }
    }

    /**
     * Forwards one diff. Collaborator failures are logged and swallowed so the relay keeps going.
     */
    public void relay(Diff diff) {
        if (!settings.get().disableAutoGitUpdates()) {
            try {
                cloneScheduler.updateFromDiff(diff);
            } catch (RuntimeException e) {
                logFailure("clone_scheduler", diff, e);
            }
        }
        List<Long> privateIds = new ArrayList<>();
        for (Repo r : diff.added()) {
            if (r.privateRepo()) {
                privateIds.add(r.id());
            }
        }
        for (Repo r : diff.modified()) {
            if (r.privateRepo()) {
                privateIds.add(r.id());
            }
        }
        if (privateIds.isEmpty()) {
            return;
        }
        try {
            permsSyncer.scheduleRepos(privateIds);
        } catch (RuntimeException e) {
            logFailure("perms_syncer", diff, e);
        }
    }

    private void logFailure(String target, Diff diff, RuntimeException e) {
        eventLog.log(SyncEventLog.SyncEvent.of(
                "synced.relay",
                target,
                "failed",
                Map.of("error", String.valueOf(e.getMessage()), "repos", diff.size())
        ));
    }

    @Override
    public void close() {
        Thread t;
        synchronized (this) {
            running = false;
            t = thread;
            thread = null;
        }
        if (t == null) {
            return;
        }
        t.interrupt();
        try {
            t.join(2_000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
