package io.reposync.sync;

import io.reposync.config.SyncSettings;
import io.reposync.model.Diff;
import io.reposync.model.SyncJob;
import io.reposync.observability.SyncEventLog;
import io.reposync.observability.SyncMetrics;
import io.reposync.storage.Store;
import io.reposync.storage.SyncJobStore;
import io.reposync.util.SyncContext;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Drives periodic syncing: queues jobs for due services, runs them on a fixed set of handler
 * threads, keeps their leases alive and takes back jobs whose handler went silent.
 *
 * <p>Each loop also has a single-tick method ({@code run*Once}) that does one round of work on
 * the calling thread.
 */
public final class SyncWorker implements AutoCloseable {
    private final Syncer syncer;
    private final SyncJobStore jobs;
    private final Store store;
    private final SyncedChannel synced;
    private final Supplier<SyncSettings> settings;
    private final SyncMetrics metrics;
    private final SyncEventLog eventLog;
    private final Clock clock;
    private final String workerId;
    private final ConcurrentMap<Long, ActiveLease> activeLeases;
    private final List<Thread> threads;
    private volatile SyncContext runCtx;
    private volatile boolean running;

    public SyncWorker(
            Syncer syncer,
            SyncJobStore jobs,
            Store store,
            SyncedChannel synced,
            Supplier<SyncSettings> settings,
            SyncMetrics metrics,
            SyncEventLog eventLog,
            Clock clock,
            String workerId
    ) {
        this.syncer = syncer;
        this.jobs = jobs;
        this.store = store;
        this.synced = synced;
        this.settings = settings;
        this.metrics = metrics == null ? SyncMetrics.NOOP : metrics;
        this.eventLog = eventLog == null ? SyncEventLog.noop() : eventLog;
        this.clock = clock;
        this.workerId = workerId == null || workerId.isBlank() ? "reposync-worker" : workerId;
        this.activeLeases = new ConcurrentHashMap<>();
        this.threads = new ArrayList<>();
        this.runCtx = SyncContext.background(clock);
        this.running = false;
    }

    /**
     * Publishes the initial diff (outside cloud mode) and starts the enqueuer, handler, heartbeat
     * and resetter threads.
     */
    public synchronized void start(SyncContext ctx) {
        if (running) {
            return;
        }
        SyncSettings current = settings.get();
        runCtx = ctx.child();
        running = true;
        if (!current.cloudMode()) {
            publishInitialDiff(runCtx);
        }
        spawn("reposync-enqueuer", () -> settings.get().enqueueIntervalMs(), () -> {
            runEnqueueOnce();
            return false;
        });
        for (int i = 1; i <= current.handlerCount(); i++) {
            spawn("reposync-handler-" + i, () -> settings.get().dequeueIntervalMs(),
                    () -> runHandlerOnce().processed());
        }
        spawn("reposync-heartbeat", () -> settings.get().heartbeatIntervalMs(), () -> {
            runHeartbeatOnce();
            return false;
        });
        spawn("reposync-resetter", () -> settings.get().resetIntervalMs(), () -> {
            runResetOnce();
            return false;
        });
        eventLog.log(SyncEventLog.SyncEvent.of(
                "worker.start",
                "worker/" + workerId,
                "ok",
                Map.of("handlers", current.handlerCount(), "cloud_mode", current.cloudMode())
        ));
    }

    /**
     * Reports every stored repo as unmodified so downstream consumers can rebuild their state.
     */
    public Diff publishInitialDiff(SyncContext ctx) {
        Diff diff = Diff.ofUnmodified(store.listRepos(0));
        synced.publish(ctx, diff);
        return diff;
    }

    /**
     * @return number of jobs queued, 0 while automatic syncs are disabled
     */
    public int runEnqueueOnce() {
        if (settings.get().disableAutoSyncs()) {
            return 0;
        }
        return jobs.enqueueSyncJobs(clock.millis());
    }

    /**
     * Leases one queued job and runs its sync pass to completion on the calling thread.
     */
    public HandlerOutcome runHandlerOnce() {
        Optional<SyncJobStore.LeasedJob> maybe = jobs.dequeue(workerId, clock.millis());
        if (maybe.isEmpty()) {
            return HandlerOutcome.idle();
        }
        SyncJobStore.LeasedJob leased = maybe.get();
        SyncJob job = leased.job();
        SyncContext jobCtx = runCtx.child();
        ActiveLease lease = new ActiveLease(job.id(), leased.leaseToken(), leased.leaseEpoch(), jobCtx);
        activeLeases.put(job.id(), lease);
        try {
            Syncer.SyncOutcome outcome = syncer.syncExternalService(
                    jobCtx, job.externalServiceId(), settings.get().minSyncIntervalMs());
            if (outcome.ok()) {
                return finish(lease, job, true, "");
            }
            return finish(lease, job, false, outcome.error().map(Throwable::getMessage).orElse(""));
        } catch (RuntimeException e) {
            return finish(lease, job, false, String.valueOf(e.getMessage()));
        } catch (AssertionError e) {
            finish(lease, job, false, "invariant violation: " + e.getMessage());
            throw e;
        } finally {
            activeLeases.remove(job.id(), lease);
            jobCtx.cancel();
        }
    }

    private HandlerOutcome finish(ActiveLease lease, SyncJob job, boolean success, String message) {
        long nowMs = clock.millis();
        boolean written = success
                ? jobs.markCompleted(job.id(), lease.leaseToken(), lease.leaseEpoch(), nowMs)
                : jobs.markErrored(job.id(), lease.leaseToken(), lease.leaseEpoch(), message, nowMs);
        String state = !written ? "stale_lease" : success ? "completed" : "errored";
        metrics.jobFinished(state);
        eventLog.log(SyncEventLog.SyncEvent.of(
                "sync.job",
                "sync_job/" + job.id(),
                state,
                Map.of(
                        "external_service_id", job.externalServiceId(),
                        "lease_epoch", lease.leaseEpoch(),
                        "message", message == null ? "" : message
                )
        ));
        return new HandlerOutcome(true, job.id(), job.externalServiceId(), state, message);
    }

    /**
     * Heartbeats every lease held by this worker. A lease that can no longer be extended has been
     * taken back, so its pass is cancelled.
     *
     * @return number of leases extended
     */
    public int runHeartbeatOnce() {
        long nowMs = clock.millis();
        int extended = 0;
        for (ActiveLease lease : activeLeases.values()) {
            if (jobs.heartbeat(lease.jobId(), lease.leaseToken(), lease.leaseEpoch(), nowMs)) {
                extended++;
                continue;
            }
            lease.ctx().cancel();
            activeLeases.remove(lease.jobId(), lease);
            eventLog.log(SyncEventLog.SyncEvent.of(
                    "lease.lost",
                    "sync_job/" + lease.jobId(),
                    "cancelled",
                    Map.of("lease_epoch", lease.leaseEpoch())
            ));
        }
        return extended;
    }

    public ResetOutcome runResetOnce() {
        SyncSettings current = settings.get();
        long nowMs = clock.millis();
        SyncJobStore.ResetSummary reset = jobs.resetStalled(nowMs, nowMs - current.leaseTimeoutMs(), current.maxNumResets());
        int cleaned = jobs.cleanupOldJobs(nowMs - current.jobRetentionMs());
        metrics.jobsReset(reset.requeued());
        if (reset.requeued() > 0 || reset.errored() > 0) {
            eventLog.log(SyncEventLog.SyncEvent.of(
                    "sync.job.reset",
                    "sync_jobs",
                    "ok",
                    Map.of("requeued", reset.requeued(), "errored", reset.errored(), "cleaned", cleaned)
            ));
        }
        return new ResetOutcome(reset.requeued(), reset.errored(), cleaned);
    }

    public int activeLeaseCount() {
        return activeLeases.size();
    }

    private void spawn(String name, LongSupplier intervalMs, Tick tick) {
        Thread t = new Thread(() -> {
            while (running && !runCtx.isCancelled()) {
                boolean busy = false;
                try {
                    busy = tick.run();
                } catch (RuntimeException | AssertionError e) {
                    eventLog.log(SyncEventLog.SyncEvent.of(
                            "worker.loop",
                            name,
                            "failed",
                            Map.of("error", String.valueOf(e.getMessage()))
                    ));
                }
                if (busy) {
                    continue;
                }
                try {
                    Thread.sleep(Math.max(10L, intervalMs.getAsLong()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }, name);
        t.setDaemon(true);
        threads.add(t);
        t.start();
    }

    @FunctionalInterface
    private interface Tick {
        /**
         * @return true when the tick did work and the loop should go again without sleeping
         */
        boolean run();
    }

    @Override
    public void close() {
        List<Thread> toJoin;
        synchronized (this) {
            running = false;
            runCtx.cancel();
            toJoin = new ArrayList<>(threads);
            threads.clear();
        }
        for (Thread t : toJoin) {
            t.interrupt();
        }
        for (Thread t : toJoin) {
            try {
                t.join(2_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private record ActiveLease(long jobId, String leaseToken, long leaseEpoch, SyncContext ctx) {
    }

    public record HandlerOutcome(boolean processed, long jobId, long serviceId, String state, String message) {
        static HandlerOutcome idle() {
            return new HandlerOutcome(false, 0L, 0L, "idle", "No queued sync jobs");
        }
    }

    public record ResetOutcome(int requeued, int errored, int cleaned) {
    }
}
