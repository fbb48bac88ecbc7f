package io.reposync.runtime;

import io.reposync.config.RepoSyncConfig;
import io.reposync.config.SettingsStore;
import io.reposync.config.SyncSettings;
import io.reposync.model.Diff;
import io.reposync.model.ExternalService;
import io.reposync.model.ExternalServiceKind;
import io.reposync.model.Repo;
import io.reposync.model.SyncJob;
import io.reposync.observability.PrometheusFormatter;
import io.reposync.observability.SyncCounters;
import io.reposync.observability.SyncEventLog;
import io.reposync.security.SensitiveDataMasker;
import io.reposync.source.ListingSourcer;
import io.reposync.source.Sourcer;
import io.reposync.storage.Database;
import io.reposync.storage.Store;
import io.reposync.storage.SyncJobStore;
import io.reposync.sync.CloneScheduler;
import io.reposync.sync.PermsSyncer;
import io.reposync.sync.PrivateCodePolicy;
import io.reposync.sync.SyncException;
import io.reposync.sync.SyncWorker;
import io.reposync.sync.SyncedChannel;
import io.reposync.sync.SyncedWatcher;
import io.reposync.sync.Syncer;
import io.reposync.util.SyncContext;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wires storage, sources, the syncer and the worker loops for one data root. The CLI talks to
 * this class only.
 */
public final class RepoSyncRuntime implements AutoCloseable {
    private static final int MAX_HANDLER_TICKS_PER_RUN = 1_000;

    private final RepoSyncConfig config;
    private final Clock clock;
    private final Database database;
    private final Store store;
    private final SyncJobStore jobs;
    private final SyncEventLog eventLog;
    private final SettingsStore settings;
    private final SyncCounters counters;
    private final SyncedChannel synced;
    private final SyncedWatcher watcher;
    private final Syncer syncer;
    private final SyncWorker worker;

    public RepoSyncRuntime(RepoSyncConfig config) {
        this(config, Clock.systemUTC(), null, null);
    }

    public RepoSyncRuntime(RepoSyncConfig config, Clock clock, CloneScheduler cloneScheduler, PermsSyncer permsSyncer) {
        this.config = config;
        this.clock = clock;
        this.database = new Database(config);
        this.store = new Store(database, clock);
        this.jobs = new SyncJobStore(database);
        this.eventLog = new SyncEventLog(config.eventsFile(), clock);
        this.settings = new SettingsStore(config.settingsFile(), clock, eventLog);
        this.counters = new SyncCounters();
        this.synced = new SyncedChannel(SyncSettings.defaults().syncedBufferSize());
        this.watcher = new SyncedWatcher(
                synced,
                cloneScheduler == null ? this::logCloneUpdate : cloneScheduler,
                permsSyncer == null ? this::logPermsSchedule : permsSyncer,
                settings,
                eventLog
        );
        Sourcer sourcer = new ListingSourcer(config.rootDir());
        this.syncer = new Syncer(store, jobs, sourcer, synced, settings, PrivateCodePolicy.fromSettings(settings),
                counters, eventLog, clock);
        this.worker = new SyncWorker(syncer, jobs, store, synced, settings, counters, eventLog, clock,
                "reposync-" + ProcessHandle.current().pid());
    }

    public void init() {
        database.init();
        settings.reload(true);
    }

    public SettingsStore.SettingsReloadOutcome reloadSettings() {
        return settings.reload(true);
    }

    public SyncSettings currentSettings() {
        return settings.get();
    }

    public ServiceView addExternalService(
            ExternalServiceKind kind,
            String displayName,
            String serviceConfig,
            long userId,
            long orgId,
            boolean cloudDefault
    ) {
        ExternalService svc;
        if (cloudDefault) {
            if (userId > 0 || orgId > 0) {
                throw new IllegalArgumentException("Cloud default services cannot have a namespace owner");
            }
            svc = ExternalService.cloudDefault(kind, displayName, serviceConfig);
        } else if (userId > 0) {
            svc = ExternalService.ownedByUser(kind, displayName, serviceConfig, userId);
        } else if (orgId > 0) {
            svc = ExternalService.ownedByOrg(kind, displayName, serviceConfig, orgId);
        } else {
            svc = ExternalService.site(kind, displayName, serviceConfig);
        }
        ExternalService saved = store.upsertExternalService(svc);
        eventLog.log(SyncEventLog.SyncEvent.of(
                "external_service.add",
                "external_service/" + saved.id(),
                "ok",
                Map.of("kind", kind.serviceType(), "owner", saved.owner(), "config", SensitiveDataMasker.maskConfig(saved.config()))
        ));
        return ServiceView.of(saved, jobs.lastSyncError(saved.id()).orElse(""));
    }

    public List<ServiceView> listExternalServices() {
        List<ServiceView> out = new ArrayList<>();
        for (ExternalService svc : store.listExternalServices(Store.ServiceQuery.all())) {
            out.add(ServiceView.of(svc, jobs.lastSyncError(svc.id()).orElse("")));
        }
        return out;
    }

    public TriggerOutcome triggerSync(long serviceId) {
        Optional<Long> jobId = syncer.triggerExternalServiceSync(serviceId);
        return new TriggerOutcome(serviceId, jobId.isPresent(), jobId.orElse(0L));
    }

    /**
     * Runs a full pass over one service on the calling thread, bypassing the job queue.
     */
    public SyncReport syncServiceNow(long serviceId) {
        watcher.start();
        Syncer.SyncOutcome outcome = syncer.syncExternalService(
                SyncContext.background(clock), serviceId, settings.get().minSyncIntervalMs());
        return SyncReport.of(outcome);
    }

    public Repo syncRepo(String name, boolean background) {
        watcher.start();
        SyncContext ctx = SyncContext.background(clock)
                .withTimeout(Duration.ofMillis(settings.get().lazySyncTimeoutMs()));
        try {
            return syncer.syncRepo(ctx, name, background);
        } finally {
            ctx.cancel();
        }
    }

    public List<Repo> listRepos(int limit) {
        return store.listRepos(limit);
    }

    public List<SyncJob> listJobs(long serviceId, int limit) {
        return jobs.listJobs(serviceId, limit);
    }

    public List<SyncJobStore.SyncErrorSummary> syncErrors(long userId, long orgId) {
        return jobs.syncErrorSummaries(userId, orgId);
    }

    /**
     * One round of every loop on the calling thread: queue due services, run queued jobs until
     * none are left, then take back stalled leases.
     */
    public RunOnceOutcome runOnce() {
        watcher.start();
        SyncContext ctx = SyncContext.background(clock);
        int initial = settings.get().cloudMode() ? 0 : worker.publishInitialDiff(ctx).size();
        int enqueued = worker.runEnqueueOnce();
        List<SyncWorker.HandlerOutcome> handled = new ArrayList<>();
        for (int i = 0; i < MAX_HANDLER_TICKS_PER_RUN; i++) {
            SyncWorker.HandlerOutcome outcome = worker.runHandlerOnce();
            if (!outcome.processed()) {
                break;
            }
            handled.add(outcome);
        }
        SyncWorker.ResetOutcome reset = worker.runResetOnce();
        return new RunOnceOutcome(initial, enqueued, handled, reset);
    }

    /**
     * Starts the relay thread and the worker loops. They run until {@link #close()}, which relays
     * whatever diffs are still queued.
     */
    public void start(SyncContext ctx) {
        watcher.start();
        worker.start(ctx);
    }

    public String metricsText() {
        String text = PrometheusFormatter.format(counters.snapshot(), jobs.countJobsByState(), store.countRepos());
        eventLog.log(SyncEventLog.SyncEvent.of(
                "runtime.metrics",
                "runtime/metrics",
                "ok",
                Map.of("bytes", text.length())
        ));
        return text;
    }

    public RepoSyncConfig config() {
        return config;
    }

    private void relayPending() {
        for (Diff diff : synced.drain()) {
            watcher.relay(diff);
        }
    }

    private void logCloneUpdate(Diff diff) {
        if (diff.isEmpty()) {
            return;
        }
        eventLog.log(SyncEventLog.SyncEvent.of(
                "clone.update",
                "repos",
                "queued",
                Map.of(
                        "added", diff.added().size(),
                        "modified", diff.modified().size(),
                        "deleted", diff.deleted().size(),
                        "unmodified", diff.unmodified().size()
                )
        ));
    }

    private void logPermsSchedule(List<Long> repoIds) {
        eventLog.log(SyncEventLog.SyncEvent.of(
                "perms.schedule",
                "repos",
                "queued",
                Map.of("repo_ids", repoIds)
        ));
    }

    @Override
    public void close() {
        worker.close();
        syncer.close();
        watcher.close();
        relayPending();
    }

    public record ServiceView(
            long id,
            String kind,
            String displayName,
            String owner,
            boolean cloudDefault,
            String config,
            long lastSyncAtMs,
            long nextSyncAtMs,
            String lastSyncError
    ) {
        static ServiceView of(ExternalService svc, String lastSyncError) {
            return new ServiceView(
                    svc.id(),
                    svc.kind().serviceType(),
                    svc.displayName(),
                    svc.owner(),
                    svc.cloudDefault(),
                    SensitiveDataMasker.maskConfig(svc.config()),
                    svc.lastSyncAtMs(),
                    svc.nextSyncAtMs(),
                    lastSyncError
            );
        }
    }

    public record TriggerOutcome(long serviceId, boolean queued, long jobId) {
    }

    public record SyncReport(
            long serviceId,
            int added,
            int modified,
            int deleted,
            int unmodified,
            long nextSyncAtMs,
            boolean ok,
            List<String> errors
    ) {
        static SyncReport of(Syncer.SyncOutcome outcome) {
            List<String> errors = outcome.error()
                    .map(SyncException::errors)
                    .map(list -> list.stream().map(e -> String.valueOf(e.getMessage())).toList())
                    .orElse(List.of());
            return new SyncReport(
                    outcome.serviceId(),
                    outcome.added(),
                    outcome.modified(),
                    outcome.deleted(),
                    outcome.unmodified(),
                    outcome.nextSyncAtMs(),
                    outcome.ok(),
                    errors
            );
        }
    }

    public record RunOnceOutcome(
            int initialRepos,
            int enqueued,
            List<SyncWorker.HandlerOutcome> handled,
            SyncWorker.ResetOutcome reset
    ) {
    }
}
