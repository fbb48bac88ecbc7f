package io.reposync.sync;

import io.reposync.config.SyncSettings;
import io.reposync.model.Diff;
import io.reposync.model.ExternalService;
import io.reposync.model.OwnerType;
import io.reposync.model.Repo;
import io.reposync.observability.SyncEventLog;
import io.reposync.observability.SyncMetrics;
import io.reposync.source.RepoGetter;
import io.reposync.source.Source;
import io.reposync.source.SourceResult;
import io.reposync.source.SourceStream;
import io.reposync.source.Sourcer;
import io.reposync.storage.Store;
import io.reposync.storage.SyncJobStore;
import io.reposync.util.SingleFlight;
import io.reposync.util.SyncContext;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Reconciles the repo inventory with what external services report.
 *
 * <p>{@link #syncExternalService} runs a full pass over one service; {@link #syncRepo} looks up a
 * single repo by name and fetches it from its code host on demand. Every committed change is
 * published on the {@link SyncedChannel} after its transaction commits.
 */
public final class Syncer implements AutoCloseable {
    private final Store store;
    private final SyncJobStore jobs;
    private final Sourcer sourcer;
    private final SyncedChannel synced;
    private final Supplier<SyncSettings> settings;
    private final PrivateCodePolicy privateCode;
    private final SyncMetrics metrics;
    private final SyncEventLog eventLog;
    private final Clock clock;
    private final ExecutorService workers;
    private final SingleFlight<String, Repo> lazyFlights;
    private final SyncContext lifecycle;

    public Syncer(
            Store store,
            SyncJobStore jobs,
            Sourcer sourcer,
            SyncedChannel synced,
            Supplier<SyncSettings> settings,
            PrivateCodePolicy privateCode,
            SyncMetrics metrics,
            SyncEventLog eventLog,
            Clock clock
    ) {
        this.store = store;
        this.jobs = jobs;
        this.sourcer = sourcer;
        this.synced = synced;
        this.settings = settings;
        this.privateCode = privateCode;
        this.metrics = metrics == null ? SyncMetrics.NOOP : metrics;
        this.eventLog = eventLog == null ? SyncEventLog.noop() : eventLog;
        this.clock = clock;
        this.workers = Executors.newCachedThreadPool(daemonThreads("reposync-syncer-"));
        this.lazyFlights = new SingleFlight<>();
        this.lifecycle = SyncContext.background(clock);
    }

    /**
     * Runs one reconciliation pass over an external service.
     *
     * @throws IllegalArgumentException   when the service does not exist
     * @throws CloudDefaultSyncException  when the service is a cloud default
     */
    public SyncOutcome syncExternalService(SyncContext ctx, long serviceId, long minSyncIntervalMs) {
        ExternalService svc = store.getExternalService(serviceId)
                .orElseThrow(() -> new IllegalArgumentException("External service not found: " + serviceId));
        if (svc.cloudDefault()) {
            throw new CloudDefaultSyncException(serviceId);
        }
        String family = svc.kind().serviceType();
        String owner = svc.ownerType().label();
        long startedAtMs = clock.millis();
        metrics.passStarted(family, owner);

        Source source = sourcer.forService(svc);
        Predicate<Repo> visible = visibilityFilter(svc);
        List<RuntimeException> errors = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        int added = 0;
        int modified = 0;
        int unmodified = 0;
        boolean stopped = false;

        try (SourceStream stream = SourceStream.open(workers, source, ctx, settings.get().sourceBufferSize())) {
            while (stream.hasNext()) {
                SourceResult result = stream.next();
                if (result.failed()) {
                    errors.add(new RuntimeException(
                            "fetching from code host " + svc.displayName() + ": " + result.error().getMessage(),
                            result.error()
                    ));
                    if (SyncErrors.isFatal(result.error())) {
                        seen.clear();
                        stopped = true;
                        break;
                    }
                    continue;
                }
                Repo sourced = result.repo();
                if (!visible.test(sourced)) {
                    continue;
                }
                Diff diff;
                try {
                    diff = apply(ctx, svc, sourced);
                } catch (RepoLimitException e) {
                    errors.add(e);
                    metrics.repoLimitReached(owner);
                    stopped = true;
                    break;
                } catch (RuntimeException e) {
                    errors.add(new RuntimeException("syncing repo " + sourced.name() + ": " + e.getMessage(), e));
                    continue;
                }
                added += diff.added().size();
                modified += diff.modified().size();
                unmodified += diff.unmodified().size();
                for (Repo r : diff.repos()) {
                    seen.add(r.id());
                }
            }
            if (ctx.isCancelled()) {
                errors.add(new CancellationException("sync of external service " + serviceId + " cancelled"));
            } else if (!stopped && !stream.completed()) {
                // An interrupted consumer leaves the listing unfinished; nothing unseen may be pruned.
                errors.add(new CancellationException("listing of external service " + serviceId + " ended before completion"));
            }
        }

        int deleted = 0;
        if (errors.isEmpty() || (!svc.isSiteOwned() && SyncErrors.anyFatal(errors))) {
            Store.DeletionOutcome deletion = store.deleteExternalServiceReposNotIn(svc, seen);
            deleted = deletion.deleted().size();
            if (deleted > 0) {
                publishCommitted(Diff.ofDeleted(deletion.deleted()));
            }
            if (!deletion.failures().isEmpty()) {
                RuntimeException failed = new RuntimeException(
                        "some repos couldn't be deleted: " + deletion.failures().keySet());
                deletion.failures().values().forEach(failed::addSuppressed);
                errors.add(failed);
            }
        }

        long nowMs = clock.millis();
        long intervalMs = SyncInterval.next(nowMs, svc.lastSyncAtMs(), minSyncIntervalMs,
                added + modified + deleted > 0, !errors.isEmpty());
        long nextSyncAtMs = nowMs + intervalMs;
        try {
            ExternalService latest = store.getExternalService(serviceId).orElse(svc);
            store.upsertExternalService(latest.withSyncTimes(nowMs, nextSyncAtMs));
        } catch (RuntimeException e) {
            errors.add(new RuntimeException("upserting external service " + serviceId + ": " + e.getMessage(), e));
        }

        Optional<SyncException> error = errors.isEmpty() ? Optional.empty() : Optional.of(SyncException.of(errors));
        metrics.passFinished(family, owner, nowMs - startedAtMs, error.isEmpty());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("added", added);
        details.put("modified", modified);
        details.put("deleted", deleted);
        details.put("unmodified", unmodified);
        details.put("errors", errors.size());
        details.put("next_sync_at_ms", nextSyncAtMs);
        error.ifPresent(e -> details.put("error", e.getMessage()));
        eventLog.log(SyncEventLog.SyncEvent.of(
                "sync.external_service",
                "external_service/" + serviceId,
                error.isEmpty() ? "ok" : "failed",
                details
        ));
        return new SyncOutcome(serviceId, added, modified, deleted, unmodified, nextSyncAtMs, error);
    }

    /**
     * Reconciles one sourced repo against the store in a single transaction and publishes the
     * resulting diff once it has committed. Repos in the returned diff are the stored rows.
     *
     * @throws RepoLimitException when inserting would exceed a user-added repo limit
     */
    public Diff apply(SyncContext ctx, ExternalService svc, Repo sourced) {
        ctx.throwIfCancelled();
        Diff diff = store.transact(tx -> {
            List<Repo> stored = tx.listReposByNameOrSpec(sourced.name(), sourced.externalRepo());
            if (stored.size() == 2) {
                Repo existing;
                Repo conflicting;
                if (stored.get(0).externalRepo().equals(sourced.externalRepo())) {
                    existing = stored.get(0);
                    conflicting = stored.get(1);
                } else if (stored.get(1).externalRepo().equals(sourced.externalRepo())) {
                    existing = stored.get(1);
                    conflicting = stored.get(0);
                } else {
                    throw new AssertionError("two stored repos match " + sourced.name() + " but none has spec " + sourced.externalRepo());
                }
                // The sourced repo takes the name; the other row comes back under its new name on a later pass.
                tx.deleteRepo(conflicting.id());
                stored = List.of(existing);
            }
            switch (stored.size()) {
                case 1 -> {
                    Optional<Repo> updated = stored.get(0).updatedWith(sourced);
                    if (updated.isEmpty()) {
                        return Diff.ofUnmodified(stored.get(0));
                    }
                    return Diff.ofModified(tx.updateExternalServiceRepo(svc, updated.get()));
                }
                case 0 -> {
                    if (!svc.isSiteOwned()) {
                        SyncSettings s = settings.get();
                        int siteAdded = tx.countNamespacedRepos(0L, 0L);
                        int namespaceAdded = tx.countNamespacedRepos(svc.namespaceUserId(), svc.namespaceOrgId());
                        if (siteAdded >= s.userReposMaxPerSite() || namespaceAdded >= s.userReposMaxPerUser()) {
                            throw new RepoLimitException(siteAdded, s.userReposMaxPerSite(), namespaceAdded,
                                    s.userReposMaxPerUser(), svc.namespaceUserId(), svc.namespaceOrgId());
                        }
                    }
                    return Diff.ofAdded(tx.createExternalServiceRepo(svc, sourced));
                }
                default -> throw new AssertionError(stored.size() + " stored repos match name or spec of " + sourced.name());
            }
        });
        publishCommitted(diff);
        return diff;
    }

    /**
     * Looks up a repo by name, fetching it from its code host when it is unknown or stale.
     *
     * <p>With {@code background} set and a stored copy present, the fetch runs asynchronously and
     * the stored copy is returned right away. Concurrent lookups of the same name share one fetch.
     *
     * @throws RepoNotFoundException when the repo is private, unknown, or gone from its host
     */
    public Repo syncRepo(SyncContext ctx, String name, boolean background) {
        Optional<Repo> stored = store.getRepoByName(name);
        Optional<CodeHost> host = CodeHosts.of(name);
        if (host.isEmpty()) {
            metrics.lazySync("unknown_host");
            return stored.orElseThrow(() -> new RepoNotFoundException(name));
        }
        if (stored.isPresent() && stored.get().privateRepo()) {
            throw new RepoNotFoundException(name);
        }
        if (stored.isPresent() && isFresh(stored.get())) {
            metrics.lazySync("debounced");
            return stored.get();
        }
        if (background && stored.isPresent()) {
            syncRepoInBackground(name, host.get());
            return stored.get();
        }
        return syncRepoShared(ctx, name, host.get());
    }

    /**
     * Queues a sync job for the service now, unless one is already queued or processing.
     *
     * @return the queued job id, empty when a job was already pending
     */
    public Optional<Long> triggerExternalServiceSync(long serviceId) {
        ExternalService svc = store.getExternalService(serviceId)
                .orElseThrow(() -> new IllegalArgumentException("External service not found: " + serviceId));
        if (svc.cloudDefault()) {
            throw new CloudDefaultSyncException(serviceId);
        }
        Optional<Long> jobId = jobs.enqueueSingleSyncJob(serviceId, clock.millis());
        eventLog.log(SyncEventLog.SyncEvent.of(
                "sync.trigger",
                "external_service/" + serviceId,
                jobId.isPresent() ? "queued" : "already_pending",
                Map.of("job_id", jobId.orElse(0L))
        ));
        return jobId;
    }

    int lazyFlightsInFlight() {
        return lazyFlights.inFlightCount();
    }

    private Repo syncRepoShared(SyncContext ctx, String name, CodeHost host) {
        return lazyFlights.run(name, () -> {
            Optional<Repo> current = store.getRepoByName(name);
            if (current.isPresent() && !current.get().privateRepo() && isFresh(current.get())) {
                metrics.lazySync("debounced");
                return current.get();
            }
            return fetchRepo(ctx, name, host, current);
        });
    }

    private void syncRepoInBackground(String name, CodeHost host) {
        if (lifecycle.isCancelled()) {
            return;
        }
        SyncContext bg = lifecycle.withTimeout(Duration.ofMillis(settings.get().lazySyncTimeoutMs()));
        try {
            workers.execute(() -> {
                try {
                    syncRepoShared(bg, name, host);
                } catch (RuntimeException e) {
                    eventLog.log(SyncEventLog.SyncEvent.of(
                            "sync.repo",
                            "repo/" + name,
                            "background_failed",
                            Map.of("error", String.valueOf(e.getMessage()))
                    ));
                } finally {
                    bg.cancel();
                }
            });
        } catch (RejectedExecutionException e) {
            bg.cancel();
            eventLog.log(SyncEventLog.SyncEvent.of("sync.repo", "repo/" + name, "background_rejected", Map.of()));
        }
    }

    private Repo fetchRepo(SyncContext ctx, String name, CodeHost host, Optional<Repo> stored) {
        ExternalService svc = resolveService(host);
        Source source = sourcer.forService(svc);
        if (!(source instanceof RepoGetter getter)) {
            throw new IllegalStateException("source of external service " + svc.id() + " can't fetch single repos");
        }
        try {
            Repo fetched = getter.getRepo(ctx, host.pathOf(name));
            if (fetched.privateRepo()) {
                throw new RepoNotFoundException(name);
            }
            Diff diff = apply(ctx, svc, fetched);
            metrics.lazySync("fetched");
            return diff.repos().get(0);
        } catch (RuntimeException e) {
            if (stored.isPresent() && SyncErrors.isGone(e)) {
                store.deleteExternalServiceRepo(svc, stored.get().id());
                publishCommitted(Diff.ofDeleted(List.of(stored.get())));
                metrics.lazySync("deleted");
            } else {
                metrics.lazySync("failed");
            }
            if (e instanceof RepoNotFoundException) {
                throw e;
            }
            if (SyncErrors.isGone(e)) {
                throw new RepoNotFoundException(name, e);
            }
            throw e;
        }
    }

    private ExternalService resolveService(CodeHost host) {
        Store.ServiceQuery query = new Store.ServiceQuery(List.of(host.kind()), !host.packageHost(), 1);
        List<ExternalService> services = store.listExternalServices(query);
        if (services.isEmpty()) {
            throw new IllegalStateException("no external service found for code host " + host.prefix());
        }
        return services.get(0);
    }

    private boolean isFresh(Repo repo) {
        return clock.millis() - repo.updatedAtMs() < settings.get().lazySyncDebounceMs();
    }

    private Predicate<Repo> visibilityFilter(ExternalService svc) {
        if (svc.ownerType() == OwnerType.USER && !privateCode.allowsPrivateCode(svc.namespaceUserId())) {
            return r -> !r.privateRepo();
        }
        return r -> true;
    }

    /**
     * Publishes a committed diff. Uses the syncer's own context so a cancelled pass still
     * reports what it already wrote.
     */
    private void publishCommitted(Diff diff) {
        metrics.reposSynced("added", diff.added().size());
        metrics.reposSynced("modified", diff.modified().size());
        metrics.reposSynced("deleted", diff.deleted().size());
        metrics.reposSynced("unmodified", diff.unmodified().size());
        synced.publish(lifecycle, diff);
    }

    @Override
    public void close() {
        lifecycle.cancel();
        workers.shutdownNow();
        try {
            workers.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public record SyncOutcome(
            long serviceId,
            int added,
            int modified,
            int deleted,
            int unmodified,
            long nextSyncAtMs,
            Optional<SyncException> error
    ) {
        public boolean ok() {
            return error.isEmpty();
        }
    }
}
