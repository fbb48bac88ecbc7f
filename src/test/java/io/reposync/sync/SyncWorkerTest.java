package io.reposync.sync;

import io.reposync.config.RepoSyncConfig;
import io.reposync.config.SyncSettings;
import io.reposync.model.Diff;
import io.reposync.model.ExternalService;
import io.reposync.model.ExternalServiceKind;
import io.reposync.model.SyncJob;
import io.reposync.model.SyncJobState;
import io.reposync.observability.SyncCounters;
import io.reposync.observability.SyncEventLog;
import io.reposync.source.Source;
import io.reposync.source.SourceException;
import io.reposync.storage.Database;
import io.reposync.storage.Store;
import io.reposync.storage.SyncJobStore;
import io.reposync.util.Jsons;
import io.reposync.util.ManualClock;
import io.reposync.util.SyncContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

final class SyncWorkerTest {
    private static final long T0 = 1_700_000_000_000L;

    @Test
    void initialDiffReportsEveryStoredRepoAsUnmodified() throws Exception {
        try (Harness h = new Harness("reposync-test-worker-initial-")) {
            ExternalService svc = h.store.upsertExternalService(
                    ExternalService.site(ExternalServiceKind.GITHUB, "GitHub", "{}"));
            h.syncer.apply(SyncContext.background(h.clock), svc, FakeSource.repo(svc, "github.com/acme/a", "1", false));
            h.syncer.apply(SyncContext.background(h.clock), svc, FakeSource.repo(svc, "github.com/acme/b", "2", false));
            h.synced.drain();

            Diff initial = h.worker.publishInitialDiff(SyncContext.background(h.clock));

            Assertions.assertEquals(2, initial.unmodified().size());
            Assertions.assertFalse(initial.changed());
            Assertions.assertEquals(List.of(initial), h.synced.drain());
        }
    }

    @Test
    void handlerRunsQueuedJobToCompletion() throws Exception {
        try (Harness h = new Harness("reposync-test-worker-handler-")) {
            ExternalService svc = h.store.upsertExternalService(
                    ExternalService.site(ExternalServiceKind.GITHUB, "GitHub", "{}"));
            h.source(svc).add(FakeSource.repo(svc, "github.com/acme/a", "1", false));

            Assertions.assertEquals(1, h.worker.runEnqueueOnce());
            SyncWorker.HandlerOutcome outcome = h.worker.runHandlerOnce();

            Assertions.assertTrue(outcome.processed());
            Assertions.assertEquals("completed", outcome.state());
            Assertions.assertEquals(svc.id(), outcome.serviceId());
            Assertions.assertEquals(SyncJobState.COMPLETED, h.jobs.getJob(outcome.jobId()).orElseThrow().state());
            Assertions.assertEquals(1, h.store.countRepos());
            Assertions.assertEquals(0, h.worker.activeLeaseCount());
            Assertions.assertEquals(1L, h.counters.value(SyncCounters.JOBS_FINISHED, "state", "completed"));

            Assertions.assertFalse(h.worker.runHandlerOnce().processed());
            Assertions.assertEquals(0, h.worker.runEnqueueOnce());
        }
    }

    @Test
    void failedPassErrorsTheJob() throws Exception {
        try (Harness h = new Harness("reposync-test-worker-errored-")) {
            ExternalService svc = h.store.upsertExternalService(
                    ExternalService.site(ExternalServiceKind.GITHUB, "GitHub", "{}"));
            h.source(svc).fail(SourceException.unauthorized());

            h.worker.runEnqueueOnce();
            SyncWorker.HandlerOutcome outcome = h.worker.runHandlerOnce();

            Assertions.assertEquals("errored", outcome.state());
            SyncJob job = h.jobs.getJob(outcome.jobId()).orElseThrow();
            Assertions.assertEquals(SyncJobState.ERRORED, job.state());
            Assertions.assertTrue(job.failureMessage().contains("fetching from code host GitHub"));
            Assertions.assertTrue(h.jobs.lastSyncError(svc.id()).isPresent());
        }
    }

    @Test
    void disabledAutoSyncsQueueNothing() throws Exception {
        try (Harness h = new Harness("reposync-test-worker-disabled-")) {
            h.store.upsertExternalService(ExternalService.site(ExternalServiceKind.GITHUB, "GitHub", "{}"));
            h.settings.set(settings("{\"disableAutoSyncs\": true}"));

            Assertions.assertEquals(0, h.worker.runEnqueueOnce());
            Assertions.assertTrue(h.jobs.listJobs(0L, 10).isEmpty());
        }
    }

    @Test
    void lostLeaseCancelsTheRunningPass() throws Exception {
        try (Harness h = new Harness("reposync-test-worker-lease-")) {
            ExternalService svc = h.store.upsertExternalService(
                    ExternalService.site(ExternalServiceKind.GITHUB, "GitHub", "{}"));
            CountDownLatch entered = new CountDownLatch(1);
            h.blocking.put(svc.id(), (ctx, results) -> {
                entered.countDown();
                while (!ctx.isCancelled()) {
                    try {
                        Thread.sleep(10L);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                }
            });
            long jobId = h.jobs.enqueueSingleSyncJob(svc.id(), h.clock.millis()).orElseThrow();

            AtomicReference<SyncWorker.HandlerOutcome> result = new AtomicReference<>();
            Thread handler = new Thread(() -> result.set(h.worker.runHandlerOnce()), "test-handler");
            handler.start();
            Assertions.assertTrue(entered.await(5, TimeUnit.SECONDS));
            Assertions.assertEquals(1, h.worker.runHeartbeatOnce());

            h.clock.advance(60_000L);
            SyncJobStore.ResetSummary reset = h.jobs.resetStalled(h.clock.millis(), h.clock.millis() - 30_000L, 3);
            Assertions.assertEquals(1, reset.requeued());

            Assertions.assertEquals(0, h.worker.runHeartbeatOnce());
            handler.join(5_000L);
            Assertions.assertFalse(handler.isAlive());
            Assertions.assertEquals("stale_lease", result.get().state());
            Assertions.assertEquals(SyncJobState.QUEUED, h.jobs.getJob(jobId).orElseThrow().state());
            Assertions.assertEquals(0, h.worker.activeLeaseCount());
        }
    }

    @Test
    void resetterRequeuesJobsPastTheLeaseTimeout() throws Exception {
        try (Harness h = new Harness("reposync-test-worker-reset-")) {
            ExternalService svc = h.store.upsertExternalService(
                    ExternalService.site(ExternalServiceKind.GITHUB, "GitHub", "{}"));
            long jobId = h.jobs.enqueueSingleSyncJob(svc.id(), h.clock.millis()).orElseThrow();
            h.jobs.dequeue("crashed-worker", h.clock.millis()).orElseThrow();

            h.clock.advance(10_000L);
            Assertions.assertEquals(0, h.worker.runResetOnce().requeued());

            h.clock.advance(30_000L);
            SyncWorker.ResetOutcome out = h.worker.runResetOnce();
            Assertions.assertEquals(1, out.requeued());
            Assertions.assertEquals(SyncJobState.QUEUED, h.jobs.getJob(jobId).orElseThrow().state());
            Assertions.assertEquals(1L, h.counters.value(SyncCounters.JOBS_RESET));
        }
    }

    @Test
    void startedLoopsSyncDueServices() throws Exception {
        try (Harness h = new Harness("reposync-test-worker-loops-")) {
            h.settings.set(settings("{\"dequeueIntervalMs\": 100, \"handlerCount\": 2}"));
            ExternalService svc = h.store.upsertExternalService(
                    ExternalService.site(ExternalServiceKind.GITHUB, "GitHub", "{}"));
            h.source(svc).add(FakeSource.repo(svc, "github.com/acme/a", "1", false));

            h.worker.start(SyncContext.background(h.clock));
            long deadline = System.currentTimeMillis() + 5_000L;
            while (System.currentTimeMillis() < deadline && h.store.countRepos() == 0) {
                Thread.sleep(20L);
            }
            while (System.currentTimeMillis() < deadline
                    && h.jobs.listJobs(svc.id(), 1).stream().noneMatch(j -> j.state() == SyncJobState.COMPLETED)) {
                Thread.sleep(20L);
            }
            h.worker.close();

            Assertions.assertEquals(1, h.store.countRepos());
            Assertions.assertEquals(SyncJobState.COMPLETED, h.jobs.listJobs(svc.id(), 1).get(0).state());
            Diff initial = h.synced.poll(10L);
            Assertions.assertNotNull(initial);
            Assertions.assertTrue(initial.isEmpty());
        }
    }

    private static SyncSettings settings(String json) throws IOException {
        return SyncSettings.fromFile(Jsons.mapper().readValue(json, SyncSettings.SyncSettingsFile.class),
                SyncSettings.defaults());
    }

    private static final class Harness implements AutoCloseable {
        final Path root;
        final ManualClock clock;
        final Store store;
        final SyncJobStore jobs;
        final SyncedChannel synced;
        final AtomicReference<SyncSettings> settings;
        final SyncCounters counters;
        final Map<Long, FakeSource> sources;
        final Map<Long, Source> blocking;
        final Syncer syncer;
        final SyncWorker worker;

        Harness(String prefix) throws IOException {
            this.root = Files.createTempDirectory(prefix);
            this.clock = new ManualClock(T0);
            Database db = new Database(RepoSyncConfig.fromRoot(root.toString()));
            db.init();
            this.store = new Store(db, clock);
            this.jobs = new SyncJobStore(db);
            this.synced = new SyncedChannel(1_024);
            this.settings = new AtomicReference<>(SyncSettings.defaults());
            this.counters = new SyncCounters();
            this.sources = new ConcurrentHashMap<>();
            this.blocking = new ConcurrentHashMap<>();
            this.syncer = new Syncer(store, jobs, svc -> {
                Source custom = blocking.get(svc.id());
                return custom != null ? custom : sources.computeIfAbsent(svc.id(), k -> new FakeSource());
            }, synced, settings::get, userId -> false, counters, SyncEventLog.noop(), clock);
            this.worker = new SyncWorker(syncer, jobs, store, synced, settings::get, counters,
                    SyncEventLog.noop(), clock, "test-worker");
        }

        FakeSource source(ExternalService svc) {
            return sources.computeIfAbsent(svc.id(), k -> new FakeSource());
        }

        @Override
        public void close() throws IOException {
            worker.close();
            syncer.close();
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
