package io.reposync.sync;

import io.reposync.model.ExternalRepoSpec;
import io.reposync.model.ExternalService;
import io.reposync.model.Repo;
import io.reposync.source.RepoGetter;
import io.reposync.source.Source;
import io.reposync.source.SourceException;
import io.reposync.source.SourceResult;
import io.reposync.util.SyncContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory source for tests. Listing replays {@link #results}; single-repo lookups read
 * {@link #repos} by path and count how often they ran.
 */
final class FakeSource implements Source, RepoGetter {
    final List<SourceResult> results = new ArrayList<>();
    final Map<String, Repo> repos = new ConcurrentHashMap<>();
    final AtomicInteger fetches = new AtomicInteger();
    volatile RuntimeException fetchError;
    volatile Error listingError;
    volatile CountDownLatch fetchGate;

    static Repo repo(ExternalService svc, String name, String externalId, boolean privateRepo) {
        Repo base = Repo.sourced(name, new ExternalRepoSpec(externalId, svc.kind().serviceType(), "https://test"), privateRepo);
        return base.withSource(svc.id(), "https://" + name + ".git");
    }

    FakeSource add(Repo repo) {
        results.add(SourceResult.of(repo));
        return this;
    }

    FakeSource fail(RuntimeException error) {
        results.add(SourceResult.failed(error));
        return this;
    }

    FakeSource abortWith(Error error) {
        this.listingError = error;
        return this;
    }

    FakeSource hosting(String path, Repo repo) {
        repos.put(path, repo);
        return this;
    }

    @Override
    public void listRepos(SyncContext ctx, Results out) {
        for (SourceResult r : List.copyOf(results)) {
            if (ctx.isCancelled() || !out.send(r)) {
                return;
            }
        }
        Error error = listingError;
        if (error != null) {
            throw error;
        }
    }

    @Override
    public Repo getRepo(SyncContext ctx, String path) {
        fetches.incrementAndGet();
        CountDownLatch gate = fetchGate;
        if (gate != null) {
            try {
                if (!gate.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("fetch gate never opened");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
        }
        RuntimeException error = fetchError;
        if (error != null) {
            throw error;
        }
        Repo repo = repos.get(path);
        if (repo == null) {
            throw SourceException.notFound(path);
        }
        return repo;
    }
}
