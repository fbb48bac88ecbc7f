package io.reposync.observability;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link SyncMetrics}: one monotonically increasing counter per metric and label set.
 */
public final class SyncCounters implements SyncMetrics {
    public static final String SYNC_STARTED = "reposync_sync_started_total";
    public static final String SYNC_FINISHED = "reposync_sync_finished_total";
    public static final String SYNC_DURATION_MS = "reposync_sync_duration_ms_total";
    public static final String SYNCED_REPOS = "reposync_synced_repos_total";
    public static final String REPO_LIMIT_REACHED = "reposync_repo_limit_reached_total";
    public static final String LAZY_SYNC = "reposync_lazy_sync_total";
    public static final String JOBS_RESET = "reposync_sync_jobs_reset_total";
    public static final String JOBS_FINISHED = "reposync_sync_jobs_finished_total";

    private final ConcurrentMap<SeriesKey, AtomicLong> counters = new ConcurrentHashMap<>();

    @Override
    public void passStarted(String family, String owner) {
        add(SYNC_STARTED, 1L, "family", family, "owner", owner);
    }

    @Override
    public void passFinished(String family, String owner, long durationMs, boolean success) {
        add(SYNC_FINISHED, 1L, "family", family, "owner", owner, "success", Boolean.toString(success));
        add(SYNC_DURATION_MS, Math.max(0L, durationMs), "family", family, "owner", owner);
    }

    @Override
    public void reposSynced(String state, int count) {
        if (count > 0) {
            add(SYNCED_REPOS, count, "state", state);
        }
    }

    @Override
    public void repoLimitReached(String owner) {
        add(REPO_LIMIT_REACHED, 1L, "owner", owner);
    }

    @Override
    public void lazySync(String result) {
        add(LAZY_SYNC, 1L, "result", result);
    }

    @Override
    public void jobsReset(int count) {
        if (count > 0) {
            add(JOBS_RESET, count);
        }
    }

    @Override
    public void jobFinished(String state) {
        add(JOBS_FINISHED, 1L, "state", state);
    }

    public long value(String metric, String... labelPairs) {
        AtomicLong counter = counters.get(SeriesKey.of(metric, labelPairs));
        return counter == null ? 0L : counter.get();
    }

    public List<Series> snapshot() {
        List<Series> out = new ArrayList<>(counters.size());
        for (Map.Entry<SeriesKey, AtomicLong> e : counters.entrySet()) {
            out.add(new Series(e.getKey().metric(), new TreeMap<>(e.getKey().labels()), e.getValue().get()));
        }
        out.sort(Comparator.comparing(Series::metric).thenComparing(s -> s.labels().toString()));
        return out;
    }

    private void add(String metric, long delta, String... labelPairs) {
        counters.computeIfAbsent(SeriesKey.of(metric, labelPairs), k -> new AtomicLong()).addAndGet(delta);
    }

    public record Series(String metric, Map<String, String> labels, long value) {
    }

    private record SeriesKey(String metric, Map<String, String> labels) {
        static SeriesKey of(String metric, String... labelPairs) {
            if (labelPairs.length % 2 != 0) {
                throw new IllegalArgumentException("label pairs must come in name/value pairs");
            }
            Map<String, String> labels = new TreeMap<>();
            for (int i = 0; i < labelPairs.length; i += 2) {
                labels.put(labelPairs[i], labelPairs[i + 1] == null ? "" : labelPairs[i + 1]);
            }
            return new SeriesKey(metric, Map.copyOf(labels));
        }
    }
}
