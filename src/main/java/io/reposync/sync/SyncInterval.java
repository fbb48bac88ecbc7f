package io.reposync.sync;

/**
 * Backoff between syncs of one external service.
 */
public final class SyncInterval {
    public static final long MAX_INTERVAL_MS = 8L * 60L * 60L * 1000L;

    private SyncInterval() {
    }

    /**
     * @param lastSyncAtMs previous sync time, 0 when the service was never synced
     * @param changed      whether the pass added, modified or deleted anything
     * @param errored      whether the pass recorded any error
     * @return milliseconds until the next sync
     */
    public static long next(long nowMs, long lastSyncAtMs, long minIntervalMs, boolean changed, boolean errored) {
        long min = Math.max(0L, Math.min(minIntervalMs, MAX_INTERVAL_MS));
        if (lastSyncAtMs <= 0L) {
            return min;
        }
        if (!errored && changed) {
            return min;
        }
        long elapsed = Math.max(0L, nowMs - lastSyncAtMs);
        long doubled = elapsed > MAX_INTERVAL_MS ? MAX_INTERVAL_MS : elapsed * 2L;
        return Math.max(min, Math.min(MAX_INTERVAL_MS, doubled));
    }
}
