package io.reposync.observability;

/**
 * Sink for sync counters. {@link #NOOP} discards everything.
 */
public interface SyncMetrics {
    SyncMetrics NOOP = new SyncMetrics() {
    };

    default void passStarted(String family, String owner) {
    }

    default void passFinished(String family, String owner, long durationMs, boolean success) {
    }

    /**
     * @param state one of added, modified, deleted, unmodified
     */
    default void reposSynced(String state, int count) {
    }

    default void repoLimitReached(String owner) {
    }

    default void lazySync(String result) {
    }

    default void jobsReset(int count) {
    }

    default void jobFinished(String state) {
    }
}
