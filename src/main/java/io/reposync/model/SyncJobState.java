package io.reposync.model;

public enum SyncJobState {
    QUEUED,
    PROCESSING,
    COMPLETED,
    ERRORED;

    public boolean terminal() {
        return this == COMPLETED || this == ERRORED;
    }
}
