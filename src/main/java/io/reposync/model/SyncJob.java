package io.reposync.model;

public record SyncJob(
        long id,
        long externalServiceId,
        SyncJobState state,
        String failureMessage,
        long queuedAtMs,
        long startedAtMs,
        long finishedAtMs,
        long lastHeartbeatAtMs,
        int numResets,
        int numFailures,
        String workerId,
        String leaseToken,
        long leaseEpoch
) {
}
