package io.reposync.sync;

/**
 * A full sync was requested for a cloud default service. Those services only gain repos through
 * single-repo lookups, and a full listing would prune everything they hold.
 */
public final class CloudDefaultSyncException extends RuntimeException {
    public CloudDefaultSyncException(long serviceId) {
        super("cloud default external services can't be synced: " + serviceId);
    }
}
