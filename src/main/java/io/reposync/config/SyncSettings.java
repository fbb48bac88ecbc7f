package io.reposync.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Live tunables of the sync engine. Every value read from the settings file is clamped to a
 * sane minimum; a missing value keeps its default.
 */
public record SyncSettings(
        long enqueueIntervalMs,
        long minSyncIntervalMs,
        long dequeueIntervalMs,
        int handlerCount,
        long heartbeatIntervalMs,
        long leaseTimeoutMs,
        long resetIntervalMs,
        int maxNumResets,
        long jobRetentionMs,
        int userReposMaxPerUser,
        int userReposMaxPerSite,
        boolean disableAutoSyncs,
        boolean disableAutoGitUpdates,
        boolean allowUserPrivateCode,
        Set<Long> privateCodeUserIds,
        boolean cloudMode,
        int syncedBufferSize,
        int sourceBufferSize,
        long lazySyncDebounceMs,
        long lazySyncTimeoutMs
) {
    public static final long DEFAULT_MIN_SYNC_INTERVAL_MS = 60_000L;
    public static final int DEFAULT_USER_REPOS_MAX_PER_USER = 2_000;
    public static final int DEFAULT_USER_REPOS_MAX_PER_SITE = 200_000;

    public SyncSettings {
        privateCodeUserIds = privateCodeUserIds == null ? Set.of() : Set.copyOf(privateCodeUserIds);
    }

    public static SyncSettings defaults() {
        return new SyncSettings(
                60_000L,
                DEFAULT_MIN_SYNC_INTERVAL_MS,
                10_000L,
                3,
                5_000L,
                30_000L,
                60_000L,
                3,
                24L * 60L * 60L * 1000L,
                DEFAULT_USER_REPOS_MAX_PER_USER,
                DEFAULT_USER_REPOS_MAX_PER_SITE,
                false,
                false,
                false,
                Set.of(),
                false,
                1_024,
                64,
                60_000L,
                60_000L
        );
    }

    public static SyncSettings fromFile(SyncSettingsFile file, SyncSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long heartbeat = sanitizeLong(file.heartbeatIntervalMs(), defaults.heartbeatIntervalMs(), 100L);
        long leaseTimeout = sanitizeLong(file.leaseTimeoutMs(), defaults.leaseTimeoutMs(), 1_000L);
        if (leaseTimeout <= heartbeat) {
            leaseTimeout = heartbeat * 2L;
        }
        return new SyncSettings(
                sanitizeLong(file.enqueueIntervalMs(), defaults.enqueueIntervalMs(), 1_000L),
                sanitizeLong(file.minSyncIntervalMs(), defaults.minSyncIntervalMs(), 1_000L),
                sanitizeLong(file.dequeueIntervalMs(), defaults.dequeueIntervalMs(), 100L),
                sanitizeInt(file.handlerCount(), defaults.handlerCount(), 1),
                heartbeat,
                leaseTimeout,
                sanitizeLong(file.resetIntervalMs(), defaults.resetIntervalMs(), 1_000L),
                sanitizeInt(file.maxNumResets(), defaults.maxNumResets(), 0),
                sanitizeLong(file.jobRetentionMs(), defaults.jobRetentionMs(), 0L),
                sanitizeInt(file.userReposMaxPerUser(), defaults.userReposMaxPerUser(), 0),
                sanitizeInt(file.userReposMaxPerSite(), defaults.userReposMaxPerSite(), 0),
                sanitizeBoolean(file.disableAutoSyncs(), defaults.disableAutoSyncs()),
                sanitizeBoolean(file.disableAutoGitUpdates(), defaults.disableAutoGitUpdates()),
                sanitizeBoolean(file.allowUserPrivateCode(), defaults.allowUserPrivateCode()),
                file.privateCodeUserIds() == null ? defaults.privateCodeUserIds() : Set.copyOf(file.privateCodeUserIds()),
                sanitizeBoolean(file.cloudMode(), defaults.cloudMode()),
                sanitizeInt(file.syncedBufferSize(), defaults.syncedBufferSize(), 1),
                sanitizeInt(file.sourceBufferSize(), defaults.sourceBufferSize(), 1),
                sanitizeLong(file.lazySyncDebounceMs(), defaults.lazySyncDebounceMs(), 0L),
                sanitizeLong(file.lazySyncTimeoutMs(), defaults.lazySyncTimeoutMs(), 1_000L)
        );
    }

    public SyncSettings withRepoLimits(int perUser, int perSite) {
        return new SyncSettings(enqueueIntervalMs, minSyncIntervalMs, dequeueIntervalMs, handlerCount,
                heartbeatIntervalMs, leaseTimeoutMs, resetIntervalMs, maxNumResets, jobRetentionMs, perUser, perSite,
                disableAutoSyncs, disableAutoGitUpdates, allowUserPrivateCode, privateCodeUserIds, cloudMode,
                syncedBufferSize, sourceBufferSize, lazySyncDebounceMs, lazySyncTimeoutMs);
    }

    public SyncSettings withPrivateCode(boolean allowAll, Set<Long> userIds) {
        return new SyncSettings(enqueueIntervalMs, minSyncIntervalMs, dequeueIntervalMs, handlerCount,
                heartbeatIntervalMs, leaseTimeoutMs, resetIntervalMs, maxNumResets, jobRetentionMs,
                userReposMaxPerUser, userReposMaxPerSite, disableAutoSyncs, disableAutoGitUpdates, allowAll, userIds,
                cloudMode, syncedBufferSize, sourceBufferSize, lazySyncDebounceMs, lazySyncTimeoutMs);
    }

    public SyncSettings withCloudMode(boolean cloud) {
        return new SyncSettings(enqueueIntervalMs, minSyncIntervalMs, dequeueIntervalMs, handlerCount,
                heartbeatIntervalMs, leaseTimeoutMs, resetIntervalMs, maxNumResets, jobRetentionMs,
                userReposMaxPerUser, userReposMaxPerSite, disableAutoSyncs, disableAutoGitUpdates,
                allowUserPrivateCode, privateCodeUserIds, cloud, syncedBufferSize, sourceBufferSize,
                lazySyncDebounceMs, lazySyncTimeoutMs);
    }

    public SyncSettings withLeaseTimeoutMs(long timeoutMs) {
        return new SyncSettings(enqueueIntervalMs, minSyncIntervalMs, dequeueIntervalMs, handlerCount,
                heartbeatIntervalMs, timeoutMs, resetIntervalMs, maxNumResets, jobRetentionMs,
                userReposMaxPerUser, userReposMaxPerSite, disableAutoSyncs, disableAutoGitUpdates,
                allowUserPrivateCode, privateCodeUserIds, cloudMode, syncedBufferSize, sourceBufferSize,
                lazySyncDebounceMs, lazySyncTimeoutMs);
    }

    List<String> changedFields(SyncSettings after) {
        List<String> changed = new ArrayList<>();
        if (after == null) {
            return changed;
        }
        if (enqueueIntervalMs != after.enqueueIntervalMs) changed.add("enqueueIntervalMs");
        if (minSyncIntervalMs != after.minSyncIntervalMs) changed.add("minSyncIntervalMs");
        if (dequeueIntervalMs != after.dequeueIntervalMs) changed.add("dequeueIntervalMs");
        if (handlerCount != after.handlerCount) changed.add("handlerCount");
        if (heartbeatIntervalMs != after.heartbeatIntervalMs) changed.add("heartbeatIntervalMs");
        if (leaseTimeoutMs != after.leaseTimeoutMs) changed.add("leaseTimeoutMs");
        if (resetIntervalMs != after.resetIntervalMs) changed.add("resetIntervalMs");
        if (maxNumResets != after.maxNumResets) changed.add("maxNumResets");
        if (jobRetentionMs != after.jobRetentionMs) changed.add("jobRetentionMs");
        if (userReposMaxPerUser != after.userReposMaxPerUser) changed.add("userReposMaxPerUser");
        if (userReposMaxPerSite != after.userReposMaxPerSite) changed.add("userReposMaxPerSite");
        if (disableAutoSyncs != after.disableAutoSyncs) changed.add("disableAutoSyncs");
        if (disableAutoGitUpdates != after.disableAutoGitUpdates) changed.add("disableAutoGitUpdates");
        if (allowUserPrivateCode != after.allowUserPrivateCode) changed.add("allowUserPrivateCode");
        if (!privateCodeUserIds.equals(after.privateCodeUserIds)) changed.add("privateCodeUserIds");
        if (cloudMode != after.cloudMode) changed.add("cloudMode");
        if (syncedBufferSize != after.syncedBufferSize) changed.add("syncedBufferSize");
        if (sourceBufferSize != after.sourceBufferSize) changed.add("sourceBufferSize");
        if (lazySyncDebounceMs != after.lazySyncDebounceMs) changed.add("lazySyncDebounceMs");
        if (lazySyncTimeoutMs != after.lazySyncTimeoutMs) changed.add("lazySyncTimeoutMs");
        return changed;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    /**
     * On-disk shape of {@code reposync-settings.json}; every field is optional.
     */
    public record SyncSettingsFile(
            Long enqueueIntervalMs,
            Long minSyncIntervalMs,
            Long dequeueIntervalMs,
            Integer handlerCount,
            Long heartbeatIntervalMs,
            Long leaseTimeoutMs,
            Long resetIntervalMs,
            Integer maxNumResets,
            Long jobRetentionMs,
            Integer userReposMaxPerUser,
            Integer userReposMaxPerSite,
            Boolean disableAutoSyncs,
            Boolean disableAutoGitUpdates,
            Boolean allowUserPrivateCode,
            List<Long> privateCodeUserIds,
            Boolean cloudMode,
            Integer syncedBufferSize,
            Integer sourceBufferSize,
            Long lazySyncDebounceMs,
            Long lazySyncTimeoutMs
    ) {
    }
}
