package io.reposync.model;

/**
 * One configured connection to a code host or package registry.
 *
 * <p>Ownership is derived from the namespace columns: both zero means the service is
 * site-owned, otherwise exactly one of {@code namespaceUserId} / {@code namespaceOrgId}
 * is set. {@code lastSyncAtMs == 0} means the service has never been synced.
 */
public record ExternalService(
        long id,
        ExternalServiceKind kind,
        String displayName,
        String config,
        long namespaceUserId,
        long namespaceOrgId,
        boolean cloudDefault,
        long lastSyncAtMs,
        long nextSyncAtMs,
        long createdAtMs,
        long updatedAtMs,
        long deletedAtMs
) {
    public ExternalService {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (namespaceUserId > 0 && namespaceOrgId > 0) {
            throw new IllegalArgumentException("External service cannot be owned by both a user and an org");
        }
        displayName = displayName == null || displayName.isBlank() ? kind.serviceType() : displayName.trim();
        config = config == null || config.isBlank() ? "{}" : config;
    }

    public static ExternalService site(ExternalServiceKind kind, String displayName, String config) {
        return new ExternalService(0L, kind, displayName, config, 0L, 0L, false, 0L, 0L, 0L, 0L, 0L);
    }

    public static ExternalService ownedByUser(ExternalServiceKind kind, String displayName, String config, long userId) {
        return new ExternalService(0L, kind, displayName, config, userId, 0L, false, 0L, 0L, 0L, 0L, 0L);
    }

    public static ExternalService ownedByOrg(ExternalServiceKind kind, String displayName, String config, long orgId) {
        return new ExternalService(0L, kind, displayName, config, 0L, orgId, false, 0L, 0L, 0L, 0L, 0L);
    }

    public static ExternalService cloudDefault(ExternalServiceKind kind, String displayName) {
        return cloudDefault(kind, displayName, "{}");
    }

    public static ExternalService cloudDefault(ExternalServiceKind kind, String displayName, String config) {
        return new ExternalService(0L, kind, displayName, config, 0L, 0L, true, 0L, 0L, 0L, 0L, 0L);
    }

    public OwnerType ownerType() {
        if (namespaceUserId > 0) {
            return OwnerType.USER;
        }
        if (namespaceOrgId > 0) {
            return OwnerType.ORG;
        }
        return OwnerType.SITE;
    }

    public boolean isSiteOwned() {
        return ownerType() == OwnerType.SITE;
    }

    public String owner() {
        return switch (ownerType()) {
            case USER -> "user:" + namespaceUserId;
            case ORG -> "org:" + namespaceOrgId;
            case SITE -> "site";
        };
    }

    public ExternalService withId(long newId) {
        return new ExternalService(newId, kind, displayName, config, namespaceUserId, namespaceOrgId, cloudDefault,
                lastSyncAtMs, nextSyncAtMs, createdAtMs, updatedAtMs, deletedAtMs);
    }

    public ExternalService withSyncTimes(long lastSyncMs, long nextSyncMs) {
        return new ExternalService(id, kind, displayName, config, namespaceUserId, namespaceOrgId, cloudDefault,
                lastSyncMs, nextSyncMs, createdAtMs, updatedAtMs, deletedAtMs);
    }

    public ExternalService withTimestamps(long created, long updated) {
        return new ExternalService(id, kind, displayName, config, namespaceUserId, namespaceOrgId, cloudDefault,
                lastSyncAtMs, nextSyncAtMs, created, updated, deletedAtMs);
    }
}
