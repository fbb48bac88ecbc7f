package io.reposync.sync;

/**
 * Raised when inserting a repo through a user- or org-owned service would exceed the site-wide
 * or per-namespace limit on user-added repos.
 */
public final class RepoLimitException extends RuntimeException {
    private final int siteAdded;
    private final int siteLimit;
    private final int namespaceAdded;
    private final int namespaceLimit;
    private final long userId;
    private final long orgId;

    public RepoLimitException(int siteAdded, int siteLimit, int namespaceAdded, int namespaceLimit, long userId, long orgId) {
        super(message(siteAdded, siteLimit, namespaceAdded, namespaceLimit, userId, orgId));
        this.siteAdded = siteAdded;
        this.siteLimit = siteLimit;
        this.namespaceAdded = namespaceAdded;
        this.namespaceLimit = namespaceLimit;
        this.userId = userId;
        this.orgId = orgId;
    }

    private static String message(int siteAdded, int siteLimit, int namespaceAdded, int namespaceLimit, long userId, long orgId) {
        if (orgId > 0) {
            return "reached maximum allowed org added repos: site:%d/%d, org:%d/%d (org-id: %d)"
                    .formatted(siteAdded, siteLimit, namespaceAdded, namespaceLimit, orgId);
        }
        return "reached maximum allowed user added repos: site:%d/%d, user:%d/%d (user-id: %d)"
                .formatted(siteAdded, siteLimit, namespaceAdded, namespaceLimit, userId);
    }

    public int siteAdded() {
        return siteAdded;
    }

    public int siteLimit() {
        return siteLimit;
    }

    public int namespaceAdded() {
        return namespaceAdded;
    }

    public int namespaceLimit() {
        return namespaceLimit;
    }

    public long userId() {
        return userId;
    }

    public long orgId() {
        return orgId;
    }
}
