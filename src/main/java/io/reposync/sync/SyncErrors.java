package io.reposync.sync;

import io.reposync.source.SourceException;

import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Classifies sync failures by the {@link SourceException.Reason}s found anywhere in their cause
 * and suppressed chains.
 */
public final class SyncErrors {
    private SyncErrors() {
    }

    /**
     * Unauthorized, forbidden and suspended accounts: the listing is unusable as a whole.
     */
    public static boolean isFatal(Throwable t) {
        return has(t, SourceException.Reason.UNAUTHORIZED)
                || has(t, SourceException.Reason.FORBIDDEN)
                || has(t, SourceException.Reason.ACCOUNT_SUSPENDED);
    }

    public static boolean isNotFound(Throwable t) {
        return has(t, SourceException.Reason.NOT_FOUND) || chainContains(t, RepoNotFoundException.class);
    }

    /**
     * Failures after which a single repo is treated as gone from its host.
     */
    public static boolean isGone(Throwable t) {
        return isNotFound(t) || isFatal(t);
    }

    public static boolean anyFatal(Collection<? extends Throwable> errors) {
        for (Throwable t : errors) {
            if (isFatal(t)) {
                return true;
            }
        }
        return false;
    }

    public static boolean has(Throwable t, SourceException.Reason reason) {
        return walk(t, Collections.newSetFromMap(new IdentityHashMap<>()), reason, null);
    }

    private static boolean chainContains(Throwable t, Class<? extends Throwable> type) {
        return walk(t, Collections.newSetFromMap(new IdentityHashMap<>()), null, type);
    }

    private static boolean walk(Throwable t, Set<Throwable> visited, SourceException.Reason reason, Class<? extends Throwable> type) {
        if (t == null || !visited.add(t)) {
            return false;
        }
        if (reason != null && t instanceof SourceException se && se.reason() == reason) {
            return true;
        }
        if (type != null && type.isInstance(t)) {
            return true;
        }
        if (walk(t.getCause(), visited, reason, type)) {
            return true;
        }
        for (Throwable s : t.getSuppressed()) {
            if (walk(s, visited, reason, type)) {
                return true;
            }
        }
        return false;
    }
}
