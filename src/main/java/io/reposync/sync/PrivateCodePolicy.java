package io.reposync.sync;

import io.reposync.config.SyncSettings;

import java.util.function.Supplier;

/**
 * Decides whether a user's own services may bring private repos into the inventory.
 */
@FunctionalInterface
public interface PrivateCodePolicy {
    boolean allowsPrivateCode(long userId);

    static PrivateCodePolicy fromSettings(Supplier<SyncSettings> settings) {
        return userId -> {
            SyncSettings s = settings.get();
            return s.allowUserPrivateCode() || s.privateCodeUserIds().contains(userId);
        };
    }
}
