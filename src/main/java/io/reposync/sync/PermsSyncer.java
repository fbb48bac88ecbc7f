package io.reposync.sync;

import java.util.List;

/**
 * Downstream consumer that recomputes permissions of private repos.
 */
@FunctionalInterface
public interface PermsSyncer {
    PermsSyncer NOOP = repoIds -> {
    };

    void scheduleRepos(List<Long> repoIds);
}
