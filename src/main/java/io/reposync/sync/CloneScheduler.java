package io.reposync.sync;

import io.reposync.model.Diff;

/**
 * Downstream consumer that keeps repository clones in line with the inventory.
 */
@FunctionalInterface
public interface CloneScheduler {
    CloneScheduler NOOP = diff -> {
    };

    void updateFromDiff(Diff diff);
}
