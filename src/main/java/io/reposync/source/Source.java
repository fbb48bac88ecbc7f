package io.reposync.source;

import io.reposync.util.SyncContext;

/**
 * Lists the repositories one external service can see.
 */
public interface Source {

    /**
     * Pushes every repo (or error) the service reports into {@code results}, returning once the
     * listing is exhausted, the context is cancelled, or {@link Results#send} returns false.
     */
    void listRepos(SyncContext ctx, Results results);

    @FunctionalInterface
    interface Results {
        /**
         * @return false when the consumer is gone and the producer should stop
         */
        boolean send(SourceResult result);
    }
}
