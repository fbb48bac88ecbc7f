package io.reposync.source;

import io.reposync.model.Repo;
import io.reposync.util.SyncContext;

/**
 * Sources that can fetch a single repository by its path on the host.
 */
public interface RepoGetter {
    Repo getRepo(SyncContext ctx, String path);
}
