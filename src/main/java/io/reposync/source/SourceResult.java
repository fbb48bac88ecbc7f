package io.reposync.source;

import io.reposync.model.Repo;

/**
 * One item of a source listing: either a repo or the error that replaced it.
 */
public record SourceResult(Repo repo, RuntimeException error) {
    public SourceResult {
        if ((repo == null) == (error == null)) {
            throw new IllegalArgumentException("SourceResult carries exactly one of repo or error");
        }
    }

    public static SourceResult of(Repo repo) {
        return new SourceResult(repo, null);
    }

    public static SourceResult failed(RuntimeException error) {
        return new SourceResult(null, error);
    }

    public boolean failed() {
        return error != null;
    }
}
