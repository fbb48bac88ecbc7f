package io.reposync.sync;

import io.reposync.model.ExternalServiceKind;

/**
 * A host prefix of repo names, such as {@code github.com/} or {@code npm/}.
 */
public record CodeHost(String prefix, ExternalServiceKind kind) {
    public boolean packageHost() {
        return kind.packageHost();
    }

    public boolean owns(String repoName) {
        return repoName != null && repoName.length() > prefix.length() && repoName.startsWith(prefix);
    }

    /**
     * The repo name with the host prefix removed.
     */
    public String pathOf(String repoName) {
        return repoName.substring(prefix.length());
    }
}
