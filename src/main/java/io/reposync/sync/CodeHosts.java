package io.reposync.sync;

import io.reposync.model.ExternalServiceKind;

import java.util.List;
import java.util.Optional;

public final class CodeHosts {
    public static final List<CodeHost> ALL = List.of(
            new CodeHost("github.com/", ExternalServiceKind.GITHUB),
            new CodeHost("gitlab.com/", ExternalServiceKind.GITLAB),
            new CodeHost("bitbucket.org/", ExternalServiceKind.BITBUCKET_CLOUD),
            new CodeHost("npm/", ExternalServiceKind.NPM_PACKAGES),
            new CodeHost("maven/", ExternalServiceKind.JVM_PACKAGES),
            new CodeHost("go/", ExternalServiceKind.GO_MODULES),
            new CodeHost("python/", ExternalServiceKind.PYTHON_PACKAGES),
            new CodeHost("crates/", ExternalServiceKind.RUST_PACKAGES)
    );

    private CodeHosts() {
    }

    public static Optional<CodeHost> of(String repoName) {
        for (CodeHost host : ALL) {
            if (host.owns(repoName)) {
                return Optional.of(host);
            }
        }
        return Optional.empty();
    }
}
