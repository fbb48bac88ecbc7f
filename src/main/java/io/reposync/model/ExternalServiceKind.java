package io.reposync.model;

public enum ExternalServiceKind {
    GITHUB("github", false),
    GITLAB("gitlab", false),
    BITBUCKET_CLOUD("bitbucketCloud", false),
    NPM_PACKAGES("npmPackages", true),
    JVM_PACKAGES("jvmPackages", true),
    GO_MODULES("goModules", true),
    PYTHON_PACKAGES("pythonPackages", true),
    RUST_PACKAGES("rustPackages", true),
    OTHER("other", false);

    private final String serviceType;
    private final boolean packageHost;

    ExternalServiceKind(String serviceType, boolean packageHost) {
        this.serviceType = serviceType;
        this.packageHost = packageHost;
    }

    public String serviceType() {
        return serviceType;
    }

    public boolean packageHost() {
        return packageHost;
    }

    public static ExternalServiceKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("External service kind must not be blank");
        }
        String normalized = raw.trim().replace("-", "_");
        for (ExternalServiceKind value : values()) {
            if (value.name().equalsIgnoreCase(normalized) || value.serviceType.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown external service kind: " + raw);
    }
}
