package io.reposync.sync;

public final class RepoNotFoundException extends RuntimeException {
    private final String name;

    public RepoNotFoundException(String name) {
        super("repo not found: " + name);
        this.name = name;
    }

    public RepoNotFoundException(String name, Throwable cause) {
        super("repo not found: " + name, cause);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
