package io.reposync;

import io.reposync.cli.RepoSyncCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new RepoSyncCommand()).execute(args);
        System.exit(code);
    }
}
