package io.reposync.cli;

import io.reposync.config.RepoSyncConfig;
import io.reposync.model.ExternalServiceKind;
import io.reposync.model.Repo;
import io.reposync.runtime.RepoSyncRuntime;
import io.reposync.sync.RepoNotFoundException;
import io.reposync.util.Jsons;
import io.reposync.util.SyncContext;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "reposync",
        mixinStandardHelpOptions = true,
        description = "External repository sync CLI",
        subcommands = {
                RepoSyncCommand.InitCommand.class,
                RepoSyncCommand.ServiceAddCommand.class,
                RepoSyncCommand.ServicesCommand.class,
                RepoSyncCommand.TriggerCommand.class,
                RepoSyncCommand.SyncServiceCommand.class,
                RepoSyncCommand.SyncRepoCommand.class,
                RepoSyncCommand.ReposCommand.class,
                RepoSyncCommand.JobsCommand.class,
                RepoSyncCommand.SyncErrorsCommand.class,
                RepoSyncCommand.RunCommand.class,
                RepoSyncCommand.MetricsCommand.class,
                RepoSyncCommand.ReloadSettingsCommand.class
        }
)
public final class RepoSyncCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = RepoSyncConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | service-add | services | trigger | sync-service | sync-repo | repos | jobs | sync-errors | run | metrics | reload-settings");
    }

    RepoSyncRuntime runtime() {
        RepoSyncRuntime runtime = new RepoSyncRuntime(RepoSyncConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        RepoSyncCommand parent;

        @Override
        public Integer call() {
            try (RepoSyncRuntime runtime = parent.runtime()) {
                System.out.println("Initialized reposync at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "service-add", description = "Register an external service")
    static final class ServiceAddCommand implements Callable<Integer> {
        @ParentCommand
        RepoSyncCommand parent;

        @Option(names = {"--kind"}, required = true, description = "Service kind, e.g. github|gitlab|npmPackages")
        String kind;

        @Option(names = {"--name"}, description = "Display name")
        String name;

        @Option(names = {"--config"}, description = "Service config JSON")
        String config;

        @Option(names = {"--config-file"}, description = "Read service config JSON from a file")
        Path configFile;

        @Option(names = {"--user"}, defaultValue = "0", description = "Owning user id")
        long userId;

        @Option(names = {"--org"}, defaultValue = "0", description = "Owning org id")
        long orgId;

        @Option(names = {"--cloud-default"}, defaultValue = "false", description = "Mark as the cloud default for its kind")
        boolean cloudDefault;

        @Override
        public Integer call() throws Exception {
            String raw = config;
            if (configFile != null) {
                raw = Files.readString(configFile, StandardCharsets.UTF_8);
            }
            // Reject malformed JSON before it is stored.
            Jsons.readTree(raw);
            try (RepoSyncRuntime runtime = parent.runtime()) {
                RepoSyncRuntime.ServiceView view = runtime.addExternalService(
                        ExternalServiceKind.fromString(kind), name, raw, userId, orgId, cloudDefault);
                System.out.println(Jsons.toJson(view));
            }
            return 0;
        }
    }

    @Command(name = "services", description = "List external services with masked config")
    static final class ServicesCommand implements Callable<Integer> {
        @ParentCommand
        RepoSyncCommand parent;

        @Override
        public Integer call() {
            try (RepoSyncRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.listExternalServices()));
            }
            return 0;
        }
    }

    @Command(name = "trigger", description = "Queue a sync job for an external service now")
    static final class TriggerCommand implements Callable<Integer> {
        @ParentCommand
        RepoSyncCommand parent;

        @Parameters(index = "0", description = "External service id")
        long serviceId;

        @Override
        public Integer call() {
            try (RepoSyncRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.triggerSync(serviceId)));
            }
            return 0;
        }
    }

    @Command(name = "sync-service", description = "Run one sync pass over an external service without queueing")
    static final class SyncServiceCommand implements Callable<Integer> {
        @ParentCommand
        RepoSyncCommand parent;

        @Parameters(index = "0", description = "External service id")
        long serviceId;

        @Override
        public Integer call() {
            try (RepoSyncRuntime runtime = parent.runtime()) {
                RepoSyncRuntime.SyncReport report = runtime.syncServiceNow(serviceId);
                System.out.println(Jsons.toJson(report));
                return report.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "sync-repo", description = "Look up a repo by name, fetching it from its code host when needed")
    static final class SyncRepoCommand implements Callable<Integer> {
        @ParentCommand
        RepoSyncCommand parent;

        @Parameters(index = "0", description = "Repo name, e.g. github.com/owner/name")
        String name;

        @Option(names = {"--background"}, defaultValue = "false",
                description = "Return the stored copy and refresh it asynchronously")
        boolean background;

        @Override
        public Integer call() {
            try (RepoSyncRuntime runtime = parent.runtime()) {
                Repo repo = runtime.syncRepo(name, background);
                System.out.println(Jsons.toJson(repo));
                return 0;
            } catch (RepoNotFoundException e) {
                System.out.println(Jsons.toJson(Map.of("error", "not_found", "name", e.name())));
                return 2;
            }
        }
    }

    @Command(name = "repos", description = "List stored repos")
    static final class ReposCommand implements Callable<Integer> {
        @ParentCommand
        RepoSyncCommand parent;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max rows, 0 for all")
        int limit;

        @Override
        public Integer call() {
            try (RepoSyncRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.listRepos(limit)));
            }
            return 0;
        }
    }

    @Command(name = "jobs", description = "List sync jobs, newest first")
    static final class JobsCommand implements Callable<Integer> {
        @ParentCommand
        RepoSyncCommand parent;

        @Option(names = {"--service"}, defaultValue = "0", description = "Only jobs of this external service")
        long serviceId;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            try (RepoSyncRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.listJobs(serviceId, limit)));
            }
            return 0;
        }
    }

    @Command(name = "sync-errors", description = "Show the latest sync error of each service in a namespace")
    static final class SyncErrorsCommand implements Callable<Integer> {
        @ParentCommand
        RepoSyncCommand parent;

        @Option(names = {"--user"}, defaultValue = "0", description = "Namespace user id")
        long userId;

        @Option(names = {"--org"}, defaultValue = "0", description = "Namespace org id")
        long orgId;

        @Override
        public Integer call() {
            try (RepoSyncRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.syncErrors(userId, orgId)));
            }
            return 0;
        }
    }

    @Command(name = "run", description = "Run the sync loops, or a single round with --once")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        RepoSyncCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run one round of every loop and exit")
        boolean once;

        @Override
        public Integer call() throws Exception {
            RepoSyncRuntime runtime = parent.runtime();
            if (once) {
                try {
                    System.out.println(Jsons.toJson(runtime.runOnce()));
                } finally {
                    runtime.close();
                }
                return 0;
            }
            SyncContext ctx = SyncContext.background();
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                ctx.cancel();
                runtime.close();
                stopped.countDown();
            }, "reposync-shutdown-hook"));
            runtime.start(ctx);
            System.out.println("reposync running at: " + runtime.config().rootDir());
            stopped.await();
            return 0;
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics text")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        RepoSyncCommand parent;

        @Override
        public Integer call() {
            try (RepoSyncRuntime runtime = parent.runtime()) {
                System.out.print(runtime.metricsText());
            }
            return 0;
        }
    }

    @Command(name = "reload-settings", description = "Force reload reposync-settings.json and print effective values")
    static final class ReloadSettingsCommand implements Callable<Integer> {
        @ParentCommand
        RepoSyncCommand parent;

        @Override
        public Integer call() {
            try (RepoSyncRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.reloadSettings()));
            }
            return 0;
        }
    }
}
