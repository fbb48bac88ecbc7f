package io.reposync.source;

import io.reposync.model.ExternalService;
import io.reposync.model.ExternalServiceKind;
import io.reposync.model.Repo;
import io.reposync.util.SyncContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class ListingSourceTest {

    @Test
    void listingYieldsReposThenTrailingErrors() throws Exception {
        Path root = Files.createTempDirectory("reposync-test-listing-");
        try {
            Path listing = write(root.resolve("github.json"), """
                    {"repos": [
                      {"name": "github.com/acme/api", "id": "101", "description": "API", "stars": 4,
                       "cloneUrl": "https://github.com/acme/api.git", "metadata": {"topics": ["go"]}},
                      {"name": "github.com/acme/secret", "id": "102", "private": true, "fork": true},
                      {"name": ""}
                    ],
                     "errors": ["rate_limited", "nonsense"]}
                    """);
            ExternalService svc = service(7L);
            ListingSource source = new ListingSource(svc, listing, "https://github.com");

            List<SourceResult> results = new ArrayList<>();
            source.listRepos(SyncContext.background(), results::add);

            Assertions.assertEquals(4, results.size());
            Repo api = results.get(0).repo();
            Assertions.assertEquals("github.com/acme/api", api.name());
            Assertions.assertEquals("101", api.externalRepo().id());
            Assertions.assertEquals("github", api.externalRepo().serviceType());
            Assertions.assertEquals("https://github.com", api.externalRepo().serviceId());
            Assertions.assertEquals("https://github.com/acme/api.git", api.sources().get(7L));
            Assertions.assertEquals(4, api.stars());
            Assertions.assertTrue(api.metadata().contains("topics"));
            Repo secret = results.get(1).repo();
            Assertions.assertTrue(secret.privateRepo());
            Assertions.assertTrue(secret.fork());
            Assertions.assertEquals("https://github.com/acme/secret", secret.sources().get(7L));

            Assertions.assertEquals(SourceException.Reason.RATE_LIMITED, reason(results.get(2)));
            Assertions.assertEquals(SourceException.Reason.UNAVAILABLE, reason(results.get(3)));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void consumerRefusalStopsTheListing() throws Exception {
        Path root = Files.createTempDirectory("reposync-test-listing-stop-");
        try {
            Path listing = write(root.resolve("l.json"),
                    "{\"repos\": [{\"name\": \"a/one\"}, {\"name\": \"a/two\"}, {\"name\": \"a/three\"}]}");
            List<SourceResult> results = new ArrayList<>();
            new ListingSource(service(1L), listing, "").listRepos(SyncContext.background(), r -> {
                results.add(r);
                return false;
            });
            Assertions.assertEquals(1, results.size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingListingIsUnavailable() throws Exception {
        Path root = Files.createTempDirectory("reposync-test-listing-missing-");
        try {
            ListingSource source = new ListingSource(service(1L), root.resolve("absent.json"), "");
            SourceException e = Assertions.assertThrows(SourceException.class,
                    () -> source.listRepos(SyncContext.background(), r -> true));
            Assertions.assertEquals(SourceException.Reason.UNAVAILABLE, e.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void singleRepoLookupMatchesFullNameOrPathSuffix() throws Exception {
        Path root = Files.createTempDirectory("reposync-test-listing-get-");
        try {
            Path listing = write(root.resolve("l.json"), "{\"repos\": [{\"name\": \"github.com/acme/api\", \"id\": \"9\"}]}");
            ListingSource source = new ListingSource(service(1L), listing, "");

            Assertions.assertEquals("9", source.getRepo(SyncContext.background(), "acme/api").externalRepo().id());
            Assertions.assertEquals("9", source.getRepo(SyncContext.background(), "github.com/acme/api").externalRepo().id());
            SourceException missing = Assertions.assertThrows(SourceException.class,
                    () -> source.getRepo(SyncContext.background(), "cme/api"));
            Assertions.assertEquals(SourceException.Reason.NOT_FOUND, missing.reason());

            write(listing, "{\"repos\": [{\"name\": \"github.com/acme/api\"}], \"errors\": [\"FORBIDDEN\"]}");
            SourceException forbidden = Assertions.assertThrows(SourceException.class,
                    () -> source.getRepo(SyncContext.background(), "acme/api"));
            Assertions.assertEquals(SourceException.Reason.FORBIDDEN, forbidden.reason());

            write(listing, "{\"repos\": [{\"name\": \"github.com/acme/api\"}], \"errors\": [\"RATE_LIMITED\"]}");
            Assertions.assertEquals("github.com/acme/api", source.getRepo(SyncContext.background(), "acme/api").name());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sourcerResolvesRelativeListingsAgainstItsBase() throws Exception {
        Path root = Files.createTempDirectory("reposync-test-sourcer-");
        try {
            write(root.resolve("listings/gh.json"), "{\"repos\": [{\"name\": \"github.com/acme/api\"}]}");
            ListingSourcer sourcer = new ListingSourcer(root);
            ExternalService svc = ExternalService.site(ExternalServiceKind.GITHUB, "GitHub",
                    "{\"listingFile\": \"listings/gh.json\"}").withId(3L);

            List<SourceResult> results = new ArrayList<>();
            sourcer.forService(svc).listRepos(SyncContext.background(), results::add);
            Assertions.assertEquals(1, results.size());

            ExternalService bare = ExternalService.site(ExternalServiceKind.GITHUB, "GitHub", "{}").withId(4L);
            Assertions.assertThrows(IllegalArgumentException.class, () -> sourcer.forService(bare));
        } finally {
            deleteRecursively(root);
        }
    }

    private static ExternalService service(long id) {
        return ExternalService.site(ExternalServiceKind.GITHUB, "GitHub", "{}").withId(id);
    }

    private static SourceException.Reason reason(SourceResult result) {
        Assertions.assertTrue(result.failed());
        return ((SourceException) result.error()).reason();
    }

    private static Path write(Path file, String body) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, body, StandardCharsets.UTF_8);
        return file;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
