package io.reposync.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.reposync.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class RepoSyncCommandTest {

    @Test
    void serviceAddSyncAndListRoundTrip() throws Exception {
        Path root = Files.createTempDirectory("reposync-test-cli-");
        try {
            Files.writeString(root.resolve("gh.json"),
                    "{\"repos\": [{\"name\": \"github.com/acme/api\", \"id\": \"1\"}]}", StandardCharsets.UTF_8);

            Result added = run(root, "service-add", "--kind", "github", "--name", "GitHub",
                    "--config", "{\"listingFile\": \"gh.json\", \"token\": \"t0ken\"}");
            Assertions.assertEquals(0, added.code());
            JsonNode view = Jsons.readTree(added.out());
            Assertions.assertEquals("github", view.path("kind").asText());
            Assertions.assertFalse(added.out().contains("t0ken"));
            long id = view.path("id").asLong();

            Result pass = run(root, "sync-service", String.valueOf(id));
            Assertions.assertEquals(0, pass.code());
            Assertions.assertEquals(1, Jsons.readTree(pass.out()).path("added").asInt());

            Result repos = run(root, "repos");
            JsonNode list = Jsons.readTree(repos.out());
            Assertions.assertEquals(1, list.size());
            Assertions.assertEquals("github.com/acme/api", list.get(0).path("name").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownRepoExitsWithNotFound() throws Exception {
        Path root = Files.createTempDirectory("reposync-test-cli-missing-");
        try {
            Result out = run(root, "sync-repo", "example.org/acme/api");
            Assertions.assertEquals(2, out.code());
            Assertions.assertEquals("not_found", Jsons.readTree(out.out()).path("error").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedServiceConfigIsRejected() throws Exception {
        Path root = Files.createTempDirectory("reposync-test-cli-badconfig-");
        try {
            Result out = run(root, "service-add", "--kind", "github", "--config", "{oops");
            Assertions.assertNotEquals(0, out.code());
            Assertions.assertEquals("[]", Jsons.readTree(run(root, "services").out()).toString());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result run(Path root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            CommandLine cli = new CommandLine(new RepoSyncCommand());
            cli.setErr(new PrintWriter(new ByteArrayOutputStream(), true));
            int code = cli.execute(full);
            return new Result(code, buffer.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(original);
        }
    }

    private record Result(int code, String out) {
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
