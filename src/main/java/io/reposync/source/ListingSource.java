package io.reposync.source;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.reposync.model.ExternalRepoSpec;
import io.reposync.model.ExternalService;
import io.reposync.model.Repo;
import io.reposync.util.Jsons;
import io.reposync.util.SyncContext;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Source backed by a JSON listing file, re-read on every call.
 *
 * <p>The file holds the repos the service would report plus optional trailing errors:
 * <pre>
 * {"repos": [{"name": "github.com/acme/api", "id": "101", "private": false, ...}],
 *  "errors": ["UNAUTHORIZED"]}
 * </pre>
 * A missing file reads as {@link SourceException.Reason#UNAVAILABLE}.
 */
public final class ListingSource implements Source, RepoGetter {
    private final ExternalService service;
    private final Path listingFile;
    private final String serviceId;

    public ListingSource(ExternalService service, Path listingFile, String serviceId) {
        this.service = service;
        this.listingFile = listingFile;
        this.serviceId = serviceId == null || serviceId.isBlank() ? listingFile.toString() : serviceId;
    }

    @Override
    public void listRepos(SyncContext ctx, Results results) {
        ListingFile file = read();
        for (ListingEntry entry : safe(file.repos())) {
            if (ctx.isCancelled()) {
                return;
            }
            if (entry == null || entry.name() == null || entry.name().isBlank()) {
                continue;
            }
            if (!results.send(SourceResult.of(toRepo(entry)))) {
                return;
            }
        }
        for (String raw : safe(file.errors())) {
            if (ctx.isCancelled()) {
                return;
            }
            if (!results.send(SourceResult.failed(toError(raw)))) {
                return;
            }
        }
    }

    @Override
    public Repo getRepo(SyncContext ctx, String path) {
        ctx.throwIfCancelled();
        ListingFile file = read();
        for (String raw : safe(file.errors())) {
            SourceException err = toError(raw);
            if (err.reason() != SourceException.Reason.RATE_LIMITED && err.reason() != SourceException.Reason.UNAVAILABLE) {
                throw err;
            }
        }
        for (ListingEntry entry : safe(file.repos())) {
            if (entry == null || entry.name() == null) {
                continue;
            }
            if (entry.name().equals(path) || entry.name().endsWith("/" + path)) {
                return toRepo(entry);
            }
        }
        throw SourceException.notFound(path);
    }

    private ListingFile read() {
        if (!Files.exists(listingFile)) {
            throw new SourceException(SourceException.Reason.UNAVAILABLE, "listing file missing: " + listingFile);
        }
        try {
            ListingFile file = Jsons.mapper().readValue(listingFile.toFile(), ListingFile.class);
            return file == null ? new ListingFile(List.of(), List.of()) : file;
        } catch (IOException e) {
            throw new SourceException(SourceException.Reason.UNAVAILABLE, "failed to read listing: " + listingFile, e);
        }
    }

    private Repo toRepo(ListingEntry entry) {
        String id = entry.id() == null || entry.id().isBlank() ? entry.name() : entry.id();
        ExternalRepoSpec spec = new ExternalRepoSpec(id, service.kind().serviceType(), serviceId);
        String cloneUrl = entry.cloneUrl() == null ? "https://" + entry.name() : entry.cloneUrl();
        return new Repo(
                0L,
                entry.name(),
                entry.uri() == null ? entry.name() : entry.uri(),
                entry.description(),
                Boolean.TRUE.equals(entry.fork()),
                Boolean.TRUE.equals(entry.archived()),
                Boolean.TRUE.equals(entry.privateRepo()),
                entry.stars() == null ? 0 : entry.stars(),
                spec,
                entry.metadata() == null ? "{}" : Jsons.toCompactJson(entry.metadata()),
                Map.of(service.id(), cloneUrl),
                0L,
                0L,
                0L
        );
    }

    private static SourceException toError(String raw) {
        String value = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        SourceException.Reason reason;
        try {
            reason = SourceException.Reason.valueOf(value);
        } catch (IllegalArgumentException e) {
            reason = SourceException.Reason.UNAVAILABLE;
        }
        return new SourceException(reason, "listing reported " + reason.name().toLowerCase(Locale.ROOT));
    }

    private static <T> List<T> safe(List<T> values) {
        return values == null ? List.of() : values;
    }

    record ListingFile(List<ListingEntry> repos, List<String> errors) {
    }

    record ListingEntry(
            String name,
            String id,
            String uri,
            String description,
            Boolean fork,
            Boolean archived,
            @JsonProperty("private") Boolean privateRepo,
            Integer stars,
            String cloneUrl,
            Map<String, Object> metadata
    ) {
    }
}
