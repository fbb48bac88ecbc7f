package io.reposync.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A repository as stored in the inventory, or as observed from a source (then {@code id == 0}).
 *
 * <p>{@code sources} maps external service id to the clone URL that service reported.
 */
public record Repo(
        long id,
        String name,
        String uri,
        String description,
        boolean fork,
        boolean archived,
        boolean privateRepo,
        int stars,
        ExternalRepoSpec externalRepo,
        String metadata,
        Map<Long, String> sources,
        long createdAtMs,
        long updatedAtMs,
        long deletedAtMs
) {
    public Repo {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Repo name must not be blank");
        }
        uri = uri == null ? "" : uri;
        description = description == null ? "" : description;
        externalRepo = externalRepo == null ? new ExternalRepoSpec("", "", "") : externalRepo;
        metadata = metadata == null || metadata.isBlank() ? "{}" : metadata;
        sources = sources == null ? Map.of() : Map.copyOf(sources);
    }

    /**
     * A sourced repo with the minimal identity fields set; the rest take defaults.
     */
    public static Repo sourced(String name, ExternalRepoSpec spec, boolean privateRepo) {
        return new Repo(0L, name, name, "", false, false, privateRepo, 0, spec, "{}", Map.of(), 0L, 0L, 0L);
    }

    public boolean isDeleted() {
        return deletedAtMs > 0L;
    }

    public Repo withId(long newId) {
        return new Repo(newId, name, uri, description, fork, archived, privateRepo, stars, externalRepo, metadata,
                sources, createdAtMs, updatedAtMs, deletedAtMs);
    }

    public Repo withDescription(String newDescription) {
        return new Repo(id, name, uri, newDescription, fork, archived, privateRepo, stars, externalRepo, metadata,
                sources, createdAtMs, updatedAtMs, deletedAtMs);
    }

    public Repo withPrivate(boolean newPrivate) {
        return new Repo(id, name, uri, description, fork, archived, newPrivate, stars, externalRepo, metadata,
                sources, createdAtMs, updatedAtMs, deletedAtMs);
    }

    public Repo withSource(long externalServiceId, String cloneUrl) {
        Map<Long, String> merged = new LinkedHashMap<>(sources);
        merged.put(externalServiceId, cloneUrl == null ? "" : cloneUrl);
        return new Repo(id, name, uri, description, fork, archived, privateRepo, stars, externalRepo, metadata,
                merged, createdAtMs, updatedAtMs, deletedAtMs);
    }

    /**
     * Merges a freshly sourced copy of this repo into the stored row.
     *
     * @return the merged row when any tracked field differs, empty when the stored row is current
     */
    public Optional<Repo> updatedWith(Repo n) {
        boolean modified = false;
        String newName = name;
        if (!n.name.isBlank() && !n.name.equals(name)) {
            newName = n.name;
            modified = true;
        }
        String newUri = uri;
        if (!n.uri.equals(uri)) {
            newUri = n.uri;
            modified = true;
        }
        String newDescription = description;
        if (!n.description.equals(description)) {
            newDescription = n.description;
            modified = true;
        }
        if (n.fork != fork || n.archived != archived || n.privateRepo != privateRepo || n.stars != stars) {
            modified = true;
        }
        ExternalRepoSpec newSpec = externalRepo;
        if (!n.externalRepo.isEmpty() && !n.externalRepo.equals(externalRepo)) {
            newSpec = n.externalRepo;
            modified = true;
        }
        String newMetadata = metadata;
        if (!Objects.equals(n.metadata, metadata)) {
            newMetadata = n.metadata;
            modified = true;
        }
        Map<Long, String> newSources = new LinkedHashMap<>(sources);
        for (Map.Entry<Long, String> e : n.sources.entrySet()) {
            String previous = newSources.put(e.getKey(), e.getValue());
            if (!e.getValue().equals(previous)) {
                modified = true;
            }
        }
        if (isDeleted()) {
            modified = true;
        }
        if (!modified) {
            return Optional.empty();
        }
        return Optional.of(new Repo(
                id,
                newName,
                newUri,
                newDescription,
                n.fork,
                n.archived,
                n.privateRepo,
                n.stars,
                newSpec,
                newMetadata,
                newSources,
                createdAtMs,
                updatedAtMs,
                0L
        ));
    }
}
