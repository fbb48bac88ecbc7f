package io.reposync.source;

import com.fasterxml.jackson.databind.JsonNode;
import io.reposync.model.ExternalService;
import io.reposync.util.Jsons;

import java.nio.file.Path;

/**
 * Builds {@link ListingSource}s from service config of the form
 * {@code {"listingFile": "listing.json", "url": "https://github.com"}}.
 *
 * <p>A relative {@code listingFile} resolves against the base directory.
 */
public final class ListingSourcer implements Sourcer {
    private final Path baseDir;

    public ListingSourcer(Path baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public Source forService(ExternalService service) {
        JsonNode config = Jsons.readTree(service.config());
        String listing = config.path("listingFile").asText("");
        if (listing.isBlank()) {
            throw new IllegalArgumentException("External service " + service.id() + " has no listingFile in its config");
        }
        Path path = Path.of(listing);
        if (!path.isAbsolute()) {
            path = baseDir.resolve(path);
        }
        return new ListingSource(service, path.normalize(), config.path("url").asText(""));
    }
}
