package io.reposync.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.reposync.security.SensitiveDataMasker;
import io.reposync.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only JSON-lines log of sync activity. One line per event, details masked.
 */
public final class SyncEventLog {
    private final Path eventFile;
    private final Clock clock;

    public SyncEventLog(Path eventFile, Clock clock) {
        this.eventFile = eventFile;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        if (eventFile == null) {
            return;
        }
        try {
            Files.createDirectories(eventFile.toAbsolutePath().getParent());
            if (!Files.exists(eventFile)) {
                try {
                    Files.createFile(eventFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize sync event log: " + eventFile, e);
        }
    }

    /**
     * A log that drops every event.
     */
    public static SyncEventLog noop() {
        return new SyncEventLog(null, Clock.systemUTC());
    }

    public Path eventFile() {
        return eventFile;
    }

    public synchronized void log(SyncEvent event) {
        if (eventFile == null) {
            return;
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.ofEpochMilli(clock.millis()).toString());
        row.put("action", event.action());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(eventFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write sync event log", e);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    public record SyncEvent(String action, String resource, String result, Map<String, Object> details) {
        public static SyncEvent of(String action, String resource, String result, Map<String, Object> details) {
            return new SyncEvent(action, resource, result, details == null ? Map.of() : details);
        }
    }
}
