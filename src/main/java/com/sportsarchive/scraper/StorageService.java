package com.sportsarchive.scraper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * File-system storage for crawl artifacts using Jackson.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Artifacts ({@code seasons_list.json}, {@code matches_*.json}, {@code composed.json}, ...) are written whole
 *   with two-space indentation.</li>
 *   <li>Issue logs are appended one JSON document at a time, each followed by a blank line.</li>
 *   <li>Parent directories are created on demand so callers never have to pre-create them.</li>
 * </ul>
 *
 * @author Sports Archive Scraper Team
 * @since 1.0
 */
public class StorageService implements StorageServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(StorageService.class);

    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    public StorageService() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public StorageService(ObjectMapper mapper) {
        this.mapper = mapper;
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter("  ", "\n"))
            .withArrayIndenter(new DefaultIndenter("  ", "\n"));
        this.writer = mapper.writer(printer);
    }

    @Override
    public void writeJson(Path path, Object value) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("Path cannot be null");
        }
        ensureParent(path);
        Files.writeString(path, writer.writeValueAsString(value), StandardCharsets.UTF_8);
        logger.debug("Wrote JSON file: {}", path);
    }

    @Override
    public void appendJson(Path path, Object value) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("Path cannot be null");
        }
        ensureParent(path);
        Files.writeString(path, writer.writeValueAsString(value) + "\n\n", StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    @Override
    public void appendText(Path path, String line) throws IOException {
        ensureParent(path);
        Files.writeString(path, (line == null ? "" : line) + "\n", StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    @Override
    public void mkdirAll(Path dir) throws IOException {
        Files.createDirectories(dir);
    }

    @Override
    public <T> Optional<T> readJson(Path path, TypeReference<T> type) throws IOException {
        if (path == null || !Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.ofNullable(mapper.readValue(path.toFile(), type));
    }

    @Override
    public boolean exists(Path path) {
        return path != null && Files.exists(path);
    }

    private static void ensureParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
    }
}
