package com.sportsarchive.scraper;

import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Interface for the crawler's persistent storage: JSON artifacts, append-only issue logs and metadata files
 * in a hierarchical output directory.
 */
public interface StorageServiceInterface {
    /**
     * Writes a value as pretty-printed JSON, replacing any existing file.
     * @param path Target file; parent directories are created as needed
     * @param value Value to serialize
     * @throws IOException if the file cannot be written
     */
    void writeJson(Path path, Object value) throws IOException;

    /**
     * Appends a value as pretty-printed JSON followed by a blank line. Used for issue logs.
     * @param path Target log file
     * @param value Value to serialize
     * @throws IOException if the file cannot be written
     */
    void appendJson(Path path, Object value) throws IOException;

    /**
     * Appends a raw line of text.
     * @param path Target file
     * @param line Line content without trailing newline
     * @throws IOException if the file cannot be written
     */
    void appendText(Path path, String line) throws IOException;

    /**
     * Creates a directory and all missing parents.
     * @param dir Directory to create
     * @throws IOException if the directory cannot be created
     */
    void mkdirAll(Path dir) throws IOException;

    /**
     * Reads a JSON file.
     * @param path File to read
     * @param type Target type
     * @return The value, or empty if the file does not exist
     * @throws IOException if the file exists but cannot be read or parsed
     */
    <T> Optional<T> readJson(Path path, TypeReference<T> type) throws IOException;

    /**
     * @param path File or directory to check
     * @return true if it exists
     */
    boolean exists(Path path);
}
