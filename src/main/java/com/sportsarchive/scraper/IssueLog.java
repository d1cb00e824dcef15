package com.sportsarchive.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only issue log bound to a single {@code *_issues.log} file.
 * <p>
 * Every recorded {@link Issue} is appended to the file and kept in memory so callers can report what was collected
 * during a crawl. Storage failures are logged and never interrupt the crawl.
 */
public class IssueLog {
    private static final Logger logger = LoggerFactory.getLogger(IssueLog.class);

    private final StorageServiceInterface storage;
    private final Path file;
    private final List<Issue> issues = new ArrayList<>();

    public IssueLog(StorageServiceInterface storage, Path file) {
        this.storage = storage;
        this.file = file;
    }

    public Issue warning(String seasonUrl, String message) {
        return record(Issue.of(seasonUrl, IssueType.WARNING, message));
    }

    public Issue error(String seasonUrl, String message) {
        return record(Issue.of(seasonUrl, IssueType.ERROR, message));
    }

    public Issue record(Issue issue) {
        issues.add(issue);
        try {
            storage.appendJson(file, issue);
        } catch (IOException e) {
            logger.error("Failed to append issue to {}: {}", file, e.getMessage());
        }
        return issue;
    }

    public List<Issue> issues() {
        return Collections.unmodifiableList(issues);
    }

    public Path file() {
        return file;
    }
}
