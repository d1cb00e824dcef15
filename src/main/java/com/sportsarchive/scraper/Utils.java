package com.sportsarchive.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Utility class for common helper methods used in scraping and file operations.
 *
 * @author Sports Archive Scraper Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);
    private static final Random RANDOM = new Random();

    /**
     * Normalizes a label for use as a path segment by replacing whitespace, colons, slashes, backslashes and
     * dollar signs with an underscore each.
     * @param name Input label (tournament, season or country name)
     * @return Normalized path segment
     */
    public static String normalizeFilepath(String name) {
        return name == null ? "" : name.replaceAll("[\\s:/$\\\\]", "_");
    }

    /**
     * Extracts the season id from a season URL: the path segment before the last slash,
     * e.g. {@code 123} for {@code https://host/soccer/competition/league-2022-2023/123/}.
     * @param seasonUrl Season page URL
     * @return Season id, or an empty string if the URL has no such segment
     */
    public static String seasonIdFromUrl(String seasonUrl) {
        if (seasonUrl == null) return "";
        String[] parts = seasonUrl.split("/", -1);
        return parts.length >= 2 ? parts[parts.length - 2] : "";
    }

    /**
     * Resolves a link found on the page against the site base URL.
     * Protocol-relative links get {@code https:}, root-relative links get the base URL prepended.
     */
    public static String absoluteUrl(String baseUrl, String href) {
        if (href == null || href.isBlank()) return href;
        String trimmed = href.trim();
        if (trimmed.startsWith("//")) return "https:" + trimmed;
        if (trimmed.startsWith("http")) return trimmed;
        String base = baseUrl == null ? "" : baseUrl;
        if (base.endsWith("/") && trimmed.startsWith("/")) return base + trimmed.substring(1);
        if (!base.endsWith("/") && !trimmed.startsWith("/")) return base + "/" + trimmed;
        return base + trimmed;
    }

    /**
     * Waits a fixed delay plus a random jitter to throttle the request rate.
     * @param sleeper Sleeper performing the wait
     * @param baseMs Fixed part of the delay
     * @param jitterMs Upper bound of the random part
     */
    public static void politePause(Sleeper sleeper, long baseMs, long jitterMs) throws InterruptedException {
        long jitter = jitterMs > 0 ? (long) (RANDOM.nextDouble() * jitterMs) : 0L;
        long total = Math.max(0L, baseMs) + jitter;
        logger.debug("Pausing {}ms before next request.", total);
        sleeper.sleep(total);
    }
}
