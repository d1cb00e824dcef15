package com.sportsarchive.scraper;

import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Loads the pre-scraped competition catalog: {@code <continent>_competitions.json} files listing each country's
 * tournaments.
 */
public class CompetitionCatalog {
    private static final Logger logger = LoggerFactory.getLogger(CompetitionCatalog.class);
    private static final TypeReference<List<Competition>> COMPETITIONS = new TypeReference<>() {};

    private final StorageServiceInterface storage;
    private final Path catalogDir;

    public CompetitionCatalog(StorageServiceInterface storage, Path catalogDir) {
        this.storage = storage;
        this.catalogDir = catalogDir;
    }

    /**
     * @param continent Continent whose file is read, or null to read every file of the catalog directory
     * @param splitCountry When set, the list is cut after this country (inclusive)
     * @return Competitions in reverse catalog order
     */
    public List<Competition> getCompetitionUrls(String continent, String splitCountry) {
        List<Competition> results = new ArrayList<>();
        for (Path file : catalogFiles(continent)) {
            results.addAll(read(file));
        }

        if (splitCountry != null && !splitCountry.isBlank()) {
            int index = -1;
            for (int i = 0; i < results.size(); i++) {
                if (splitCountry.equals(results.get(i).country())) {
                    index = i;
                    break;
                }
            }
            if (index == -1) {
                logger.warn("Split country {} was not found", splitCountry);
            } else {
                logger.info("Data split with {} as the end country", splitCountry);
                results = new ArrayList<>(results.subList(0, index + 1));
            }
        }

        Collections.reverse(results);
        return results;
    }

    private List<Path> catalogFiles(String continent) {
        if (continent != null && !continent.isBlank()) {
            return List.of(catalogDir.resolve(continent.toLowerCase(Locale.ROOT) + "_competitions.json"));
        }
        if (!Files.isDirectory(catalogDir)) {
            logger.warn("Competition catalog directory {} does not exist.", catalogDir);
            return List.of();
        }
        try (Stream<Path> files = Files.list(catalogDir)) {
            return files.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            logger.warn("Failed to list competition catalog {}: {}", catalogDir, e.getMessage());
            return List.of();
        }
    }

    private List<Competition> read(Path file) {
        try {
            return storage.readJson(file, COMPETITIONS).orElseGet(() -> {
                logger.warn("Failed to retrieve competition URLs. The file named {} does not exist.", file);
                return List.of();
            });
        } catch (IOException e) {
            logger.warn("Error occurred when retrieving competition URLs from {}: {}", file, e.getMessage());
            return List.of();
        }
    }
}
