package com.sportsarchive.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Drives one tournament end to end.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Discovers the tournament's seasons; nothing is scraped for a non-league or season-less tournament.</li>
 *   <li>Crawls each season. A season with its error flag raised is rescraped into {@code <season>/retries} with a
 *   fresh file id, up to {@code maxRescrapeCount} times.</li>
 *   <li>Clean seasons go to {@code composed.json}, fixed ones to {@code repaired.json}, the rest (with their first
 *   attempt's result) to {@code erroneous.json}. Empty buckets are not written.</li>
 * </ul>
 *
 * @author Sports Archive Scraper Team
 * @since 1.0
 */
public class TournamentComposer {
    private static final Logger logger = LoggerFactory.getLogger(TournamentComposer.class);

    private final SeasonDiscovery discovery;
    private final SeasonScraper seasonScraper;
    private final StorageServiceInterface storage;
    private final ScraperConfig config;
    private final Sleeper sleeper;
    private final LongSupplier clock;

    public TournamentComposer(SeasonDiscovery discovery, SeasonScraper seasonScraper,
                              StorageServiceInterface storage, ScraperConfig config, Sleeper sleeper,
                              LongSupplier clock) {
        this.discovery = discovery;
        this.seasonScraper = seasonScraper;
        this.storage = storage;
        this.config = config;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * @param tournament Tournament name
     * @param pageUrl Tournament landing page
     * @param countryDir Directory of the tournament's country
     * @return The bucketed seasons, also persisted under {@code <countryDir>/<tournament>}
     */
    public TournamentOutcome scrapeTournament(String tournament, String pageUrl, Path countryDir)
            throws InterruptedException {
        Path dataDir = countryDir.resolve(Utils.normalizeFilepath(tournament));
        logger.info("Scraping {}...", tournament);

        SeasonDiscoveryResult discovered;
        try {
            storage.mkdirAll(dataDir);
            discovered = discovery.discoverSeasons(pageUrl, dataDir, config.leaguesOnly());
        } catch (IOException e) {
            logger.error("Failed to create {}: {}", dataDir, e.getMessage());
            return TournamentOutcome.empty();
        } catch (ReconnectionTimeoutException e) {
            logger.error("Season discovery for {} aborted: {}", tournament, e.getMessage());
            return TournamentOutcome.empty();
        }
        if (discovered.status() != SeasonDiscoveryResult.Status.FOUND || discovered.isEmpty()) {
            logger.warn("No seasons to scrape for {} ({}).", tournament, discovered.status());
            return TournamentOutcome.empty();
        }
        logger.info("Season links scraping for {} completed.", tournament);

        List<SeasonResult> composed = new ArrayList<>();
        List<SeasonResult> repaired = new ArrayList<>();
        List<SeasonResult> erroneous = new ArrayList<>();
        List<SeasonLink> seasons = discovered.seasons();

        for (int i = 0; i < seasons.size(); i++) {
            SeasonLink link = seasons.get(i);
            Path seasonDir = dataDir.resolve(Utils.normalizeFilepath(link.season()));
            logger.info("Processing {} of {} seasons [{}]", i + 1, seasons.size(), link.season());

            ScrapeOutcome first;
            try {
                first = seasonScraper.scrapeSeason(link.url(), seasonDir, null);
            } catch (ReconnectionTimeoutException e) {
                logger.error("Season {} aborted: {}", link.season(), e.getMessage());
                erroneous.add(new SeasonResult(link.season(), List.of(), link.leagueStanding()));
                pauseBetweenSeasons(i, seasons.size());
                continue;
            }

            if (!first.hasErrorOccurred()) {
                composed.add(new SeasonResult(link.season(), first.result(), link.leagueStanding()));
            } else {
                logger.warn("Encountered error on season {}", link.season());
                Optional<ScrapeOutcome> fixed = rescrape(link, seasonDir);
                if (fixed.isPresent()) {
                    repaired.add(new SeasonResult(link.season(), fixed.get().result(), link.leagueStanding()));
                } else {
                    erroneous.add(new SeasonResult(link.season(), first.result(), link.leagueStanding()));
                }
            }
            logger.info("{} season scraping completed", link.season());
            pauseBetweenSeasons(i, seasons.size());
        }

        persist(dataDir.resolve("composed.json"), tournament, composed);
        persist(dataDir.resolve("repaired.json"), tournament, repaired);
        persist(dataDir.resolve("erroneous.json"), tournament, erroneous);

        if (composed.isEmpty()) {
            logger.warn("No season of {} was scraped cleanly", tournament);
        } else {
            logger.info("{} seasons of {} composed", composed.size(), tournament);
        }
        if (!repaired.isEmpty()) {
            logger.info("{} season(s) of {} were repaired after a scraping error", repaired.size(), tournament);
        }
        if (erroneous.isEmpty()) {
            logger.info("There was no erroneous season in {}", tournament);
        } else {
            logger.warn("{} season(s) of {} remained erroneous", erroneous.size(), tournament);
        }
        logger.info("{} scraping completed.", tournament);
        return new TournamentOutcome(composed, repaired, erroneous);
    }

    /**
     * @return The first clean rescrape, or empty when every attempt failed
     */
    private Optional<ScrapeOutcome> rescrape(SeasonLink link, Path seasonDir) throws InterruptedException {
        int max = config.maxRescrapeCount();
        for (int attempt = 1; attempt <= max; attempt++) {
            logger.info("[{}/{}] Retrying {} season...", attempt, max, link.season());
            ScrapeOutcome retried;
            try {
                retried = seasonScraper.scrapeSeason(link.url(), seasonDir.resolve("retries"),
                    String.valueOf(clock.getAsLong()));
            } catch (ReconnectionTimeoutException e) {
                logger.error("Rescrape of {} aborted: {}", link.season(), e.getMessage());
                return Optional.empty();
            }
            if (!retried.hasErrorOccurred()) {
                logger.info("Error seemingly resolved after {} {}", attempt, attempt > 1 ? "retries" : "retry");
                return Optional.of(retried);
            }
        }
        return Optional.empty();
    }

    private void pauseBetweenSeasons(int index, int total) throws InterruptedException {
        if (index < total - 1) {
            logger.info("Taking {}s delay before processing next season...", config.seasonDelayMs() / 1000);
            Utils.politePause(sleeper, config.seasonDelayMs(), 0);
        }
    }

    private void persist(Path file, String tournament, List<SeasonResult> bucket) {
        if (bucket.isEmpty()) return;
        try {
            storage.writeJson(file, new TournamentResult(tournament, bucket));
            logger.info("Results saved to {}", file);
        } catch (IOException e) {
            logger.error("Failed to write {}: {}", file, e.getMessage());
        }
    }
}
