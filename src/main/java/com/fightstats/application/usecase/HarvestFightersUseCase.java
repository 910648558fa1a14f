package com.fightstats.application.usecase;

import com.fightstats.application.harvest.BoundedTaskRunner;
import com.fightstats.application.harvest.HarvestContext;
import com.fightstats.domain.model.DatasetCounts;
import com.fightstats.domain.model.FighterProfile;
import com.fightstats.domain.model.HarvestSummary;
import com.fightstats.domain.model.PersistedIds;
import com.fightstats.domain.ports.Dataset;
import com.fightstats.domain.ports.DocumentFetcher;
import com.fightstats.infrastructure.scraper.ufcstats.FighterDetailParser;
import com.fightstats.infrastructure.scraper.ufcstats.FighterListParser;
import com.fightstats.infrastructure.scraper.ufcstats.UfcStatsUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Harvests fighter profiles into the fighters dataset.
 * <p>
 * The fighters listing is partitioned by the first letter of the surname; every letter
 * is listed in full, ids already in the dataset are dropped, and only the remaining
 * fighter pages are fetched.
 */
@Service
public class HarvestFightersUseCase {

    private static final Logger logger = LoggerFactory.getLogger(HarvestFightersUseCase.class);

    private final DocumentFetcher fetcher;
    private final UfcStatsUrls urls;
    private final BoundedTaskRunner enumerationRunner;
    private final BoundedTaskRunner detailRunner;
    private final Dataset<FighterProfile> fighters;
    private final String alphabet;

    private final FighterListParser listParser = new FighterListParser();
    private final FighterDetailParser detailParser;

    public HarvestFightersUseCase(HarvestContext context,
                                  Dataset<FighterProfile> fighters,
                                  @Value("${harvest.alphabet:abcdefghijklmnopqrstuvwxyz}") String alphabet,
                                  Clock clock) {
        this.fetcher = context.fetcher();
        this.urls = context.urls();
        this.enumerationRunner = new BoundedTaskRunner(context.enumerationWorkers());
        this.detailRunner = new BoundedTaskRunner(context.workers());
        this.fighters = fighters;
        this.alphabet = alphabet;
        this.detailParser = new FighterDetailParser(clock);
    }

    public HarvestSummary execute() {
        logger.info("Starting fighter harvest");

        // Enumerate every letter of the partition
        List<Character> letters = alphabet.chars()
            .mapToObj(c -> (char) c)
            .distinct()
            .toList();
        List<String> listed = enumerationRunner.runAll(
            "Fighter listings",
            letters,
            Object::toString,
            letter -> new ArrayList<>(listParser.parse(fetcher.fetch(urls.fighterListing(letter))))
        );
        TreeSet<String> fighterIds = new TreeSet<>(listed);
        logger.info("Found {} fighters across {} letters", fighterIds.size(), letters.size());

        // Filter
        PersistedIds known = fighters.loadIds();
        List<String> pending = fighterIds.stream()
            .filter(id -> !known.alreadyHas(id))
            .toList();
        logger.info("Fighters: {} already harvested, {} to fetch", fighterIds.size() - pending.size(), pending.size());

        // Dispatch and collect
        List<FighterProfile> profiles = detailRunner.runAll(
            "Fighter pages",
            pending,
            id -> id,
            id -> {
                Optional<FighterProfile> profile = detailParser.parse(fetcher.fetch(urls.fighterDetails(id)), id);
                if (profile.isEmpty()) {
                    logger.warn("No fighter profile found on page for {}", id);
                }
                return profile.map(List::of).orElse(List.of());
            }
        );

        // Persist
        int written = fighters.append(profiles);
        logger.info("Fighters: {} new, {} already present", written, known.size());

        HarvestSummary summary = new HarvestSummary("fighters",
            List.of(new DatasetCounts(fighters.name(), written, known.size())));
        logger.info("Fighter harvest finished: {} new rows", summary.totalWritten());
        return summary;
    }
}
