package com.fightstats.infrastructure.cli;

import com.fightstats.application.usecase.HarvestContestsUseCase;
import com.fightstats.application.usecase.HarvestFightersUseCase;
import com.fightstats.domain.model.DatasetCounts;
import com.fightstats.domain.model.HarvestSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Runs the configured harvests in order and logs per-dataset counts.
 * <p>
 * {@code harvest.phases} is a comma-separated list of {@code fighters} and
 * {@code contests}; e.g. {@code --harvest.phases=contests} skips the fighter pages.
 */
@Component
public class HarvestCommandLineRunner implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(HarvestCommandLineRunner.class);

    private final HarvestFightersUseCase harvestFighters;
    private final HarvestContestsUseCase harvestContests;
    private final List<String> phases;

    public HarvestCommandLineRunner(HarvestFightersUseCase harvestFighters,
                                    HarvestContestsUseCase harvestContests,
                                    @Value("${harvest.phases:fighters,contests}") String phases) {
        this.harvestFighters = harvestFighters;
        this.harvestContests = harvestContests;
        this.phases = Arrays.stream(phases.split(","))
            .map(phase -> phase.trim().toLowerCase(Locale.ROOT))
            .filter(phase -> !phase.isEmpty())
            .toList();
    }

    @Override
    public void run(String... args) {
        List<HarvestSummary> summaries = new ArrayList<>();
        for (String phase : phases) {
            switch (phase) {
                case "fighters" -> summaries.add(harvestFighters.execute());
                case "contests" -> summaries.add(harvestContests.execute());
                default -> logger.warn("Unknown harvest phase '{}', expected 'fighters' or 'contests'", phase);
            }
        }

        logger.info("==== Harvest summary ====");
        for (HarvestSummary summary : summaries) {
            for (DatasetCounts counts : summary.datasets()) {
                logger.info("{}: {} written, {} already present", counts.dataset(), counts.written(), counts.alreadyPresent());
            }
        }
    }
}
