package com.fightstats.application.usecase;

import com.fightstats.application.harvest.BoundedTaskRunner;
import com.fightstats.application.harvest.HarvestContext;
import com.fightstats.domain.exception.FetchException;
import com.fightstats.domain.model.Contest;
import com.fightstats.domain.model.ContestParticipantResult;
import com.fightstats.domain.model.ContestResult;
import com.fightstats.domain.model.DatasetCounts;
import com.fightstats.domain.model.Event;
import com.fightstats.domain.model.HarvestSummary;
import com.fightstats.domain.model.PersistedIds;
import com.fightstats.domain.ports.Dataset;
import com.fightstats.domain.ports.DocumentFetcher;
import com.fightstats.infrastructure.scraper.ufcstats.ContestDetailParser;
import com.fightstats.infrastructure.scraper.ufcstats.EventDetailParser;
import com.fightstats.infrastructure.scraper.ufcstats.EventListParser;
import com.fightstats.infrastructure.scraper.ufcstats.UfcStatsUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Harvests completed events into the fights and fight-stats datasets.
 * <p>
 * Phase 1 reads the full events listing, skips events already recorded, fetches the
 * remaining event pages and appends their bouts. An event is recorded only after its
 * bouts are written, so an interrupted run fetches it again.
 * <p>
 * Phase 2 takes every bout in the fights dataset that has no rows in the fight-stats
 * dataset yet and fetches its fight page. The two phases fail independently: a bout
 * whose fight page cannot be read stays in the fights dataset.
 */
@Service
public class HarvestContestsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(HarvestContestsUseCase.class);

    private final DocumentFetcher fetcher;
    private final UfcStatsUrls urls;
    private final BoundedTaskRunner detailRunner;
    private final Dataset<Event> events;
    private final Dataset<Contest> contests;
    private final Dataset<ContestParticipantResult> participantResults;

    private final EventListParser eventListParser = new EventListParser();
    private final EventDetailParser eventDetailParser = new EventDetailParser();
    private final ContestDetailParser contestDetailParser = new ContestDetailParser();

    private record EventHarvest(Event event, List<Contest> contests) {}

    public HarvestContestsUseCase(HarvestContext context,
                                  Dataset<Event> events,
                                  Dataset<Contest> contests,
                                  Dataset<ContestParticipantResult> participantResults) {
        this.fetcher = context.fetcher();
        this.urls = context.urls();
        this.detailRunner = new BoundedTaskRunner(context.workers());
        this.events = events;
        this.contests = contests;
        this.participantResults = participantResults;
    }

    public HarvestSummary execute() {
        logger.info("Starting contest harvest");

        List<DatasetCounts> counts = new ArrayList<>(harvestEventsAndContests());
        counts.add(harvestParticipantResults());

        HarvestSummary summary = new HarvestSummary("contests", counts);
        logger.info("Contest harvest finished: {} new rows", summary.totalWritten());
        return summary;
    }

    private List<DatasetCounts> harvestEventsAndContests() {
        // Enumerate
        List<Event> listed = enumerateEvents();

        // Filter before the expensive per-event fetch
        PersistedIds knownEvents = events.loadIds();
        Map<String, Event> unique = new LinkedHashMap<>();
        for (Event event : listed) {
            if (!knownEvents.alreadyHas(event.id())) {
                unique.putIfAbsent(event.id(), event);
            }
        }
        List<Event> pending = new ArrayList<>(unique.values());
        logger.info("Events: {} listed, {} already harvested, {} to fetch",
            listed.size(), listed.size() - pending.size(), pending.size());

        // Dispatch and collect
        List<EventHarvest> harvested = detailRunner.runAll(
            "Event pages",
            pending,
            Event::sourceUrl,
            event -> List.of(new EventHarvest(event, eventDetailParser.parse(fetcher.fetch(event.sourceUrl()), event)))
        );

        // Filter bouts against the dataset and within this run
        PersistedIds knownContests = contests.loadIds();
        Map<String, Contest> newContests = new LinkedHashMap<>();
        for (EventHarvest harvest : harvested) {
            for (Contest contest : harvest.contests()) {
                if (!knownContests.alreadyHas(contest.id())) {
                    newContests.putIfAbsent(contest.id(), contest);
                }
            }
        }

        // Persist bouts first, then mark their events done
        int contestsWritten = contests.append(new ArrayList<>(newContests.values()));
        int eventsWritten = events.append(harvested.stream().map(EventHarvest::event).toList());
        logger.info("Fights: {} new, {} already present", contestsWritten, knownContests.size());

        return List.of(
            new DatasetCounts(events.name(), eventsWritten, knownEvents.size()),
            new DatasetCounts(contests.name(), contestsWritten, knownContests.size())
        );
    }

    private List<Event> enumerateEvents() {
        try {
            List<Event> listed = eventListParser.parse(fetcher.fetch(urls.completedEvents()));
            logger.info("Found {} completed events", listed.size());
            return listed;
        } catch (FetchException e) {
            logger.error("Could not fetch the events listing, skipping event pages: {}", e.getMessage());
            return List.of();
        }
    }

    private DatasetCounts harvestParticipantResults() {
        PersistedIds allContests = contests.loadIds();
        PersistedIds done = participantResults.loadIds();
        List<String> pending = allContests.asSet().stream()
            .filter(id -> !done.alreadyHas(id))
            .sorted()
            .toList();
        logger.info("Fight stats: {} fights known, {} already done, {} to fetch",
            allContests.size(), done.size(), pending.size());

        List<ContestParticipantResult> rows = detailRunner.runAll(
            "Fight pages",
            pending,
            id -> id,
            id -> contestDetailParser.parse(fetcher.fetch(urls.contestDetails(id)), id)
                .map(ContestResult::rows)
                .orElseGet(() -> {
                    logger.warn("No usable fighter totals for fight {}", id);
                    return List.of();
                })
        );

        int written = participantResults.append(rows);
        logger.info("Fight stats: {} new rows for {} fights", written, written / 2);
        return new DatasetCounts(participantResults.name(), written, done.size());
    }
}
