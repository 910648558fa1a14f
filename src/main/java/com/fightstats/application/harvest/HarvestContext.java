package com.fightstats.application.harvest;

import com.fightstats.domain.ports.DocumentFetcher;
import com.fightstats.infrastructure.scraper.ufcstats.UfcStatsUrls;

/**
 * Everything a harvest run shares: the fetcher (which owns the pooled HTTP client and
 * retry policy), the source URL layout, and the pool sizes.
 *
 * @param workers            threads for per-item detail pages
 * @param enumerationWorkers threads for listing pages
 */
public record HarvestContext(DocumentFetcher fetcher, UfcStatsUrls urls, int workers, int enumerationWorkers) {

    public HarvestContext {
        if (workers < 1 || enumerationWorkers < 1) {
            throw new IllegalArgumentException("Worker pool sizes must be >= 1");
        }
    }
}
