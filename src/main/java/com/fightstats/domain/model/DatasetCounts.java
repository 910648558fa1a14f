package com.fightstats.domain.model;

/**
 * Rows appended by a run versus ids the dataset already held when the run started.
 */
public record DatasetCounts(String dataset, int written, int alreadyPresent) {
}
