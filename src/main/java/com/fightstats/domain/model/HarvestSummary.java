package com.fightstats.domain.model;

import java.util.List;

/**
 * Per-dataset outcome of one harvest use case.
 */
public record HarvestSummary(String harvest, List<DatasetCounts> datasets) {

    public HarvestSummary {
        datasets = List.copyOf(datasets);
    }

    public int totalWritten() {
        return datasets.stream().mapToInt(DatasetCounts::written).sum();
    }
}
