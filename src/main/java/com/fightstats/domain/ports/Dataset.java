package com.fightstats.domain.ports;

import com.fightstats.domain.model.PersistedIds;

import java.util.List;

/**
 * Port for an append-only tabular dataset keyed by a primary id column.
 *
 * @param <T> record type stored as one row
 */
public interface Dataset<T> {

    /**
     * @return dataset name used in logs and summaries (e.g. "fights")
     */
    String name();

    /**
     * Reads the ids already persisted. A dataset that does not exist yet has none.
     */
    PersistedIds loadIds();

    /**
     * Appends rows, writing the header first when the dataset is created by this call.
     * Callers must filter out ids already present; this method does not deduplicate.
     *
     * @return number of rows written
     */
    int append(List<T> records);
}
