package com.fightstats.application.harvest;

import com.fightstats.domain.exception.FetchException;

import java.util.List;

/**
 * One unit of fetch-and-parse work. Returns the records found for a single candidate.
 */
@FunctionalInterface
public interface HarvestTask<T, R> {

    List<R> run(T candidate) throws FetchException;
}
