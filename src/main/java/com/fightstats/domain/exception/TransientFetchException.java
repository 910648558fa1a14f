package com.fightstats.domain.exception;

/**
 * The source answered 429 Too Many Requests. Retried by the fetcher with backoff.
 */
public class TransientFetchException extends FetchException {

    public TransientFetchException(String url) {
        super(url, "Rate limited fetching " + url);
    }
}
