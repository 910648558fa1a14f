package com.fightstats.domain.exception;

/**
 * A page could not be retrieved: non-success status, transport error, or rate limiting
 * that outlasted the retry bound.
 */
public class FetchException extends Exception {

    private final String url;

    public FetchException(String url, String message) {
        super(message);
        this.url = url;
    }

    public FetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
