package com.fightstats.domain.exception;

/**
 * Reading or appending to a dataset failed. Aborts the run: rows already appended stay valid.
 */
public class DatasetException extends RuntimeException {

    public DatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
