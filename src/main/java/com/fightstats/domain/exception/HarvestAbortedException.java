package com.fightstats.domain.exception;

/**
 * The harvesting thread was interrupted while waiting on workers.
 */
public class HarvestAbortedException extends RuntimeException {

    public HarvestAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
