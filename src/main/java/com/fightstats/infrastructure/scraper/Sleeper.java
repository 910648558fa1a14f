package com.fightstats.infrastructure.scraper;

import java.time.Duration;

/**
 * Blocking pause between retries.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
