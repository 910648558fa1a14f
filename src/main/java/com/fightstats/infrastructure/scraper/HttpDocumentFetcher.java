package com.fightstats.infrastructure.scraper;

import com.fightstats.domain.exception.FetchException;
import com.fightstats.domain.exception.TransientFetchException;
import com.fightstats.domain.ports.DocumentFetcher;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Fetches HTML pages over a shared, pooled HttpClient and parses them with jsoup.
 * <p>
 * A 429 response is retried {@link RetryPolicy#maxRetries()} times with exponential
 * backoff, then attempted once more; a 429 on that last attempt is fatal for the URL.
 * Any other non-2xx status or I/O error fails immediately.
 */
public class HttpDocumentFetcher implements DocumentFetcher {

    private static final Logger logger = LoggerFactory.getLogger(HttpDocumentFetcher.class);
    private static final int MAX_LOG_BODY_LENGTH = 500;

    private final CloseableHttpClient httpClient;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final String userAgent;

    public HttpDocumentFetcher(CloseableHttpClient httpClient, RetryPolicy retryPolicy, Sleeper sleeper, String userAgent) {
        this.httpClient = httpClient;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.userAgent = userAgent;
    }

    @Override
    public Document fetch(String url) throws FetchException {
        for (int attempt = 0; attempt < retryPolicy.maxRetries(); attempt++) {
            try {
                return attempt(url);
            } catch (TransientFetchException e) {
                Duration wait = retryPolicy.backoffFor(attempt);
                logger.debug("Rate limited on {} (attempt {}), backing off {} ms", url, attempt + 1, wait.toMillis());
                pause(url, wait);
            }
        }

        try {
            return attempt(url);
        } catch (TransientFetchException e) {
            throw new FetchException(url, "Still rate limited after " + retryPolicy.maxRetries() + " retries: " + url, e);
        }
    }

    private Document attempt(String url) throws FetchException {
        HttpGet request = new HttpGet(url);
        if (userAgent != null && !userAgent.isBlank()) {
            request.setHeader("User-Agent", userAgent);
        }
        request.setHeader("Accept", "text/html,application/xhtml+xml");

        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int statusCode = response.getCode();
            HttpEntity entity = response.getEntity();

            if (statusCode == HttpStatus.SC_TOO_MANY_REQUESTS) {
                EntityUtils.consume(entity);
                throw new TransientFetchException(url);
            }

            String body = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
            if (statusCode < 200 || statusCode >= 300) {
                logger.debug("HTTP {} from {}: {}", statusCode, url, preview(body));
                throw new FetchException(url, "HTTP request failed with status " + statusCode + ": " + url);
            }
            return Jsoup.parse(body, url);
        } catch (IOException e) {
            throw new FetchException(url, "Transport error fetching " + url + ": " + e.getMessage(), e);
        } catch (ParseException e) {
            throw new FetchException(url, "Failed to read response body from " + url, e);
        }
    }

    private void pause(String url, Duration wait) throws FetchException {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, "Interrupted while backing off on " + url, e);
        }
    }

    private static String preview(String body) {
        return body.length() > MAX_LOG_BODY_LENGTH
            ? body.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : body;
    }
}
