package com.fightstats.infrastructure.scraper;

import com.fightstats.domain.exception.FetchException;
import com.fightstats.domain.exception.TransientFetchException;
import com.sun.net.httpserver.HttpServer;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HttpDocumentFetcher against a local HTTP server.
 */
class HttpDocumentFetcherTest {

    private static final String PAGE = "<html><body><span class=\"name\">Danny Abbadi</span></body></html>";

    private HttpServer server;
    private CloseableHttpClient httpClient;
    private final AtomicInteger hits = new AtomicInteger();
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private final List<String> userAgents = new CopyOnWriteArrayList<>();

    // Number of 429 responses before the page is served; -1 means always 429
    private volatile int rateLimitedResponses;
    private volatile int failureStatus;

    private HttpDocumentFetcher fetcher;
    private String url;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/fighter-details/15df64c02b6b0fde", exchange -> {
            int hit = hits.incrementAndGet();
            userAgents.add(exchange.getRequestHeaders().getFirst("User-Agent"));
            int status;
            byte[] body;
            if (failureStatus != 0) {
                status = failureStatus;
                body = "boom".getBytes(StandardCharsets.UTF_8);
            } else if (rateLimitedResponses < 0 || hit <= rateLimitedResponses) {
                status = 429;
                body = "slow down".getBytes(StandardCharsets.UTF_8);
            } else {
                status = 200;
                body = PAGE.getBytes(StandardCharsets.UTF_8);
            }
            exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
            exchange.sendResponseHeaders(status, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();

        url = "http://127.0.0.1:" + server.getAddress().getPort() + "/fighter-details/15df64c02b6b0fde";
        httpClient = HttpClients.custom().disableAutomaticRetries().build();
        fetcher = new HttpDocumentFetcher(httpClient, new RetryPolicy(5, Duration.ofSeconds(1)),
            sleeps::add, "test-agent/1.0");
    }

    @AfterEach
    void tearDown() throws IOException {
        httpClient.close();
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void testSuccessOnFirstAttempt() throws FetchException {
        Document document = fetcher.fetch(url);

        assertEquals("Danny Abbadi", document.selectFirst("span.name").text());
        assertEquals(url, document.location());
        assertEquals(1, hits.get());
        assertTrue(sleeps.isEmpty());
        assertEquals(List.of("test-agent/1.0"), userAgents);
    }

    @Test
    void testRateLimitedResponsesBackOffExponentially() throws FetchException {
        rateLimitedResponses = 4;

        Document document = fetcher.fetch(url);

        assertEquals("Danny Abbadi", document.selectFirst("span.name").text());
        assertEquals(5, hits.get());
        assertEquals(List.of(
            Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8)
        ), sleeps);
        assertEquals(Duration.ofSeconds(15), sleeps.stream().reduce(Duration.ZERO, Duration::plus));
    }

    @Test
    void testRateLimitedOnEveryAttemptFailsAfterFinalAttempt() {
        rateLimitedResponses = -1;

        FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch(url));

        assertFalse(e instanceof TransientFetchException);
        assertEquals(url, e.getUrl());
        // five retries plus the final attempt
        assertEquals(6, hits.get());
        assertEquals(List.of(
            Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4),
            Duration.ofSeconds(8), Duration.ofSeconds(16)
        ), sleeps);
    }

    @Test
    void testServerErrorIsNotRetried() {
        failureStatus = 500;

        FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch(url));

        assertTrue(e.getMessage().contains("500"));
        assertEquals(1, hits.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testNotFoundIsNotRetried() {
        failureStatus = 404;

        assertThrows(FetchException.class, () -> fetcher.fetch(url));
        assertEquals(1, hits.get());
    }

    @Test
    void testTransportErrorBecomesFetchException() {
        server.stop(0);
        server = null;

        FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch(url));

        assertFalse(e instanceof TransientFetchException);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testInterruptedBackoffStopsRetrying() {
        rateLimitedResponses = -1;
        HttpDocumentFetcher interrupted = new HttpDocumentFetcher(httpClient,
            new RetryPolicy(5, Duration.ofSeconds(1)),
            duration -> {
                throw new InterruptedException("stop");
            },
            null);

        try {
            assertThrows(FetchException.class, () -> interrupted.fetch(url));
            assertTrue(Thread.currentThread().isInterrupted());
            assertEquals(1, hits.get());
        } finally {
            // clear the flag for the next test
            Thread.interrupted();
        }
    }

    @Test
    void testRetryPolicyBackoffDoubles() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(1000));

        assertEquals(Duration.ofMillis(1000), policy.backoffFor(0));
        assertEquals(Duration.ofMillis(16000), policy.backoffFor(4));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, Duration.ZERO));
    }

    @Test
    void testRetryPolicyRejectsRetryCountsThatOverflowBackoff() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(63, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(RetryPolicy.MAX_RETRIES_LIMIT + 1, Duration.ofSeconds(1)));

        RetryPolicy widest = new RetryPolicy(RetryPolicy.MAX_RETRIES_LIMIT, Duration.ofMillis(1));
        assertTrue(widest.backoffFor(RetryPolicy.MAX_RETRIES_LIMIT - 1).compareTo(Duration.ZERO) > 0);
    }
}
