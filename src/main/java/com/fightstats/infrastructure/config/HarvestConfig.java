package com.fightstats.infrastructure.config;

import com.fightstats.application.harvest.HarvestContext;
import com.fightstats.domain.model.Contest;
import com.fightstats.domain.model.ContestParticipantResult;
import com.fightstats.domain.model.Event;
import com.fightstats.domain.model.FighterProfile;
import com.fightstats.domain.ports.Dataset;
import com.fightstats.domain.ports.DocumentFetcher;
import com.fightstats.infrastructure.persistence.CsvDataset;
import com.fightstats.infrastructure.scraper.HttpDocumentFetcher;
import com.fightstats.infrastructure.scraper.RetryPolicy;
import com.fightstats.infrastructure.scraper.Sleeper;
import com.fightstats.infrastructure.scraper.ufcstats.UfcStatsUrls;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;

/**
 * Harvest wiring: shared HTTP client, fetcher, run context and the CSV datasets.
 */
@Configuration
public class HarvestConfig {

    private static final Logger logger = LoggerFactory.getLogger(HarvestConfig.class);
    private static final String TODAY = "today";

    @Value("${harvest.base-url:http://ufcstats.com}")
    private String baseUrl;

    @Value("${harvest.output-dir:data}")
    private String outputDir;

    // "today" = ISO date of the run, blank = write straight into output-dir
    @Value("${harvest.partition:today}")
    private String partition;

    @Value("${harvest.workers:10}")
    private int workers;

    @Value("${harvest.enumeration-workers:10}")
    private int enumerationWorkers;

    @Value("${harvest.max-retries:5}")
    private int maxRetries;

    @Value("${harvest.base-backoff-ms:1000}")
    private long baseBackoffMs;

    @Value("${harvest.request-timeout-seconds:30}")
    private int requestTimeoutSeconds;

    @Value("${harvest.user-agent:Mozilla/5.0 (compatible; UFC-Stats-Scraper/1.0)}")
    private String userAgent;

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(destroyMethod = "close")
    public CloseableHttpClient httpClient() {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
            .setConnectTimeout(Timeout.ofSeconds(requestTimeoutSeconds))
            .setSocketTimeout(Timeout.ofSeconds(requestTimeoutSeconds))
            .build();
        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(connectionConfig)
            .setMaxConnTotal(Math.max(workers, enumerationWorkers) * 2)
            .setMaxConnPerRoute(Math.max(workers, enumerationWorkers))
            .build();
        RequestConfig requestConfig = RequestConfig.custom()
            .setResponseTimeout(Timeout.ofSeconds(requestTimeoutSeconds))
            .build();
        return HttpClients.custom()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(requestConfig)
            // 429 backoff is handled by HttpDocumentFetcher
            .disableAutomaticRetries()
            .build();
    }

    @Bean
    public DocumentFetcher documentFetcher(CloseableHttpClient httpClient) {
        RetryPolicy retryPolicy = new RetryPolicy(maxRetries, Duration.ofMillis(baseBackoffMs));
        return new HttpDocumentFetcher(httpClient, retryPolicy, Sleeper.THREAD, userAgent);
    }

    @Bean
    public HarvestContext harvestContext(DocumentFetcher documentFetcher) {
        return new HarvestContext(documentFetcher, new UfcStatsUrls(baseUrl), workers, enumerationWorkers);
    }

    @Bean
    public Path datasetDirectory(Clock clock) {
        Path base = Paths.get(outputDir);
        String resolved = partition == null ? "" : partition.trim();
        if (resolved.equalsIgnoreCase(TODAY)) {
            resolved = LocalDate.now(clock).toString();
        }
        Path directory = resolved.isEmpty() ? base : base.resolve(resolved);
        logger.info("Datasets will be written under {}", directory.toAbsolutePath());
        return directory;
    }

    @Bean
    public Dataset<Event> eventsDataset(Path datasetDirectory) {
        return new CsvDataset<>("events", datasetDirectory.resolve("events.csv"), Event.class, "event_id");
    }

    @Bean
    public Dataset<Contest> contestsDataset(Path datasetDirectory) {
        return new CsvDataset<>("fights", datasetDirectory.resolve("fights.csv"), Contest.class, "contest_id");
    }

    @Bean
    public Dataset<ContestParticipantResult> participantResultsDataset(Path datasetDirectory) {
        return new CsvDataset<>("fight_stats", datasetDirectory.resolve("fight_stats.csv"),
            ContestParticipantResult.class, "contest_id");
    }

    @Bean
    public Dataset<FighterProfile> fightersDataset(Path datasetDirectory) {
        return new CsvDataset<>("fighters", datasetDirectory.resolve("fighters.csv"), FighterProfile.class, "id");
    }
}
