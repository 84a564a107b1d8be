package io.pulsereader.ingestion;

import io.pulsereader.ingestion.config.BudgetConfig;
import io.pulsereader.ingestion.config.EnrichmentConfig;
import io.pulsereader.ingestion.config.EventsConfig;
import io.pulsereader.ingestion.config.HttpConfig;
import io.pulsereader.ingestion.config.IngestionConfig;
import io.pulsereader.ingestion.config.LeaseConfig;
import io.pulsereader.ingestion.config.ProcessingConfig;
import io.pulsereader.ingestion.config.SecurityConfig;

import java.time.Duration;
import java.util.List;

public final class TestConfigs {

    public static final String SERVICE_TOKEN = "test-service-token";

    private TestConfigs() {
    }

    public static IngestionConfig config(int ceiling, int finalizeReserve, int maxSources, int batchSize, String apiKey) {
        return new IngestionConfig(
                new BudgetConfig(ceiling, finalizeReserve),
                processing(maxSources, batchSize),
                http(),
                enrichment(apiKey, "http://localhost:1"),
                new SecurityConfig(SERVICE_TOKEN),
                new LeaseConfig(false, null, null),
                new EventsConfig(false)
        );
    }

    public static IngestionConfig defaults() {
        return config(45, 1, 10, 20, "");
    }

    public static IngestionConfig withEnrichment(String apiKey, String baseUrl) {
        return new IngestionConfig(
                new BudgetConfig(45, 1),
                processing(10, 20),
                http(),
                enrichment(apiKey, baseUrl),
                new SecurityConfig(SERVICE_TOKEN),
                new LeaseConfig(false, null, null),
                new EventsConfig(false)
        );
    }

    public static ProcessingConfig processing(int maxSources, int batchSize) {
        return new ProcessingConfig(maxSources, batchSize, Duration.ZERO, Duration.ZERO,
                Duration.ofMinutes(15), Duration.ofSeconds(30), false);
    }

    public static HttpConfig http() {
        return new HttpConfig(2000, 2000, List.of("TestAgent/1.0"), 5000);
    }

    public static EnrichmentConfig enrichment(String apiKey, String baseUrl) {
        return new EnrichmentConfig(apiKey, baseUrl, "test/model", 0.1, 200, Duration.ofSeconds(2),
                10, 5, 50, 1500, "https://pulsereader.test", "PulseReader Test");
    }
}
