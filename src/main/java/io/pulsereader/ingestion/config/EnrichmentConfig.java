package io.pulsereader.ingestion.config;

import java.time.Duration;

public record EnrichmentConfig(
        String apiKey,
        String baseUrl,
        String model,
        double temperature,
        int maxTokens,
        Duration timeout,
        int batchSize,
        int maxTopics,
        int maxTopicLength,
        int maxInputLength,
        String referer,
        String appTitle
) {
    public EnrichmentConfig {
        apiKey = apiKey == null ? "" : apiKey.trim();
        timeout = timeout != null ? timeout : Duration.ofSeconds(10);
        if (batchSize < 1) {
            batchSize = 1;
        }
    }

    public boolean hasApiKey() {
        return !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "EnrichmentConfig[baseUrl=" + baseUrl + ", model=" + model
                + ", apiKey=" + (hasApiKey() ? "<set>" : "<none>") + "]";
    }
}
