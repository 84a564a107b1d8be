package io.pulsereader.ingestion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ingestion")
public record IngestionConfig(
        BudgetConfig budget,
        ProcessingConfig processing,
        HttpConfig http,
        EnrichmentConfig enrichment,
        SecurityConfig security,
        LeaseConfig lease,
        EventsConfig events
) {

    public boolean isEnrichmentEnabled() {
        return enrichment != null && enrichment.hasApiKey();
    }

    public boolean isEventsEnabled() {
        return events != null && events.enabled();
    }
}
