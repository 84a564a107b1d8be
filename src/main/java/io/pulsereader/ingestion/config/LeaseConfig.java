package io.pulsereader.ingestion.config;

import java.time.Duration;

public record LeaseConfig(
        boolean enabled,
        String key,
        Duration ttl
) {
    public LeaseConfig {
        key = key == null || key.isBlank() ? "ingestion:run-lease" : key;
        ttl = ttl != null ? ttl : Duration.ofMinutes(10);
    }
}
