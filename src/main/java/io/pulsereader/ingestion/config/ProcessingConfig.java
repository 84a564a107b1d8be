package io.pulsereader.ingestion.config;

import java.time.Duration;

public record ProcessingConfig(
        int maxSourcesPerRun,
        int batchSize,
        Duration sourceDelay,
        Duration fallbackDelay,
        Duration scheduleInterval,
        Duration initialDelay,
        boolean enableScheduling
) {
    public ProcessingConfig {
        if (maxSourcesPerRun < 1) {
            throw new IllegalArgumentException("maxSourcesPerRun must be positive: " + maxSourcesPerRun);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        sourceDelay = sourceDelay != null ? sourceDelay : Duration.ZERO;
        fallbackDelay = fallbackDelay != null ? fallbackDelay : Duration.ZERO;
        scheduleInterval = scheduleInterval != null ? scheduleInterval : Duration.ofMinutes(15);
        initialDelay = initialDelay != null ? initialDelay : Duration.ofSeconds(30);
    }

    public long getScheduleIntervalMs() {
        return scheduleInterval.toMillis();
    }

    public long getInitialDelayMs() {
        return initialDelay.toMillis();
    }
}
