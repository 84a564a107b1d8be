package io.pulsereader.ingestion.api.util;

import io.pulsereader.ingestion.config.IngestionConfig;
import org.springframework.stereotype.Component;

/**
 * Flat view of the schedule settings for the {@code @Scheduled} expressions.
 */
@Component
public class IngestionProps {
    private final long scheduleIntervalMs;
    private final long initialDelayMs;

    public IngestionProps(IngestionConfig config) {
        this.scheduleIntervalMs = config.processing().getScheduleIntervalMs();
        this.initialDelayMs = config.processing().getInitialDelayMs();
    }

    public long getScheduleIntervalMs() { return scheduleIntervalMs; }
    public long getInitialDelayMs() { return initialDelayMs; }
}
