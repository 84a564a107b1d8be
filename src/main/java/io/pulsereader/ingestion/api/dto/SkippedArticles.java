package io.pulsereader.ingestion.api.dto;

import java.util.UUID;

public record SkippedArticles(
        UUID sourceId,
        String sourceName,
        int skippedCount
) {}
