package io.pulsereader.ingestion.api.dto;

import java.util.UUID;

public record SourceError(
        UUID sourceId,
        String sourceName,
        String error
) {}
