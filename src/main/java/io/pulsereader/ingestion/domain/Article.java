package io.pulsereader.ingestion.domain;

import java.time.Instant;
import java.util.UUID;

public record Article(
        UUID id,
        UUID sourceId,
        String title,
        String description,
        String link,
        Instant publishedAt,
        Sentiment sentiment,
        Instant createdAt,
        Instant updatedAt
) {}
