package io.pulsereader.ingestion.domain;

import java.time.Instant;

/**
 * A normalized entry of a fetched feed. {@code link} is already canonical and
 * is the deduplication key once persisted.
 */
public record FeedItem(
        String title,
        String description,
        String link,
        Instant publishedAt
) {}
