package io.pulsereader.ingestion.domain;

import java.time.Instant;
import java.util.UUID;

public record Source(
        UUID id,
        String name,
        String url,
        boolean active,
        Instant lastFetchedAt,
        String lastFetchError
) {
    public boolean neverFetched() {
        return lastFetchedAt == null;
    }
}
